/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.stompy.client;

import io.stompy.frame.Command;
import io.stompy.frame.Frame;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking STOMP 1.2 client.
 *
 * <p>Iterating over a client receives frames until the broker closes the connection.
 */
public interface StompClient extends Iterable<Frame>, AutoCloseable {

    default Frame connect(BrokerAddress address) {
        return connect(List.of(address), Optional.empty(), Optional.empty(), Map.of(), Optional.empty());
    }

    default Frame connect(List<BrokerAddress> addresses, String login, String passcode) {
        return connect(
                addresses, Optional.ofNullable(login), Optional.ofNullable(passcode), Map.of(), Optional.empty());
    }

    /**
     * Tries each address in order and completes the STOMP handshake with the first broker that
     * answers CONNECTED.
     *
     * @param addresses brokers to try, in order
     * @param login login header value
     * @param passcode passcode header value
     * @param headers extra CONNECT headers
     * @param timeout bound on TCP connect and handshake per address
     * @return the CONNECTED frame
     */
    Frame connect(
            List<BrokerAddress> addresses,
            Optional<String> login,
            Optional<String> passcode,
            Map<String, String> headers,
            Optional<Duration> timeout);

    ConnectionState state();

    Optional<BrokerAddress> brokerAddress();

    default String subscribe(String destination) {
        return subscribe(destination, AckMode.AUTO, true);
    }

    default String subscribe(String destination, AckMode ackMode) {
        return subscribe(destination, ackMode, true);
    }

    /**
     * Subscribes to a destination.
     *
     * @param destination the destination
     * @param ackMode the ack mode requested from the broker
     * @param autoAck whether the client acknowledges messages on the caller's behalf
     * @return the generated subscription id
     */
    String subscribe(String destination, AckMode ackMode, boolean autoAck);

    Optional<Subscription> subscription(String id);

    /**
     * Removes a subscription; unknown ids are ignored.
     *
     * @param id the subscription id
     * @return the UNSUBSCRIBE receipt, or empty if the id was unknown
     */
    Optional<ReceiptFuture> unsubscribe(String id);

    default Optional<ReceiptFuture> send(Command command, Map<String, String> headers) {
        return send(command, headers, new byte[0], Optional.empty(), Receipt.none());
    }

    default Optional<ReceiptFuture> send(Command command, Map<String, String> headers, Receipt receipt) {
        return send(command, headers, new byte[0], Optional.empty(), receipt);
    }

    /**
     * Writes an arbitrary frame.
     *
     * @param command the command
     * @param headers headers, written in iteration order
     * @param body the body
     * @param transaction transaction id appended as the {@code transaction} header
     * @param receipt whether to append a {@code receipt} header
     * @return the receipt future if a receipt was requested
     */
    Optional<ReceiptFuture> send(
            Command command,
            Map<String, String> headers,
            byte[] body,
            Optional<String> transaction,
            Receipt receipt);

    default Optional<ReceiptFuture> message(String destination, String body) {
        return message(destination, body, Receipt.none());
    }

    default Optional<ReceiptFuture> message(String destination, String body, Receipt receipt) {
        return message(destination, body.getBytes(StandardCharsets.UTF_8), Map.of(), receipt);
    }

    default Optional<ReceiptFuture> message(
            String destination, byte[] body, Map<String, String> headers, Receipt receipt) {
        return message(destination, body, Optional.empty(), headers, receipt, Optional.empty());
    }

    /**
     * Sends a SEND frame to a destination.
     *
     * @param destination the destination
     * @param body the body
     * @param messageId optional {@code message-id} header
     * @param headers extra headers, written after {@code destination}
     * @param receipt whether to request a receipt
     * @param transaction optional transaction id
     * @return the receipt future if a receipt was requested
     */
    Optional<ReceiptFuture> message(
            String destination,
            byte[] body,
            Optional<String> messageId,
            Map<String, String> headers,
            Receipt receipt,
            Optional<String> transaction);

    default void ack(String ackId) {
        ack(ackId, Optional.empty());
    }

    void ack(String ackId, Optional<String> transaction);

    default void nack(String ackId) {
        nack(ackId, Optional.empty());
    }

    void nack(String ackId, Optional<String> transaction);

    default Transaction transaction() {
        return transaction(Optional.empty());
    }

    /**
     * Begins a transaction; the BEGIN frame requests a receipt.
     *
     * @param transactionId the id to use, generated when empty
     * @return the transaction handle
     */
    Transaction transaction(Optional<String> transactionId);

    default Optional<Frame> recv() {
        return recv(Optional.empty(), Optional.empty());
    }

    default Optional<Frame> recv(Duration timeout) {
        return recv(Optional.empty(), Optional.of(timeout));
    }

    /**
     * Returns the next application-visible frame. RECEIPT frames are consumed internally, ERROR
     * frames raise {@link io.stompy.exception.StompProtocolException}.
     *
     * @param transaction transaction id attached to automatic ACKs
     * @param timeout overall deadline, empty to wait indefinitely
     * @return the frame, or empty once the broker closed the connection
     */
    Optional<Frame> recv(Optional<String> transaction, Optional<Duration> timeout);

    default Optional<Frame> loop() {
        return loop(Optional.empty(), Optional.empty());
    }

    /**
     * Receives frames and hands each one to the registered callbacks in order until a callback
     * returns {@link DispatchResult#STOP} or the connection closes. Callbacks after the one that
     * stopped do not see that frame.
     *
     * @param transaction transaction id attached to automatic ACKs
     * @param timeout deadline for each receive
     * @return the frame the loop stopped on, or empty if the connection closed
     */
    Optional<Frame> loop(Optional<String> transaction, Optional<Duration> timeout);

    void addCallback(FrameListener listener);

    void removeCallback(FrameListener listener);

    void removeAllCallbacks();

    /**
     * Sends DISCONNECT, waits for its receipt, then closes the connection. Does nothing unless
     * connected.
     */
    void disconnect();

    @Override
    void close();
}
