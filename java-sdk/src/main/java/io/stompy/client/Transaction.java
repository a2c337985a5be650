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

import io.stompy.exception.StompTransactionClosedException;
import io.stompy.frame.Command;
import io.stompy.frame.Frame;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * A broker-side transaction started with {@link StompClient#transaction()}.
 *
 * <p>Every frame sent through this handle carries the transaction id. Once {@link #commit()} or
 * {@link #abort()} has been issued, every further call fails with
 * {@link StompTransactionClosedException}.
 */
public final class Transaction {

    private final StompClient client;
    private final String id;
    private final ReceiptFuture beginReceipt;
    private volatile boolean closed;

    public Transaction(StompClient client, String id, ReceiptFuture beginReceipt) {
        this.client = client;
        this.id = id;
        this.beginReceipt = beginReceipt;
    }

    public String id() {
        return id;
    }

    /**
     * Returns the receipt requested with the BEGIN frame.
     *
     * @return the BEGIN receipt
     */
    public ReceiptFuture beginReceipt() {
        return beginReceipt;
    }

    public boolean isClosed() {
        return closed;
    }

    public Optional<ReceiptFuture> send(Command command, Map<String, String> headers, byte[] body, Receipt receipt) {
        ensureOpen();
        return client.send(command, headers, body, Optional.of(id), receipt);
    }

    public Optional<ReceiptFuture> message(String destination, String body) {
        return message(destination, body.getBytes(StandardCharsets.UTF_8), Map.of(), Receipt.none());
    }

    public Optional<ReceiptFuture> message(
            String destination, byte[] body, Map<String, String> headers, Receipt receipt) {
        ensureOpen();
        return client.message(destination, body, Optional.empty(), headers, receipt, Optional.of(id));
    }

    /**
     * Receives the next frame; automatic ACKs sent for it are part of this transaction.
     *
     * @param timeout the maximum time to wait, empty to wait indefinitely
     * @return the frame, or empty if the connection closed
     */
    public Optional<Frame> recv(Optional<Duration> timeout) {
        ensureOpen();
        return client.recv(Optional.of(id), timeout);
    }

    public void ack(String ackId) {
        ensureOpen();
        client.ack(ackId, Optional.of(id));
    }

    public void nack(String ackId) {
        ensureOpen();
        client.nack(ackId, Optional.of(id));
    }

    public Optional<ReceiptFuture> commit() {
        return commit(Receipt.none());
    }

    public synchronized Optional<ReceiptFuture> commit(Receipt receipt) {
        return finish(Command.COMMIT, receipt);
    }

    public Optional<ReceiptFuture> abort() {
        return abort(Receipt.none());
    }

    public synchronized Optional<ReceiptFuture> abort(Receipt receipt) {
        return finish(Command.ABORT, receipt);
    }

    private Optional<ReceiptFuture> finish(Command command, Receipt receipt) {
        ensureOpen();
        Optional<ReceiptFuture> result = client.send(command, Map.of(), new byte[0], Optional.of(id), receipt);
        closed = true;
        return result;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StompTransactionClosedException(id);
        }
    }

    @Override
    public String toString() {
        return "Transaction{id=" + id + ", closed=" + closed + "}";
    }
}
