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

package io.stompy.client.tcp;

import io.stompy.StompyVersion;
import io.stompy.client.AckMode;
import io.stompy.client.BrokerAddress;
import io.stompy.client.ConnectionState;
import io.stompy.client.DispatchResult;
import io.stompy.client.FrameListener;
import io.stompy.client.Receipt;
import io.stompy.client.ReceiptFuture;
import io.stompy.client.StompClient;
import io.stompy.client.Subscription;
import io.stompy.client.Transaction;
import io.stompy.config.RetryPolicy;
import io.stompy.exception.StompClientException;
import io.stompy.exception.StompClosedException;
import io.stompy.exception.StompConnectionException;
import io.stompy.exception.StompException;
import io.stompy.exception.StompInvalidArgumentException;
import io.stompy.exception.StompNotConnectedException;
import io.stompy.exception.StompProtocolException;
import io.stompy.exception.StompTimeoutException;
import io.stompy.frame.Command;
import io.stompy.frame.Frame;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * STOMP 1.2 client over a single TCP connection.
 *
 * <p>Thread safety: any number of threads may send concurrently, writes are serialized frame by
 * frame. One thread at a time receives; RECEIPT frames seen by that thread resolve the
 * {@link ReceiptFuture}s other threads are waiting on.
 */
public class StompTcpClient implements StompClient {

    private static final Logger log = LoggerFactory.getLogger(StompTcpClient.class);

    static final String PROTOCOL_VERSION = "1.2";
    static final Duration DEFAULT_DISCONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final byte[] NO_BODY = new byte[0];

    private final List<BrokerAddress> addresses;
    private final Optional<String> login;
    private final Optional<String> passcode;
    private final Map<String, String> connectHeaders;
    private final Optional<Duration> connectionTimeout;
    private final Duration disconnectTimeout;
    private final RetryPolicy retryPolicy;

    private final AtomicLong idSequence = new AtomicLong(1);
    // guards state, connection, subscriptions and receipts
    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock receiveLock = new ReentrantLock();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Map<String, Subscription> subscriptions = new HashMap<>();
    private final Map<String, ReceiptFuture> receipts = new HashMap<>();
    private final List<FrameListener> callbacks = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.NEW;
    private volatile StompConnection connection;
    private volatile BrokerAddress brokerAddress;

    public StompTcpClient() {
        this(List.of(), null, null, Map.of(), null, DEFAULT_DISCONNECT_TIMEOUT, RetryPolicy.noRetry());
    }

    @SuppressWarnings("checkstyle:ParameterNumber")
    StompTcpClient(
            List<BrokerAddress> addresses,
            String login,
            String passcode,
            Map<String, String> connectHeaders,
            Duration connectionTimeout,
            Duration disconnectTimeout,
            RetryPolicy retryPolicy) {
        this.addresses = List.copyOf(addresses);
        this.login = Optional.ofNullable(login);
        this.passcode = Optional.ofNullable(passcode);
        this.connectHeaders = new LinkedHashMap<>(connectHeaders);
        this.connectionTimeout = Optional.ofNullable(connectionTimeout);
        this.disconnectTimeout = disconnectTimeout;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Creates a new builder for configuring a StompTcpClient.
     *
     * @return a new builder
     */
    public static StompTcpClientBuilder builder() {
        return new StompTcpClientBuilder();
    }

    /**
     * Connects with the addresses, credentials and headers given to the builder.
     *
     * @return the CONNECTED frame
     */
    public Frame connect() {
        return connect(addresses, login, passcode, connectHeaders, connectionTimeout);
    }

    @Override
    public Frame connect(
            List<BrokerAddress> addresses,
            Optional<String> login,
            Optional<String> passcode,
            Map<String, String> headers,
            Optional<Duration> timeout) {
        if (addresses.isEmpty()) {
            throw new StompInvalidArgumentException("At least one broker address is required");
        }
        stateLock.lock();
        try {
            switch (state) {
                case NEW -> state = ConnectionState.CONNECTING;
                case CLOSED -> throw new StompClosedException();
                default -> throw new StompClientException("Already connected");
            }
        } finally {
            stateLock.unlock();
        }

        Frame connectFrame = connectFrame(login, passcode, headers);
        StompException lastError = null;
        try {
            for (int round = 0; round <= retryPolicy.getMaxRetries(); round++) {
                if (round > 0) {
                    sleepBeforeRetry(round);
                }
                for (BrokerAddress address : addresses) {
                    try {
                        return handshake(address, connectFrame, timeout.or(() -> connectionTimeout));
                    } catch (StompClosedException e) {
                        throw e;
                    } catch (StompException e) {
                        log.debug("Connection attempt to {} failed: {}", address, e.getMessage());
                        lastError = e;
                    }
                }
            }
        } finally {
            resetIfStillConnecting();
        }
        throw new StompConnectionException("Failed to connect to any broker of " + addresses, lastError);
    }

    private Frame connectFrame(Optional<String> login, Optional<String> passcode, Map<String, String> headers) {
        Map<String, String> frameHeaders = new LinkedHashMap<>();
        frameHeaders.put("accept-version", PROTOCOL_VERSION);
        login.ifPresent(value -> frameHeaders.put("login", value));
        passcode.ifPresent(value -> frameHeaders.put("passcode", value));
        frameHeaders.putAll(headers);
        return new Frame(Command.CONNECT, frameHeaders);
    }

    private Frame handshake(BrokerAddress address, Frame connectFrame, Optional<Duration> timeout) {
        StompConnection stream = StompConnection.open(address, timeout, this::onEndOfStream);
        boolean established = false;
        try {
            stream.send(connectFrame);
            Frame reply = stream.recv(timeout)
                    .orElseThrow(() -> new StompConnectionException(
                            "Broker at " + address + " closed the connection during the handshake"));
            if (reply.is(Command.ERROR)) {
                throw StompProtocolException.fromErrorFrame(reply);
            }
            if (!reply.is(Command.CONNECTED)) {
                throw new StompConnectionException(
                        "Error connecting to the broker. Unknown response command: " + reply.command());
            }
            stateLock.lock();
            try {
                if (state != ConnectionState.CONNECTING) {
                    throw new StompClosedException("Client was closed while connecting to " + address);
                }
                connection = stream;
                brokerAddress = address;
                state = ConnectionState.CONNECTED;
            } finally {
                stateLock.unlock();
            }
            established = true;
            if (stream.hasEnded()) {
                onEndOfStream(stream);
            }
            log.info(
                    "Connected to STOMP broker at {} (version {}) using {}",
                    address,
                    reply.get("version", "unknown"),
                    StompyVersion.getInstance());
            return reply;
        } finally {
            if (!established) {
                stream.close();
            }
        }
    }

    private void sleepBeforeRetry(int retry) {
        Duration delay = retryPolicy.delayBeforeRetry(retry);
        log.debug("All broker addresses failed, retry {} of {} in {}", retry, retryPolicy.getMaxRetries(), delay);
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StompConnectionException("Interrupted while waiting to retry the connection", e);
        }
    }

    private void resetIfStillConnecting() {
        stateLock.lock();
        try {
            if (state == ConnectionState.CONNECTING) {
                state = ConnectionState.NEW;
            }
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    @Override
    public Optional<BrokerAddress> brokerAddress() {
        return Optional.ofNullable(brokerAddress);
    }

    @Override
    public String subscribe(String destination, AckMode ackMode, boolean autoAck) {
        if (StringUtils.isBlank(destination)) {
            throw new StompInvalidArgumentException("Destination cannot be blank");
        }
        requireConnection();
        String id = nextSubscriptionId();
        var subscription = new Subscription(this, id, destination, ackMode, autoAck);
        withStateLock(() -> subscriptions.put(id, subscription));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(Frame.DESTINATION, destination);
        headers.put(Frame.ACK, ackMode.getValue());
        headers.put(Frame.ID, id);
        try {
            send(Command.SUBSCRIBE, headers);
        } catch (RuntimeException e) {
            withStateLock(() -> subscriptions.remove(id));
            throw e;
        }
        log.debug("Subscribed to {} with id {} (ack={}, autoAck={})", destination, id, ackMode.getValue(), autoAck);
        return id;
    }

    @Override
    public Optional<Subscription> subscription(String id) {
        return Optional.ofNullable(withStateLock(() -> subscriptions.get(id)));
    }

    @Override
    public Optional<ReceiptFuture> unsubscribe(String id) {
        requireConnection();
        Subscription removed = withStateLock(() -> subscriptions.remove(id));
        if (removed == null) {
            return Optional.empty();
        }
        log.debug("Unsubscribing {} from {}", id, removed.destination());
        return send(Command.UNSUBSCRIBE, Map.of(Frame.ID, id), Receipt.auto());
    }

    @Override
    public Optional<ReceiptFuture> send(
            Command command,
            Map<String, String> headers,
            byte[] body,
            Optional<String> transaction,
            Receipt receipt) {
        StompConnection stream = requireConnection();
        Map<String, String> frameHeaders = new LinkedHashMap<>(headers);
        transaction.ifPresent(id -> frameHeaders.put(Frame.TRANSACTION, id));

        ReceiptFuture future = null;
        if (receipt.isRequested()) {
            String receiptId = receipt.id().orElseGet(this::nextReceiptId);
            frameHeaders.put(Frame.RECEIPT, receiptId);
            future = registerReceipt(receiptId);
        }
        try {
            write(stream, new Frame(command, frameHeaders, body));
        } catch (RuntimeException e) {
            if (future != null) {
                String receiptId = future.receiptId();
                withStateLock(() -> receipts.remove(receiptId));
            }
            throw e;
        }
        return Optional.ofNullable(future);
    }

    private ReceiptFuture registerReceipt(String receiptId) {
        var future = new ReceiptFuture(receiptId);
        stateLock.lock();
        try {
            if (state == ConnectionState.CLOSED) {
                throw new StompClosedException();
            }
            receipts.put(receiptId, future);
        } finally {
            stateLock.unlock();
        }
        return future;
    }

    private void write(StompConnection stream, Frame frame) {
        writeLock.lock();
        try {
            stream.send(frame);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<ReceiptFuture> message(
            String destination,
            byte[] body,
            Optional<String> messageId,
            Map<String, String> headers,
            Receipt receipt,
            Optional<String> transaction) {
        Map<String, String> frameHeaders = new LinkedHashMap<>();
        frameHeaders.put(Frame.DESTINATION, destination);
        frameHeaders.putAll(headers);
        messageId.ifPresent(id -> frameHeaders.put(Frame.MESSAGE_ID, id));
        return send(Command.SEND, frameHeaders, body, transaction, receipt);
    }

    @Override
    public void ack(String ackId, Optional<String> transaction) {
        send(Command.ACK, Map.of(Frame.ID, ackId), NO_BODY, transaction, Receipt.none());
    }

    @Override
    public void nack(String ackId, Optional<String> transaction) {
        send(Command.NACK, Map.of(Frame.ID, ackId), NO_BODY, transaction, Receipt.none());
    }

    @Override
    public Transaction transaction(Optional<String> transactionId) {
        String id = transactionId.filter(StringUtils::isNotBlank).orElseGet(this::nextTransactionId);
        ReceiptFuture begin = send(Command.BEGIN, Map.of(), NO_BODY, Optional.of(id), Receipt.auto())
                .orElseThrow();
        log.debug("Began transaction {}", id);
        return new Transaction(this, id, begin);
    }

    @Override
    public Optional<Frame> recv(Optional<String> transaction, Optional<Duration> timeout) {
        return receive(transaction, timeout, null);
    }

    // returns empty as soon as awaited is resolved
    private Optional<Frame> receive(Optional<String> transaction, Optional<Duration> timeout, ReceiptFuture awaited) {
        StompConnection stream = null;
        receiveLock.lock();
        try {
            stream = readableConnection();
            long deadline = timeout.map(t -> System.nanoTime() + t.toNanos()).orElse(0L);
            while (true) {
                Optional<Duration> remaining =
                        timeout.map(t -> Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
                Optional<Frame> next = stream.recv(remaining);
                if (next.isEmpty()) {
                    log.debug("Broker at {} closed the connection", stream.address());
                    close();
                    return Optional.empty();
                }
                Frame frame = next.get();
                if (frame.is(Command.RECEIPT)) {
                    resolveReceipt(frame);
                    if (awaited != null && awaited.isDone()) {
                        return Optional.empty();
                    }
                    continue;
                }
                if (frame.is(Command.ERROR)) {
                    throw StompProtocolException.fromErrorFrame(frame);
                }
                if (frame.is(Command.MESSAGE) && frame.contains(Frame.ACK) && requiresAutoAck(frame)) {
                    String ackId = frame.get(Frame.ACK).orElseThrow();
                    if (state == ConnectionState.CLOSED) {
                        log.debug("Connection closed, not acknowledging message {}", ackId);
                    } else {
                        log.debug("Acknowledging message {} automatically", ackId);
                        ack(ackId, transaction);
                    }
                }
                return Optional.of(frame);
            }
        } finally {
            receiveLock.unlock();
            if (stream != null && stream.hasEnded()) {
                settleReceipts(stream);
            }
        }
    }

    private void resolveReceipt(Frame frame) {
        String receiptId = frame.get(Frame.RECEIPT_ID, "");
        ReceiptFuture future = withStateLock(() -> receipts.remove(receiptId));
        if (future == null) {
            log.debug("Ignoring RECEIPT {} nobody is waiting for", receiptId);
            return;
        }
        future.complete(frame);
    }

    private boolean requiresAutoAck(Frame frame) {
        Subscription subscription = frame.get(Frame.SUBSCRIPTION)
                .map(id -> withStateLock(() -> subscriptions.get(id)))
                .orElse(null);
        if (subscription == null) {
            return true;
        }
        return subscription.autoAck() && subscription.ackMode() != AckMode.AUTO;
    }

    @Override
    public Optional<Frame> loop(Optional<String> transaction, Optional<Duration> timeout) {
        while (true) {
            Optional<Frame> frame = recv(transaction, timeout);
            if (frame.isEmpty() || dispatch(frame.get()) == DispatchResult.STOP) {
                return frame;
            }
        }
    }

    // later callbacks do not see a frame an earlier one stopped on
    private DispatchResult dispatch(Frame frame) {
        for (FrameListener callback : callbacks) {
            if (callback.onFrame(this, frame) == DispatchResult.STOP) {
                return DispatchResult.STOP;
            }
        }
        return DispatchResult.CONTINUE;
    }

    @Override
    public void addCallback(FrameListener listener) {
        withStateLock(() -> {
            callbacks.remove(listener);
            return callbacks.add(listener);
        });
    }

    @Override
    public void removeCallback(FrameListener listener) {
        callbacks.remove(listener);
    }

    @Override
    public void removeAllCallbacks() {
        callbacks.clear();
    }

    @Override
    public void disconnect() {
        stateLock.lock();
        try {
            if (state != ConnectionState.CONNECTED) {
                return;
            }
            state = ConnectionState.DISCONNECTING;
        } finally {
            stateLock.unlock();
        }
        try {
            ReceiptFuture receipt = send(Command.DISCONNECT, Map.of(), Receipt.auto()).orElseThrow();
            awaitDisconnectReceipt(receipt);
        } catch (StompClosedException e) {
            log.debug("Broker closed the connection before DISCONNECT was sent");
        } finally {
            close();
        }
    }

    private void awaitDisconnectReceipt(ReceiptFuture receipt) {
        if (!receiveLock.tryLock()) {
            try {
                receipt.await(disconnectTimeout);
            } catch (StompClosedException e) {
                log.debug("Connection closed before the DISCONNECT receipt arrived");
            } catch (StompTimeoutException e) {
                log.warn("No DISCONNECT receipt from {} within {}", brokerAddress, disconnectTimeout);
                throw e;
            }
            return;
        }
        try {
            long deadline = System.nanoTime() + disconnectTimeout.toNanos();
            while (!receipt.isDone()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new StompTimeoutException("disconnect", disconnectTimeout);
                }
                receive(Optional.empty(), Optional.of(Duration.ofNanos(remaining)), receipt)
                        .ifPresent(frame ->
                                log.debug("Discarding {} frame received while disconnecting", frame.command()));
            }
        } catch (StompTimeoutException e) {
            log.warn("No DISCONNECT receipt from {} within {}", brokerAddress, disconnectTimeout);
            throw e;
        } finally {
            receiveLock.unlock();
        }
    }

    /**
     * Closes the connection. Pending receipts fail with {@link StompClosedException}. Safe to call
     * more than once, and after the broker has closed the connection.
     */
    @Override
    public void close() {
        StompConnection stream;
        List<ReceiptFuture> pending;
        stateLock.lock();
        try {
            state = ConnectionState.CLOSED;
            stream = connection;
            connection = null;
            pending = new ArrayList<>(receipts.values());
            receipts.clear();
            subscriptions.clear();
            callbacks.clear();
        } finally {
            stateLock.unlock();
        }
        if (stream != null) {
            stream.close();
            log.info("Closed connection to STOMP broker at {}", stream.address());
        }
        failReceipts(pending);
    }

    /**
     * Runs on the Netty event loop once the broker closes the connection or the transport fails.
     *
     * <p>The client becomes {@link ConnectionState#CLOSED} right away. Frames already queued stay
     * readable and the receiver that reaches the end of them releases the connection. RECEIPT
     * frames still queued resolve their receipts, every other pending receipt fails.
     */
    private void onEndOfStream(StompConnection stream) {
        stateLock.lock();
        try {
            if (connection != stream || state == ConnectionState.CLOSED) {
                return;
            }
            state = ConnectionState.CLOSED;
        } finally {
            stateLock.unlock();
        }
        log.info("Broker at {} closed the connection", stream.address());
        settleReceipts(stream);
    }

    // skipped while another thread receives, that thread settles once it lets go of the stream
    private void settleReceipts(StompConnection stream) {
        if (!receiveLock.tryLock()) {
            return;
        }
        try {
            Map<ReceiptFuture, Frame> answered = new LinkedHashMap<>();
            List<ReceiptFuture> unanswered;
            stateLock.lock();
            try {
                for (Frame frame : stream.unreadFrames()) {
                    if (frame.is(Command.RECEIPT)) {
                        ReceiptFuture future = receipts.remove(frame.get(Frame.RECEIPT_ID, ""));
                        if (future != null) {
                            answered.put(future, frame);
                        }
                    }
                }
                unanswered = new ArrayList<>(receipts.values());
                receipts.clear();
            } finally {
                stateLock.unlock();
            }
            answered.forEach(ReceiptFuture::complete);
            failReceipts(unanswered);
        } finally {
            receiveLock.unlock();
        }
    }

    private static void failReceipts(List<ReceiptFuture> pending) {
        for (ReceiptFuture future : pending) {
            future.fail(new StompClosedException(
                    "Connection closed before receipt " + future.receiptId() + " arrived"));
        }
    }

    @Override
    public Iterator<Frame> iterator() {
        return new FrameIterator();
    }

    String nextSubscriptionId() {
        return "s." + idSequence.getAndIncrement();
    }

    String nextReceiptId() {
        return "r." + idSequence.getAndIncrement();
    }

    String nextTransactionId() {
        return "t." + idSequence.getAndIncrement();
    }

    private StompConnection requireConnection() {
        ConnectionState current = state;
        if (current == ConnectionState.CLOSED) {
            throw new StompClosedException();
        }
        StompConnection stream = connection;
        if (stream == null || current == ConnectionState.NEW || current == ConnectionState.CONNECTING) {
            throw new StompNotConnectedException();
        }
        return stream;
    }

    // frames queued before the broker hung up can still be received
    private StompConnection readableConnection() {
        StompConnection stream = connection;
        if (stream != null && state == ConnectionState.CLOSED) {
            return stream;
        }
        return requireConnection();
    }

    private <T> T withStateLock(Supplier<T> action) {
        stateLock.lock();
        try {
            return action.get();
        } finally {
            stateLock.unlock();
        }
    }

    private final class FrameIterator implements Iterator<Frame> {

        private Frame next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            Optional<Frame> frame = recv();
            if (frame.isEmpty()) {
                finished = true;
                return false;
            }
            next = frame.get();
            return true;
        }

        @Override
        public Frame next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Frame frame = next;
            next = null;
            return frame;
        }
    }
}
