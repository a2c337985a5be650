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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.DecoderException;
import io.stompy.client.BrokerAddress;
import io.stompy.exception.StompClientException;
import io.stompy.exception.StompConnectionException;
import io.stompy.exception.StompException;
import io.stompy.exception.StompTimeoutException;
import io.stompy.frame.Frame;
import io.stompy.frame.FrameEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A single TCP connection to a broker carrying whole frames in both directions.
 *
 * <p>Inbound frames are decoded on the Netty event loop and queued; {@link #recv(Optional)}
 * blocks on that queue. Once the peer closes the stream, or {@link #close()} is called, every
 * subsequent receive reports end of stream. Frames queued before that point stay readable.
 *
 * <p>The end-of-stream listener runs on the Netty event loop right after the end marker is queued,
 * whether or not any thread is receiving.
 */
final class StompConnection {

    private static final Logger log = LoggerFactory.getLogger(StompConnection.class);

    private final BrokerAddress address;
    private final Connection connection;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Consumer<StompConnection> endOfStreamListener;
    private volatile boolean ended;

    private StompConnection(
            BrokerAddress address, Connection connection, Consumer<StompConnection> endOfStreamListener) {
        this.address = address;
        this.connection = connection;
        this.endOfStreamListener = endOfStreamListener;
    }

    /**
     * Opens a TCP connection to the broker.
     *
     * @param address the broker
     * @param connectTimeout bound on establishing the TCP connection
     * @param endOfStreamListener notified once when the inbound stream ends or fails
     * @return the open connection
     */
    static StompConnection open(
            BrokerAddress address,
            Optional<Duration> connectTimeout,
            Consumer<StompConnection> endOfStreamListener) {
        TcpClient tcpClient = TcpClient.create()
                .host(address.host())
                .port(address.port())
                .doOnConnected(conn -> conn.addHandlerLast("stompFrameDecoder", new StompFrameDecoder()));
        if (connectTimeout.isPresent()) {
            int millis = (int) Math.min(Integer.MAX_VALUE, Math.max(1, connectTimeout.get().toMillis()));
            tcpClient = tcpClient.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, millis);
        }
        Connection connection;
        try {
            connection = connectTimeout.isPresent()
                    ? tcpClient.connectNow(connectTimeout.get())
                    : tcpClient.connectNow();
        } catch (RuntimeException e) {
            throw new StompConnectionException("Cannot open TCP connection to " + address, e);
        }
        var stompConnection = new StompConnection(address, connection, endOfStreamListener);
        stompConnection.receiveInbound();
        log.debug("Opened TCP connection to {}", address);
        return stompConnection;
    }

    private void receiveInbound() {
        connection
                .inbound()
                .receiveObject()
                .ofType(Frame.class)
                .subscribe(
                        frame -> inbound.add(Inbound.of(frame)),
                        error -> {
                            inbound.add(Inbound.failed(error));
                            endOfStream();
                        },
                        this::endOfStream);
    }

    private void endOfStream() {
        inbound.add(Inbound.END);
        ended = true;
        try {
            endOfStreamListener.accept(this);
        } catch (RuntimeException e) {
            log.warn("End of stream handling for {} failed", address, e);
        }
    }

    BrokerAddress address() {
        return address;
    }

    /**
     * Returns true once the inbound stream has ended, by the peer or by {@link #close()}.
     */
    boolean hasEnded() {
        return ended;
    }

    /**
     * Snapshot of the frames queued but not yet received, oldest first.
     */
    List<Frame> unreadFrames() {
        return inbound.stream()
                .map(Inbound::frame)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Writes a frame and waits until it has been flushed to the socket.
     *
     * @param frame the frame
     */
    void send(Frame frame) {
        if (closed.get()) {
            throw new StompConnectionException("Connection to " + address + " is closed");
        }
        ByteBuf buffer = FrameEncoder.toBytes(frame);
        log.trace("Sending {} frame to {}, {} bytes", frame.command(), address, buffer.readableBytes());
        try {
            connection.outbound().send(Mono.just(buffer)).then().block();
        } catch (RuntimeException e) {
            throw new StompConnectionException("Failed to send " + frame.command() + " frame to " + address, e);
        }
    }

    /**
     * Waits for the next inbound frame.
     *
     * @param timeout how long to wait, empty to wait indefinitely
     * @return the frame, or empty at end of stream
     * @throws StompTimeoutException if no frame arrived in time
     */
    Optional<Frame> recv(Optional<Duration> timeout) {
        Inbound next;
        try {
            next = timeout.isPresent()
                    ? inbound.poll(timeout.get().toNanos(), TimeUnit.NANOSECONDS)
                    : inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StompClientException("Interrupted while waiting for a frame from " + address, e);
        }
        if (next == null) {
            throw new StompTimeoutException("recv", timeout.get());
        }
        if (next.isEnd()) {
            // end of stream is sticky
            inbound.offer(next);
            return Optional.empty();
        }
        if (next.error() != null) {
            throw translate(next.error());
        }
        log.trace("Received {} frame from {}", next.frame().command(), address);
        return Optional.of(next.frame());
    }

    private StompException translate(Throwable error) {
        Throwable cause = error instanceof DecoderException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof StompException) {
            return (StompException) cause;
        }
        return new StompConnectionException("Connection to " + address + " failed", cause);
    }

    /**
     * Closes the socket. Safe to call more than once.
     */
    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connection.dispose();
        inbound.offer(Inbound.END);
        log.debug("Closed TCP connection to {}", address);
    }

    private record Inbound(Frame frame, Throwable error) {

        static final Inbound END = new Inbound(null, null);

        static Inbound of(Frame frame) {
            return new Inbound(frame, null);
        }

        static Inbound failed(Throwable error) {
            return new Inbound(null, error);
        }

        boolean isEnd() {
            return frame == null && error == null;
        }
    }
}
