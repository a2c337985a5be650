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

import io.stompy.client.BrokerAddress;
import io.stompy.config.RetryPolicy;
import io.stompy.exception.StompInvalidArgumentException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder for creating configured StompTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Build, then connect explicitly
 * var client = StompTcpClient.builder()
 *     .address("localhost", 61613)
 *     .credentials("admin", "secret")
 *     .build();
 * client.connect();
 *
 * // Fail over between two brokers, retrying the pair with backoff
 * var client = StompTcpClient.builder()
 *     .address("broker-a", 61613)
 *     .address("broker-b", 61613)
 *     .retryPolicy(RetryPolicy.exponentialBackoff())
 *     .buildAndConnect();
 * }</pre>
 *
 * @see StompTcpClient#builder()
 */
public final class StompTcpClientBuilder {
    private final List<BrokerAddress> addresses = new ArrayList<>();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String login;
    private String passcode;
    private Duration connectionTimeout;
    private Duration disconnectTimeout = StompTcpClient.DEFAULT_DISCONNECT_TIMEOUT;
    private RetryPolicy retryPolicy = RetryPolicy.noRetry();

    StompTcpClientBuilder() {}

    /**
     * Adds a broker to the list tried by {@code connect}, in insertion order.
     *
     * @param host the host address
     * @param port the port number
     * @return this builder
     */
    public StompTcpClientBuilder address(String host, int port) {
        return address(BrokerAddress.of(host, port));
    }

    public StompTcpClientBuilder address(BrokerAddress address) {
        this.addresses.add(address);
        return this;
    }

    public StompTcpClientBuilder addresses(List<BrokerAddress> addresses) {
        this.addresses.addAll(addresses);
        return this;
    }

    /**
     * Sets the {@code login} and {@code passcode} sent with CONNECT. Either may be null.
     *
     * @param login the login
     * @param passcode the passcode
     * @return this builder
     */
    public StompTcpClientBuilder credentials(String login, String passcode) {
        this.login = login;
        this.passcode = passcode;
        return this;
    }

    /**
     * Adds an extra CONNECT header, for example {@code host} or {@code heart-beat}.
     *
     * @param name the header name
     * @param value the header value
     * @return this builder
     */
    public StompTcpClientBuilder header(String name, String value) {
        this.headers.put(name, value);
        return this;
    }

    /**
     * Adds extra CONNECT headers in the map's iteration order.
     *
     * @param headers the headers, null adds none
     * @return this builder
     */
    public StompTcpClientBuilder headers(Map<String, String> headers) {
        if (headers != null) {
            this.headers.putAll(headers);
        }
        return this;
    }

    /**
     * Bounds the TCP connect and the CONNECTED wait, per broker address.
     *
     * @param connectionTimeout the timeout
     * @return this builder
     */
    public StompTcpClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Bounds the wait for the DISCONNECT receipt. Defaults to 10 seconds.
     *
     * @param disconnectTimeout the timeout
     * @return this builder
     */
    public StompTcpClientBuilder disconnectTimeout(Duration disconnectTimeout) {
        this.disconnectTimeout = disconnectTimeout;
        return this;
    }

    public StompTcpClientBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Builds an unconnected client.
     * Note: You still need to call {@link StompTcpClient#connect()} on the returned client.
     *
     * @return a new StompTcpClient instance
     * @throws StompInvalidArgumentException if no address was given or a timeout is not positive
     */
    public StompTcpClient build() {
        if (addresses.isEmpty()) {
            throw new StompInvalidArgumentException("At least one broker address is required");
        }
        if (connectionTimeout != null && (connectionTimeout.isNegative() || connectionTimeout.isZero())) {
            throw new StompInvalidArgumentException("Connection timeout must be positive");
        }
        if (disconnectTimeout == null || disconnectTimeout.isNegative() || disconnectTimeout.isZero()) {
            throw new StompInvalidArgumentException("Disconnect timeout must be positive");
        }
        if (retryPolicy == null) {
            throw new StompInvalidArgumentException("Retry policy cannot be null");
        }
        return new StompTcpClient(
                addresses, login, passcode, headers, connectionTimeout, disconnectTimeout, retryPolicy);
    }

    /**
     * Builds the client and connects it to the first broker that accepts the handshake.
     *
     * @return a connected StompTcpClient instance
     */
    public StompTcpClient buildAndConnect() {
        StompTcpClient client = build();
        client.connect();
        return client;
    }
}
