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

package io.stompy;

import io.stompy.client.BrokerAddress;
import io.stompy.client.StompClient;
import io.stompy.client.tcp.StompTcpClient;
import io.stompy.client.tcp.StompTcpClientBuilder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for creating STOMP clients.
 *
 * <pre>{@code
 * try (StompClient client = Stompy.connect(BrokerAddress.of("localhost", 61613))) {
 *     client.subscribe("/queue/orders", AckMode.CLIENT_INDIVIDUAL);
 *     client.addCallback((c, frame) -> {
 *         System.out.println(frame.text());
 *         return DispatchResult.CONTINUE;
 *     });
 *     client.loop();
 * }
 * }</pre>
 *
 * @see StompTcpClientBuilder
 * @see StompyVersion
 */
public final class Stompy {

    private Stompy() {}

    public static StompTcpClientBuilder tcpClientBuilder() {
        return StompTcpClient.builder();
    }

    /**
     * Connects to a single broker without credentials.
     *
     * @param address the broker
     * @return a connected client
     */
    public static StompClient connect(BrokerAddress address) {
        return tcpClientBuilder().address(address).buildAndConnect();
    }

    /**
     * Connects to the first broker of the list that accepts the handshake.
     *
     * @param addresses brokers to try, in order
     * @param login the login, may be null
     * @param passcode the passcode, may be null
     * @param headers extra CONNECT headers, may be null
     * @return a connected client
     */
    public static StompClient connect(
            List<BrokerAddress> addresses, String login, String passcode, Map<String, String> headers) {
        return connect(addresses, login, passcode, headers, null);
    }

    /**
     * Connects to the first broker of the list that accepts the handshake, bounding each attempt.
     *
     * @param addresses brokers to try, in order
     * @param login the login, may be null
     * @param passcode the passcode, may be null
     * @param headers extra CONNECT headers, may be null
     * @param timeout bound on the TCP connect and the CONNECTED wait per address, null waits indefinitely
     * @return a connected client
     */
    public static StompClient connect(
            List<BrokerAddress> addresses,
            String login,
            String passcode,
            Map<String, String> headers,
            Duration timeout) {
        return tcpClientBuilder()
                .addresses(addresses)
                .credentials(login, passcode)
                .headers(headers)
                .connectionTimeout(timeout)
                .buildAndConnect();
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "0.3.0")
     */
    public static String version() {
        return StompyVersion.getInstance().getVersion();
    }

    public static StompyVersion versionInfo() {
        return StompyVersion.getInstance();
    }
}
