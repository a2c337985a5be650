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

import io.stompy.exception.StompInvalidArgumentException;
import org.apache.commons.lang3.StringUtils;

/**
 * Host and port of a STOMP broker.
 *
 * @param host the host name or IP address
 * @param port the TCP port
 */
public record BrokerAddress(String host, int port) {

    public static final int DEFAULT_PORT = 61613;

    public BrokerAddress {
        if (StringUtils.isBlank(host)) {
            throw new StompInvalidArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new StompInvalidArgumentException("Port must be between 1 and 65535, got " + port);
        }
    }

    public static BrokerAddress of(String host, int port) {
        return new BrokerAddress(host, port);
    }

    /**
     * Parses {@code host:port}; a missing port defaults to {@value #DEFAULT_PORT}.
     *
     * @param address the address string
     * @return the parsed address
     */
    public static BrokerAddress parse(String address) {
        if (StringUtils.isBlank(address)) {
            throw new StompInvalidArgumentException("Broker address cannot be null or empty");
        }
        String trimmed = address.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon < 0) {
            return new BrokerAddress(trimmed, DEFAULT_PORT);
        }
        String port = trimmed.substring(colon + 1);
        try {
            return new BrokerAddress(trimmed.substring(0, colon), Integer.parseInt(port));
        } catch (NumberFormatException e) {
            throw new StompInvalidArgumentException("Invalid port in broker address: " + address);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
