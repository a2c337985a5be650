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

/**
 * Acknowledgement modes a subscription can request from the broker.
 */
public enum AckMode {
    AUTO("auto"),
    CLIENT("client"),
    CLIENT_INDIVIDUAL("client-individual");

    private final String value;

    AckMode(String value) {
        this.value = value;
    }

    /**
     * Returns the value sent in the {@code ack} header of a SUBSCRIBE frame.
     *
     * @return the header value
     */
    public String getValue() {
        return value;
    }

    public static AckMode fromValue(String value) {
        for (AckMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        throw new StompInvalidArgumentException("Unknown ack mode: " + value);
    }
}
