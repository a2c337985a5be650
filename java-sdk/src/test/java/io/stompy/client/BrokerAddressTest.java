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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerAddressTest {

    @Test
    void shouldParseHostAndPort() {
        assertThat(BrokerAddress.parse("broker.local:61614")).isEqualTo(BrokerAddress.of("broker.local", 61614));
    }

    @Test
    void shouldDefaultToStompPort() {
        assertThat(BrokerAddress.parse(" broker.local ").port()).isEqualTo(61613);
    }

    @Test
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> BrokerAddress.parse("host:abc")).isInstanceOf(StompInvalidArgumentException.class);
        assertThatThrownBy(() -> BrokerAddress.of("host", 0)).isInstanceOf(StompInvalidArgumentException.class);
        assertThatThrownBy(() -> BrokerAddress.of("host", 70000)).isInstanceOf(StompInvalidArgumentException.class);
    }

    @Test
    void shouldRejectBlankHost() {
        assertThatThrownBy(() -> BrokerAddress.of(" ", 61613)).isInstanceOf(StompInvalidArgumentException.class);
        assertThatThrownBy(() -> BrokerAddress.parse(":61613")).isInstanceOf(StompInvalidArgumentException.class);
    }

    @Test
    void shouldRenderAsHostColonPort() {
        assertThat(BrokerAddress.of("localhost", 61613)).hasToString("localhost:61613");
    }

    @Test
    void ackModeShouldRoundTripHeaderValue() {
        assertThat(AckMode.fromValue("client-individual")).isEqualTo(AckMode.CLIENT_INDIVIDUAL);
        assertThat(AckMode.CLIENT.getValue()).isEqualTo("client");
        assertThatThrownBy(() -> AckMode.fromValue("sometimes")).isInstanceOf(StompInvalidArgumentException.class);
    }
}
