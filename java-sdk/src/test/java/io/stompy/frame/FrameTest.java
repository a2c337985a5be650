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

package io.stompy.frame;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameTest {

    @Test
    void shouldRejectBlankCommand() {
        assertThatThrownBy(() -> new Frame(" ", Map.of(), null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepUnknownCommandAsText() {
        // given
        Frame frame = new Frame("PING", Map.of(), null);

        // then
        assertThat(frame.command()).isEqualTo("PING");
        assertThat(frame.knownCommand()).isEmpty();
    }

    @Test
    void shouldNotExposeInternalState() {
        // given
        byte[] body = "abc".getBytes(StandardCharsets.UTF_8);
        Frame frame = new Frame(Command.SEND, Map.of("destination", "/q"), body);

        // when
        body[0] = 'x';
        frame.body()[1] = 'y';
        frame.headers().put("destination", "/other");

        // then
        assertThat(frame.text()).isEqualTo("abc");
        assertThat(frame.destination()).contains("/q");
    }

    @Test
    void shouldDecodeTextUsingContentTypeCharset() {
        // given
        byte[] body = "café".getBytes(StandardCharsets.ISO_8859_1);
        Frame frame = new Frame(Command.MESSAGE, Map.of("content-type", "text/plain; charset=ISO-8859-1"), body);

        // then
        assertThat(frame.text()).isEqualTo("café");
    }

    @Test
    void shouldReturnDefaultForMissingHeader() {
        // given
        Frame frame = new Frame(Command.RECEIPT, Map.of("receipt-id", "r.1"));

        // then
        assertThat(frame.get("message", "none")).isEqualTo("none");
        assertThat(frame.contains("receipt-id")).isTrue();
        assertThat(frame.is(Command.RECEIPT)).isTrue();
    }

    @Test
    void shouldCompareByValue() {
        // given
        Frame first = new Frame(Command.ACK, Map.of("id", "a1"));
        Frame second = new Frame("ACK", Map.of("id", "a1"), new byte[0]);

        // then
        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first.toString()).isEqualTo("Frame{command=ACK, headers={id=a1}, body=0 bytes}");
    }
}
