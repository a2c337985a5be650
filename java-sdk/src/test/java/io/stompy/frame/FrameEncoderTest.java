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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FrameEncoderTest {

    private static String encodeToString(Frame frame) {
        return new String(FrameEncoder.encode(frame), StandardCharsets.UTF_8);
    }

    @Test
    void shouldEncodeHeadersInInsertionOrder() {
        // given
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept-version", "1.2");
        headers.put("login", "admin");
        headers.put("passcode", "pw");

        // when
        String wire = encodeToString(new Frame(Command.CONNECT, headers));

        // then
        assertThat(wire).isEqualTo("CONNECT\naccept-version:1.2\nlogin:admin\npasscode:pw\n\n\0");
    }

    @Test
    void shouldInjectContentLengthBeforeOtherHeadersForNonEmptyBody() {
        // given
        Frame frame = new Frame(
                Command.SEND, Map.of("destination", "/queue/a"), "hi".getBytes(StandardCharsets.UTF_8));

        // when
        String wire = encodeToString(frame);

        // then
        assertThat(wire).isEqualTo("SEND\ncontent-length:2\ndestination:/queue/a\n\nhi\0");
    }

    @Test
    void shouldKeepCallerSuppliedContentLength() {
        // given
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("destination", "/queue/a");
        headers.put("content-length", "2");
        Frame frame = new Frame(Command.SEND, headers, "hi".getBytes(StandardCharsets.UTF_8));

        // when
        String wire = encodeToString(frame);

        // then
        assertThat(wire).isEqualTo("SEND\ndestination:/queue/a\ncontent-length:2\n\nhi\0");
    }

    @Test
    void shouldNotAddContentLengthForEmptyBody() {
        // when
        String wire = encodeToString(new Frame(Command.ACK, Map.of("id", "a1")));

        // then
        assertThat(wire).isEqualTo("ACK\nid:a1\n\n\0");
    }

    @Test
    void shouldEncodeBinaryBodyVerbatim() {
        // given
        byte[] body = {1, 0, 2, 0};
        Frame frame = new Frame(Command.SEND, Map.of(), body);

        // when
        byte[] wire = FrameEncoder.encode(frame);

        // then
        byte[] prefix = "SEND\ncontent-length:4\n\n".getBytes(StandardCharsets.UTF_8);
        assertThat(wire).hasSize(prefix.length + body.length + 1);
        assertThat(Arrays.copyOfRange(wire, 0, prefix.length)).isEqualTo(prefix);
        assertThat(Arrays.copyOfRange(wire, prefix.length, wire.length)).isEqualTo(new byte[] {1, 0, 2, 0, 0});
    }

    @Test
    void shouldParseWhatItEncodes() {
        // given
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("destination", "/topic/prices");
        headers.put("content-type", "text/plain;charset=UTF-8");
        Frame original = new Frame(Command.MESSAGE, headers, "12.5\0EUR".getBytes(StandardCharsets.UTF_8));

        // when
        FrameParser parser = new FrameParser();
        parser.process(FrameEncoder.toBytes(original));

        // then
        Frame parsed = parser.frame().orElseThrow();
        assertThat(parsed.command()).isEqualTo("MESSAGE");
        assertThat(parsed.body()).isEqualTo(original.body());
        assertThat(parsed.get("destination")).contains("/topic/prices");
        assertThat(parsed.get("content-length")).contains("8");
    }
}
