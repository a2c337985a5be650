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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.stompy.exception.StompFrameFormatException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class FrameParserTest {

    private static ByteBuf bytes(String text) {
        return Unpooled.wrappedBuffer(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Frame parse(String text) {
        FrameParser parser = new FrameParser();
        parser.process(bytes(text));
        assertThat(parser.isComplete()).isTrue();
        return parser.frame().orElseThrow();
    }

    @Nested
    class Headers {

        @Test
        void shouldParseCommandHeadersAndBody() {
            // when
            Frame frame = parse("MESSAGE\ndestination:/queue/a\nsubscription:s.1\n\nhello\0");

            // then
            assertThat(frame.command()).isEqualTo("MESSAGE");
            assertThat(frame.headers())
                    .containsExactly(entry("destination", "/queue/a"), entry("subscription", "s.1"));
            assertThat(frame.text()).isEqualTo("hello");
        }

        @Test
        void shouldSplitHeaderOnFirstColonOnly() {
            // when
            Frame frame = parse("MESSAGE\nurl:http://host:8080/x\n\n\0");

            // then
            assertThat(frame.get("url")).contains("http://host:8080/x");
        }

        @Test
        void shouldKeepLastValueOfDuplicateHeaderAtFirstPosition() {
            // when
            Frame frame = parse("MESSAGE\nfoo:1\nbar:2\nfoo:3\n\n\0");

            // then
            assertThat(frame.headers().keySet()).containsExactly("foo", "bar");
            assertThat(frame.get("foo")).contains("3");
        }

        @Test
        void shouldStripCarriageReturnsFromLines() {
            // when
            Frame frame = parse("RECEIPT\r\nreceipt-id:r.7\r\n\r\n\0");

            // then
            assertThat(frame.command()).isEqualTo("RECEIPT");
            assertThat(frame.get("receipt-id")).contains("r.7");
        }

        @Test
        void shouldRejectHeaderLineWithoutColon() {
            // given
            FrameParser parser = new FrameParser();

            // then
            assertThatThrownBy(() -> parser.process(bytes("MESSAGE\nbroken\n\n\0")))
                    .isInstanceOf(StompFrameFormatException.class)
                    .hasMessageContaining("broken");
        }
    }

    @Nested
    class Body {

        @Test
        void shouldReadExactlyContentLengthBytesIncludingNul() {
            // when
            Frame frame = parse("MESSAGE\ncontent-length:5\n\nab\0cd\0");

            // then
            assertThat(frame.body()).isEqualTo(new byte[] {'a', 'b', 0, 'c', 'd'});
        }

        @Test
        void shouldReadUpToFirstNulWithoutContentLength() {
            // given
            FrameParser parser = new FrameParser();
            ByteBuf input = bytes("MESSAGE\n\nabc\0rest");

            // when
            parser.process(input);

            // then
            assertThat(parser.frame().orElseThrow().text()).isEqualTo("abc");
            assertThat(input.toString(StandardCharsets.UTF_8)).isEqualTo("rest");
        }

        @Test
        void shouldAcceptEmptyBody() {
            // when
            Frame frame = parse("CONNECTED\nversion:1.2\n\n\0");

            // then
            assertThat(frame.bodyLength()).isZero();
        }

        @Test
        void shouldRejectNonNumericContentLength() {
            // given
            FrameParser parser = new FrameParser();

            // then
            assertThatThrownBy(() -> parser.process(bytes("MESSAGE\ncontent-length:abc\n\n\0")))
                    .isInstanceOf(StompFrameFormatException.class)
                    .hasMessageContaining("content-length");
        }

        @Test
        void shouldRejectNegativeContentLength() {
            // given
            FrameParser parser = new FrameParser();

            // then
            assertThatThrownBy(() -> parser.process(bytes("MESSAGE\ncontent-length:-1\n\n\0")))
                    .isInstanceOf(StompFrameFormatException.class);
        }

        @Test
        void shouldRejectMissingNulAfterDeclaredBody() {
            // given
            FrameParser parser = new FrameParser();

            // then
            assertThatThrownBy(() -> parser.process(bytes("MESSAGE\ncontent-length:2\n\nabc\0")))
                    .isInstanceOf(StompFrameFormatException.class);
        }
    }

    @Nested
    class Streaming {

        @Test
        void shouldSkipHeartbeatsBeforeCommand() {
            // when
            Frame frame = parse("\n\r\n\nRECEIPT\nreceipt-id:r.1\n\n\0");

            // then
            assertThat(frame.command()).isEqualTo("RECEIPT");
        }

        @Test
        void shouldProduceSameFrameForEveryChunking() {
            // given
            String wire = "MESSAGE\ndestination:/topic/x\ncontent-length:4\n\nab\0c\0";
            Frame expected = parse(wire);
            byte[] data = wire.getBytes(StandardCharsets.UTF_8);

            for (int chunk = 1; chunk <= data.length; chunk++) {
                FrameParser parser = new FrameParser();

                // when
                for (int offset = 0; offset < data.length && !parser.isComplete(); offset += chunk) {
                    int length = Math.min(chunk, data.length - offset);
                    parser.process(Unpooled.wrappedBuffer(data, offset, length));
                }

                // then
                assertThat(parser.frame()).as("chunk size %d", chunk).contains(expected);
            }
        }

        @Test
        void shouldLeaveFollowingFrameUnread() {
            // given
            ByteBuf input = bytes("RECEIPT\nreceipt-id:r.1\n\n\0RECEIPT\nreceipt-id:r.2\n\n\0");
            List<Frame> frames = new ArrayList<>();

            // when
            while (input.isReadable()) {
                FrameParser parser = new FrameParser();
                parser.process(input);
                parser.frame().ifPresent(frames::add);
            }

            // then
            assertThat(frames).extracting(f -> f.get("receipt-id").orElseThrow()).containsExactly("r.1", "r.2");
        }

        @Test
        void shouldReportPartialFrameOnlyAfterCommandBytes() {
            // given
            FrameParser parser = new FrameParser();

            // when
            parser.process(bytes("\n\n"));

            // then
            assertThat(parser.hasPartialFrame()).isFalse();

            // when
            parser.process(bytes("MESS"));

            // then
            assertThat(parser.hasPartialFrame()).isTrue();
            assertThat(parser.state()).isEqualTo(FrameParser.State.AWAIT_COMMAND);
        }
    }
}
