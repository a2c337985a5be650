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

package io.stompy.exception;

import io.stompy.frame.Command;
import io.stompy.frame.Frame;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StompProtocolExceptionTest {

    @Nested
    class BuildMessage {

        @Test
        void shouldRenderErrorFrameWithoutNulTerminator() {
            // given
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("message", "bad destination");
            headers.put("receipt-id", "r.3");
            Frame frame = new Frame(Command.ERROR, headers, "details".getBytes(StandardCharsets.UTF_8));

            // when
            StompProtocolException exception = StompProtocolException.fromErrorFrame(frame);

            // then
            assertThat(exception.getMessage())
                    .isEqualTo("STOMP error: bad destination\n"
                            + "- frame ---------------------\n"
                            + "ERROR\ncontent-length:7\nmessage:bad destination\nreceipt-id:r.3\n\ndetails\n"
                            + "- end of frame --------------\n");
        }

        @Test
        void shouldUseEmptyMessageWhenHeaderMissing() {
            // given
            Frame frame = new Frame(Command.ERROR, Map.of());

            // when
            StompProtocolException exception = StompProtocolException.fromErrorFrame(frame);

            // then
            assertThat(exception.getBrokerMessage()).isEmpty();
            assertThat(exception.getFrame()).contains(frame);
        }

        @Test
        void shouldOmitFrameDumpWithoutFrame() {
            // when
            StompProtocolException exception = new StompProtocolException("boom", null);

            // then
            assertThat(exception.getMessage()).isEqualTo("STOMP error: boom");
            assertThat(exception.getFrame()).isEmpty();
        }
    }

    @Test
    void timeoutMessageNamesOperationAndBound() {
        // when
        var exception = new StompTimeoutException("recv", Duration.ofMillis(250));

        // then
        assertThat(exception.getMessage()).isEqualTo("STOMP timeout: recv did not complete within 250 ms");
    }

    @Test
    void transactionClosedExceptionCarriesId() {
        // when
        var exception = new StompTransactionClosedException("t.4");

        // then
        assertThat(exception.getTransactionId()).isEqualTo("t.4");
        assertThat(exception).isInstanceOf(StompClientException.class);
    }
}
