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

import io.stompy.frame.Frame;
import io.stompy.frame.FrameEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Exception thrown when the broker answers with an {@code ERROR} frame.
 *
 * <p>Carries the broker's {@code message} header and the offending frame; the exception message
 * renders the frame so broker-side diagnostics end up in logs and stack traces.
 */
public class StompProtocolException extends StompException {

    private final String brokerMessage;
    private final Frame frame;

    /**
     * Constructs a new StompProtocolException.
     *
     * @param brokerMessage the error text reported by the broker
     * @param frame the frame that carried the error, may be null
     */
    public StompProtocolException(String brokerMessage, Frame frame) {
        super(buildMessage(brokerMessage, frame));
        this.brokerMessage = brokerMessage;
        this.frame = frame;
    }

    /**
     * Creates an exception from a broker {@code ERROR} frame.
     *
     * @param frame the ERROR frame
     * @return the exception
     */
    public static StompProtocolException fromErrorFrame(Frame frame) {
        return new StompProtocolException(frame.get(Frame.MESSAGE, ""), frame);
    }

    public String getBrokerMessage() {
        return brokerMessage;
    }

    public Optional<Frame> getFrame() {
        return Optional.ofNullable(frame);
    }

    private static String buildMessage(String brokerMessage, Frame frame) {
        StringBuilder sb = new StringBuilder("STOMP error: ").append(brokerMessage);
        if (frame != null) {
            byte[] dump = FrameEncoder.encode(frame);
            // the NUL terminator is noise in a log line
            if (dump.length > 0 && dump[dump.length - 1] == 0) {
                dump = Arrays.copyOf(dump, dump.length - 1);
            }
            sb.append("\n- frame ---------------------\n")
                    .append(new String(dump, StandardCharsets.UTF_8))
                    .append("\n- end of frame --------------\n");
        }
        return sb.toString();
    }
}
