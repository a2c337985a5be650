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

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes frames to their wire form:
 * {@code COMMAND\n} + {@code name:value\n} per header + {@code \n} + body + {@code \0}.
 *
 * <p>A non-empty body without an explicit {@code content-length} header gets one computed
 * and written ahead of the other headers.
 */
public final class FrameEncoder {

    private static final byte LF = '\n';
    private static final byte NUL = 0;

    private FrameEncoder() {}

    public static ByteBuf toBytes(Frame frame) {
        ByteBuf buffer = Unpooled.buffer(estimateSize(frame));
        writeFrame(frame, buffer);
        return buffer;
    }

    public static byte[] encode(Frame frame) {
        ByteBuf buffer = toBytes(frame);
        try {
            byte[] bytes = new byte[buffer.readableBytes()];
            buffer.readBytes(bytes);
            return bytes;
        } finally {
            buffer.release();
        }
    }

    static void writeFrame(Frame frame, ByteBuf out) {
        writeLine(out, frame.command());
        Map<String, String> headers = frame.headers();
        if (frame.bodyLength() > 0 && !headers.containsKey(Frame.CONTENT_LENGTH)) {
            writeLine(out, Frame.CONTENT_LENGTH + ":" + frame.bodyLength());
        }
        for (var header : headers.entrySet()) {
            writeLine(out, header.getKey() + ":" + header.getValue());
        }
        out.writeByte(LF);
        out.writeBytes(frame.body());
        out.writeByte(NUL);
    }

    private static void writeLine(ByteBuf out, String line) {
        out.writeCharSequence(line, StandardCharsets.UTF_8);
        out.writeByte(LF);
    }

    private static int estimateSize(Frame frame) {
        // command + headers are usually small; body dominates
        return 64 + frame.bodyLength();
    }
}
