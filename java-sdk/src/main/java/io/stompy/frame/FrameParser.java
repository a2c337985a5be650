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
import io.stompy.exception.StompFrameFormatException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Incremental parser for a single STOMP frame.
 *
 * <p>Bytes are fed with {@link #process(ByteBuf)} in chunks of any size. The parser consumes
 * everything up to the end of the frame and leaves the rest of the buffer readable, so the
 * same total input yields the same frame whatever the chunk boundaries. Once
 * {@link #isComplete()} returns true the parser is spent; a new instance parses the next frame.
 *
 * <p>Parsing rules:
 * <ul>
 *   <li>blank lines before the command line are heart-beats and are discarded;</li>
 *   <li>each header line is split on its first colon, a duplicate name keeps the last value;</li>
 *   <li>with a {@code content-length} header exactly that many body bytes are read, NULs
 *       included, and the following byte must be the NUL terminator;</li>
 *   <li>without one the body runs up to the first NUL, which is not part of the body.</li>
 * </ul>
 * A trailing {@code \r} is dropped from command and header lines.
 */
public final class FrameParser {

    private static final byte LF = '\n';
    private static final byte NUL = 0;
    private static final int UNDECLARED = -1;

    public enum State {
        AWAIT_COMMAND,
        READING_HEADERS,
        READING_BODY,
        COMPLETE
    }

    private final ByteArrayOutputStream line = new ByteArrayOutputStream();
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private State state = State.AWAIT_COMMAND;
    private String command;
    private int remainingBodyBytes = UNDECLARED;
    private Frame frame;

    /**
     * Consumes bytes from the buffer until the frame is complete or the buffer is drained.
     *
     * @param buffer the inbound bytes; its reader index is advanced past the consumed bytes
     * @return the same buffer, holding whatever follows the completed frame
     * @throws StompFrameFormatException if the bytes do not form a valid frame
     */
    public ByteBuf process(ByteBuf buffer) {
        while (state != State.COMPLETE && buffer.isReadable()) {
            switch (state) {
                case AWAIT_COMMAND -> readLine(buffer).ifPresent(this::onCommandLine);
                case READING_HEADERS -> readLine(buffer).ifPresent(this::onHeaderLine);
                case READING_BODY -> readBody(buffer);
                default -> throw new IllegalStateException("Unexpected parser state " + state);
            }
        }
        return buffer;
    }

    public State state() {
        return state;
    }

    public boolean isComplete() {
        return state == State.COMPLETE;
    }

    /**
     * Returns true once any byte of a frame (other than heart-beats) has been consumed.
     *
     * @return whether a frame is partially received
     */
    public boolean hasPartialFrame() {
        return state != State.COMPLETE && (state != State.AWAIT_COMMAND || line.size() > 0);
    }

    public Optional<Frame> frame() {
        return Optional.ofNullable(frame);
    }

    private Optional<String> readLine(ByteBuf buffer) {
        int end = buffer.indexOf(buffer.readerIndex(), buffer.writerIndex(), LF);
        if (end < 0) {
            drain(buffer, buffer.readableBytes(), line);
            return Optional.empty();
        }
        drain(buffer, end - buffer.readerIndex(), line);
        buffer.skipBytes(1);
        String text = line.toString(StandardCharsets.UTF_8);
        line.reset();
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return Optional.of(text);
    }

    private void onCommandLine(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return; // heart-beat
        }
        command = trimmed;
        state = State.READING_HEADERS;
    }

    private void onHeaderLine(String text) {
        if (text.isEmpty()) {
            remainingBodyBytes = contentLength();
            state = State.READING_BODY;
            return;
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            throw new StompFrameFormatException("Malformed header line in " + command + " frame: " + text);
        }
        headers.put(text.substring(0, colon), text.substring(colon + 1));
    }

    private int contentLength() {
        String declared = headers.get(Frame.CONTENT_LENGTH);
        if (declared == null) {
            return UNDECLARED;
        }
        int length;
        try {
            length = Integer.parseInt(declared.trim());
        } catch (NumberFormatException e) {
            throw new StompFrameFormatException("Invalid content-length: " + declared, e);
        }
        if (length < 0) {
            throw new StompFrameFormatException("Negative content-length: " + declared);
        }
        return length;
    }

    private void readBody(ByteBuf buffer) {
        if (remainingBodyBytes > 0) {
            int count = Math.min(remainingBodyBytes, buffer.readableBytes());
            drain(buffer, count, body);
            remainingBodyBytes -= count;
        } else if (remainingBodyBytes == 0) {
            byte terminator = buffer.readByte();
            if (terminator != NUL) {
                throw new StompFrameFormatException(
                        "Expected NUL after " + body.size() + "-byte body of " + command + " frame");
            }
            complete();
        } else {
            int nul = buffer.indexOf(buffer.readerIndex(), buffer.writerIndex(), NUL);
            if (nul < 0) {
                drain(buffer, buffer.readableBytes(), body);
                return;
            }
            drain(buffer, nul - buffer.readerIndex(), body);
            buffer.skipBytes(1);
            complete();
        }
    }

    private void complete() {
        frame = new Frame(command, headers, body.toByteArray());
        state = State.COMPLETE;
    }

    private static void drain(ByteBuf buffer, int count, ByteArrayOutputStream target) {
        if (count == 0) {
            return;
        }
        byte[] chunk = new byte[count];
        buffer.readBytes(chunk);
        target.write(chunk, 0, count);
    }
}
