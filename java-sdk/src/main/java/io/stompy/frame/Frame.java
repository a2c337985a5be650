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

import org.apache.commons.lang3.StringUtils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single STOMP frame: command, ordered headers and a raw body.
 *
 * <p>Headers keep insertion order, which is the order they are serialized in. When the same
 * name is put twice the last value wins and the header keeps the position where the name
 * first appeared. Frames are immutable.
 */
public final class Frame {

    public static final String CONTENT_LENGTH = "content-length";
    public static final String CONTENT_TYPE = "content-type";
    public static final String DESTINATION = "destination";
    public static final String RECEIPT = "receipt";
    public static final String RECEIPT_ID = "receipt-id";
    public static final String TRANSACTION = "transaction";
    public static final String SUBSCRIPTION = "subscription";
    public static final String MESSAGE_ID = "message-id";
    public static final String MESSAGE = "message";
    public static final String ACK = "ack";
    public static final String ID = "id";

    private static final String CHARSET_PARAMETER = "charset=";
    private static final byte[] EMPTY_BODY = new byte[0];

    private final String command;
    private final Map<String, String> headers;
    private final byte[] body;

    public Frame(String command, Map<String, String> headers, byte[] body) {
        if (StringUtils.isBlank(command)) {
            throw new IllegalArgumentException("Frame command cannot be blank");
        }
        this.command = command;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers == null ? Map.of() : headers));
        this.body = body == null || body.length == 0 ? EMPTY_BODY : body.clone();
    }

    public Frame(Command command, Map<String, String> headers, byte[] body) {
        this(command.name(), headers, body);
    }

    public Frame(Command command, Map<String, String> headers) {
        this(command.name(), headers, EMPTY_BODY);
    }

    public String command() {
        return command;
    }

    /**
     * Returns the command as an enum constant.
     *
     * @return the command, or empty if the broker sent a command this client does not know
     */
    public Optional<Command> knownCommand() {
        return Command.fromString(command);
    }

    public boolean is(Command expected) {
        return expected.name().equals(command);
    }

    /**
     * Returns a mutable copy of the headers in insertion order.
     *
     * @return the headers
     */
    public Map<String, String> headers() {
        return new LinkedHashMap<>(headers);
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public String get(String name, String defaultValue) {
        return headers.getOrDefault(name, defaultValue);
    }

    public boolean contains(String name) {
        return headers.containsKey(name);
    }

    public Optional<String> destination() {
        return get(DESTINATION);
    }

    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    /**
     * Decodes the body using the {@code charset} parameter of the {@code content-type} header,
     * or UTF-8 when there is none.
     *
     * @return the body as text
     */
    public String text() {
        return text(charset());
    }

    public String text(Charset charset) {
        return new String(body, charset);
    }

    private Charset charset() {
        String contentType = headers.get(CONTENT_TYPE);
        if (contentType != null) {
            for (String parameter : StringUtils.split(contentType, ';')) {
                String trimmed = parameter.trim();
                if (trimmed.startsWith(CHARSET_PARAMETER)) {
                    return Charset.forName(StringUtils.strip(trimmed.substring(CHARSET_PARAMETER.length()), "\""));
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return command.equals(other.command) && headers.equals(other.headers) && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, headers) * 31 + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Frame{command=" + command + ", headers=" + headers + ", body=" + body.length + " bytes}";
    }
}
