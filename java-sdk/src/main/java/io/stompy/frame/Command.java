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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * STOMP 1.2 frame commands understood by the client. The wire form of each command is its name.
 */
public enum Command {
    // client frames
    CONNECT,
    SEND,
    SUBSCRIBE,
    UNSUBSCRIBE,
    ACK,
    NACK,
    BEGIN,
    COMMIT,
    ABORT,
    DISCONNECT,

    // server frames
    CONNECTED,
    MESSAGE,
    RECEIPT,
    ERROR;

    private static final Map<String, Command> BY_NAME = new HashMap<>();

    static {
        for (Command command : values()) {
            BY_NAME.put(command.name(), command);
        }
    }

    /**
     * Returns the command for the given wire name.
     *
     * @param name the command line of a frame
     * @return the matching command, or empty for a command outside the supported vocabulary
     */
    public static Optional<Command> fromString(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
