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

import java.time.Duration;

/**
 * Exception thrown when a bounded wait (socket read, receipt, disconnect) exceeds its deadline.
 */
public class StompTimeoutException extends StompException {

    /**
     * Constructs a new StompTimeoutException for the given operation and timeout.
     *
     * @param operation the operation that timed out
     * @param timeout the timeout that elapsed
     */
    public StompTimeoutException(String operation, Duration timeout) {
        super("STOMP timeout: " + operation + " did not complete within " + timeout.toMillis() + " ms");
    }

    /**
     * Constructs a new StompTimeoutException with the specified message.
     *
     * @param message the detail message
     */
    public StompTimeoutException(String message) {
        super(message);
    }
}
