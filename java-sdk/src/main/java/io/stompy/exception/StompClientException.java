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

/**
 * Exception thrown when the client is used incorrectly, e.g. an operation is attempted
 * in a state that does not allow it.
 */
public class StompClientException extends StompException {

    /**
     * Constructs a new StompClientException with the specified message.
     *
     * @param message the detail message
     */
    public StompClientException(String message) {
        super(message);
    }

    /**
     * Constructs a new StompClientException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public StompClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
