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
 * Exception thrown when an operation is attempted on a transaction that was already
 * committed or aborted.
 */
public class StompTransactionClosedException extends StompClientException {

    private final String transactionId;

    /**
     * Constructs a new StompTransactionClosedException.
     *
     * @param transactionId the id of the closed transaction
     */
    public StompTransactionClosedException(String transactionId) {
        super("Transaction " + transactionId + " already closed");
        this.transactionId = transactionId;
    }

    /**
     * Returns the id of the closed transaction.
     *
     * @return the transaction id
     */
    public String getTransactionId() {
        return transactionId;
    }
}
