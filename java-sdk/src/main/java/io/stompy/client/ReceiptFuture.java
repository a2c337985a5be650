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

package io.stompy.client;

import io.stompy.exception.StompClientException;
import io.stompy.exception.StompException;
import io.stompy.exception.StompTimeoutException;
import io.stompy.frame.Frame;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a broker receipt that has been requested but may not have arrived yet.
 *
 * <p>The future is resolved exactly once: with the RECEIPT frame when it is received, or with a
 * failure when the connection closes first. Any number of threads may wait on it.
 */
public final class ReceiptFuture {

    private final String receiptId;
    private final CompletableFuture<Frame> future = new CompletableFuture<>();

    public ReceiptFuture(String receiptId) {
        this.receiptId = receiptId;
    }

    public String receiptId() {
        return receiptId;
    }

    /**
     * Resolves the future with the RECEIPT frame.
     *
     * @param receipt the RECEIPT frame
     * @return true if this call resolved the future
     */
    public boolean complete(Frame receipt) {
        return future.complete(receipt);
    }

    /**
     * Fails the future, waking every waiter with the given exception.
     *
     * @param cause the failure
     * @return true if this call resolved the future
     */
    public boolean fail(StompException cause) {
        return future.completeExceptionally(cause);
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Waits until the receipt arrives or the connection closes.
     *
     * @return the RECEIPT frame
     */
    public Frame await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StompClientException("Interrupted while waiting for receipt " + receiptId, e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Waits at most {@code timeout} for the receipt.
     *
     * @param timeout the maximum time to wait
     * @return the RECEIPT frame
     * @throws StompTimeoutException if the receipt did not arrive in time
     */
    public Frame await(Duration timeout) {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StompClientException("Interrupted while waiting for receipt " + receiptId, e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (TimeoutException e) {
            throw new StompTimeoutException("receipt " + receiptId, timeout);
        }
    }

    /**
     * Returns a view of this receipt for composition; completing the view does not resolve
     * the receipt.
     *
     * @return a dependent future
     */
    public CompletableFuture<Frame> toCompletableFuture() {
        return future.copy();
    }

    private RuntimeException unwrap(ExecutionException e) {
        if (e.getCause() instanceof StompException) {
            return (StompException) e.getCause();
        }
        return new StompClientException("Receipt " + receiptId + " failed", e.getCause());
    }

    @Override
    public String toString() {
        return "ReceiptFuture{" + receiptId + (isDone() ? ", done" : "") + "}";
    }
}
