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

package io.stompy.config;

import io.stompy.exception.StompInvalidArgumentException;

import java.time.Duration;

/**
 * How many extra rounds over the broker address list a client makes when every address of a
 * round failed, and how long it sleeps between rounds.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {
        if (maxRetries < 0) {
            throw new StompInvalidArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new StompInvalidArgumentException("Retry delays cannot be negative");
        }
        if (multiplier < 1.0) {
            throw new StompInvalidArgumentException("Backoff multiplier must be at least 1.0: " + multiplier);
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    /**
     * Exponential backoff between rounds with the default parameters.
     *
     * <p>Defaults:
     * <ul>
     *   <li>Retry rounds: 3</li>
     *   <li>First delay: 100ms</li>
     *   <li>Delay cap: 5s</li>
     *   <li>Multiplier: 2.0</li>
     * </ul>
     *
     * @return the default backoff policy
     */
    public static RetryPolicy exponentialBackoff() {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }

    /**
     * Exponential backoff between rounds with custom parameters.
     *
     * @param maxRetries   extra rounds after the first one, not negative
     * @param initialDelay sleep before the first retry round
     * @param maxDelay     upper bound on any sleep
     * @param multiplier   growth factor per round, at least 1.0
     * @return the backoff policy
     */
    public static RetryPolicy exponentialBackoff(
            int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier);
    }

    /**
     * The same sleep before every retry round.
     *
     * @param maxRetries extra rounds after the first one, not negative
     * @param delay      sleep before each retry round
     * @return the fixed delay policy
     */
    public static RetryPolicy fixedDelay(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, delay, 1.0);
    }

    /**
     * A single round over the address list. This is the builder default.
     *
     * @return a policy that never retries
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Gets the number of retry rounds after the first round.
     *
     * @return the maximum number of retries
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Gets the sleep before the first retry round.
     *
     * @return the initial delay
     */
    public Duration getInitialDelay() {
        return initialDelay;
    }

    /**
     * Gets the cap applied to every computed sleep.
     *
     * @return the maximum delay
     */
    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * Gets the factor the sleep grows by from one round to the next.
     *
     * @return the backoff multiplier
     */
    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Computes the sleep before the given retry round.
     *
     * @param retry the 1-based retry number
     * @return {@code min(initialDelay * multiplier^(retry - 1), maxDelay)}
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier + "}";
    }
}
