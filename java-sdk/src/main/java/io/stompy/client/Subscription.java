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

import java.util.Optional;

/**
 * An active subscription registered with a client.
 */
public final class Subscription {

    private final StompClient client;
    private final String id;
    private final String destination;
    private final AckMode ackMode;
    private final boolean autoAck;

    public Subscription(StompClient client, String id, String destination, AckMode ackMode, boolean autoAck) {
        this.client = client;
        this.id = id;
        this.destination = destination;
        this.ackMode = ackMode;
        this.autoAck = autoAck;
    }

    public String id() {
        return id;
    }

    public String destination() {
        return destination;
    }

    public AckMode ackMode() {
        return ackMode;
    }

    /**
     * Returns whether the client acknowledges messages of this subscription on the caller's behalf.
     *
     * @return true if ACKs are sent automatically
     */
    public boolean autoAck() {
        return autoAck;
    }

    /**
     * Unsubscribes through the owning client.
     *
     * @return the UNSUBSCRIBE receipt, empty if the subscription was already gone
     */
    public Optional<ReceiptFuture> cancel() {
        return client.unsubscribe(id);
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", destination=" + destination + ", ack=" + ackMode.getValue()
                + ", autoAck=" + autoAck + "}";
    }
}
