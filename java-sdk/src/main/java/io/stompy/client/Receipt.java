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

import io.stompy.exception.StompInvalidArgumentException;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Whether a frame should carry a {@code receipt} header: not at all, with an id the client
 * generates, or with an explicit id chosen by the caller.
 */
public final class Receipt {

    private static final Receipt NONE = new Receipt(false, null);
    private static final Receipt AUTO = new Receipt(true, null);

    private final boolean requested;
    private final String id;

    private Receipt(boolean requested, String id) {
        this.requested = requested;
        this.id = id;
    }

    public static Receipt none() {
        return NONE;
    }

    public static Receipt auto() {
        return AUTO;
    }

    public static Receipt of(String id) {
        if (StringUtils.isBlank(id)) {
            throw new StompInvalidArgumentException("Receipt id cannot be blank");
        }
        return new Receipt(true, id);
    }

    public boolean isRequested() {
        return requested;
    }

    /**
     * Returns the caller-chosen id.
     *
     * @return the explicit id, or empty when none was given
     */
    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    @Override
    public String toString() {
        if (!requested) {
            return "Receipt{none}";
        }
        return id == null ? "Receipt{auto}" : "Receipt{" + id + "}";
    }
}
