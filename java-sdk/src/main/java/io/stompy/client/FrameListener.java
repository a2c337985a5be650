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

import io.stompy.frame.Frame;

/**
 * Callback invoked by {@link StompClient#loop()} for every delivered frame.
 */
@FunctionalInterface
public interface FrameListener {

    /**
     * Handles a frame delivered by the broker.
     *
     * @param client the client that received the frame
     * @param frame the frame
     * @return {@link DispatchResult#STOP} to end the loop on this frame, skipping later callbacks
     */
    DispatchResult onFrame(StompClient client, Frame frame);
}
