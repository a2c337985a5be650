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

/**
 * Netty-based TCP implementation of the STOMP client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.stompy.client.tcp.StompTcpClient}: the client; connection lifecycle,
 *       subscription and receipt bookkeeping, automatic ACKs</li>
 *   <li>{@link io.stompy.client.tcp.StompTcpClientBuilder}: fluent builder</li>
 *   <li>{@code StompConnection}: one Reactor Netty connection carrying whole frames</li>
 *   <li>{@code StompFrameDecoder}: splits the inbound byte stream into frames</li>
 * </ul>
 *
 * <h2>Wire Format</h2>
 * <p>{@code COMMAND\n(name:value\n)*\n<body>\0}. Blank lines between frames are heart-beats.
 * A {@code content-length} header makes the body binary safe; the encoder adds it whenever the
 * body is not empty.
 *
 * @see io.stompy.client.StompClient
 */
package io.stompy.client.tcp;
