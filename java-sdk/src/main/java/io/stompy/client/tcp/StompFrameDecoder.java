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

package io.stompy.client.tcp;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.stompy.frame.Frame;
import io.stompy.frame.FrameParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns the inbound byte stream of a connection into {@link Frame} objects.
 *
 * <p>Holds one {@link FrameParser} at a time and starts a fresh one after every completed frame,
 * so a single read may yield several frames and a frame may span any number of reads.
 */
class StompFrameDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(StompFrameDecoder.class);

    private FrameParser parser = new FrameParser();

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.isReadable()) {
            parser.process(in);
            if (!parser.isComplete()) {
                return;
            }
            Frame frame = parser.frame().orElseThrow();
            log.trace(
                    "Decoded {} frame, headers={}, body={} bytes",
                    frame.command(),
                    frame.headers(),
                    frame.bodyLength());
            out.add(frame);
            parser = new FrameParser();
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (parser.hasPartialFrame()) {
            log.warn("Connection ended in the middle of a frame (parser state {})", parser.state());
        }
    }
}
