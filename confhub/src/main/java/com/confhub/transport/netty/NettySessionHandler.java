/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.confhub.transport.netty;

import com.confhub.common.ConfhubException;
import com.confhub.internal.JSONUtil;
import com.confhub.rpc.RpcError;
import com.confhub.rpc.RpcReply;
import com.confhub.rpc.RpcRequest;
import com.confhub.transport.SessionIdGenerator;
import com.confhub.transport.SessionStatus;
import com.confhub.transport.TerminationReason;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-channel handler. Performs the hello exchange, then decodes RPC frames and queues them on the
 * channel's {@link NettyTransportSession}. Requests are never executed on the event loop.
 */
public class NettySessionHandler extends SimpleChannelInboundHandler<String> {
    private static final Logger LOGGER = LoggerFactory.getLogger(NettySessionHandler.class);
    private final NettyProtocolEngine engine;

    public NettySessionHandler(NettyProtocolEngine engine) {
        this.engine = engine;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        NettyTransportSession session = new NettyTransportSession(SessionIdGenerator.next(), ctx.channel());
        ctx.channel().attr(ChannelAttributes.SESSION).set(session);
        engine.registerChannel(ctx.channel());
        session.sendHello(engine.getCapabilities());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        NettyTransportSession session = ctx.channel().attr(ChannelAttributes.SESSION).get();
        if (session != null) {
            session.dropped();
        }
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String frame) {
        NettyTransportSession session = ctx.channel().attr(ChannelAttributes.SESSION).get();
        if (session == null) {
            return;
        }
        if (session.getStatus() == SessionStatus.STARTING) {
            handleHello(session, frame);
        } else if (session.getStatus() == SessionStatus.RUNNING) {
            handleRequest(session, frame);
        }
    }

    private void handleHello(NettyTransportSession session, String frame) {
        String username = null;
        try {
            JsonNode hello = JSONUtil.readTree(frame).path("hello");
            username = hello.path("username").asText(null);
        } catch (ConfhubException e) {
            LOGGER.debug("Session {} sent an unparsable hello", session.getId(), e);
        }
        if (username == null || username.isBlank()) {
            LOGGER.warn("Session {} failed the hello exchange", session.getId());
            session.close(TerminationReason.BAD_HELLO);
            return;
        }
        session.established(username);
        LOGGER.debug("Session {} established for {}", session.getId(), username);
        engine.sessionEstablished(session);
    }

    private void handleRequest(NettyTransportSession session, String frame) {
        RpcRequest request;
        try {
            request = JSONUtil.readValue(frame, RpcRequest.class);
        } catch (ConfhubException e) {
            session.send(RpcReply.error(null, new RpcError(RpcError.MALFORMED_MESSAGE, "unparsable RPC", null)));
            return;
        }
        if (request.getOperation() == null || request.getOperation().isBlank()) {
            session.send(RpcReply.error(request.getMessageId(),
                    new RpcError(RpcError.MALFORMED_MESSAGE, "operation is missing", null)));
            return;
        }
        session.deliver(request);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.debug("Closing channel {} after an exception", ctx.channel(), cause);
        ctx.close();
    }
}
