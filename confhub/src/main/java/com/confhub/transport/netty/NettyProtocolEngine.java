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

import com.confhub.Context;
import com.confhub.InitializationException;
import com.confhub.rpc.RpcDispatcher;
import com.confhub.transport.PollSet;
import com.confhub.transport.ProtocolEngine;
import com.confhub.transport.TerminationReason;
import com.confhub.transport.TransportSession;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Reference protocol engine: JSON messages over TCP, framed by the NETCONF 1.0 end-of-message marker.
 * <p>
 * Sessions that complete the hello exchange are queued until {@link #accept(Duration)} picks them up.
 * RPCs are decoded on the Netty event loop and executed on the thread polling a {@link NettyPollSet}.
 */
public class NettyProtocolEngine implements ProtocolEngine {
    public static final String DELIMITER = "]]>]]>";
    public static final List<String> CAPABILITIES = List.of(
            "urn:ietf:params:netconf:base:1.0",
            "urn:ietf:params:netconf:capability:candidate:1.0",
            "urn:ietf:params:netconf:capability:startup:1.0"
    );
    private static final Logger LOGGER = LoggerFactory.getLogger(NettyProtocolEngine.class);
    private final Context context;
    private final RpcDispatcher dispatcher;
    private final EventLoopGroup parentGroup;
    private final EventLoopGroup childGroup;
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final LinkedBlockingQueue<NettyTransportSession> established = new LinkedBlockingQueue<>();
    private volatile Channel serverChannel;
    private volatile boolean shutdown;

    public NettyProtocolEngine(Context context, RpcDispatcher dispatcher) {
        this.context = context;
        this.dispatcher = dispatcher;
        this.parentGroup = new NioEventLoopGroup(1, new ThreadFactoryBuilder()
                .setNameFormat("confhub-transport-boss-" + context.getEpoch() + "-%d").build());
        this.childGroup = new NioEventLoopGroup(0, new ThreadFactoryBuilder()
                .setNameFormat("confhub-transport-worker-" + context.getEpoch() + "-%d").build());
    }

    @Override
    public void start() {
        Config config = context.getConfig();
        String host = config.getString("transport.host");
        int port = config.getInt("transport.port");
        int maxFrameLength = config.getInt("transport.max_frame_length");

        ServerBootstrap b = new ServerBootstrap();
        b.group(parentGroup, childGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    public void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new DelimiterBasedFrameDecoder(maxFrameLength,
                                Unpooled.wrappedBuffer(DELIMITER.getBytes(StandardCharsets.UTF_8))));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new NettySessionHandler(NettyProtocolEngine.this));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 1 << 9)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationException("Interrupted while binding the transport", e);
        } catch (Exception e) {
            throw new InitializationException(String.format("Failed to listen on %s:%d", host, port), e);
        }
        LOGGER.info("Listening for clients on {}", serverChannel.localAddress());
    }

    /**
     * Returns the address the engine listens on, useful when {@code transport.port} is 0.
     *
     * @return the bound address, or null if the engine has not started
     */
    public InetSocketAddress getBoundAddress() {
        Channel channel = serverChannel;
        if (channel == null) {
            return null;
        }
        return (InetSocketAddress) channel.localAddress();
    }

    List<String> getCapabilities() {
        return CAPABILITIES;
    }

    void registerChannel(Channel channel) {
        channels.add(channel);
    }

    void sessionEstablished(NettyTransportSession session) {
        if (shutdown) {
            session.close(TerminationReason.OTHER);
            return;
        }
        established.offer(session);
    }

    @Override
    public TransportSession accept(Duration timeout) {
        try {
            return established.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @Override
    public PollSet newPollSet() {
        return new NettyPollSet(dispatcher);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Context getContext() {
        return context;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        NettyTransportSession pending;
        while ((pending = established.poll()) != null) {
            pending.close(TerminationReason.OTHER);
        }
        channels.close().awaitUninterruptibly();
        childGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        parentGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
