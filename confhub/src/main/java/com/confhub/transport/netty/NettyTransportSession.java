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

import com.confhub.internal.JSONUtil;
import com.confhub.rpc.RpcReply;
import com.confhub.rpc.RpcRequest;
import com.confhub.transport.SessionStatus;
import com.confhub.transport.TerminationReason;
import com.confhub.transport.TransportSession;
import io.netty.channel.Channel;

import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A transport session carried by one Netty channel.
 * <p>
 * Requests decoded on the event loop are queued here and announced to the poll set the session belongs to.
 * Queueing and attaching to a poll set are serialized on the session's monitor, so a request that arrives
 * before the session is admitted is announced on admission instead of being lost.
 */
public class NettyTransportSession implements TransportSession {
    private final long id;
    private final Channel channel;
    private final ConcurrentLinkedQueue<RpcRequest> requests = new ConcurrentLinkedQueue<>();
    private volatile String identity;
    private volatile SessionStatus status = SessionStatus.STARTING;
    private volatile TerminationReason terminationReason;
    private volatile Object attachment;
    private NettyPollSet pollSet;

    NettyTransportSession(long id, Channel channel) {
        this.id = id;
        this.channel = channel;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public SessionStatus getStatus() {
        return status;
    }

    @Override
    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    @Override
    public void setAttachment(Object attachment) {
        this.attachment = attachment;
    }

    @Override
    public Object getAttachment() {
        return attachment;
    }

    @Override
    public void close(TerminationReason reason) {
        terminate(reason, true);
    }

    synchronized void established(String identity) {
        this.identity = identity;
        this.status = SessionStatus.RUNNING;
    }

    /**
     * Called on the event loop when the channel has become inactive.
     */
    void dropped() {
        terminate(TerminationReason.DROPPED, false);
    }

    private void terminate(TerminationReason reason, boolean closeChannel) {
        NettyPollSet owner;
        synchronized (this) {
            if (status == SessionStatus.INVALID) {
                return;
            }
            status = SessionStatus.INVALID;
            terminationReason = reason;
            owner = pollSet;
        }
        if (closeChannel) {
            channel.close();
        }
        if (owner != null) {
            owner.sessionGone(this);
        }
    }

    void deliver(RpcRequest request) {
        synchronized (this) {
            requests.add(request);
            if (pollSet != null) {
                pollSet.requestReady(this);
            }
        }
    }

    RpcRequest nextRequest() {
        return requests.poll();
    }

    synchronized void attach(NettyPollSet set) {
        pollSet = set;
        for (int i = 0; i < requests.size(); i++) {
            set.requestReady(this);
        }
        if (status != SessionStatus.RUNNING) {
            set.sessionGone(this);
        }
    }

    synchronized void detach(NettyPollSet set) {
        if (pollSet == set) {
            pollSet = null;
        }
    }

    void send(RpcReply reply) {
        write(reply);
    }

    void write(Object message) {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(JSONUtil.writeValueAsString(message) + NettyProtocolEngine.DELIMITER);
    }

    void sendHello(Iterable<String> capabilities) {
        write(Map.of("hello", Map.of("session-id", id, "capabilities", capabilities)));
    }
}
