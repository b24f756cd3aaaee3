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

import com.confhub.rpc.RpcDispatcher;
import com.confhub.rpc.RpcRequest;
import com.confhub.rpc.RpcResponse;
import com.confhub.transport.PollResult;
import com.confhub.transport.PollSet;
import com.confhub.transport.SessionStatus;
import com.confhub.transport.TerminationReason;
import com.confhub.transport.TransportSession;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Poll set over {@link NettyTransportSession}s. Member sessions announce ready requests and terminations
 * through a shared event queue; {@link #poll(Duration)} consumes one event at a time and dispatches at most
 * one request per call.
 */
public class NettyPollSet implements PollSet {
    private final RpcDispatcher dispatcher;
    private final Set<NettyTransportSession> members = ConcurrentHashMap.newKeySet();
    private final LinkedBlockingQueue<Event> events = new LinkedBlockingQueue<>();

    NettyPollSet(RpcDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void add(TransportSession session) {
        if (!(session instanceof NettyTransportSession nettySession)) {
            throw new IllegalArgumentException("session does not belong to the Netty protocol engine");
        }
        members.add(nettySession);
        nettySession.attach(this);
    }

    @Override
    public void remove(TransportSession session) {
        if (session instanceof NettyTransportSession nettySession) {
            members.remove(nettySession);
            nettySession.detach(this);
        }
    }

    @Override
    public int size() {
        return members.size();
    }

    void requestReady(NettyTransportSession session) {
        events.offer(new Event(EventKind.REQUEST, session));
    }

    void sessionGone(NettyTransportSession session) {
        events.offer(new Event(EventKind.GONE, session));
    }

    @Override
    public PollResult poll(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Event event;
            try {
                event = events.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PollResult.TIMEOUT;
            }
            if (event == null) {
                return PollResult.TIMEOUT;
            }

            NettyTransportSession session = event.session();
            if (!members.contains(session)) {
                // Stale event of a session that has already been removed.
                continue;
            }
            if (event.kind() == EventKind.GONE || session.getStatus() != SessionStatus.RUNNING) {
                return PollResult.sessionGone(session);
            }

            RpcRequest request = session.nextRequest();
            if (request == null) {
                continue;
            }
            RpcResponse response = dispatcher.dispatch(session, request);
            session.send(response.getReply());
            if (response.isCloseSession()) {
                session.close(TerminationReason.CLOSED);
            }
            if (session.getStatus() != SessionStatus.RUNNING) {
                return PollResult.sessionGone(session);
            }
            return PollResult.activity(session);
        }
    }

    private enum EventKind {
        REQUEST,
        GONE
    }

    private record Event(EventKind kind, NettyTransportSession session) {
    }
}
