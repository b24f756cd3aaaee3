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

package com.confhub.transport;

import com.confhub.ConfhubService;

import java.time.Duration;

/**
 * ProtocolEngine is the protocol side of the server: it listens for clients, negotiates sessions and
 * parses and serializes protocol messages. One engine instance lives for exactly one epoch.
 */
public interface ProtocolEngine extends ConfhubService {
    String NAME = "Transport";

    /**
     * Starts the engine, e.g. binds the listening endpoints.
     *
     * @throws com.confhub.InitializationException if the engine cannot start
     */
    void start();

    /**
     * Waits up to {@code timeout} for a new session to complete its handshake.
     *
     * @param timeout the maximum time to wait
     * @return the accepted session, or null if none arrived in time
     */
    TransportSession accept(Duration timeout);

    /**
     * Creates a new, empty poll set. Requests received on its members are dispatched through the
     * engine's {@link com.confhub.rpc.RpcDispatcher}.
     *
     * @return a new poll set
     */
    PollSet newPollSet();
}
