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

package com.confhub.backend.inmemory;

import com.confhub.backend.BackendConnection;
import com.confhub.backend.BackendUnavailableException;
import com.confhub.backend.StoreSession;
import com.confhub.datastore.Datastore;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.confhub.common.Preconditions.checkNotNull;

public class InMemoryBackendConnection implements BackendConnection {
    private final InMemoryBackendEngine engine;
    private final Set<String> users;
    private final Set<InMemoryStoreSession> openSessions = ConcurrentHashMap.newKeySet();
    private volatile boolean connected = true;

    InMemoryBackendConnection(InMemoryBackendEngine engine, Set<String> users) {
        this.engine = engine;
        this.users = Set.copyOf(users);
    }

    @Override
    public StoreSession openSession(String identity, Datastore datastore) {
        checkNotNull(datastore, "datastore cannot be null");
        if (!connected || !engine.isAvailable()) {
            throw new BackendUnavailableException("connection to the backend is lost");
        }
        if (identity == null || identity.isBlank()) {
            throw new BackendUnavailableException("identity cannot be empty");
        }
        if (!users.isEmpty() && !users.contains(identity)) {
            throw new BackendUnavailableException(String.format("unknown user '%s'", identity));
        }
        InMemoryStoreSession session = new InMemoryStoreSession(this, identity, datastore);
        openSessions.add(session);
        return session;
    }

    void sessionClosed(InMemoryStoreSession session) {
        openSessions.remove(session);
    }

    /**
     * Retrieves the number of store sessions opened through this connection and not closed yet.
     *
     * @return the number of open store sessions
     */
    public int openSessionCount() {
        return openSessions.size();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
        for (InMemoryStoreSession session : openSessions) {
            session.close();
        }
    }
}
