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

import com.confhub.backend.StoreSession;
import com.confhub.datastore.Datastore;

import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryStoreSession implements StoreSession {
    private final InMemoryBackendConnection connection;
    private final String identity;
    private final Datastore datastore;
    private final AtomicBoolean closed = new AtomicBoolean();

    InMemoryStoreSession(InMemoryBackendConnection connection, String identity, Datastore datastore) {
        this.connection = connection;
        this.identity = identity;
        this.datastore = datastore;
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public Datastore getDatastore() {
        return datastore;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            connection.sessionClosed(this);
        }
    }
}
