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
import com.confhub.backend.BackendEngine;
import com.confhub.backend.BackendUnavailableException;
import com.typesafe.config.Config;

import java.util.HashSet;
import java.util.Set;

/**
 * InMemoryBackendEngine is a process-local backend. It knows the identities listed under
 * {@code backend.users}; an empty list admits every identity.
 * <p>
 * The engine can be switched off with {@link #setAvailable(boolean)}: while unavailable, new connections and
 * new store sessions are refused.
 */
public class InMemoryBackendEngine implements BackendEngine {
    private volatile boolean available = true;

    @Override
    public BackendConnection connect(Config config) {
        if (!available) {
            throw new BackendUnavailableException("backend is not available");
        }
        Set<String> users = new HashSet<>();
        if (config.hasPath("backend.users")) {
            users.addAll(config.getStringList("backend.users"));
        }
        return new InMemoryBackendConnection(this, users);
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}
