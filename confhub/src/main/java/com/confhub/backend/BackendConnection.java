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

package com.confhub.backend;

import com.confhub.datastore.Datastore;

/**
 * A connection to the backend configuration-store engine. The connection is created once per epoch and
 * shared read-only by both loops afterwards, implementations must be safe for concurrent use.
 */
public interface BackendConnection {

    /**
     * Opens a store session scoped to {@code identity} on {@code datastore}.
     *
     * @param identity  the client identity
     * @param datastore the target datastore
     * @return an open store session
     * @throws BackendUnavailableException if the backend cannot open the session
     */
    StoreSession openSession(String identity, Datastore datastore);

    boolean isConnected();

    /**
     * Disconnects from the backend. Store sessions opened through this connection are closed.
     */
    void disconnect();
}
