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

import com.confhub.ConfhubService;
import com.confhub.Context;
import com.confhub.InitializationException;
import com.confhub.datastore.Datastore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BackendService owns the epoch's connection to the backend configuration-store engine. The connection is
 * established in the constructor and never replaced afterwards.
 */
public class BackendService implements ConfhubService {
    public static final String NAME = "Backend";
    private static final Logger LOGGER = LoggerFactory.getLogger(BackendService.class);
    private final Context context;
    private final BackendConnection connection;
    private final Datastore defaultDatastore;

    public BackendService(Context context, BackendEngine engine) {
        this.context = context;
        try {
            this.defaultDatastore = Datastore.fromName(context.getConfig().getString("backend.default_datastore"));
        } catch (IllegalArgumentException e) {
            throw new InitializationException("Invalid backend.default_datastore", e);
        }
        try {
            this.connection = engine.connect(context.getConfig());
        } catch (BackendUnavailableException e) {
            throw new InitializationException("Unable to connect to the backend", e);
        }
        LOGGER.info("Connected to the backend, default datastore is {}", defaultDatastore);
    }

    /**
     * Opens a store session for {@code identity} on the default datastore.
     *
     * @param identity the client identity
     * @return an open store session
     * @throws BackendUnavailableException if the backend cannot open the session
     */
    public StoreSession openSession(String identity) {
        return connection.openSession(identity, defaultDatastore);
    }

    public Datastore getDefaultDatastore() {
        return defaultDatastore;
    }

    public BackendConnection getConnection() {
        return connection;
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
        connection.disconnect();
        LOGGER.info("Disconnected from the backend");
    }
}
