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

package com.confhub;

import com.confhub.datastore.DatastoreLockTable;
import com.confhub.rpc.RpcHandlers;
import com.typesafe.config.Config;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * The ContextImpl class represents the implementation of the Context interface in the Confhub server.
 */
public class ContextImpl implements Context {
    private final long epoch;
    private final Config config;
    private final ProcessControl processControl;
    private final DatastoreLockTable datastoreLockTable;
    private final RpcHandlers rpcHandlers = new RpcHandlers();
    private final LinkedHashMap<String, ConfhubService> services = new LinkedHashMap<>();

    public ContextImpl(long epoch, Config config, ProcessControl processControl, DatastoreLockTable datastoreLockTable) {
        for (String path : new String[]{"server.name", "transport", "coordinator", "backend"}) {
            if (!config.hasPath(path)) {
                throw new MissingConfigException(String.format("%s is missing in configuration", path));
            }
        }
        this.epoch = epoch;
        this.config = config;
        this.processControl = processControl;
        this.datastoreLockTable = datastoreLockTable;
    }

    @Override
    public long getEpoch() {
        return epoch;
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public ProcessControl getProcessControl() {
        return processControl;
    }

    @Override
    public DatastoreLockTable getDatastoreLockTable() {
        return datastoreLockTable;
    }

    @Override
    public RpcHandlers getRpcHandlers() {
        return rpcHandlers;
    }

    @Override
    public synchronized void registerService(@Nonnull String id, @Nonnull ConfhubService service) {
        // Registration sort is important, this is why we use LinkedHashMap to store services.
        services.putIfAbsent(id, service);
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized <T> T getService(@Nonnull String id) {
        return (T) services.get(id);
    }

    @Override
    public synchronized List<ConfhubService> getServices() {
        return new ArrayList<>(services.values());
    }
}
