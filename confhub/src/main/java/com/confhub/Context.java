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
import java.util.List;

/**
 * The Context interface represents the state shared by everything that runs in one epoch of a
 * Confhub instance. A new context is created on every (re)initialization.
 */
public interface Context {

    /**
     * Retrieves the sequence number of the epoch this context belongs to. The first epoch is 1.
     *
     * @return the epoch number
     */
    long getEpoch();

    /**
     * Retrieves the configuration loaded for this epoch.
     *
     * @return the configuration associated with the Context.
     */
    Config getConfig();

    /**
     * Retrieves the process-wide control state read by the accept and process loops.
     *
     * @return the process control
     */
    ProcessControl getProcessControl();

    /**
     * Retrieves the datastore lock table. The table outlives the epoch, it is reset at the start of every epoch.
     *
     * @return the datastore lock table
     */
    DatastoreLockTable getDatastoreLockTable();

    /**
     * Retrieves the registry of RPC handlers used by the protocol engine's dispatcher.
     *
     * @return the RPC handler registry
     */
    RpcHandlers getRpcHandlers();

    /**
     * Registers a service in the context. Services are shut down in reverse registration order.
     *
     * @param id      the unique identifier for the service
     * @param service the service to register
     */
    void registerService(@Nonnull String id, @Nonnull ConfhubService service);

    /**
     * Retrieves a service from the context using the specified service identifier.
     *
     * @param id  the unique identifier for the service
     * @param <T> the type of the service to retrieve
     * @return the service with the specified identifier, or null if it is not registered
     */
    <T> T getService(@Nonnull String id);

    /**
     * Retrieves the list of services registered in the context, in registration order.
     *
     * @return the list of services
     */
    List<ConfhubService> getServices();
}
