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

import com.confhub.backend.BackendService;
import com.confhub.backend.inmemory.InMemoryBackendConnection;
import com.confhub.backend.inmemory.InMemoryBackendEngine;
import com.confhub.datastore.DatastoreLockTable;
import com.confhub.rpc.RpcDispatcher;
import com.confhub.session.Binding;
import com.confhub.session.SessionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Wires a session service of one epoch on top of the in-memory backend and the fake protocol engine.
 */
public class BaseSessionTest extends BaseTest {
    protected ContextImpl context;
    protected InMemoryBackendEngine backendEngine;
    protected BackendService backendService;
    protected FakeProtocolEngine engine;
    protected SessionService sessionService;
    protected RpcDispatcher dispatcher;

    @BeforeEach
    public void setupSessionService() {
        context = newContext();
        backendEngine = new InMemoryBackendEngine();
        backendService = new BackendService(context, backendEngine);
        dispatcher = new RpcDispatcher(context.getRpcHandlers());
        engine = new FakeProtocolEngine(context, dispatcher);
        sessionService = new SessionService(context, engine, backendService);
    }

    @AfterEach
    public void tearDownSessionService() {
        sessionService.shutdown();
        engine.shutdown();
        backendService.shutdown();
    }

    protected DatastoreLockTable lockTable() {
        return context.getDatastoreLockTable();
    }

    protected FakePollSet pollSet() {
        return engine.getPollSet();
    }

    protected InMemoryBackendConnection backendConnection() {
        return (InMemoryBackendConnection) backendService.getConnection();
    }

    protected Binding admit(String identity) {
        return sessionService.admit(new FakeTransportSession(identity));
    }
}
