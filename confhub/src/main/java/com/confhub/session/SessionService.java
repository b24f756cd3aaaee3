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

package com.confhub.session;

import com.confhub.ConfhubService;
import com.confhub.Context;
import com.confhub.backend.BackendService;
import com.confhub.backend.BackendUnavailableException;
import com.confhub.datastore.DatastoreLockTable;
import com.confhub.rpc.RpcHandlers;
import com.confhub.rpc.handlers.CloseSessionHandler;
import com.confhub.rpc.handlers.GetLocksHandler;
import com.confhub.rpc.handlers.KillSessionHandler;
import com.confhub.rpc.handlers.LockHandler;
import com.confhub.rpc.handlers.UnlockHandler;
import com.confhub.transport.ProtocolEngine;
import com.confhub.transport.TerminationReason;
import com.confhub.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SessionService wires session binding and the session registry of an epoch, and registers the RPC handlers
 * that work on session state: datastore locking and session termination.
 */
public class SessionService implements ConfhubService {
    public static final String NAME = "Session";
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionService.class);
    private final Context context;
    private final SessionBinder binder;
    private final SessionRegistry registry;

    public SessionService(Context context, ProtocolEngine engine, BackendService backendService) {
        this.context = context;

        DatastoreLockTable lockTable = context.getDatastoreLockTable();
        this.binder = new SessionBinder(backendService, lockTable);
        this.registry = new SessionRegistry(engine.newPollSet(), binder);

        RpcHandlers handlers = context.getRpcHandlers();
        handlers.register(LockHandler.OPERATION, new LockHandler(lockTable));
        handlers.register(UnlockHandler.OPERATION, new UnlockHandler(lockTable));
        handlers.register(GetLocksHandler.OPERATION, new GetLocksHandler(lockTable));
        handlers.register(CloseSessionHandler.OPERATION, new CloseSessionHandler());
        handlers.register(KillSessionHandler.OPERATION, new KillSessionHandler(this::getRegistry));
    }

    /**
     * Binds a newly accepted transport session and admits it to the registry.
     * <p>
     * If the backend refuses the store session, the transport session is closed and never admitted. If
     * admission fails after the binding has been created, the binding is torn down before the error propagates.
     *
     * @param session the accepted transport session
     * @return the binding of the admitted session
     * @throws BackendUnavailableException if no store session could be opened
     */
    public Binding admit(TransportSession session) {
        Binding binding;
        try {
            binding = binder.bind(session);
        } catch (BackendUnavailableException e) {
            LOGGER.error("Terminating session {} due to failure when connecting to the backend", session.getId());
            session.close(TerminationReason.OTHER);
            throw e;
        }

        boolean admitted = false;
        try {
            registry.add(binding);
            admitted = true;
            return binding;
        } finally {
            if (!admitted) {
                binder.unbind(binding);
                session.close(TerminationReason.OTHER);
            }
        }
    }

    public SessionBinder getBinder() {
        return binder;
    }

    public SessionRegistry getRegistry() {
        return registry;
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
        // The process loop drains on exit, this covers epochs that never started it.
        registry.drain();
    }
}
