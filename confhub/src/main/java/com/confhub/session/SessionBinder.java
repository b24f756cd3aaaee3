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

import com.confhub.backend.BackendService;
import com.confhub.backend.BackendUnavailableException;
import com.confhub.backend.StoreSession;
import com.confhub.datastore.DatastoreLockTable;
import com.confhub.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import static com.confhub.common.Preconditions.checkNotNull;

/**
 * SessionBinder creates and destroys {@link Binding}s.
 * <p>
 * {@link #unbind(Binding)} may run on a different thread than {@link #bind(TransportSession)}; ownership of
 * the store session moves to whichever thread tears the binding down.
 */
public class SessionBinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionBinder.class);
    private final BackendService backendService;
    private final DatastoreLockTable lockTable;

    public SessionBinder(BackendService backendService, DatastoreLockTable lockTable) {
        this.backendService = backendService;
        this.lockTable = lockTable;
    }

    /**
     * Opens a backend store session for the identity of {@code session} on the default datastore and attaches
     * the resulting binding to the session.
     *
     * @param session the accepted transport session
     * @return the new binding
     * @throws BackendUnavailableException if the backend cannot open a store session
     */
    public Binding bind(@Nonnull TransportSession session) {
        checkNotNull(session, "session cannot be null");
        StoreSession storeSession;
        try {
            storeSession = backendService.openSession(session.getIdentity());
        } catch (BackendUnavailableException e) {
            LOGGER.error("Unable to create a backend session for session {} (identity: {}, datastore: {}): {}",
                    session.getId(), session.getIdentity(), backendService.getDefaultDatastore(), e.getMessage());
            throw e;
        }
        Binding binding = new Binding(session, storeSession);
        session.setAttachment(binding);
        LOGGER.debug("Session {} bound to datastore {} as {}", session.getId(), binding.getDatastore(), binding.getIdentity());
        return binding;
    }

    /**
     * Closes the binding's store session and releases every datastore lock held by its transport session.
     * Unbinding an already unbound binding only repeats the lock release, which is a no-op.
     *
     * @param binding the binding to tear down
     */
    public void unbind(@Nonnull Binding binding) {
        checkNotNull(binding, "binding cannot be null");
        try {
            if (binding.close()) {
                LOGGER.debug("Backend session of session {} has been closed", binding.getSessionId());
            }
        } finally {
            // No lock may outlive its owner, even if closing the store session failed.
            lockTable.releaseAll(binding.getTransportSession());
            if (binding.getTransportSession().getAttachment() == binding) {
                binding.getTransportSession().setAttachment(null);
            }
        }
    }
}
