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

import com.confhub.backend.StoreSession;
import com.confhub.datastore.Datastore;
import com.confhub.transport.TransportSession;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binding pairs one transport session with the backend store session opened for it.
 * <p>
 * The transport session is borrowed for the binding's lifetime. The store session is owned: the binding is
 * the only party allowed to close it, and closing it is idempotent.
 */
public class Binding {
    private final TransportSession transportSession;
    private final StoreSession storeSession;
    private final Datastore datastore;
    private final String identity;
    private final AtomicBoolean closed = new AtomicBoolean();

    Binding(TransportSession transportSession, StoreSession storeSession) {
        this.transportSession = transportSession;
        this.storeSession = storeSession;
        this.datastore = storeSession.getDatastore();
        this.identity = transportSession.getIdentity();
    }

    /**
     * Extracts the {@link Binding} attached to a transport session.
     *
     * @param session the transport session
     * @return the binding, or null if the session is not bound
     */
    public static Binding extractFromSession(TransportSession session) {
        Object attachment = session.getAttachment();
        if (attachment instanceof Binding binding) {
            return binding;
        }
        return null;
    }

    public TransportSession getTransportSession() {
        return transportSession;
    }

    public StoreSession getStoreSession() {
        return storeSession;
    }

    public Datastore getDatastore() {
        return datastore;
    }

    public String getIdentity() {
        return identity;
    }

    public long getSessionId() {
        return transportSession.getId();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the store session. Only the first call has an effect.
     *
     * @return true if this call closed the store session
     */
    boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        storeSession.close();
        return true;
    }

    @Override
    public String toString() {
        return String.format("Binding{session=%d, identity=%s, datastore=%s}", getSessionId(), identity, datastore);
    }
}
