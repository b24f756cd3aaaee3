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

import com.confhub.BaseTest;
import com.confhub.backend.BackendConnection;
import com.confhub.backend.BackendUnavailableException;
import com.confhub.backend.StoreSession;
import com.confhub.datastore.Datastore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBackendEngineTest extends BaseTest {

    @Test
    void test_openSession() {
        InMemoryBackendEngine engine = new InMemoryBackendEngine();
        InMemoryBackendConnection connection = (InMemoryBackendConnection) engine.connect(loadConfig("test.conf"));

        StoreSession session = connection.openSession("admin", Datastore.RUNNING);
        assertEquals("admin", session.getIdentity());
        assertEquals(Datastore.RUNNING, session.getDatastore());
        assertFalse(session.isClosed());
        assertEquals(1, connection.openSessionCount());
    }

    @Test
    void test_close_is_idempotent() {
        InMemoryBackendEngine engine = new InMemoryBackendEngine();
        InMemoryBackendConnection connection = (InMemoryBackendConnection) engine.connect(loadConfig("test.conf"));

        StoreSession session = connection.openSession("admin", Datastore.RUNNING);
        session.close();
        session.close();
        assertTrue(session.isClosed());
        assertEquals(0, connection.openSessionCount());
    }

    @Test
    void test_connect_when_unavailable() {
        InMemoryBackendEngine engine = new InMemoryBackendEngine();
        engine.setAvailable(false);
        assertThrows(BackendUnavailableException.class, () -> engine.connect(loadConfig("test.conf")));
    }

    @Test
    void test_openSession_when_unavailable() {
        InMemoryBackendEngine engine = new InMemoryBackendEngine();
        BackendConnection connection = engine.connect(loadConfig("test.conf"));
        engine.setAvailable(false);
        assertThrows(BackendUnavailableException.class, () -> connection.openSession("admin", Datastore.RUNNING));
    }

    @Test
    void test_openSession_with_blank_identity() {
        BackendConnection connection = new InMemoryBackendEngine().connect(loadConfig("test.conf"));
        assertThrows(BackendUnavailableException.class, () -> connection.openSession(" ", Datastore.RUNNING));
        assertThrows(BackendUnavailableException.class, () -> connection.openSession(null, Datastore.RUNNING));
    }

    @Test
    void test_user_allow_list() {
        BackendConnection connection = new InMemoryBackendEngine()
                .connect(loadConfig("test.conf", "backend.users", List.of("alice")));

        assertNotNull(connection.openSession("alice", Datastore.CANDIDATE));
        assertThrows(BackendUnavailableException.class, () -> connection.openSession("mallory", Datastore.CANDIDATE));
    }

    @Test
    void test_disconnect_closes_open_sessions() {
        InMemoryBackendConnection connection = (InMemoryBackendConnection) new InMemoryBackendEngine()
                .connect(loadConfig("test.conf"));
        StoreSession first = connection.openSession("alice", Datastore.RUNNING);
        StoreSession second = connection.openSession("bob", Datastore.RUNNING);

        connection.disconnect();

        assertFalse(connection.isConnected());
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        assertEquals(0, connection.openSessionCount());
        assertThrows(BackendUnavailableException.class, () -> connection.openSession("alice", Datastore.RUNNING));
    }
}
