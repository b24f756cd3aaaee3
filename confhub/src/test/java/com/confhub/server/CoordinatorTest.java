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

package com.confhub.server;

import com.confhub.BaseSessionTest;
import com.confhub.ControlState;
import com.confhub.FakeTransportSession;
import com.confhub.datastore.Datastore;
import com.confhub.session.Binding;
import com.confhub.transport.SessionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class CoordinatorTest extends BaseSessionTest {

    private Thread startEpoch() {
        Coordinator coordinator = new Coordinator(context, engine, sessionService);
        Thread thread = new Thread(coordinator::runEpoch, "coordinator-test");
        thread.start();
        return thread;
    }

    @Test
    void test_stop_with_connected_sessions() throws InterruptedException {
        Thread thread = startEpoch();

        List<FakeTransportSession> sessions = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            FakeTransportSession session = new FakeTransportSession("user-" + i);
            sessions.add(session);
            engine.connect(session);
        }
        await().atMost(Duration.ofSeconds(5)).until(() -> sessionService.getRegistry().activeCount() == 3);
        List<Binding> bindings = sessionService.getRegistry().bindings();
        for (int i = 0; i < 3; i++) {
            assertTrue(lockTable().tryAcquire(Datastore.values()[i], sessions.get(i)));
        }

        context.getProcessControl().requestStop();
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(thread.isAlive());
        assertEquals(0, sessionService.getRegistry().activeCount());
        assertThat(lockTable().snapshot()).isEmpty();
        assertEquals(0, backendConnection().openSessionCount());
        for (Binding binding : bindings) {
            assertTrue(binding.getStoreSession().isClosed());
        }
        for (FakeTransportSession session : sessions) {
            assertEquals(SessionStatus.INVALID, session.getStatus());
        }
    }

    @Test
    void test_restart_request_ends_the_epoch() throws InterruptedException {
        Thread thread = startEpoch();
        engine.connect(new FakeTransportSession("alice"));
        await().atMost(Duration.ofSeconds(5)).until(() -> sessionService.getRegistry().activeCount() == 1);

        context.getProcessControl().requestRestart();
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(thread.isAlive());
        assertEquals(ControlState.RESTART, context.getProcessControl().get());
        assertEquals(0, sessionService.getRegistry().activeCount());
    }

    @Test
    void test_process_loop_thread_is_named_after_the_epoch() throws InterruptedException {
        Thread thread = startEpoch();

        await().atMost(Duration.ofSeconds(5)).until(() -> Thread.getAllStackTraces().keySet().stream()
                .anyMatch(t -> t.getName().startsWith("confhub-process-loop-" + context.getEpoch() + "-")));

        context.getProcessControl().requestStop();
        thread.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(thread.isAlive());
    }
}
