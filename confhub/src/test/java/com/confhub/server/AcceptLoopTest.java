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
import com.confhub.FakeTransportSession;
import com.confhub.session.Binding;
import com.confhub.transport.SessionStatus;
import com.confhub.transport.TerminationReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class AcceptLoopTest extends BaseSessionTest {

    private Thread startAcceptLoop() {
        AcceptLoop loop = new AcceptLoop(context.getProcessControl(), engine, sessionService, Duration.ofMillis(20));
        Thread thread = new Thread(loop, "accept-loop-test");
        thread.start();
        return thread;
    }

    private void stopAndJoin(Thread thread) throws InterruptedException {
        context.getProcessControl().requestStop();
        thread.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(thread.isAlive());
    }

    @Test
    void test_accepted_session_is_admitted() throws InterruptedException {
        Thread thread = startAcceptLoop();
        FakeTransportSession session = new FakeTransportSession("alice");

        engine.connect(session);

        await().atMost(Duration.ofSeconds(5)).until(() -> sessionService.getRegistry().activeCount() == 1);
        assertNotNull(Binding.extractFromSession(session));
        assertTrue(pollSet().contains(session));

        stopAndJoin(thread);
    }

    @Test
    void test_backend_failure_closes_only_that_session() throws InterruptedException {
        Thread thread = startAcceptLoop();

        backendEngine.setAvailable(false);
        FakeTransportSession rejected = new FakeTransportSession("alice");
        engine.connect(rejected);
        await().atMost(Duration.ofSeconds(5)).until(() -> rejected.getStatus() == SessionStatus.INVALID);
        assertEquals(TerminationReason.OTHER, rejected.getTerminationReason());
        assertEquals(0, sessionService.getRegistry().activeCount());

        backendEngine.setAvailable(true);
        FakeTransportSession accepted = new FakeTransportSession("bob");
        engine.connect(accepted);
        await().atMost(Duration.ofSeconds(5)).until(() -> sessionService.getRegistry().activeCount() == 1);
        assertTrue(thread.isAlive());

        stopAndJoin(thread);
    }

    @Test
    void test_exits_on_restart_request() throws InterruptedException {
        Thread thread = startAcceptLoop();
        context.getProcessControl().requestRestart();
        thread.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(thread.isAlive());
    }
}
