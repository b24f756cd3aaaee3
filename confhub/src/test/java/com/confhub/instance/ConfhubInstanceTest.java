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

package com.confhub.instance;

import com.confhub.BaseTest;
import com.confhub.Context;
import com.confhub.FakeProtocolEngine;
import com.confhub.FakeTransportSession;
import com.confhub.backend.inmemory.InMemoryBackendEngine;
import com.confhub.datastore.Datastore;
import com.confhub.session.SessionService;
import com.confhub.transport.ProtocolEngineFactory;
import com.confhub.transport.SessionStatus;
import com.typesafe.config.Config;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ConfhubInstanceTest extends BaseTest {
    private final List<FakeProtocolEngine> engines = new CopyOnWriteArrayList<>();
    private final InMemoryBackendEngine backendEngine = new InMemoryBackendEngine();
    private final ProtocolEngineFactory engineFactory = (context, dispatcher) -> {
        FakeProtocolEngine engine = new FakeProtocolEngine(context, dispatcher);
        engines.add(engine);
        return engine;
    };
    private ConfhubInstance instance;

    private CompletableFuture<Integer> start(Supplier<Config> configLoader, ProtocolEngineFactory factory) {
        instance = new ConfhubInstance(configLoader, backendEngine, factory);
        return CompletableFuture.supplyAsync(instance::run);
    }

    private CompletableFuture<Integer> start() {
        return start(() -> loadConfig("test.conf"), engineFactory);
    }

    private void awaitEpoch(long epoch) {
        await().atMost(Duration.ofSeconds(5)).until(() ->
                instance.getStatus() == InstanceStatus.RUNNING
                        && instance.getContext() != null
                        && instance.getContext().getEpoch() == epoch);
    }

    private SessionService sessionService() {
        Context context = instance.getContext();
        return context.getService(SessionService.NAME);
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        if (instance != null) {
            instance.getProcessControl().requestStop();
            instance.awaitTermination(Duration.ofSeconds(5));
        }
    }

    @Test
    void test_run_until_stop() throws Exception {
        CompletableFuture<Integer> exitStatus = start();
        awaitEpoch(1);

        FakeProtocolEngine engine = engines.get(0);
        assertTrue(engine.isStarted());
        FakeTransportSession session = new FakeTransportSession("alice");
        engine.connect(session);
        await().atMost(Duration.ofSeconds(5)).until(() -> sessionService().getRegistry().activeCount() == 1);

        instance.getProcessControl().requestStop();

        assertEquals(ConfhubInstance.EXIT_OK, exitStatus.get(5, TimeUnit.SECONDS));
        assertEquals(InstanceStatus.STOPPED, instance.getStatus());
        assertTrue(engine.isShutdown());
        assertEquals(SessionStatus.INVALID, session.getStatus());
        assertTrue(instance.awaitTermination(Duration.ZERO));
    }

    @Test
    void test_restart_starts_a_new_epoch() throws Exception {
        CompletableFuture<Integer> exitStatus = start();
        awaitEpoch(1);

        FakeTransportSession session = new FakeTransportSession("alice");
        engines.get(0).connect(session);
        await().atMost(Duration.ofSeconds(5)).until(() -> sessionService().getRegistry().activeCount() == 1);
        assertTrue(instance.getLockTable().tryAcquire(Datastore.CANDIDATE, session));

        instance.getProcessControl().requestRestart();
        awaitEpoch(2);

        assertEquals(2, engines.size());
        assertTrue(engines.get(0).isShutdown());
        assertFalse(engines.get(1).isShutdown());
        assertEquals(SessionStatus.INVALID, session.getStatus());
        assertThat(instance.getLockTable().snapshot()).isEmpty();
        assertEquals(0, sessionService().getRegistry().activeCount());

        instance.getProcessControl().requestStop();
        assertEquals(ConfhubInstance.EXIT_OK, exitStatus.get(5, TimeUnit.SECONDS));
    }

    @Test
    void test_repeated_restarts_reach_the_same_steady_state() throws Exception {
        CompletableFuture<Integer> exitStatus = start();
        awaitEpoch(1);

        for (long epoch = 2; epoch <= 4; epoch++) {
            instance.getProcessControl().requestRestart();
            awaitEpoch(epoch);

            assertEquals(0, sessionService().getRegistry().activeCount());
            assertThat(instance.getLockTable().snapshot()).isEmpty();
            assertTrue(instance.getProcessControl().shouldContinue());
        }

        instance.getProcessControl().requestStop();
        assertEquals(ConfhubInstance.EXIT_OK, exitStatus.get(5, TimeUnit.SECONDS));
        assertEquals(4, engines.size());
        assertTrue(engines.stream().allMatch(FakeProtocolEngine::isShutdown));
    }

    @Test
    void test_engine_start_failure() throws Exception {
        CompletableFuture<Integer> exitStatus = start(() -> loadConfig("test.conf"), (context, dispatcher) -> {
            FakeProtocolEngine engine = new FakeProtocolEngine(context, dispatcher);
            engine.setFailOnStart(true);
            engines.add(engine);
            return engine;
        });

        assertEquals(ConfhubInstance.EXIT_INITIALIZATION_FAILURE, exitStatus.get(5, TimeUnit.SECONDS));
        assertEquals(InstanceStatus.STOPPED, instance.getStatus());
        assertTrue(engines.get(0).isShutdown());
    }

    @Test
    void test_backend_unavailable_at_startup() throws Exception {
        backendEngine.setAvailable(false);
        CompletableFuture<Integer> exitStatus = start();

        assertEquals(ConfhubInstance.EXIT_INITIALIZATION_FAILURE, exitStatus.get(5, TimeUnit.SECONDS));
        assertTrue(engines.isEmpty());
    }

    @Test
    void test_missing_configuration() throws Exception {
        CompletableFuture<Integer> exitStatus = start(() -> loadConfig("test.conf").withoutPath("transport"), engineFactory);
        assertEquals(ConfhubInstance.EXIT_INITIALIZATION_FAILURE, exitStatus.get(5, TimeUnit.SECONDS));
    }

    @Test
    void test_initialization_failure_with_pending_restart_is_retried() throws Exception {
        CompletableFuture<Integer> exitStatus = start(() -> loadConfig("test.conf"), (context, dispatcher) -> {
            if (engines.isEmpty()) {
                // A restart arrives while the first epoch is failing.
                context.getProcessControl().requestRestart();
                FakeProtocolEngine failing = new FakeProtocolEngine(context, dispatcher);
                failing.setFailOnStart(true);
                engines.add(failing);
                return failing;
            }
            return engineFactory.create(context, dispatcher);
        });
        awaitEpoch(2);

        assertEquals(2, engines.size());
        assertTrue(engines.get(1).isStarted());

        instance.getProcessControl().requestStop();
        assertEquals(ConfhubInstance.EXIT_OK, exitStatus.get(5, TimeUnit.SECONDS));
    }

    @Test
    void test_failed_reinitialization_after_restart_is_retried() throws Exception {
        CompletableFuture<Integer> exitStatus = start(() -> loadConfig("test.conf"), (context, dispatcher) -> {
            FakeProtocolEngine engine = (FakeProtocolEngine) engineFactory.create(context, dispatcher);
            // The engine of the second epoch cannot bind.
            engine.setFailOnStart(engines.size() == 2);
            return engine;
        });
        awaitEpoch(1);

        instance.getProcessControl().requestRestart();
        awaitEpoch(3);

        assertEquals(3, engines.size());
        assertFalse(engines.get(1).isStarted());
        assertTrue(engines.get(1).isShutdown());
        assertTrue(engines.get(2).isStarted());
        assertFalse(exitStatus.isDone());

        instance.getProcessControl().requestStop();
        assertEquals(ConfhubInstance.EXIT_OK, exitStatus.get(5, TimeUnit.SECONDS));
    }
}
