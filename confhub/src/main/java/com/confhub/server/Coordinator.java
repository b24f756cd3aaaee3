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

import com.confhub.Context;
import com.confhub.ProcessControl;
import com.confhub.internal.ExecutorServiceUtil;
import com.confhub.session.SessionService;
import com.confhub.transport.ProtocolEngine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

/**
 * Coordinator drives one epoch: the process loop runs on a dedicated thread while the accept loop runs on
 * the calling thread. {@link #runEpoch()} returns once both loops have exited and every session is drained.
 */
public class Coordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(Coordinator.class);
    private final Context context;
    private final ProtocolEngine engine;
    private final SessionService sessionService;
    private final Duration acceptTimeout;
    private final Duration pollTimeout;
    private final Duration idleSleep;
    private final Duration shutdownTimeout;

    public Coordinator(Context context, ProtocolEngine engine, SessionService sessionService) {
        this.context = context;
        this.engine = engine;
        this.sessionService = sessionService;

        Config config = context.getConfig();
        this.acceptTimeout = config.getDuration("transport.accept_timeout");
        this.pollTimeout = config.getDuration("coordinator.poll_timeout");
        this.idleSleep = config.getDuration("coordinator.idle_sleep");
        this.shutdownTimeout = config.getDuration("coordinator.shutdown_timeout");
    }

    /**
     * Runs the accept and process loops until the control state leaves {@link com.confhub.ControlState#CONTINUE}.
     */
    public void runEpoch() {
        ProcessControl control = context.getProcessControl();
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat("confhub-process-loop-" + context.getEpoch() + "-%d")
                .build();
        ExecutorService executor = Executors.newSingleThreadExecutor(factory);
        try {
            Future<?> processLoop = executor.submit(new ProcessLoop(control, sessionService, pollTimeout, idleSleep));
            LOGGER.info("Epoch {} is running", context.getEpoch());
            try {
                new AcceptLoop(control, engine, sessionService, acceptTimeout).run();
            } finally {
                if (control.shouldContinue()) {
                    // The accept loop died while the epoch should still be running.
                    control.requestStop();
                }
                awaitProcessLoop(processLoop);
            }
        } finally {
            if (!ExecutorServiceUtil.shutdownNowThenAwaitTermination(executor, shutdownTimeout)) {
                LOGGER.warn("Process loop of epoch {} cannot be stopped gracefully", context.getEpoch());
            }
        }
        LOGGER.info("Epoch {} finished, control state: {}", context.getEpoch(), control.get());
    }

    private void awaitProcessLoop(Future<?> processLoop) {
        try {
            processLoop.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.getProcessControl().requestStop();
            LOGGER.warn("Interrupted while waiting for the process loop");
        } catch (ExecutionException e) {
            LOGGER.error("Process loop terminated abnormally", e.getCause());
        }
    }
}
