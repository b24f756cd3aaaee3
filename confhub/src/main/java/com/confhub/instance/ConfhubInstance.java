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

import com.confhub.ConfhubService;
import com.confhub.Context;
import com.confhub.ContextImpl;
import com.confhub.ControlState;
import com.confhub.InitializationException;
import com.confhub.ProcessControl;
import com.confhub.backend.BackendEngine;
import com.confhub.backend.BackendService;
import com.confhub.backend.inmemory.InMemoryBackendEngine;
import com.confhub.datastore.DatastoreLockTable;
import com.confhub.rpc.RpcDispatcher;
import com.confhub.server.Coordinator;
import com.confhub.session.SessionService;
import com.confhub.transport.ProtocolEngine;
import com.confhub.transport.ProtocolEngineFactory;
import com.confhub.transport.netty.NettyProtocolEngine;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * ConfhubInstance runs the server as a sequence of epochs.
 * <p>
 * Every epoch reloads the configuration, connects to the backend, starts a fresh protocol engine and runs a
 * {@link Coordinator} until the control state leaves {@link ControlState#CONTINUE}. Services are shut down
 * in reverse registration order when the epoch ends. A restart starts the next epoch with an empty lock
 * table; a stop ends {@link #run()}.
 * <p>
 * The {@link ProcessControl} and the {@link DatastoreLockTable} outlive epochs and are owned by the instance.
 */
public class ConfhubInstance {
    public static final int EXIT_OK = 0;
    public static final int EXIT_INITIALIZATION_FAILURE = 1;
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfhubInstance.class);
    private static final Duration DEFAULT_RESTART_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
    private final Supplier<Config> configLoader;
    private final BackendEngine backendEngine;
    private final ProtocolEngineFactory engineFactory;
    private final ProcessControl processControl = new ProcessControl();
    private final DatastoreLockTable lockTable = new DatastoreLockTable();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile InstanceStatus status = InstanceStatus.INITIALIZING;
    private volatile Context context;
    private volatile Duration restartBackoff = DEFAULT_RESTART_BACKOFF;
    private volatile Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    public ConfhubInstance(Supplier<Config> configLoader, BackendEngine backendEngine, ProtocolEngineFactory engineFactory) {
        this.configLoader = configLoader;
        this.backendEngine = backendEngine;
        this.engineFactory = engineFactory;
    }

    /**
     * Creates an instance that loads {@code application.conf}, stores sessions in memory and serves the
     * Netty protocol engine.
     *
     * @return a new instance
     */
    public static ConfhubInstance withDefaults() {
        return new ConfhubInstance(ConfhubInstance::loadConfig, new InMemoryBackendEngine(), NettyProtocolEngine::new);
    }

    private static Config loadConfig() {
        // Picks up edits of the configuration files on restart.
        ConfigFactory.invalidateCaches();
        return ConfigFactory.load();
    }

    /**
     * Runs epochs until a stop is requested or the first epoch fails to initialize. An epoch that was started
     * by a restart is retried after {@code coordinator.restart_backoff} when its initialization fails.
     *
     * @return {@link #EXIT_OK} after a stop, {@link #EXIT_INITIALIZATION_FAILURE} after a fatal
     * initialization failure
     */
    public int run() {
        int exitStatus = EXIT_OK;
        long epoch = 0;
        boolean restarting = false;
        try {
            while (processControl.beginEpoch()) {
                epoch++;
                lockTable.reset();
                try {
                    runEpoch(epoch);
                } catch (InitializationException | ConfigException e) {
                    LOGGER.error("Failed to initialize epoch {}", epoch, e);
                    if (!restarting && processControl.get() != ControlState.RESTART) {
                        processControl.requestStop();
                        exitStatus = EXIT_INITIALIZATION_FAILURE;
                        break;
                    }
                    LOGGER.info("Restart failed, retrying in {} ms", restartBackoff.toMillis());
                    setStatus(InstanceStatus.RESTARTING);
                    if (!backoff()) {
                        break;
                    }
                    restarting = true;
                    continue;
                }
                restarting = processControl.get() == ControlState.RESTART;
                if (restarting) {
                    setStatus(InstanceStatus.RESTARTING);
                }
            }
        } finally {
            setStatus(InstanceStatus.STOPPED);
            terminated.countDown();
        }
        return exitStatus;
    }

    private void runEpoch(long epoch) {
        setStatus(InstanceStatus.INITIALIZING);
        LOGGER.info("Initializing epoch {}", epoch);

        Config config = configLoader.get();
        ContextImpl epochContext = new ContextImpl(epoch, config, processControl, lockTable);
        restartBackoff = epochContext.getConfig().getDuration("coordinator.restart_backoff");
        shutdownTimeout = epochContext.getConfig().getDuration("coordinator.shutdown_timeout");
        context = epochContext;
        try {
            BackendService backendService = new BackendService(epochContext, backendEngine);
            epochContext.registerService(BackendService.NAME, backendService);

            ProtocolEngine engine = engineFactory.create(epochContext, new RpcDispatcher(epochContext.getRpcHandlers()));
            epochContext.registerService(ProtocolEngine.NAME, engine);
            engine.start();

            SessionService sessionService = new SessionService(epochContext, engine, backendService);
            epochContext.registerService(SessionService.NAME, sessionService);

            setStatus(InstanceStatus.RUNNING);
            new Coordinator(epochContext, engine, sessionService).runEpoch();
        } finally {
            shutdownServices(epochContext);
        }
    }

    private void shutdownServices(Context epochContext) {
        List<ConfhubService> services = epochContext.getServices();
        for (int i = services.size() - 1; i >= 0; i--) {
            ConfhubService service = services.get(i);
            try {
                LOGGER.debug("{} service has been shutting down", service.getName());
                service.shutdown();
            } catch (Exception e) {
                LOGGER.error("{} service cannot be closed due to errors", service.getName(), e);
            }
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(restartBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processControl.requestStop();
            return false;
        }
    }

    /**
     * Waits until {@link #run()} has returned.
     *
     * @param timeout the maximum time to wait
     * @return true if the instance has terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public ProcessControl getProcessControl() {
        return processControl;
    }

    public DatastoreLockTable getLockTable() {
        return lockTable;
    }

    /**
     * Returns the context of the current epoch, or of the last one after the instance has stopped.
     *
     * @return the epoch context, or null if no epoch has been initialized yet
     */
    public Context getContext() {
        return context;
    }

    public InstanceStatus getStatus() {
        return status;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    private void setStatus(InstanceStatus status) {
        if (this.status != status) {
            this.status = status;
            LOGGER.info("Setting instance status to {}", status);
        }
    }
}
