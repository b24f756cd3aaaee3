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

package com.confhub.internal;

import com.confhub.common.ConfhubException;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Utility class for shutting down the executors that run the coordinator's loops.
 */
public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {
    }

    /**
     * Interrupts the executor's threads and waits for them to terminate.
     *
     * @param executor the executor service to shut down; if null or already terminated, returns true immediately
     * @param timeout  how long to wait for termination
     * @return true if the executor terminated within the timeout, false otherwise
     * @throws ConfhubException if the waiting thread is interrupted
     */
    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor, Duration timeout) {
        if (executor == null || executor.isTerminated()) {
            return true;
        }

        executor.shutdownNow();
        try {
            return executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new ConfhubException(exp);
        }
    }
}
