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

package com.confhub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ProcessControl is the shared cell holding the process-wide {@link ControlState}.
 * <p>
 * Requests coming from the signal listener only move the state away from {@link ControlState#CONTINUE}:
 * a restart request never overrides a pending stop, and nothing but {@link #beginEpoch()} brings a
 * restarting process back to {@code CONTINUE}.
 */
public class ProcessControl {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessControl.class);
    private final AtomicReference<ControlState> state = new AtomicReference<>(ControlState.CONTINUE);
    private final AtomicInteger stopRequests = new AtomicInteger();

    public ControlState get() {
        return state.get();
    }

    /**
     * Returns true while both loops should keep running.
     *
     * @return true if the state is {@link ControlState#CONTINUE}
     */
    public boolean shouldContinue() {
        return state.get() == ControlState.CONTINUE;
    }

    /**
     * Requests the process to stop. Always wins over a pending restart.
     *
     * @return the number of stop requests received so far, including this one
     */
    public int requestStop() {
        ControlState previous = state.getAndSet(ControlState.STOP);
        int attempt = stopRequests.incrementAndGet();
        if (previous != ControlState.STOP) {
            LOGGER.info("Stop requested");
        }
        return attempt;
    }

    /**
     * Requests the process to restart. Ignored if a restart or a stop is already pending.
     *
     * @return true if the state moved from {@link ControlState#CONTINUE} to {@link ControlState#RESTART}
     */
    public boolean requestRestart() {
        boolean accepted = state.compareAndSet(ControlState.CONTINUE, ControlState.RESTART);
        if (accepted) {
            LOGGER.info("Restart requested");
        }
        return accepted;
    }

    /**
     * Called by the coordinator immediately before initializing a new epoch. A pending restart is consumed
     * and the state goes back to {@link ControlState#CONTINUE}.
     *
     * @return true if a new epoch may start, false if a stop has been requested
     */
    public boolean beginEpoch() {
        state.compareAndSet(ControlState.RESTART, ControlState.CONTINUE);
        return state.get() == ControlState.CONTINUE;
    }
}
