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

import com.confhub.ProcessControl;
import com.confhub.backend.BackendUnavailableException;
import com.confhub.session.SessionRegistry;
import com.confhub.session.SessionService;
import com.confhub.transport.PollResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * ProcessLoop polls the admitted sessions, lets the protocol engine dispatch their requests and removes
 * terminated sessions. It drains the registry when the control state leaves
 * {@link com.confhub.ControlState#CONTINUE}.
 */
public class ProcessLoop implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessLoop.class);
    private final ProcessControl control;
    private final SessionService sessionService;
    private final SessionRegistry registry;
    private final Duration pollTimeout;
    private final Duration idleSleep;

    public ProcessLoop(ProcessControl control, SessionService sessionService, Duration pollTimeout, Duration idleSleep) {
        this.control = control;
        this.sessionService = sessionService;
        this.registry = sessionService.getRegistry();
        this.pollTimeout = pollTimeout;
        this.idleSleep = idleSleep;
    }

    @Override
    public void run() {
        try {
            while (control.shouldContinue()) {
                if (registry.activeCount() == 0) {
                    // Polling an empty set would spin, rest for a while.
                    if (!rest()) {
                        break;
                    }
                    continue;
                }
                try {
                    PollResult result = registry.poll(pollTimeout);
                    handle(result);
                } catch (Exception e) {
                    LOGGER.error("Unexpected error in the process loop", e);
                }
            }
        } finally {
            registry.drain();
            LOGGER.debug("Process loop exited, control state: {}", control.get());
        }
    }

    private void handle(PollResult result) {
        switch (result.outcome()) {
            case SESSION_GONE -> registry.removeTerminated();
            case NEW_SUBCHANNEL -> {
                try {
                    sessionService.admit(result.session());
                    LOGGER.debug("Subchannel session {} admitted", result.session().getId());
                } catch (BackendUnavailableException e) {
                    LOGGER.debug("Subchannel session {} rejected: {}", result.session().getId(), e.getMessage());
                }
            }
            default -> {
                // TIMEOUT or ACTIVITY, nothing to do here.
            }
        }
    }

    private boolean rest() {
        try {
            TimeUnit.NANOSECONDS.sleep(idleSleep.toNanos());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Process loop has been interrupted");
            control.requestStop();
            return false;
        }
    }
}
