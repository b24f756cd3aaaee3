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
import com.confhub.session.SessionService;
import com.confhub.transport.ProtocolEngine;
import com.confhub.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * AcceptLoop waits for new transport sessions and admits them while the control state is
 * {@link com.confhub.ControlState#CONTINUE}. Termination is passive: the loop simply stops accepting.
 */
public class AcceptLoop implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AcceptLoop.class);
    private final ProcessControl control;
    private final ProtocolEngine engine;
    private final SessionService sessionService;
    private final Duration acceptTimeout;

    public AcceptLoop(ProcessControl control, ProtocolEngine engine, SessionService sessionService, Duration acceptTimeout) {
        this.control = control;
        this.engine = engine;
        this.sessionService = sessionService;
        this.acceptTimeout = acceptTimeout;
    }

    @Override
    public void run() {
        while (control.shouldContinue()) {
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warn("Accept loop has been interrupted");
                control.requestStop();
                break;
            }
            try {
                TransportSession session = engine.accept(acceptTimeout);
                if (session == null) {
                    continue;
                }
                sessionService.admit(session);
                LOGGER.debug("Session {} accepted for {}", session.getId(), session.getIdentity());
            } catch (BackendUnavailableException e) {
                // The transport session is closed already. Keep accepting.
                LOGGER.debug("Session rejected: {}", e.getMessage());
            } catch (Exception e) {
                LOGGER.error("Unexpected error in the accept loop", e);
            }
        }
        LOGGER.debug("Accept loop exited, control state: {}", control.get());
    }
}
