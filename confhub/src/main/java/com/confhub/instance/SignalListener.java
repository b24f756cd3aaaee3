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

import com.confhub.ProcessControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

import java.util.List;
import java.util.function.IntConsumer;

/**
 * Translates OS signals into {@link ProcessControl} transitions. {@code HUP} and {@code USR1} request a
 * restart, {@code INT} and {@code TERM} request a stop. A second stop request halts the process with
 * status {@value #FORCED_EXIT_STATUS} without waiting for the graceful shutdown to finish.
 */
public class SignalListener {
    public static final List<String> RESTART_SIGNALS = List.of("HUP", "USR1");
    public static final List<String> STOP_SIGNALS = List.of("INT", "TERM");
    public static final int FORCED_EXIT_STATUS = 1;
    private static final Logger LOGGER = LoggerFactory.getLogger(SignalListener.class);
    private final ProcessControl processControl;
    private final IntConsumer halter;

    public SignalListener(ProcessControl processControl) {
        this(processControl, status -> Runtime.getRuntime().halt(status));
    }

    SignalListener(ProcessControl processControl, IntConsumer halter) {
        this.processControl = processControl;
        this.halter = halter;
    }

    /**
     * Installs the restart and stop handlers. A signal that the JVM or the OS reserves is skipped.
     *
     * @return true if every handler has been installed
     */
    public boolean install() {
        boolean installed = true;
        for (String name : RESTART_SIGNALS) {
            installed &= install(name);
        }
        for (String name : STOP_SIGNALS) {
            installed &= install(name);
        }
        return installed;
    }

    private boolean install(String name) {
        try {
            Signal.handle(new Signal(name), signal -> onSignal(signal.getName()));
            return true;
        } catch (IllegalArgumentException e) {
            LOGGER.warn("SIG{} is not available, no handler installed: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Applies the control transition for a signal.
     *
     * @param name signal name without the {@code SIG} prefix
     */
    public void onSignal(String name) {
        switch (name) {
            case "HUP", "USR1" -> {
                if (!processControl.requestRestart()) {
                    LOGGER.info("SIG{} ignored, control state is {}", name, processControl.get());
                }
            }
            case "INT", "TERM" -> {
                int attempt = processControl.requestStop();
                if (attempt > 1) {
                    LOGGER.warn("SIG{} received while stopping, forcing exit", name);
                    halter.accept(FORCED_EXIT_STATUS);
                } else {
                    LOGGER.info("SIG{} received, stopping", name);
                }
            }
            default -> LOGGER.debug("Ignoring SIG{}", name);
        }
    }
}
