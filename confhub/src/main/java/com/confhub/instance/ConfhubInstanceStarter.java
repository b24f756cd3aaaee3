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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Runs a {@link ConfhubInstance} on the main thread and exits with its status.
 */
public class ConfhubInstanceStarter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfhubInstanceStarter.class);

    private static void greeting() {
        LOGGER.info("pid: {} has been started", ProcessHandle.current().pid());
        LOGGER.info("Confhub on {}/{} Java {}",
                System.getProperty("os.name"),
                System.getProperty("os.arch"),
                System.getProperty("java.version"));
    }

    public static void main(String[] args) {
        ConfhubInstance instance = ConfhubInstance.withDefaults();
        new SignalListener(instance.getProcessControl()).install();
        Runtime.getRuntime().addShutdownHook(createShutdownHook(instance));
        greeting();

        int status = instance.run();
        LOGGER.info("Quit!");
        System.exit(status);
    }

    private static Thread createShutdownHook(ConfhubInstance instance) {
        return new Thread(() -> {
            instance.getProcessControl().requestStop();
            try {
                if (!instance.awaitTermination(instance.getShutdownTimeout())) {
                    LOGGER.warn("Instance did not stop in {} ms", instance.getShutdownTimeout().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "confhub-shutdown-hook");
    }
}
