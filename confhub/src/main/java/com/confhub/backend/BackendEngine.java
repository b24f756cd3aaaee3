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

package com.confhub.backend;

import com.typesafe.config.Config;

/**
 * Entry point of the backend configuration-store engine.
 */
public interface BackendEngine {

    /**
     * Connects to the backend.
     *
     * @param config the configuration of the epoch
     * @return a new connection
     * @throws BackendUnavailableException if the backend cannot be reached
     */
    BackendConnection connect(Config config);
}
