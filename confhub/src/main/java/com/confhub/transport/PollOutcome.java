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

package com.confhub.transport;

/**
 * Outcomes of a single {@link PollSet#poll(java.time.Duration)} call.
 */
public enum PollOutcome {
    /**
     * Nothing happened within the timeout.
     */
    TIMEOUT,

    /**
     * A member session had a request ready and it has been dispatched.
     */
    ACTIVITY,

    /**
     * At least one member session terminated and must be removed.
     */
    SESSION_GONE,

    /**
     * A member session gained an additional transport channel that has to be admitted on its own.
     */
    NEW_SUBCHANNEL
}
