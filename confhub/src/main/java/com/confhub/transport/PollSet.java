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

import java.time.Duration;

/**
 * PollSet is the protocol engine's multiplexing primitive over a set of transport sessions.
 * Implementations must tolerate concurrent {@code add}, {@code remove} and {@code poll} calls.
 */
public interface PollSet {

    /**
     * Adds a session to the set.
     *
     * @param session the session to add
     */
    void add(TransportSession session);

    /**
     * Removes a session from the set. Removing a session that is not a member is a no-op.
     *
     * @param session the session to remove
     */
    void remove(TransportSession session);

    /**
     * Retrieves the number of member sessions.
     *
     * @return the number of members
     */
    int size();

    /**
     * Blocks up to {@code timeout} waiting for activity on any member. A ready request is dispatched
     * before this method returns {@link PollOutcome#ACTIVITY}.
     *
     * @param timeout the maximum time to wait
     * @return the poll result, never null
     */
    PollResult poll(Duration timeout);
}
