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

package com.confhub.session;

import com.confhub.transport.PollResult;
import com.confhub.transport.PollSet;
import com.confhub.transport.SessionStatus;
import com.confhub.transport.TerminationReason;
import com.confhub.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.confhub.common.Preconditions.checkNotNull;

/**
 * SessionRegistry holds the transport sessions that are eligible for polling, together with their bindings.
 * <p>
 * Every member has a binding. A member leaves the registry exactly once: the thread that wins the removal
 * from the membership map is the one that unbinds it, so no binding is ever torn down twice.
 */
public class SessionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);
    private final PollSet pollSet;
    private final SessionBinder binder;
    private final ConcurrentHashMap<Long, Binding> members = new ConcurrentHashMap<>();

    public SessionRegistry(PollSet pollSet, SessionBinder binder) {
        this.pollSet = pollSet;
        this.binder = binder;
    }

    /**
     * Admits a bound session to the poll set. A session that is discarded concurrently, before it reached
     * the poll set, is taken out of the poll set again.
     *
     * @param binding the binding created for the session by {@link SessionBinder#bind(TransportSession)}
     * @throws IllegalStateException if a session with the same id is already a member
     */
    public void add(@Nonnull Binding binding) {
        checkNotNull(binding, "binding cannot be null");
        if (binding.isClosed()) {
            throw new IllegalStateException(String.format("session %d is already unbound", binding.getSessionId()));
        }
        if (members.putIfAbsent(binding.getSessionId(), binding) != null) {
            throw new IllegalStateException(String.format("session %d is already registered", binding.getSessionId()));
        }
        try {
            pollSet.add(binding.getTransportSession());
        } catch (RuntimeException e) {
            members.remove(binding.getSessionId(), binding);
            throw e;
        }
        if (members.get(binding.getSessionId()) != binding) {
            // Discarded while it was being added to the poll set, the poll set must not keep it.
            pollSet.remove(binding.getTransportSession());
            LOGGER.debug("Session {} terminated during admission", binding.getSessionId());
            return;
        }
        LOGGER.debug("Session {} admitted, {} active session(s)", binding.getSessionId(), members.size());
    }

    /**
     * Waits for activity on the member sessions.
     *
     * @param timeout the maximum time to wait
     * @return the poll result
     */
    public PollResult poll(Duration timeout) {
        return pollSet.poll(timeout);
    }

    /**
     * Unbinds and discards every member whose transport session is no longer running.
     *
     * @return the number of removed sessions
     */
    public int removeTerminated() {
        int removed = 0;
        for (Map.Entry<Long, Binding> entry : members.entrySet()) {
            TransportSession session = entry.getValue().getTransportSession();
            if (session.getStatus() != SessionStatus.RUNNING && discard(entry.getValue())) {
                LOGGER.debug("Session {} removed, reason: {}", session.getId(), session.getTerminationReason());
                removed++;
            }
        }
        return removed;
    }

    /**
     * Treats every member as gone: closes its transport session, unbinds it and discards it.
     *
     * @return the number of removed sessions
     */
    public int drain() {
        int removed = 0;
        for (Binding binding : members.values()) {
            try {
                binding.getTransportSession().close(TerminationReason.OTHER);
            } catch (Exception e) {
                LOGGER.warn("Failed to close session {}", binding.getSessionId(), e);
            }
            if (discard(binding)) {
                removed++;
            }
        }
        if (removed > 0) {
            LOGGER.info("{} session(s) drained", removed);
        }
        return removed;
    }

    private boolean discard(Binding binding) {
        if (!members.remove(binding.getSessionId(), binding)) {
            // Someone else has already removed it.
            return false;
        }
        try {
            pollSet.remove(binding.getTransportSession());
        } finally {
            binder.unbind(binding);
        }
        return true;
    }

    public int activeCount() {
        return members.size();
    }

    public Optional<Binding> lookup(long sessionId) {
        return Optional.ofNullable(members.get(sessionId));
    }

    public Optional<Binding> lookup(@Nonnull TransportSession session) {
        return lookup(session.getId());
    }

    /**
     * Returns a snapshot of the current bindings.
     *
     * @return the bindings of all members
     */
    public List<Binding> bindings() {
        return new ArrayList<>(members.values());
    }
}
