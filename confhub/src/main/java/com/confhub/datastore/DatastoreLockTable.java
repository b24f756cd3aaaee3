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

package com.confhub.datastore;

import com.confhub.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.confhub.common.Preconditions.checkNotNull;

/**
 * DatastoreLockTable tracks, per {@link Datastore}, which transport session holds its exclusive lock.
 * <p>
 * Mutations are serialized through the write side of a fair {@link ReentrantReadWriteLock}; a fair lock
 * hands the lock to a waiting writer before readers that arrived after it, so releases are never delayed
 * by a stream of diagnostic reads. A lock that is already held is a normal {@code false} result, turning it
 * into a protocol-level "lock denied" reply is up to the caller.
 */
public class DatastoreLockTable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatastoreLockTable.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final EnumMap<Datastore, TransportSession> slots = new EnumMap<>(Datastore.class);

    /**
     * Acquires the lock of the given datastore for the session, without blocking.
     *
     * @param datastore the datastore to lock
     * @param session   the requesting session
     * @return true if the slot was unlocked and is now owned by {@code session}, false otherwise
     */
    public boolean tryAcquire(@Nonnull Datastore datastore, @Nonnull TransportSession session) {
        checkNotNull(datastore, "datastore cannot be null");
        checkNotNull(session, "session cannot be null");

        lock.writeLock().lock();
        try {
            TransportSession owner = slots.get(datastore);
            if (owner != null) {
                LOGGER.debug("Lock on {} denied to session {}, held by session {}", datastore, session.getId(), owner.getId());
                return false;
            }
            slots.put(datastore, session);
            LOGGER.debug("Lock on {} acquired by session {}", datastore, session.getId());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Releases the lock of the given datastore if, and only if, {@code session} owns it. A release request
     * from a non-owner is a no-op.
     *
     * @param datastore the datastore to unlock
     * @param session   the session releasing the lock
     * @return true if the slot was owned by {@code session} and has been cleared
     */
    public boolean release(@Nonnull Datastore datastore, @Nonnull TransportSession session) {
        checkNotNull(datastore, "datastore cannot be null");
        checkNotNull(session, "session cannot be null");

        lock.writeLock().lock();
        try {
            if (slots.get(datastore) != session) {
                return false;
            }
            slots.remove(datastore);
            LOGGER.debug("Lock on {} released by session {}", datastore, session.getId());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Calls {@link #release(Datastore, TransportSession)} for every datastore. Used when a session is torn down.
     *
     * @param session the session whose locks are released
     */
    public void releaseAll(@Nonnull TransportSession session) {
        checkNotNull(session, "session cannot be null");
        lock.writeLock().lock();
        try {
            for (Datastore datastore : Datastore.values()) {
                release(datastore, session);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Clears every slot. Called at the start of every epoch.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            slots.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Retrieves the session that holds the lock of the given datastore.
     *
     * @param datastore the datastore
     * @return the owning session, or null if the datastore is unlocked
     */
    public TransportSession ownerOf(@Nonnull Datastore datastore) {
        lock.readLock().lock();
        try {
            return slots.get(datastore);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isOwnedBy(@Nonnull Datastore datastore, @Nonnull TransportSession session) {
        return ownerOf(datastore) == session;
    }

    public boolean isLocked(@Nonnull Datastore datastore) {
        return ownerOf(datastore) != null;
    }

    /**
     * Returns a point-in-time view of the held locks, datastore to the owner's session id.
     *
     * @return an unmodifiable map containing only the locked datastores
     */
    public Map<Datastore, Long> snapshot() {
        lock.readLock().lock();
        try {
            EnumMap<Datastore, Long> result = new EnumMap<>(Datastore.class);
            slots.forEach((datastore, owner) -> result.put(datastore, owner.getId()));
            return Collections.unmodifiableMap(result);
        } finally {
            lock.readLock().unlock();
        }
    }
}
