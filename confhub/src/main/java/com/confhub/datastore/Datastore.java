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

import java.util.Locale;

/**
 * Well-known configuration datastores. Each one has exactly one slot in the {@link DatastoreLockTable}.
 */
public enum Datastore {
    RUNNING("running"),
    STARTUP("startup"),
    CANDIDATE("candidate");

    private final String name;

    Datastore(String name) {
        this.name = name;
    }

    /**
     * Resolves a datastore from its protocol name, case-insensitively.
     *
     * @param name the datastore name, e.g. {@code candidate}
     * @return the matching datastore
     * @throws IllegalArgumentException if no datastore has the given name
     */
    public static Datastore fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("datastore name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Datastore datastore : values()) {
            if (datastore.name.equals(normalized)) {
                return datastore;
            }
        }
        throw new IllegalArgumentException(String.format("unknown datastore '%s'", name));
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
