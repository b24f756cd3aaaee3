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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates transport session ids. Ids start at 1 and are never reused while the process lives, so a
 * session id stays unique across restarts.
 */
public final class SessionIdGenerator {
    private static final AtomicLong NEXT = new AtomicLong(1);

    private SessionIdGenerator() {
    }

    public static long next() {
        return NEXT.getAndIncrement();
    }
}
