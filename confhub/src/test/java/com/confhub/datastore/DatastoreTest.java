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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatastoreTest {

    @Test
    void test_fromName() {
        assertEquals(Datastore.RUNNING, Datastore.fromName("running"));
        assertEquals(Datastore.STARTUP, Datastore.fromName("startup"));
        assertEquals(Datastore.CANDIDATE, Datastore.fromName("CANDIDATE"));
    }

    @Test
    void test_fromName_unknown() {
        assertThrows(IllegalArgumentException.class, () -> Datastore.fromName("intended"));
    }

    @Test
    void test_toString_is_the_protocol_name() {
        assertEquals("candidate", Datastore.CANDIDATE.toString());
    }
}
