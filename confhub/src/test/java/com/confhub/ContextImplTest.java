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

package com.confhub;

import com.confhub.datastore.DatastoreLockTable;
import com.typesafe.config.Config;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextImplTest extends BaseTest {

    @Test
    void test_missing_mandatory_section() {
        Config config = loadConfig("test.conf").withoutPath("coordinator");
        MissingConfigException exception = assertThrows(MissingConfigException.class,
                () -> new ContextImpl(1, config, new ProcessControl(), new DatastoreLockTable()));
        assertTrue(exception.getMessage().contains("coordinator"));
    }

    @Test
    void test_missing_config_is_an_initialization_failure() {
        Config config = loadConfig("test.conf").withoutPath("server.name");
        assertThrows(InitializationException.class,
                () -> new ContextImpl(1, config, new ProcessControl(), new DatastoreLockTable()));
    }

    @Test
    void test_services_keep_registration_order() {
        ContextImpl context = newContext();
        FakeProtocolEngine first = new FakeProtocolEngine(context, null);
        FakeProtocolEngine second = new FakeProtocolEngine(context, null);
        context.registerService("first", first);
        context.registerService("second", second);

        List<ConfhubService> services = context.getServices();
        assertEquals(2, services.size());
        assertSame(first, services.get(0));
        assertSame(second, services.get(1));
        assertSame(second, context.getService("second"));
    }

    @Test
    void test_registerService_ignores_duplicate_id() {
        ContextImpl context = newContext();
        FakeProtocolEngine first = new FakeProtocolEngine(context, null);
        context.registerService("engine", first);
        context.registerService("engine", new FakeProtocolEngine(context, null));

        assertSame(first, context.getService("engine"));
        assertEquals(1, context.getServices().size());
    }
}
