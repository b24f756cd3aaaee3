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

package com.confhub.rpc;

import com.confhub.rpc.handlers.CloseSessionHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RpcHandlersTest {

    @Test
    void test_register_and_get() {
        RpcHandlers handlers = new RpcHandlers();
        RpcHandler handler = new CloseSessionHandler();
        handlers.register("close-session", handler);

        assertSame(handler, handlers.get("close-session"));
        assertTrue(handlers.getOperations().contains("close-session"));
    }

    @Test
    void test_register_twice() {
        RpcHandlers handlers = new RpcHandlers();
        handlers.register("close-session", new CloseSessionHandler());
        assertThrows(RpcHandlerAlreadyRegisteredException.class,
                () -> handlers.register("close-session", new CloseSessionHandler()));
    }

    @Test
    void test_get_unknown_operation() {
        RpcHandlers handlers = new RpcHandlers();
        RpcHandlerNotFoundException exception = assertThrows(RpcHandlerNotFoundException.class,
                () -> handlers.get("edit-config"));
        assertEquals(RpcError.OPERATION_NOT_SUPPORTED, exception.getTag());
    }

    @Test
    void test_get_null_operation() {
        assertThrows(RpcHandlerNotFoundException.class, () -> new RpcHandlers().get(null));
    }
}
