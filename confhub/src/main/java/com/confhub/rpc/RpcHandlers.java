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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.confhub.common.Preconditions.checkNotNull;

/**
 * The RpcHandlers class represents a collection of registered RPC handlers, keyed by operation name.
 */
public class RpcHandlers {
    private final ConcurrentHashMap<String, RpcHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler for an operation.
     *
     * @param operation the operation name, e.g. {@code lock}
     * @param handler   the handler for the operation
     * @throws RpcHandlerAlreadyRegisteredException if the operation is already registered
     */
    public void register(String operation, RpcHandler handler) {
        checkNotNull(operation, "operation cannot be null");
        checkNotNull(handler, "handler cannot be null");
        if (handlers.putIfAbsent(operation, handler) != null) {
            throw new RpcHandlerAlreadyRegisteredException(String.format("operation already registered '%s'", operation));
        }
    }

    /**
     * Retrieves the registered handler for the given operation.
     *
     * @param operation the operation for which to retrieve the handler
     * @return the registered handler
     * @throws RpcHandlerNotFoundException if the operation is not registered
     */
    public RpcHandler get(String operation) {
        RpcHandler handler = operation == null ? null : handlers.get(operation);
        if (handler == null) {
            throw new RpcHandlerNotFoundException(String.format("unknown operation '%s'", operation));
        }
        return handler;
    }

    public Set<String> getOperations() {
        return Set.copyOf(handlers.keySet());
    }
}
