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

import com.confhub.session.Binding;

/**
 * The RpcHandler interface represents a handler for one protocol operation.
 */
public interface RpcHandler {
    /**
     * Executes the given request on behalf of the bound session.
     * <p>
     * The handler writes its reply through {@code response}. Throwing an {@link RpcException} answers with
     * the corresponding protocol error.
     *
     * @param binding  the binding of the session that sent the request
     * @param request  the request to execute
     * @param response the response used to write the reply
     * @throws Exception if an error occurs during execution
     */
    void execute(Binding binding, RpcRequest request, RpcResponse response) throws Exception;
}
