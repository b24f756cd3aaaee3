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

package com.confhub.rpc.handlers;

import com.confhub.rpc.RpcHandler;
import com.confhub.rpc.RpcRequest;
import com.confhub.rpc.RpcResponse;
import com.confhub.session.Binding;

/**
 * close-session: gracefully terminates the calling session once the reply has been written.
 * Its locks are released when the session is removed from the registry.
 */
public class CloseSessionHandler implements RpcHandler {
    public static final String OPERATION = "close-session";

    @Override
    public void execute(Binding binding, RpcRequest request, RpcResponse response) {
        response.writeOk();
        response.closeSessionAfterReply();
    }
}
