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

import com.confhub.rpc.RpcError;
import com.confhub.rpc.RpcException;
import com.confhub.rpc.RpcHandler;
import com.confhub.rpc.RpcRequest;
import com.confhub.rpc.RpcResponse;
import com.confhub.session.Binding;
import com.confhub.session.SessionRegistry;
import com.confhub.transport.TerminationReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * kill-session: forcibly terminates another session. The killed session's locks are released when it is
 * removed from the registry, its in-flight operations are not rolled back here.
 */
public class KillSessionHandler implements RpcHandler {
    public static final String OPERATION = "kill-session";
    private static final Logger LOGGER = LoggerFactory.getLogger(KillSessionHandler.class);
    private final Supplier<SessionRegistry> registry;

    public KillSessionHandler(Supplier<SessionRegistry> registry) {
        this.registry = registry;
    }

    @Override
    public void execute(Binding binding, RpcRequest request, RpcResponse response) {
        long sessionId = request.requireSessionId();
        if (sessionId == binding.getSessionId()) {
            throw new RpcException(RpcError.INVALID_VALUE, "a session cannot kill itself, use close-session");
        }
        Binding victim = registry.get().lookup(sessionId).orElseThrow(
                () -> new RpcException(RpcError.INVALID_VALUE, String.format("no such session %d", sessionId))
        );
        LOGGER.info("Session {} killed by session {}", sessionId, binding.getSessionId());
        victim.getTransportSession().close(TerminationReason.KILLED);
        response.writeOk();
    }
}
