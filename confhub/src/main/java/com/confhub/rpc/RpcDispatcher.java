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
import com.confhub.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RpcDispatcher routes a request received on a transport session to the handler registered for its
 * operation. The session's {@link Binding} supplies the store session and datastore the handler works on.
 */
public class RpcDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(RpcDispatcher.class);
    private final RpcHandlers handlers;

    public RpcDispatcher(RpcHandlers handlers) {
        this.handlers = handlers;
    }

    /**
     * Executes a request. Never throws: every failure is turned into an error reply.
     *
     * @param session the session the request was received on
     * @param request the request
     * @return the response to send back
     */
    public RpcResponse dispatch(TransportSession session, RpcRequest request) {
        RpcResponse response = new RpcResponse(request.getMessageId());

        Binding binding = Binding.extractFromSession(session);
        if (binding == null || binding.isClosed()) {
            response.writeError(RpcError.OPERATION_FAILED, String.format("session %d is not bound", session.getId()));
            return response;
        }

        LOGGER.debug("Dispatching '{}' (message-id: {}) from session {}", request.getOperation(), request.getMessageId(), session.getId());
        try {
            RpcHandler handler = handlers.get(request.getOperation());
            handler.execute(binding, request, response);
        } catch (RpcException e) {
            response.writeError(e);
        } catch (Exception e) {
            LOGGER.debug("Unhandled error while serving '{}' from session {}", request.getOperation(), session.getId(), e);
            response.writeError(RpcError.OPERATION_FAILED, e.getMessage());
        }
        return response;
    }
}
