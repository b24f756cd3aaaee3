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

/**
 * Collects the reply of one RPC. The protocol engine sends {@link #getReply()} to the client and, when
 * {@link #isCloseSession()} is set, terminates the session right after the reply is written.
 */
public class RpcResponse {
    private final String messageId;
    private RpcReply reply;
    private boolean closeSession;

    public RpcResponse(String messageId) {
        this.messageId = messageId;
    }

    public void writeOk() {
        reply = RpcReply.ok(messageId);
    }

    public void writeData(Object data) {
        reply = RpcReply.data(messageId, data);
    }

    public void writeError(String tag, String message) {
        reply = RpcReply.error(messageId, new RpcError(tag, message, null));
    }

    public void writeError(RpcException exception) {
        reply = RpcReply.error(messageId, exception.toError());
    }

    public void closeSessionAfterReply() {
        closeSession = true;
    }

    public boolean isCloseSession() {
        return closeSession;
    }

    /**
     * Retrieves the reply. A handler that wrote nothing is answered with {@code ok}.
     *
     * @return the reply to send
     */
    public RpcReply getReply() {
        if (reply == null) {
            return RpcReply.ok(messageId);
        }
        return reply;
    }
}
