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

import com.confhub.datastore.Datastore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An RPC received from a client.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RpcRequest {
    @JsonProperty("message-id")
    private String messageId;

    @JsonProperty("operation")
    private String operation;

    @JsonProperty("target")
    private String target;

    @JsonProperty("session-id")
    private Long sessionId;

    public RpcRequest() {
    }

    public RpcRequest(String messageId, String operation) {
        this.messageId = messageId;
        this.operation = operation;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public String getTarget() {
        return target;
    }

    public RpcRequest setTarget(String target) {
        this.target = target;
        return this;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public RpcRequest setSessionId(Long sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    /**
     * Resolves the {@code target} parameter to a datastore.
     *
     * @return the target datastore
     * @throws RpcException with {@link RpcError#MISSING_ELEMENT} or {@link RpcError#INVALID_VALUE}
     */
    public Datastore requireTarget() {
        if (target == null || target.isBlank()) {
            throw new RpcException(RpcError.MISSING_ELEMENT, "target is missing");
        }
        try {
            return Datastore.fromName(target);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcError.INVALID_VALUE, e.getMessage());
        }
    }

    /**
     * Resolves the {@code session-id} parameter.
     *
     * @return the session id
     * @throws RpcException with {@link RpcError#MISSING_ELEMENT} if the parameter is absent
     */
    public long requireSessionId() {
        if (sessionId == null) {
            throw new RpcException(RpcError.MISSING_ELEMENT, "session-id is missing");
        }
        return sessionId;
    }
}
