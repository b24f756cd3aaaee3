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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A reply to an {@link RpcRequest}: exactly one of {@code ok}, {@code data} or {@code error} is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RpcReply {
    @JsonProperty("message-id")
    private String messageId;

    @JsonProperty("ok")
    private Boolean ok;

    @JsonProperty("data")
    private Object data;

    @JsonProperty("error")
    private RpcError error;

    public RpcReply() {
    }

    private RpcReply(String messageId, Boolean ok, Object data, RpcError error) {
        this.messageId = messageId;
        this.ok = ok;
        this.data = data;
        this.error = error;
    }

    public static RpcReply ok(String messageId) {
        return new RpcReply(messageId, true, null, null);
    }

    public static RpcReply data(String messageId, Object data) {
        return new RpcReply(messageId, null, data, null);
    }

    public static RpcReply error(String messageId, RpcError error) {
        return new RpcReply(messageId, null, null, error);
    }

    public String getMessageId() {
        return messageId;
    }

    public boolean isOk() {
        return Boolean.TRUE.equals(ok);
    }

    public Object getData() {
        return data;
    }

    public RpcError getError() {
        return error;
    }
}
