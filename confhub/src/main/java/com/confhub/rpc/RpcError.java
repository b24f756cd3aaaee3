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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The error part of an {@link RpcReply}. The tag constants follow the NETCONF error-tag vocabulary.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RpcError {
    public static final String LOCK_DENIED = "lock-denied";
    public static final String OPERATION_FAILED = "operation-failed";
    public static final String OPERATION_NOT_SUPPORTED = "operation-not-supported";
    public static final String INVALID_VALUE = "invalid-value";
    public static final String MISSING_ELEMENT = "missing-element";
    public static final String MALFORMED_MESSAGE = "malformed-message";
    public static final String RESOURCE_DENIED = "resource-denied";

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("message")
    private String message;

    @JsonProperty("session-id")
    private Long sessionId;

    public RpcError() {
    }

    public RpcError(String tag, String message, Long sessionId) {
        this.tag = tag;
        this.message = message;
        this.sessionId = sessionId;
    }

    public String getTag() {
        return tag;
    }

    public String getMessage() {
        return message;
    }

    /**
     * For {@link #LOCK_DENIED}, the id of the session holding the lock.
     *
     * @return the session id, or null
     */
    public Long getSessionId() {
        return sessionId;
    }
}
