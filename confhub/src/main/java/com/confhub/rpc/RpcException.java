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

import com.confhub.common.ConfhubException;

/**
 * Raised by RPC handlers to answer with a protocol error. The dispatcher turns it into an {@link RpcError}.
 */
public class RpcException extends ConfhubException {
    private final String tag;
    private final Long sessionId;

    public RpcException(String tag, String message) {
        this(tag, message, null);
    }

    public RpcException(String tag, String message, Long sessionId) {
        super(message);
        this.tag = tag;
        this.sessionId = sessionId;
    }

    public String getTag() {
        return tag;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public RpcError toError() {
        return new RpcError(tag, getMessage(), sessionId);
    }
}
