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

package com.confhub.common;

/**
 * ConfhubException is the root of the unchecked exception hierarchy used across Confhub modules.
 */
public class ConfhubException extends RuntimeException {
    public ConfhubException() {
        super();
    }

    public ConfhubException(String message) {
        super(message);
    }

    public ConfhubException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfhubException(Throwable cause) {
        super(cause);
    }
}
