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

package com.confhub.transport;

/**
 * TransportSession represents an authenticated, transport-layer connection instance managed by a
 * {@link ProtocolEngine}. The coordinator borrows transport sessions, it never owns their I/O resources.
 */
public interface TransportSession {

    /**
     * Retrieves the session id assigned by the protocol engine. Ids are unique for the lifetime of the process.
     *
     * @return the session id
     */
    long getId();

    /**
     * Retrieves the identity negotiated during the session handshake.
     *
     * @return the client identity, e.g. the user name
     */
    String getIdentity();

    /**
     * Retrieves the current status of the session.
     *
     * @return the session status
     */
    SessionStatus getStatus();

    /**
     * Retrieves the reason the session terminated.
     *
     * @return the termination reason, or null while the session is alive
     */
    TerminationReason getTerminationReason();

    /**
     * Terminates the session. Calling it on an already terminated session is a no-op.
     *
     * @param reason why the session is terminated
     */
    void close(TerminationReason reason);

    /**
     * Attaches an opaque object to the session. The coordinator attaches the session's binding here.
     *
     * @param attachment the object to attach, null to clear
     */
    void setAttachment(Object attachment);

    /**
     * Retrieves the object previously attached with {@link #setAttachment(Object)}.
     *
     * @return the attachment, or null
     */
    Object getAttachment();
}
