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

import com.confhub.FakeTransportSession;
import com.confhub.datastore.Datastore;
import com.confhub.rpc.RpcError;
import com.confhub.rpc.RpcReply;
import com.confhub.rpc.RpcResponse;
import com.confhub.session.Binding;
import com.confhub.transport.SessionStatus;
import com.confhub.transport.TerminationReason;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SessionHandlersTest extends BaseHandlerTest {

    @Test
    void test_close_session() {
        Binding alice = admit("alice");
        RpcResponse response = execute(alice, request(CloseSessionHandler.OPERATION));

        assertTrue(response.getReply().isOk());
        assertTrue(response.isCloseSession());
        // The protocol engine closes the session once the reply has been sent.
        assertEquals(SessionStatus.RUNNING, alice.getTransportSession().getStatus());
    }

    @Test
    void test_kill_session() {
        Binding alice = admit("alice");
        Binding bob = admit("bob");
        lock(bob, "candidate");

        RpcReply reply = execute(alice, request(KillSessionHandler.OPERATION).setSessionId(bob.getSessionId())).getReply();

        assertTrue(reply.isOk());
        FakeTransportSession victim = (FakeTransportSession) bob.getTransportSession();
        assertEquals(SessionStatus.INVALID, victim.getStatus());
        assertEquals(TerminationReason.KILLED, victim.getTerminationReason());

        sessionService.getRegistry().removeTerminated();
        assertFalse(lockTable().isLocked(Datastore.CANDIDATE));
    }

    @Test
    void test_kill_session_self() {
        Binding alice = admit("alice");
        RpcReply reply = execute(alice, request(KillSessionHandler.OPERATION).setSessionId(alice.getSessionId())).getReply();

        assertEquals(RpcError.INVALID_VALUE, reply.getError().getTag());
        assertEquals(SessionStatus.RUNNING, alice.getTransportSession().getStatus());
    }

    @Test
    void test_kill_session_unknown() {
        Binding alice = admit("alice");
        RpcReply reply = execute(alice, request(KillSessionHandler.OPERATION).setSessionId(Long.MAX_VALUE)).getReply();
        assertEquals(RpcError.INVALID_VALUE, reply.getError().getTag());
    }

    @Test
    void test_kill_session_missing_id() {
        Binding alice = admit("alice");
        RpcReply reply = execute(alice, request(KillSessionHandler.OPERATION)).getReply();
        assertEquals(RpcError.MISSING_ELEMENT, reply.getError().getTag());
    }

    @Test
    void test_get_locks() {
        Binding alice = admit("alice");
        Binding bob = admit("bob");
        lock(alice, "running");
        lock(bob, "candidate");

        RpcReply reply = execute(alice, request(GetLocksHandler.OPERATION)).getReply();

        assertThat(reply.getData()).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Long> locks = (Map<String, Long>) reply.getData();
        assertThat(locks)
                .containsEntry("running", alice.getSessionId())
                .containsEntry("candidate", bob.getSessionId())
                .hasSize(2);
    }
}
