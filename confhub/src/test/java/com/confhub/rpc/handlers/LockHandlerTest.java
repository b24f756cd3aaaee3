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
import com.confhub.session.Binding;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LockHandlerTest extends BaseHandlerTest {

    @Test
    void test_lock() {
        Binding alice = admit("alice");
        assertTrue(lock(alice, "candidate").isOk());
        assertTrue(lockTable().isOwnedBy(Datastore.CANDIDATE, alice.getTransportSession()));
    }

    @Test
    void test_lock_held_by_another_session() {
        Binding alice = admit("alice");
        Binding bob = admit("bob");
        lock(alice, "candidate");

        RpcReply reply = lock(bob, "candidate");

        assertEquals(RpcError.LOCK_DENIED, reply.getError().getTag());
        assertEquals(alice.getSessionId(), reply.getError().getSessionId());
    }

    @Test
    void test_lock_twice_by_same_session() {
        Binding alice = admit("alice");
        lock(alice, "running");

        RpcReply reply = lock(alice, "running");

        assertEquals(RpcError.LOCK_DENIED, reply.getError().getTag());
        assertEquals(alice.getSessionId(), reply.getError().getSessionId());
    }

    @Test
    void test_lock_missing_target() {
        Binding alice = admit("alice");
        RpcReply reply = execute(alice, request(LockHandler.OPERATION)).getReply();
        assertEquals(RpcError.MISSING_ELEMENT, reply.getError().getTag());
    }

    @Test
    void test_lock_unknown_target() {
        Binding alice = admit("alice");
        assertEquals(RpcError.INVALID_VALUE, lock(alice, "intended").getError().getTag());
    }

    @Test
    void test_lock_released_when_owner_terminates() {
        Binding alice = admit("alice");
        Binding bob = admit("bob");

        assertTrue(lock(alice, "candidate").isOk());
        assertEquals(RpcError.LOCK_DENIED, lock(bob, "candidate").getError().getTag());

        // Alice goes away without unlocking.
        ((FakeTransportSession) alice.getTransportSession()).drop();
        assertEquals(1, sessionService.getRegistry().removeTerminated());
        assertFalse(lockTable().isLocked(Datastore.CANDIDATE));

        assertTrue(lock(bob, "candidate").isOk());
        assertTrue(lockTable().isOwnedBy(Datastore.CANDIDATE, bob.getTransportSession()));
    }
}
