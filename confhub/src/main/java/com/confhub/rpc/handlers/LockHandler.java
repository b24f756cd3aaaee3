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

import com.confhub.datastore.Datastore;
import com.confhub.datastore.DatastoreLockTable;
import com.confhub.rpc.RpcError;
import com.confhub.rpc.RpcException;
import com.confhub.rpc.RpcHandler;
import com.confhub.rpc.RpcRequest;
import com.confhub.rpc.RpcResponse;
import com.confhub.session.Binding;
import com.confhub.transport.TransportSession;

/**
 * lock: acquires the exclusive lock of the target datastore for the calling session.
 */
public class LockHandler implements RpcHandler {
    public static final String OPERATION = "lock";
    private final DatastoreLockTable lockTable;

    public LockHandler(DatastoreLockTable lockTable) {
        this.lockTable = lockTable;
    }

    @Override
    public void execute(Binding binding, RpcRequest request, RpcResponse response) {
        Datastore target = request.requireTarget();
        TransportSession session = binding.getTransportSession();
        if (lockTable.tryAcquire(target, session)) {
            response.writeOk();
            return;
        }

        TransportSession owner = lockTable.ownerOf(target);
        if (owner == null) {
            // Released in the meantime, the caller may retry.
            throw new RpcException(RpcError.LOCK_DENIED, String.format("lock on %s is being released", target));
        }
        if (owner == session) {
            throw new RpcException(RpcError.LOCK_DENIED, String.format("lock on %s is already held by this session", target), owner.getId());
        }
        throw new RpcException(RpcError.LOCK_DENIED, String.format("lock on %s is held by session %d", target, owner.getId()), owner.getId());
    }
}
