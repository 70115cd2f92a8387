/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Umbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.umbra.replica;

import com.hellblazer.umbra.replica.entity.EntityTable;
import com.hellblazer.umbra.replica.model.WorldState;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the replicas of the currently bound connection. Every method is safe to call from any thread.
 * While no connection is bound all replicas read as empty.
 *
 * @author hal.hildebrand
 */
public interface ReplicaView {

    /**
     * @return an immutable copy of a table's replica
     */
    <K, E> Map<K, E> snapshot(EntityTable<K, E> table);

    <K, E> Optional<E> find(EntityTable<K, E> table, K key);

    Optional<WorldState> worldState();

    /**
     * @return true once the local player's own row has arrived on the current connection
     */
    boolean isLocalActorRegistered();

    ConnectionState state();
}
