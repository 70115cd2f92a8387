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
package com.hellblazer.umbra.replica.store;

import com.hellblazer.umbra.replica.entity.EntityTable;
import com.hellblazer.umbra.replica.entity.EntityTables;
import com.hellblazer.umbra.replica.entity.EntityType;
import com.hellblazer.umbra.replica.model.WorldState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link ReplicaStore} per entity type, for the lifetime of a connection.
 *
 * @author hal.hildebrand
 */
public class ReplicaSet {
    private final Map<EntityType, ReplicaStore<?, ?>> stores;

    public ReplicaSet(float positionEpsilon) {
        var byType = new EnumMap<EntityType, ReplicaStore<?, ?>>(EntityType.class);
        for (var table : EntityTables.all()) {
            byType.put(table.type(), new ReplicaStore<>(table, positionEpsilon));
        }
        stores = Collections.unmodifiableMap(byType);
    }

    @SuppressWarnings("unchecked")
    public <K, E> ReplicaStore<K, E> store(EntityTable<K, E> table) {
        return (ReplicaStore<K, E>) stores.get(table.type());
    }

    public ReplicaStore<?, ?> store(EntityType type) {
        return stores.get(type);
    }

    /**
     * @return the world state row, if it has been replicated
     */
    public Optional<WorldState> worldState() {
        return store(EntityTables.WORLD_STATES).values().stream().findFirst();
    }

    /**
     * Empty every store.
     *
     * @return the number of entities removed
     */
    public int clearAll() {
        var removed = 0;
        for (var store : stores.values()) {
            removed += store.clear();
        }
        return removed;
    }

    public int totalSize() {
        return stores.values().stream().mapToInt(ReplicaStore::size).sum();
    }

    public boolean isEmpty() {
        return totalSize() == 0;
    }
}
