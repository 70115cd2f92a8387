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
package com.hellblazer.umbra.replica.entity;

/**
 * The closed set of entity kinds replicated from the authoritative service.
 * <p>
 * Each kind names the remote table it is read from and carries a default {@link Scope}. Only tables that store a
 * {@code chunk_index} column can be queried per chunk; of those, the static resources are spatial by default and the
 * rest is global. The scope can be overridden through configuration.
 *
 * @author hal.hildebrand
 */
public enum EntityType {
    PLAYER("player", Scope.GLOBAL, false),
    TREE("tree", Scope.SPATIAL, true),
    STONE("stone", Scope.SPATIAL, true),
    MUSHROOM("mushroom", Scope.SPATIAL, true),
    CAMPFIRE("campfire", Scope.GLOBAL, true),
    DROPPED_ITEM("dropped_item", Scope.GLOBAL, false),
    WOODEN_STORAGE_BOX("wooden_storage_box", Scope.GLOBAL, false),
    ITEM_DEFINITION("item_definition", Scope.GLOBAL, false),
    INVENTORY_ITEM("inventory_item", Scope.GLOBAL, false),
    RECIPE("recipe", Scope.GLOBAL, false),
    WORLD_STATE("world_state", Scope.GLOBAL, false),
    ACTIVE_EQUIPMENT("active_equipment", Scope.GLOBAL, false),
    CRAFTING_QUEUE_ITEM("crafting_queue_item", Scope.GLOBAL, false);

    private final String  tableName;
    private final Scope   defaultScope;
    private final boolean chunkIndexed;

    EntityType(String tableName, Scope defaultScope, boolean chunkIndexed) {
        this.tableName = tableName;
        this.defaultScope = defaultScope;
        this.chunkIndexed = chunkIndexed;
    }

    /**
     * @return the remote table name
     */
    public String tableName() {
        return tableName;
    }

    public Scope defaultScope() {
        return defaultScope;
    }

    /**
     * @return true if the remote table carries a {@code chunk_index} column, so the type may be subscribed per chunk
     */
    public boolean isChunkIndexed() {
        return chunkIndexed;
    }
}
