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
package com.hellblazer.umbra.replica.subscription;

import com.hellblazer.umbra.geometry.ChunkId;
import com.hellblazer.umbra.replica.entity.EntityType;

import java.util.Objects;

/**
 * Describes one subscription: every row of a table, or the rows of a table in one chunk.
 *
 * @param type       the table
 * @param chunk      the chunk, null for a global query
 * @param chunkIndex row-major index of the chunk as stored on the remote rows, -1 for a global query
 * @author hal.hildebrand
 */
public record SubscriptionQuery(EntityType type, ChunkId chunk, int chunkIndex) {

    public SubscriptionQuery {
        Objects.requireNonNull(type, "Entity type cannot be null");
        if ((chunk == null) != (chunkIndex < 0)) {
            throw new IllegalArgumentException("Chunk and chunk index must both be present or both absent");
        }
    }

    public static SubscriptionQuery global(EntityType type) {
        return new SubscriptionQuery(type, null, -1);
    }

    public static SubscriptionQuery spatial(EntityType type, ChunkId chunk, int chunkIndex) {
        return new SubscriptionQuery(type, Objects.requireNonNull(chunk, "Chunk cannot be null"), chunkIndex);
    }

    public boolean isSpatial() {
        return chunk != null;
    }

    /**
     * @return the query in the service's SQL subset
     */
    public String predicate() {
        if (chunk == null) {
            return "SELECT * FROM " + type.tableName();
        }
        return "SELECT * FROM " + type.tableName() + " WHERE chunk_index = " + chunkIndex;
    }

    @Override
    public String toString() {
        return chunk == null ? type.tableName() : type.tableName() + "@" + chunk;
    }
}
