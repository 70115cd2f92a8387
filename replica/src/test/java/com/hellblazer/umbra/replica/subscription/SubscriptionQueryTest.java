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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionQueryTest {

    @Test
    void testPredicates() {
        assertEquals("SELECT * FROM tree WHERE chunk_index = 42",
                     SubscriptionQuery.spatial(EntityType.TREE, new ChunkId(2, 8), 42).predicate());
        assertEquals("SELECT * FROM item_definition", SubscriptionQuery.global(EntityType.ITEM_DEFINITION).predicate());
    }

    @Test
    void testScope() {
        assertTrue(SubscriptionQuery.spatial(EntityType.STONE, new ChunkId(0, 0), 0).isSpatial());
        assertFalse(SubscriptionQuery.global(EntityType.PLAYER).isSpatial());
    }

    @Test
    void testChunkAndIndexGoTogether() {
        assertThrows(IllegalArgumentException.class, () -> new SubscriptionQuery(EntityType.TREE, null, 3));
        assertThrows(IllegalArgumentException.class,
                     () -> new SubscriptionQuery(EntityType.TREE, new ChunkId(0, 0), -1));
    }
}
