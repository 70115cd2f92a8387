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
package com.hellblazer.umbra.replica.model;

import com.hellblazer.umbra.replica.entity.ChangeFilter;
import com.hellblazer.umbra.replica.entity.Positioned;

import java.util.Objects;

/**
 * A harvestable tree. Trees are partitioned by chunk.
 *
 * @param lastHitTimeMs time of the last hit, null if never hit
 * @param respawnAtMs   respawn time while felled, null while standing
 * @author hal.hildebrand
 */
public record Tree(long id, float posX, float posY, int health, String treeType, Long lastHitTimeMs, Long respawnAtMs)
implements Positioned {

    public static ChangeFilter<Tree> changeFilter(float positionEpsilon) {
        return (stored, incoming) -> ChangeFilter.moved(stored, incoming, positionEpsilon)
        || stored.health != incoming.health
        || !Objects.equals(stored.treeType, incoming.treeType)
        || !Objects.equals(stored.lastHitTimeMs, incoming.lastHitTimeMs)
        || !Objects.equals(stored.respawnAtMs, incoming.respawnAtMs);
    }

    public Tree withHealth(int health, Long lastHitTimeMs) {
        return new Tree(id, posX, posY, health, treeType, lastHitTimeMs, respawnAtMs);
    }

    public Tree withPosition(float x, float y) {
        return new Tree(id, x, y, health, treeType, lastHitTimeMs, respawnAtMs);
    }
}
