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
package com.hellblazer.umbra.geometry;

/**
 * Identifies one fixed-size cell of the chunk grid by its column and row.
 *
 * @param x column, from 0 at the world's minimum x
 * @param y row, from 0 at the world's minimum y
 * @author hal.hildebrand
 */
public record ChunkId(int x, int y) implements Comparable<ChunkId> {

    /**
     * Row-major ordering, matching the ordering of {@link ChunkGrid#indexOf(ChunkId)}.
     */
    @Override
    public int compareTo(ChunkId other) {
        var rows = Integer.compare(y, other.y);
        return rows != 0 ? rows : Integer.compare(x, other.x);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
