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
package com.hellblazer.umbra.replica.reconcile;

import com.hellblazer.umbra.geometry.ChunkId;

import java.util.Set;

/**
 * Outcome of one reconciliation pass.
 *
 * @param required  chunks the viewport requires
 * @param added     chunks subscribed by this pass
 * @param removed   chunks released by this pass
 * @param mutations registry mutations performed
 * @author hal.hildebrand
 */
public record ReconcileResult(Set<ChunkId> required, Set<ChunkId> added, Set<ChunkId> removed, long mutations) {

    public ReconcileResult {
        required = Set.copyOf(required);
        added = Set.copyOf(added);
        removed = Set.copyOf(removed);
    }

    public static ReconcileResult unchanged(Set<ChunkId> required) {
        return new ReconcileResult(required, Set.of(), Set.of(), 0);
    }

    public boolean isUnchanged() {
        return added.isEmpty() && removed.isEmpty();
    }
}
