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

/**
 * Receives the effective changes of a {@link ReplicaStore}. Suppressed and duplicate events produce no callback.
 * <p>
 * Callbacks run on the event loop that mutates the store and must not block.
 *
 * @param <E> entity type
 * @author hal.hildebrand
 */
public interface ReplicaListener<E> {

    default void onInserted(E entity) {
    }

    default void onUpdated(E previous, E current) {
    }

    default void onRemoved(E entity) {
    }

    /**
     * The store was emptied by connection teardown.
     */
    default void onCleared() {
    }
}
