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

import java.util.Objects;

/**
 * Decides whether an incoming update changes anything a consumer can observe.
 * <p>
 * Updates judged insignificant are not written to the replica and raise no change signal, which bounds the downstream
 * work caused by high frequency, visually irrelevant updates such as sub-pixel position jitter.
 *
 * @param <E> entity type
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ChangeFilter<E> {

    /**
     * @param stored   the value currently held by the replica
     * @param incoming the value carried by the update
     * @return true if the incoming value should replace the stored one
     */
    boolean isSignificant(E stored, E incoming);

    /**
     * Creates a filter for a configured position tolerance.
     *
     * @param <E> entity type
     */
    @FunctionalInterface
    interface Factory<E> {
        ChangeFilter<E> create(float positionEpsilon);
    }

    /**
     * @return a filter accepting any update that differs by equality
     */
    static <E> ChangeFilter<E> anyDifference() {
        return (stored, incoming) -> !Objects.equals(stored, incoming);
    }

    /**
     * @return true if either coordinate moved strictly more than epsilon
     */
    static boolean moved(Positioned stored, Positioned incoming, float epsilon) {
        return Math.abs(stored.posX() - incoming.posX()) > epsilon
        || Math.abs(stored.posY() - incoming.posY()) > epsilon;
    }
}
