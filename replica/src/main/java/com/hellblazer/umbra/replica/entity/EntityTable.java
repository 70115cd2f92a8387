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
import java.util.function.Function;

/**
 * Typed binding of an {@link EntityType} to the record class that carries its rows, the function extracting each
 * row's stable key, and the factory for its {@link ChangeFilter}.
 *
 * @param <K> key type
 * @param <E> entity type
 * @author hal.hildebrand
 */
public final class EntityTable<K, E> {
    private final EntityType            type;
    private final Class<E>              entityClass;
    private final Function<? super E, K> keyExtractor;
    private final ChangeFilter.Factory<E> filterFactory;

    EntityTable(EntityType type, Class<E> entityClass, Function<? super E, K> keyExtractor,
                ChangeFilter.Factory<E> filterFactory) {
        this.type = Objects.requireNonNull(type, "Entity type cannot be null");
        this.entityClass = Objects.requireNonNull(entityClass, "Entity class cannot be null");
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "Key extractor cannot be null");
        this.filterFactory = Objects.requireNonNull(filterFactory, "Filter factory cannot be null");
    }

    public EntityType type() {
        return type;
    }

    public Class<E> entityClass() {
        return entityClass;
    }

    /**
     * @return the stable identity of the entity within this table
     */
    public K keyOf(E entity) {
        return keyExtractor.apply(entity);
    }

    public ChangeFilter<E> changeFilter(float positionEpsilon) {
        return filterFactory.create(positionEpsilon);
    }

    /**
     * @return true if entities of this table occupy a position in world space
     */
    public boolean isPositioned() {
        return Positioned.class.isAssignableFrom(entityClass);
    }

    public boolean isPlaceable() {
        return Placeable.class.isAssignableFrom(entityClass);
    }

    @Override
    public String toString() {
        return "EntityTable[" + type.tableName() + "]";
    }
}
