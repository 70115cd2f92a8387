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
package com.hellblazer.umbra.replica;

import com.hellblazer.umbra.geometry.ChunkGrid;
import com.hellblazer.umbra.geometry.ViewportTracker;
import com.hellblazer.umbra.replica.entity.EntityType;
import com.hellblazer.umbra.replica.entity.Scope;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of the replication layer: world and chunk geometry, the visible rectangle, viewport smoothing, update
 * filtering and the subscription scope of each entity type.
 * <p>
 * The defaults describe a 100 x 100 tile world of 48 unit tiles, split into chunks of 20 x 20 tiles, seen through a
 * 960 x 720 window with a two tile pre-fetch margin.
 *
 * @author hal.hildebrand
 */
public class ReplicationConfig {

    public static final float TILE_SIZE = 48.0f;

    private final float                  chunkSize;
    private final float                  worldWidth;
    private final float                  worldHeight;
    private final float                  viewWidth;
    private final float                  viewHeight;
    private final float                  prefetchMargin;
    private final long                   debounceMillis;
    private final float                  movementThresholdSquared;
    private final float                  positionEpsilon;
    private final boolean                discardStrayInserts;
    private final Map<EntityType, Scope> scopeOverrides;

    private ReplicationConfig(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.worldWidth = builder.worldWidth;
        this.worldHeight = builder.worldHeight;
        this.viewWidth = builder.viewWidth;
        this.viewHeight = builder.viewHeight;
        this.prefetchMargin = builder.prefetchMargin;
        this.debounceMillis = builder.debounceMillis;
        this.movementThresholdSquared = builder.movementThresholdSquared;
        this.positionEpsilon = builder.positionEpsilon;
        this.discardStrayInserts = builder.discardStrayInserts;
        this.scopeOverrides = builder.scopeOverrides.isEmpty() ? Map.of() : Collections.unmodifiableMap(
        new EnumMap<>(builder.scopeOverrides));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the defaults described in the class comment
     */
    public static ReplicationConfig defaultConfig() {
        return builder().build();
    }

    public float getChunkSize() {
        return chunkSize;
    }

    public float getWorldWidth() {
        return worldWidth;
    }

    public float getWorldHeight() {
        return worldHeight;
    }

    public float getViewWidth() {
        return viewWidth;
    }

    public float getViewHeight() {
        return viewHeight;
    }

    /**
     * @return margin added on every side of the visible rectangle before it is mapped to chunks
     */
    public float getPrefetchMargin() {
        return prefetchMargin;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public float getMovementThresholdSquared() {
        return movementThresholdSquared;
    }

    /**
     * @return position change below which updates of positioned entities are ignored
     */
    public float getPositionEpsilon() {
        return positionEpsilon;
    }

    /**
     * @return true if inserts of spatial entities outside the required chunks are dropped
     */
    public boolean isDiscardStrayInserts() {
        return discardStrayInserts;
    }

    public Map<EntityType, Scope> getScopeOverrides() {
        return scopeOverrides;
    }

    /**
     * @return the configured scope of a type, falling back to its default
     */
    public Scope scopeOf(EntityType type) {
        return scopeOverrides.getOrDefault(type, type.defaultScope());
    }

    public Set<EntityType> spatialTypes() {
        return typesOf(Scope.SPATIAL);
    }

    public Set<EntityType> globalTypes() {
        return typesOf(Scope.GLOBAL);
    }

    public ChunkGrid createChunkGrid() {
        return new ChunkGrid(chunkSize, worldWidth, worldHeight);
    }

    public ViewportTracker createViewportTracker() {
        return new ViewportTracker(viewWidth, viewHeight, debounceMillis, movementThresholdSquared);
    }

    private Set<EntityType> typesOf(Scope scope) {
        var types = EnumSet.noneOf(EntityType.class);
        for (var type : EntityType.values()) {
            if (scopeOf(type) == scope) {
                types.add(type);
            }
        }
        return Collections.unmodifiableSet(types);
    }

    @Override
    public String toString() {
        return String.format(
        "ReplicationConfig[chunk=%.1f, world=%.1fx%.1f, view=%.1fx%.1f, prefetch=%.1f, debounce=%dms, threshold=%.1f, epsilon=%.3f, discardStray=%s, overrides=%s]",
        chunkSize, worldWidth, worldHeight, viewWidth, viewHeight, prefetchMargin, debounceMillis,
        movementThresholdSquared, positionEpsilon, discardStrayInserts, scopeOverrides);
    }

    /**
     * Builder for ReplicationConfig
     */
    public static class Builder {
        private float                  chunkSize                = 20 * TILE_SIZE;
        private float                  worldWidth               = 100 * TILE_SIZE;
        private float                  worldHeight              = 100 * TILE_SIZE;
        private float                  viewWidth                = 960.0f;
        private float                  viewHeight               = 720.0f;
        private float                  prefetchMargin           = 2 * TILE_SIZE;
        private long                   debounceMillis           = 100;
        private float                  movementThresholdSquared = TILE_SIZE * TILE_SIZE;
        private float                  positionEpsilon          = 0.01f;
        private boolean                discardStrayInserts      = true;
        private final Map<EntityType, Scope> scopeOverrides     = new EnumMap<>(EntityType.class);

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if size is not positive
         */
        public Builder withChunkSize(float size) {
            this.chunkSize = positive("Chunk size", size);
            return this;
        }

        /**
         * @throws IllegalArgumentException if either dimension is not positive
         */
        public Builder withWorldSize(float width, float height) {
            this.worldWidth = positive("World width", width);
            this.worldHeight = positive("World height", height);
            return this;
        }

        /**
         * Sets the visible rectangle centered on the focus.
         *
         * @throws IllegalArgumentException if either dimension is not positive
         */
        public Builder withViewSize(float width, float height) {
            this.viewWidth = positive("View width", width);
            this.viewHeight = positive("View height", height);
            return this;
        }

        public Builder withPrefetchMargin(float margin) {
            this.prefetchMargin = nonNegative("Pre-fetch margin", margin);
            return this;
        }

        public Builder withDebounceMillis(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("Debounce interval must be non-negative: " + millis);
            }
            this.debounceMillis = millis;
            return this;
        }

        /**
         * @param thresholdSquared squared focus displacement required for a new viewport
         */
        public Builder withMovementThresholdSquared(float thresholdSquared) {
            this.movementThresholdSquared = nonNegative("Movement threshold", thresholdSquared);
            return this;
        }

        public Builder withPositionEpsilon(float epsilon) {
            this.positionEpsilon = nonNegative("Position epsilon", epsilon);
            return this;
        }

        public Builder withDiscardStrayInserts(boolean discard) {
            this.discardStrayInserts = discard;
            return this;
        }

        /**
         * Override the default subscription scope of a type. Only chunk-indexed types can be subscribed per chunk.
         *
         * @throws IllegalArgumentException if type or scope is null, or a type without a chunk index is made spatial
         */
        public Builder withScope(EntityType type, Scope scope) {
            if (type == null || scope == null) {
                throw new IllegalArgumentException("Entity type and scope cannot be null");
            }
            if (scope == Scope.SPATIAL && !type.isChunkIndexed()) {
                throw new IllegalArgumentException(type + " has no chunk index and cannot be subscribed per chunk");
            }
            if (scope == type.defaultScope()) {
                scopeOverrides.remove(type);
            } else {
                scopeOverrides.put(type, scope);
            }
            return this;
        }

        public ReplicationConfig build() {
            return new ReplicationConfig(this);
        }

        private static float positive(String name, float value) {
            if (!(value > 0.0f) || Float.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be positive and finite: " + value);
            }
            return value;
        }

        private static float nonNegative(String name, float value) {
            if (!(value >= 0.0f) || Float.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be non-negative and finite: " + value);
            }
            return value;
        }
    }
}
