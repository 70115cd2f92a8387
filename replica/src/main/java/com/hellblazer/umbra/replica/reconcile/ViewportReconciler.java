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

import com.hellblazer.umbra.geometry.ChunkGrid;
import com.hellblazer.umbra.geometry.ChunkId;
import com.hellblazer.umbra.geometry.Viewport;
import com.hellblazer.umbra.replica.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Brings the spatial subscriptions of a {@link SubscriptionRegistry} in line with a viewport.
 * <p>
 * Each pass maps the viewport, grown by the pre-fetch margin, to its required chunks and diffs that set against the
 * registry's live state:
 * <ul>
 *   <li>added: required chunks missing a subscription for at least one spatial type</li>
 *   <li>removed: chunks holding any subscription that are no longer required</li>
 * </ul>
 * When both are empty the registry is not touched. Because the diff is always taken against what the registry
 * actually holds, a pair dropped by a failed subscribe is picked up again by the next pass.
 * <p>
 * Confined to the event loop.
 *
 * @author hal.hildebrand
 */
public class ViewportReconciler {
    private static final Logger log = LoggerFactory.getLogger(ViewportReconciler.class);

    private final ChunkGrid            grid;
    private final SubscriptionRegistry registry;
    private final float                prefetchMargin;

    private Viewport     viewport;
    private Set<ChunkId> required = Set.of();

    public ViewportReconciler(ChunkGrid grid, SubscriptionRegistry registry, float prefetchMargin) {
        this.grid = Objects.requireNonNull(grid, "Chunk grid cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        if (prefetchMargin < 0.0f) {
            throw new IllegalArgumentException("Pre-fetch margin must be non-negative: " + prefetchMargin);
        }
        this.prefetchMargin = prefetchMargin;
    }

    /**
     * Reconcile the registry against a new viewport.
     *
     * @param viewport the new viewport, null for no interest region
     * @return what the pass did
     */
    public ReconcileResult reconcile(Viewport viewport) {
        this.viewport = viewport;
        required = requiredChunks(viewport);
        if (registry.spatialTypes().isEmpty()) {
            return ReconcileResult.unchanged(required);
        }

        var added = new TreeSet<>(required);
        added.removeAll(registry.completeChunks());
        var removed = new TreeSet<>(registry.trackedChunks());
        removed.removeAll(required);
        if (added.isEmpty() && removed.isEmpty()) {
            return ReconcileResult.unchanged(required);
        }

        var before = registry.mutationCount();
        for (var chunk : removed) {
            for (var type : registry.spatialTypes()) {
                registry.remove(type, chunk);
            }
        }
        for (var chunk : added) {
            for (var type : registry.spatialTypes()) {
                registry.add(type, chunk);
            }
        }
        var result = new ReconcileResult(required, added, removed, registry.mutationCount() - before);
        log.debug("Viewport {}: +{} -{} chunks, {} mutations", viewport, added, removed, result.mutations());
        return result;
    }

    /**
     * Drop the viewport, releasing every spatial subscription.
     */
    public ReconcileResult clear() {
        return reconcile(null);
    }

    /**
     * @return the chunks required by the last reconciled viewport
     */
    public Set<ChunkId> required() {
        return required;
    }

    public boolean isRequired(ChunkId chunk) {
        return required.contains(chunk);
    }

    public Optional<Viewport> viewport() {
        return Optional.ofNullable(viewport);
    }

    public float getPrefetchMargin() {
        return prefetchMargin;
    }

    private Set<ChunkId> requiredChunks(Viewport viewport) {
        if (viewport == null || viewport.isEmpty()) {
            return Set.of();
        }
        return grid.chunksOverlapping(viewport.expand(prefetchMargin));
    }
}
