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

import com.hellblazer.umbra.geometry.ChunkGrid;
import com.hellblazer.umbra.geometry.ChunkId;
import com.hellblazer.umbra.replica.entity.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns every live subscription of one connection.
 * <p>
 * Spatial subscriptions are indexed by (entity type, chunk), global subscriptions by entity type. There is at most one
 * entry per key. All operations are idempotent.
 * <p>
 * A subscription that fails, either by throwing from the subscribe call or by reporting an error later, is dropped
 * from the registry and logged. Failures never propagate to the caller; a dropped pair is simply absent, so the next
 * reconciliation pass that still requires it subscribes again.
 * <p>
 * Mutations must be made from the owning event loop. Completion callbacks from the subscription service are re-posted
 * onto that loop. The observation methods may be called from any thread.
 *
 * @author hal.hildebrand
 */
public class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final SubscriptionService                            service;
    private final ChunkGrid                                      grid;
    private final Executor                                       loop;
    private final Set<EntityType>                                spatialTypes;
    private final Map<SpatialKey, ManagedSubscription>           spatial   = new ConcurrentHashMap<>();
    private final Map<EntityType, ManagedSubscription>           global    = new ConcurrentHashMap<>();
    private final AtomicLong                                     mutations = new AtomicLong();
    private final AtomicLong                                     failures  = new AtomicLong();

    /**
     * @param service      the subscription service of the connection
     * @param grid         maps chunks to the index stored on remote rows
     * @param loop         the event loop completion callbacks are posted to
     * @param spatialTypes the entity types subscribed per chunk
     */
    public SubscriptionRegistry(SubscriptionService service, ChunkGrid grid, Executor loop,
                                Set<EntityType> spatialTypes) {
        this.service = Objects.requireNonNull(service, "Subscription service cannot be null");
        this.grid = Objects.requireNonNull(grid, "Chunk grid cannot be null");
        this.loop = Objects.requireNonNull(loop, "Event loop cannot be null");
        Objects.requireNonNull(spatialTypes, "Spatial types cannot be null");
        this.spatialTypes = spatialTypes.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(
        EnumSet.copyOf(spatialTypes));
    }

    /**
     * Subscribe to the rows of a spatial type in one chunk, unless a subscription for the pair already exists.
     *
     * @return true if a subscription was created
     */
    public boolean add(EntityType type, ChunkId chunk) {
        Objects.requireNonNull(chunk, "Chunk cannot be null");
        requireSpatial(type);
        var key = new SpatialKey(type, chunk);
        if (spatial.containsKey(key)) {
            return false;
        }
        var subscription = open(SubscriptionQuery.spatial(type, chunk, grid.indexOf(chunk)));
        if (subscription == null) {
            return false;
        }
        spatial.put(key, subscription);
        log.debug("Subscribed {}", subscription.query());
        return true;
    }

    /**
     * Release and forget the subscription for a pair, if present.
     *
     * @return true if a subscription was released
     */
    public boolean remove(EntityType type, ChunkId chunk) {
        Objects.requireNonNull(type, "Entity type cannot be null");
        Objects.requireNonNull(chunk, "Chunk cannot be null");
        var subscription = spatial.remove(new SpatialKey(type, chunk));
        if (subscription == null) {
            return false;
        }
        close(subscription);
        log.debug("Unsubscribed {}", subscription.query());
        return true;
    }

    /**
     * Subscribe to every row of a type, unless already subscribed.
     *
     * @return true if a subscription was created
     */
    public boolean addGlobal(EntityType type) {
        Objects.requireNonNull(type, "Entity type cannot be null");
        if (global.containsKey(type)) {
            return false;
        }
        var subscription = open(SubscriptionQuery.global(type));
        if (subscription == null) {
            return false;
        }
        global.put(type, subscription);
        log.debug("Subscribed {}", subscription.query());
        return true;
    }

    /**
     * @return true if a subscription was released
     */
    public boolean removeGlobal(EntityType type) {
        Objects.requireNonNull(type, "Entity type cannot be null");
        var subscription = global.remove(type);
        if (subscription == null) {
            return false;
        }
        close(subscription);
        return true;
    }

    /**
     * Release every tracked subscription, spatial and global.
     *
     * @return the number of subscriptions released
     */
    public int removeAll() {
        var released = new ArrayList<ManagedSubscription>(spatial.size() + global.size());
        for (var key : new ArrayList<>(spatial.keySet())) {
            var subscription = spatial.remove(key);
            if (subscription != null) {
                released.add(subscription);
            }
        }
        for (var type : new ArrayList<>(global.keySet())) {
            var subscription = global.remove(type);
            if (subscription != null) {
                released.add(subscription);
            }
        }
        released.forEach(this::close);
        if (!released.isEmpty()) {
            log.debug("Released {} subscriptions", released.size());
        }
        return released.size();
    }

    /**
     * @return the chunks with at least one live spatial subscription
     */
    public Set<ChunkId> trackedChunks() {
        var chunks = new TreeSet<ChunkId>();
        for (var key : spatial.keySet()) {
            chunks.add(key.chunk());
        }
        return Collections.unmodifiableSet(chunks);
    }

    /**
     * @return the chunks with a live subscription for every spatial type
     */
    public Set<ChunkId> completeChunks() {
        if (spatialTypes.isEmpty()) {
            return trackedChunks();
        }
        var counts = new HashMap<ChunkId, Integer>();
        for (var key : spatial.keySet()) {
            counts.merge(key.chunk(), 1, Integer::sum);
        }
        return counts.entrySet()
                     .stream()
                     .filter(e -> e.getValue() == spatialTypes.size())
                     .map(Map.Entry::getKey)
                     .collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean isTracked(EntityType type, ChunkId chunk) {
        return spatial.containsKey(new SpatialKey(type, chunk));
    }

    public boolean isGlobalTracked(EntityType type) {
        return global.containsKey(type);
    }

    /**
     * @return the spatial keys with a live subscription
     */
    public Set<SpatialKey> spatialKeys() {
        return Set.copyOf(spatial.keySet());
    }

    /**
     * @return the global types with a live subscription
     */
    public Set<EntityType> globalTypes() {
        return global.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(global.keySet()));
    }

    public Set<EntityType> spatialTypes() {
        return spatialTypes;
    }

    public int liveHandleCount() {
        return spatial.size() + global.size();
    }

    /**
     * @return subscribe requests issued plus subscriptions released
     */
    public long mutationCount() {
        return mutations.get();
    }

    public long failureCount() {
        return failures.get();
    }

    private ManagedSubscription open(SubscriptionQuery query) {
        var subscription = new ManagedSubscription(query);
        mutations.incrementAndGet();
        SubscriptionHandle handle;
        try {
            handle = service.subscribe(query, new Observer(subscription));
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("Subscribe to {} failed: {}", query, e.toString());
            return null;
        }
        if (handle == null) {
            failures.incrementAndGet();
            log.warn("Subscribe to {} returned no handle", query);
            return null;
        }
        subscription.attach(handle);
        if (subscription.status() == ManagedSubscription.Status.FAILED) {
            // error delivered inline by an executor that runs callbacks on the calling thread
            subscription.release();
            return null;
        }
        return subscription;
    }

    private void close(ManagedSubscription subscription) {
        mutations.incrementAndGet();
        subscription.release();
    }

    private void requireSpatial(EntityType type) {
        Objects.requireNonNull(type, "Entity type cannot be null");
        if (!spatialTypes.contains(type)) {
            throw new IllegalArgumentException(type + " is not subscribed per chunk");
        }
    }

    private void failed(ManagedSubscription subscription, Throwable cause) {
        if (subscription.isReleased()) {
            log.debug("Ignoring error from released subscription {}: {}", subscription.query(), String.valueOf(cause));
            return;
        }
        failures.incrementAndGet();
        subscription.markFailed();
        var query = subscription.query();
        log.warn("Subscription {} failed: {}", query, String.valueOf(cause));
        boolean removed;
        if (query.isSpatial()) {
            removed = spatial.remove(new SpatialKey(query.type(), query.chunk()), subscription);
        } else {
            removed = global.remove(query.type(), subscription);
        }
        if (removed) {
            subscription.release();
        }
    }

    /**
     * Key of a spatial subscription.
     */
    public record SpatialKey(EntityType type, ChunkId chunk) {
        public SpatialKey {
            Objects.requireNonNull(type, "Entity type cannot be null");
            Objects.requireNonNull(chunk, "Chunk cannot be null");
        }
    }

    private class Observer implements SubscriptionObserver {
        private final ManagedSubscription subscription;

        private Observer(ManagedSubscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void onApplied() {
            loop.execute(() -> {
                subscription.markApplied();
                log.debug("Applied {}", subscription.query());
            });
        }

        @Override
        public void onError(Throwable cause) {
            loop.execute(() -> failed(subscription, cause));
        }
    }
}
