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
import com.hellblazer.umbra.geometry.Viewport;
import com.hellblazer.umbra.replica.connection.ReplicaConnection;
import com.hellblazer.umbra.replica.connection.RowListener;
import com.hellblazer.umbra.replica.connection.RowRegistration;
import com.hellblazer.umbra.replica.entity.EntityTable;
import com.hellblazer.umbra.replica.entity.EntityTables;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.entity.Placeable;
import com.hellblazer.umbra.replica.entity.Positioned;
import com.hellblazer.umbra.replica.entity.Scope;
import com.hellblazer.umbra.replica.loop.EventLoop;
import com.hellblazer.umbra.replica.model.Player;
import com.hellblazer.umbra.replica.reconcile.ReconcileResult;
import com.hellblazer.umbra.replica.reconcile.ViewportReconciler;
import com.hellblazer.umbra.replica.store.ReplicaSet;
import com.hellblazer.umbra.replica.store.ReplicaStore;
import com.hellblazer.umbra.replica.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Everything that lives exactly as long as one bound connection: the replicas, the subscription registry, the
 * reconciler and the row callbacks.
 * <p>
 * Row events are re-posted onto the event loop and applied there. Once the session is closed, events still queued
 * for it are dropped, so nothing from a dead connection reaches a later one.
 * <p>
 * Beyond applying rows, the session:
 * <ul>
 *   <li>discards inserts of spatial entities outside the required chunks, when configured to</li>
 *   <li>reports the arrival and removal of the local player's own row</li>
 *   <li>reports entities placed by the local player as they appear</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class ReplicationSession {
    private static final Logger log = LoggerFactory.getLogger(ReplicationSession.class);

    private final ReplicaConnection          connection;
    private final Identity                   identity;
    private final ReplicationConfig          config;
    private final EventLoop                  loop;
    private final LongSupplier               clock;
    private final Consumer<ReplicationEvent> events;
    private final ChunkGrid                  grid;
    private final ReplicaSet                 replicas;
    private final SubscriptionRegistry       registry;
    private final ViewportReconciler         reconciler;
    private final List<RowRegistration>      registrations = new ArrayList<>();
    private final AtomicLong                 strayInserts  = new AtomicLong();

    private volatile boolean closed;
    private volatile boolean localActorRegistered;

    public ReplicationSession(ReplicaConnection connection, ReplicationConfig config, EventLoop loop,
                              LongSupplier clock, Consumer<ReplicationEvent> events) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.identity = Objects.requireNonNull(connection.identity(), "Connection identity cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.loop = Objects.requireNonNull(loop, "Event loop cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.events = Objects.requireNonNull(events, "Event sink cannot be null");
        this.grid = config.createChunkGrid();
        this.replicas = new ReplicaSet(config.getPositionEpsilon());
        this.registry = new SubscriptionRegistry(connection.subscriptions(), grid, loop, config.spatialTypes());
        this.reconciler = new ViewportReconciler(grid, registry, config.getPrefetchMargin());
    }

    /**
     * Register the row callbacks of every table, then issue the global subscriptions.
     *
     * @throws RuntimeException if the connection refuses a row listener; the session is then unusable and must be
     *                          closed
     */
    public void bind() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
        for (var table : EntityTables.all()) {
            bindRows(table);
        }
        for (var type : config.globalTypes()) {
            registry.addGlobal(type);
        }
        log.debug("Bound {} tables and {} global subscriptions for {}", registrations.size(),
                  registry.globalTypes().size(), identity.toDebugString());
    }

    /**
     * Re-issue failed global subscriptions, then reconcile the spatial subscriptions against the viewport.
     */
    public ReconcileResult updateViewport(Viewport viewport) {
        if (closed) {
            return ReconcileResult.unchanged(reconciler.required());
        }
        retryGlobals();
        return reconciler.reconcile(viewport);
    }

    /**
     * Tear down: cancel the row callbacks, release every subscription and clear every replica. Idempotent.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (var registration : registrations) {
            try {
                registration.cancel();
            } catch (RuntimeException e) {
                log.debug("Cancel of row listener failed, connection likely gone: {}", e.toString());
            }
        }
        registrations.clear();
        var released = registry.removeAll();
        var cleared = replicas.clearAll();
        localActorRegistered = false;
        log.debug("Closed session of {}: released {} subscriptions, cleared {} entities", identity.toDebugString(),
                  released, cleared);
    }

    public ReplicaConnection connection() {
        return connection;
    }

    public Identity identity() {
        return identity;
    }

    public ReplicaSet replicas() {
        return replicas;
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    public ViewportReconciler reconciler() {
        return reconciler;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isLocalActorRegistered() {
        return localActorRegistered;
    }

    /**
     * @return the number of inserts discarded because their chunk was not required
     */
    public long strayInsertCount() {
        return strayInserts.get();
    }

    private <K, E> void bindRows(EntityTable<K, E> table) {
        var store = replicas.store(table);
        registrations.add(connection.addRowListener(table, new RowListener<E>() {
            @Override
            public void onInsert(E row) {
                loop.execute(() -> {
                    if (!closed) {
                        inserted(table, store, row);
                    }
                });
            }

            @Override
            public void onUpdate(E oldRow, E newRow) {
                loop.execute(() -> {
                    if (!closed) {
                        updated(table, store, oldRow, newRow);
                    }
                });
            }

            @Override
            public void onDelete(E row) {
                loop.execute(() -> {
                    if (!closed) {
                        deleted(table, store, row);
                    }
                });
            }
        }));
    }

    private <K, E> void inserted(EntityTable<K, E> table, ReplicaStore<K, E> store, E row) {
        var fresh = !store.contains(table.keyOf(row));
        if (fresh && isStray(table, row)) {
            return;
        }
        if (store.onInsert(row)) {
            observe(table, row, fresh);
        }
    }

    private <K, E> void updated(EntityTable<K, E> table, ReplicaStore<K, E> store, E oldRow, E newRow) {
        var fresh = !store.contains(table.keyOf(newRow));
        if (fresh && isStray(table, newRow)) {
            return;
        }
        if (store.onUpdate(oldRow, newRow)) {
            observe(table, newRow, fresh);
        }
    }

    private <K, E> void deleted(EntityTable<K, E> table, ReplicaStore<K, E> store, E row) {
        if (!store.onDelete(row)) {
            return;
        }
        if (table == EntityTables.PLAYERS && isLocal((Player) row) && localActorRegistered) {
            localActorRegistered = false;
            reconciler.clear();
            log.info("Local player {} removed, viewport cleared", identity.toDebugString());
            events.accept(new ReplicationEvent.LocalActorRemoved(clock.getAsLong(), identity));
        }
    }

    private <K, E> void observe(EntityTable<K, E> table, E row, boolean fresh) {
        if (table == EntityTables.PLAYERS) {
            var player = (Player) row;
            if (isLocal(player) && !localActorRegistered) {
                localActorRegistered = true;
                log.info("Local player {} registered at ({}, {})", identity.toDebugString(), player.posX(),
                         player.posY());
                events.accept(new ReplicationEvent.LocalActorRegistered(clock.getAsLong(), identity, player));
            }
        } else if (fresh && row instanceof Placeable placeable && identity.equals(placeable.placedBy())) {
            log.debug("Placement of {} {} confirmed", table.type(), table.keyOf(row));
            events.accept(
            new ReplicationEvent.PlacementConfirmed(clock.getAsLong(), identity, table.type(), table.keyOf(row),
                                                    placeable.posX(), placeable.posY()));
        }
    }

    private boolean isLocal(Player player) {
        return identity.equals(player.identity());
    }

    private <K, E> boolean isStray(EntityTable<K, E> table, E row) {
        if (!config.isDiscardStrayInserts() || config.scopeOf(table.type()) != Scope.SPATIAL
        || !(row instanceof Positioned positioned)) {
            return false;
        }
        var chunk = grid.chunkAt(positioned.posX(), positioned.posY(), ReplicationConfig.TILE_SIZE);
        if (reconciler.isRequired(chunk)) {
            return false;
        }
        strayInserts.incrementAndGet();
        log.debug("Discarding {} {} in unrequired chunk {}", table.type(), table.keyOf(row), chunk);
        return true;
    }

    private void retryGlobals() {
        for (var type : config.globalTypes()) {
            if (!registry.isGlobalTracked(type) && registry.addGlobal(type)) {
                log.info("Re-issued global subscription {}", type);
            }
        }
    }
}
