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

import com.hellblazer.umbra.geometry.Viewport;
import com.hellblazer.umbra.replica.connection.ReplicaConnection;
import com.hellblazer.umbra.replica.entity.EntityTable;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.loop.EventLoop;
import com.hellblazer.umbra.replica.model.WorldState;
import com.hellblazer.umbra.replica.reconcile.ReconcileResult;
import com.hellblazer.umbra.replica.store.ReplicaListener;
import com.hellblazer.umbra.replica.store.ReplicaSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Binds the replication layer to at most one connection at a time.
 * <p>
 * {@link ConnectionState#UNBOUND} to {@link ConnectionState#BOUND} on {@link #onConnected}: a fresh
 * {@link ReplicationSession} registers its row callbacks and global subscriptions, and the last requested viewport is
 * applied. Notifying the bound connection again does nothing; notifying a different connection first tears the bound
 * one down.
 * <p>
 * {@link ConnectionState#BOUND} to {@link ConnectionState#UNBOUND} on {@link #onDisconnected} or
 * {@link #onConnectError}: the session is withdrawn from readers, then closed, releasing every subscription and
 * clearing every replica. The viewport is forgotten. A disconnect for a connection that is not the bound one is
 * ignored.
 * <p>
 * Mutating methods must be called on the event loop. The {@link ReplicaView} methods may be called from any thread.
 *
 * @author hal.hildebrand
 */
public class ConnectionLifecycle implements ReplicaView {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycle.class);

    private final ReplicationConfig                    config;
    private final EventLoop                            loop;
    private final LongSupplier                         clock;
    private final List<ReplicationEventListener>       listeners        = new CopyOnWriteArrayList<>();
    private final List<ReplicaBinding<?, ?>>           replicaListeners = new CopyOnWriteArrayList<>();

    private volatile ReplicationSession session;
    private          Viewport           viewport;

    public ConnectionLifecycle(ReplicationConfig config, EventLoop loop, LongSupplier clock) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.loop = Objects.requireNonNull(loop, "Event loop cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * A connection became available.
     */
    public void onConnected(ReplicaConnection connection) {
        Objects.requireNonNull(connection, "Connection cannot be null");
        var bound = session;
        if (bound != null) {
            if (bound.connection() == connection) {
                log.debug("Connection of {} already bound", bound.identity().toDebugString());
                return;
            }
            log.info("Connection of {} replaces bound connection of {}", connection.identity().toDebugString(),
                     bound.identity().toDebugString());
            unbind(bound, null);
        }

        var next = new ReplicationSession(connection, config, loop, clock, this::dispatch);
        for (var binding : replicaListeners) {
            binding.attach(next.replicas());
        }
        try {
            next.bind();
        } catch (RuntimeException e) {
            log.error("Failed to bind connection of {}", next.identity().toDebugString(), e);
            next.close();
            dispatch(new ReplicationEvent.Unbound(clock.getAsLong(), next.identity(), e));
            return;
        }
        session = next;
        log.info("Bound connection of {}", next.identity().toDebugString());
        dispatch(new ReplicationEvent.Bound(clock.getAsLong(), next.identity()));

        if (viewport != null) {
            next.updateViewport(viewport);
        }
    }

    /**
     * A connection was lost or closed.
     *
     * @param cause the failure, null for an orderly close
     */
    public void onDisconnected(ReplicaConnection connection, Throwable cause) {
        var bound = session;
        if (bound == null || bound.connection() != connection) {
            log.debug("Ignoring disconnect of a connection that is not bound");
            return;
        }
        unbind(bound, cause);
    }

    /**
     * Establishing or keeping the connection failed.
     */
    public void onConnectError(Throwable cause) {
        var bound = session;
        if (bound == null) {
            log.warn("Connect failed: {}", String.valueOf(cause));
            return;
        }
        unbind(bound, cause);
    }

    /**
     * Request a new interest region. Applied immediately when bound, otherwise remembered for the next bind.
     *
     * @param viewport the new viewport, null to drop all spatial interest
     * @return the reconciliation, if a connection is bound
     */
    public Optional<ReconcileResult> updateViewport(Viewport viewport) {
        this.viewport = viewport;
        var bound = session;
        if (bound == null) {
            log.debug("Not bound, viewport {} deferred", viewport);
            return Optional.empty();
        }
        return Optional.of(bound.updateViewport(viewport));
    }

    /**
     * Tear down the bound connection, if any, as if it had been closed.
     */
    public void shutdown() {
        var bound = session;
        if (bound != null) {
            unbind(bound, null);
        }
        viewport = null;
    }

    public void addEventListener(ReplicationEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeEventListener(ReplicationEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Observe a table's replica across connections. The listener is attached to the current session, if any, and to
     * every session bound later.
     */
    public <K, E> void addReplicaListener(EntityTable<K, E> table, ReplicaListener<E> listener) {
        var binding = new ReplicaBinding<>(table, listener);
        replicaListeners.add(binding);
        var bound = session;
        if (bound != null) {
            binding.attach(bound.replicas());
        }
    }

    public Optional<ReplicationSession> session() {
        return Optional.ofNullable(session);
    }

    public Optional<Identity> localIdentity() {
        return session().map(ReplicationSession::identity);
    }

    /**
     * @return the last requested viewport
     */
    public Optional<Viewport> viewport() {
        return Optional.ofNullable(viewport);
    }

    @Override
    public <K, E> Map<K, E> snapshot(EntityTable<K, E> table) {
        var bound = session;
        return bound == null ? Map.of() : bound.replicas().store(table).snapshot();
    }

    @Override
    public <K, E> Optional<E> find(EntityTable<K, E> table, K key) {
        var bound = session;
        return bound == null ? Optional.empty() : bound.replicas().store(table).get(key);
    }

    @Override
    public Optional<WorldState> worldState() {
        var bound = session;
        return bound == null ? Optional.empty() : bound.replicas().worldState();
    }

    @Override
    public boolean isLocalActorRegistered() {
        var bound = session;
        return bound != null && bound.isLocalActorRegistered();
    }

    @Override
    public ConnectionState state() {
        return session == null ? ConnectionState.UNBOUND : ConnectionState.BOUND;
    }

    private void unbind(ReplicationSession bound, Throwable cause) {
        session = null;
        viewport = null;
        bound.close();
        if (cause == null) {
            log.info("Unbound connection of {}", bound.identity().toDebugString());
        } else {
            log.warn("Unbound connection of {}: {}", bound.identity().toDebugString(), cause.toString());
        }
        dispatch(new ReplicationEvent.Unbound(clock.getAsLong(), bound.identity(), cause));
    }

    private void dispatch(ReplicationEvent event) {
        if (event instanceof ReplicationEvent.LocalActorRemoved) {
            viewport = null;
        }
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Replication event listener failed on {}", event, e);
            }
        }
    }

    private record ReplicaBinding<K, E>(EntityTable<K, E> table, ReplicaListener<E> listener) {

        ReplicaBinding {
            Objects.requireNonNull(table, "Table cannot be null");
            Objects.requireNonNull(listener, "Listener cannot be null");
        }

        void attach(ReplicaSet replicas) {
            replicas.store(table).addListener(listener);
        }
    }
}
