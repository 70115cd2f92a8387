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
import com.hellblazer.umbra.geometry.ViewportTracker;
import com.hellblazer.umbra.replica.connection.ReplicaConnection;
import com.hellblazer.umbra.replica.entity.EntityTable;
import com.hellblazer.umbra.replica.entity.EntityTables;
import com.hellblazer.umbra.replica.loop.EventLoop;
import com.hellblazer.umbra.replica.loop.SingleThreadEventLoop;
import com.hellblazer.umbra.replica.model.Player;
import com.hellblazer.umbra.replica.model.WorldState;
import com.hellblazer.umbra.replica.store.ReplicaListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Entry point of the replication layer.
 * <p>
 * Every input, whether connection notifications, viewport changes or focus movement, is posted onto the event loop,
 * so the client may be driven from any thread. Replicas are read through the {@link ReplicaView} methods, which
 * return immutable snapshots.
 * <p>
 * The viewport can be supplied directly with {@link #updateViewport}, derived from a focal point with
 * {@link #updateFocus}, or derived from the local player's replicated position after {@link #followLocalActor()}. The
 * last two pass through a {@link ViewportTracker}, so small or rapid movements do not cause re-subscription.
 *
 * @author hal.hildebrand
 */
public class ReplicationClient implements ReplicaView, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReplicationClient.class);

    private final EventLoop           loop;
    private final boolean             ownsLoop;
    private final LongSupplier        clock;
    private final ConnectionLifecycle lifecycle;
    private final ViewportTracker     tracker;
    private final AtomicBoolean       closed = new AtomicBoolean();

    private EventLoop.Cancellable pendingPoll;
    private boolean               following;

    /**
     * Create a client running on its own event loop thread.
     */
    public ReplicationClient(ReplicationConfig config) {
        this(config, new SingleThreadEventLoop("umbra-replication"), true, System::currentTimeMillis);
    }

    /**
     * Create a client on a shared event loop. The loop is not closed with the client.
     */
    public ReplicationClient(ReplicationConfig config, EventLoop loop, LongSupplier clock) {
        this(config, loop, false, clock);
    }

    private ReplicationClient(ReplicationConfig config, EventLoop loop, boolean ownsLoop, LongSupplier clock) {
        Objects.requireNonNull(config, "Config cannot be null");
        this.loop = Objects.requireNonNull(loop, "Event loop cannot be null");
        this.ownsLoop = ownsLoop;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.lifecycle = new ConnectionLifecycle(config, loop, clock);
        this.tracker = config.createViewportTracker();
        lifecycle.addEventListener(this::onLifecycleEvent);
    }

    public void connected(ReplicaConnection connection) {
        Objects.requireNonNull(connection, "Connection cannot be null");
        loop.execute(() -> lifecycle.onConnected(connection));
    }

    /**
     * @param cause the failure, null for an orderly close
     */
    public void disconnected(ReplicaConnection connection, Throwable cause) {
        loop.execute(() -> lifecycle.onDisconnected(connection, cause));
    }

    public void connectFailed(Throwable cause) {
        loop.execute(() -> lifecycle.onConnectError(cause));
    }

    /**
     * Replace the interest region.
     *
     * @param viewport the new viewport, null to drop all spatial interest
     */
    public void updateViewport(Viewport viewport) {
        loop.execute(() -> lifecycle.updateViewport(viewport));
    }

    /**
     * Move the focal point; a new viewport follows when the tracker decides the move is significant.
     */
    public void updateFocus(float x, float y) {
        var focus = new Point2f(x, y);
        loop.execute(() -> focus(focus));
    }

    /**
     * Derive the viewport from the local player's position on every connection from now on.
     */
    public void followLocalActor() {
        loop.execute(() -> {
            if (following) {
                return;
            }
            following = true;
            lifecycle.addReplicaListener(EntityTables.PLAYERS, new ReplicaListener<Player>() {
                @Override
                public void onInserted(Player player) {
                    follow(player);
                }

                @Override
                public void onUpdated(Player previous, Player current) {
                    follow(current);
                }
            });
            lifecycle.localIdentity().flatMap(id -> lifecycle.find(EntityTables.PLAYERS, id)).ifPresent(this::follow);
        });
    }

    /**
     * Release a debounced focus movement whose interval has elapsed. Called automatically from a scheduled task; can
     * be called explicitly by callers that drive time themselves.
     */
    public void pollViewport() {
        loop.execute(this::poll);
    }

    public void addEventListener(ReplicationEventListener listener) {
        lifecycle.addEventListener(listener);
    }

    public void removeEventListener(ReplicationEventListener listener) {
        lifecycle.removeEventListener(listener);
    }

    /**
     * Observe a table's replica across connections.
     */
    public <K, E> void addReplicaListener(EntityTable<K, E> table, ReplicaListener<E> listener) {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");
        loop.execute(() -> lifecycle.addReplicaListener(table, listener));
    }

    @Override
    public <K, E> Map<K, E> snapshot(EntityTable<K, E> table) {
        return lifecycle.snapshot(table);
    }

    @Override
    public <K, E> Optional<E> find(EntityTable<K, E> table, K key) {
        return lifecycle.find(table, key);
    }

    @Override
    public Optional<WorldState> worldState() {
        return lifecycle.worldState();
    }

    @Override
    public boolean isLocalActorRegistered() {
        return lifecycle.isLocalActorRegistered();
    }

    @Override
    public ConnectionState state() {
        return lifecycle.state();
    }

    /**
     * Tear down the bound connection, if any. A loop created by this client is stopped afterwards.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        loop.execute(() -> {
            cancelPoll();
            lifecycle.shutdown();
            if (ownsLoop) {
                loop.close();
            }
        });
    }

    ConnectionLifecycle lifecycle() {
        return lifecycle;
    }

    private void follow(Player player) {
        var local = lifecycle.localIdentity();
        if (local.isPresent() && local.get().equals(player.identity())) {
            focus(new Point2f(player.posX(), player.posY()));
        }
    }

    private void focus(Point2f focus) {
        var viewport = tracker.update(focus, clock.getAsLong());
        if (viewport.isPresent()) {
            cancelPoll();
            lifecycle.updateViewport(viewport.get());
        } else {
            schedulePoll();
        }
    }

    private void poll() {
        cancelPoll();
        tracker.poll(clock.getAsLong()).ifPresent(lifecycle::updateViewport);
        schedulePoll();
    }

    private void schedulePoll() {
        if (pendingPoll != null || !tracker.hasPending()) {
            return;
        }
        var delay = tracker.remainingDebounce(clock.getAsLong());
        pendingPoll = loop.schedule(this::poll, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelPoll() {
        if (pendingPoll != null) {
            pendingPoll.cancel();
            pendingPoll = null;
        }
    }

    private void onLifecycleEvent(ReplicationEvent event) {
        if (event instanceof ReplicationEvent.Unbound || event instanceof ReplicationEvent.LocalActorRemoved) {
            cancelPoll();
            tracker.reset();
            log.debug("Viewport tracking reset on {}", event.getClass().getSimpleName());
        }
    }
}
