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
import com.hellblazer.umbra.replica.entity.EntityTables;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.model.Player;
import com.hellblazer.umbra.replica.model.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2f;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ReplicationClient facade: marshalling, focus tracking and following the local player.
 *
 * @author hal.hildebrand
 */
class ReplicationClientTest {

    private static final Identity LOCAL = Identity.of("a11ce");

    private ManualEventLoop   loop;
    private AtomicLong        clock;
    private ReplicationClient client;

    private static Player player(Identity identity, float x, float y) {
        return new Player(identity, "p", x, y, "#0f0", "up", 0L, 100f, 100f, 100f, 100f, 100f, false, false, 0L);
    }

    @BeforeEach
    void setUp() {
        var config = ReplicationConfig.builder()
                                      .withChunkSize(500)
                                      .withWorldSize(5000, 5000)
                                      .withViewSize(800, 600)
                                      .withPrefetchMargin(0)
                                      .withDebounceMillis(100)
                                      .withMovementThresholdSquared(100)
                                      .build();
        loop = new ManualEventLoop();
        clock = new AtomicLong(0);
        client = new ReplicationClient(config, loop, clock::get);
    }

    @Test
    void testConnectionNotificationsRunOnLoop() {
        var connection = new FakeReplicaConnection(LOCAL);
        var before = loop.executedCount();

        client.connected(connection);

        assertTrue(loop.executedCount() > before);
        assertEquals(ConnectionState.BOUND, client.state());

        client.disconnected(connection, null);
        assertEquals(ConnectionState.UNBOUND, client.state());
    }

    @Test
    void testFocusDrivesViewport() {
        client.connected(new FakeReplicaConnection(LOCAL));

        client.updateFocus(1000, 1000);
        assertEquals(new Viewport(600, 700, 1400, 1300), client.lifecycle().viewport().orElseThrow());
        assertEquals(4, client.lifecycle().session().orElseThrow().registry().trackedChunks().size());

        clock.set(500);
        client.updateFocus(1005, 1005);
        assertEquals(new Point2f(1000, 1000), client.lifecycle().viewport().orElseThrow().center(),
                     "Below the movement threshold");
        assertEquals(0, loop.pendingScheduled());
    }

    @Test
    void testDebouncedFocusReleasedByScheduledPoll() {
        client.connected(new FakeReplicaConnection(LOCAL));
        client.updateFocus(1000, 1000);

        clock.set(30);
        client.updateFocus(1050, 1000);

        assertEquals(new Point2f(1000, 1000), client.lifecycle().viewport().orElseThrow().center());
        assertEquals(1, loop.pendingScheduled());
        assertEquals(70, loop.lastScheduledDelay());

        clock.set(100);
        assertEquals(1, loop.runScheduled());

        assertEquals(new Point2f(1050, 1000), client.lifecycle().viewport().orElseThrow().center());
        assertEquals(0, loop.pendingScheduled());
    }

    @Test
    void testFollowLocalActor() {
        var connection = new FakeReplicaConnection(LOCAL);
        client.connected(connection);
        client.followLocalActor();

        connection.insert(EntityTables.PLAYERS, player(Identity.of("b0b"), 3000, 3000));
        assertTrue(client.lifecycle().viewport().isEmpty(), "Other players are not followed");

        var me = player(LOCAL, 2000, 2000);
        connection.insert(EntityTables.PLAYERS, me);
        assertTrue(client.isLocalActorRegistered());
        assertEquals(new Point2f(2000, 2000), client.lifecycle().viewport().orElseThrow().center());

        clock.set(200);
        connection.update(EntityTables.PLAYERS, me, me.withPosition(2600, 2000));
        assertEquals(new Point2f(2600, 2000), client.lifecycle().viewport().orElseThrow().center());
    }

    @Test
    void testFollowPicksUpPlayerAlreadyPresent() {
        var connection = new FakeReplicaConnection(LOCAL);
        client.connected(connection);
        connection.insert(EntityTables.PLAYERS, player(LOCAL, 2000, 2000));

        client.followLocalActor();

        assertEquals(new Point2f(2000, 2000), client.lifecycle().viewport().orElseThrow().center());
    }

    @Test
    void testTrackingResetOnDisconnect() {
        var first = new FakeReplicaConnection(LOCAL);
        client.connected(first);
        client.updateFocus(1000, 1000);
        clock.set(10);
        client.updateFocus(1100, 1000);
        assertEquals(1, loop.pendingScheduled());

        client.disconnected(first, new RuntimeException("gone"));
        assertEquals(0, loop.pendingScheduled());

        client.connected(new FakeReplicaConnection(LOCAL));
        clock.set(20);
        client.updateFocus(1000, 1000);
        assertEquals(new Point2f(1000, 1000), client.lifecycle().viewport().orElseThrow().center(),
                     "A fresh tracker emits immediately");
    }

    @Test
    void testReadsThroughView() {
        var connection = new FakeReplicaConnection(LOCAL);
        assertTrue(client.worldState().isEmpty());

        client.connected(connection);
        var state = new WorldState(1, WorldState.TimeOfDay.NIGHT, 0.9f, true, 4);
        connection.insert(EntityTables.WORLD_STATES, state);
        connection.insert(EntityTables.PLAYERS, player(LOCAL, 1, 1));

        assertEquals(state, client.worldState().orElseThrow());
        assertTrue(client.find(EntityTables.PLAYERS, LOCAL).isPresent());
        assertEquals(1, client.snapshot(EntityTables.PLAYERS).size());
    }

    @Test
    void testEventsAndClose() {
        var events = new ArrayList<ReplicationEvent>();
        client.addEventListener(events::add);
        var connection = new FakeReplicaConnection(LOCAL);
        client.connected(connection);

        client.close();
        client.close();

        assertEquals(ConnectionState.UNBOUND, client.state());
        assertTrue(connection.subscriptions().live().isEmpty());
        assertFalse(loop.isClosed(), "A shared loop is left running");
        assertEquals(2, events.size());
        assertInstanceOf(ReplicationEvent.Unbound.class, events.get(1));
    }
}
