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
import com.hellblazer.umbra.replica.FakeSubscriptionService;
import com.hellblazer.umbra.replica.ManualEventLoop;
import com.hellblazer.umbra.replica.entity.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for SubscriptionRegistry idempotency and failure handling.
 *
 * @author hal.hildebrand
 */
class SubscriptionRegistryTest {

    private static final ChunkId A = new ChunkId(0, 0);
    private static final ChunkId B = new ChunkId(1, 0);

    private ChunkGrid               grid;
    private FakeSubscriptionService service;
    private SubscriptionRegistry    registry;

    @BeforeEach
    void setUp() {
        grid = new ChunkGrid(500.0f, 5000.0f, 5000.0f);
        service = new FakeSubscriptionService();
        registry = new SubscriptionRegistry(service, grid, new ManualEventLoop(),
                                            EnumSet.of(EntityType.TREE, EntityType.STONE));
    }

    @Test
    void testAddIsIdempotent() {
        assertTrue(registry.add(EntityType.TREE, A));
        assertFalse(registry.add(EntityType.TREE, A));

        assertEquals(1, registry.liveHandleCount());
        assertEquals(1, service.subscribeCalls());
        assertEquals("SELECT * FROM tree WHERE chunk_index = 0", service.handles().get(0).query().predicate());
    }

    @Test
    void testRemoveIsIdempotent() {
        registry.add(EntityType.TREE, B);

        assertTrue(registry.remove(EntityType.TREE, B));
        assertFalse(registry.remove(EntityType.TREE, B));
        assertFalse(registry.remove(EntityType.STONE, B), "Never added");

        assertEquals(0, registry.liveHandleCount());
        assertEquals(1, service.handles().get(0).releaseCount());
    }

    @Test
    void testRemoveAllReleasesEverything() {
        registry.add(EntityType.TREE, A);
        registry.add(EntityType.STONE, A);
        registry.add(EntityType.TREE, B);
        registry.addGlobal(EntityType.PLAYER);

        assertEquals(4, registry.removeAll());
        assertEquals(0, registry.removeAll());

        assertEquals(0, registry.liveHandleCount());
        assertTrue(registry.trackedChunks().isEmpty());
        assertTrue(registry.globalTypes().isEmpty());
        assertTrue(service.live().isEmpty());
        service.handles().forEach(h -> assertEquals(1, h.releaseCount()));
    }

    @Test
    void testTrackedAndCompleteChunks() {
        registry.add(EntityType.TREE, A);
        registry.add(EntityType.STONE, A);
        registry.add(EntityType.TREE, B);

        assertEquals(Set.of(A, B), registry.trackedChunks());
        assertEquals(Set.of(A), registry.completeChunks());
    }

    @Test
    void testRejectedSubscribeLeavesNoHandle() {
        var query = SubscriptionQuery.spatial(EntityType.TREE, A, 0);
        service.rejectOnce(query);

        assertFalse(registry.add(EntityType.TREE, A));
        assertFalse(registry.isTracked(EntityType.TREE, A));
        assertEquals(1, registry.failureCount());

        assertTrue(registry.add(EntityType.TREE, A), "A later attempt subscribes again");
    }

    @Test
    void testErrorDuringSubscribeOnLoopDropsEntry() {
        var loop = new ManualEventLoop();
        registry = new SubscriptionRegistry(service, grid, loop, EnumSet.of(EntityType.STONE));
        var query = SubscriptionQuery.spatial(EntityType.STONE, B, grid.indexOf(B));
        service.failOnce(query);
        var added = new AtomicBoolean();
        var trackedInTask = new AtomicBoolean();

        loop.execute(() -> {
            added.set(registry.add(EntityType.STONE, B));
            trackedInTask.set(registry.isTracked(EntityType.STONE, B));
        });

        assertTrue(added.get(), "The error is queued behind the reconciling task");
        assertTrue(trackedInTask.get());
        assertFalse(registry.isTracked(EntityType.STONE, B));
        assertEquals(0, registry.liveHandleCount());
        assertEquals(1, registry.failureCount());
        assertTrue(service.latest(query).isReleased(), "The failed channel is not leaked");
        assertTrue(registry.add(EntityType.STONE, B), "The next pass subscribes again");
    }

    @Test
    void testInlineErrorLeavesNoHandle() {
        // ManualEventLoop runs the error callback inside subscribe when called outside a task
        var query = SubscriptionQuery.spatial(EntityType.STONE, B, grid.indexOf(B));
        service.failOnce(query);

        assertFalse(registry.add(EntityType.STONE, B));

        assertEquals(0, registry.liveHandleCount());
        assertEquals(1, registry.failureCount());
        assertTrue(service.latest(query).isReleased(), "The failed channel is not leaked");
    }

    @Test
    void testAsynchronousErrorDropsEntry() {
        var deferred = new ArrayList<Runnable>();
        registry = new SubscriptionRegistry(service, grid, deferred::add, EnumSet.of(EntityType.TREE));
        registry.add(EntityType.TREE, A);
        runAll(deferred);

        service.latest(SubscriptionQuery.spatial(EntityType.TREE, A, 0)).fail(new RuntimeException("lost"));
        assertTrue(registry.isTracked(EntityType.TREE, A), "Errors are applied on the loop");

        runAll(deferred);
        assertFalse(registry.isTracked(EntityType.TREE, A));
        assertEquals(1, registry.failureCount());
        assertTrue(service.live().isEmpty());
    }

    @Test
    void testLateErrorDoesNotDropReplacement() {
        var deferred = new ArrayList<Runnable>();
        registry = new SubscriptionRegistry(service, grid, deferred::add, EnumSet.of(EntityType.TREE));
        var query = SubscriptionQuery.spatial(EntityType.TREE, A, 0);
        registry.add(EntityType.TREE, A);
        var first = service.latest(query);
        registry.remove(EntityType.TREE, A);
        registry.add(EntityType.TREE, A);
        runAll(deferred);

        first.fail(new RuntimeException("late"));
        runAll(deferred);

        assertTrue(registry.isTracked(EntityType.TREE, A));
        assertFalse(service.latest(query).isReleased());
        assertEquals(0, registry.failureCount());
    }

    @Test
    void testGlobalSubscriptions() {
        assertTrue(registry.addGlobal(EntityType.PLAYER));
        assertFalse(registry.addGlobal(EntityType.PLAYER));
        assertTrue(registry.isGlobalTracked(EntityType.PLAYER));
        assertEquals("SELECT * FROM player", service.handles().get(0).query().predicate());

        assertTrue(registry.removeGlobal(EntityType.PLAYER));
        assertFalse(registry.removeGlobal(EntityType.PLAYER));
    }

    @Test
    void testNonSpatialTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.add(EntityType.PLAYER, A));
        assertThrows(IllegalArgumentException.class, () -> registry.add(EntityType.TREE, new ChunkId(10, 0)));
    }

    @Test
    void testServiceCalledOncePerPair() {
        var mockService = mock(SubscriptionService.class);
        when(mockService.subscribe(any(), any())).thenReturn(mock(SubscriptionHandle.class));
        registry = new SubscriptionRegistry(mockService, grid, new ManualEventLoop(), EnumSet.of(EntityType.TREE));

        registry.add(EntityType.TREE, B);
        registry.add(EntityType.TREE, B);
        registry.add(EntityType.TREE, B);

        verify(mockService, times(1)).subscribe(eq(SubscriptionQuery.spatial(EntityType.TREE, B, 1)), any());
        assertEquals(1, registry.mutationCount());
    }

    private static void runAll(List<Runnable> deferred) {
        while (!deferred.isEmpty()) {
            deferred.remove(0).run();
        }
    }
}
