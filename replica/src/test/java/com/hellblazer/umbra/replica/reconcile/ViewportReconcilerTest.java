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
import com.hellblazer.umbra.replica.FakeSubscriptionService;
import com.hellblazer.umbra.replica.ManualEventLoop;
import com.hellblazer.umbra.replica.entity.EntityType;
import com.hellblazer.umbra.replica.subscription.SubscriptionQuery;
import com.hellblazer.umbra.replica.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ViewportReconciler minimal-churn diffing.
 *
 * @author hal.hildebrand
 */
class ViewportReconcilerTest {

    private static final Set<EntityType> SPATIAL = EnumSet.of(EntityType.TREE, EntityType.STONE,
                                                              EntityType.MUSHROOM);

    private ChunkGrid               grid;
    private FakeSubscriptionService service;
    private SubscriptionRegistry    registry;
    private ViewportReconciler      reconciler;

    @BeforeEach
    void setUp() {
        grid = new ChunkGrid(500.0f, 5000.0f, 5000.0f);
        service = new FakeSubscriptionService();
        registry = new SubscriptionRegistry(service, grid, new ManualEventLoop(), SPATIAL);
        reconciler = new ViewportReconciler(grid, registry, 0.0f);
    }

    @Test
    void testInitialViewportSubscribesEveryPair() {
        var result = reconciler.reconcile(new Viewport(0, 0, 1000, 1000));

        var expected = Set.of(new ChunkId(0, 0), new ChunkId(1, 0), new ChunkId(0, 1), new ChunkId(1, 1));
        assertEquals(expected, result.required());
        assertEquals(expected, result.added());
        assertTrue(result.removed().isEmpty());
        assertEquals(12, registry.liveHandleCount());
        assertEquals(12, result.mutations());
    }

    @Test
    void testSmallShiftWithSameChunksCausesNoMutation() {
        reconciler.reconcile(new Viewport(0, 0, 1000, 1000));
        var before = registry.mutationCount();

        var result = reconciler.reconcile(new Viewport(0, 0, 1000, 1000).translate(-10, -10));

        assertTrue(result.isUnchanged());
        assertEquals(0, result.mutations());
        assertEquals(before, registry.mutationCount());
    }

    @Test
    void testSameViewportTwiceIsNoop() {
        reconciler.reconcile(new Viewport(100, 100, 900, 900));
        var calls = service.subscribeCalls();

        reconciler.reconcile(new Viewport(100, 100, 900, 900));
        reconciler.reconcile(new Viewport(120, 90, 910, 880));

        assertEquals(calls, service.subscribeCalls());
    }

    @Test
    void testSlideAddsOneChunkAndRemovesOne() {
        // {A, B, C} -> {B, C, D}
        reconciler.reconcile(new Viewport(0, 0, 1500, 500));
        var before = registry.mutationCount();

        var result = reconciler.reconcile(new Viewport(500, 0, 2000, 500));

        assertEquals(Set.of(new ChunkId(3, 0)), result.added());
        assertEquals(Set.of(new ChunkId(0, 0)), result.removed());
        assertEquals(2 * SPATIAL.size(), registry.mutationCount() - before);
        assertEquals(Set.of(new ChunkId(1, 0), new ChunkId(2, 0), new ChunkId(3, 0)), registry.trackedChunks());
        for (var type : SPATIAL) {
            assertFalse(registry.isTracked(type, new ChunkId(0, 0)));
            assertTrue(registry.isTracked(type, new ChunkId(3, 0)));
        }
    }

    @Test
    void testNullViewportReleasesAllSpatial() {
        registry.addGlobal(EntityType.PLAYER);
        reconciler.reconcile(new Viewport(0, 0, 1000, 1000));

        var result = reconciler.reconcile(null);

        assertTrue(result.required().isEmpty());
        assertEquals(4, result.removed().size());
        assertTrue(registry.trackedChunks().isEmpty());
        assertTrue(registry.isGlobalTracked(EntityType.PLAYER), "Globals are not touched");
        assertTrue(reconciler.viewport().isEmpty());
    }

    @Test
    void testFailedPairRetriedOnNextPass() {
        var chunk = new ChunkId(0, 0);
        service.rejectOnce(SubscriptionQuery.spatial(EntityType.STONE, chunk, grid.indexOf(chunk)));

        reconciler.reconcile(new Viewport(0, 0, 400, 400));
        assertTrue(registry.isTracked(EntityType.TREE, chunk));
        assertFalse(registry.isTracked(EntityType.STONE, chunk));

        var result = reconciler.reconcile(new Viewport(10, 10, 410, 410));

        assertEquals(Set.of(chunk), result.added());
        assertEquals(1, result.mutations(), "Only the missing pair is subscribed");
        assertEquals(Set.of(chunk), registry.completeChunks());
    }

    @Test
    void testPrefetchMarginGrowsRequiredSet() {
        reconciler = new ViewportReconciler(grid, registry, 96.0f);

        var result = reconciler.reconcile(new Viewport(600, 600, 950, 950));

        assertEquals(Set.of(new ChunkId(1, 1), new ChunkId(2, 1), new ChunkId(1, 2), new ChunkId(2, 2)),
                     result.required());
    }

    @Test
    void testDegenerateViewportRequiresNothing() {
        var result = reconciler.reconcile(new Viewport(100, 100, 100, 900));

        assertTrue(result.required().isEmpty());
        assertEquals(0, registry.liveHandleCount());
    }

    @Test
    void testAtMostOneHandlePerPairOverRandomWalk() {
        var random = new Random(42);
        float x = 2500, y = 2500;
        for (int i = 0; i < 300; i++) {
            x = Math.max(-500, Math.min(5500, x + (random.nextFloat() - 0.5f) * 900));
            y = Math.max(-500, Math.min(5500, y + (random.nextFloat() - 0.5f) * 900));
            var required = reconciler.reconcile(new Viewport(x, y, x + 960, y + 720)).required();

            assertEquals(required, registry.trackedChunks());
            assertEquals(required.size() * SPATIAL.size(), registry.liveHandleCount());

            var live = new HashMap<SubscriptionQuery, Integer>();
            for (var handle : service.live()) {
                live.merge(handle.query(), 1, Integer::sum);
            }
            live.values().forEach(count -> assertEquals(1, count));
        }
    }
}
