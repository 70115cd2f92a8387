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
package com.hellblazer.umbra.replica.store;

import com.hellblazer.umbra.replica.entity.EntityTables;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.model.Player;
import com.hellblazer.umbra.replica.model.Recipe;
import com.hellblazer.umbra.replica.model.Tree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReplicaStore event application and change filtering.
 *
 * @author hal.hildebrand
 */
class ReplicaStoreTest {

    private ReplicaStore<Identity, Player> players;
    private RecordingListener<Player>      signals;

    private static Player player(float x, float y) {
        return new Player(Identity.of("a1"), "alice", x, y, "#f00", "down", 0L, 100f, 100f, 100f, 100f, 100f, false,
                          false, 0L);
    }

    @BeforeEach
    void setUp() {
        players = new ReplicaStore<>(EntityTables.PLAYERS, 0.01f);
        signals = new RecordingListener<>();
        players.addListener(signals);
    }

    @Test
    void testSubEpsilonUpdateIsSuppressed() {
        var original = player(100.000f, 50);
        players.onInsert(original);
        signals.clear();

        var changed = players.onUpdate(original, player(100.004f, 50));

        assertFalse(changed);
        assertEquals(original, players.get(original.identity()).orElseThrow());
        assertTrue(signals.events.isEmpty(), "No change signal for an insignificant update");
        assertEquals(1, players.suppressedUpdates());
    }

    @Test
    void testDriftIsMeasuredAgainstStoredValue() {
        var original = player(100.000f, 50);
        players.onInsert(original);

        // each step is below epsilon relative to the previous event, but the third crosses it relative to the store
        assertFalse(players.onUpdate(player(100.000f, 50), player(100.004f, 50)));
        assertFalse(players.onUpdate(player(100.004f, 50), player(100.008f, 50)));
        assertTrue(players.onUpdate(player(100.008f, 50), player(100.012f, 50)));

        assertEquals(100.012f, players.get(original.identity()).orElseThrow().positionX());
    }

    @Test
    void testSignificantUpdateReplacesAndSignals() {
        var original = player(100, 50);
        players.onInsert(original);
        var moved = player(140, 50);

        assertTrue(players.onUpdate(original, moved));

        assertEquals(moved, players.get(moved.identity()).orElseThrow());
        assertEquals(List.of("insert", "update"), signals.events);
        assertEquals(2, players.version());
    }

    @Test
    void testUpdateForUnknownIsImplicitInsert() {
        var moved = player(140, 50);

        assertTrue(players.onUpdate(player(100, 50), moved));

        assertEquals(1, players.size());
        assertEquals(List.of("insert"), signals.events);
    }

    @Test
    void testDeleteForUnknownIsDropped() {
        assertFalse(players.onDelete(player(1, 1)));
        assertTrue(signals.events.isEmpty());
        assertEquals(0, players.version());
    }

    @Test
    void testDeleteRemoves() {
        var original = player(1, 1);
        players.onInsert(original);

        assertTrue(players.onDelete(original));

        assertTrue(players.isEmpty());
        assertEquals(List.of("insert", "remove"), signals.events);
    }

    @Test
    void testDuplicateInsertIsNoop() {
        var original = player(1, 1);
        assertTrue(players.onInsert(original));
        assertFalse(players.onInsert(original));
        assertEquals(1, players.version());
    }

    @Test
    void testIdenticalUpdateDroppedForPlainTables() {
        var recipes = new ReplicaStore<>(EntityTables.RECIPES, 0.01f);
        var recipe = new Recipe(1, 2, 1, List.of(new Recipe.Ingredient(3, 4)), 5);
        recipes.onInsert(recipe);

        assertFalse(recipes.onUpdate(recipe, new Recipe(1, 2, 1, List.of(new Recipe.Ingredient(3, 4)), 5)));
        assertTrue(recipes.onUpdate(recipe, new Recipe(1, 2, 2, List.of(new Recipe.Ingredient(3, 4)), 5)));
    }

    @Test
    void testSnapshotIsImmutableCopy() {
        players.onInsert(player(1, 1));
        var snapshot = players.snapshot();

        players.onDelete(player(1, 1));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
    }

    @Test
    void testClearSignalsOnce() {
        var trees = new ReplicaStore<>(EntityTables.TREES, 0.01f);
        var treeSignals = new RecordingListener<Tree>();
        trees.addListener(treeSignals);
        trees.onInsert(new Tree(1, 0, 0, 100, "oak", null, null));
        trees.onInsert(new Tree(2, 5, 5, 100, "oak", null, null));

        assertEquals(2, trees.clear());
        assertEquals(0, trees.clear());

        assertTrue(trees.isEmpty());
        assertEquals(List.of("insert", "insert", "clear"), treeSignals.events);
    }

    @Test
    void testFailingListenerDoesNotBreakStore() {
        players.addListener(new ReplicaListener<Player>() {
            @Override
            public void onInserted(Player entity) {
                throw new IllegalStateException("boom");
            }
        });
        var recorder = new RecordingListener<Player>();
        players.addListener(recorder);

        assertTrue(players.onInsert(player(1, 1)));

        assertEquals(1, players.size());
        assertEquals(List.of("insert"), recorder.events);
    }

    static class RecordingListener<E> implements ReplicaListener<E> {
        final List<String> events = new ArrayList<>();

        @Override
        public void onInserted(E entity) {
            events.add("insert");
        }

        @Override
        public void onUpdated(E previous, E current) {
            events.add("update");
        }

        @Override
        public void onRemoved(E entity) {
            events.add("remove");
        }

        @Override
        public void onCleared() {
            events.add("clear");
        }

        void clear() {
            events.clear();
        }
    }
}
