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
package com.hellblazer.umbra.replica.entity;

import com.hellblazer.umbra.replica.model.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The catalog of replicated tables, one per {@link EntityType}.
 *
 * @author hal.hildebrand
 */
public final class EntityTables {

    public static final EntityTable<Identity, Player> PLAYERS = new EntityTable<>(EntityType.PLAYER, Player.class,
                                                                                  Player::identity,
                                                                                  Player::changeFilter);

    public static final EntityTable<Long, Tree> TREES = new EntityTable<>(EntityType.TREE, Tree.class, Tree::id,
                                                                          Tree::changeFilter);

    public static final EntityTable<Long, Stone> STONES = new EntityTable<>(EntityType.STONE, Stone.class, Stone::id,
                                                                            Stone::changeFilter);

    public static final EntityTable<Long, Mushroom> MUSHROOMS = new EntityTable<>(EntityType.MUSHROOM,
                                                                                  Mushroom.class, Mushroom::id,
                                                                                  Mushroom::changeFilter);

    public static final EntityTable<Long, Campfire> CAMPFIRES = new EntityTable<>(EntityType.CAMPFIRE,
                                                                                  Campfire.class, Campfire::id,
                                                                                  anyDifference());

    public static final EntityTable<Long, DroppedItem> DROPPED_ITEMS = new EntityTable<>(EntityType.DROPPED_ITEM,
                                                                                         DroppedItem.class,
                                                                                         DroppedItem::id,
                                                                                         anyDifference());

    public static final EntityTable<Long, WoodenStorageBox> WOODEN_STORAGE_BOXES = new EntityTable<>(
    EntityType.WOODEN_STORAGE_BOX, WoodenStorageBox.class, WoodenStorageBox::id, anyDifference());

    public static final EntityTable<Long, ItemDefinition> ITEM_DEFINITIONS = new EntityTable<>(
    EntityType.ITEM_DEFINITION, ItemDefinition.class, ItemDefinition::id, anyDifference());

    public static final EntityTable<Long, InventoryItem> INVENTORY_ITEMS = new EntityTable<>(
    EntityType.INVENTORY_ITEM, InventoryItem.class, InventoryItem::instanceId, anyDifference());

    public static final EntityTable<Long, Recipe> RECIPES = new EntityTable<>(EntityType.RECIPE, Recipe.class,
                                                                              Recipe::recipeId, anyDifference());

    public static final EntityTable<Long, WorldState> WORLD_STATES = new EntityTable<>(EntityType.WORLD_STATE,
                                                                                       WorldState.class,
                                                                                       WorldState::id,
                                                                                       WorldState::changeFilter);

    public static final EntityTable<Identity, ActiveEquipment> ACTIVE_EQUIPMENT = new EntityTable<>(
    EntityType.ACTIVE_EQUIPMENT, ActiveEquipment.class, ActiveEquipment::playerIdentity, anyDifference());

    public static final EntityTable<Long, CraftingQueueItem> CRAFTING_QUEUE_ITEMS = new EntityTable<>(
    EntityType.CRAFTING_QUEUE_ITEM, CraftingQueueItem.class, CraftingQueueItem::queueItemId, anyDifference());

    private static final Map<EntityType, EntityTable<?, ?>> BY_TYPE;

    static {
        var byType = new EnumMap<EntityType, EntityTable<?, ?>>(EntityType.class);
        for (var table : List.of(PLAYERS, TREES, STONES, MUSHROOMS, CAMPFIRES, DROPPED_ITEMS, WOODEN_STORAGE_BOXES,
                                 ITEM_DEFINITIONS, INVENTORY_ITEMS, RECIPES, WORLD_STATES, ACTIVE_EQUIPMENT,
                                 CRAFTING_QUEUE_ITEMS)) {
            byType.put(table.type(), table);
        }
        if (byType.size() != EntityType.values().length) {
            throw new IllegalStateException("Every entity type requires a table binding");
        }
        BY_TYPE = Collections.unmodifiableMap(byType);
    }

    private EntityTables() {
    }

    /**
     * @return every table, in {@link EntityType} declaration order
     */
    public static List<EntityTable<?, ?>> all() {
        return List.copyOf(BY_TYPE.values());
    }

    public static EntityTable<?, ?> forType(EntityType type) {
        return BY_TYPE.get(type);
    }

    private static <E> ChangeFilter.Factory<E> anyDifference() {
        return epsilon -> ChangeFilter.anyDifference();
    }
}
