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
package com.hellblazer.umbra.replica.model;

import com.hellblazer.umbra.replica.entity.Identity;

/**
 * An item being crafted for a player.
 *
 * @author hal.hildebrand
 */
public record CraftingQueueItem(long queueItemId, Identity playerIdentity, long recipeId, long outputItemDefId,
                                int outputQuantity, long startTimeMs, long finishTimeMs) {
}
