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

import com.hellblazer.umbra.replica.entity.ChangeFilter;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.entity.Positioned;

import java.util.Objects;

/**
 * A connected player, keyed by the player's client identity.
 *
 * @author hal.hildebrand
 */
public record Player(Identity identity, String username, float positionX, float positionY, String color,
                     String direction, long jumpStartTimeMs, float health, float stamina, float thirst, float hunger,
                     float warmth, boolean sprinting, boolean dead, long lastUpdateMs) implements Positioned {

    public Player {
        Objects.requireNonNull(identity, "Player identity cannot be null");
    }

    /**
     * Players change on position beyond the epsilon, on any vital rounded to a whole point, and on their discrete
     * movement state. The last update timestamp alone is never significant.
     */
    public static ChangeFilter<Player> changeFilter(float positionEpsilon) {
        return (stored, incoming) -> ChangeFilter.moved(stored, incoming, positionEpsilon)
        || Math.round(stored.health) != Math.round(incoming.health)
        || Math.round(stored.stamina) != Math.round(incoming.stamina)
        || Math.round(stored.hunger) != Math.round(incoming.hunger)
        || Math.round(stored.thirst) != Math.round(incoming.thirst)
        || Math.round(stored.warmth) != Math.round(incoming.warmth)
        || stored.sprinting != incoming.sprinting
        || !Objects.equals(stored.direction, incoming.direction)
        || stored.jumpStartTimeMs != incoming.jumpStartTimeMs
        || stored.dead != incoming.dead;
    }

    @Override
    public float posX() {
        return positionX;
    }

    @Override
    public float posY() {
        return positionY;
    }

    /**
     * @return a copy moved to the given position
     */
    public Player withPosition(float x, float y) {
        return new Player(identity, username, x, y, color, direction, jumpStartTimeMs, health, stamina, thirst, hunger,
                          warmth, sprinting, dead, lastUpdateMs);
    }

    /**
     * @return a copy with different vitals
     */
    public Player withVitals(float health, float stamina, float thirst, float hunger, float warmth) {
        return new Player(identity, username, positionX, positionY, color, direction, jumpStartTimeMs, health, stamina,
                          thirst, hunger, warmth, sprinting, dead, lastUpdateMs);
    }

    public Player withLastUpdate(long lastUpdateMs) {
        return new Player(identity, username, positionX, positionY, color, direction, jumpStartTimeMs, health, stamina,
                          thirst, hunger, warmth, sprinting, dead, lastUpdateMs);
    }
}
