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

import com.hellblazer.umbra.replica.entity.EntityType;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.model.Player;

import java.util.Objects;
import java.util.Optional;

/**
 * Sealed interface for replication lifecycle events.
 * <p>
 * Events are immutable records delivered to {@link ReplicationEventListener}s on the event loop, in the order the
 * transitions happen. Every {@link Bound} is eventually followed by exactly one {@link Unbound}; a connection that
 * fails to bind reports an {@link Unbound} alone.
 *
 * @author hal.hildebrand
 */
public sealed interface ReplicationEvent permits
    ReplicationEvent.Bound,
    ReplicationEvent.Unbound,
    ReplicationEvent.LocalActorRegistered,
    ReplicationEvent.LocalActorRemoved,
    ReplicationEvent.PlacementConfirmed {

    /**
     * Event timestamp in milliseconds, from the client's clock.
     * @return event timestamp
     */
    long timestamp();

    /**
     * Identity of the connection the event belongs to.
     * @return local identity
     */
    Identity identity();

    /**
     * Emitted once row callbacks and global subscriptions are in place for a new connection.
     *
     * @param timestamp event timestamp
     * @param identity  local identity of the connection
     */
    record Bound(
        long timestamp,
        Identity identity
    ) implements ReplicationEvent {}

    /**
     * Emitted after a connection's subscriptions have been released and every replica cleared.
     *
     * @param timestamp event timestamp
     * @param identity  local identity of the connection that was bound
     * @param cause     the failure that ended the connection, null for an orderly disconnect
     */
    record Unbound(
        long timestamp,
        Identity identity,
        Throwable cause
    ) implements ReplicationEvent {

        public Optional<Throwable> failure() {
            return Optional.ofNullable(cause);
        }
    }

    /**
     * Emitted when the local player's own row first arrives.
     *
     * @param timestamp event timestamp
     * @param identity  local identity
     * @param player    the local player's row
     */
    record LocalActorRegistered(
        long timestamp,
        Identity identity,
        Player player
    ) implements ReplicationEvent {}

    /**
     * Emitted when the local player's row is deleted. The viewport has been cleared.
     *
     * @param timestamp event timestamp
     * @param identity  local identity
     */
    record LocalActorRemoved(
        long timestamp,
        Identity identity
    ) implements ReplicationEvent {}

    /**
     * Emitted when an entity placed by the local player appears in the replica.
     *
     * @param timestamp event timestamp
     * @param identity  local identity
     * @param type      kind of the placed entity
     * @param entityId  key of the placed entity
     * @param x         world x of the placed entity
     * @param y         world y of the placed entity
     */
    record PlacementConfirmed(
        long timestamp,
        Identity identity,
        EntityType type,
        Object entityId,
        float x,
        float y
    ) implements ReplicationEvent {

        public PlacementConfirmed {
            Objects.requireNonNull(type, "Entity type cannot be null");
        }
    }
}
