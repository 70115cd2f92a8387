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
package com.hellblazer.umbra.replica.connection;

import com.hellblazer.umbra.replica.entity.EntityTable;
import com.hellblazer.umbra.replica.entity.Identity;
import com.hellblazer.umbra.replica.subscription.SubscriptionService;

/**
 * An established connection to the authoritative service, as handed over by the connection provider once its
 * handshake completes.
 * <p>
 * Each instance stands for one connection; a reconnect produces a new instance. Instances are compared by identity.
 *
 * @author hal.hildebrand
 */
public interface ReplicaConnection {

    /**
     * @return the identity this connection is bound to
     */
    Identity identity();

    /**
     * @return the subscription service of this connection
     */
    SubscriptionService subscriptions();

    /**
     * Register for the insert, update and delete events of a table.
     *
     * @param table    the table
     * @param listener receives the events
     * @return registration used to cancel delivery
     */
    <K, E> RowRegistration addRowListener(EntityTable<K, E> table, RowListener<E> listener);
}
