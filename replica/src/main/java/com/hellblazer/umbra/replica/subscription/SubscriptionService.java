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

/**
 * The remote subscription service of a connection.
 *
 * @author hal.hildebrand
 */
public interface SubscriptionService {

    /**
     * Request a continuous feed of the rows matching a query. The request completes asynchronously through the
     * observer; rows are delivered to the row listeners registered on the connection.
     *
     * @param query    what to subscribe to
     * @param observer receives completion or failure
     * @return handle releasing the subscription
     * @throws RuntimeException if the request cannot be issued at all
     */
    SubscriptionHandle subscribe(SubscriptionQuery query, SubscriptionObserver observer);
}
