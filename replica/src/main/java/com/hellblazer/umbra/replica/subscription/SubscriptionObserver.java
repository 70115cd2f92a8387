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
 * Completion callbacks of an asynchronous subscribe request. Either method may be invoked from any thread.
 *
 * @author hal.hildebrand
 */
public interface SubscriptionObserver {

    /**
     * The subscription is established and its initial rows have been delivered.
     */
    void onApplied();

    /**
     * The subscription could not be established, or failed after being established.
     *
     * @param cause the failure reported by the service
     */
    void onError(Throwable cause);
}
