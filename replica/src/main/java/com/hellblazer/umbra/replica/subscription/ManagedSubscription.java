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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A registry entry: the query, the service handle once the subscribe call has returned, and the observed status.
 * <p>
 * Release is idempotent. Releasing before the service handle is attached causes the handle to be released as soon as
 * it arrives, so a subscription that fails from inside the subscribe call never leaks its channel.
 *
 * @author hal.hildebrand
 */
public class ManagedSubscription implements SubscriptionHandle {
    private static final Logger log = LoggerFactory.getLogger(ManagedSubscription.class);

    private final SubscriptionQuery query;
    private final AtomicBoolean     released = new AtomicBoolean();

    private volatile SubscriptionHandle delegate;
    private volatile Status             status = Status.PENDING;

    public ManagedSubscription(SubscriptionQuery query) {
        this.query = Objects.requireNonNull(query, "Query cannot be null");
    }

    public SubscriptionQuery query() {
        return query;
    }

    public Status status() {
        return status;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Attach the handle returned by the service.
     */
    void attach(SubscriptionHandle handle) {
        delegate = Objects.requireNonNull(handle, "Handle cannot be null");
        if (released.get()) {
            releaseDelegate(handle);
        }
    }

    void markApplied() {
        if (status == Status.PENDING) {
            status = Status.APPLIED;
        }
    }

    void markFailed() {
        if (status != Status.RELEASED) {
            status = Status.FAILED;
        }
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        if (status != Status.FAILED) {
            status = Status.RELEASED;
        }
        var handle = delegate;
        if (handle != null) {
            releaseDelegate(handle);
        }
    }

    private void releaseDelegate(SubscriptionHandle handle) {
        try {
            handle.release();
        } catch (RuntimeException e) {
            log.debug("Release of {} failed, connection likely gone: {}", query, e.toString());
        }
    }

    @Override
    public String toString() {
        return "ManagedSubscription[" + query + ", " + status + "]";
    }

    public enum Status {
        /** Issued, completion not yet observed */
        PENDING,
        /** Initial rows delivered */
        APPLIED,
        /** Reported an error; never retained by the registry */
        FAILED,
        /** Released by its owner */
        RELEASED
    }
}
