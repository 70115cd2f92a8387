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

import com.hellblazer.umbra.replica.subscription.SubscriptionHandle;
import com.hellblazer.umbra.replica.subscription.SubscriptionObserver;
import com.hellblazer.umbra.replica.subscription.SubscriptionQuery;
import com.hellblazer.umbra.replica.subscription.SubscriptionService;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-memory subscription service. Subscriptions are applied synchronously unless configured to fail.
 *
 * @author hal.hildebrand
 */
public class FakeSubscriptionService implements SubscriptionService {
    private final List<FakeHandle>       handles    = new ArrayList<>();
    private final Set<SubscriptionQuery> rejectOnce = new HashSet<>();
    private final Set<SubscriptionQuery> failOnce   = new HashSet<>();
    private       int                    calls;
    private       boolean                autoApply  = true;

    @Override
    public SubscriptionHandle subscribe(SubscriptionQuery query, SubscriptionObserver observer) {
        calls++;
        if (rejectOnce.remove(query)) {
            throw new IllegalStateException("Rejected " + query.predicate());
        }
        var handle = new FakeHandle(query, observer);
        handles.add(handle);
        if (failOnce.remove(query)) {
            observer.onError(new IllegalStateException("Failed " + query.predicate()));
        } else if (autoApply) {
            observer.onApplied();
        }
        return handle;
    }

    /**
     * The next subscribe for the query throws.
     */
    public void rejectOnce(SubscriptionQuery query) {
        rejectOnce.add(query);
    }

    /**
     * The next subscribe for the query reports an error before returning.
     */
    public void failOnce(SubscriptionQuery query) {
        failOnce.add(query);
    }

    public void setAutoApply(boolean autoApply) {
        this.autoApply = autoApply;
    }

    /**
     * @return every handle ever issued
     */
    public List<FakeHandle> handles() {
        return handles;
    }

    public List<FakeHandle> live() {
        return handles.stream().filter(h -> !h.isReleased()).toList();
    }

    public long liveCount(Predicate<SubscriptionQuery> filter) {
        return live().stream().filter(h -> filter.test(h.query())).count();
    }

    public FakeHandle latest(SubscriptionQuery query) {
        for (int i = handles.size() - 1; i >= 0; i--) {
            if (handles.get(i).query().equals(query)) {
                return handles.get(i);
            }
        }
        throw new IllegalArgumentException("No handle for " + query);
    }

    /**
     * @return the number of subscribe calls, including rejected ones
     */
    public int subscribeCalls() {
        return calls;
    }

    public static class FakeHandle implements SubscriptionHandle {
        private final SubscriptionQuery    query;
        private final SubscriptionObserver observer;
        private       int                  releases;

        FakeHandle(SubscriptionQuery query, SubscriptionObserver observer) {
            this.query = query;
            this.observer = observer;
        }

        @Override
        public void release() {
            releases++;
        }

        public SubscriptionQuery query() {
            return query;
        }

        public boolean isReleased() {
            return releases > 0;
        }

        public int releaseCount() {
            return releases;
        }

        /**
         * Report a failure after the subscription was established.
         */
        public void fail(Throwable cause) {
            observer.onError(cause);
        }

        public void apply() {
            observer.onApplied();
        }
    }
}
