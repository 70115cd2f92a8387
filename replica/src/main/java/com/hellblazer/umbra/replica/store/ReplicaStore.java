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

import com.hellblazer.umbra.replica.entity.ChangeFilter;
import com.hellblazer.umbra.replica.entity.EntityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local replica of one remote table: entity key to latest known value.
 * <p>
 * Mutated only through {@link #onInsert}, {@link #onUpdate} and {@link #onDelete}, driven by the subscription event
 * stream, and by {@link #clear()} on teardown. Updates are written only when the table's {@link ChangeFilter} judges
 * them significant against the value currently stored, so drift accumulated over suppressed updates is applied as
 * soon as it crosses the threshold.
 * <p>
 * Mutation is confined to the event loop. Reads are safe from any thread; {@link #snapshot()} returns an immutable
 * copy.
 *
 * @param <K> key type
 * @param <E> entity type
 * @author hal.hildebrand
 */
public class ReplicaStore<K, E> {
    private static final Logger log = LoggerFactory.getLogger(ReplicaStore.class);

    private final EntityTable<K, E>            table;
    private final ChangeFilter<E>              filter;
    private final Map<K, E>                    entries    = new ConcurrentHashMap<>();
    private final List<ReplicaListener<E>>     listeners  = new CopyOnWriteArrayList<>();
    private final AtomicLong                   version    = new AtomicLong();
    private final AtomicLong                   suppressed = new AtomicLong();

    public ReplicaStore(EntityTable<K, E> table, float positionEpsilon) {
        this.table = Objects.requireNonNull(table, "Table cannot be null");
        this.filter = table.changeFilter(positionEpsilon);
    }

    public EntityTable<K, E> table() {
        return table;
    }

    /**
     * Store a newly visible entity.
     *
     * @return true if the replica changed
     */
    public boolean onInsert(E entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        var key = table.keyOf(entity);
        var previous = entries.put(key, entity);
        if (previous == null) {
            version.incrementAndGet();
            fireInserted(entity);
            return true;
        }
        if (previous.equals(entity)) {
            return false;
        }
        log.debug("Insert for existing {} {}, replacing", table.type(), key);
        version.incrementAndGet();
        fireUpdated(previous, entity);
        return true;
    }

    /**
     * Apply an update if it is significant relative to the stored value. An update for an entity that is not held is
     * applied as an insert.
     *
     * @param previous the old value carried by the event, informational only
     * @param incoming the new value
     * @return true if the replica changed
     */
    public boolean onUpdate(E previous, E incoming) {
        Objects.requireNonNull(incoming, "Entity cannot be null");
        var key = table.keyOf(incoming);
        var stored = entries.get(key);
        if (stored == null) {
            log.warn("Update for unknown {} {}, applying as insert", table.type(), key);
            entries.put(key, incoming);
            version.incrementAndGet();
            fireInserted(incoming);
            return true;
        }
        if (!filter.isSignificant(stored, incoming)) {
            suppressed.incrementAndGet();
            return false;
        }
        entries.put(key, incoming);
        version.incrementAndGet();
        fireUpdated(stored, incoming);
        return true;
    }

    /**
     * @return true if the entity was held and has been removed
     */
    public boolean onDelete(E entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        var key = table.keyOf(entity);
        var removed = entries.remove(key);
        if (removed == null) {
            log.debug("Delete for unknown {} {}, ignoring", table.type(), key);
            return false;
        }
        version.incrementAndGet();
        fireRemoved(removed);
        return true;
    }

    /**
     * Remove every entity.
     *
     * @return the number of entities removed
     */
    public int clear() {
        var count = entries.size();
        entries.clear();
        if (count == 0) {
            return 0;
        }
        version.incrementAndGet();
        for (var listener : listeners) {
            try {
                listener.onCleared();
            } catch (RuntimeException e) {
                log.error("Replica listener failed on clear of {}", table.type(), e);
            }
        }
        return count;
    }

    public Optional<E> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    /**
     * @return an immutable copy of the replica
     */
    public Map<K, E> snapshot() {
        return Map.copyOf(entries);
    }

    public Collection<E> values() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return the number of effective mutations so far
     */
    public long version() {
        return version.get();
    }

    /**
     * @return the number of updates dropped as insignificant
     */
    public long suppressedUpdates() {
        return suppressed.get();
    }

    public void addListener(ReplicaListener<E> listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(ReplicaListener<E> listener) {
        listeners.remove(listener);
    }

    private void fireInserted(E entity) {
        for (var listener : listeners) {
            try {
                listener.onInserted(entity);
            } catch (RuntimeException e) {
                log.error("Replica listener failed on insert into {}", table.type(), e);
            }
        }
    }

    private void fireUpdated(E previous, E current) {
        for (var listener : listeners) {
            try {
                listener.onUpdated(previous, current);
            } catch (RuntimeException e) {
                log.error("Replica listener failed on update of {}", table.type(), e);
            }
        }
    }

    private void fireRemoved(E entity) {
        for (var listener : listeners) {
            try {
                listener.onRemoved(entity);
            } catch (RuntimeException e) {
                log.error("Replica listener failed on delete from {}", table.type(), e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("ReplicaStore[%s, size=%d, version=%d]", table.type(), entries.size(), version.get());
    }
}
