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
package com.hellblazer.umbra.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import java.util.Optional;

/**
 * Turns a stream of focal point positions into a sparse stream of viewports.
 * <p>
 * A new viewport is produced only when:
 * <ul>
 *   <li>no viewport has been produced yet, or</li>
 *   <li>the focus has moved at least the movement threshold (squared distance) from the focus of the last produced
 *   viewport, and the debounce interval has elapsed since it was produced</li>
 * </ul>
 * A qualifying move that arrives inside the debounce interval is held as pending and released by {@link #poll(long)}
 * once the interval has elapsed, so the final resting position is never lost.
 * <p>
 * Not thread safe; confine to the owning event loop.
 *
 * @author hal.hildebrand
 */
public class ViewportTracker {
    private static final Logger log = LoggerFactory.getLogger(ViewportTracker.class);

    private final float visibleWidth;
    private final float visibleHeight;
    private final long  debounceMillis;
    private final float movementThresholdSquared;

    private Viewport current;
    private Point2f  lastFocus;
    private long     lastEmitMillis;
    private Point2f  pending;

    /**
     * @param visibleWidth             width of the visible rectangle around the focus
     * @param visibleHeight            height of the visible rectangle around the focus
     * @param debounceMillis           minimum interval between produced viewports
     * @param movementThresholdSquared squared focus displacement required to produce a new viewport
     */
    public ViewportTracker(float visibleWidth, float visibleHeight, long debounceMillis,
                           float movementThresholdSquared) {
        if (!(visibleWidth > 0.0f) || !(visibleHeight > 0.0f)) {
            throw new IllegalArgumentException(
            "Visible dimensions must be positive: " + visibleWidth + " x " + visibleHeight);
        }
        if (debounceMillis < 0) {
            throw new IllegalArgumentException("Debounce interval must be non-negative: " + debounceMillis);
        }
        if (movementThresholdSquared < 0.0f) {
            throw new IllegalArgumentException("Movement threshold must be non-negative: " + movementThresholdSquared);
        }
        this.visibleWidth = visibleWidth;
        this.visibleHeight = visibleHeight;
        this.debounceMillis = debounceMillis;
        this.movementThresholdSquared = movementThresholdSquared;
    }

    /**
     * Record a new focal point.
     *
     * @param focus     current focus position
     * @param nowMillis current time
     * @return the new viewport, if one is due
     */
    public Optional<Viewport> update(Point2f focus, long nowMillis) {
        if (current == null) {
            return Optional.of(emit(focus, nowMillis));
        }
        if (focus.distanceSquared(lastFocus) < movementThresholdSquared) {
            // back inside the hysteresis band; anything pending is obsolete
            pending = null;
            return Optional.empty();
        }
        if (nowMillis - lastEmitMillis < debounceMillis) {
            pending = new Point2f(focus);
            return Optional.empty();
        }
        return Optional.of(emit(focus, nowMillis));
    }

    /**
     * Release a pending focus whose debounce interval has elapsed.
     *
     * @param nowMillis current time
     * @return the new viewport, if a pending one became due
     */
    public Optional<Viewport> poll(long nowMillis) {
        if (pending == null || nowMillis - lastEmitMillis < debounceMillis) {
            return Optional.empty();
        }
        return Optional.of(emit(pending, nowMillis));
    }

    /**
     * @return milliseconds until a pending focus becomes due, 0 if due now, -1 if nothing is pending
     */
    public long remainingDebounce(long nowMillis) {
        if (pending == null) {
            return -1;
        }
        return Math.max(0, debounceMillis - (nowMillis - lastEmitMillis));
    }

    public boolean hasPending() {
        return pending != null;
    }

    /**
     * @return the most recently produced viewport
     */
    public Optional<Viewport> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Forget all history; the next update produces a viewport immediately.
     */
    public void reset() {
        current = null;
        lastFocus = null;
        pending = null;
        lastEmitMillis = 0;
    }

    private Viewport emit(Point2f focus, long nowMillis) {
        lastFocus = new Point2f(focus);
        lastEmitMillis = nowMillis;
        pending = null;
        current = Viewport.centeredOn(lastFocus, visibleWidth, visibleHeight);
        log.debug("Viewport moved to {}", current);
        return current;
    }
}
