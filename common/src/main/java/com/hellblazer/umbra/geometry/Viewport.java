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

import javax.vecmath.Point2f;

/**
 * Axis-aligned rectangle of world space the local client is interested in.
 * <p>
 * Viewports are immutable and are replaced wholesale when the focus moves, never patched. A viewport whose width or
 * height is not positive is considered empty and maps to no chunks.
 *
 * @param minX minimum x, world units
 * @param minY minimum y, world units
 * @param maxX maximum x, world units
 * @param maxY maximum y, world units
 * @author hal.hildebrand
 */
public record Viewport(float minX, float minY, float maxX, float maxY) {

    public Viewport {
        if (Float.isNaN(minX) || Float.isNaN(minY) || Float.isNaN(maxX) || Float.isNaN(maxY)) {
            throw new IllegalArgumentException("Viewport coordinates cannot be NaN");
        }
    }

    /**
     * Create a viewport of the given size centered on a focal point.
     *
     * @param center focal point
     * @param width  visible width
     * @param height visible height
     * @return the centered viewport
     */
    public static Viewport centeredOn(Point2f center, float width, float height) {
        var halfWidth = width / 2.0f;
        var halfHeight = height / 2.0f;
        return new Viewport(center.x - halfWidth, center.y - halfHeight, center.x + halfWidth, center.y + halfHeight);
    }

    public float width() {
        return maxX - minX;
    }

    public float height() {
        return maxY - minY;
    }

    /**
     * @return true if this viewport has zero or negative area
     */
    public boolean isEmpty() {
        return width() <= 0.0f || height() <= 0.0f;
    }

    public Point2f center() {
        return new Point2f((minX + maxX) / 2.0f, (minY + maxY) / 2.0f);
    }

    /**
     * Grow the viewport by a margin on every side. Negative margins shrink it.
     *
     * @param margin margin in world units
     * @return the expanded viewport
     */
    public Viewport expand(float margin) {
        if (margin == 0.0f) {
            return this;
        }
        return new Viewport(minX - margin, minY - margin, maxX + margin, maxY + margin);
    }

    public Viewport translate(float dx, float dy) {
        return new Viewport(minX + dx, minY + dy, maxX + dx, maxY + dy);
    }

    /**
     * Intersect with another rectangle. The result may be empty.
     */
    public Viewport intersect(Viewport other) {
        return new Viewport(Math.max(minX, other.minX), Math.max(minY, other.minY), Math.min(maxX, other.maxX),
                            Math.min(maxY, other.maxY));
    }

    public boolean contains(float x, float y) {
        return x >= minX && x < maxX && y >= minY && y < maxY;
    }

    @Override
    public String toString() {
        return String.format("Viewport[(%.1f, %.1f) - (%.1f, %.1f)]", minX, minY, maxX, maxY);
    }
}
