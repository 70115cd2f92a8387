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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partitions a bounded world into square chunks and maps world-space rectangles onto the chunks they overlap.
 * <p>
 * The world spans {@code [0, worldWidth) x [0, worldHeight)}. Chunks are numbered by column and row from the world
 * origin; {@link #indexOf(ChunkId)} flattens them in row-major order, the same index the authoritative service stores on
 * chunk-partitioned rows.
 * <p>
 * All mapping operations are pure: the same viewport and grid always yield the same chunk set.
 *
 * @author hal.hildebrand
 */
public final class ChunkGrid {

    private final float chunkSize;
    private final float worldWidth;
    private final float worldHeight;
    private final int   widthInChunks;
    private final int   heightInChunks;
    private final Viewport worldBounds;

    /**
     * Create a chunk grid.
     *
     * @param chunkSize   edge length of a chunk in world units
     * @param worldWidth  world width in world units
     * @param worldHeight world height in world units
     * @throws IllegalArgumentException if any dimension is not positive
     */
    public ChunkGrid(float chunkSize, float worldWidth, float worldHeight) {
        if (!(chunkSize > 0.0f)) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        if (!(worldWidth > 0.0f) || !(worldHeight > 0.0f)) {
            throw new IllegalArgumentException(
            "World dimensions must be positive: " + worldWidth + " x " + worldHeight);
        }
        this.chunkSize = chunkSize;
        this.worldWidth = worldWidth;
        this.worldHeight = worldHeight;
        this.widthInChunks = (int) Math.ceil((double) worldWidth / chunkSize);
        this.heightInChunks = (int) Math.ceil((double) worldHeight / chunkSize);
        this.worldBounds = new Viewport(0.0f, 0.0f, worldWidth, worldHeight);
    }

    /**
     * Compute the chunks whose cells intersect the viewport with positive area. Cells that only touch the viewport's
     * edge are excluded. The viewport is clipped to the world first.
     *
     * @param viewport region of interest, may be null
     * @return unmodifiable set of overlapped chunks, ordered row-major; empty for a null, degenerate or off-world
     * viewport
     */
    public Set<ChunkId> chunksOverlapping(Viewport viewport) {
        if (viewport == null || viewport.isEmpty()) {
            return Set.of();
        }
        var clipped = viewport.intersect(worldBounds);
        if (clipped.isEmpty()) {
            return Set.of();
        }

        var minCol = clampColumn((int) Math.floor((double) clipped.minX() / chunkSize));
        var maxCol = clampColumn((int) Math.ceil((double) clipped.maxX() / chunkSize) - 1);
        var minRow = clampRow((int) Math.floor((double) clipped.minY() / chunkSize));
        var maxRow = clampRow((int) Math.ceil((double) clipped.maxY() / chunkSize) - 1);

        var chunks = new TreeSet<ChunkId>();
        for (int row = minRow; row <= maxRow; row++) {
            for (int col = minCol; col <= maxCol; col++) {
                chunks.add(new ChunkId(col, row));
            }
        }
        return Collections.unmodifiableSet(chunks);
    }

    /**
     * Locate the chunk containing a world position. Positions outside the world are clamped onto its edge chunks.
     */
    public ChunkId chunkAt(float x, float y) {
        var col = clampColumn((int) Math.floor((double) x / chunkSize));
        var row = clampRow((int) Math.floor((double) y / chunkSize));
        return new ChunkId(col, row);
    }

    /**
     * Locate the chunk containing a world position the way a tile-based store assigns it: the position is first
     * floored to a whole tile in single precision, then the tile is divided down to its chunk. Falls back to
     * {@link #chunkAt(float, float)} when the chunk size is not a whole number of tiles.
     *
     * @param tileSize the edge length of one tile in world units
     */
    public ChunkId chunkAt(float x, float y, float tileSize) {
        if (!(tileSize > 0.0f)) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
        var tilesPerChunk = Math.round(chunkSize / tileSize);
        if (tilesPerChunk < 1 || tilesPerChunk * tileSize != chunkSize) {
            return chunkAt(x, y);
        }
        var col = clampColumn(Math.floorDiv(tileOf(x, tileSize), tilesPerChunk));
        var row = clampRow(Math.floorDiv(tileOf(y, tileSize), tilesPerChunk));
        return new ChunkId(col, row);
    }

    /**
     * @return the row-major index of the chunk
     * @throws IllegalArgumentException if the chunk lies outside this grid
     */
    public int indexOf(ChunkId chunk) {
        if (!contains(chunk)) {
            throw new IllegalArgumentException("Chunk " + chunk + " is outside a " + widthInChunks + "x"
                                               + heightInChunks + " grid");
        }
        return chunk.y() * widthInChunks + chunk.x();
    }

    /**
     * Inverse of {@link #indexOf(ChunkId)}.
     */
    public ChunkId chunkOf(int index) {
        if (index < 0 || index >= chunkCount()) {
            throw new IllegalArgumentException("Chunk index out of range: " + index);
        }
        return new ChunkId(index % widthInChunks, index / widthInChunks);
    }

    public boolean contains(ChunkId chunk) {
        return chunk.x() >= 0 && chunk.x() < widthInChunks && chunk.y() >= 0 && chunk.y() < heightInChunks;
    }

    public int chunkCount() {
        return widthInChunks * heightInChunks;
    }

    public float getChunkSize() {
        return chunkSize;
    }

    public float getWorldWidth() {
        return worldWidth;
    }

    public float getWorldHeight() {
        return worldHeight;
    }

    public int getWidthInChunks() {
        return widthInChunks;
    }

    public int getHeightInChunks() {
        return heightInChunks;
    }

    private static int tileOf(float coordinate, float tileSize) {
        var quotient = coordinate / tileSize;
        return (int) Math.floor(quotient);
    }

    private int clampColumn(int col) {
        return Math.max(0, Math.min(widthInChunks - 1, col));
    }

    private int clampRow(int row) {
        return Math.max(0, Math.min(heightInChunks - 1, row));
    }

    @Override
    public String toString() {
        return String.format("ChunkGrid[chunkSize=%.1f, world=%.1fx%.1f, chunks=%dx%d]", chunkSize, worldWidth,
                             worldHeight, widthInChunks, heightInChunks);
    }
}
