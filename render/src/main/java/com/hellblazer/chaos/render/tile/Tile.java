/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Chaos Engine.
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
package com.hellblazer.chaos.render.tile;

/**
 * A rectangular block of grid pixels computed as one work item.
 *
 * @param tileX  tile column in the tile grid (0-based)
 * @param tileY  tile row in the tile grid (0-based)
 * @param pixelX first pixel column covered
 * @param pixelY first pixel row covered
 * @param width  pixel columns covered, clipped at the frame edge
 * @param height pixel rows covered, clipped at the frame edge
 */
public record Tile(int tileX, int tileY, int pixelX, int pixelY, int width, int height) {

    public Tile {
        if (tileX < 0 || tileY < 0) {
            throw new IllegalArgumentException("Tile coordinates must be non-negative");
        }
        if (pixelX < 0 || pixelY < 0) {
            throw new IllegalArgumentException("Pixel origin must be non-negative");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tile dimensions must be positive");
        }
    }

    public int pixelCount() {
        return width * height;
    }
}
