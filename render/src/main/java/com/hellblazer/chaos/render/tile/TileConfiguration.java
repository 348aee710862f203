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

import java.util.ArrayList;
import java.util.List;

/**
 * Divides a frame into square tiles. Edge tiles are clipped to the frame.
 *
 * @param frameWidth  frame width in pixels
 * @param frameHeight frame height in pixels
 * @param tileSize    nominal tile edge in pixels
 * @param tilesX      number of tile columns
 * @param tilesY      number of tile rows
 */
public record TileConfiguration(int frameWidth, int frameHeight, int tileSize, int tilesX, int tilesY) {

    /**
     * Creates a tile configuration covering the whole frame.
     *
     * @param frameWidth  frame width in pixels
     * @param frameHeight frame height in pixels
     * @param tileSize    tile edge in pixels
     * @return configuration for the given parameters
     */
    public static TileConfiguration from(int frameWidth, int frameHeight, int tileSize) {
        if (frameWidth <= 0 || frameHeight <= 0 || tileSize <= 0) {
            throw new IllegalArgumentException("Frame dimensions and tile size must be positive");
        }
        // round up to cover the entire frame
        int tilesX = (frameWidth + tileSize - 1) / tileSize;
        int tilesY = (frameHeight + tileSize - 1) / tileSize;
        return new TileConfiguration(frameWidth, frameHeight, tileSize, tilesX, tilesY);
    }

    public TileConfiguration {
        if (frameWidth <= 0 || frameHeight <= 0 || tileSize <= 0) {
            throw new IllegalArgumentException("Frame dimensions and tile size must be positive");
        }
        if (tilesX * tileSize < frameWidth || tilesY * tileSize < frameHeight) {
            throw new IllegalArgumentException("Tiles do not cover a " + frameWidth + "x" + frameHeight + " frame");
        }
    }

    public int totalTiles() {
        return tilesX * tilesY;
    }

    /**
     * The tile at a tile-grid coordinate, clipped at the frame edges.
     */
    public Tile tile(int tileX, int tileY) {
        if (tileX < 0 || tileX >= tilesX || tileY < 0 || tileY >= tilesY) {
            throw new IllegalArgumentException(
            "Tile coordinates out of bounds: (" + tileX + "," + tileY + ") for " + tilesX + "x" + tilesY + " grid");
        }
        int pixelX = tileX * tileSize;
        int pixelY = tileY * tileSize;
        return new Tile(tileX, tileY, pixelX, pixelY, Math.min(tileSize, frameWidth - pixelX),
                        Math.min(tileSize, frameHeight - pixelY));
    }

    /**
     * All tiles in scanline order.
     */
    public List<Tile> partition() {
        var tiles = new ArrayList<Tile>(totalTiles());
        for (int tileY = 0; tileY < tilesY; tileY++) {
            for (int tileX = 0; tileX < tilesX; tileX++) {
                tiles.add(tile(tileX, tileY));
            }
        }
        return tiles;
    }
}
