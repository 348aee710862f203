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

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TileConfigurationTest {

    @Test
    void testEdgeTilesAreClipped() {
        var config = TileConfiguration.from(100, 70, 32);

        assertEquals(4, config.tilesX());
        assertEquals(3, config.tilesY());
        assertEquals(12, config.totalTiles());

        var corner = config.tile(3, 2);
        assertEquals(96, corner.pixelX());
        assertEquals(64, corner.pixelY());
        assertEquals(4, corner.width());
        assertEquals(6, corner.height());
    }

    @Test
    void testOutOfBoundsTileRejected() {
        var config = TileConfiguration.from(64, 64, 32);

        assertThrows(IllegalArgumentException.class, () -> config.tile(2, 0));
        assertThrows(IllegalArgumentException.class, () -> config.tile(0, -1));
        assertThrows(IllegalArgumentException.class, () -> TileConfiguration.from(0, 64, 32));
        assertThrows(IllegalArgumentException.class, () -> new TileConfiguration(100, 100, 32, 3, 4));
    }

    @Property
    @Label("Tiles cover every pixel of the frame exactly once")
    void partitionCoversFrame(@ForAll @IntRange(min = 1, max = 300) int width,
                              @ForAll @IntRange(min = 1, max = 300) int height,
                              @ForAll @IntRange(min = 1, max = 64) int tileSize) {
        var covered = new int[width * height];
        var tiles = TileConfiguration.from(width, height, tileSize).partition();

        for (var tile : tiles) {
            for (int y = tile.pixelY(); y < tile.pixelY() + tile.height(); y++) {
                for (int x = tile.pixelX(); x < tile.pixelX() + tile.width(); x++) {
                    covered[y * width + x]++;
                }
            }
        }
        for (int count : covered) {
            assertEquals(1, count);
        }
    }

    @Test
    void testMetricsInvariants() {
        var metrics = new DispatchMetrics(4, 100, 25, 10L);
        assertEquals(0.25, metrics.interiorRatio());

        assertThrows(IllegalArgumentException.class, () -> new DispatchMetrics(1, 10, 11, 0L));
        assertThrows(IllegalArgumentException.class, () -> new DispatchMetrics(1, 10, 1, -1L));
        assertEquals(0.0, new DispatchMetrics(0, 0, 0, 0L).interiorRatio());
    }
}
