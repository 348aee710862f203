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
package com.hellblazer.chaos.render;

import com.hellblazer.chaos.fractal.color.ColorMapper;
import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.core.Viewport;
import com.hellblazer.chaos.fractal.intent.FractalParameters;
import com.hellblazer.chaos.render.tile.TileDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotExporterTest {

    private static final FractalParameters BASE = new FractalParameters(Viewport.DEFAULT, 30,
                                                                        FractalFamily.MANDELBROT);

    private ExecutorService executor;
    private TileDispatcher  dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        dispatcher = new TileDispatcher(16, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testDoublesIterationsOfBase() {
        var snapshot = new SnapshotExporter(dispatcher, 64, 48, new Random(3)).render(BASE);

        assertEquals(60, snapshot.parameters().maxIteration());
        assertEquals(BASE.viewport(), snapshot.parameters().viewport());
        assertTrue(snapshot.pixels().hasDimensions(64, 48));
        assertTrue(snapshot.paletteId() >= 0 && snapshot.paletteId() < ColorMapper.PALETTE_COUNT);
        // the default view is centered inside the main cardioid
        assertEquals(0, snapshot.pixels().packed(32, 24));
    }

    @Test
    void testSeededExportsRepeat() {
        var first = new SnapshotExporter(dispatcher, 40, 30, new Random(11)).render(BASE);
        var second = new SnapshotExporter(dispatcher, 40, 30, new Random(11)).render(BASE);

        assertEquals(first.paletteId(), second.paletteId());
        assertEquals(first.palette(), second.palette());
        assertArrayEquals(first.pixels().bytes(), second.pixels().bytes());
    }

    @Test
    void testExportWritesPng(@TempDir Path dir) throws IOException {
        var exporter = new SnapshotExporter(dispatcher, 40, 30, new Random(5));
        var file = dir.resolve("Mandelbrot_fractal.png");

        var snapshot = exporter.export(BASE, file);

        var image = ImageIO.read(file.toFile());
        assertEquals(40, image.getWidth());
        assertEquals(30, image.getHeight());
        assertEquals(snapshot.pixels().packed(3, 4), image.getRGB(3, 4) & 0xFFFFFF);
    }

    @Test
    void testRejectsBadConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new SnapshotExporter(null, 10, 10, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new SnapshotExporter(dispatcher, 0, 10, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new SnapshotExporter(dispatcher, 10, 10, null));
    }
}
