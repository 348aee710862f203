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
import com.hellblazer.chaos.fractal.color.PaletteParameters;
import com.hellblazer.chaos.fractal.core.IterationGrid;
import com.hellblazer.chaos.fractal.core.PixelBuffer;
import com.hellblazer.chaos.fractal.effects.EffectParameters;
import com.hellblazer.chaos.fractal.effects.EffectsPipeline;
import com.hellblazer.chaos.fractal.effects.FrameContext;
import com.hellblazer.chaos.fractal.intent.FractalParameters;
import com.hellblazer.chaos.render.tile.TileDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * High-resolution still export of the base view.
 * <p>
 * The export uses the base viewport, not the animated one, at a fixed resolution with twice the iteration budget and
 * no effects. Each export picks a random palette and random palette multipliers. It works on its own buffers and does
 * not disturb the interactive render.
 *
 * @author hal.hildebrand
 */
public class SnapshotExporter {
    private static final Logger log = LoggerFactory.getLogger(SnapshotExporter.class);

    /**
     * An exported image and how it was colored.
     */
    public record Snapshot(PixelBuffer pixels, FractalParameters parameters, int paletteId,
                           PaletteParameters palette) {
    }

    private final TileDispatcher dispatcher;
    private final int            width;
    private final int            height;
    private final Random         random;

    public SnapshotExporter(TileDispatcher dispatcher, int width, int height, Random random) {
        if (dispatcher == null || random == null) {
            throw new IllegalArgumentException("Dispatcher and random source are required");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Export dimensions must be positive: " + width + "x" + height);
        }
        this.dispatcher = dispatcher;
        this.width = width;
        this.height = height;
        this.random = random;
    }

    /**
     * Render the snapshot of a base view.
     */
    public Snapshot render(FractalParameters base) {
        var parameters = base.withMaxIteration(base.maxIteration() * 2);
        var grid = new IterationGrid(width, height);
        var metrics = dispatcher.dispatchFrame(grid, parameters.viewport(), parameters.maxIteration(),
                                               parameters.family());

        var palette = PaletteParameters.random(random);
        int paletteId = random.nextInt(ColorMapper.PALETTE_COUNT);
        var pixels = new PixelBuffer(width, height);
        var context = FrameContext.plain(EffectParameters.DEFAULTS.withPalette(palette), paletteId,
                                         parameters.maxIteration(), random);
        EffectsPipeline.colorize(grid.toScalarField(new double[width * height]), width, height, pixels, context);

        log.debug("Snapshot {}x{} at {} iterations, {} tiles, palette {}", width, height, parameters.maxIteration(),
                  metrics.totalTiles(), paletteId);
        return new Snapshot(pixels, parameters, paletteId, palette);
    }

    /**
     * Render the snapshot of a base view and write it as PNG.
     */
    public Snapshot export(FractalParameters base, Path file) throws IOException {
        var snapshot = render(base);
        FrameSaver.write(snapshot.pixels(), file);
        log.info("Saved {} snapshot ({}x{}, iter={}) to {}", base.family().displayName(), width, height,
                 snapshot.parameters().maxIteration(), file);
        return snapshot;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
