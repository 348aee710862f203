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

import com.hellblazer.chaos.fractal.core.EscapeTimeComputer;
import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.core.IterationGrid;
import com.hellblazer.chaos.fractal.core.Viewport;
import com.hellblazer.chaos.fractal.filter.ConvolutionFilter;
import com.hellblazer.chaos.fractal.filter.EdgeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Shards grid work across an executor and waits for every shard before returning.
 *
 * Execution Flow:
 * 1. Partition the grid into tiles
 * 2. Compute escape-time counts per tile in parallel
 * 3. Barrier on all tiles
 * 4. Optionally run the convolution filter in parallel row bands
 * 5. Barrier on all bands
 *
 * Tiles write disjoint regions of the grid, so no synchronization is needed beyond the barriers. Counts do not depend
 * on tile size or thread count.
 *
 * @author hal.hildebrand
 */
public class TileDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TileDispatcher.class);

    private final int             tileSize;
    private final ExecutorService executor;

    /**
     * @param tileSize tile edge in pixels; also the row height of a filter band
     * @param executor worker pool; owned by the caller
     */
    public TileDispatcher(int tileSize, ExecutorService executor) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        this.tileSize = tileSize;
        this.executor = executor;
    }

    /**
     * Overwrite every count of {@code grid} for the given view.
     *
     * @param grid         target grid, its budget is set to {@code maxIteration}
     * @param viewport     plane rectangle to sample
     * @param maxIteration iteration budget
     * @param family       map to iterate
     * @return dispatch metrics
     */
    public DispatchMetrics dispatchFrame(IterationGrid grid, Viewport viewport, int maxIteration,
                                         FractalFamily family) {
        long startTime = System.nanoTime();
        var mapper = EscapeTimeComputer.prepare(grid, viewport, maxIteration);
        var tiles = TileConfiguration.from(grid.width(), grid.height(), tileSize).partition();

        var work = new ArrayList<Callable<Integer>>(tiles.size());
        for (var tile : tiles) {
            work.add(() -> {
                EscapeTimeComputer.computeRegion(grid, mapper, family, maxIteration, tile.pixelX(), tile.pixelY(),
                                                 tile.width(), tile.height());
                return countInterior(grid, tile);
            });
        }

        int interior = 0;
        for (int count : invokeAll(work)) {
            interior += count;
        }
        long dispatchTime = System.nanoTime() - startTime;
        log.trace("Dispatched {} tiles for {} in {} us", tiles.size(), grid, dispatchTime / 1_000);
        return new DispatchMetrics(tiles.size(), grid.width() * grid.height(), interior, dispatchTime);
    }

    /**
     * Write the coloring source for {@code grid} into {@code output}: the raw counts, or their Sobel or emboss
     * transform computed in parallel row bands.
     *
     * @return {@code output}
     */
    public double[] filter(EdgeMode mode, IterationGrid grid, double[] output) {
        if (mode == EdgeMode.NONE) {
            return grid.toScalarField(output);
        }
        var bands = new ArrayList<Callable<Integer>>();
        for (int rowStart = 0; rowStart < grid.height(); rowStart += tileSize) {
            int start = rowStart;
            int end = Math.min(grid.height(), rowStart + tileSize);
            bands.add(() -> {
                if (mode == EdgeMode.SOBEL) {
                    ConvolutionFilter.sobel(grid, output, start, end);
                } else {
                    ConvolutionFilter.emboss(grid, output, start, end);
                }
                return end - start;
            });
        }
        invokeAll(bands);
        return output;
    }

    public int tileSize() {
        return tileSize;
    }

    private static int countInterior(IterationGrid grid, Tile tile) {
        int count = 0;
        for (int y = tile.pixelY(); y < tile.pixelY() + tile.height(); y++) {
            for (int x = tile.pixelX(); x < tile.pixelX() + tile.width(); x++) {
                if (grid.isInterior(x, y)) {
                    count++;
                }
            }
        }
        return count;
    }

    private List<Integer> invokeAll(List<Callable<Integer>> work) {
        List<Future<Integer>> futures;
        try {
            futures = executor.invokeAll(work);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for grid workers", e);
        }
        var results = new ArrayList<Integer>(futures.size());
        for (var future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while collecting grid workers", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Grid worker failed", e.getCause());
            }
        }
        return results;
    }
}
