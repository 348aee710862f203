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
package com.hellblazer.chaos.fractal.core;

/**
 * Escape-time evaluation of a {@link FractalFamily} over a pixel grid.
 * <p>
 * Every pixel is independent of every other, so a grid may be filled region by region from any number of threads in
 * any order; the counts depend only on the pixel position, the mapper, the family and the budget. Callers that shard
 * the work must call {@link #prepare} once before dispatching regions.
 *
 * @author hal.hildebrand
 */
public final class EscapeTimeComputer {

    private EscapeTimeComputer() {
    }

    /**
     * Fill a new grid sequentially.
     *
     * @param viewport     plane rectangle
     * @param width        grid width in pixels
     * @param height       grid height in pixels
     * @param maxIteration iteration budget
     * @param family       family to evaluate
     * @return the filled grid
     */
    public static IterationGrid compute(Viewport viewport, int width, int height, int maxIteration,
                                        FractalFamily family) {
        var grid = new IterationGrid(width, height);
        compute(grid, viewport, maxIteration, family);
        return grid;
    }

    /**
     * Overwrite an existing grid sequentially.
     */
    public static void compute(IterationGrid grid, Viewport viewport, int maxIteration, FractalFamily family) {
        var mapper = prepare(grid, viewport, maxIteration);
        computeRegion(grid, mapper, family, maxIteration, 0, 0, grid.width(), grid.height());
    }

    /**
     * Stamp the budget on the grid and build the shared mapper for a sharded render.
     */
    public static ViewportMapper prepare(IterationGrid grid, Viewport viewport, int maxIteration) {
        grid.setMaxIteration(maxIteration);
        return new ViewportMapper(viewport, grid.width(), grid.height());
    }

    /**
     * Fill the rectangle {@code [x0, x0 + w) x [y0, y0 + h)} of the grid.
     *
     * @param grid         target grid, already {@link #prepare prepared}
     * @param mapper       mapper matching the grid dimensions
     * @param family       family to evaluate
     * @param maxIteration iteration budget
     * @param x0           first column
     * @param y0           first row
     * @param w            region width, clipped to the grid
     * @param h            region height, clipped to the grid
     */
    public static void computeRegion(IterationGrid grid, ViewportMapper mapper, FractalFamily family,
                                     int maxIteration, int x0, int y0, int w, int h) {
        if (mapper.width() != grid.width() || mapper.height() != grid.height()) {
            throw new IllegalArgumentException("Mapper " + mapper + " does not match " + grid);
        }
        int xEnd = Math.min(grid.width(), x0 + w);
        int yEnd = Math.min(grid.height(), y0 + h);
        for (int y = y0; y < yEnd; y++) {
            double im = mapper.imag(y);
            for (int x = x0; x < xEnd; x++) {
                grid.set(x, y, family.escapeTime(mapper.real(x), im, maxIteration));
            }
        }
    }
}
