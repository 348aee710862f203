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

import com.hellblazer.chaos.fractal.core.IterationGrid;
import com.hellblazer.chaos.fractal.core.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The owned working buffers of a render: the iteration grid, the coloring source field and the pixel buffer.
 * <p>
 * The three always share one shape. A dimension change replaces all of them with one volatile write, so a reader of
 * {@link #current()} never sees a grid and pixel buffer of different sizes. Buffers are otherwise reused and
 * overwritten in place.
 *
 * @author hal.hildebrand
 */
public final class RenderBuffers {
    private static final Logger log = LoggerFactory.getLogger(RenderBuffers.class);

    /**
     * One consistent set of buffers.
     *
     * @param grid   iteration counts
     * @param field  coloring source, raw counts or their edge transform
     * @param pixels colored output
     */
    public record Frame(IterationGrid grid, double[] field, PixelBuffer pixels) {

        public Frame {
            if (grid == null || field == null || pixels == null) {
                throw new IllegalArgumentException("All buffers are required");
            }
            if (field.length != grid.width() * grid.height() || !pixels.hasDimensions(grid.width(), grid.height())) {
                throw new IllegalArgumentException("Buffers must share one shape");
            }
        }

        static Frame allocate(int width, int height) {
            return new Frame(new IterationGrid(width, height), new double[width * height],
                             new PixelBuffer(width, height));
        }

        public int width() {
            return grid.width();
        }

        public int height() {
            return grid.height();
        }
    }

    private final AtomicInteger reallocations = new AtomicInteger();
    private volatile Frame current;

    /**
     * The current buffers, or null before the first {@link #resizeIfNeeded}.
     */
    public Frame current() {
        return current;
    }

    /**
     * Return buffers of the requested shape, replacing the current set only when the shape differs.
     */
    public Frame resizeIfNeeded(int width, int height) {
        var frame = current;
        if (frame != null && frame.grid().hasDimensions(width, height)) {
            return frame;
        }
        var replacement = Frame.allocate(width, height);
        current = replacement;
        reallocations.incrementAndGet();
        log.debug("Render buffers reallocated at {}x{}", width, height);
        return replacement;
    }

    /**
     * Number of times the buffers have been (re)allocated.
     */
    public int reallocations() {
        return reallocations.get();
    }
}
