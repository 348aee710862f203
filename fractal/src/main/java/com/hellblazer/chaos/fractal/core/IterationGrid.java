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
 * Row-major {@code height x width} grid of escape-time counts in {@code [0, maxIteration]}.
 * <p>
 * A grid is overwritten in place by successive renders of the same size; the owner reallocates it only when the
 * dimensions change. Distinct rows may be written by distinct threads.
 *
 * @author hal.hildebrand
 */
public final class IterationGrid {

    private final int   width;
    private final int   height;
    private final int[] counts;
    private volatile int maxIteration;

    public IterationGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.counts = new int[width * height];
    }

    public int get(int x, int y) {
        return counts[y * width + x];
    }

    public void set(int x, int y, int count) {
        counts[y * width + x] = count;
    }

    /**
     * Whether the pixel never escaped within the budget of the last render.
     */
    public boolean isInterior(int x, int y) {
        return get(x, y) == maxIteration;
    }

    public int maxIteration() {
        return maxIteration;
    }

    public void setMaxIteration(int maxIteration) {
        if (maxIteration < 1) {
            throw new IllegalArgumentException("Max iteration must be at least 1: " + maxIteration);
        }
        this.maxIteration = maxIteration;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean hasDimensions(int w, int h) {
        return width == w && height == h;
    }

    /**
     * Copy of the raw row-major counts.
     */
    public int[] toArray() {
        return counts.clone();
    }

    /**
     * Direct view of the row-major counts, for the convolution and colorization stages.
     */
    public int[] rawCounts() {
        return counts;
    }

    /**
     * The counts widened to doubles, the scalar-field form consumed by colorization when no edge transform is active.
     */
    public double[] toScalarField(double[] target) {
        if (target.length != counts.length) {
            throw new IllegalArgumentException("Target length " + target.length + " != " + counts.length);
        }
        for (int i = 0; i < counts.length; i++) {
            target[i] = counts[i];
        }
        return target;
    }

    @Override
    public String toString() {
        return "IterationGrid[" + width + "x" + height + ", max=" + maxIteration + "]";
    }
}
