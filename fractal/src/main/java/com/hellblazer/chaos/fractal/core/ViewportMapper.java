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

import javax.vecmath.Point2d;

/**
 * Maps between a pixel grid and the complex-plane rectangle of a {@link Viewport}.
 * <p>
 * Pixel {@code (x, y)} maps to
 * <pre>
 * real = reStart + (x / width)  * (reEnd - reStart)
 * imag = imStart + (y / height) * (imEnd - imStart)
 * </pre>
 * so pixel {@code (0, 0)} is the lower-left corner of the plane rectangle and pixel {@code (width, height)} the
 * upper-right corner. Every consumer (interactive frames, snapshot export) goes through this class so that the same
 * viewport shows the same region at any resolution.
 * <p>
 * Instances are immutable and safe to share between worker threads.
 *
 * @author hal.hildebrand
 */
public final class ViewportMapper {

    private final int    width;
    private final int    height;
    private final double reStart;
    private final double reEnd;
    private final double imStart;
    private final double imEnd;

    /**
     * Create a mapper for the viewport at the given pixel dimensions.
     *
     * @param viewport the plane rectangle
     * @param width    pixel width, must be positive
     * @param height   pixel height, must be positive
     */
    public ViewportMapper(Viewport viewport, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Pixel dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;

        var imSpan = viewport.imSpan(aspectRatio(width, height));
        this.reStart = viewport.reCenter() - viewport.reSpan() / 2.0;
        this.reEnd = viewport.reCenter() + viewport.reSpan() / 2.0;
        this.imStart = viewport.imCenter() - imSpan / 2.0;
        this.imEnd = viewport.imCenter() + imSpan / 2.0;
    }

    /**
     * Aspect ratio (width / height) of a pixel grid, 1.0 when the height is not positive.
     */
    public static double aspectRatio(int width, int height) {
        return height > 0 ? (double) width / height : 1.0;
    }

    /**
     * Real coordinate of pixel column {@code x}.
     */
    public double real(double x) {
        return reStart + (x / width) * (reEnd - reStart);
    }

    /**
     * Imaginary coordinate of pixel row {@code y}.
     */
    public double imag(double y) {
        return imStart + (y / height) * (imEnd - imStart);
    }

    /**
     * Map a pixel position to its plane coordinate.
     */
    public Point2d map(double x, double y) {
        return new Point2d(real(x), imag(y));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public double reStart() {
        return reStart;
    }

    public double reEnd() {
        return reEnd;
    }

    public double imStart() {
        return imStart;
    }

    public double imEnd() {
        return imEnd;
    }

    @Override
    public String toString() {
        return String.format("ViewportMapper[%dx%d re=[%g, %g] im=[%g, %g]]", width, height, reStart, reEnd, imStart,
                             imEnd);
    }
}
