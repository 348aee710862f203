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
 * A rectangle of the complex plane described by its real-axis extent and its center. The imaginary extent is not
 * stored; it is derived from the pixel aspect ratio of whatever grid the viewport is mapped onto.
 *
 * @param reSpan   width of the rectangle along the real axis, always positive
 * @param reCenter real coordinate of the center
 * @param imCenter imaginary coordinate of the center
 * @author hal.hildebrand
 */
public record Viewport(double reSpan, double reCenter, double imCenter) {

    /**
     * The classic full view of the Mandelbrot set.
     */
    public static final Viewport DEFAULT = new Viewport(3.5, -0.5, 0.0);

    public Viewport {
        if (!(reSpan > 0.0) || Double.isInfinite(reSpan)) {
            throw new IllegalArgumentException("Real span must be positive and finite: " + reSpan);
        }
        if (!Double.isFinite(reCenter) || !Double.isFinite(imCenter)) {
            throw new IllegalArgumentException("Center must be finite: (" + reCenter + ", " + imCenter + ")");
        }
    }

    /**
     * Imaginary extent of this viewport when shown at the given aspect ratio (width / height).
     */
    public double imSpan(double aspectRatio) {
        return reSpan / aspectRatio;
    }

    public Viewport withCenter(double newReCenter, double newImCenter) {
        return new Viewport(reSpan, newReCenter, newImCenter);
    }

    public Viewport withSpan(double newReSpan) {
        return new Viewport(newReSpan, reCenter, imCenter);
    }
}
