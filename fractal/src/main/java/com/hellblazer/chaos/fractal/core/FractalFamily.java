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
 * The closed set of iterated-map families the engine renders. Each variant carries its own escape-time kernel, so the
 * family is chosen once per render and the per-pixel loop never inspects a name.
 * <p>
 * All three kernels share the escape test {@code |z|^2 > 4} and report the iteration count at which it first
 * triggers, or {@code maxIteration} when it never does.
 *
 * @author hal.hildebrand
 */
public sealed interface FractalFamily permits FractalFamily.Mandelbrot, FractalFamily.Julia, FractalFamily.BurningShip {

    FractalFamily MANDELBROT   = new Mandelbrot();
    FractalFamily BURNING_SHIP = new BurningShip();

    /**
     * Escape-time count for the plane coordinate {@code (re, im)}.
     *
     * @param re           real coordinate of the pixel
     * @param im           imaginary coordinate of the pixel
     * @param maxIteration iteration budget
     * @return count in {@code [0, maxIteration]}
     */
    int escapeTime(double re, double im, int maxIteration);

    /**
     * Display name, also used to build the default intent literal.
     */
    String displayName();

    /**
     * Resolve a family from its display name or enum-style name, case-insensitive. Julia resolves with the origin as
     * its constant.
     *
     * @throws IllegalArgumentException for unknown names
     */
    static FractalFamily fromName(String name) {
        var normalized = name == null ? "" : name.trim().toLowerCase().replace('_', ' ').replace('-', ' ');
        return switch (normalized) {
            case "mandelbrot" -> MANDELBROT;
            case "julia" -> new Julia(0.0, 0.0);
            case "burning ship", "burningship" -> BURNING_SHIP;
            default -> throw new IllegalArgumentException("Unknown fractal family: " + name);
        };
    }

    /**
     * {@code z <- z^2 + c}, {@code z0 = 0}, {@code c} the pixel coordinate.
     */
    record Mandelbrot() implements FractalFamily {
        @Override
        public int escapeTime(double re, double im, int maxIteration) {
            double zr = 0.0, zi = 0.0;
            int n = 0;
            while (n < maxIteration) {
                double zr2 = zr * zr;
                double zi2 = zi * zi;
                if (zr2 + zi2 > 4.0) {
                    break;
                }
                zi = 2.0 * zr * zi + im;
                zr = zr2 - zi2 + re;
                n++;
            }
            return n;
        }

        @Override
        public String displayName() {
            return "Mandelbrot";
        }
    }

    /**
     * {@code z <- z^2 + c}, {@code z0} the pixel coordinate, {@code c} fixed.
     *
     * @param cReal real part of the constant
     * @param cImag imaginary part of the constant
     */
    record Julia(double cReal, double cImag) implements FractalFamily {
        @Override
        public int escapeTime(double re, double im, int maxIteration) {
            double zr = re, zi = im;
            int n = 0;
            while (n < maxIteration) {
                double zr2 = zr * zr;
                double zi2 = zi * zi;
                if (zr2 + zi2 > 4.0) {
                    break;
                }
                zi = 2.0 * zr * zi + cImag;
                zr = zr2 - zi2 + cReal;
                n++;
            }
            return n;
        }

        @Override
        public String displayName() {
            return "Julia";
        }

        public Julia withConstant(double real, double imag) {
            return new Julia(real, imag);
        }
    }

    /**
     * {@code z <- (|Re z| + i|Im z|)^2 + c}, {@code z0 = 0}, {@code c} the pixel coordinate.
     */
    record BurningShip() implements FractalFamily {
        @Override
        public int escapeTime(double re, double im, int maxIteration) {
            double zr = 0.0, zi = 0.0;
            int n = 0;
            while (n < maxIteration) {
                if (zr * zr + zi * zi > 4.0) {
                    break;
                }
                double ar = Math.abs(zr);
                double ai = Math.abs(zi);
                double nextReal = ar * ar - ai * ai + re;
                zi = 2.0 * ar * ai + im;
                zr = nextReal;
                n++;
            }
            return n;
        }

        @Override
        public String displayName() {
            return "Burning Ship";
        }
    }
}
