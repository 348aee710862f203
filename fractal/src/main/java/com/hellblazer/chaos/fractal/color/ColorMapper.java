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
package com.hellblazer.chaos.fractal.color;

/**
 * Converts an iteration value into a packed {@code 0xRRGGBB} color.
 * <p>
 * Two modes are provided:
 * <ul>
 *   <li>palette mode, four closed-form formulas selected by {@code paletteId % 4}</li>
 *   <li>continuous-hue mode, an HSV cycle driven by the iteration value and the animation phase</li>
 * </ul>
 * In both modes a value equal to the iteration budget is interior and maps to black. Values are doubles because the
 * source may be an edge-transformed field rather than raw counts.
 *
 * @author hal.hildebrand
 */
public final class ColorMapper {

    public static final int PALETTE_COUNT = 4;
    public static final int BLACK         = 0;

    private static final double TWO_PI = 2.0 * Math.PI;

    private ColorMapper() {
    }

    /**
     * Palette-mode color.
     *
     * @param n            iteration value
     * @param maxIteration iteration budget
     * @param paletteId    palette counter; only {@code paletteId % 4} matters
     * @param params       channel multipliers
     * @return packed RGB
     */
    public static int paletteColor(double n, int maxIteration, int paletteId, PaletteParameters params) {
        if (n == maxIteration) {
            return BLACK;
        }
        int r, g, b;
        switch (Math.floorMod(paletteId, PALETTE_COUNT)) {
            case 0 -> {
                r = (int) Math.min(255.0, n * params.red());
                g = (int) Math.min(255.0, n * (params.green() + floorMod(n, 5.0)));
                b = (int) Math.max(0.0, 50.0 - n * params.blue());
            }
            case 1 -> {
                r = (int) Math.max(0.0, 100.0 - n * params.red());
                g = (int) Math.min(255.0, n * params.green());
                b = (int) Math.min(255.0, 100.0 + n * params.blue());
            }
            case 2 -> {
                r = Math.floorMod((int) (n * params.red() + 60.0), 256);
                g = Math.floorMod((int) (n * params.green() + 120.0), 256);
                b = Math.floorMod((int) (n * params.blue()), 100);
            }
            default -> {
                int grey = (int) (255.0 * n / maxIteration);
                r = grey;
                g = grey;
                b = grey;
            }
        }
        return pack(r, g, b);
    }

    /**
     * Continuous-hue color.
     *
     * @param n            iteration value
     * @param maxIteration iteration budget
     * @param timePhase    animation phase in [0, 1)
     * @param params       speeds and offsets
     * @return packed RGB
     */
    public static int psychedelicColor(double n, int maxIteration, double timePhase, PsychedelicParameters params) {
        if (n == maxIteration) {
            return BLACK;
        }
        double hue = floorMod(n / 25.0 + timePhase * params.hueSpeed() + params.hueOffset(), 1.0);
        double saturation = 0.6 + 0.4 * Math.sin(TWO_PI * timePhase * params.satSpeed() + params.satOffset());
        double value = 0.8 + 0.2 * Math.sin(n / 10.0 + TWO_PI * timePhase * params.valSpeed() + params.valOffset());
        return hsvToRgb(hue, saturation, value);
    }

    /**
     * Standard six-sector HSV to RGB conversion, components in [0, 1].
     *
     * @return packed RGB
     */
    public static int hsvToRgb(double hue, double saturation, double value) {
        int sector = (int) (hue * 6.0);
        double f = hue * 6.0 - sector;
        double p = value * (1.0 - saturation);
        double q = value * (1.0 - f * saturation);
        double t = value * (1.0 - (1.0 - f) * saturation);
        double r, g, b;
        switch (Math.floorMod(sector, 6)) {
            case 0 -> {
                r = value;
                g = t;
                b = p;
            }
            case 1 -> {
                r = q;
                g = value;
                b = p;
            }
            case 2 -> {
                r = p;
                g = value;
                b = t;
            }
            case 3 -> {
                r = p;
                g = q;
                b = value;
            }
            case 4 -> {
                r = t;
                g = p;
                b = value;
            }
            default -> {
                r = value;
                g = p;
                b = q;
            }
        }
        return pack((int) (r * 255), (int) (g * 255), (int) (b * 255));
    }

    /**
     * Pack channels, saturating each to [0, 255].
     */
    public static int pack(int r, int g, int b) {
        return clamp(r) << 16 | clamp(g) << 8 | clamp(b);
    }

    public static int red(int rgb) {
        return rgb >> 16 & 0xFF;
    }

    public static int green(int rgb) {
        return rgb >> 8 & 0xFF;
    }

    public static int blue(int rgb) {
        return rgb & 0xFF;
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }

    private static double floorMod(double x, double m) {
        return x - m * Math.floor(x / m);
    }
}
