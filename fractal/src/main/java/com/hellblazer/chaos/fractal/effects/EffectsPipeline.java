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
package com.hellblazer.chaos.fractal.effects;

import com.hellblazer.chaos.fractal.color.ColorMapper;
import com.hellblazer.chaos.fractal.core.PixelBuffer;

/**
 * Colorizes a scalar field into a {@link PixelBuffer}, running the enabled effects in a fixed order per pixel:
 * <ol>
 *   <li>warp bands, on the iteration value of non-interior pixels</li>
 *   <li>pixel glitch, replacing the iteration value</li>
 *   <li>color mapping, palette or continuous-hue</li>
 *   <li>tunnel vignette</li>
 *   <li>color crush</li>
 *   <li>scan lines</li>
 * </ol>
 * The first two change what gets colored; the last three are brightness and quantization transforms of the colored
 * pixel.
 *
 * @author hal.hildebrand
 */
public final class EffectsPipeline {

    private EffectsPipeline() {
    }

    /**
     * Colorize a whole frame.
     *
     * @param field  row-major iteration values, raw counts or an edge transform of them
     * @param width  field width
     * @param height field height
     * @param target output buffer of the same dimensions
     * @param frame  effects, parameters and animation state of this frame
     */
    public static void colorize(double[] field, int width, int height, PixelBuffer target, FrameContext frame) {
        if (field.length != width * height) {
            throw new IllegalArgumentException(
            "Field length " + field.length + " does not match " + width + "x" + height);
        }
        if (!target.hasDimensions(width, height)) {
            throw new IllegalArgumentException(
            "Target " + target.width() + "x" + target.height() + " does not match " + width + "x" + height);
        }

        var params = frame.parameters();
        int max = frame.maxIteration();
        boolean warp = frame.has(Effect.WARP_BANDS);
        boolean glitch = frame.has(Effect.PIXEL_GLITCH);
        boolean psychedelic = frame.has(Effect.PSYCHEDELIC);
        boolean tunnel = frame.has(Effect.TUNNEL_VIGNETTE);
        boolean crush = frame.has(Effect.COLOR_CRUSH);
        boolean scan = frame.has(Effect.SCAN_LINES);
        var random = frame.random();

        for (int y = 0; y < height; y++) {
            boolean darkRow = scan && y % params.scanSpacing() == 0;
            for (int x = 0; x < width; x++) {
                double n = field[y * width + x];
                if (warp) {
                    n = warp(n, y, max, frame.timePhase(), params.warpFrequency(), params.warpAmplitude());
                }
                if (glitch && random.nextDouble() < params.glitchChance()) {
                    n = random.nextInt(max + 1);
                }

                int rgb = psychedelic ? ColorMapper.psychedelicColor(n, max, frame.timePhase(), params.psychedelic())
                                      : ColorMapper.paletteColor(n, max, frame.paletteId(), params.palette());
                int r = ColorMapper.red(rgb);
                int g = ColorMapper.green(rgb);
                int b = ColorMapper.blue(rgb);

                if (tunnel) {
                    double brightness = tunnelBrightness(x, y, width, height, params.tunnelPower());
                    r = (int) (r * brightness);
                    g = (int) (g * brightness);
                    b = (int) (b * brightness);
                }
                if (crush) {
                    r = crush(r, params.crushLevels());
                    g = crush(g, params.crushLevels());
                    b = crush(b, params.crushLevels());
                }
                if (darkRow) {
                    r = (int) (r * params.scanDarkness());
                    g = (int) (g * params.scanDarkness());
                    b = (int) (b * params.scanDarkness());
                }
                target.set(x, y, r, g, b);
            }
        }
    }

    /**
     * Offset a non-interior iteration value by {@code sin(y / frequency + phase * 4pi) * amplitude}, truncated toward
     * zero and clamped at zero. Interior values pass through.
     */
    public static double warp(double n, int y, int maxIteration, double timePhase, double frequency,
                              double amplitude) {
        if (n >= maxIteration) {
            return n;
        }
        double offset = Math.sin(y / frequency + timePhase * Math.PI * 4.0) * amplitude;
        return Math.max(0.0, n + (int) offset);
    }

    /**
     * Radial falloff {@code max(0, 1 - (d / dMax)^power)} from the grid center.
     */
    public static double tunnelBrightness(int x, int y, int width, int height, double power) {
        double cx = width / 2.0;
        double cy = height / 2.0;
        double maxDist = Math.sqrt(cx * cx + cy * cy);
        double dx = x - cx;
        double dy = y - cy;
        double dist = Math.sqrt(dx * dx + dy * dy);
        return Math.max(0.0, 1.0 - Math.pow(dist / maxDist, power));
    }

    /**
     * Quantize a channel to {@code floor(channel / factor) * factor} with {@code factor = 256 / levels}, truncated to
     * an integer. Only levels dividing 256 give exact bucket edges; for the others a crushed value may fall into the
     * bucket below when crushed again.
     */
    public static int crush(int channel, int levels) {
        double factor = 256.0 / levels;
        return (int) (Math.floor(channel / factor) * factor);
    }
}
