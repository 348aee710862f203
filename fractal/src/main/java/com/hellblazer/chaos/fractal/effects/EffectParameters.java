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

import com.hellblazer.chaos.fractal.color.PaletteParameters;
import com.hellblazer.chaos.fractal.color.PsychedelicParameters;

import java.util.Random;

/**
 * The tunable look of every effect. Immutable; {@link #randomized} returns a copy with one effect's parameters
 * redrawn.
 *
 * @param psychedelic   continuous-hue speeds and offsets
 * @param warpFrequency row period divisor of the warp bands
 * @param warpAmplitude iteration offset amplitude of the warp bands
 * @param tunnelPower   exponent of the vignette falloff
 * @param glitchChance  per-pixel glitch probability
 * @param crushLevels   quantization levels per channel
 * @param rgbShift      display-stage channel offset in pixels
 * @param morphRadius   radius of the Julia constant orbit
 * @param palette       palette-mode multipliers
 * @param scanSpacing   row spacing of the scan lines
 * @param scanDarkness  brightness multiplier of a scan line
 */
public record EffectParameters(PsychedelicParameters psychedelic, double warpFrequency, double warpAmplitude,
                               double tunnelPower, double glitchChance, int crushLevels, int rgbShift,
                               double morphRadius, PaletteParameters palette, int scanSpacing, double scanDarkness) {

    public static final EffectParameters DEFAULTS = new EffectParameters(PsychedelicParameters.DEFAULT, 30.0, 10.0,
                                                                         2.0, 0.001, 4, 2, 0.005,
                                                                         PaletteParameters.DEFAULT, 4, 0.7);

    public EffectParameters {
        if (psychedelic == null || palette == null) {
            throw new IllegalArgumentException("Color parameters are required");
        }
        if (warpFrequency <= 0.0) {
            throw new IllegalArgumentException("Warp frequency must be positive: " + warpFrequency);
        }
        if (crushLevels < 1 || crushLevels > 256) {
            throw new IllegalArgumentException("Crush levels must be in [1, 256]: " + crushLevels);
        }
        if (scanSpacing < 1) {
            throw new IllegalArgumentException("Scan line spacing must be positive: " + scanSpacing);
        }
    }

    /**
     * Copy with the parameters belonging to {@code effect} drawn fresh from their ranges. Neon edges and emboss both
     * redraw the palette multipliers; strobe has no parameters.
     */
    public EffectParameters randomized(Effect effect, Random random) {
        return switch (effect) {
            case PSYCHEDELIC -> new EffectParameters(PsychedelicParameters.random(random), warpFrequency,
                                                     warpAmplitude, tunnelPower, glitchChance, crushLevels, rgbShift,
                                                     morphRadius, palette, scanSpacing, scanDarkness);
            case WARP_BANDS -> new EffectParameters(psychedelic, uniform(random, 15.0, 60.0),
                                                    uniform(random, 5.0, 15.0), tunnelPower, glitchChance,
                                                    crushLevels, rgbShift, morphRadius, palette, scanSpacing,
                                                    scanDarkness);
            case TUNNEL_VIGNETTE -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude,
                                                         uniform(random, 1.5, 3.5), glitchChance, crushLevels,
                                                         rgbShift, morphRadius, palette, scanSpacing, scanDarkness);
            case PIXEL_GLITCH -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower,
                                                      uniform(random, 0.0005, 0.0025), crushLevels, rgbShift,
                                                      morphRadius, palette, scanSpacing, scanDarkness);
            case COLOR_CRUSH -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower,
                                                     glitchChance, 3 + random.nextInt(6), rgbShift, morphRadius,
                                                     palette, scanSpacing, scanDarkness);
            case RGB_SHIFT -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower,
                                                   glitchChance, crushLevels, 1 + random.nextInt(4), morphRadius,
                                                   palette, scanSpacing, scanDarkness);
            case JULIA_MORPH -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower,
                                                     glitchChance, crushLevels, rgbShift,
                                                     uniform(random, 0.002, 0.01), palette, scanSpacing,
                                                     scanDarkness);
            case NEON_EDGES, EMBOSS -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower,
                                                            glitchChance, crushLevels, rgbShift, morphRadius,
                                                            PaletteParameters.random(random), scanSpacing,
                                                            scanDarkness);
            case SCAN_LINES -> new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower,
                                                    glitchChance, crushLevels, rgbShift, morphRadius, palette,
                                                    3 + random.nextInt(4), uniform(random, 0.5, 0.8));
            case STROBE -> this;
        };
    }

    public EffectParameters withPalette(PaletteParameters newPalette) {
        return new EffectParameters(psychedelic, warpFrequency, warpAmplitude, tunnelPower, glitchChance,
                                    crushLevels, rgbShift, morphRadius, newPalette, scanSpacing, scanDarkness);
    }

    private static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
