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

/**
 * The named visual-effect toggles.
 * <p>
 * {@link #WARP_BANDS} and {@link #PIXEL_GLITCH} act on the iteration value before coloring; {@link #TUNNEL_VIGNETTE},
 * {@link #COLOR_CRUSH} and {@link #SCAN_LINES} act on the colored pixel. {@link #NEON_EDGES} and {@link #EMBOSS}
 * select the convolution source, {@link #RGB_SHIFT} is applied when compositing for display, {@link #JULIA_MORPH}
 * perturbs the Julia constant and {@link #STROBE} advances the palette.
 */
public enum Effect {
    PSYCHEDELIC("colors"),
    WARP_BANDS("bands"),
    TUNNEL_VIGNETTE("tunnel"),
    PIXEL_GLITCH("glitch"),
    COLOR_CRUSH("crush"),
    SCAN_LINES("scan"),
    RGB_SHIFT("rgb"),
    NEON_EDGES("neon"),
    EMBOSS("emboss"),
    JULIA_MORPH("morph"),
    STROBE("strobe");

    private final String key;

    Effect(String key) {
        this.key = key;
    }

    /**
     * Short name used on the command line.
     */
    public String getKey() {
        return key;
    }

    /**
     * Resolve by short key or enum name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Effect fromString(String name) {
        for (var effect : values()) {
            if (effect.key.equalsIgnoreCase(name) || effect.name().equalsIgnoreCase(name)) {
                return effect;
            }
        }
        throw new IllegalArgumentException("Unknown effect: " + name);
    }
}
