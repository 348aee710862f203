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
package com.hellblazer.chaos.fractal.intent;

import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.core.Viewport;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives a reproducible view of a fractal from arbitrary text.
 * <p>
 * The UTF-8 text is hashed with SHA-256 and fixed slices of the lowercase hex digest are read as unsigned integers
 * and rescaled:
 * <ul>
 *   <li>{@code [0,4)}: real span in {@code [0.001, 3.5]} (Burning Ship and Julia use the fixed spans 2.8 and 3.0)</li>
 *   <li>{@code [4,8)}, {@code [8,12)}: center offsets of up to 15% of the span around the family's base center, the
 *   imaginary offset scaled by the aspect ratio</li>
 *   <li>{@code [16,18)}: iteration budget between the base and 2.5 times the base</li>
 *   <li>{@code [20,24)}, {@code [24,28)}: Julia constant, each part in {@code [-1.5, 1.5]}</li>
 * </ul>
 * The same text, aspect ratio, family and base budget always produce bit-identical parameters.
 *
 * @author hal.hildebrand
 */
public class IntentParameterGenerator {

    /**
     * The prompt shown in an untouched intent field; treated like empty text.
     */
    public static final String PLACEHOLDER_INTENT = "Write Your Intent Here...";

    public static final double MIN_SPAN = 0.001;
    public static final double MAX_SPAN = 3.5;

    private static final double OFFSET_FRACTION   = 0.3;
    private static final double JULIA_C_MIN       = -1.5;
    private static final double JULIA_C_RANGE     = 3.0;
    private static final double ITERATION_SPREAD  = 2.5;
    private static final double SHORT_SLICE_RANGE = 65535.0;
    private static final double BYTE_SLICE_RANGE  = 255.0;

    private final int baseMaxIteration;

    /**
     * @param baseMaxIteration lower bound of the derived iteration budget
     */
    public IntentParameterGenerator(int baseMaxIteration) {
        if (baseMaxIteration < 1) {
            throw new IllegalArgumentException("Base max iteration must be at least 1: " + baseMaxIteration);
        }
        this.baseMaxIteration = baseMaxIteration;
    }

    /**
     * The literal hashed in place of empty or placeholder text.
     */
    public static String defaultIntent(FractalFamily family) {
        return family.displayName() + " Default";
    }

    /**
     * Text that will actually be hashed for the given input.
     */
    public static String effectiveIntent(String intent, FractalFamily family) {
        if (intent == null || intent.isEmpty() || PLACEHOLDER_INTENT.equals(intent)) {
            return defaultIntent(family);
        }
        return intent;
    }

    /**
     * Derive the parameters for an intent.
     *
     * @param intent      user text; empty or placeholder text is replaced by {@link #defaultIntent}
     * @param aspectRatio width / height of the render grid; non-positive ratios leave the imaginary offset unscaled
     * @param family      family to view; only its kind matters, a Julia constant is replaced by the derived one
     * @return derived parameters
     */
    public FractalParameters generate(String intent, double aspectRatio, FractalFamily family) {
        var hex = digest(effectiveIntent(intent, family));

        double reSpan = MIN_SPAN + (slice(hex, 0, 4) / SHORT_SLICE_RANGE) * (MAX_SPAN - MIN_SPAN);
        double reBase;
        double imBase;
        if (family instanceof FractalFamily.BurningShip) {
            reBase = -0.5;
            imBase = -0.5;
            reSpan = 2.8;
        } else if (family instanceof FractalFamily.Julia) {
            reBase = 0.0;
            imBase = 0.0;
            reSpan = 3.0;
        } else {
            reBase = -0.75;
            imBase = 0.0;
        }

        double reOffset = (-0.5 + slice(hex, 4, 8) / SHORT_SLICE_RANGE) * reSpan * OFFSET_FRACTION;
        double imExtent = aspectRatio > 0 ? reSpan / aspectRatio : reSpan;
        double imOffset = (-0.5 + slice(hex, 8, 12) / SHORT_SLICE_RANGE) * imExtent * OFFSET_FRACTION;

        int maxBudget = (int) (baseMaxIteration * ITERATION_SPREAD);
        int maxIteration = baseMaxIteration + (int) ((slice(hex, 16, 18) / BYTE_SLICE_RANGE) * (maxBudget
                                                                                                  - baseMaxIteration));

        FractalFamily resolved = family;
        if (family instanceof FractalFamily.Julia) {
            double cReal = JULIA_C_MIN + (slice(hex, 20, 24) / SHORT_SLICE_RANGE) * JULIA_C_RANGE;
            double cImag = JULIA_C_MIN + (slice(hex, 24, 28) / SHORT_SLICE_RANGE) * JULIA_C_RANGE;
            resolved = new FractalFamily.Julia(cReal, cImag);
        }

        var viewport = new Viewport(reSpan, reBase + reOffset, imBase + imOffset);
        return new FractalParameters(viewport, Math.max(1, maxIteration), resolved);
    }

    public int baseMaxIteration() {
        return baseMaxIteration;
    }

    /**
     * Lowercase hex SHA-256 digest of the UTF-8 text.
     */
    static String digest(String text) {
        try {
            var sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static int slice(String hex, int from, int to) {
        return Integer.parseInt(hex, from, to, 16);
    }
}
