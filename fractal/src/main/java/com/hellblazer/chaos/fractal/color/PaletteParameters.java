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

import java.util.Random;

/**
 * Per-channel multipliers of the palette formulas.
 *
 * @param red   red multiplier
 * @param green green multiplier
 * @param blue  blue multiplier
 */
public record PaletteParameters(double red, double green, double blue) {

    public static final PaletteParameters DEFAULT = new PaletteParameters(15.0, 5.0, 2.0);

    /**
     * Fresh multipliers: red in [5, 20), green in [2, 10), blue in [1, 5).
     */
    public static PaletteParameters random(Random random) {
        return new PaletteParameters(uniform(random, 5.0, 20.0), uniform(random, 2.0, 10.0),
                                     uniform(random, 1.0, 5.0));
    }

    static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
