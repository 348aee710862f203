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

import static com.hellblazer.chaos.fractal.color.PaletteParameters.uniform;

/**
 * Speeds and phase offsets of the continuous-hue coloring mode.
 *
 * @param hueSpeed  hue cycles per animation period
 * @param satSpeed  saturation oscillations per animation period
 * @param valSpeed  value oscillations per animation period
 * @param hueOffset constant hue shift, in turns
 * @param satOffset saturation phase, radians
 * @param valOffset value phase, radians
 */
public record PsychedelicParameters(double hueSpeed, double satSpeed, double valSpeed, double hueOffset,
                                    double satOffset, double valOffset) {

    public static final PsychedelicParameters DEFAULT = new PsychedelicParameters(2.0, 3.0, 1.0, 0.0, 0.0, 0.0);

    /**
     * Fresh parameters: hue and saturation speeds in [1, 4), value speed in [0.5, 2), offsets in [0, 1).
     */
    public static PsychedelicParameters random(Random random) {
        return new PsychedelicParameters(uniform(random, 1.0, 4.0), uniform(random, 1.0, 4.0),
                                         uniform(random, 0.5, 2.0), random.nextDouble(), random.nextDouble(),
                                         random.nextDouble());
    }
}
