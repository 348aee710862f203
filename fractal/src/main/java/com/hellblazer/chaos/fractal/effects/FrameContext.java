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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

/**
 * Everything colorization reads for one frame, captured before the frame starts.
 *
 * @param effects      enabled effects
 * @param parameters   effect parameters
 * @param timePhase    animation phase in [0, 1)
 * @param paletteId    palette counter
 * @param maxIteration iteration budget of the source grid
 * @param random       glitch source; colorization of one frame runs on one thread
 */
public record FrameContext(Set<Effect> effects, EffectParameters parameters, double timePhase, int paletteId,
                           int maxIteration, Random random) {

    public FrameContext {
        if (parameters == null || random == null) {
            throw new IllegalArgumentException("Parameters and random source are required");
        }
        if (maxIteration < 1) {
            throw new IllegalArgumentException("Max iteration must be at least 1: " + maxIteration);
        }
        effects = effects == null || effects.isEmpty() ? Collections.emptySet()
                                                       : Collections.unmodifiableSet(EnumSet.copyOf(effects));
    }

    /**
     * Context with no effects, as used for snapshot export.
     */
    public static FrameContext plain(EffectParameters parameters, int paletteId, int maxIteration, Random random) {
        return new FrameContext(Collections.emptySet(), parameters, 0.0, paletteId, maxIteration, random);
    }

    public boolean has(Effect effect) {
        return effects.contains(effect);
    }
}
