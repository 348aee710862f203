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

/**
 * Parameters derived from an intent: the base viewport, the iteration budget and the family to render. For Julia the
 * family carries the derived constant.
 *
 * @param viewport     base viewport
 * @param maxIteration iteration budget
 * @param family       family, with its constant for Julia
 */
public record FractalParameters(Viewport viewport, int maxIteration, FractalFamily family) {

    public FractalParameters {
        if (viewport == null || family == null) {
            throw new IllegalArgumentException("Viewport and family are required");
        }
        if (maxIteration < 1) {
            throw new IllegalArgumentException("Max iteration must be at least 1: " + maxIteration);
        }
    }

    public FractalParameters withViewport(Viewport newViewport) {
        return new FractalParameters(newViewport, maxIteration, family);
    }

    public FractalParameters withFamily(FractalFamily newFamily) {
        return new FractalParameters(viewport, maxIteration, newFamily);
    }

    public FractalParameters withMaxIteration(int newMaxIteration) {
        return new FractalParameters(viewport, newMaxIteration, family);
    }
}
