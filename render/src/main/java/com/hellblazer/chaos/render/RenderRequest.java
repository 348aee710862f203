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
package com.hellblazer.chaos.render;

import com.hellblazer.chaos.fractal.effects.FrameContext;
import com.hellblazer.chaos.fractal.filter.EdgeMode;
import com.hellblazer.chaos.fractal.intent.FractalParameters;

/**
 * Everything needed to render one frame, fixed when the request is made.
 *
 * @param parameters  the displayed viewport, iteration budget and effective family
 * @param width       grid width
 * @param height      grid height
 * @param edgeMode    coloring source selection
 * @param frame       coloring state
 */
public record RenderRequest(FractalParameters parameters, int width, int height, EdgeMode edgeMode,
                            FrameContext frame) {

    public RenderRequest {
        if (parameters == null || edgeMode == null || frame == null) {
            throw new IllegalArgumentException("Parameters, edge mode and frame context are required");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (frame.maxIteration() != parameters.maxIteration()) {
            throw new IllegalArgumentException(
            "Frame budget " + frame.maxIteration() + " does not match " + parameters.maxIteration());
        }
    }
}
