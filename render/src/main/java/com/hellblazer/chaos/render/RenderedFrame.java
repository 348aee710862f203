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

import com.hellblazer.chaos.fractal.core.PixelBuffer;
import com.hellblazer.chaos.fractal.intent.FractalParameters;
import com.hellblazer.chaos.render.tile.DispatchMetrics;

/**
 * A finished frame. The pixel buffer is a private copy; it is not touched by later renders.
 *
 * @param frameNumber     sequence number within the pipeline
 * @param pixels          colored frame at grid resolution
 * @param parameters      what was rendered
 * @param metrics         grid dispatch metrics; zero tiles for a recolor of an existing grid
 * @param renderTimeNanos total time including colorization
 */
public record RenderedFrame(long frameNumber, PixelBuffer pixels, FractalParameters parameters,
                            DispatchMetrics metrics, long renderTimeNanos) {

    public int width() {
        return pixels.width();
    }

    public int height() {
        return pixels.height();
    }
}
