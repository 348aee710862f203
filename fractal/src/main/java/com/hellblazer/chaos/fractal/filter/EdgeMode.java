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
package com.hellblazer.chaos.fractal.filter;

/**
 * Which convolution, if any, replaces the raw iteration counts as the colorization source.
 */
public enum EdgeMode {
    NONE,
    SOBEL,
    EMBOSS;

    /**
     * Resolve the two edge toggles. Sobel wins when both are set.
     *
     * @param neonEdges Sobel toggle
     * @param emboss    emboss toggle
     */
    public static EdgeMode select(boolean neonEdges, boolean emboss) {
        if (neonEdges) {
            return SOBEL;
        }
        return emboss ? EMBOSS : NONE;
    }
}
