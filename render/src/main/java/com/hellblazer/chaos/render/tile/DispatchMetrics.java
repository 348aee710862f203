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
package com.hellblazer.chaos.render.tile;

/**
 * Work done by one grid dispatch.
 *
 * @param totalTiles     number of tiles computed
 * @param totalPixels    number of pixels computed
 * @param interiorPixels pixels that exhausted the iteration budget
 * @param dispatchTimeNs wall time from first submission to the barrier, in nanoseconds
 */
public record DispatchMetrics(int totalTiles, int totalPixels, int interiorPixels, long dispatchTimeNs) {

    public DispatchMetrics {
        if (totalTiles < 0) {
            throw new IllegalArgumentException("Total tiles must be non-negative");
        }
        if (totalPixels < 0) {
            throw new IllegalArgumentException("Total pixels must be non-negative");
        }
        if (interiorPixels < 0 || interiorPixels > totalPixels) {
            throw new IllegalArgumentException("Interior pixels must be in [0, totalPixels]");
        }
        if (dispatchTimeNs < 0) {
            throw new IllegalArgumentException("Dispatch time must be non-negative");
        }
    }

    /**
     * Fraction of pixels inside the set.
     */
    public double interiorRatio() {
        return totalPixels == 0 ? 0.0 : (double) interiorPixels / totalPixels;
    }
}
