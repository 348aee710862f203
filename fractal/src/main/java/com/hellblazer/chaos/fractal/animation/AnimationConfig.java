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
package com.hellblazer.chaos.fractal.animation;

/**
 * Constants of the viewport oscillation and interactive zoom.
 *
 * @param periodSeconds  length of one animation cycle
 * @param zoomMagnitude  fractional span oscillation amplitude
 * @param panMagnitudeX  real-axis drift as a fraction of the span
 * @param panMagnitudeY  imaginary-axis drift as a fraction of the imaginary span
 * @param zoomStep       span factor of one interactive zoom step
 */
public record AnimationConfig(double periodSeconds, double zoomMagnitude, double panMagnitudeX,
                              double panMagnitudeY, double zoomStep) {

    public static final AnimationConfig DEFAULT = new AnimationConfig(15.0, 0.25, 0.04, 0.04, 1.15);

    public AnimationConfig {
        if (periodSeconds <= 0.0) {
            throw new IllegalArgumentException("Animation period must be positive: " + periodSeconds);
        }
        if (zoomMagnitude < 0.0 || zoomMagnitude >= 1.0) {
            throw new IllegalArgumentException("Zoom magnitude must be in [0, 1): " + zoomMagnitude);
        }
        if (zoomStep <= 1.0) {
            throw new IllegalArgumentException("Zoom step must exceed 1: " + zoomStep);
        }
    }

    public long periodMillis() {
        return Math.round(periodSeconds * 1000.0);
    }
}
