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
package com.hellblazer.chaos.render.config;

import com.hellblazer.chaos.fractal.animation.AnimationConfig;

/**
 * Startup configuration of the engine.
 *
 * @param displayWidth        initial display width in pixels
 * @param displayHeight       initial display height in pixels
 * @param renderScale         display-to-grid downsampling divisor
 * @param baseMaxIteration    base iteration budget of intent derivation
 * @param minGridDimension    floor of each grid dimension
 * @param animationTickMillis interval between animation frames
 * @param strobeIntervalMillis interval between strobe recolors when not animating
 * @param animationPeriodSeconds length of one animation cycle
 * @param zoomMagnitude       fractional span oscillation amplitude
 * @param panMagnitudeX       real-axis drift as a fraction of the span
 * @param panMagnitudeY       imaginary-axis drift as a fraction of the imaginary span
 * @param zoomStep            span factor of one interactive zoom step
 * @param exportWidth         snapshot export width
 * @param exportHeight        snapshot export height
 * @param tileSize            tile edge of the grid dispatch
 * @param workerThreads       tile worker pool size
 * @param oracleRefreshMillis interval between oracle values
 *
 * @author hal.hildebrand
 */
public record EngineConfiguration(int displayWidth, int displayHeight, double renderScale, int baseMaxIteration,
                                  int minGridDimension, long animationTickMillis, long strobeIntervalMillis,
                                  double animationPeriodSeconds, double zoomMagnitude, double panMagnitudeX,
                                  double panMagnitudeY, double zoomStep, int exportWidth, int exportHeight,
                                  int tileSize, int workerThreads, long oracleRefreshMillis) {

    public static final double MIN_RENDER_SCALE    = 0.5;
    public static final double MAX_RENDER_SCALE    = 10.0;
    public static final int    MIN_BASE_ITERATIONS = 10;
    public static final int    MAX_BASE_ITERATIONS = 1000;

    public static EngineConfiguration defaults() {
        return new EngineConfiguration(560, 420, 1.5, 45, 50, 75L, 100L, 15.0, 0.25, 0.04, 0.04, 1.15, 1920, 1080,
                                       32, Runtime.getRuntime().availableProcessors(), 1000L);
    }

    public EngineConfiguration {
        if (displayWidth <= 0 || displayHeight <= 0) {
            throw new IllegalArgumentException("Display dimensions must be positive");
        }
        if (renderScale < MIN_RENDER_SCALE || renderScale > MAX_RENDER_SCALE) {
            throw new IllegalArgumentException(
            "Render scale must be in [" + MIN_RENDER_SCALE + ", " + MAX_RENDER_SCALE + "]: " + renderScale);
        }
        if (baseMaxIteration < MIN_BASE_ITERATIONS || baseMaxIteration > MAX_BASE_ITERATIONS) {
            throw new IllegalArgumentException(
            "Base max iteration must be in [" + MIN_BASE_ITERATIONS + ", " + MAX_BASE_ITERATIONS + "]: "
            + baseMaxIteration);
        }
        if (minGridDimension <= 0) {
            throw new IllegalArgumentException("Minimum grid dimension must be positive");
        }
        if (animationTickMillis <= 0 || strobeIntervalMillis <= 0 || oracleRefreshMillis <= 0) {
            throw new IllegalArgumentException("Timer intervals must be positive");
        }
        if (exportWidth <= 0 || exportHeight <= 0) {
            throw new IllegalArgumentException("Export dimensions must be positive");
        }
        if (tileSize <= 0 || workerThreads <= 0) {
            throw new IllegalArgumentException("Tile size and worker threads must be positive");
        }
    }

    /**
     * The animation constants of this configuration.
     */
    public AnimationConfig animation() {
        return new AnimationConfig(animationPeriodSeconds, zoomMagnitude, panMagnitudeX, panMagnitudeY, zoomStep);
    }

    public EngineConfiguration withRenderSettings(double scale, int iterations) {
        return new EngineConfiguration(displayWidth, displayHeight, scale, iterations, minGridDimension,
                                       animationTickMillis, strobeIntervalMillis, animationPeriodSeconds,
                                       zoomMagnitude, panMagnitudeX, panMagnitudeY, zoomStep, exportWidth,
                                       exportHeight, tileSize, workerThreads, oracleRefreshMillis);
    }

    public EngineConfiguration withWorkerThreads(int threads) {
        return new EngineConfiguration(displayWidth, displayHeight, renderScale, baseMaxIteration, minGridDimension,
                                       animationTickMillis, strobeIntervalMillis, animationPeriodSeconds,
                                       zoomMagnitude, panMagnitudeX, panMagnitudeY, zoomStep, exportWidth,
                                       exportHeight, tileSize, threads, oracleRefreshMillis);
    }

    public EngineConfiguration withDisplay(int width, int height) {
        return new EngineConfiguration(width, height, renderScale, baseMaxIteration, minGridDimension,
                                       animationTickMillis, strobeIntervalMillis, animationPeriodSeconds,
                                       zoomMagnitude, panMagnitudeX, panMagnitudeY, zoomStep, exportWidth,
                                       exportHeight, tileSize, workerThreads, oracleRefreshMillis);
    }
}
