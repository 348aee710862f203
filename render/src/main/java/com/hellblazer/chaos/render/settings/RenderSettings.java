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
package com.hellblazer.chaos.render.settings;

import com.hellblazer.chaos.render.config.EngineConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The two user-editable performance settings: render scale and base iteration budget.
 * <p>
 * Entered text is parsed, clamped to its range and applied. Text that does not parse is rejected and the field reverts
 * to the last valid value.
 *
 * @author hal.hildebrand
 */
public class RenderSettings {
    private static final Logger log = LoggerFactory.getLogger(RenderSettings.class);

    private static final double SCALE_TOLERANCE = 1e-5;

    /**
     * Result of applying the two fields.
     *
     * @param scaleChanged      the render scale took a new value
     * @param iterationsChanged the base iteration budget took a new value
     * @param scaleText         text the scale field should now show
     * @param iterationText     text the iteration field should now show
     */
    public record Outcome(boolean scaleChanged, boolean iterationsChanged, String scaleText, String iterationText) {

        public boolean changed() {
            return scaleChanged || iterationsChanged;
        }
    }

    private double renderScale;
    private int    baseMaxIteration;

    public RenderSettings(double renderScale, int baseMaxIteration) {
        this.renderScale = clampScale(renderScale);
        this.baseMaxIteration = clampIterations(baseMaxIteration);
    }

    public static RenderSettings from(EngineConfiguration config) {
        return new RenderSettings(config.renderScale(), config.baseMaxIteration());
    }

    /**
     * Apply entered text for both fields. Each field is handled independently.
     */
    public Outcome apply(String scaleText, String iterationText) {
        boolean scaleChanged = false;
        boolean iterationsChanged = false;

        try {
            double scale = clampScale(Double.parseDouble(scaleText.trim()));
            if (Double.isNaN(scale)) {
                throw new NumberFormatException("NaN");
            }
            if (Math.abs(renderScale - scale) > SCALE_TOLERANCE) {
                renderScale = scale;
                scaleChanged = true;
            }
        } catch (NumberFormatException | NullPointerException e) {
            log.warn("Invalid render scale '{}', keeping {}", scaleText, renderScale);
        }

        try {
            int iterations = clampIterations(Integer.parseInt(iterationText.trim()));
            if (iterations != baseMaxIteration) {
                baseMaxIteration = iterations;
                iterationsChanged = true;
            }
        } catch (NumberFormatException | NullPointerException e) {
            log.warn("Invalid base max iterations '{}', keeping {}", iterationText, baseMaxIteration);
        }

        return new Outcome(scaleChanged, iterationsChanged, String.valueOf(renderScale),
                           String.valueOf(baseMaxIteration));
    }

    public double renderScale() {
        return renderScale;
    }

    public int baseMaxIteration() {
        return baseMaxIteration;
    }

    static double clampScale(double scale) {
        return Math.max(EngineConfiguration.MIN_RENDER_SCALE, Math.min(EngineConfiguration.MAX_RENDER_SCALE, scale));
    }

    static int clampIterations(int iterations) {
        return Math.max(EngineConfiguration.MIN_BASE_ITERATIONS,
                        Math.min(EngineConfiguration.MAX_BASE_ITERATIONS, iterations));
    }
}
