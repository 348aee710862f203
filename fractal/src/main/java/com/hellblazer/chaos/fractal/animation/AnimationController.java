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

import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.core.Viewport;
import com.hellblazer.chaos.fractal.core.ViewportMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Drives the viewport over time and absorbs interactive pan and zoom.
 * <p>
 * The controller holds the persisted <em>base</em> viewport. While animating, each tick derives the time phase
 * {@code ((now - start) mod period) / period} and the <em>displayed</em> viewport
 * <pre>
 * span   = base.span * (1 - zoom * sin(2 pi phase))
 * re     = base.re + panX * span * cos(2 pi phase)
 * im     = base.im + panY * (span / aspect) * sin(2 pi phase)
 * </pre>
 * The displayed viewport is never written back to the base. Pan and zoom always mutate the base.
 * <p>
 * Single threaded: called from the interaction tick only.
 *
 * @author hal.hildebrand
 */
public class AnimationController {
    private static final Logger log = LoggerFactory.getLogger(AnimationController.class);

    private static final double TWO_PI = 2.0 * Math.PI;

    private final AnimationConfig config;
    private final Clock           clock;

    private Viewport base;
    private boolean  animating = true;
    private long     startMillis;
    private double   timePhase;

    public AnimationController(AnimationConfig config, Clock clock, Viewport base) {
        if (config == null || clock == null || base == null) {
            throw new IllegalArgumentException("Config, clock and base viewport are required");
        }
        this.config = config;
        this.clock = clock;
        this.base = base;
        this.startMillis = clock.millis();
    }

    /**
     * Displayed viewport for a given phase.
     */
    public static Viewport oscillate(Viewport base, double timePhase, double aspectRatio, AnimationConfig config) {
        double sinWave = Math.sin(TWO_PI * timePhase);
        double span = base.reSpan() * (1.0 - config.zoomMagnitude() * sinWave);
        double reOffset = config.panMagnitudeX() * span * Math.cos(TWO_PI * timePhase);
        double imOffset = config.panMagnitudeY() * (span / aspectRatio) * sinWave;
        return new Viewport(span, base.reCenter() + reOffset, base.imCenter() + imOffset);
    }

    /**
     * Restart the animation clock at phase zero.
     */
    public void reset() {
        startMillis = clock.millis();
        timePhase = 0.0;
        log.debug("Animation clock reset");
    }

    /**
     * Advance the phase from the clock. Does nothing when not animating.
     *
     * @return the current phase
     */
    public double tick() {
        if (animating) {
            timePhase = phaseAt(clock.millis());
        }
        return timePhase;
    }

    /**
     * Phase at a wall-clock instant, in [0, 1).
     */
    public double phaseAt(long nowMillis) {
        long period = config.periodMillis();
        long elapsed = Math.floorMod(nowMillis - startMillis, period);
        return (double) elapsed / period;
    }

    /**
     * The viewport to render this frame: the oscillated base while animating, the base otherwise.
     */
    public Viewport displayedViewport(double aspectRatio) {
        return animating ? oscillate(base, timePhase, aspectRatio, config) : base;
    }

    /**
     * The Julia constant perturbed along a circle of {@code radius}, half a turn per period.
     */
    public FractalFamily.Julia morph(FractalFamily.Julia julia, double radius) {
        double angle = timePhase * TWO_PI * 0.5;
        return julia.withConstant(julia.cReal() + radius * Math.cos(angle), julia.cImag() + radius * Math.sin(angle));
    }

    /**
     * Drag the view. The pixel delta is converted with the span currently on screen and subtracted from the base
     * center.
     *
     * @param dx     horizontal drag in display pixels
     * @param dy     vertical drag in display pixels
     * @param width  display width
     * @param height display height
     * @return false when the display has no area
     */
    public boolean pan(double dx, double dy, int width, int height) {
        if (width <= 0 || height <= 0) {
            return false;
        }
        double span;
        if (animating) {
            double phase = phaseAt(clock.millis());
            span = base.reSpan() * (1.0 - config.zoomMagnitude() * Math.sin(TWO_PI * phase));
        } else {
            span = base.reSpan();
        }
        double imSpan = span / ViewportMapper.aspectRatio(width, height);
        base = base.withCenter(base.reCenter() - (dx / width) * span, base.imCenter() - (dy / height) * imSpan);
        return true;
    }

    /**
     * Zoom about an anchor pixel, keeping the anchor's plane coordinate fixed.
     *
     * @param direction positive zooms in, otherwise out
     * @param anchorX   anchor column in display pixels
     * @param anchorY   anchor row in display pixels
     * @param width     display width
     * @param height    display height
     * @return false when the display has no area
     */
    public boolean zoom(int direction, double anchorX, double anchorY, int width, int height) {
        if (width <= 0 || height <= 0) {
            return false;
        }
        double factor = direction > 0 ? config.zoomStep() : 1.0 / config.zoomStep();
        var anchor = new ViewportMapper(base, width, height).map(anchorX, anchorY);
        double reCenter = anchor.x + (base.reCenter() - anchor.x) / factor;
        double imCenter = anchor.y + (base.imCenter() - anchor.y) / factor;
        base = new Viewport(base.reSpan() / factor, reCenter, imCenter);
        return true;
    }

    public Viewport base() {
        return base;
    }

    public void setBase(Viewport base) {
        if (base == null) {
            throw new IllegalArgumentException("Base viewport is required");
        }
        this.base = base;
    }

    public boolean isAnimating() {
        return animating;
    }

    public void setAnimating(boolean animating) {
        this.animating = animating;
        log.debug("Fractal animation {}", animating ? "enabled" : "disabled");
    }

    public double timePhase() {
        return timePhase;
    }

    public AnimationConfig config() {
        return config;
    }
}
