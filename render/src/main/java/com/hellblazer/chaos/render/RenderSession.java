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

import com.hellblazer.chaos.fractal.effects.EffectState;
import com.hellblazer.chaos.fractal.effects.FrameContext;

import java.util.Random;

/**
 * Per-session mutable coloring state: the enabled effects with their parameters, the palette counter and the session
 * random source. Everything that varies between frames is captured into a {@link FrameContext} before colorization.
 * <p>
 * Pass an explicitly seeded {@link Random} for reproducible sessions.
 */
public class RenderSession {

    private final Random      random;
    private final EffectState effects;
    private       int         paletteId;

    public RenderSession(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random source is required");
        }
        this.random = random;
        this.effects = new EffectState(random);
    }

    public EffectState effects() {
        return effects;
    }

    public int paletteId() {
        return paletteId;
    }

    /**
     * Advance the palette counter when strobe is on and psychedelic coloring is off.
     *
     * @return true if the counter moved
     */
    public boolean strobe() {
        if (!effects.strobeAdvancesPalette()) {
            return false;
        }
        paletteId++;
        return true;
    }

    public Random random() {
        return random;
    }

    /**
     * Capture the coloring state of one frame.
     */
    public FrameContext frame(double timePhase, int maxIteration) {
        return new FrameContext(effects.active(), effects.parameters(), timePhase, paletteId, maxIteration, random);
    }
}
