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
package com.hellblazer.chaos.fractal.effects;

import com.hellblazer.chaos.fractal.filter.EdgeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

/**
 * The set of enabled effects and their current parameters.
 * <p>
 * An effect's parameters are redrawn only on its off-to-on transition; setting an already enabled effect again keeps
 * its look. Psychedelic coloring and strobe are exclusive: enabling psychedelic switches strobe off, and strobe cannot
 * be enabled while psychedelic is on.
 * <p>
 * Not thread safe. Mutated from the interaction thread and snapshotted into a {@link FrameContext} for each render.
 *
 * @author hal.hildebrand
 */
public class EffectState {
    private static final Logger log = LoggerFactory.getLogger(EffectState.class);

    private final EnumSet<Effect> active = EnumSet.noneOf(Effect.class);
    private final Random          random;
    private       EffectParameters parameters;

    /**
     * @param random source for parameter regeneration, owned by the render session
     */
    public EffectState(Random random) {
        this(random, EffectParameters.DEFAULTS);
    }

    public EffectState(Random random, EffectParameters initial) {
        if (random == null || initial == null) {
            throw new IllegalArgumentException("Random source and parameters are required");
        }
        this.random = random;
        this.parameters = initial;
    }

    /**
     * Enable or disable an effect.
     *
     * @return true if the set of enabled effects changed
     */
    public boolean set(Effect effect, boolean enabled) {
        if (!enabled) {
            var removed = active.remove(effect);
            if (removed) {
                log.debug("Effect {} disabled", effect);
            }
            return removed;
        }
        if (active.contains(effect)) {
            return false;
        }
        if (effect == Effect.STROBE && active.contains(Effect.PSYCHEDELIC)) {
            log.debug("Strobe ignored while psychedelic coloring is enabled");
            return false;
        }
        parameters = parameters.randomized(effect, random);
        active.add(effect);
        if (effect == Effect.PSYCHEDELIC) {
            active.remove(Effect.STROBE);
        }
        log.debug("Effect {} enabled with {}", effect, parameters);
        return true;
    }

    /**
     * Flip an effect.
     *
     * @return the new enabled state
     */
    public boolean toggle(Effect effect) {
        set(effect, !active.contains(effect));
        return active.contains(effect);
    }

    public boolean isActive(Effect effect) {
        return active.contains(effect);
    }

    /**
     * Immutable snapshot of the enabled effects.
     */
    public Set<Effect> active() {
        return Collections.unmodifiableSet(EnumSet.copyOf(active));
    }

    public EffectParameters parameters() {
        return parameters;
    }

    /**
     * The convolution source implied by the neon and emboss toggles.
     */
    public EdgeMode edgeMode() {
        return EdgeMode.select(active.contains(Effect.NEON_EDGES), active.contains(Effect.EMBOSS));
    }

    /**
     * Whether a redraw should advance the palette counter.
     */
    public boolean strobeAdvancesPalette() {
        return active.contains(Effect.STROBE) && !active.contains(Effect.PSYCHEDELIC);
    }
}
