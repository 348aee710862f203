package com.hellblazer.chaos.fractal.effects;

import com.hellblazer.chaos.fractal.filter.EdgeMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EffectStateTest {

    private EffectState state;

    @BeforeEach
    void setUp() {
        state = new EffectState(new Random(7));
    }

    @Test
    void testParametersRedrawnOnlyWhenEnabled() {
        assertTrue(state.set(Effect.WARP_BANDS, true));
        var drawn = state.parameters();
        assertNotEquals(EffectParameters.DEFAULTS.warpFrequency(), drawn.warpFrequency());

        assertFalse(state.set(Effect.WARP_BANDS, true));
        assertSame(drawn, state.parameters());

        assertTrue(state.set(Effect.WARP_BANDS, false));
        assertSame(drawn, state.parameters());
        assertFalse(state.set(Effect.WARP_BANDS, false));
    }

    @Test
    void testRandomizedRangesRespected() {
        for (var effect : Effect.values()) {
            state.set(effect, true);
            state.set(effect, false);
        }
        var p = state.parameters();
        assertTrue(p.warpFrequency() >= 15 && p.warpFrequency() <= 60);
        assertTrue(p.warpAmplitude() >= 5 && p.warpAmplitude() <= 15);
        assertTrue(p.tunnelPower() >= 1.5 && p.tunnelPower() <= 3.5);
        assertTrue(p.glitchChance() >= 0.0005 && p.glitchChance() <= 0.0025);
        assertTrue(p.crushLevels() >= 3 && p.crushLevels() <= 8);
        assertTrue(p.rgbShift() >= 1 && p.rgbShift() <= 4);
        assertTrue(p.morphRadius() >= 0.002 && p.morphRadius() <= 0.01);
        assertTrue(p.scanSpacing() >= 3 && p.scanSpacing() <= 6);
        assertTrue(p.scanDarkness() >= 0.5 && p.scanDarkness() <= 0.8);
    }

    @Test
    void testPsychedelicDisablesStrobe() {
        assertTrue(state.set(Effect.STROBE, true));
        assertTrue(state.strobeAdvancesPalette());

        assertTrue(state.set(Effect.PSYCHEDELIC, true));
        assertFalse(state.isActive(Effect.STROBE));
        assertFalse(state.strobeAdvancesPalette());
    }

    @Test
    void testStrobeRefusedWhilePsychedelic() {
        state.set(Effect.PSYCHEDELIC, true);

        assertFalse(state.set(Effect.STROBE, true));
        assertFalse(state.toggle(Effect.STROBE));
        assertEquals(EnumSet.of(Effect.PSYCHEDELIC), state.active());
    }

    @Test
    void testToggle() {
        assertTrue(state.toggle(Effect.SCAN_LINES));
        assertTrue(state.isActive(Effect.SCAN_LINES));
        assertFalse(state.toggle(Effect.SCAN_LINES));
        assertTrue(state.active().isEmpty());
    }

    @Test
    void testEdgeModeFromToggles() {
        assertEquals(EdgeMode.NONE, state.edgeMode());
        state.set(Effect.EMBOSS, true);
        assertEquals(EdgeMode.EMBOSS, state.edgeMode());
        state.set(Effect.NEON_EDGES, true);
        assertEquals(EdgeMode.SOBEL, state.edgeMode());
    }

    @Test
    void testActiveSnapshotIsDetached() {
        state.set(Effect.RGB_SHIFT, true);
        var snapshot = state.active();
        state.set(Effect.RGB_SHIFT, false);

        assertTrue(snapshot.contains(Effect.RGB_SHIFT));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Effect.STROBE));
    }

    @Test
    void testEffectNames() {
        assertEquals(Effect.PSYCHEDELIC, Effect.fromString("colors"));
        assertEquals(Effect.NEON_EDGES, Effect.fromString("NEON_EDGES"));
        assertThrows(IllegalArgumentException.class, () -> Effect.fromString("sepia"));
    }
}
