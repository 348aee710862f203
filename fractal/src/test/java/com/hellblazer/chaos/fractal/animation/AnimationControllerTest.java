package com.hellblazer.chaos.fractal.animation;

import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.core.Viewport;
import com.hellblazer.chaos.fractal.core.ViewportMapper;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnimationControllerTest {

    private static final double   EPSILON = 1e-9;
    private static final Viewport BASE    = new Viewport(3.5, -0.5, 0.0);

    private Clock               clock;
    private AnimationController controller;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(1_000L);
        controller = new AnimationController(AnimationConfig.DEFAULT, clock, BASE);
    }

    @Test
    void testPhaseFromClock() {
        when(clock.millis()).thenReturn(1_000L + 3_750L);
        assertEquals(0.25, controller.tick(), EPSILON);

        when(clock.millis()).thenReturn(1_000L + 15_000L + 7_500L);
        assertEquals(0.5, controller.tick(), EPSILON);
    }

    @Test
    void testPausedPhaseHolds() {
        when(clock.millis()).thenReturn(1_000L + 3_000L);
        double phase = controller.tick();
        controller.setAnimating(false);

        when(clock.millis()).thenReturn(1_000L + 9_000L);
        assertEquals(phase, controller.tick());
        assertEquals(BASE, controller.displayedViewport(1.0));
    }

    @Test
    void testResetReturnsToPhaseZero() {
        when(clock.millis()).thenReturn(6_000L);
        controller.tick();
        controller.reset();

        assertEquals(0.0, controller.timePhase());
        assertEquals(0.0, controller.phaseAt(6_000L));
    }

    @Test
    void testOscillationAtQuarterPhase() {
        when(clock.millis()).thenReturn(1_000L + 3_750L);
        controller.tick();
        var shown = controller.displayedViewport(2.0);

        double span = 3.5 * 0.75;
        assertEquals(span, shown.reSpan(), EPSILON);
        assertEquals(-0.5, shown.reCenter(), EPSILON);
        assertEquals(0.04 * span / 2.0, shown.imCenter(), EPSILON);
        assertEquals(BASE, controller.base());
    }

    @Test
    void testOscillationAtPhaseZero() {
        var shown = AnimationController.oscillate(BASE, 0.0, 1.0, AnimationConfig.DEFAULT);

        assertEquals(3.5, shown.reSpan(), EPSILON);
        assertEquals(-0.5 + 0.04 * 3.5, shown.reCenter(), EPSILON);
        assertEquals(0.0, shown.imCenter(), EPSILON);
    }

    @Test
    void testPanWhilePausedUsesBaseSpan() {
        controller.setAnimating(false);

        assertTrue(controller.pan(100, 50, 200, 100));
        assertEquals(-0.5 - 1.75, controller.base().reCenter(), EPSILON);
        assertEquals(-0.875, controller.base().imCenter(), EPSILON);
        assertEquals(3.5, controller.base().reSpan());
    }

    @Test
    void testPanWhileAnimatingUsesDisplayedSpan() {
        when(clock.millis()).thenReturn(1_000L + 3_750L);

        assertTrue(controller.pan(100, 0, 200, 100));
        assertEquals(-0.5 - 0.5 * 3.5 * 0.75, controller.base().reCenter(), EPSILON);
    }

    @Test
    void testNoAreaIsIgnored() {
        assertFalse(controller.pan(10, 10, 0, 100));
        assertFalse(controller.zoom(1, 0, 0, 100, 0));
        assertEquals(BASE, controller.base());
    }

    @Property
    @Label("The anchor pixel maps to the same plane point before and after a zoom")
    void zoomKeepsAnchorFixed(@ForAll @IntRange(min = 1, max = 1000) int width,
                              @ForAll @IntRange(min = 1, max = 1000) int height,
                              @ForAll @DoubleRange(min = 0.0, max = 1.0) double ax,
                              @ForAll @DoubleRange(min = 0.0, max = 1.0) double ay,
                              @ForAll boolean zoomIn) {
        var fixedClock = Clock.fixed(Instant.ofEpochMilli(0L), ZoneOffset.UTC);
        var zoomer = new AnimationController(AnimationConfig.DEFAULT, fixedClock, BASE);
        double anchorX = ax * width;
        double anchorY = ay * height;
        var before = new ViewportMapper(zoomer.base(), width, height).map(anchorX, anchorY);

        assertTrue(zoomer.zoom(zoomIn ? 1 : -1, anchorX, anchorY, width, height));
        var after = new ViewportMapper(zoomer.base(), width, height).map(anchorX, anchorY);

        assertEquals(before.x, after.x, EPSILON);
        assertEquals(before.y, after.y, EPSILON);
        double expectedSpan = zoomIn ? 3.5 / 1.15 : 3.5 * 1.15;
        assertEquals(expectedSpan, zoomer.base().reSpan(), EPSILON);
    }

    @Test
    void testMorphOrbitsConstant() {
        var julia = new FractalFamily.Julia(-0.7, 0.27);

        var atZero = controller.morph(julia, 0.01);
        assertEquals(-0.69, atZero.cReal(), EPSILON);
        assertEquals(0.27, atZero.cImag(), EPSILON);

        when(clock.millis()).thenReturn(1_000L + 7_500L);
        controller.tick();
        var atHalf = controller.morph(julia, 0.01);
        assertEquals(-0.7, atHalf.cReal(), EPSILON);
        assertEquals(0.28, atHalf.cImag(), EPSILON);
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new AnimationConfig(0.0, 0.25, 0.04, 0.04, 1.15));
        assertThrows(IllegalArgumentException.class, () -> new AnimationConfig(15.0, 1.0, 0.04, 0.04, 1.15));
        assertThrows(IllegalArgumentException.class, () -> new AnimationConfig(15.0, 0.25, 0.04, 0.04, 1.0));
        assertEquals(15_000L, AnimationConfig.DEFAULT.periodMillis());
    }
}
