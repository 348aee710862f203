package com.hellblazer.chaos.fractal.effects;

import com.hellblazer.chaos.fractal.color.ColorMapper;
import com.hellblazer.chaos.fractal.color.PaletteParameters;
import com.hellblazer.chaos.fractal.color.PsychedelicParameters;
import com.hellblazer.chaos.fractal.core.PixelBuffer;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EffectsPipelineTest {

    private static final int MAX = 50;

    private static double[] ramp(int width, int height) {
        var field = new double[width * height];
        for (int i = 0; i < field.length; i++) {
            field[i] = i % (MAX + 1);
        }
        return field;
    }

    private static FrameContext frame(Set<Effect> effects, EffectParameters params, long seed) {
        return new FrameContext(effects, params, 0.3, 0, MAX, new Random(seed));
    }

    @Property
    @Label("Crushing a crushed channel changes nothing when the levels divide 256")
    void crushIsIdempotent(@ForAll @IntRange(min = 0, max = 255) int channel,
                           @ForAll @IntRange(min = 0, max = 8) int exponent) {
        int levels = 1 << exponent;
        int once = EffectsPipeline.crush(channel, levels);

        assertEquals(once, EffectsPipeline.crush(once, levels));
        assertTrue(once >= 0 && once <= 255);
    }

    @Test
    void testCrushBoundaries() {
        assertEquals(0, EffectsPipeline.crush(0, 4));
        assertEquals(0, EffectsPipeline.crush(63, 4));
        assertEquals(64, EffectsPipeline.crush(64, 4));
        assertEquals(192, EffectsPipeline.crush(255, 4));
        assertEquals(0, EffectsPipeline.crush(255, 1));
        assertEquals(224, EffectsPipeline.crush(255, 8));
    }

    @Test
    void testCrushTruncatesForUnevenLevels() {
        // 255 / 85.33 lands in bucket 2, whose edge 170.67 truncates to 170
        assertEquals(170, EffectsPipeline.crush(255, 3));
        // 170 sits just below that edge, so a second pass drops a bucket
        assertEquals(85, EffectsPipeline.crush(170, 3));
        assertEquals(85, EffectsPipeline.crush(86, 3));
        assertEquals(51, EffectsPipeline.crush(52, 5));
        assertEquals(42, EffectsPipeline.crush(43, 6));
        assertEquals(36, EffectsPipeline.crush(37, 7));
        assertEquals(204, EffectsPipeline.crush(255, 5));
        assertEquals(213, EffectsPipeline.crush(255, 6));
        assertEquals(219, EffectsPipeline.crush(255, 7));
    }

    @Test
    void testPlainFrameMatchesPaletteMapping() {
        var field = ramp(8, 6);
        var target = new PixelBuffer(8, 6);
        EffectsPipeline.colorize(field, 8, 6, target, FrameContext.plain(EffectParameters.DEFAULTS, 2, MAX,
                                                                         new Random(1)));

        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 8; x++) {
                assertEquals(ColorMapper.paletteColor(field[y * 8 + x], MAX, 2, PaletteParameters.DEFAULT),
                             target.packed(x, y));
            }
        }
    }

    @Test
    void testPsychedelicReplacesPalette() {
        var field = ramp(5, 5);
        var target = new PixelBuffer(5, 5);
        EffectsPipeline.colorize(field, 5, 5, target,
                                 frame(EnumSet.of(Effect.PSYCHEDELIC), EffectParameters.DEFAULTS, 1));

        assertEquals(ColorMapper.psychedelicColor(field[7], MAX, 0.3, PsychedelicParameters.DEFAULT),
                     target.packed(2, 1));
    }

    @Test
    void testCrushThenScanLines() {
        var field = ramp(6, 6);
        var target = new PixelBuffer(6, 6);
        var params = EffectParameters.DEFAULTS;
        EffectsPipeline.colorize(field, 6, 6, target,
                                 frame(EnumSet.of(Effect.COLOR_CRUSH, Effect.SCAN_LINES), params, 1));

        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 6; x++) {
                int rgb = ColorMapper.paletteColor(field[y * 6 + x], MAX, 0, params.palette());
                int r = EffectsPipeline.crush(ColorMapper.red(rgb), params.crushLevels());
                if (y % params.scanSpacing() == 0) {
                    r = (int) (r * params.scanDarkness());
                }
                assertEquals(r, target.red(x, y), "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void testTunnelDarkensCornersBeforeCrush() {
        var field = new double[9 * 9];
        java.util.Arrays.fill(field, 3.0);
        var target = new PixelBuffer(9, 9);
        EffectsPipeline.colorize(field, 9, 9, target,
                                 frame(EnumSet.of(Effect.TUNNEL_VIGNETTE), EffectParameters.DEFAULTS, 1));

        assertEquals(0, target.red(0, 0) + target.green(0, 0) + target.blue(0, 0));
        assertTrue(target.red(4, 4) > 0);
        assertEquals(0.0, EffectsPipeline.tunnelBrightness(0, 0, 9, 9, 2.0), 1e-12);
        assertEquals(1.0, EffectsPipeline.tunnelBrightness(5, 5, 10, 10, 2.0), 1e-12);
    }

    @Test
    void testGlitchReplacesValuesFromFrameRandom() {
        var params = new EffectParameters(PsychedelicParameters.DEFAULT, 30.0, 10.0, 2.0, 1.0, 4, 2, 0.005,
                                          PaletteParameters.DEFAULT, 4, 0.7);
        var field = ramp(4, 3);
        var target = new PixelBuffer(4, 3);
        EffectsPipeline.colorize(field, 4, 3, target, frame(EnumSet.of(Effect.PIXEL_GLITCH), params, 99));

        var replay = new Random(99);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 4; x++) {
                assertTrue(replay.nextDouble() < 1.0);
                int n = replay.nextInt(MAX + 1);
                assertEquals(ColorMapper.paletteColor(n, MAX, 0, PaletteParameters.DEFAULT), target.packed(x, y));
            }
        }
    }

    @Test
    void testWarpLeavesInteriorAlone() {
        assertEquals(MAX, EffectsPipeline.warp(MAX, 17, MAX, 0.4, 30.0, 10.0));
        // sin(0) = 0
        assertEquals(12.0, EffectsPipeline.warp(12.0, 0, MAX, 0.0, 30.0, 10.0));
        // sin(pi / 2) * 10 = 10
        assertEquals(22.0, EffectsPipeline.warp(12.0, 0, MAX, 0.125, 30.0, 10.0), 1e-9);
        assertEquals(0.0, EffectsPipeline.warp(2.0, 0, MAX, 0.375, 30.0, 10.0));
    }

    @Test
    void testDimensionMismatchRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> EffectsPipeline.colorize(new double[10], 4, 3, new PixelBuffer(4, 3),
                                                    FrameContext.plain(EffectParameters.DEFAULTS, 0, MAX,
                                                                       new Random())));
        assertThrows(IllegalArgumentException.class,
                     () -> EffectsPipeline.colorize(new double[12], 4, 3, new PixelBuffer(3, 4),
                                                    FrameContext.plain(EffectParameters.DEFAULTS, 0, MAX,
                                                                       new Random())));
    }
}
