package com.hellblazer.chaos.fractal.color;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Scale;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ColorMapperTest {

    @Property
    @Label("Interior values are black in every palette and in continuous-hue mode")
    void interiorIsBlack(@ForAll @IntRange(min = 1, max = 1000) int maxIteration,
                         @ForAll @IntRange(min = -10, max = 100) int paletteId,
                         @ForAll @DoubleRange(min = 0.0, max = 0.999) @Scale(3) double phase,
                         @ForAll long seed) {
        var random = new Random(seed);

        assertEquals(ColorMapper.BLACK,
                     ColorMapper.paletteColor(maxIteration, maxIteration, paletteId, PaletteParameters.random(random)));
        assertEquals(ColorMapper.BLACK, ColorMapper.psychedelicColor(maxIteration, maxIteration, phase,
                                                                    PsychedelicParameters.random(random)));
    }

    @Test
    void testPaletteZero() {
        // n = 3: r = 45, g = 3 * (5 + 3) = 24, b = 50 - 6 = 44
        int rgb = ColorMapper.paletteColor(3, 50, 0, PaletteParameters.DEFAULT);

        assertEquals(45, ColorMapper.red(rgb));
        assertEquals(24, ColorMapper.green(rgb));
        assertEquals(44, ColorMapper.blue(rgb));
    }

    @Test
    void testPaletteZeroSaturates() {
        int rgb = ColorMapper.paletteColor(40, 50, 0, PaletteParameters.DEFAULT);

        assertEquals(255, ColorMapper.red(rgb));
        assertEquals(0, ColorMapper.blue(rgb));
    }

    @Test
    void testPaletteOne() {
        int rgb = ColorMapper.paletteColor(4, 50, 1, PaletteParameters.DEFAULT);

        assertEquals(40, ColorMapper.red(rgb));
        assertEquals(20, ColorMapper.green(rgb));
        assertEquals(108, ColorMapper.blue(rgb));
    }

    @Test
    void testPaletteTwoWraps() {
        int rgb = ColorMapper.paletteColor(20, 50, 2, PaletteParameters.DEFAULT);

        assertEquals((300 + 60) % 256, ColorMapper.red(rgb));
        assertEquals((100 + 120) % 256, ColorMapper.green(rgb));
        assertEquals(40 % 100, ColorMapper.blue(rgb));
    }

    @Test
    void testPaletteThreeIsGreyscale() {
        int rgb = ColorMapper.paletteColor(25, 50, 3, PaletteParameters.DEFAULT);

        assertEquals(127, ColorMapper.red(rgb));
        assertEquals(127, ColorMapper.green(rgb));
        assertEquals(127, ColorMapper.blue(rgb));
    }

    @Test
    void testPaletteIdCycles() {
        for (int n = 0; n < 50; n++) {
            assertEquals(ColorMapper.paletteColor(n, 50, 1, PaletteParameters.DEFAULT),
                         ColorMapper.paletteColor(n, 50, 5, PaletteParameters.DEFAULT));
        }
    }

    @Test
    void testHsvPrimaries() {
        assertEquals(0xFF0000, ColorMapper.hsvToRgb(0.0, 1.0, 1.0));
        assertEquals(0x00FF00, ColorMapper.hsvToRgb(1.0 / 3.0, 1.0, 1.0));
        assertEquals(0x0000FF, ColorMapper.hsvToRgb(2.0 / 3.0, 1.0, 1.0));
        assertEquals(0xFFFFFF, ColorMapper.hsvToRgb(0.5, 0.0, 1.0));
    }

    @Test
    void testPackSaturates() {
        assertEquals(0xFF00FF, ColorMapper.pack(300, -4, 255));
    }

    @Test
    void testRandomParametersInRange() {
        var random = new Random(42);
        for (int i = 0; i < 100; i++) {
            var p = PaletteParameters.random(random);
            assertTrue(p.red() >= 5 && p.red() <= 20);
            assertTrue(p.green() >= 2 && p.green() <= 10);
            assertTrue(p.blue() >= 1 && p.blue() <= 5);
        }
    }
}
