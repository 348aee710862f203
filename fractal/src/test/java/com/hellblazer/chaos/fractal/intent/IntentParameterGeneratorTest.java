package com.hellblazer.chaos.fractal.intent;

import com.hellblazer.chaos.fractal.core.FractalFamily;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntentParameterGeneratorTest {

    private static final double TOLERANCE = 1e-12;
    private static final double ASPECT    = 1.333;

    private final IntentParameterGenerator generator = new IntentParameterGenerator(45);

    @Test
    void testMandelbrotDefault() {
        var params = generator.generate("Mandelbrot Default", ASPECT, FractalFamily.MANDELBROT);

        assertEquals(2.8435003585870144, params.viewport().reSpan(), TOLERANCE);
        assertEquals(-0.7793331565945335, params.viewport().reCenter(), TOLERANCE);
        assertEquals(0.029788053023337122, params.viewport().imCenter(), TOLERANCE);
        assertEquals(47, params.maxIteration());
        assertSame(FractalFamily.MANDELBROT, params.family());
    }

    @Test
    void testEmptyAndPlaceholderUseFamilyDefault() {
        var expected = generator.generate("Mandelbrot Default", ASPECT, FractalFamily.MANDELBROT);

        assertEquals(expected, generator.generate("", ASPECT, FractalFamily.MANDELBROT));
        assertEquals(expected, generator.generate(null, ASPECT, FractalFamily.MANDELBROT));
        assertEquals(expected,
                     generator.generate(IntentParameterGenerator.PLACEHOLDER_INTENT, ASPECT, FractalFamily.MANDELBROT));
        assertEquals("Burning Ship Default", IntentParameterGenerator.effectiveIntent("", FractalFamily.BURNING_SHIP));
        assertEquals("spiral", IntentParameterGenerator.effectiveIntent("spiral", FractalFamily.BURNING_SHIP));
    }

    @Test
    void testJuliaDefault() {
        var params = generator.generate("", ASPECT, new FractalFamily.Julia(0.3, 0.3));

        assertEquals(3.0, params.viewport().reSpan());
        assertEquals(-0.05353856717784391, params.viewport().reCenter(), TOLERANCE);
        assertEquals(0.02775985825250085, params.viewport().imCenter(), TOLERANCE);
        assertEquals(103, params.maxIteration());
        var julia = assertInstanceOf(FractalFamily.Julia.class, params.family());
        assertEquals(-1.0617303730830854, julia.cReal(), TOLERANCE);
        assertEquals(1.1406958113984893, julia.cImag(), TOLERANCE);
    }

    @Test
    void testBurningShipDefault() {
        var params = generator.generate("", ASPECT, FractalFamily.BURNING_SHIP);

        assertEquals(2.8, params.viewport().reSpan());
        assertEquals(-0.29855252918287933, params.viewport().reCenter(), TOLERANCE);
        assertEquals(-0.4659079338385752, params.viewport().imCenter(), TOLERANCE);
        assertEquals(61, params.maxIteration());
    }

    @Test
    void testHelloJulia() {
        var params = generator.generate("hello", 1.0, new FractalFamily.Julia(0.0, 0.0));

        assertEquals(-0.17673838406958117, params.viewport().reCenter(), TOLERANCE);
        assertEquals(-0.113593499656672, params.viewport().imCenter(), TOLERANCE);
        assertEquals(54, params.maxIteration());
        var julia = (FractalFamily.Julia) params.family();
        assertEquals(-0.806660563057908, julia.cReal(), TOLERANCE);
        assertEquals(0.8170977340352485, julia.cImag(), TOLERANCE);
    }

    @Test
    void testDigestIsLowercaseHex() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                     IntentParameterGenerator.digest("hello"));
    }

    @Test
    void testRejectsNonPositiveBase() {
        assertThrows(IllegalArgumentException.class, () -> new IntentParameterGenerator(0));
    }

    @Property
    @Label("Same intent, aspect and family produce identical parameters")
    void generationIsDeterministic(@ForAll @StringLength(max = 64) String intent,
                                   @ForAll @DoubleRange(min = 0.1, max = 4.0) double aspect,
                                   @ForAll("families") FractalFamily family) {
        var first = generator.generate(intent, aspect, family);
        var second = new IntentParameterGenerator(45).generate(intent, aspect, family);

        assertEquals(first, second);
        assertEquals(family.displayName(), first.family().displayName());
    }

    @Provide
    Arbitrary<FractalFamily> families() {
        return Arbitraries.of(FractalFamily.MANDELBROT, new FractalFamily.Julia(0.0, 0.0),
                              new FractalFamily.Julia(-0.7, 0.27), FractalFamily.BURNING_SHIP);
    }

    @Property
    @Label("Derived parameters stay inside their documented ranges")
    void derivedParametersAreBounded(@ForAll @StringLength(min = 1, max = 64) String intent) {
        var params = generator.generate(intent, ASPECT, new FractalFamily.Julia(0.0, 0.0));
        var mandelbrot = generator.generate(intent, ASPECT, FractalFamily.MANDELBROT);

        assertTrue(mandelbrot.viewport().reSpan() >= IntentParameterGenerator.MIN_SPAN);
        assertTrue(mandelbrot.viewport().reSpan() <= IntentParameterGenerator.MAX_SPAN);
        assertTrue(Math.abs(mandelbrot.viewport().reCenter() + 0.75) <= 0.15 * mandelbrot.viewport().reSpan() + 1e-12);
        assertTrue(params.maxIteration() >= 45 && params.maxIteration() <= 112);
        var julia = (FractalFamily.Julia) params.family();
        assertTrue(Math.abs(julia.cReal()) <= 1.5);
        assertTrue(Math.abs(julia.cImag()) <= 1.5);
    }
}
