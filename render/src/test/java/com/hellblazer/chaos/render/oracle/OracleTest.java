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
package com.hellblazer.chaos.render.oracle;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class OracleTest {

    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    void testKnownValues() {
        assertEquals(1052618982L, Oracle.value(12345, 1_700_000_000_000L));
        assertEquals(579083939L, Oracle.value(0, 0));
        assertEquals(3020642994L, Oracle.value(65535, 1234));
    }

    @Test
    void testCurrentUsesClockAndSeed() {
        var oracle = new Oracle(FIXED, new Random(1));
        oracle.acceptSeed(12345);

        assertEquals(1052618982L, oracle.current());
        assertEquals(12345, oracle.seed());
        assertFalse(oracle.isUsingFallback());
    }

    @Test
    void testFallbackSeed() {
        var oracle = new Oracle(FIXED, new Random(7));
        long seed = oracle.seedUnavailable("connection refused");

        assertTrue(oracle.isUsingFallback());
        assertEquals(seed, oracle.seed());
        assertTrue(seed >= 0 && seed <= Oracle.MAX_FALLBACK_SEED);
        assertEquals(Oracle.value(seed, FIXED.millis()), oracle.current());

        oracle.acceptSeed(99);
        assertFalse(oracle.isUsingFallback());
    }

    @Property
    void valuesFitInThirtyTwoBits(@ForAll long seed, @ForAll long millis) {
        long value = Oracle.value(seed, millis);
        assertTrue(value >= 0 && value <= 0xFFFF_FFFFL);
    }

    @Test
    void testRequiresCollaborators() {
        assertThrows(IllegalArgumentException.class, () -> new Oracle(null, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new Oracle(FIXED, null));
    }
}
