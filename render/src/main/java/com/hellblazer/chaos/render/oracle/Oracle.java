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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Random;

/**
 * A number that changes every refresh: the first eight hex digits of {@code sha256("{seed}-{epochMillis}")} read as
 * an unsigned integer.
 * <p>
 * The seed comes from an external source. When that source reports a failure a pseudo-random seed in
 * {@code [0, 65535]} is used instead.
 *
 * @author hal.hildebrand
 */
public class Oracle {
    private static final Logger log = LoggerFactory.getLogger(Oracle.class);

    public static final int MAX_FALLBACK_SEED = 65535;

    private final Clock  clock;
    private final Random fallback;

    private volatile long    seed;
    private volatile boolean usingFallback;

    public Oracle(Clock clock, Random fallback) {
        if (clock == null || fallback == null) {
            throw new IllegalArgumentException("Clock and fallback random source are required");
        }
        this.clock = clock;
        this.fallback = fallback;
    }

    /**
     * Oracle value of a seed at an instant.
     */
    public static long value(long seed, long epochMillis) {
        try {
            var sha = MessageDigest.getInstance("SHA-256");
            var digest = sha.digest((seed + "-" + epochMillis).getBytes(StandardCharsets.UTF_8));
            return Long.parseLong(HexFormat.of().formatHex(digest, 0, 4), 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Accept a seed from the external source.
     */
    public void acceptSeed(long newSeed) {
        seed = newSeed;
        usingFallback = false;
        log.info("New oracle seed acquired: {}", newSeed);
    }

    /**
     * The external source failed; switch to a pseudo-random seed.
     *
     * @return the fallback seed
     */
    public long seedUnavailable(String reason) {
        long newSeed = fallback.nextInt(MAX_FALLBACK_SEED + 1);
        seed = newSeed;
        usingFallback = true;
        log.warn("Oracle seed unavailable: {}. Using pseudo-random fallback seed: {}", reason, newSeed);
        return newSeed;
    }

    /**
     * The oracle value now.
     */
    public long current() {
        return value(seed, clock.millis());
    }

    public long seed() {
        return seed;
    }

    public boolean isUsingFallback() {
        return usingFallback;
    }
}
