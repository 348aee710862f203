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

import com.hellblazer.chaos.fractal.core.PixelBuffer;

/**
 * Display-stage RGB shift: three copies of a frame, offset by {@code -s} in x, {@code -s} in y and {@code +s} in x,
 * each added at half intensity onto black and saturated.
 */
public final class RgbShiftCompositor {

    private RgbShiftCompositor() {
    }

    /**
     * @param source frame to composite
     * @param shift  offset in pixels
     * @return a new buffer of the same size
     */
    public static PixelBuffer composite(PixelBuffer source, int shift) {
        int width = source.width();
        int height = source.height();
        var target = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r = 0.0;
                double g = 0.0;
                double b = 0.0;
                // copy drawn shifted left
                if (x + shift < width && x + shift >= 0) {
                    r += 0.5 * source.red(x + shift, y);
                    g += 0.5 * source.green(x + shift, y);
                    b += 0.5 * source.blue(x + shift, y);
                }
                // copy drawn shifted up
                if (y + shift < height && y + shift >= 0) {
                    r += 0.5 * source.red(x, y + shift);
                    g += 0.5 * source.green(x, y + shift);
                    b += 0.5 * source.blue(x, y + shift);
                }
                // copy drawn shifted right
                if (x - shift >= 0 && x - shift < width) {
                    r += 0.5 * source.red(x - shift, y);
                    g += 0.5 * source.green(x - shift, y);
                    b += 0.5 * source.blue(x - shift, y);
                }
                target.set(x, y, (int) r, (int) g, (int) b);
            }
        }
        return target;
    }
}
