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
package com.hellblazer.chaos.fractal.filter;

import com.hellblazer.chaos.fractal.core.IterationGrid;

/**
 * 3x3 convolutions of an {@link IterationGrid} treated as a scalar field.
 * <p>
 * Output is written to a separate row-major double field of the same size. Interior cells are independent, so rows
 * may be processed in parallel. The one-pixel border has no full neighbourhood and receives the input value
 * unchanged.
 *
 * @author hal.hildebrand
 */
public final class ConvolutionFilter {

    private ConvolutionFilter() {
    }

    /**
     * Apply the transform selected by {@code mode}; {@link EdgeMode#NONE} copies the counts.
     *
     * @param mode   transform to apply
     * @param input  iteration counts
     * @param output target field, {@code width * height} long
     * @return {@code output}
     */
    public static double[] apply(EdgeMode mode, IterationGrid input, double[] output) {
        checkSize(input, output);
        switch (mode) {
            case SOBEL -> sobel(input, output, 0, input.height());
            case EMBOSS -> emboss(input, output, 0, input.height());
            case NONE -> input.toScalarField(output);
        }
        return output;
    }

    /**
     * Sobel gradient magnitude {@code sqrt(gx^2 + gy^2)} for rows {@code [rowStart, rowEnd)}.
     */
    public static void sobel(IterationGrid input, double[] output, int rowStart, int rowEnd) {
        checkSize(input, output);
        int w = input.width();
        int h = input.height();
        int[] v = input.rawCounts();
        for (int y = Math.max(0, rowStart); y < Math.min(h, rowEnd); y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (isBorder(x, y, w, h)) {
                    output[i] = v[i];
                    continue;
                }
                int up = i - w;
                int down = i + w;
                double gx = (v[up + 1] + 2.0 * v[i + 1] + v[down + 1]) - (v[up - 1] + 2.0 * v[i - 1] + v[down - 1]);
                double gy = (v[up - 1] + 2.0 * v[up] + v[up + 1]) - (v[down - 1] + 2.0 * v[down] + v[down + 1]);
                output[i] = Math.sqrt(gx * gx + gy * gy);
            }
        }
    }

    /**
     * Emboss with kernel {@code [[-2,-1,0],[-1,1,1],[0,1,2]]} for rows {@code [rowStart, rowEnd)}.
     */
    public static void emboss(IterationGrid input, double[] output, int rowStart, int rowEnd) {
        checkSize(input, output);
        int w = input.width();
        int h = input.height();
        int[] v = input.rawCounts();
        for (int y = Math.max(0, rowStart); y < Math.min(h, rowEnd); y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (isBorder(x, y, w, h)) {
                    output[i] = v[i];
                    continue;
                }
                int up = i - w;
                int down = i + w;
                output[i] = -2.0 * v[up - 1] - v[up]
                            - v[i - 1] + v[i] + v[i + 1]
                            + v[down] + 2.0 * v[down + 1];
            }
        }
    }

    private static boolean isBorder(int x, int y, int w, int h) {
        return x == 0 || y == 0 || x == w - 1 || y == h - 1;
    }

    private static void checkSize(IterationGrid input, double[] output) {
        if (output.length != input.width() * input.height()) {
            throw new IllegalArgumentException(
            "Output field length " + output.length + " does not match " + input.width() + "x" + input.height());
        }
    }
}
