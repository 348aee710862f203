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
package com.hellblazer.chaos.fractal.core;

/**
 * Row-major {@code height x width x 3} RGB byte buffer produced by colorization.
 *
 * @author hal.hildebrand
 */
public final class PixelBuffer {

    public static final int CHANNELS = 3;

    private final int    width;
    private final int    height;
    private final byte[] rgb;

    public PixelBuffer(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.rgb = new byte[width * height * CHANNELS];
    }

    /**
     * Store a pixel; channels are saturated to {@code [0, 255]}.
     */
    public void set(int x, int y, int r, int g, int b) {
        int i = (y * width + x) * CHANNELS;
        rgb[i] = (byte) clamp(r);
        rgb[i + 1] = (byte) clamp(g);
        rgb[i + 2] = (byte) clamp(b);
    }

    public int red(int x, int y) {
        return rgb[(y * width + x) * CHANNELS] & 0xFF;
    }

    public int green(int x, int y) {
        return rgb[(y * width + x) * CHANNELS + 1] & 0xFF;
    }

    public int blue(int x, int y) {
        return rgb[(y * width + x) * CHANNELS + 2] & 0xFF;
    }

    /**
     * Packed {@code 0xRRGGBB} value of a pixel.
     */
    public int packed(int x, int y) {
        return red(x, y) << 16 | green(x, y) << 8 | blue(x, y);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean hasDimensions(int w, int h) {
        return width == w && height == h;
    }

    /**
     * The raw RGB bytes, row-major. Shared, not copied.
     */
    public byte[] bytes() {
        return rgb;
    }

    public PixelBuffer copy() {
        var copy = new PixelBuffer(width, height);
        System.arraycopy(rgb, 0, copy.rgb, 0, rgb.length);
        return copy;
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }
}
