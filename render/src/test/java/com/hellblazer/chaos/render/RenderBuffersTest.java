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

import com.hellblazer.chaos.fractal.core.IterationGrid;
import com.hellblazer.chaos.fractal.core.PixelBuffer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RenderBuffersTest {

    @Test
    void testAllocatesOnFirstUse() {
        var buffers = new RenderBuffers();
        assertNull(buffers.current());

        var frame = buffers.resizeIfNeeded(40, 30);

        assertSame(frame, buffers.current());
        assertEquals(40, frame.width());
        assertEquals(30, frame.height());
        assertEquals(1200, frame.field().length);
        assertTrue(frame.pixels().hasDimensions(40, 30));
        assertEquals(1, buffers.reallocations());
    }

    @Test
    void testSameShapeReused() {
        var buffers = new RenderBuffers();
        var first = buffers.resizeIfNeeded(40, 30);

        assertSame(first, buffers.resizeIfNeeded(40, 30));
        assertEquals(1, buffers.reallocations());

        var resized = buffers.resizeIfNeeded(30, 40);
        assertNotSame(first, resized);
        assertEquals(30, resized.width());
        assertEquals(2, buffers.reallocations());
    }

    @Test
    void testFrameShapeMustAgree() {
        var grid = new IterationGrid(4, 4);
        assertThrows(IllegalArgumentException.class,
                     () -> new RenderBuffers.Frame(grid, new double[15], new PixelBuffer(4, 4)));
        assertThrows(IllegalArgumentException.class,
                     () -> new RenderBuffers.Frame(grid, new double[16], new PixelBuffer(4, 5)));
        assertThrows(IllegalArgumentException.class, () -> new RenderBuffers.Frame(grid, null, new PixelBuffer(4, 4)));
    }
}
