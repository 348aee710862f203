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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves rendered frames to PNG files.
 */
public class FrameSaver {

    private static final Logger log = LoggerFactory.getLogger(FrameSaver.class);

    private final Path outputDir;

    /**
     * Create a frame saver that outputs to the specified directory.
     *
     * @param outputDir Directory to save frames (created if not exists)
     */
    public FrameSaver(Path outputDir) throws IOException {
        this.outputDir = outputDir;
        Files.createDirectories(outputDir);
        log.info("Frame saver initialized: {}", outputDir);
    }

    /**
     * Save a frame as {@code frame_NNNN.png}.
     *
     * @param pixels   Frame pixels
     * @param frameNum Frame number (for filename)
     * @return the written file
     */
    public Path save(PixelBuffer pixels, int frameNum) throws IOException {
        var filepath = outputDir.resolve(String.format("frame_%04d.png", frameNum));
        write(pixels, filepath);
        if (frameNum % 60 == 0) {
            log.debug("Saved {}", filepath.getFileName());
        }
        return filepath;
    }

    /**
     * Write a single PNG.
     */
    public static void write(PixelBuffer pixels, Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(toImage(pixels), "png", file.toFile())) {
            throw new IOException("No PNG writer available for " + file);
        }
    }

    /**
     * RGB image of a pixel buffer; both are top-down.
     */
    public static BufferedImage toImage(PixelBuffer pixels) {
        var image = new BufferedImage(pixels.width(), pixels.height(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < pixels.height(); y++) {
            for (int x = 0; x < pixels.width(); x++) {
                image.setRGB(x, y, pixels.packed(x, y));
            }
        }
        return image;
    }
}
