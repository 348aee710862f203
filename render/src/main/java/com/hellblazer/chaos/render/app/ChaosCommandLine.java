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
package com.hellblazer.chaos.render.app;

import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.effects.Effect;
import com.hellblazer.chaos.render.ChaosEngine;
import com.hellblazer.chaos.render.FractalRenderingPipeline;
import com.hellblazer.chaos.render.FrameSaver;
import com.hellblazer.chaos.render.config.EngineConfiguration;
import com.hellblazer.chaos.render.config.EngineConfigurationLoader;
import com.hellblazer.chaos.render.oracle.Oracle;
import com.hellblazer.chaos.render.settings.JuliaConstantInput;
import com.hellblazer.chaos.render.settings.RenderSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Chaos Engine command line.
 * <p>
 * Usage:
 *   ChaosCommandLine render [options]
 *   ChaosCommandLine animate [options]
 *   ChaosCommandLine export [options]
 *   ChaosCommandLine oracle [--seed n]
 *   ChaosCommandLine help
 */
public class ChaosCommandLine {

    public enum Mode {
        RENDER("render", "Render one frame of an intent at display resolution"),
        ANIMATE("animate", "Render a sequence of animation frames"),
        EXPORT("export", "Export a high-resolution snapshot of the base view"),
        ORACLE("oracle", "Print the oracle value for a seed"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public String getCommand() { return command; }
        public String getDescription() { return description; }

        public static Mode fromString(String command) {
            for (Mode mode : values()) {
                if (mode.command.equals(command)) {
                    return mode;
                }
            }
            return null;
        }
    }

    /**
     * Configuration for all operational modes
     */
    public static class Config {
        public Mode mode;

        // View
        public String        intent = "";
        public FractalFamily family = FractalFamily.MANDELBROT;
        public String        juliaReal;
        public String        juliaImag;
        public List<Effect>  effects = new ArrayList<>();

        // Resolution and performance
        public Integer frameWidth;
        public Integer frameHeight;
        public Double  renderScale;
        public Integer baseIterations;
        public Integer maxThreads;

        // Output
        public String outputFile;
        public String configFile;
        public Long   seed;

        // Animate mode options
        public int frames = 60;

        @Override
        public String toString() {
            return String.format("Config[mode=%s, intent='%s', family=%s, effects=%s, output=%s]", mode, intent,
                                 family.displayName(), effects, outputFile);
        }
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        try {
            Config config = parseArguments(args);
            if (config.mode == Mode.HELP) {
                printUsage();
                System.exit(0);
            }
            System.exit(execute(config));
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println();
            printUsage();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Execution failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static Config parseArguments(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("Mode required");
        }
        Config config = new Config();
        config.mode = Mode.fromString(args[0]);
        if (config.mode == null) {
            throw new IllegalArgumentException("Unknown mode: " + args[0]);
        }

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--intent" -> config.intent = getArgValue(args, ++i);
                case "--family" -> config.family = FractalFamily.fromName(getArgValue(args, ++i));
                case "--julia" -> parseJulia(getArgValue(args, ++i), config);
                case "--effects" -> parseEffects(getArgValue(args, ++i), config);
                case "--size" -> parseFrameSize(getArgValue(args, ++i), config);
                case "--scale" -> config.renderScale = Double.parseDouble(getArgValue(args, ++i));
                case "--iterations" -> config.baseIterations = Integer.parseInt(getArgValue(args, ++i));
                case "--threads" -> config.maxThreads = Integer.parseInt(getArgValue(args, ++i));
                case "--output" -> config.outputFile = getArgValue(args, ++i);
                case "--config" -> config.configFile = getArgValue(args, ++i);
                case "--seed" -> config.seed = Long.parseLong(getArgValue(args, ++i));
                case "--frames" -> {
                    if (config.mode != Mode.ANIMATE) {
                        throw new IllegalArgumentException("--frames only applies to animate mode");
                    }
                    config.frames = Integer.parseInt(getArgValue(args, ++i));
                    if (config.frames <= 0) {
                        throw new IllegalArgumentException("Frame count must be positive");
                    }
                }
                default -> throw new IllegalArgumentException("Unknown " + config.mode.getCommand() + " option: "
                                                              + args[i]);
            }
        }
        return config;
    }

    /**
     * Build the engine configuration from the loaded file or resource and the command line overrides.
     */
    static EngineConfiguration engineConfiguration(Config config) throws IOException {
        var loader = new EngineConfigurationLoader();
        var engineConfig = config.configFile != null ? loader.load(Path.of(config.configFile)) : loader.load();
        if (config.frameWidth != null) {
            engineConfig = engineConfig.withDisplay(config.frameWidth, config.frameHeight);
        }
        if (config.renderScale != null || config.baseIterations != null) {
            var settings = new RenderSettings(
            config.renderScale != null ? config.renderScale : engineConfig.renderScale(),
            config.baseIterations != null ? config.baseIterations : engineConfig.baseMaxIteration());
            engineConfig = engineConfig.withRenderSettings(settings.renderScale(), settings.baseMaxIteration());
        }
        if (config.maxThreads != null) {
            engineConfig = engineConfig.withWorkerThreads(config.maxThreads);
        }
        return engineConfig;
    }

    static int execute(Config config) throws IOException {
        System.out.println("Chaos Engine Command Line Interface");
        System.out.println("Mode: " + config.mode.getDescription());
        System.out.println("Config: " + config);
        System.out.println();

        var random = config.seed != null ? new Random(config.seed) : new Random();
        if (config.mode == Mode.ORACLE) {
            return runOracle(config, random);
        }

        var engineConfig = engineConfiguration(config);
        var clock = new FrameClock();
        var pipeline = new FractalRenderingPipeline(engineConfig.workerThreads(), engineConfig.tileSize());
        try (var engine = new ChaosEngine(engineConfig, pipeline, clock, random)) {
            engine.animation().setAnimating(config.mode == Mode.ANIMATE);
            for (var effect : config.effects) {
                engine.session().effects().set(effect, true);
            }
            var juliaConstant = config.juliaReal != null ? JuliaConstantInput.parse(config.juliaReal,
                                                                                     config.juliaImag)
                                                         : Optional.<FractalFamily.Julia>empty();
            var frame = engine.regenerateFromIntent(config.intent, config.family, juliaConstant);

            switch (config.mode) {
                case RENDER -> {
                    var output = Path.of(config.outputFile != null ? config.outputFile : "chaos.png");
                    FrameSaver.write(engine.displayImage(frame), output);
                    System.out.printf("Rendered %dx%d frame to %s%n", frame.width(), frame.height(), output);
                }
                case ANIMATE -> {
                    var saver = new FrameSaver(Path.of(config.outputFile != null ? config.outputFile : "frames"));
                    saver.save(engine.displayImage(frame), 0);
                    for (int i = 1; i < config.frames; i++) {
                        clock.advance(engineConfig.animationTickMillis());
                        var next = engine.tick().orElseThrow();
                        saver.save(engine.displayImage(next), i);
                    }
                    System.out.printf("Rendered %d animation frames%n", config.frames);
                }
                case EXPORT -> {
                    var output = Path.of(config.outputFile != null ? config.outputFile
                                                                   : config.family.displayName().replace(' ', '_')
                                                                     + "_fractal.png");
                    var snapshot = engine.exportSnapshot(output);
                    System.out.printf("Exported %dx%d snapshot (palette %d) to %s%n", snapshot.pixels().width(),
                                      snapshot.pixels().height(), snapshot.paletteId(), output);
                }
                default -> throw new IllegalStateException("Unexpected mode: " + config.mode);
            }
            var metrics = engine.pipeline().getPerformanceMetrics();
            System.out.printf("Frames: %d, average %.2f ms%n", metrics.totalFramesRendered(),
                              metrics.averageFrameTimeMs());
        }
        return 0;
    }

    private static int runOracle(Config config, Random random) {
        var oracle = new Oracle(Clock.systemUTC(), random);
        if (config.seed != null) {
            oracle.acceptSeed(config.seed);
        } else {
            oracle.seedUnavailable("no seed supplied");
        }
        System.out.println("Oracle: " + oracle.current());
        return 0;
    }

    private static String getArgValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for argument: " + args[index - 1]);
        }
        return args[index];
    }

    private static void parseFrameSize(String sizeStr, Config config) {
        String[] parts = sizeStr.split("x");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid frame size format. Use: widthxheight");
        }
        config.frameWidth = Integer.parseInt(parts[0]);
        config.frameHeight = Integer.parseInt(parts[1]);
    }

    private static void parseJulia(String value, Config config) {
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid Julia constant format. Use: real,imag");
        }
        config.juliaReal = parts[0];
        config.juliaImag = parts[1];
    }

    private static void parseEffects(String value, Config config) {
        for (var name : value.split(",")) {
            if (!name.isBlank()) {
                config.effects.add(Effect.fromString(name.trim()));
            }
        }
    }

    private static void printUsage() {
        System.out.println("Chaos Engine Command Line Interface");
        System.out.println();
        System.out.println("Usage: ChaosCommandLine <mode> [options]");
        System.out.println();
        System.out.println("Modes:");
        for (Mode mode : Mode.values()) {
            System.out.printf("  %-10s %s%n", mode.getCommand(), mode.getDescription());
        }
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --intent <text>          Intent text (default: family default)");
        System.out.println("  --family <name>          Mandelbrot, Julia or Burning Ship");
        System.out.println("  --julia <re,im>          Explicit Julia constant");
        System.out.println("  --effects <a,b,...>      Effects: colors, bands, tunnel, glitch, crush, scan, rgb,");
        System.out.println("                           neon, emboss, morph, strobe");
        System.out.println("  --size <w>x<h>           Display size");
        System.out.println("  --scale <f>              Render scale divisor [0.5, 10]");
        System.out.println("  --iterations <n>         Base max iterations [10, 1000]");
        System.out.println("  --threads <n>            Worker threads");
        System.out.println("  --frames <n>             Animation frames (animate mode)");
        System.out.println("  --output <path>          Output file, or directory for animate mode");
        System.out.println("  --config <file>          Engine configuration JSON");
        System.out.println("  --seed <n>               Random seed, or oracle seed in oracle mode");
    }

    /**
     * Clock advanced by the frame loop, so animation frames land on exact tick boundaries.
     */
    static final class FrameClock extends Clock {
        private long millis;

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
