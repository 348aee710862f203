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

import com.hellblazer.chaos.fractal.animation.AnimationController;
import com.hellblazer.chaos.fractal.core.FractalFamily;
import com.hellblazer.chaos.fractal.core.PixelBuffer;
import com.hellblazer.chaos.fractal.core.Viewport;
import com.hellblazer.chaos.fractal.core.ViewportMapper;
import com.hellblazer.chaos.fractal.effects.Effect;
import com.hellblazer.chaos.fractal.intent.FractalParameters;
import com.hellblazer.chaos.fractal.intent.IntentParameterGenerator;
import com.hellblazer.chaos.render.config.EngineConfiguration;
import com.hellblazer.chaos.render.settings.RenderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.Random;

/**
 * The interaction controller: owns the base view, the animation clock, the render session and the pipeline, and
 * turns interaction events into renders.
 * <p>
 * Two regeneration paths exist. Regeneration from intent re-derives the base view from the intent text; regeneration
 * from state renders the current base view, animated or not. Pan, zoom, resize, effect toggles and animation toggles
 * regenerate from state without resetting the animation clock.
 * <p>
 * Not thread safe. All calls are expected from one interaction thread.
 *
 * @author hal.hildebrand
 */
public class ChaosEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChaosEngine.class);

    private final EngineConfiguration      config;
    private final FractalRenderingPipeline pipeline;
    private final AnimationController      animation;
    private final RenderSession            session;
    private final RenderSettings           settings;
    private final SnapshotExporter         exporter;

    private IntentParameterGenerator generator;
    private int                      displayWidth;
    private int                      displayHeight;
    private String                   intent       = IntentParameterGenerator.PLACEHOLDER_INTENT;
    private FractalFamily            family       = FractalFamily.MANDELBROT;
    private FractalFamily.Julia      juliaOverride;
    private FractalFamily            resolvedFamily = FractalFamily.MANDELBROT;
    private int                      baseMaxIteration;

    public ChaosEngine(EngineConfiguration config, FractalRenderingPipeline pipeline, Clock clock, Random random) {
        if (config == null || pipeline == null || clock == null || random == null) {
            throw new IllegalArgumentException("Configuration, pipeline, clock and random source are required");
        }
        this.config = config;
        this.pipeline = pipeline;
        this.session = new RenderSession(random);
        this.settings = RenderSettings.from(config);
        this.generator = new IntentParameterGenerator(settings.baseMaxIteration());
        this.animation = new AnimationController(config.animation(), clock, Viewport.DEFAULT);
        this.exporter = new SnapshotExporter(pipeline.dispatcher(), config.exportWidth(), config.exportHeight(),
                                             random);
        this.displayWidth = config.displayWidth();
        this.displayHeight = config.displayHeight();
        this.baseMaxIteration = settings.baseMaxIteration();
    }

    /**
     * An engine with its own pipeline, the system clock and an unseeded random source.
     */
    public static ChaosEngine create(EngineConfiguration config) {
        var pipeline = new FractalRenderingPipeline(config.workerThreads(), config.tileSize());
        return new ChaosEngine(config, pipeline, Clock.systemUTC(), new Random());
    }

    /**
     * Select a new intent and family and derive a fresh base view, resetting the animation clock.
     *
     * @param intentText    user text; empty or placeholder text selects the family default
     * @param selected      family to view; a Julia constant on it is ignored
     * @param juliaConstant explicit Julia constant overriding the derived one, if the user entered a valid one
     */
    public RenderedFrame regenerateFromIntent(String intentText, FractalFamily selected,
                                              Optional<FractalFamily.Julia> juliaConstant) {
        if (selected == null || juliaConstant == null) {
            throw new IllegalArgumentException("Fractal family and Julia constant option are required");
        }
        this.intent = intentText;
        this.family = selected;
        this.juliaOverride = juliaConstant.orElse(null);
        if (!(selected instanceof FractalFamily.Julia)) {
            session.effects().set(Effect.JULIA_MORPH, false);
        }
        return regenerateFromIntent(true);
    }

    /**
     * Re-derive the base view from the current intent.
     */
    public RenderedFrame regenerateFromIntent(boolean resetClock) {
        var effective = IntentParameterGenerator.effectiveIntent(intent, family);
        log.info("Generating new base ({}) from intent '{}'", family.displayName(), effective);

        var derived = generator.generate(intent, ViewportMapper.aspectRatio(gridWidth(), gridHeight()), family);
        animation.setBase(derived.viewport());
        baseMaxIteration = derived.maxIteration();
        if (derived.family() instanceof FractalFamily.Julia derivedJulia) {
            resolvedFamily = juliaOverride != null ? juliaOverride : derivedJulia;
        } else {
            resolvedFamily = derived.family();
        }
        return regenerateFromState(resetClock);
    }

    /**
     * Render the current base view: one animated frame while animating, the unmodified base otherwise.
     */
    public RenderedFrame regenerateFromState(boolean resetClock) {
        if (resetClock) {
            animation.reset();
        }
        return animation.isAnimating() ? animatedFrame() : redraw();
    }

    /**
     * Animation tick.
     *
     * @return the next animated frame, or empty when not animating
     */
    public Optional<RenderedFrame> tick() {
        if (!animation.isAnimating()) {
            return Optional.empty();
        }
        return Optional.of(animatedFrame());
    }

    /**
     * Strobe tick while not animating: advance the palette and recolor the existing grid.
     *
     * @return the recolored frame, or empty if animating, strobe is inactive or nothing was rendered yet
     */
    public Optional<RenderedFrame> strobeTick() {
        if (animation.isAnimating() || !session.strobe()) {
            return Optional.empty();
        }
        return pipeline.lastParameters()
                       .flatMap(last -> pipeline.recolor(session.frame(animation.timePhase(), last.maxIteration())));
    }

    /**
     * Drag the view by a display-pixel delta.
     */
    public Optional<RenderedFrame> pan(double dx, double dy) {
        if (!animation.pan(dx, dy, displayWidth, displayHeight)) {
            return Optional.empty();
        }
        return Optional.of(regenerateFromState(false));
    }

    /**
     * Zoom one step about a display pixel.
     *
     * @param direction positive zooms in, otherwise out
     */
    public Optional<RenderedFrame> zoom(int direction, double anchorX, double anchorY) {
        if (!animation.zoom(direction, anchorX, anchorY, displayWidth, displayHeight)) {
            return Optional.empty();
        }
        return Optional.of(regenerateFromState(false));
    }

    /**
     * The display changed size. Grid dimensions follow; the base view and animation clock are kept.
     */
    public RenderedFrame resize(int width, int height) {
        displayWidth = width;
        displayHeight = height;
        log.debug("Display resized to {}x{}, grid {}x{}", width, height, gridWidth(), gridHeight());
        return regenerateFromState(false);
    }

    /**
     * Enable or disable an effect. Julia morph is refused unless the Julia family is selected.
     *
     * @return the new frame, or empty if nothing changed
     */
    public Optional<RenderedFrame> setEffect(Effect effect, boolean enabled) {
        if (effect == Effect.JULIA_MORPH && enabled && !(family instanceof FractalFamily.Julia)) {
            log.debug("Julia morph requires the Julia family, {} selected", family.displayName());
            return Optional.empty();
        }
        if (!session.effects().set(effect, enabled)) {
            return Optional.empty();
        }
        return Optional.of(regenerateFromState(false));
    }

    public Optional<RenderedFrame> toggleEffect(Effect effect) {
        return setEffect(effect, !session.effects().isActive(effect));
    }

    public RenderedFrame setAnimating(boolean animating) {
        animation.setAnimating(animating);
        log.info("Fractal animation {}", animating ? "enabled" : "disabled");
        return regenerateFromState(false);
    }

    /**
     * Apply entered performance settings. A change of either value re-derives the view from the intent without
     * resetting the animation clock.
     */
    public RenderSettings.Outcome applySettings(String scaleText, String iterationText) {
        var outcome = settings.apply(scaleText, iterationText);
        if (outcome.changed()) {
            log.info("Settings applied: render scale {}, base max iterations {}", settings.renderScale(),
                     settings.baseMaxIteration());
            generator = new IntentParameterGenerator(settings.baseMaxIteration());
            regenerateFromIntent(false);
        } else {
            log.info("No valid setting changes applied");
        }
        return outcome;
    }

    /**
     * Write a high-resolution snapshot of the base view.
     */
    public SnapshotExporter.Snapshot exportSnapshot(Path file) throws IOException {
        return exporter.export(baseParameters(), file);
    }

    /**
     * The frame as it should be shown, with the display-stage RGB shift applied when enabled.
     */
    public PixelBuffer displayImage(RenderedFrame frame) {
        if (!session.effects().isActive(Effect.RGB_SHIFT)) {
            return frame.pixels();
        }
        return RgbShiftCompositor.composite(frame.pixels(), session.effects().parameters().rgbShift());
    }

    /**
     * The persisted view: base viewport, derived budget and resolved family without morph.
     */
    public FractalParameters baseParameters() {
        return new FractalParameters(animation.base(), baseMaxIteration, resolvedFamily);
    }

    public int gridWidth() {
        return Math.max(config.minGridDimension(), (int) (displayWidth / settings.renderScale()));
    }

    public int gridHeight() {
        return Math.max(config.minGridDimension(), (int) (displayHeight / settings.renderScale()));
    }

    public void addListener(RenderListener listener) {
        pipeline.addListener(listener);
    }

    public AnimationController animation() {
        return animation;
    }

    public RenderSession session() {
        return session;
    }

    public RenderSettings settings() {
        return settings;
    }

    public FractalRenderingPipeline pipeline() {
        return pipeline;
    }

    public FractalFamily family() {
        return family;
    }

    public String intent() {
        return intent;
    }

    @Override
    public void close() {
        pipeline.close();
    }

    private RenderedFrame animatedFrame() {
        animation.tick();
        session.strobe();
        // a collapsed display keeps a unit aspect
        double displayAspect = displayWidth > 0 ? (double) displayWidth / Math.max(1, displayHeight) : 1.0;
        return render(animation.displayedViewport(displayAspect));
    }

    private RenderedFrame redraw() {
        session.strobe();
        return render(animation.base());
    }

    private RenderedFrame render(Viewport viewport) {
        var effective = resolvedFamily;
        if (effective instanceof FractalFamily.Julia julia && session.effects().isActive(Effect.JULIA_MORPH)) {
            effective = animation.morph(julia, session.effects().parameters().morphRadius());
        }
        var parameters = new FractalParameters(viewport, baseMaxIteration, effective);
        var request = new RenderRequest(parameters, gridWidth(), gridHeight(), session.effects().edgeMode(),
                                        session.frame(animation.timePhase(), baseMaxIteration));
        return pipeline.render(request);
    }
}
