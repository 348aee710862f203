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

import com.hellblazer.chaos.fractal.effects.EffectsPipeline;
import com.hellblazer.chaos.fractal.effects.FrameContext;
import com.hellblazer.chaos.fractal.intent.FractalParameters;
import com.hellblazer.chaos.render.tile.DispatchMetrics;
import com.hellblazer.chaos.render.tile.TileDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Renders fractal frames: escape-time grid on the tile workers, optional convolution, then colorization through the
 * effects pipeline.
 * <p>
 * Renders never overlap. Each request takes a new generation number; an asynchronous render that finds a newer
 * generation when it starts, or after its grid is computed, is discarded without coloring. Synchronous renders
 * supersede any pending asynchronous one.
 *
 * @author hal.hildebrand
 */
public class FractalRenderingPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FractalRenderingPipeline.class);

    private static final int FRAME_TIME_WINDOW = 100;

    private final ExecutorService workers;
    private final ExecutorService renderExecutor;
    private final TileDispatcher  dispatcher;
    private final RenderBuffers   buffers   = new RenderBuffers();
    private final Object          renderLock = new Object();

    private final CopyOnWriteArrayList<RenderListener> listeners = new CopyOnWriteArrayList<>();

    // Rendering state
    private final    AtomicBoolean     isRendering = new AtomicBoolean(false);
    private final    AtomicLong          generation  = new AtomicLong();
    private volatile FractalParameters   lastParameters;
    // buffers of the last completed render; a discarded render may already have replaced the current ones
    private volatile RenderBuffers.Frame lastFrame;

    // Performance tracking
    private final AtomicLong                  frameNumbers         = new AtomicLong();
    private final AtomicLong                  totalFramesRendered  = new AtomicLong();
    private final AtomicLong                  totalRenderTimeNanos = new AtomicLong();
    private final AtomicInteger               discardedFrames      = new AtomicInteger();
    private final ConcurrentLinkedQueue<Long> frameTimes           = new ConcurrentLinkedQueue<>();

    /**
     * Performance metrics for the rendering pipeline.
     *
     * @param totalFramesRendered frames delivered, including recolors
     * @param averageFrameTimeMs  mean render time
     * @param frameTimeStdDev     standard deviation over the most recent frames, in milliseconds
     * @param discardedFrames     asynchronous renders superseded before completion
     * @param bufferReallocations times the working buffers changed shape
     */
    public record PerformanceMetrics(long totalFramesRendered, double averageFrameTimeMs, double frameTimeStdDev,
                                     int discardedFrames, int bufferReallocations) {
    }

    /**
     * @param workerThreads size of the tile worker pool
     * @param tileSize      tile edge in pixels
     */
    public FractalRenderingPipeline(int workerThreads, int tileSize) {
        this(tilePool(workerThreads), Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "chaos-render");
            t.setDaemon(true);
            return t;
        }), tileSize);
        log.info("FractalRenderingPipeline initialized with {} workers, {}px tiles", workerThreads, tileSize);
    }

    /**
     * Pipeline over caller-supplied executors, which it owns and shuts down on close.
     */
    FractalRenderingPipeline(ExecutorService workers, ExecutorService renderExecutor, int tileSize) {
        this.workers = workers;
        this.renderExecutor = renderExecutor;
        this.dispatcher = new TileDispatcher(tileSize, workers);
    }

    /**
     * Render a frame on the calling thread, superseding any pending asynchronous render.
     */
    public RenderedFrame render(RenderRequest request) {
        generation.incrementAndGet();
        synchronized (renderLock) {
            return renderLocked(request, -1L);
        }
    }

    /**
     * Render a frame on the render thread.
     *
     * @return the frame, or empty if a newer request superseded this one
     */
    public CompletableFuture<Optional<RenderedFrame>> submit(RenderRequest request) {
        long requested = generation.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> {
            synchronized (renderLock) {
                if (requested != generation.get()) {
                    discard(requested);
                    return Optional.<RenderedFrame>empty();
                }
                return Optional.ofNullable(renderLocked(request, requested));
            }
        }, renderExecutor);
    }

    /**
     * Colorize the existing coloring source again with a new frame context, without recomputing the grid.
     *
     * @return the recolored frame, or empty if nothing has been rendered yet
     */
    public Optional<RenderedFrame> recolor(FrameContext context) {
        synchronized (renderLock) {
            var frame = lastFrame;
            var parameters = lastParameters;
            if (frame == null || parameters == null) {
                return Optional.empty();
            }
            long startTime = System.nanoTime();
            EffectsPipeline.colorize(frame.field(), frame.width(), frame.height(), frame.pixels(), context);
            return Optional.of(finish(frame, parameters, new DispatchMetrics(0, 0, 0, 0L), startTime));
        }
    }

    /**
     * Parameters of the most recent completed render.
     */
    public Optional<FractalParameters> lastParameters() {
        return Optional.ofNullable(lastParameters);
    }

    public TileDispatcher dispatcher() {
        return dispatcher;
    }

    public RenderBuffers buffers() {
        return buffers;
    }

    public boolean isRendering() {
        return isRendering.get();
    }

    public void addListener(RenderListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RenderListener listener) {
        listeners.remove(listener);
    }

    /**
     * Get current performance metrics.
     */
    public PerformanceMetrics getPerformanceMetrics() {
        long frames = totalFramesRendered.get();
        if (frames == 0) {
            return new PerformanceMetrics(0, 0.0, 0.0, discardedFrames.get(), buffers.reallocations());
        }
        double avgTimeNanos = (double) totalRenderTimeNanos.get() / frames;

        double variance = 0;
        int count = 0;
        for (Long time : frameTimes) {
            double diff = (time - avgTimeNanos) / 1_000_000.0;
            variance += diff * diff;
            count++;
        }
        double stdDev = count > 0 ? Math.sqrt(variance / count) : 0;
        return new PerformanceMetrics(frames, avgTimeNanos / 1_000_000.0, stdDev, discardedFrames.get(),
                                      buffers.reallocations());
    }

    @Override
    public void close() {
        log.info("Closing FractalRenderingPipeline...");
        generation.incrementAndGet();
        shutdown(renderExecutor);
        shutdown(workers);
        listeners.clear();
        log.info("FractalRenderingPipeline closed after {} frames", totalFramesRendered.get());
    }

    private RenderedFrame renderLocked(RenderRequest request, long requested) {
        isRendering.set(true);
        try {
            long startTime = System.nanoTime();
            var frame = buffers.resizeIfNeeded(request.width(), request.height());
            var parameters = request.parameters();

            var metrics = dispatcher.dispatchFrame(frame.grid(), parameters.viewport(), parameters.maxIteration(),
                                                   parameters.family());
            if (requested >= 0 && requested != generation.get()) {
                discard(requested);
                return null;
            }

            dispatcher.filter(request.edgeMode(), frame.grid(), frame.field());
            EffectsPipeline.colorize(frame.field(), frame.width(), frame.height(), frame.pixels(), request.frame());
            lastParameters = parameters;
            lastFrame = frame;
            return finish(frame, parameters, metrics, startTime);
        } finally {
            isRendering.set(false);
        }
    }

    private RenderedFrame finish(RenderBuffers.Frame frame, FractalParameters parameters, DispatchMetrics metrics,
                                 long startTime) {
        long renderTime = System.nanoTime() - startTime;
        totalFramesRendered.incrementAndGet();
        totalRenderTimeNanos.addAndGet(renderTime);
        frameTimes.offer(renderTime);
        while (frameTimes.size() > FRAME_TIME_WINDOW) {
            frameTimes.poll();
        }

        var rendered = new RenderedFrame(frameNumbers.incrementAndGet(), frame.pixels().copy(), parameters, metrics,
                                         renderTime);
        if (log.isDebugEnabled()) {
            log.debug("Frame {} rendered {}x{} in {} ms", rendered.frameNumber(), frame.width(), frame.height(),
                      String.format("%.2f", renderTime / 1_000_000.0));
        }
        for (var listener : listeners) {
            listener.frameRendered(rendered);
        }
        return rendered;
    }

    private void discard(long requested) {
        discardedFrames.incrementAndGet();
        log.debug("Render {} superseded by {}", requested, generation.get());
    }

    private static ExecutorService tilePool(int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("Worker threads must be positive: " + workerThreads);
        }
        var threadIds = new AtomicInteger();
        return Executors.newFixedThreadPool(workerThreads, r -> {
            var t = new Thread(r, "chaos-tile-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
