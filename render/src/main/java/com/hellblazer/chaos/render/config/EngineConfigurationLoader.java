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
package com.hellblazer.chaos.render.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EngineConfiguration} from JSON.
 * <p>
 * Sources:
 * 1. An explicit file, which must be readable
 * 2. The classpath resource {@value #CONFIG_RESOURCE}, falling back to defaults when absent or unreadable
 * <p>
 * Keys missing from the document keep their default; unknown keys are ignored. A {@code workerThreads} of zero or less
 * means one worker per available processor.
 *
 * @author hal.hildebrand
 */
public class EngineConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigurationLoader.class);

    static final String CONFIG_RESOURCE = "/chaos-engine.json";

    private final ObjectMapper objectMapper;

    public EngineConfigurationLoader() {
        this(new ObjectMapper());
    }

    public EngineConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the bundled configuration resource.
     *
     * @return the configuration, or defaults if the resource is missing or invalid
     */
    public EngineConfiguration load() {
        return loadResource(CONFIG_RESOURCE);
    }

    /**
     * Load a classpath resource.
     *
     * @return the configuration, or defaults if the resource is missing or invalid
     */
    public EngineConfiguration loadResource(String resource) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Configuration resource not found: {}, using defaults", resource);
                return EngineConfiguration.defaults();
            }
            var config = parse(objectMapper.readTree(is));
            log.info("Loaded engine configuration from {}", resource);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load configuration {}: {}, using defaults", resource, e.getMessage());
            return EngineConfiguration.defaults();
        }
    }

    /**
     * Load an explicit configuration file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public EngineConfiguration load(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            var config = parse(objectMapper.readTree(is));
            log.info("Loaded engine configuration from {}", file);
            return config;
        }
    }

    /**
     * Overlay a JSON object on the defaults.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public EngineConfiguration parse(JsonNode root) {
        var defaults = EngineConfiguration.defaults();
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }
        int workerThreads = root.path("workerThreads").asInt(defaults.workerThreads());
        if (workerThreads <= 0) {
            workerThreads = defaults.workerThreads();
        }
        return new EngineConfiguration(root.path("displayWidth").asInt(defaults.displayWidth()),
                                       root.path("displayHeight").asInt(defaults.displayHeight()),
                                       root.path("renderScale").asDouble(defaults.renderScale()),
                                       root.path("baseMaxIteration").asInt(defaults.baseMaxIteration()),
                                       root.path("minGridDimension").asInt(defaults.minGridDimension()),
                                       root.path("animationTickMillis").asLong(defaults.animationTickMillis()),
                                       root.path("strobeIntervalMillis").asLong(defaults.strobeIntervalMillis()),
                                       root.path("animationPeriodSeconds").asDouble(
                                       defaults.animationPeriodSeconds()),
                                       root.path("zoomMagnitude").asDouble(defaults.zoomMagnitude()),
                                       root.path("panMagnitudeX").asDouble(defaults.panMagnitudeX()),
                                       root.path("panMagnitudeY").asDouble(defaults.panMagnitudeY()),
                                       root.path("zoomStep").asDouble(defaults.zoomStep()),
                                       root.path("exportWidth").asInt(defaults.exportWidth()),
                                       root.path("exportHeight").asInt(defaults.exportHeight()),
                                       root.path("tileSize").asInt(defaults.tileSize()), workerThreads,
                                       root.path("oracleRefreshMillis").asLong(defaults.oracleRefreshMillis()));
    }
}
