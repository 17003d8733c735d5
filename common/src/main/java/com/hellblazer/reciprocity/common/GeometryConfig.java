/*
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.reciprocity.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.reciprocity.exceptions.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Configuration for chain resolution and reciprocal space calculation. Immutable; create with
 * {@link #builder()} or {@link #load()}.
 *
 * @author hal.hildebrand
 */
public class GeometryConfig {

    public static final String RESOURCE = "/reciprocity.json";

    private static final Logger         log      = LoggerFactory.getLogger(GeometryConfig.class);
    private static final GeometryConfig DEFAULTS = builder().build();

    /**
     * @return the configuration with every parameter at its default
     */
    public static GeometryConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Load the configuration from the {@value #RESOURCE} classpath resource, falling back to the defaults when
     * the resource is absent
     *
     * @return the loaded configuration
     * @throws InvalidConfigurationException if the resource exists but cannot be parsed
     */
    public static GeometryConfig load() {
        try (var in = GeometryConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
                return DEFAULTS;
            }
            return load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Unable to read " + RESOURCE, e);
        }
    }

    /**
     * Load the configuration from a JSON document. Absent fields keep their defaults.
     *
     * @param in the JSON source, not closed by this method
     * @return the loaded configuration
     */
    public static GeometryConfig load(InputStream in) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Malformed geometry configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Geometry configuration must be a JSON object");
        }
        var builder = builder();
        if (root.has("maxChainLength")) {
            builder.maxChainLength(root.get("maxChainLength").asInt());
        }
        if (root.has("singularTolerance")) {
            builder.singularTolerance(root.get("singularTolerance").asDouble());
        }
        if (root.has("parallelBatches")) {
            builder.parallelBatches(root.get("parallelBatches").asBoolean());
        }
        var config = builder.build();
        log.info("Loaded geometry configuration: {}", config);
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    private final int     maxChainLength;
    private final double  singularTolerance;
    private final boolean parallelBatches;

    private GeometryConfig(Builder builder) {
        this.maxChainLength = builder.maxChainLength;
        this.singularTolerance = builder.singularTolerance;
        this.parallelBatches = builder.parallelBatches;
    }

    /**
     * @return the most links a chain may have before traversal is abandoned as cyclic
     */
    public int getMaxChainLength() {
        return maxChainLength;
    }

    /**
     * @return the absolute determinant below which a matrix is treated as singular
     */
    public double getSingularTolerance() {
        return singularTolerance;
    }

    /**
     * @return true if scan batches may evaluate points concurrently
     */
    public boolean isParallelBatches() {
        return parallelBatches;
    }

    @Override
    public String toString() {
        return "GeometryConfig{maxChainLength=" + maxChainLength + ", singularTolerance=" + singularTolerance
        + ", parallelBatches=" + parallelBatches + '}';
    }

    public static class Builder {
        private int     maxChainLength    = 64;
        private double  singularTolerance = 1e-12;
        private boolean parallelBatches   = true;

        private Builder() {
        }

        public GeometryConfig build() {
            return new GeometryConfig(this);
        }

        public Builder maxChainLength(int maxChainLength) {
            if (maxChainLength < 1) {
                throw new InvalidConfigurationException("maxChainLength must be positive: " + maxChainLength);
            }
            this.maxChainLength = maxChainLength;
            return this;
        }

        public Builder parallelBatches(boolean parallelBatches) {
            this.parallelBatches = parallelBatches;
            return this;
        }

        public Builder singularTolerance(double singularTolerance) {
            if (!(singularTolerance >= 0.0)) {
                throw new InvalidConfigurationException("singularTolerance must be non-negative: "
                                                        + singularTolerance);
            }
            this.singularTolerance = singularTolerance;
            return this;
        }
    }
}
