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
package com.hellblazer.reciprocity.diffraction;

import com.hellblazer.reciprocity.common.GeometryConfig;

import java.util.Objects;

/**
 * The explicit, immutable context a {@link GeometryModel} is built in.
 *
 * @param labFrame the frame every real space result is expressed in
 * @param config   resolution and calculation parameters
 * @author hal.hildebrand
 */
public record GeometryContext(LabFrame labFrame, GeometryConfig config) {

    public GeometryContext {
        Objects.requireNonNull(labFrame, "labFrame");
        Objects.requireNonNull(config, "config");
    }

    /**
     * The identity lab frame, with the configuration from the classpath (see {@link GeometryConfig#load()})
     */
    public static GeometryContext defaults() {
        return new GeometryContext(LabFrame.identity(), GeometryConfig.load());
    }

    public GeometryContext withLabFrame(LabFrame frame) {
        return new GeometryContext(frame, config);
    }

    public GeometryContext withConfig(GeometryConfig newConfig) {
        return new GeometryContext(labFrame, newConfig);
    }
}
