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

import com.hellblazer.reciprocity.transform.ChainComposer;
import com.hellblazer.reciprocity.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.List;
import java.util.Objects;

/**
 * A detector: its own placement chain and the modules it carries.
 *
 * @author hal.hildebrand
 */
public final class Detector {

    private static final Logger log = LoggerFactory.getLogger(Detector.class);

    /**
     * The scan length implied by a detector's chain and every module inside it
     */
    public static int scanLength(ChainComposer composer, String path) {
        var accessor = composer.getWalker().getAccessor();
        var length = composer.getWalker().maxSize(path);
        for (var module : Fields.childGroups(accessor, path, GeometryModel.NX_DETECTOR_MODULE)) {
            length = Math.max(length, DetectorModule.scanLength(composer, module));
        }
        return length;
    }

    public static Detector load(ChainComposer composer, String path, int scanLength, LabFrame labFrame) {
        var accessor = composer.getWalker().getAccessor();
        var modules = Fields.childGroups(accessor, path, GeometryModel.NX_DETECTOR_MODULE)
                            .stream()
                            .map(module -> DetectorModule.load(composer, module, scanLength, labFrame))
                            .toList();
        if (modules.isEmpty()) {
            log.warn("Detector {} has no detector modules", path);
        }
        return new Detector(path, composer.chain(path, scanLength).prepend(labFrame.toMatrix4d()), modules);
    }

    private final TransformChain       chain;
    private final List<DetectorModule> modules;
    private final String               path;

    public Detector(String path, TransformChain chain, List<DetectorModule> modules) {
        this.path = Objects.requireNonNull(path, "path");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.modules = List.copyOf(modules);
    }

    public TransformChain chain() {
        return chain;
    }

    public List<DetectorModule> modules() {
        return modules;
    }

    public String path() {
        return path;
    }

    /**
     * @return the detector position at the middle of the scan
     */
    public Point3d position() {
        return chain.origin(chain.size() / 2);
    }

    @Override
    public String toString() {
        return "Detector[%s, %d modules]".formatted(path, modules.size());
    }
}
