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

import com.hellblazer.reciprocity.exceptions.GeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3d;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;
import java.util.stream.IntStream;

/**
 * Evaluates per point geometry queries over every point of a scan. Points are independent: a geometry error at
 * one point is recorded against that point and the rest of the scan carries on.
 *
 * @author hal.hildebrand
 */
public class ScanBatch {

    private static final Logger log = LoggerFactory.getLogger(ScanBatch.class);

    private final GeometryModel model;
    private final boolean       parallel;

    public ScanBatch(GeometryModel model) {
        this(model, model.context().config().isParallelBatches());
    }

    public ScanBatch(GeometryModel model, boolean parallel) {
        this.model = model;
        this.parallel = parallel;
    }

    /**
     * Evaluate a query at every scan point
     *
     * @param scanLength number of points
     * @param query      the per point query
     * @return one row per point, NaN where the query failed
     */
    public BatchResult evaluate(int scanLength, IntFunction<? extends Tuple3d> query) {
        var values = new double[scanLength][];
        Map<Integer, GeometryException> failures = new ConcurrentHashMap<>();
        var points = IntStream.range(0, scanLength);
        if (parallel) {
            points = points.parallel();
        }
        points.forEach(i -> {
            try {
                var result = query.apply(i);
                values[i] = new double[] { result.x, result.y, result.z };
            } catch (GeometryException e) {
                log.debug("Scan point {} failed: {}", i, e.getMessage());
                failures.put(i, e);
                var nan = new double[3];
                Arrays.fill(nan, Double.NaN);
                values[i] = nan;
            }
        });
        if (!failures.isEmpty()) {
            log.warn("{} of {} scan points failed", failures.size(), scanLength);
        }
        return new BatchResult(values, failures);
    }

    /**
     * Miller indices at a fixed pixel of the first module over the scan
     */
    public BatchResult hkl(double slow, double fast) {
        return evaluate(model.scanLength(), i -> model.hkl(new PixelPoint(i, slow, fast)));
    }

    /**
     * Position of a fixed pixel of a module over the scan
     */
    public BatchResult pixelPositions(DetectorModule module, double slow, double fast) {
        return evaluate(model.scanLength(), i -> module.pixelPosition(i, slow, fast));
    }

    /**
     * Scattered wavevector reaching a fixed pixel of a module over the scan
     */
    public BatchResult pixelWavevectors(DetectorModule module, double slow, double fast) {
        var wavelength = model.beam().wavelength();
        return evaluate(model.scanLength(), i -> module.pixelWavevector(new PixelPoint(i, slow, fast), wavelength));
    }

    /**
     * Scattering vector at a fixed pixel of the first module over the scan
     */
    public BatchResult q(double slow, double fast) {
        return evaluate(model.scanLength(), i -> model.detectorQ(new PixelPoint(i, slow, fast)));
    }
}
