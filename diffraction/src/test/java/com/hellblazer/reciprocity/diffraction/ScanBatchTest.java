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
import com.hellblazer.reciprocity.exceptions.DegenerateDirectionException;
import com.hellblazer.reciprocity.exceptions.DegenerateLatticeException;
import com.hellblazer.reciprocity.exceptions.IndexOutOfRangeException;
import com.hellblazer.reciprocity.transform.SnapshotNodeAccessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3d;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class ScanBatchTest {

    private GeometryModel model;

    @BeforeEach
    public void before() {
        model = GeometryModel.load(SnapshotNodeAccessor.fromResource("/snapshots/instrument.json"));
    }

    @Test
    public void testQOverScan() {
        var result = new ScanBatch(model).q(0, 0);
        assertTrue(result.isComplete());
        assertEquals(3, result.size());
        for (var value : result.row(0)) {
            assertEquals(0.0, value, 1e-12);
        }
        var expected = model.detectorQ(PixelPoint.origin(2));
        assertArrayEquals(new double[] { expected.x, expected.y, expected.z }, result.row(2), 1e-15);
    }

    @Test
    public void testValuesAreCopied() {
        var rows = new double[][] { { 1, 2, 3 } };
        var result = new BatchResult(rows, Map.of());
        rows[0][0] = 99;
        var values = result.values();
        values[0][1] = 99;
        values[0] = new double[] { 7, 7, 7 };
        assertArrayEquals(new double[] { 1, 2, 3 }, result.row(0), 0.0);
        assertArrayEquals(new double[] { 1, 2, 3 }, result.values()[0], 0.0);
    }

    @Test
    public void testParallelMatchesSequential() {
        var parallel = new ScanBatch(model, true).hkl(50, 100);
        var sequential = new ScanBatch(model, false).hkl(50, 100);
        assertEquals(0, parallel.failureCount());
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(sequential.row(i), parallel.row(i), 0.0);
        }
    }

    @Test
    public void testPixelPositionsAndWavevectors() {
        var batch = new ScanBatch(model);
        var positions = batch.pixelPositions(model.module(), 0, 0);
        assertArrayEquals(new double[] { 0, 500, 1000 * Math.cos(Math.toRadians(30)) }, positions.row(1), 1e-9);

        var wavevectors = batch.pixelWavevectors(model.module(), 100, 200);
        var k = XrayUtils.wavevector(model.beam().wavelength());
        for (int i = 0; i < wavevectors.size(); i++) {
            var row = wavevectors.row(i);
            assertEquals(k, new Vector3d(row).length(), 1e-12);
        }
    }

    @Test
    public void testFailuresAreIsolated() {
        var result = new ScanBatch(model, false).evaluate(4, i -> {
            if (i == 1) {
                throw new IndexOutOfRangeException("Scan", i, 1);
            }
            return new Vector3d(i, i, i);
        });
        assertFalse(result.isComplete());
        assertEquals(1, result.failureCount());
        assertFalse(result.succeeded(1));
        assertTrue(result.succeeded(3));
        assertInstanceOf(IndexOutOfRangeException.class, result.failures().get(1));
        for (var value : result.row(1)) {
            assertTrue(Double.isNaN(value));
        }
        assertArrayEquals(new double[] { 3, 3, 3 }, result.row(3), 0.0);
        assertThrows(UnsupportedOperationException.class, () -> result.failures().clear());
    }

    @Test
    public void testDegeneratePointsRecorded() {
        var mocked = mock(GeometryModel.class);
        when(mocked.context()).thenReturn(
        GeometryContext.defaults().withConfig(GeometryConfig.builder().parallelBatches(false).build()));
        when(mocked.scanLength()).thenReturn(3);
        when(mocked.hkl(any(PixelPoint.class))).thenAnswer(invocation -> {
            PixelPoint point = invocation.getArgument(0);
            if (point.frame() == 2) {
                throw new DegenerateLatticeException("UB matrix", 0.0);
            }
            return new Vector3d(point.frame(), point.slow(), point.fast());
        });

        var result = new ScanBatch(mocked).hkl(5, 6);
        assertEquals(1, result.failureCount());
        assertArrayEquals(new double[] { 1, 5, 6 }, result.row(1), 0.0);
        assertTrue(Double.isNaN(result.row(2)[0]));
        verify(mocked, times(3)).hkl(any(PixelPoint.class));
    }

    @Test
    public void testPixelOnOriginRecorded() {
        var z = new double[] { 0, 0, 1 };
        var accessor = SnapshotNodeAccessor.builder()
                                           .group("/entry", GeometryModel.NX_ENTRY)
                                           .group("/entry/instrument", GeometryModel.NX_INSTRUMENT)
                                           .group("/entry/instrument/detector", GeometryModel.NX_DETECTOR,
                                                  "distance")
                                           .translation("/entry/instrument/detector/distance", z, "mm", ".", 0,
                                                        100, 200)
                                           .group("/entry/instrument/detector/module",
                                                  GeometryModel.NX_DETECTOR_MODULE)
                                           .data("/entry/instrument/detector/module/data_size", null, 10, 10)
                                           .translation("/entry/instrument/detector/module/module_offset",
                                                        new double[] { 1, 0, 0 }, "mm",
                                                        "/entry/instrument/detector/distance", 0)
                                           .translation("/entry/instrument/detector/module/fast_pixel_direction",
                                                        new double[] { 1, 0, 0 }, "mm", "module_offset", 0.1)
                                           .translation("/entry/instrument/detector/module/slow_pixel_direction",
                                                        new double[] { 0, -1, 0 }, "mm", "module_offset", 0.1)
                                           .group("/entry/sample", GeometryModel.NX_SAMPLE)
                                           .group("/entry/sample/beam", GeometryModel.NX_BEAM)
                                           .data("/entry/sample/beam/incident_wavelength", "angstrom", 1.0)
                                           .build();
        var flat = GeometryModel.load(accessor);
        assertEquals(3, flat.scanLength());

        var result = new ScanBatch(flat, false).q(0, 0);
        assertEquals(1, result.failureCount());
        assertInstanceOf(DegenerateDirectionException.class, result.failures().get(0));
        for (var value : result.row(0)) {
            assertTrue(Double.isNaN(value));
        }
        // forward scattering: the origin pixel sits on the beam axis
        assertTrue(result.succeeded(1));
        assertArrayEquals(new double[] { 0, 0, 0 }, result.row(1), 1e-12);
        assertTrue(result.succeeded(2));
        assertArrayEquals(new double[] { 0, 0, 0 }, result.row(2), 1e-12);
    }
}
