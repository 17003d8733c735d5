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

import com.hellblazer.reciprocity.exceptions.IndexOutOfRangeException;
import com.hellblazer.reciprocity.exceptions.MissingFieldException;
import com.hellblazer.reciprocity.transform.ChainComposer;
import com.hellblazer.reciprocity.transform.SnapshotNodeAccessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DetectorModuleTest {

    private ChainComposer composer;
    private DetectorModule module;

    private static void assertTuple(double x, double y, double z, Tuple3d actual) {
        assertEquals(x, actual.x, 1e-9, () -> "x of " + actual);
        assertEquals(y, actual.y, 1e-9, () -> "y of " + actual);
        assertEquals(z, actual.z, 1e-9, () -> "z of " + actual);
    }

    private static SnapshotNodeAccessor.Builder moduleNodes() {
        return SnapshotNodeAccessor.builder()
                                   .group("/det", "NXdetector_module")
                                   .translation("/det/module_offset", new double[] { 0, 0, 1 }, "mm", ".", 100,
                                                200)
                                   .translation("/det/fast_pixel_direction", new double[] { 1, 0, 0 }, "mm",
                                                "module_offset", 0.5)
                                   .translation("/det/slow_pixel_direction", new double[] { 0, 1, 0 }, "mm",
                                                "module_offset", 0.25);
    }

    @BeforeEach
    public void before() {
        composer = new ChainComposer(moduleNodes().data("/det/data_size", null, 4, 8).build());
        module = DetectorModule.load(composer, "/det", DetectorModule.scanLength(composer, "/det"),
                                     LabFrame.identity());
    }

    @Test
    public void testShape() {
        assertEquals(2, DetectorModule.scanLength(composer, "/det"));
        assertArrayEquals(new int[] { 2, 4, 8 }, module.shape());
        assertArrayEquals(new int[] { 0, 0 }, module.dataOrigin());
    }

    @Test
    public void testPixelPositions() {
        assertTuple(0, 0, 100, module.pixelPosition(0, 0, 0));
        assertTuple(1.5, 0.5, 200, module.pixelPosition(1, 2, 3));
        assertTuple(0.25, 0.125, 100, module.pixelPosition(new PixelPoint(0, 0.5, 0.5)));
    }

    @Test
    public void testPixelBounds() {
        assertTuple(4, 1, 100, module.pixelPosition(0, 4, 8));
        assertThrows(IndexOutOfRangeException.class, () -> module.pixelPosition(0, 4.01, 0));
        assertThrows(IndexOutOfRangeException.class, () -> module.pixelPosition(0, 0, -0.5));
        assertThrows(IndexOutOfRangeException.class, () -> module.pixelPosition(0, Double.NaN, 0));
        var e = assertThrows(IndexOutOfRangeException.class, () -> module.pixelPosition(2, 0, 0));
        assertEquals(2, e.getBound());
    }

    @Test
    public void testCorners() {
        var corners = module.corners(0);
        assertEquals(5, corners.size());
        assertEquals(corners.get(0), corners.get(4));
        assertTuple(0, 0, 100, corners.get(0));
        assertTuple(0, 1, 100, corners.get(1));
        assertTuple(4, 1, 100, corners.get(2));
        assertTuple(4, 0, 100, corners.get(3));
    }

    @Test
    public void testDirectionAndWavevector() {
        assertTuple(0, 0, 1, module.pixelDirection(PixelPoint.origin(1)));
        var kf = module.pixelWavevector(new PixelPoint(0, 4, 8), 1.5);
        assertEquals(2 * Math.PI / 1.5, kf.length(), 1e-12);
        var direction = new Vector3d(4, 1, 100);
        direction.normalize();
        assertEquals(1.0, direction.dot(module.pixelDirection(new PixelPoint(0, 4, 8))), 1e-12);
    }

    @Test
    public void testLabFrame() {
        var lab = LabFrame.ofAxes(new Vector3d(0, 0, 1), new Vector3d(1, 0, 0), new Vector3d(0, 1, 0));
        var rotated = DetectorModule.load(composer, "/det", 2, lab);
        assertTuple(100, 0, 0, rotated.pixelPosition(0, 0, 0));
        assertTuple(200, 1.5, 0.5, rotated.pixelPosition(1, 2, 3));
    }

    @Test
    public void testBroadcastAgainstLongerScan() {
        var longer = DetectorModule.load(composer, "/det", 2, LabFrame.identity());
        assertEquals(2, longer.shape()[0]);
        var single = new ChainComposer(SnapshotNodeAccessor.builder()
                                                           .group("/det", "NXdetector_module")
                                                           .translation("/det/module_offset",
                                                                        new double[] { 0, 0, 1 }, "mm", ".", 50)
                                                           .translation("/det/fast_pixel_direction",
                                                                        new double[] { 1, 0, 0 }, "mm",
                                                                        "module_offset", 1)
                                                           .translation("/det/slow_pixel_direction",
                                                                        new double[] { 0, 1, 0 }, "mm",
                                                                        "module_offset", 1)
                                                           .build());
        var broadcast = DetectorModule.load(single, "/det", 4, LabFrame.identity());
        assertArrayEquals(new int[] { 4, 1, 1 }, broadcast.shape());
        assertTuple(1, 1, 50, broadcast.pixelPosition(3, 1, 1));
    }

    @Test
    public void testMalformedSize() {
        var composer = new ChainComposer(moduleNodes().data("/det/data_size", null, 4, 8, 2).build());
        assertThrows(MissingFieldException.class, () -> DetectorModule.load(composer, "/det", 2, LabFrame.identity()));
    }
}
