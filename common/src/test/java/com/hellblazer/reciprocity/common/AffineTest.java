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

import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class AffineTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testRotationAboutZ() {
        var m = Affine.rotation(new Vector3d(0, 0, 1), Math.PI / 2);
        var p = Affine.apply(m, new Point3d(1, 0, 0));
        assertEquals(0.0, p.x, EPSILON);
        assertEquals(1.0, p.y, EPSILON);
        assertEquals(0.0, p.z, EPSILON);
    }

    @Test
    public void testRotationIsOrthonormal() {
        var axis = Affine.unit(new Vector3d(1, 2, 3));
        var r = Affine.rotationPart(Affine.rotation(axis, 0.7));
        assertEquals(1.0, r.determinant(), EPSILON);
        var rt = new Matrix3d(r);
        rt.transpose();
        rt.mul(r);
        var identity = new Matrix3d();
        identity.setIdentity();
        assertTrue(identity.epsilonEquals(rt, EPSILON));
    }

    @Test
    public void testTranslation() {
        var m = Affine.translation(new Vector3d(1, -2, 3));
        var p = Affine.apply(m, new Point3d(1, 1, 1));
        assertEquals(new Point3d(2, -1, 4), p);
        assertEquals(1.0, Affine.rotationPart(m).determinant(), EPSILON);
    }

    @Test
    public void testApplyDoesNotModifyArgument() {
        var point = new Point3d(1, 2, 3);
        Affine.apply(Affine.translation(new Vector3d(5, 5, 5)), point);
        assertEquals(new Point3d(1, 2, 3), point);
    }

    @Test
    public void testUnit() {
        var u = Affine.unit(new Vector3d(0, 3, 4));
        assertEquals(1.0, u.length(), EPSILON);
        assertEquals(0.6, u.y, EPSILON);
        assertThrows(IllegalArgumentException.class, () -> Affine.unit(new Vector3d()));
    }

    @Test
    public void testVectorAndMatrixShapes() {
        assertEquals(new Vector3d(1, 2, 3), Affine.vector(new double[] { 1, 2, 3 }));
        assertThrows(IllegalArgumentException.class, () -> Affine.vector(new double[] { 1, 2 }));
        assertThrows(IllegalArgumentException.class, () -> Affine.matrix3(new double[4]));
        var m = Affine.matrix3(new double[] { 1, 2, 3, 4, 5, 6, 7, 8, 10 });
        assertEquals(6.0, m.getElement(1, 2), 0.0);
    }

    @Test
    public void testFormat() {
        Matrix4d identity = Affine.identity();
        var text = Affine.format(identity);
        assertEquals(4, text.lines().count());
        assertTrue(text.startsWith("[   1.0000,    0.0000"));
    }
}
