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

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.Locale;
import java.util.Objects;

/**
 * Static helpers for 4x4 homogeneous transforms and 3-vectors in double precision.
 *
 * @author hal.hildebrand
 */
public final class Affine {

    /**
     * Tolerance below which an axis is considered zero length
     */
    public static final double ZERO_LENGTH = 1e-12;

    /**
     * Apply a homogeneous transform to a point, translation included
     *
     * @param transform the 4x4 transform
     * @param point     the point, not modified
     * @return the transformed point
     */
    public static Point3d apply(Matrix4d transform, Tuple3d point) {
        var result = new Point3d(point);
        transform.transform(result);
        return result;
    }

    /**
     * @return a new 4x4 identity
     */
    public static Matrix4d identity() {
        var m = new Matrix4d();
        m.setIdentity();
        return m;
    }

    /**
     * Build a 3x3 matrix from nine row-major values
     */
    public static Matrix3d matrix3(double[] rowMajor) {
        Objects.requireNonNull(rowMajor, "rowMajor");
        if (rowMajor.length != 9) {
            throw new IllegalArgumentException("3x3 matrix requires 9 values, got " + rowMajor.length);
        }
        return new Matrix3d(rowMajor);
    }

    /**
     * Rodrigues rotation about a unit axis through the origin
     *
     * @param axis    the rotation axis, must be unit length
     * @param radians the right handed rotation angle
     * @return the 4x4 rotation
     */
    public static Matrix4d rotation(Vector3d axis, double radians) {
        var nx = axis.x;
        var ny = axis.y;
        var nz = axis.z;
        var cos = Math.cos(radians);
        var sin = Math.sin(radians);
        var oneMCos = 1 - cos;

        var r = new Matrix3d(cos + nx * nx * oneMCos, nx * ny * oneMCos - nz * sin, nx * nz * oneMCos + ny * sin,
                             ny * nx * oneMCos + nz * sin, cos + ny * ny * oneMCos, ny * nz * oneMCos - nx * sin,
                             nz * nx * oneMCos - ny * sin, nz * ny * oneMCos + nx * sin, cos + nz * nz * oneMCos);
        var m = new Matrix4d();
        m.set(r);
        return m;
    }

    /**
     * The upper left 3x3 block, without any orthonormalization
     */
    public static Matrix3d rotationPart(Matrix4d transform) {
        var r = new Matrix3d();
        transform.getRotationScale(r);
        return r;
    }

    /**
     * Render a matrix as rows of fixed precision numbers, one row per line
     */
    public static String format(Matrix4d m) {
        var sb = new StringBuilder();
        for (int row = 0; row < 4; row++) {
            sb.append('[');
            for (int col = 0; col < 4; col++) {
                if (col > 0) {
                    sb.append(", ");
                }
                sb.append(String.format(Locale.ROOT, "%9.4f", m.getElement(row, col)));
            }
            sb.append("]\n");
        }
        return sb.toString();
    }

    /**
     * @return the components of the tuple as a new array
     */
    public static double[] toArray(Tuple3d t) {
        return new double[] { t.x, t.y, t.z };
    }

    /**
     * Pure translation
     */
    public static Matrix4d translation(Vector3d delta) {
        var m = identity();
        m.setTranslation(delta);
        return m;
    }

    /**
     * @return the unit vector along v
     * @throws IllegalArgumentException if v has zero length
     */
    public static Vector3d unit(Tuple3d v) {
        var u = new Vector3d(v);
        var length = u.length();
        if (!(length > ZERO_LENGTH)) {
            throw new IllegalArgumentException("Cannot normalize zero length vector " + v);
        }
        u.scale(1.0 / length);
        return u;
    }

    /**
     * Build a 3-vector from an array
     *
     * @throws IllegalArgumentException if the array does not hold exactly three values
     */
    public static Vector3d vector(double[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length != 3) {
            throw new IllegalArgumentException("3-vector requires 3 values, got " + values.length);
        }
        return new Vector3d(values[0], values[1], values[2]);
    }

    private Affine() {
    }
}
