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

import com.hellblazer.reciprocity.exceptions.InvalidConfigurationException;

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * An immutable change of basis from instrument axes to lab (or display) axes, supplied explicitly when a
 * {@link GeometryModel} is built. Only proper rotations are accepted, so lengths, angles and Miller indices
 * are unchanged by the choice of frame.
 *
 * @author hal.hildebrand
 */
public final class LabFrame {

    private static final double   TOLERANCE = 1e-9;
    private static final LabFrame IDENTITY  = new LabFrame(identity3());

    public static LabFrame identity() {
        return IDENTITY;
    }

    /**
     * A frame from a rotation matrix
     *
     * @param rotation maps instrument coordinates to lab coordinates
     * @throws InvalidConfigurationException if the matrix is not a proper rotation
     */
    public static LabFrame of(Matrix3d rotation) {
        var transpose = new Matrix3d(rotation);
        transpose.transpose();
        transpose.mul(rotation);
        if (!identity3().epsilonEquals(transpose, TOLERANCE)
        || Math.abs(rotation.determinant() - 1.0) > TOLERANCE) {
            throw new InvalidConfigurationException("Lab frame must be a proper rotation: " + rotation);
        }
        return new LabFrame(new Matrix3d(rotation));
    }

    /**
     * A frame in which the lab axes are the supplied instrument directions
     *
     * @param x instrument direction that becomes lab x
     * @param y instrument direction that becomes lab y
     * @param z instrument direction that becomes lab z
     */
    public static LabFrame ofAxes(Vector3d x, Vector3d y, Vector3d z) {
        var m = new Matrix3d();
        m.setRow(0, x);
        m.setRow(1, y);
        m.setRow(2, z);
        return of(m);
    }

    private static Matrix3d identity3() {
        var m = new Matrix3d();
        m.setIdentity();
        return m;
    }

    private final Matrix3d rotation;

    private LabFrame(Matrix3d rotation) {
        this.rotation = rotation;
    }

    /**
     * @return the direction expressed in lab axes
     */
    public Vector3d apply(Tuple3d instrument) {
        var v = new Vector3d(instrument);
        rotation.transform(v);
        return v;
    }

    public boolean isIdentity() {
        return identity3().epsilonEquals(rotation, 0.0);
    }

    /**
     * @return a copy of the rotation
     */
    public Matrix3d rotation() {
        return new Matrix3d(rotation);
    }

    /**
     * @return the frame change as a homogeneous transform
     */
    public Matrix4d toMatrix4d() {
        var m = new Matrix4d();
        m.set(rotation);
        return m;
    }

    @Override
    public String toString() {
        return isIdentity() ? "LabFrame[identity]" : "LabFrame[" + rotation + "]";
    }
}
