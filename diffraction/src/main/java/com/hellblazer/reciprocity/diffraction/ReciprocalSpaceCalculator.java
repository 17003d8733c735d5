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
import com.hellblazer.reciprocity.exceptions.DegenerateLatticeException;

import javax.vecmath.Matrix3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * Scattering vector and Miller index calculations. UB matrices are stored without the 2 pi factor and scaled
 * here, so Q is in inverse Angstrom.
 *
 * @author hal.hildebrand
 */
public class ReciprocalSpaceCalculator {

    private static final double TWO_PI = 2 * Math.PI;

    private final double singularTolerance;

    public ReciprocalSpaceCalculator() {
        this(GeometryConfig.defaults());
    }

    public ReciprocalSpaceCalculator(GeometryConfig config) {
        this.singularTolerance = config.getSingularTolerance();
    }

    /**
     * Miller indices of a scattering vector: <code>inverse(2 pi UB) * inverse(R) * Q</code>
     *
     * @param q        the scattering vector
     * @param rotation the sample rotation R
     * @param ub       the UB matrix, without 2 pi
     * @return (h, k, l)
     * @throws DegenerateLatticeException if R or 2 pi UB is singular within tolerance
     */
    public Vector3d hkl(Tuple3d q, Matrix3d rotation, Matrix3d ub) {
        var hphi = new Vector3d(q);
        invert(rotation, "sample rotation").transform(hphi);
        invert(scaled(ub), "UB matrix").transform(hphi);
        return hphi;
    }

    /**
     * Scattering vector of a reflection: <code>R * 2 pi UB * hkl</code>
     *
     * @param hkl      Miller indices
     * @param rotation the sample rotation R
     * @param ub       the UB matrix, without 2 pi
     * @return Q in inverse Angstrom
     */
    public Vector3d hklToQ(Tuple3d hkl, Matrix3d rotation, Matrix3d ub) {
        var q = new Vector3d(hkl);
        scaled(ub).transform(q);
        rotation.transform(q);
        return q;
    }

    /**
     * Q = kf - ki
     */
    public Vector3d scatteringVector(Tuple3d ki, Tuple3d kf) {
        var q = new Vector3d(kf);
        q.sub(ki);
        return q;
    }

    private Matrix3d invert(Matrix3d m, String what) {
        var determinant = m.determinant();
        if (!(Math.abs(determinant) >= singularTolerance) || determinant == 0.0) {
            throw new DegenerateLatticeException(what, determinant);
        }
        var inverse = new Matrix3d(m);
        inverse.invert();
        return inverse;
    }

    private Matrix3d scaled(Matrix3d ub) {
        var m = new Matrix3d(ub);
        m.mul(TWO_PI);
        return m;
    }
}
