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

import com.hellblazer.reciprocity.exceptions.DegenerateLatticeException;

import javax.vecmath.Matrix3d;

/**
 * Unit cell geometry.
 *
 * @author hal.hildebrand
 */
public final class Lattice {

    /**
     * The cell every sample has when none is stored
     */
    public static final double[] DEFAULT_CELL = { 1, 1, 1, 90, 90, 90 };

    /**
     * Busing and Levy B matrix of a unit cell: the reciprocal basis vectors, in inverse Angstrom without the 2
     * pi factor, as the columns of an upper triangular matrix with a* along x
     *
     * @param a     cell length, Angstrom
     * @param b     cell length, Angstrom
     * @param c     cell length, Angstrom
     * @param alpha cell angle, degrees
     * @param beta  cell angle, degrees
     * @param gamma cell angle, degrees
     * @return the B matrix
     * @throws DegenerateLatticeException if the parameters do not describe a cell with volume
     */
    public static Matrix3d bMatrix(double a, double b, double c, double alpha, double beta, double gamma) {
        if (!(a > 0 && b > 0 && c > 0)) {
            throw new IllegalArgumentException("Cell lengths must be positive: %s, %s, %s".formatted(a, b, c));
        }
        var a1 = Math.toRadians(alpha);
        var a2 = Math.toRadians(beta);
        var a3 = Math.toRadians(gamma);

        var beta1 = Math.acos((Math.cos(a2) * Math.cos(a3) - Math.cos(a1)) / (Math.sin(a2) * Math.sin(a3)));
        var beta2 = Math.acos((Math.cos(a1) * Math.cos(a3) - Math.cos(a2)) / (Math.sin(a1) * Math.sin(a3)));
        var beta3 = Math.acos((Math.cos(a1) * Math.cos(a2) - Math.cos(a3)) / (Math.sin(a1) * Math.sin(a2)));

        var b1 = 1 / (a * Math.sin(a2) * Math.sin(beta3));
        var b2 = 1 / (b * Math.sin(a3) * Math.sin(beta1));
        var b3 = 1 / (c * Math.sin(a1) * Math.sin(beta2));

        var bm = new Matrix3d(b1, b2 * Math.cos(beta3), b3 * Math.cos(beta2),
                              0, b2 * Math.sin(beta3), -b3 * Math.sin(beta2) * Math.cos(a1),
                              0, 0, 1 / c);
        var determinant = bm.determinant();
        if (!Double.isFinite(determinant) || determinant <= 0) {
            throw new DegenerateLatticeException("unit cell (%s, %s, %s, %s, %s, %s)".formatted(a, b, c, alpha,
                                                                                               beta, gamma),
                                                 determinant);
        }
        return bm;
    }

    /**
     * B matrix from the six cell parameters (a, b, c, alpha, beta, gamma)
     */
    public static Matrix3d bMatrix(double[] cell) {
        if (cell.length != 6) {
            throw new IllegalArgumentException("Unit cell requires 6 parameters, got " + cell.length);
        }
        return bMatrix(cell[0], cell[1], cell[2], cell[3], cell[4], cell[5]);
    }

    private Lattice() {
    }
}
