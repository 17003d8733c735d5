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
package com.hellblazer.reciprocity.exceptions;

/**
 * A matrix that must be inverted to recover Miller indices is singular within tolerance.
 *
 * @author hal.hildebrand
 */
public final class DegenerateLatticeException extends GeometryException {

    private final double determinant;

    public DegenerateLatticeException(String what, double determinant) {
        super("Cannot invert %s: determinant %g is below tolerance".formatted(what, determinant));
        this.determinant = determinant;
    }

    public double getDeterminant() {
        return determinant;
    }
}
