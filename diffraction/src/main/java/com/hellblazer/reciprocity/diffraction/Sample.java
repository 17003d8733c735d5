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

import com.hellblazer.reciprocity.common.Affine;
import com.hellblazer.reciprocity.transform.ChainComposer;
import com.hellblazer.reciprocity.transform.NodePaths;
import com.hellblazer.reciprocity.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Objects;

/**
 * The sample: its lattice, orientation, UB matrix and the chain that rotates it through the scan.
 *
 * @author hal.hildebrand
 */
public final class Sample {

    public static final String UNIT_CELL          = "unit_cell";
    public static final String ORIENTATION_MATRIX = "orientation_matrix";
    public static final String UB_MATRIX          = "ub_matrix";

    private static final Logger log = LoggerFactory.getLogger(Sample.class);

    /**
     * Load a sample group. Absent lattice fields take the default cell, an identity orientation and the B matrix
     * of the cell.
     *
     * @param composer   resolves the sample's chain
     * @param path       the sample group
     * @param scanLength the number of scan points the model resolves over
     * @param labFrame   the frame the chain is expressed in
     * @param calculator the reciprocal space calculator
     * @return the sample
     */
    public static Sample load(ChainComposer composer, String path, int scanLength, LabFrame labFrame,
                              ReciprocalSpaceCalculator calculator) {
        var accessor = composer.getWalker().getAccessor();
        var unitCell = Fields.values(accessor, path, UNIT_CELL, Lattice.DEFAULT_CELL);
        var orientation = Fields.matrix(accessor, path, ORIENTATION_MATRIX).orElseGet(() -> {
            var identity = new Matrix3d();
            identity.setIdentity();
            return identity;
        });
        var ub = Fields.matrix(accessor, path, UB_MATRIX).orElseGet(() -> Lattice.bMatrix(unitCell));
        var chain = composer.chain(path, scanLength).prepend(labFrame.toMatrix4d());
        var sample = new Sample(path, unitCell, orientation, ub, chain, calculator);
        log.debug("Loaded {}", sample);
        return sample;
    }

    private final ReciprocalSpaceCalculator calculator;
    private final TransformChain            chain;
    private final Matrix3d                  orientation;
    private final String                    path;
    private final Matrix3d                  ub;
    private final double[]                  unitCell;

    public Sample(String path, double[] unitCell, Matrix3d orientation, Matrix3d ub, TransformChain chain,
                  ReciprocalSpaceCalculator calculator) {
        this.path = Objects.requireNonNull(path, "path");
        this.unitCell = unitCell.clone();
        this.orientation = new Matrix3d(orientation);
        this.ub = new Matrix3d(ub);
        this.chain = Objects.requireNonNull(chain, "chain");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
    }

    public TransformChain chain() {
        return chain;
    }

    /**
     * Miller indices of a scattering vector measured at a scan point
     */
    public Vector3d hkl(Tuple3d q, int scanIndex) {
        return calculator.hkl(q, rotation(scanIndex), ub);
    }

    /**
     * Scattering vector of a reflection at a scan point: Q = R 2 pi UB hkl
     *
     * @param hkl       Miller indices
     * @param scanIndex the scan point whose sample rotation R applies
     * @return Q in inverse Angstrom, in lab axes
     */
    public Vector3d hklToQ(Tuple3d hkl, int scanIndex) {
        return calculator.hklToQ(hkl, rotation(scanIndex), ub);
    }

    /**
     * @return the name of the sample group
     */
    public String name() {
        return NodePaths.name(path);
    }

    public Matrix3d orientation() {
        return new Matrix3d(orientation);
    }

    public String path() {
        return path;
    }

    /**
     * @return the sample position at a scan point
     */
    public Point3d position(int scanIndex) {
        return chain.origin(scanIndex);
    }

    /**
     * @return the rotation part of the sample's composed chain at a scan point
     */
    public Matrix3d rotation(int scanIndex) {
        return Affine.rotationPart(chain.matrix(scanIndex));
    }

    @Override
    public String toString() {
        return "Sample[%s, cell=%s, links=%d, points=%d]".formatted(path, Arrays.toString(unitCell),
                                                                   chain.operations().size(), chain.size());
    }

    public Matrix3d ub() {
        return new Matrix3d(ub);
    }

    public double[] unitCell() {
        return unitCell.clone();
    }
}
