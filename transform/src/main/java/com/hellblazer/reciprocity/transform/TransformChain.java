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
package com.hellblazer.reciprocity.transform;

import com.hellblazer.reciprocity.common.Affine;
import com.hellblazer.reciprocity.exceptions.IndexOutOfRangeException;

import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import java.util.List;
import java.util.Objects;

/**
 * A resolved transformation chain: its links and one composed transform per scan point. Immutable; every
 * matrix handed out is a copy.
 *
 * @author hal.hildebrand
 */
public final class TransformChain {

    private final String                   startPath;
    private final List<TransformOperation> operations;
    private final int                      scanLength;
    private final Matrix4d[]               composed;

    TransformChain(String startPath, List<TransformOperation> operations, int scanLength, Matrix4d[] composed) {
        this.startPath = Objects.requireNonNull(startPath, "startPath");
        this.operations = List.copyOf(operations);
        this.scanLength = scanLength;
        this.composed = composed;
    }

    /**
     * A chain with no links: the identity at every scan point
     */
    public static TransformChain identity(String startPath, int scanLength) {
        var composed = new Matrix4d[scanLength];
        for (int i = 0; i < scanLength; i++) {
            composed[i] = Affine.identity();
        }
        return new TransformChain(startPath, List.of(), scanLength, composed);
    }

    /**
     * @return true if the chain has no links
     */
    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * The composed transform at a scan point
     *
     * @param scanIndex the scan point
     * @return a copy of the composed transform
     * @throws IndexOutOfRangeException if the index is outside the resolved scan
     */
    public Matrix4d matrix(int scanIndex) {
        return new Matrix4d(composed[check(scanIndex)]);
    }

    public List<TransformOperation> operations() {
        return operations;
    }

    /**
     * @return the position of the chain's local origin at a scan point
     */
    public Point3d origin(int scanIndex) {
        return transform(new Point3d(), scanIndex);
    }

    /**
     * A chain whose every composed transform is premultiplied by a fixed frame change
     *
     * @param frame the transform applied after the chain
     * @return the new chain
     */
    public TransformChain prepend(Matrix4d frame) {
        var framed = new Matrix4d[scanLength];
        for (int i = 0; i < scanLength; i++) {
            framed[i] = new Matrix4d(frame);
            framed[i].mul(composed[i]);
        }
        return new TransformChain(startPath, operations, scanLength, framed);
    }

    /**
     * @return the number of scan points the chain was resolved over
     */
    public int size() {
        return scanLength;
    }

    public String startPath() {
        return startPath;
    }

    @Override
    public String toString() {
        return "TransformChain[" + startPath + ", links=" + operations.size() + ", points=" + scanLength + "]";
    }

    /**
     * Apply the composed transform at a scan point to a position
     *
     * @param point     the position, in the chain's local frame
     * @param scanIndex the scan point
     * @return the position in the chain's root frame
     */
    public Point3d transform(Tuple3d point, int scanIndex) {
        return Affine.apply(composed[check(scanIndex)], point);
    }

    private int check(int scanIndex) {
        if (scanIndex < 0 || scanIndex >= scanLength) {
            throw new IndexOutOfRangeException("Scan", scanIndex, scanLength);
        }
        return scanIndex;
    }
}
