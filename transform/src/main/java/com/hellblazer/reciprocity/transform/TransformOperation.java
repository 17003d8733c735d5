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

import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Objects;

/**
 * One link of a transformation chain, interpreted from its stored record. Built fresh on every resolution and
 * never mutated.
 *
 * @param path        absolute path of the link
 * @param kind        the operation performed
 * @param axis        rotation axis or translation direction, as stored
 * @param offset      fixed offset, as stored
 * @param offsetUnits unit label of the offset
 * @param units       unit label of the values
 * @param values      one value, or one per scan point
 * @param dependsOn   the parent reference
 * @author hal.hildebrand
 */
public record TransformOperation(String path, TransformKind kind, Vector3d axis, Vector3d offset, String offsetUnits,
                                 String units, double[] values, String dependsOn) {

    public TransformOperation {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        axis = new Vector3d(Objects.requireNonNull(axis, "axis"));
        offset = new Vector3d(Objects.requireNonNull(offset, "offset"));
        offsetUnits = offsetUnits == null ? "" : offsetUnits;
        units = units == null ? "" : units;
        values = Objects.requireNonNull(values, "values").clone();
        dependsOn = dependsOn == null ? NodePaths.TERMINAL : dependsOn;
    }

    /**
     * Interpret a stored record as a chain link. A plain data field reached through a parent reference becomes an
     * unrecognized link that ends the chain.
     *
     * @param record a transform or data record
     * @return the link
     * @throws IllegalArgumentException if the record is a group
     */
    public static TransformOperation from(NodeRecord record) {
        if (record instanceof TransformNode node) {
            return new TransformOperation(node.path(), TransformKind.parse(node.transformationType()),
                                          Affine.vector(node.vector()), Affine.vector(node.offset()),
                                          node.offsetUnits(), node.units(), node.values(), node.dependsOn());
        }
        if (record instanceof DataNode data) {
            return new TransformOperation(data.path(), TransformKind.UNRECOGNIZED, new Vector3d(1, 0, 0),
                                          new Vector3d(), "", data.units(), data.values(), NodePaths.TERMINAL);
        }
        throw new IllegalArgumentException("Not a transformation: " + record);
    }

    @Override
    public Vector3d axis() {
        return new Vector3d(axis);
    }

    @Override
    public Vector3d offset() {
        return new Vector3d(offset);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    /**
     * @return the number of stored values
     */
    public int size() {
        return values.length;
    }

    /**
     * The raw value for a scan point, broadcasting a single value to every point
     *
     * @param scanIndex  the scan point
     * @param scanLength the scan length the values must agree with
     * @return the stored value, in stored units
     * @throws com.hellblazer.reciprocity.exceptions.ShapeMismatchException if the value count is neither 1 nor
     *                                                                      the scan length
     */
    public double valueAt(int scanIndex, int scanLength) {
        return OperationResolver.select(this, scanIndex, scanLength);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TransformOperation other && path.equals(other.path) && kind == other.kind
        && axis.equals(other.axis) && offset.equals(other.offset) && offsetUnits.equals(other.offsetUnits)
        && units.equals(other.units) && Arrays.equals(values, other.values) && dependsOn.equals(other.dependsOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, kind, axis, offset, offsetUnits, units, Arrays.hashCode(values), dependsOn);
    }

    @Override
    public String toString() {
        return "TransformOperation[%s %s axis=%s values=%d %s]".formatted(path, kind, axis, values.length, units);
    }
}
