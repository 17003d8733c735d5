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

import java.util.Arrays;
import java.util.Objects;

/**
 * A stored transformation operation: a value array carrying <code>transformation_type</code>,
 * <code>vector</code>, <code>offset</code>, <code>units</code> and <code>depends_on</code> attributes. The raw
 * attribute strings are kept as stored; interpretation happens in {@link TransformOperation}.
 *
 * @param path               absolute path of the node
 * @param transformationType raw <code>transformation_type</code>, may be blank
 * @param vector             axis or direction, three values, need not be unit length
 * @param offset             fixed offset, three values
 * @param offsetUnits        unit label of the offset, may be blank
 * @param units              unit label of the values
 * @param values             one value, or one per scan point
 * @param dependsOn          parent reference, {@link NodePaths#TERMINAL} ends the chain
 * @author hal.hildebrand
 */
public record TransformNode(String path, String transformationType, double[] vector, double[] offset,
                            String offsetUnits, String units, double[] values, String dependsOn)
implements NodeRecord {

    private static final double[] DEFAULT_VECTOR = { 1, 0, 0 };
    private static final double[] DEFAULT_OFFSET = { 0, 0, 0 };

    public TransformNode {
        Objects.requireNonNull(path, "path");
        transformationType = transformationType == null ? "" : transformationType;
        vector = vector == null ? DEFAULT_VECTOR.clone() : checkTriple("vector", path, vector);
        offset = offset == null ? DEFAULT_OFFSET.clone() : checkTriple("offset", path, offset);
        offsetUnits = offsetUnits == null ? "" : offsetUnits;
        units = units == null ? "" : units;
        values = values == null ? new double[0] : values.clone();
        dependsOn = dependsOn == null || dependsOn.isBlank() ? NodePaths.TERMINAL : dependsOn.strip();
    }

    public static TransformNode rotation(String path, double[] vector, String units, String dependsOn,
                                         double... values) {
        return new TransformNode(path, "rotation", vector, null, null, units, values, dependsOn);
    }

    public static TransformNode translation(String path, double[] vector, String units, String dependsOn,
                                            double... values) {
        return new TransformNode(path, "translation", vector, null, null, units, values, dependsOn);
    }

    private static double[] checkTriple(String field, String path, double[] value) {
        if (value.length != 3) {
            throw new IllegalArgumentException("%s of %s must have 3 values, got %d".formatted(field, path,
                                                                                             value.length));
        }
        return value.clone();
    }

    @Override
    public double[] offset() {
        return offset.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public double[] vector() {
        return vector.clone();
    }

    /**
     * @return the number of stored values
     */
    public int size() {
        return values.length;
    }

    /**
     * @return a copy of this node with a different parent reference
     */
    public TransformNode withDependsOn(String parent) {
        return new TransformNode(path, transformationType, vector, offset, offsetUnits, units, values, parent);
    }

    /**
     * @return a copy of this node with the supplied offset
     */
    public TransformNode withOffset(double[] newOffset, String newOffsetUnits) {
        return new TransformNode(path, transformationType, vector, newOffset, newOffsetUnits, units, values,
                                 dependsOn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransformNode other)) {
            return false;
        }
        return path.equals(other.path) && transformationType.equals(other.transformationType) && Arrays.equals(
        vector, other.vector) && Arrays.equals(offset, other.offset) && offsetUnits.equals(other.offsetUnits)
        && units.equals(other.units) && Arrays.equals(values, other.values) && dependsOn.equals(other.dependsOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, transformationType, Arrays.hashCode(vector), Arrays.hashCode(offset),
                            offsetUnits, units, Arrays.hashCode(values), dependsOn);
    }

    @Override
    public String toString() {
        return "TransformNode[%s %s vector=%s values=%d %s depends_on=%s]".formatted(path, transformationType,
                                                                                    Arrays.toString(vector),
                                                                                    values.length, units,
                                                                                    dependsOn);
    }
}
