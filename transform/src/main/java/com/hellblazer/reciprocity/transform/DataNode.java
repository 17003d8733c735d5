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
 * A plain numeric field, such as a wavelength or a flattened (row-major) matrix.
 *
 * @param path   absolute path of the field
 * @param values the values, flattened
 * @param units  unit label, may be blank
 * @author hal.hildebrand
 */
public record DataNode(String path, double[] values, String units) implements NodeRecord {

    public DataNode {
        Objects.requireNonNull(path, "path");
        values = values == null ? new double[0] : values.clone();
        units = units == null ? "" : units;
    }

    /**
     * @return the first value
     * @throws IllegalStateException if the field is empty
     */
    public double first() {
        if (values.length == 0) {
            throw new IllegalStateException("Empty field: " + path);
        }
        return values[0];
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DataNode other && path.equals(other.path) && Arrays.equals(values, other.values)
        && units.equals(other.units);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, Arrays.hashCode(values), units);
    }

    @Override
    public String toString() {
        return "DataNode[" + path + "=" + Arrays.toString(values) + " " + units + "]";
    }
}
