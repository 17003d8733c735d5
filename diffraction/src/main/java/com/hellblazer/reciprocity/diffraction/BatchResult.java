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

import com.hellblazer.reciprocity.exceptions.GeometryException;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per scan point results of a batch evaluation. Failed points hold NaN and keep their error.
 *
 * @param values   one (x, y, z) row per scan point
 * @param failures the error of each failed scan point, by index
 * @author hal.hildebrand
 */
public record BatchResult(double[][] values, Map<Integer, GeometryException> failures) {

    public BatchResult {
        values = copy(values);
        failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    private static double[][] copy(double[][] values) {
        var copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    public int failureCount() {
        return failures.size();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    /**
     * @return true if the scan point produced a value
     */
    public boolean succeeded(int scanIndex) {
        return !failures.containsKey(scanIndex);
    }

    public int size() {
        return values.length;
    }

    /**
     * @return a copy of every row
     */
    @Override
    public double[][] values() {
        return copy(values);
    }

    /**
     * @return a copy of one scan point's row
     */
    public double[] row(int scanIndex) {
        return values[scanIndex].clone();
    }
}
