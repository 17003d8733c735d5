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
import com.hellblazer.reciprocity.common.Units;
import com.hellblazer.reciprocity.exceptions.IndexOutOfRangeException;
import com.hellblazer.reciprocity.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix4d;
import javax.vecmath.Vector3d;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts one chain link at one scan point into a 4x4 homogeneous transform. Rotations are normalized to
 * radians, lengths to millimetres.
 * <p>
 * Rotation: <code>T(offset) * R(axis, angle)</code>, so the child frame's origin sits on the offset point and
 * the axis passes through it. Translation: <code>T(offset + value * axis)</code>. Unrecognized links, units and
 * degenerate axes are recovered locally with a warning, logged once per link and problem.
 *
 * @author hal.hildebrand
 */
public class OperationResolver {
    private static final Logger log = LoggerFactory.getLogger(OperationResolver.class);

    /**
     * Select the raw value of a link for a scan point
     *
     * @param operation  the link
     * @param scanIndex  the scan point
     * @param scanLength the number of scan points
     * @return the single value when one is stored, else the value at the scan index
     * @throws ShapeMismatchException   if the link stores neither 1 nor scanLength values
     * @throws IndexOutOfRangeException if scanIndex is outside [0, scanLength)
     */
    static double select(TransformOperation operation, int scanIndex, int scanLength) {
        if (scanLength < 1) {
            throw new IllegalArgumentException("Scan length must be positive: " + scanLength);
        }
        if (scanIndex < 0 || scanIndex >= scanLength) {
            throw new IndexOutOfRangeException("Scan", scanIndex, scanLength);
        }
        var size = operation.size();
        if (size == 1) {
            return operation.values()[0];
        }
        if (size != scanLength) {
            throw new ShapeMismatchException(operation.path(), size, scanLength);
        }
        return operation.values()[scanIndex];
    }

    private final Set<String> warned = ConcurrentHashMap.newKeySet();

    /**
     * Resolve a link at a scan point
     *
     * @param operation  the link
     * @param scanIndex  the scan point
     * @param scanLength the number of scan points
     * @return a new 4x4 transform
     */
    public Matrix4d resolve(TransformOperation operation, int scanIndex, int scanLength) {
        return switch (operation.kind()) {
            case ROTATION -> rotation(operation, select(operation, scanIndex, scanLength));
            case TRANSLATION -> translation(operation, select(operation, scanIndex, scanLength));
            case UNRECOGNIZED -> {
                warnOnce(operation.path(), "kind", "Transformation type of '{}' not recognized, using identity",
                         operation.path());
                yield Affine.identity();
            }
        };
    }

    /**
     * The link's offset in millimetres. A blank offset unit means the value unit for translations and
     * millimetres for rotations.
     */
    Vector3d offsetMillimetres(TransformOperation operation) {
        var label = operation.offsetUnits();
        if (Units.isBlank(label)) {
            if (operation.kind() != TransformKind.TRANSLATION) {
                return operation.offset();
            }
            label = operation.units();
        }
        var offset = operation.offset();
        offset.scale(millimetres(operation, label, "offset"));
        return offset;
    }

    private Vector3d direction(TransformOperation operation) {
        var axis = operation.axis();
        if (!(axis.length() > Affine.ZERO_LENGTH)) {
            warnOnce(operation.path(), "axis", "Zero length axis on '{}', using identity", operation.path());
            return null;
        }
        return Affine.unit(axis);
    }

    private double millimetres(TransformOperation operation, String label, String field) {
        var multiplier = Units.millimetresPer(label);
        if (multiplier.isPresent()) {
            return multiplier.getAsDouble();
        }
        warnOnce(operation.path(), field + ":" + label, "Unknown {} units '{}' on '{}', assuming mm", field, label,
                 operation.path());
        return 1.0;
    }

    private Matrix4d rotation(TransformOperation operation, double value) {
        var axis = direction(operation);
        if (axis == null) {
            return Affine.identity();
        }
        var unit = Units.angleUnit(operation.units());
        if (unit == Units.AngleUnit.UNKNOWN) {
            warnOnce(operation.path(), "units:" + operation.units(),
                     "Incorrect rotation units '{}' on '{}', assuming degrees", operation.units(), operation.path());
        }
        var matrix = Affine.rotation(axis, unit.toRadians(value));
        matrix.setTranslation(offsetMillimetres(operation));
        return matrix;
    }

    private Matrix4d translation(TransformOperation operation, double value) {
        var axis = direction(operation);
        if (axis == null) {
            return Affine.identity();
        }
        var delta = offsetMillimetres(operation);
        delta.scaleAdd(value * millimetres(operation, operation.units(), "translation"), axis, delta);
        return Affine.translation(delta);
    }

    private void warnOnce(String path, String problem, String format, Object... arguments) {
        if (warned.add(path + '|' + problem)) {
            log.warn(format, arguments);
        } else if (log.isDebugEnabled()) {
            log.debug(format, arguments);
        }
    }
}
