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
import com.hellblazer.reciprocity.exceptions.MissingFieldException;
import com.hellblazer.reciprocity.transform.DataNode;
import com.hellblazer.reciprocity.transform.GroupNode;
import com.hellblazer.reciprocity.transform.NodeAccessor;
import com.hellblazer.reciprocity.transform.NodePaths;

import javax.vecmath.Matrix3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Data field and child group lookups shared by the component loaders.
 *
 * @author hal.hildebrand
 */
final class Fields {

    static List<String> childGroups(NodeAccessor accessor, String groupPath, String nxClass) {
        var found = new ArrayList<String>();
        for (var child : accessor.children(groupPath)) {
            accessor.find(child)
                    .filter(r -> r instanceof GroupNode g && g.isA(nxClass))
                    .ifPresent(r -> found.add(child));
        }
        return found;
    }

    static Optional<DataNode> data(NodeAccessor accessor, String groupPath, String name) {
        return accessor.find(NodePaths.join(groupPath, name))
                       .filter(DataNode.class::isInstance)
                       .map(DataNode.class::cast);
    }

    static Optional<String> firstChildGroup(NodeAccessor accessor, String groupPath, String nxClass) {
        return childGroups(accessor, groupPath, nxClass).stream().findFirst();
    }

    static int[] ints(NodeAccessor accessor, String groupPath, String name, int[] defaultValue) {
        var field = data(accessor, groupPath, name);
        if (field.isEmpty()) {
            return defaultValue.clone();
        }
        var values = field.get().values();
        if (values.length != defaultValue.length) {
            throw new MissingFieldException(groupPath, "%s requires %d values, found %d".formatted(name,
                                                                                               defaultValue.length,
                                                                                               values.length));
        }
        var result = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (int) Math.round(values[i]);
        }
        return result;
    }

    static Optional<Matrix3d> matrix(NodeAccessor accessor, String groupPath, String name) {
        return data(accessor, groupPath, name).map(field -> {
            var values = field.values();
            if (values.length != 9) {
                throw new MissingFieldException(groupPath,
                                                "%s requires a 3x3 matrix, found %d values".formatted(name,
                                                                                                       values.length));
            }
            return Affine.matrix3(values);
        });
    }

    static double[] values(NodeAccessor accessor, String groupPath, String name, double[] defaultValue) {
        var field = data(accessor, groupPath, name);
        if (field.isEmpty()) {
            return defaultValue.clone();
        }
        var values = field.get().values();
        if (values.length != defaultValue.length) {
            throw new MissingFieldException(groupPath, "%s requires %d values, found %d".formatted(name,
                                                                                               defaultValue.length,
                                                                                               values.length));
        }
        return values;
    }

    private Fields() {
    }
}
