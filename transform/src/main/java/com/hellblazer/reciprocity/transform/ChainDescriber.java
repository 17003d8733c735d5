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

import java.util.Locale;

/**
 * Human readable rendering of a resolved chain, for diagnostics.
 *
 * @author hal.hildebrand
 */
public final class ChainDescriber {

    /**
     * Describe every link of a chain at a scan point, followed by the composed transform
     */
    public static String describe(TransformChain chain, int scanIndex) {
        var sb = new StringBuilder();
        sb.append(chain.startPath()).append(" @ ").append(scanIndex).append('/').append(chain.size()).append('\n');
        if (chain.isEmpty()) {
            sb.append("  (no transformations)\n");
        }
        for (var operation : chain.operations()) {
            sb.append("  ").append(describe(operation, scanIndex, chain.size())).append('\n');
        }
        sb.append(Affine.format(chain.matrix(scanIndex)));
        return sb.toString();
    }

    /**
     * Describe one link at a scan point
     */
    public static String describe(TransformOperation operation, int scanIndex, int scanLength) {
        var axis = operation.axis();
        var vector = String.format(Locale.ROOT, "(%.4g, %.4g, %.4g)", axis.x, axis.y, axis.z);
        return switch (operation.kind()) {
            case ROTATION -> String.format(Locale.ROOT, "Rotating about %s by %.6g %s | %s", vector,
                                           operation.valueAt(scanIndex, scanLength), operation.units(),
                                           operation.path());
            case TRANSLATION -> String.format(Locale.ROOT, "Translating along %s by %.6g %s | %s", vector,
                                              operation.valueAt(scanIndex, scanLength), operation.units(),
                                              operation.path());
            case UNRECOGNIZED -> "Unrecognized transformation (identity) | " + operation.path();
        };
    }

    private ChainDescriber() {
    }
}
