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

import java.util.Locale;

/**
 * The closed set of operations a chain link can perform.
 *
 * @author hal.hildebrand
 */
public enum TransformKind {
    ROTATION, TRANSLATION,
    /**
     * Any other <code>transformation_type</code>. Resolves to the identity so the chain stays composable.
     */
    UNRECOGNIZED;

    /**
     * Classify a stored <code>transformation_type</code> value
     */
    public static TransformKind parse(String transformationType) {
        if (transformationType == null) {
            return UNRECOGNIZED;
        }
        return switch (transformationType.strip().toLowerCase(Locale.ROOT)) {
            case "rotation" -> ROTATION;
            case "translation" -> TRANSLATION;
            default -> UNRECOGNIZED;
        };
    }
}
