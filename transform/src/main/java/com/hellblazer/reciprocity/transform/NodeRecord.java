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

/**
 * An immutable record returned by a {@link NodeAccessor} for one path of the stored hierarchy.
 *
 * @author hal.hildebrand
 */
public sealed interface NodeRecord permits TransformNode, GroupNode, DataNode {

    /**
     * @return the absolute path of the node
     */
    String path();

    /**
     * @return the last segment of the path
     */
    default String name() {
        return NodePaths.name(path());
    }
}
