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

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a stored hierarchy. Implementations return immutable records and must tolerate concurrent
 * reads for the lifetime of an analysis session.
 *
 * @author hal.hildebrand
 */
public interface NodeAccessor {

    /**
     * The paths of the direct children of a group, in storage order
     *
     * @param groupPath the absolute path of the group
     * @return the child paths, empty if the group has none or does not exist
     */
    List<String> children(String groupPath);

    /**
     * @return true if a node exists at the path
     */
    default boolean exists(String path) {
        return find(path).isPresent();
    }

    /**
     * Look up the record at a path
     *
     * @param path the absolute path
     * @return the record, or empty if no node exists at the path
     */
    Optional<NodeRecord> find(String path);
}
