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

import java.util.Objects;

/**
 * A group in the stored hierarchy, identified by its NeXus class. A component group may carry a
 * <code>depends_on</code> field naming the head of its transformation chain.
 *
 * @param path      absolute path of the group
 * @param nxClass   the <code>NX_class</code> attribute, may be blank
 * @param dependsOn the parent reference, or null when the group has none
 * @author hal.hildebrand
 */
public record GroupNode(String path, String nxClass, String dependsOn) implements NodeRecord {

    public GroupNode {
        Objects.requireNonNull(path, "path");
        nxClass = nxClass == null ? "" : nxClass;
        dependsOn = dependsOn == null || dependsOn.isBlank() ? null : dependsOn.strip();
    }

    public GroupNode(String path, String nxClass) {
        this(path, nxClass, null);
    }

    /**
     * @return true if the group declares a <code>depends_on</code> field
     */
    public boolean hasDependsOn() {
        return dependsOn != null;
    }

    /**
     * @return true if the group has the supplied NeXus class
     */
    public boolean isA(String className) {
        return nxClass.equals(className);
    }

    /**
     * @return the parent reference, {@link NodePaths#TERMINAL} if the group declares none
     */
    public String parent() {
        return dependsOn == null ? NodePaths.TERMINAL : dependsOn;
    }
}
