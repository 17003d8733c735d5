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
 * Path arithmetic for the slash separated hierarchy.
 *
 * @author hal.hildebrand
 */
public final class NodePaths {

    /**
     * The parent reference that ends a transformation chain
     */
    public static final String TERMINAL = ".";
    public static final String ROOT     = "/";

    public static boolean isAbsolute(String path) {
        return path.startsWith(ROOT);
    }

    public static boolean isTerminal(String reference) {
        return reference == null || TERMINAL.equals(reference);
    }

    /**
     * Join a group path and a relative path
     */
    public static String join(String group, String relative) {
        if (group.endsWith(ROOT)) {
            return group + relative;
        }
        return group + ROOT + relative;
    }

    /**
     * @return the last segment of the path
     */
    public static String name(String path) {
        var index = path.lastIndexOf('/');
        return index < 0 ? path : path.substring(index + 1);
    }

    /**
     * @return the containing group of the path, the root for top level paths
     */
    public static String parent(String path) {
        var index = path.lastIndexOf('/');
        return index <= 0 ? ROOT : path.substring(0, index);
    }

    private NodePaths() {
    }
}
