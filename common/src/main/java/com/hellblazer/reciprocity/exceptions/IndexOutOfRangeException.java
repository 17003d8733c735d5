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
package com.hellblazer.reciprocity.exceptions;

/**
 * A scan index or pixel coordinate outside the resolved bounds.
 *
 * @author hal.hildebrand
 */
public final class IndexOutOfRangeException extends GeometryException {

    private final int index;
    private final int bound;

    /**
     * @param what  name of the indexed quantity, used in the message
     * @param index the offending index
     * @param bound the exclusive upper bound
     */
    public IndexOutOfRangeException(String what, int index, int bound) {
        super("%s index %d out of range [0, %d)".formatted(what, index, bound));
        this.index = index;
        this.bound = bound;
    }

    public int getBound() {
        return bound;
    }

    public int getIndex() {
        return index;
    }
}
