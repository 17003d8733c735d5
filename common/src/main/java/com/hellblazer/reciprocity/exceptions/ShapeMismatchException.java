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
 * A per point value array whose length is neither 1 nor the scan length.
 *
 * @author hal.hildebrand
 */
public final class ShapeMismatchException extends GeometryException {

    private final String path;
    private final int    length;
    private final int    scanLength;

    public ShapeMismatchException(String path, int length, int scanLength) {
        super("Values of '%s' have length %d, expected 1 or %d".formatted(path, length, scanLength));
        this.path = path;
        this.length = length;
        this.scanLength = scanLength;
    }

    public int getLength() {
        return length;
    }

    public String getPath() {
        return path;
    }

    public int getScanLength() {
        return scanLength;
    }
}
