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
 * A direction was requested from a position vector of zero length, as for a pixel that resolves onto the
 * interaction point.
 *
 * @author hal.hildebrand
 */
public final class DegenerateDirectionException extends GeometryException {

    private final String path;
    private final int    frame;

    public DegenerateDirectionException(String path, int frame) {
        super("Position of '%s' at frame %d coincides with the origin; no direction is defined".formatted(path,
                                                                                                          frame));
        this.path = path;
        this.frame = frame;
    }

    public int getFrame() {
        return frame;
    }

    public String getPath() {
        return path;
    }
}
