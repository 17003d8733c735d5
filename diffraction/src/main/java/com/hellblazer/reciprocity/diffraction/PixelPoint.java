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

/**
 * A detector coordinate: a scan frame and a (possibly fractional) pixel position on a module.
 *
 * @param frame the scan point
 * @param slow  pixel coordinate along the slow axis
 * @param fast  pixel coordinate along the fast axis
 * @author hal.hildebrand
 */
public record PixelPoint(int frame, double slow, double fast) {

    public static PixelPoint origin(int frame) {
        return new PixelPoint(frame, 0, 0);
    }

    public PixelPoint atFrame(int newFrame) {
        return new PixelPoint(newFrame, slow, fast);
    }
}
