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
 * A required data field (for example the beam wavelength) is absent from a group.
 *
 * @author hal.hildebrand
 */
public final class MissingFieldException extends GeometryException {

    private final String groupPath;

    public MissingFieldException(String groupPath, String detail) {
        super("%s: %s".formatted(groupPath, detail));
        this.groupPath = groupPath;
    }

    public String getGroupPath() {
        return groupPath;
    }
}
