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
 * A <code>depends_on</code> reference that does not resolve to any node.
 *
 * @author hal.hildebrand
 */
public final class BrokenChainException extends GeometryException {

    private final String missingPath;
    private final String referringPath;

    public BrokenChainException(String referringPath, String missingPath) {
        super("Broken transformation chain: '%s' depends on missing path '%s'".formatted(referringPath,
                                                                                           missingPath));
        this.referringPath = referringPath;
        this.missingPath = missingPath;
    }

    /**
     * @return the reference that could not be resolved, as written in the data
     */
    public String getMissingPath() {
        return missingPath;
    }

    /**
     * @return the node holding the broken reference
     */
    public String getReferringPath() {
        return referringPath;
    }
}
