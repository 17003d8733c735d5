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
 * Base of the closed hierarchy of failures raised while resolving transformation chains and computing
 * reciprocal space geometry. Every failure is fatal to the single query that raised it, never to the process;
 * batch callers catch per item.
 *
 * @author hal.hildebrand
 */
public sealed class GeometryException extends RuntimeException
permits BrokenChainException, ChainTooLongException, ShapeMismatchException, IndexOutOfRangeException,
        DegenerateLatticeException, DegenerateDirectionException, MissingFieldException,
        InvalidConfigurationException {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
