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
package com.hellblazer.reciprocity.common;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Fixed unit tables used to normalize stored values. Lengths are converted to millimetres, angles to radians.
 * Lookups are case insensitive and ignore surrounding whitespace. The tables only answer questions; warning
 * about unrecognized labels is left to the caller.
 *
 * @author hal.hildebrand
 */
public final class Units {

    /**
     * Classification of a rotation unit label
     */
    public enum AngleUnit {
        DEGREES, RADIANS,
        /**
         * Blank or unrecognized label. Treated as degrees by convention.
         */
        UNKNOWN;

        /**
         * Convert a value in this unit to radians. Unknown units are taken to be degrees.
         */
        public double toRadians(double value) {
            return this == RADIANS ? value : Math.toRadians(value);
        }
    }

    private static final Set<String> DEGREE_TOKENS = Set.of("deg", "degree", "degrees");
    private static final String      RADIAN_TOKEN  = "rad";

    private static final Map<String, Double> MILLIMETRES = Map.ofEntries(Map.entry("km", 1.0e6),
                                                                         Map.entry("m", 1.0e3),
                                                                         Map.entry("meter", 1.0e3),
                                                                         Map.entry("meters", 1.0e3),
                                                                         Map.entry("metre", 1.0e3),
                                                                         Map.entry("metres", 1.0e3),
                                                                         Map.entry("cm", 10.0),
                                                                         Map.entry("mm", 1.0),
                                                                         Map.entry("millimeter", 1.0),
                                                                         Map.entry("millimeters", 1.0),
                                                                         Map.entry("um", 1.0e-3),
                                                                         Map.entry("µm", 1.0e-3),
                                                                         Map.entry("micron", 1.0e-3),
                                                                         Map.entry("microns", 1.0e-3),
                                                                         Map.entry("micrometer", 1.0e-3),
                                                                         Map.entry("nm", 1.0e-6),
                                                                         Map.entry("nanometer", 1.0e-6),
                                                                         Map.entry("a", 1.0e-7),
                                                                         Map.entry("å", 1.0e-7),
                                                                         Map.entry("angstrom", 1.0e-7),
                                                                         Map.entry("angstroms", 1.0e-7),
                                                                         Map.entry("pm", 1.0e-9));

    /**
     * Classify a rotation unit label. Only the exact token <code>rad</code> means radians; every other label,
     * including <code>radians</code> or <code>RAD</code>, is read as degrees.
     *
     * @param label the stored unit label, may be null
     * @return the angle unit, UNKNOWN for blank or unrecognized labels
     */
    public static AngleUnit angleUnit(String label) {
        if (RADIAN_TOKEN.equals(label)) {
            return AngleUnit.RADIANS;
        }
        if (DEGREE_TOKENS.contains(normalize(label))) {
            return AngleUnit.DEGREES;
        }
        return AngleUnit.UNKNOWN;
    }

    /**
     * Millimetres per one unit of the supplied length label
     *
     * @param label the stored unit label, may be null
     * @return the multiplier, or empty if the label is not in the table
     */
    public static OptionalDouble millimetresPer(String label) {
        var multiplier = MILLIMETRES.get(normalize(label));
        return multiplier == null ? OptionalDouble.empty() : OptionalDouble.of(multiplier);
    }

    /**
     * @return true if the label is blank (null, empty or whitespace)
     */
    public static boolean isBlank(String label) {
        return label == null || label.isBlank();
    }

    private static String normalize(String label) {
        return label == null ? "" : label.strip().toLowerCase(Locale.ROOT);
    }

    private Units() {
    }
}
