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
 * X-ray photon conversions. Energies in keV, wavelengths in Angstrom, wavevectors in inverse Angstrom.
 *
 * @author hal.hildebrand
 */
public final class XrayUtils {

    /** Electron charge, C */
    public static final double ELECTRON_CHARGE = 1.6021733E-19;
    /** Planck constant, J s */
    public static final double PLANCK          = 6.62606868E-34;
    /** Speed of light, m/s */
    public static final double SPEED_OF_LIGHT  = 299792458;
    /** One Angstrom, m */
    public static final double ANGSTROM        = 1e-10;

    /**
     * lambda [A] = h c / E, about 12.398 / E [keV]
     */
    public static double photonWavelength(double energyKev) {
        requirePositive("energy", energyKev);
        var joules = 1000 * energyKev * ELECTRON_CHARGE;
        return PLANCK * SPEED_OF_LIGHT / joules / ANGSTROM;
    }

    /**
     * E [keV] = h c / lambda, about 12.398 / lambda [A]
     */
    public static double photonEnergy(double wavelengthAngstrom) {
        requirePositive("wavelength", wavelengthAngstrom);
        var joules = PLANCK * SPEED_OF_LIGHT / (wavelengthAngstrom * ANGSTROM);
        return joules / ELECTRON_CHARGE / 1000.0;
    }

    /**
     * Wavevector magnitude, 2 pi / lambda
     */
    public static double wavevector(double wavelengthAngstrom) {
        requirePositive("wavelength", wavelengthAngstrom);
        return 2 * Math.PI / wavelengthAngstrom;
    }

    private static void requirePositive(String what, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(what + " must be positive and finite: " + value);
        }
    }

    private XrayUtils() {
    }
}
