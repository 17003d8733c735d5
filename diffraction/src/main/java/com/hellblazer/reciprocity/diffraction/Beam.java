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

import com.hellblazer.reciprocity.common.Affine;
import com.hellblazer.reciprocity.common.Units;
import com.hellblazer.reciprocity.exceptions.MissingFieldException;
import com.hellblazer.reciprocity.transform.ChainWalker;
import com.hellblazer.reciprocity.transform.DataNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.Locale;
import java.util.Objects;

/**
 * The incident beam: a direction in lab axes and a wavelength in Angstrom.
 *
 * @author hal.hildebrand
 */
public final class Beam {

    public static final String INCIDENT_WAVELENGTH = "incident_wavelength";
    public static final String INCIDENT_ENERGY     = "incident_energy";

    private static final Logger log                    = LoggerFactory.getLogger(Beam.class);
    private static final double MILLIMETRES_PER_ANGSTROM = 1e-7;

    /**
     * Load a beam group
     *
     * @param walker   chain walker over the stored hierarchy
     * @param path     the beam group
     * @param labFrame the frame the direction is expressed in
     * @return the beam
     * @throws MissingFieldException if the group has neither a wavelength nor an energy
     */
    public static Beam load(ChainWalker walker, String path, LabFrame labFrame) {
        var accessor = walker.getAccessor();
        var wavelength = Fields.data(accessor, path, INCIDENT_WAVELENGTH)
                               .map(Beam::angstroms)
                               .or(() -> Fields.data(accessor, path, INCIDENT_ENERGY)
                                               .map(energy -> XrayUtils.photonWavelength(kiloElectronVolts(energy))))
                               .orElseThrow(() -> new MissingFieldException(path, "contains no '%s' or '%s'".formatted(
                               INCIDENT_WAVELENGTH, INCIDENT_ENERGY)));
        var beam = new Beam(path, labFrame.apply(direction(walker, path)), wavelength);
        log.debug("Loaded {}", beam);
        return beam;
    }

    private static double angstroms(DataNode field) {
        var value = field.first();
        var units = field.units();
        if (Units.isBlank(units)) {
            return value;
        }
        var perUnit = Units.millimetresPer(units);
        if (perUnit.isEmpty()) {
            log.warn("Unknown wavelength units '{}' on {}, assuming Angstrom", units, field.path());
            return value;
        }
        return value * perUnit.getAsDouble() / MILLIMETRES_PER_ANGSTROM;
    }

    private static Vector3d direction(ChainWalker walker, String path) {
        var operations = walker.operations(path);
        if (operations.isEmpty()) {
            return new Vector3d(0, 0, 1);
        }
        var axis = operations.get(0).axis();
        if (axis.length() < Affine.ZERO_LENGTH) {
            log.warn("Beam direction {} has no length, assuming +z", operations.get(0).path());
            return new Vector3d(0, 0, 1);
        }
        return Affine.unit(axis);
    }

    private static double kiloElectronVolts(DataNode field) {
        var value = field.first();
        var units = field.units() == null ? "" : field.units().trim().toLowerCase(Locale.ROOT);
        return switch (units) {
            case "ev" -> value / 1000.0;
            case "", "kev" -> value;
            default -> {
                log.warn("Unknown energy units '{}' on {}, assuming keV", field.units(), field.path());
                yield value;
            }
        };
    }

    private final Vector3d direction;
    private final String   path;
    private final double   wavelength;

    /**
     * @param path       the beam group
     * @param direction  the beam direction, normalized on construction
     * @param wavelength the wavelength in Angstrom
     */
    public Beam(String path, Tuple3d direction, double wavelength) {
        this.path = Objects.requireNonNull(path, "path");
        this.direction = Affine.unit(direction);
        if (!(wavelength > 0) || Double.isInfinite(wavelength)) {
            throw new IllegalArgumentException("Wavelength must be positive: " + wavelength);
        }
        this.wavelength = wavelength;
    }

    /**
     * @return unit beam direction, in lab axes
     */
    public Vector3d direction() {
        return new Vector3d(direction);
    }

    /**
     * @return photon energy in keV
     */
    public double energy() {
        return XrayUtils.photonEnergy(wavelength);
    }

    /**
     * @return ki = 2 pi / lambda along the beam direction, in inverse Angstrom
     */
    public Vector3d incidentWavevector() {
        var ki = new Vector3d(direction);
        ki.scale(wavevectorMagnitude());
        return ki;
    }

    public String path() {
        return path;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Beam[%s, direction=(%.4f, %.4f, %.4f), wavelength=%.5f A, energy=%.4f keV]",
                             path, direction.x, direction.y, direction.z, wavelength, energy());
    }

    /**
     * @return wavelength in Angstrom
     */
    public double wavelength() {
        return wavelength;
    }

    /**
     * @return 2 pi / lambda, in inverse Angstrom
     */
    public double wavevectorMagnitude() {
        return XrayUtils.wavevector(wavelength);
    }
}
