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

import com.hellblazer.reciprocity.exceptions.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LabFrameTest {

    @Test
    public void testIdentity() {
        var frame = LabFrame.identity();
        assertTrue(frame.isIdentity());
        assertEquals(new Vector3d(1, 2, 3), frame.apply(new Vector3d(1, 2, 3)));
    }

    @Test
    public void testAxes() {
        // lab x = instrument z, lab y = instrument x, lab z = instrument y
        var frame = LabFrame.ofAxes(new Vector3d(0, 0, 1), new Vector3d(1, 0, 0), new Vector3d(0, 1, 0));
        assertFalse(frame.isIdentity());
        assertEquals(new Vector3d(1, 0, 0), frame.apply(new Vector3d(0, 0, 1)));
        assertEquals(new Vector3d(0, 0, 1), frame.apply(new Vector3d(0, 1, 0)));
        assertEquals(1.0, frame.toMatrix4d().getElement(3, 3), 0.0);
        assertEquals(0.0, frame.toMatrix4d().getElement(0, 3), 0.0);
    }

    @Test
    public void testRejectsNonRotations() {
        var scaled = new Matrix3d(2, 0, 0, 0, 1, 0, 0, 0, 1);
        assertThrows(InvalidConfigurationException.class, () -> LabFrame.of(scaled));
        var reflection = new Matrix3d(-1, 0, 0, 0, 1, 0, 0, 0, 1);
        assertThrows(InvalidConfigurationException.class, () -> LabFrame.of(reflection));
        assertThrows(InvalidConfigurationException.class,
                     () -> LabFrame.ofAxes(new Vector3d(1, 0, 0), new Vector3d(1, 0, 0), new Vector3d(0, 0, 1)));
    }

    @Test
    public void testRotationIsCopied() {
        var m = new Matrix3d(0, -1, 0, 1, 0, 0, 0, 0, 1);
        var frame = LabFrame.of(m);
        m.setIdentity();
        assertFalse(frame.isIdentity());
        frame.rotation().setZero();
        assertEquals(new Vector3d(0, 1, 0), frame.apply(new Vector3d(1, 0, 0)));
    }
}
