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
package com.hellblazer.reciprocity.transform;

import com.hellblazer.reciprocity.common.Affine;
import com.hellblazer.reciprocity.exceptions.IndexOutOfRangeException;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TransformChainTest {

    private static TransformChain chain() {
        var accessor = SnapshotNodeAccessor.builder()
                                           .translation("/t", new double[] { 1, 0, 0 }, "mm", ".", 1, 2)
                                           .build();
        return new ChainComposer(accessor).chain("/t");
    }

    @Test
    public void testMatricesAreCopies() {
        var chain = chain();
        var m = chain.matrix(1);
        m.setIdentity();
        assertEquals(2.0, chain.matrix(1).getElement(0, 3), 0.0);
    }

    @Test
    public void testIndexBounds() {
        var chain = chain();
        assertEquals(2, chain.size());
        var e = assertThrows(IndexOutOfRangeException.class, () -> chain.matrix(2));
        assertEquals(2, e.getBound());
        assertThrows(IndexOutOfRangeException.class, () -> chain.origin(-1));
    }

    @Test
    public void testTransformAndOrigin() {
        var chain = chain();
        assertEquals(new Point3d(2, 0, 0), chain.origin(1));
        assertEquals(new Point3d(3, 1, 1), chain.transform(new Point3d(1, 1, 1), 1));
    }

    @Test
    public void testPrepend() {
        var quarter = Affine.rotation(new Vector3d(0, 0, 1), Math.PI / 2);
        var framed = chain().prepend(quarter);
        var origin = framed.origin(1);
        assertEquals(0.0, origin.x, 1e-12);
        assertEquals(2.0, origin.y, 1e-12);
        assertEquals("/t", framed.startPath());
        assertEquals(1, framed.operations().size());
    }

    @Test
    public void testIdentityChain() {
        var identity = TransformChain.identity("/entry/sample", 3);
        assertTrue(identity.isEmpty());
        assertEquals(3, identity.size());
        assertEquals(new Point3d(), identity.origin(2));
    }
}
