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

import com.hellblazer.reciprocity.common.GeometryConfig;
import com.hellblazer.reciprocity.exceptions.BrokenChainException;
import com.hellblazer.reciprocity.exceptions.ChainTooLongException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class ChainWalkerTest {

    private static final double[] X = { 1, 0, 0 };
    private static final double[] Y = { 0, 1, 0 };
    private static final double[] Z = { 0, 0, 1 };

    private static SnapshotNodeAccessor sample() {
        return SnapshotNodeAccessor.builder()
                                   .group("/entry", "NXentry")
                                   .group("/entry/sample", "NXsample", "/entry/sample/transformations/phi")
                                   .group("/entry/sample/transformations", "NXtransformations")
                                   .rotation("/entry/sample/transformations/phi", Y, "deg", "chi", 0, 10, 20)
                                   .rotation("/entry/sample/transformations/chi", Z, "deg", "eta", 90)
                                   .rotation("/entry/sample/transformations/eta", X, "deg", ".", 5, 6, 7)
                                   .build();
    }

    @Test
    public void testWalkFromGroup() {
        var walker = new ChainWalker(sample());
        assertEquals(List.of("/entry/sample/transformations/phi", "/entry/sample/transformations/chi",
                             "/entry/sample/transformations/eta"), walker.walk("/entry/sample"));
    }

    @Test
    public void testWalkFromOperation() {
        var walker = new ChainWalker(sample());
        assertEquals(List.of("/entry/sample/transformations/chi", "/entry/sample/transformations/eta"),
                     walker.walk("/entry/sample/transformations/chi"));
        assertEquals(List.of("/entry/sample/transformations/eta"), walker.walk("/entry/sample/transformations/eta"));
    }

    @Test
    public void testGroupWithoutDependsOnIsEmpty() {
        var walker = new ChainWalker(sample());
        assertTrue(walker.walk("/entry").isEmpty());
        assertEquals(1, walker.maxSize("/entry"));
    }

    @Test
    public void testGroupPassedThroughIsNotListed() {
        var accessor = SnapshotNodeAccessor.builder()
                                           .group("/entry/instrument/detector", "NXdetector", "/entry/instrument/arm")
                                           .group("/entry/instrument/arm", "NXpositioner", "/entry/instrument/arm/delta")
                                           .rotation("/entry/instrument/arm/delta", Y, "deg", ".", 30)
                                           .build();
        assertEquals(List.of("/entry/instrument/arm/delta"),
                     new ChainWalker(accessor).walk("/entry/instrument/detector"));
    }

    @Test
    public void testRelativeReferencesSearchAncestors() {
        var accessor = SnapshotNodeAccessor.builder()
                                           .group("/entry/sample", "NXsample", "transformations/phi")
                                           .rotation("/entry/sample/transformations/phi", Y, "deg", "mu", 1)
                                           .rotation("/entry/mu", X, "deg", ".", 2)
                                           .build();
        assertEquals(List.of("/entry/sample/transformations/phi", "/entry/mu"),
                     new ChainWalker(accessor).walk("/entry/sample"));
    }

    @Test
    public void testBrokenChainNamesMissingPath() {
        var accessor = SnapshotNodeAccessor.builder()
                                           .rotation("/entry/sample/phi", Y, "deg", "/entry/sample/missing", 1)
                                           .build();
        var walker = new ChainWalker(accessor);
        var e = assertThrows(BrokenChainException.class, () -> walker.walk("/entry/sample/phi"));
        assertEquals("/entry/sample/missing", e.getMissingPath());
        assertEquals("/entry/sample/phi", e.getReferringPath());
        assertTrue(e.getMessage().contains("/entry/sample/missing"));
    }

    @Test
    public void testMissingRelativeReference() {
        var accessor = SnapshotNodeAccessor.builder().rotation("/entry/sample/phi", Y, "deg", "nowhere", 1).build();
        var e = assertThrows(BrokenChainException.class, () -> new ChainWalker(accessor).walk("/entry/sample/phi"));
        assertEquals("nowhere", e.getMissingPath());
    }

    @Test
    public void testMissingStart() {
        var walker = new ChainWalker(sample());
        var e = assertThrows(BrokenChainException.class, () -> walker.walk("/entry/nothing"));
        assertEquals("/entry/nothing", e.getMissingPath());
    }

    @Test
    public void testCycleDetected() {
        var accessor = SnapshotNodeAccessor.builder()
                                           .rotation("/a", Y, "deg", "/b", 1)
                                           .rotation("/b", Y, "deg", "/c", 1)
                                           .rotation("/c", Y, "deg", "/a", 1)
                                           .build();
        var e = assertThrows(ChainTooLongException.class, () -> new ChainWalker(accessor).walk("/a"));
        assertEquals("/a", e.getStartPath());
        assertEquals(3, e.getHops());
        assertTrue(e.getMessage().contains("cycle"));
    }

    @Test
    public void testHopBound() {
        var builder = SnapshotNodeAccessor.builder();
        for (int i = 0; i < 10; i++) {
            builder.translation("/t" + i, X, "mm", i == 9 ? "." : "/t" + (i + 1), 1);
        }
        var accessor = builder.build();
        var bounded = new ChainWalker(accessor, GeometryConfig.builder().maxChainLength(8).build());
        var e = assertThrows(ChainTooLongException.class, () -> bounded.walk("/t0"));
        assertEquals(8, e.getHops());

        var roomy = new ChainWalker(accessor, GeometryConfig.builder().maxChainLength(9).build());
        assertEquals(10, roomy.walk("/t0").size());
    }

    @Test
    public void testMaxSize() {
        var walker = new ChainWalker(sample());
        assertEquals(3, walker.maxSize("/entry/sample"));
        assertEquals(3, walker.maxSize("/entry/sample/transformations/chi"));
    }

    @Test
    public void testOperationsInTraversalOrder() {
        var operations = new ChainWalker(sample()).operations("/entry/sample");
        assertEquals(3, operations.size());
        assertEquals(TransformKind.ROTATION, operations.get(0).kind());
        assertEquals("chi", operations.get(0).dependsOn());
        assertEquals(NodePaths.TERMINAL, operations.get(2).dependsOn());
    }

    @Test
    public void testWalkOnlyPerformsLookups() {
        var accessor = mock(NodeAccessor.class);
        when(accessor.find(anyString())).thenReturn(Optional.empty());
        when(accessor.exists(anyString())).thenCallRealMethod();
        when(accessor.find("/s")).thenReturn(Optional.of(new GroupNode("/s", "NXsample", "/s/phi")));
        when(accessor.find("/s/phi")).thenReturn(Optional.of(TransformNode.rotation("/s/phi", Y, "deg", ".", 3)));

        assertEquals(List.of("/s/phi"), new ChainWalker(accessor).walk("/s"));
        verify(accessor, never()).children(any());
        verify(accessor, never()).find(NodePaths.TERMINAL);
    }
}
