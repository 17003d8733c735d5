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
import com.hellblazer.reciprocity.common.GeometryConfig;
import com.hellblazer.reciprocity.exceptions.BrokenChainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix4d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines the links of a chain into one transform per scan point.
 * <p>
 * For links <code>M1 .. Mn</code> in traversal order (M1 the start, Mn the link nearest the sentinel) the
 * composed transform is <code>Mn * ... * M2 * M1</code>: each link is expressed in its parent's frame, so a
 * point is moved by the start link first and by the root link last.
 *
 * @author hal.hildebrand
 */
public class ChainComposer {
    private static final Logger log = LoggerFactory.getLogger(ChainComposer.class);

    private final ChainWalker       walker;
    private final OperationResolver resolver;

    public ChainComposer(NodeAccessor accessor) {
        this(accessor, GeometryConfig.defaults());
    }

    public ChainComposer(NodeAccessor accessor, GeometryConfig config) {
        this(new ChainWalker(accessor, config), new OperationResolver());
    }

    public ChainComposer(ChainWalker walker, OperationResolver resolver) {
        this.walker = Objects.requireNonNull(walker, "walker");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Resolve the chain starting at a path for every point of the scan it implies
     *
     * @param startPath the start of the chain
     * @return the resolved chain
     */
    public TransformChain chain(String startPath) {
        var operations = walker.operations(startPath);
        return chain(startPath, operations, ChainWalker.maxSize(operations));
    }

    /**
     * Resolve the chain starting at a path against an externally imposed scan length, broadcasting single valued
     * links
     *
     * @param startPath  the start of the chain
     * @param scanLength the number of scan points
     * @return the resolved chain
     */
    public TransformChain chain(String startPath, int scanLength) {
        return chain(startPath, walker.operations(startPath), scanLength);
    }

    /**
     * Compose the links at one scan point
     *
     * @param operations the links, in traversal order
     * @param scanIndex  the scan point
     * @param scanLength the number of scan points
     * @return a new composed transform, the identity for an empty chain
     */
    public Matrix4d compose(List<TransformOperation> operations, int scanIndex, int scanLength) {
        if (operations.isEmpty()) {
            return Affine.identity();
        }
        if (operations.size() == 1) {
            return resolver.resolve(operations.get(0), scanIndex, scanLength);
        }
        var composed = Affine.identity();
        for (int i = operations.size() - 1; i >= 0; i--) {
            composed.mul(resolver.resolve(operations.get(i), scanIndex, scanLength));
        }
        return composed;
    }

    /**
     * Compose the chain formed by the supplied paths, with the scan length implied by their values
     *
     * @param paths     the link paths, in traversal order, as produced by {@link ChainWalker#walk(String)}
     * @param scanIndex the scan point
     * @return the composed transform
     */
    public Matrix4d compose(List<String> paths, int scanIndex) {
        var operations = new ArrayList<TransformOperation>(paths.size());
        for (var path : paths) {
            var record = walker.getAccessor().find(path).orElseThrow(() -> new BrokenChainException(path, path));
            operations.add(TransformOperation.from(record));
        }
        return compose(operations, scanIndex, ChainWalker.maxSize(operations));
    }

    /**
     * Compose the links at every scan point
     *
     * @return one composed transform per scan point
     */
    public Matrix4d[] composeAll(List<TransformOperation> operations, int scanLength) {
        var all = new Matrix4d[scanLength];
        for (int i = 0; i < scanLength; i++) {
            all[i] = compose(operations, i, scanLength);
        }
        return all;
    }

    public ChainWalker getWalker() {
        return walker;
    }

    public OperationResolver getResolver() {
        return resolver;
    }

    private TransformChain chain(String startPath, List<TransformOperation> operations, int scanLength) {
        var chain = new TransformChain(startPath, operations, scanLength, composeAll(operations, scanLength));
        log.debug("Resolved {} links from {} over {} scan points", operations.size(), startPath, scanLength);
        return chain;
    }
}
