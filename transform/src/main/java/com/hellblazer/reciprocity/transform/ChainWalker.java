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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Follows <code>depends_on</code> references from a starting node to the terminal sentinel. Traversal is
 * iterative with an explicit visited set and a hop bound, so cyclic data surfaces as
 * {@link ChainTooLongException} rather than unbounded work.
 * <p>
 * Relative references are resolved the NeXus way: against the referring group (or the group holding a
 * referring field), then each ancestor in turn.
 *
 * @author hal.hildebrand
 */
public class ChainWalker {
    private static final Logger log = LoggerFactory.getLogger(ChainWalker.class);

    private final NodeAccessor accessor;
    private final int          maxChainLength;

    public ChainWalker(NodeAccessor accessor) {
        this(accessor, GeometryConfig.defaults());
    }

    public ChainWalker(NodeAccessor accessor, GeometryConfig config) {
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.maxChainLength = config.getMaxChainLength();
    }

    public NodeAccessor getAccessor() {
        return accessor;
    }

    /**
     * Load the links of the chain starting at the supplied path
     *
     * @param startPath an operation node, or a group carrying a parent reference
     * @return the links in traversal order, child first
     */
    public List<TransformOperation> operations(String startPath) {
        var paths = walk(startPath);
        var operations = new ArrayList<TransformOperation>(paths.size());
        for (var path : paths) {
            operations.add(TransformOperation.from(require(path, path)));
        }
        return operations;
    }

    /**
     * The largest value count along the chain, i.e. the scan length the chain implies
     *
     * @param startPath the start of the chain
     * @return the scan length, at least 1
     */
    public int maxSize(String startPath) {
        return maxSize(operations(startPath));
    }

    /**
     * @return the largest value count among the links, at least 1
     */
    public static int maxSize(List<TransformOperation> operations) {
        var max = 1;
        for (var operation : operations) {
            max = Math.max(max, operation.size());
        }
        return max;
    }

    /**
     * Follow parent references from the start node until the terminal sentinel
     *
     * @param startPath an operation node, or a group carrying a parent reference
     * @return the paths of the chain's links, child first. Groups passed through are not listed.
     * @throws BrokenChainException  if the start or any reference does not resolve
     * @throws ChainTooLongException if the hop bound is exceeded or a node is revisited
     */
    public List<String> walk(String startPath) {
        Objects.requireNonNull(startPath, "startPath");
        var current = require(null, startPath);
        var chain = new ArrayList<String>();
        var visited = new HashSet<String>();
        visited.add(current.path());
        if (!(current instanceof GroupNode)) {
            chain.add(current.path());
        }

        var hops = 0;
        var reference = parentOf(current);
        while (!NodePaths.isTerminal(reference)) {
            if (++hops > maxChainLength) {
                throw new ChainTooLongException(startPath, hops - 1,
                                                "more than %d links, probable cycle".formatted(maxChainLength));
            }
            var resolved = resolve(current, reference);
            if (!visited.add(resolved)) {
                throw new ChainTooLongException(startPath, hops, "cycle through '%s'".formatted(resolved));
            }
            current = require(current.path(), resolved);
            if (!(current instanceof GroupNode)) {
                chain.add(resolved);
            }
            reference = parentOf(current);
        }
        log.debug("Chain from {}: {}", startPath, chain);
        return Collections.unmodifiableList(chain);
    }

    private String parentOf(NodeRecord node) {
        if (node instanceof TransformNode transform) {
            return transform.dependsOn();
        }
        if (node instanceof GroupNode group) {
            return group.parent();
        }
        return NodePaths.TERMINAL;
    }

    private NodeRecord require(String referringPath, String path) {
        return accessor.find(path)
                       .orElseThrow(() -> new BrokenChainException(referringPath == null ? path : referringPath,
                                                                   path));
    }

    private String resolve(NodeRecord from, String reference) {
        if (NodePaths.isAbsolute(reference)) {
            if (accessor.exists(reference)) {
                return reference;
            }
            throw new BrokenChainException(from.path(), reference);
        }
        var base = from instanceof GroupNode ? from.path() : NodePaths.parent(from.path());
        while (true) {
            var candidate = NodePaths.join(base, reference);
            if (accessor.exists(candidate)) {
                return candidate;
            }
            if (NodePaths.ROOT.equals(base)) {
                throw new BrokenChainException(from.path(), reference);
            }
            base = NodePaths.parent(base);
        }
    }
}
