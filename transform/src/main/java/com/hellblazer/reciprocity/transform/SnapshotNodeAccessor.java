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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.reciprocity.exceptions.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable, in memory snapshot of a stored hierarchy. Built programmatically with {@link #builder()} or
 * loaded from a JSON document of the form
 *
 * <pre>
 * { "nodes": {
 *     "/entry/sample": { "NX_class": "NXsample", "depends_on": "transformations/phi" },
 *     "/entry/sample/transformations/phi": { "transformation_type": "rotation", "vector": [0, 1, 0],
 *                                            "units": "deg", "value": [0, 10, 20], "depends_on": "." },
 *     "/entry/sample/unit_cell": { "value": [4, 4, 4, 90, 90, 90], "units": "Angstrom" } } }
 * </pre>
 * <p>
 * Nodes with a <code>transformation_type</code> or a <code>depends_on</code> next to a value are operations,
 * other nodes with a value are data fields, the rest are groups. Children are derived from the paths, in
 * declaration order. Safe for concurrent reads.
 *
 * @author hal.hildebrand
 */
public final class SnapshotNodeAccessor implements NodeAccessor {
    private static final Logger log = LoggerFactory.getLogger(SnapshotNodeAccessor.class);

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load a snapshot from a JSON document
     *
     * @param in the document, not closed by this method
     * @return the snapshot
     * @throws InvalidConfigurationException if the document is unreadable or malformed
     */
    public static SnapshotNodeAccessor fromJson(InputStream in) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Unreadable node snapshot", e);
        }
        if (root == null || !root.path("nodes").isObject()) {
            throw new InvalidConfigurationException("Node snapshot requires a 'nodes' object");
        }
        var builder = builder();
        var fields = root.get("nodes").fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            builder.node(parse(entry.getKey(), entry.getValue()));
        }
        var snapshot = builder.build();
        log.info("Loaded snapshot of {} nodes", snapshot.size());
        return snapshot;
    }

    /**
     * Load a snapshot from a classpath resource
     */
    public static SnapshotNodeAccessor fromResource(String resource) {
        try (var in = SnapshotNodeAccessor.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new InvalidConfigurationException("No such resource: " + resource);
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Unable to read " + resource, e);
        }
    }

    private static double[] numbers(String path, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        var flattened = new ArrayList<Double>();
        flatten(path, node, flattened);
        var values = new double[flattened.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = flattened.get(i);
        }
        return values;
    }

    private static void flatten(String path, JsonNode node, List<Double> into) {
        if (node.isNumber()) {
            into.add(node.doubleValue());
        } else if (node.isArray()) {
            for (var element : node) {
                flatten(path, element, into);
            }
        } else {
            throw new InvalidConfigurationException("Non numeric value in " + path + ": " + node);
        }
    }

    private static NodeRecord parse(String path, JsonNode node) {
        if (!node.isObject()) {
            throw new InvalidConfigurationException("Node " + path + " must be a JSON object");
        }
        var value = node.has("value") ? node.get("value") : node.get("values");
        var dependsOn = text(node, "depends_on");
        if (node.has("transformation_type") || (value != null && dependsOn != null)) {
            return new TransformNode(path, text(node, "transformation_type"), numbers(path, node.get("vector")),
                                     numbers(path, node.get("offset")), text(node, "offset_units"),
                                     text(node, "units"), numbers(path, value), dependsOn);
        }
        if (value != null) {
            return new DataNode(path, numbers(path, value), text(node, "units"));
        }
        return new GroupNode(path, text(node, "NX_class"), dependsOn);
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private final Map<String, NodeRecord>   nodes;
    private final Map<String, List<String>> children;

    private SnapshotNodeAccessor(Map<String, NodeRecord> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        var index = new LinkedHashMap<String, List<String>>();
        for (var path : this.nodes.keySet()) {
            index.computeIfAbsent(NodePaths.parent(path), k -> new ArrayList<>()).add(path);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.children = Collections.unmodifiableMap(index);
    }

    @Override
    public List<String> children(String groupPath) {
        return children.getOrDefault(groupPath, List.of());
    }

    @Override
    public Optional<NodeRecord> find(String path) {
        return Optional.ofNullable(nodes.get(path));
    }

    /**
     * @return every path in the snapshot, in declaration order
     */
    public List<String> paths() {
        return List.copyOf(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public static class Builder {
        private final Map<String, NodeRecord> nodes = new LinkedHashMap<>();

        private Builder() {
        }

        public SnapshotNodeAccessor build() {
            return new SnapshotNodeAccessor(nodes);
        }

        public Builder data(String path, String units, double... values) {
            return node(new DataNode(path, values, units));
        }

        public Builder group(String path, String nxClass) {
            return node(new GroupNode(path, nxClass));
        }

        public Builder group(String path, String nxClass, String dependsOn) {
            return node(new GroupNode(path, nxClass, dependsOn));
        }

        /**
         * Add a record, replacing any record already at its path
         */
        public Builder node(NodeRecord record) {
            if (!NodePaths.isAbsolute(record.path())) {
                throw new IllegalArgumentException("Snapshot paths must be absolute: " + record.path());
            }
            nodes.put(record.path(), record);
            return this;
        }

        public Builder rotation(String path, double[] vector, String units, String dependsOn, double... values) {
            return node(TransformNode.rotation(path, vector, units, dependsOn, values));
        }

        public Builder translation(String path, double[] vector, String units, String dependsOn,
                                   double... values) {
            return node(TransformNode.translation(path, vector, units, dependsOn, values));
        }
    }
}
