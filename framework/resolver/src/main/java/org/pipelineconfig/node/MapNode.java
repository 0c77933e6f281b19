/*
 * Copyright (c) 2023-2025 Mariano Barcia
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pipelineconfig.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping scope of a configuration tree. Keys are unique and keep insertion order.
 */
public final class MapNode implements ConfigNode {

    private static final MapNode EMPTY = new MapNode(Map.of());

    private final Map<String, ConfigNode> entries;

    private MapNode(Map<String, ConfigNode> entries) {
        this.entries = entries;
    }

    public static MapNode empty() {
        return EMPTY;
    }

    /**
     * Copies the given entries into a new mapping, preserving iteration order.
     *
     * @param entries the entries to copy
     * @return the mapping
     */
    public static MapNode of(Map<String, ? extends ConfigNode> entries) {
        if (entries.isEmpty()) {
            return EMPTY;
        }
        Map<String, ConfigNode> copy = new LinkedHashMap<>();
        entries.forEach((key, value) -> copy.put(
            Objects.requireNonNull(key, "key must not be null"),
            Objects.requireNonNull(value, "value must not be null for key " + key)));
        return new MapNode(Collections.unmodifiableMap(copy));
    }

    /**
     * Wraps {@code leaf} in one mapping per path segment, outermost first.
     *
     * @param path the key path; empty returns {@code leaf} when it is already a mapping
     * @param leaf the innermost node
     * @return the nested mapping
     */
    public static MapNode nest(List<String> path, ConfigNode leaf) {
        if (path.isEmpty()) {
            if (leaf instanceof MapNode map) {
                return map;
            }
            throw new IllegalArgumentException("Cannot nest a non-mapping node under an empty path");
        }
        ConfigNode current = leaf;
        for (int i = path.size() - 1; i >= 0; i--) {
            current = of(Map.of(path.get(i), current));
        }
        return (MapNode) current;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ConfigNode> entries() {
        return entries;
    }

    public Optional<ConfigNode> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Looks up a node by key path.
     *
     * @param path the keys to follow
     * @return the node, or empty when any segment is missing or crosses a non-mapping node
     */
    public Optional<ConfigNode> find(List<String> path) {
        ConfigNode current = this;
        for (String key : path) {
            if (!(current instanceof MapNode map)) {
                return Optional.empty();
            }
            current = map.entries.get(key);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public MapNode without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        Map<String, ConfigNode> copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return of(copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof MapNode map && entries.equals(map.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    /**
     * Mutable tree builder used while reading a fragment.
     *
     * <p>Assignments to the same path replace earlier ones. Writing below a path that currently holds a
     * scalar replaces that scalar with a mapping.</p>
     */
    public static final class Builder {

        private final Map<String, Object> root = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Assigns a node at the given path, creating intermediate mappings.
         *
         * @param path the key path, at least one segment
         * @param node the value
         * @return this builder
         */
        public Builder put(List<String> path, ConfigNode node) {
            if (path.isEmpty()) {
                throw new IllegalArgumentException("path must not be empty");
            }
            Map<String, Object> parent = ensureMap(path.subList(0, path.size() - 1));
            String key = path.get(path.size() - 1);
            if (node instanceof MapNode map) {
                Map<String, Object> target = ensureMap(path);
                map.entries.forEach((childKey, child) -> putInto(target, childKey, child));
            } else {
                parent.put(key, node);
            }
            return this;
        }

        /**
         * Makes sure a mapping exists at the given path.
         *
         * @param path the key path
         * @return this builder
         */
        public Builder ensure(List<String> path) {
            ensureMap(path);
            return this;
        }

        public boolean isEmpty() {
            return root.isEmpty();
        }

        public MapNode build() {
            return toNode(root);
        }

        private void putInto(Map<String, Object> target, String key, ConfigNode node) {
            if (node instanceof MapNode map) {
                Map<String, Object> child = childMap(target, key);
                map.entries.forEach((childKey, value) -> putInto(child, childKey, value));
            } else {
                target.put(key, node);
            }
        }

        private Map<String, Object> ensureMap(List<String> path) {
            Map<String, Object> current = root;
            for (String key : path) {
                current = childMap(current, key);
            }
            return current;
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> childMap(Map<String, Object> parent, String key) {
            Object existing = parent.get(key);
            if (existing instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            Map<String, Object> created = new LinkedHashMap<>();
            parent.put(key, created);
            return created;
        }

        @SuppressWarnings("unchecked")
        private static MapNode toNode(Map<String, Object> map) {
            Map<String, ConfigNode> converted = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                Object value = entry.getValue();
                converted.put(entry.getKey(), value instanceof Map<?, ?> child
                    ? toNode((Map<String, Object>) child)
                    : (ConfigNode) value);
            }
            return of(converted);
        }
    }
}
