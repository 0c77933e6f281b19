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

package org.pipelineconfig.layer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.node.ConfigNode;
import org.pipelineconfig.node.MapNode;

/**
 * Precedence-ordered layers plus the selectors extracted from them.
 *
 * <p>Layers are ordered defaults, fragments (inclusion order), profiles (activation order) whatever order they
 * were added in. Selector keys are removed from every layer tree and kept as {@link Selector} entries in
 * declaration order, so they can be applied after all layers have been merged.</p>
 */
public final class LayerStack {

    private static final Logger LOG = Logger.getLogger(LayerStack.class);

    private final List<Layer> layers;
    private final List<Selector> selectors;

    private LayerStack(List<Layer> layers, List<Selector> selectors) {
        this.layers = List.copyOf(layers);
        this.selectors = List.copyOf(selectors);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Selector-free layers, lowest precedence first.
     *
     * @return the ordered layers
     */
    public List<Layer> layers() {
        return layers;
    }

    /**
     * All selectors in declaration order across the stack.
     *
     * @return the selectors
     */
    public List<Selector> selectors() {
        return selectors;
    }

    @Override
    public String toString() {
        return "LayerStack{layers=" + layers.stream().map(layer -> layer.provenance().toString()).toList()
            + ", selectors=" + selectors.size() + "}";
    }

    /**
     * Collects layers into their precedence buckets.
     */
    public static final class Builder {

        private final Map<Provenance.Kind, List<Layer>> buckets = new EnumMap<>(Provenance.Kind.class);

        private Builder() {
        }

        /**
         * Adds a layer to the bucket of its provenance kind, after layers of the same kind already added.
         *
         * @param layer a defaults, fragment or profile layer
         * @return this builder
         * @throws IllegalArgumentException for selector layers, which are derived rather than added
         */
        public Builder add(Layer layer) {
            if (layer.provenance().kind() == Provenance.Kind.SELECTOR) {
                throw new IllegalArgumentException("Selector layers are derived from the stack and cannot be added: " + layer.provenance());
            }
            buckets.computeIfAbsent(layer.provenance().kind(), ignored -> new ArrayList<>()).add(layer);
            return this;
        }

        public Builder addAll(List<Layer> layers) {
            layers.forEach(this::add);
            return this;
        }

        public LayerStack build() {
            List<Layer> ordered = new ArrayList<>();
            List<Selector> selectors = new ArrayList<>();
            for (Provenance.Kind kind : Provenance.Kind.values()) {
                for (Layer layer : buckets.getOrDefault(kind, List.of())) {
                    MapNode stripped = extract(layer.tree(), List.of(), layer.provenance(), selectors);
                    ordered.add(layer.withTree(stripped));
                }
            }
            if (LOG.isDebugEnabled()) {
                LOG.debugf("Built layer stack with %d layer(s) and %d selector(s)", ordered.size(), selectors.size());
            }
            return new LayerStack(ordered, selectors);
        }

        private static MapNode extract(MapNode tree, List<String> scope, Provenance declaredBy, List<Selector> selectors) {
            Map<String, ConfigNode> kept = new LinkedHashMap<>();
            boolean changed = false;
            for (Map.Entry<String, ConfigNode> entry : tree.entries().entrySet()) {
                String key = entry.getKey();
                ConfigNode value = entry.getValue();
                if (Selector.isSelectorKey(key)) {
                    if (!(value instanceof MapNode overrides)) {
                        throw new FragmentParseException(declaredBy.toString(), "Selector " + key + " does not scope any key");
                    }
                    selectors.add(new Selector(key.substring(Selector.PREFIX.length()), scope, overrides, declaredBy));
                    changed = true;
                } else if (value instanceof MapNode child) {
                    List<String> childScope = new ArrayList<>(scope);
                    childScope.add(key);
                    MapNode stripped = extract(child, childScope, declaredBy, selectors);
                    changed |= stripped != child;
                    kept.put(key, stripped);
                } else {
                    kept.put(key, value);
                }
            }
            return changed ? MapNode.of(kept) : tree;
        }
    }
}
