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

package org.pipelineconfig.merge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;
import org.pipelineconfig.layer.Layer;
import org.pipelineconfig.node.ConfigNode;
import org.pipelineconfig.node.MapNode;

/**
 * Deep merge of configuration trees, lowest precedence first.
 *
 * <p>Two mappings merge key by key: keys of the lower tree keep their position, keys only the higher tree
 * sets are appended, shared keys merge recursively. In every other case the higher value replaces the lower
 * one whole, including a scalar replacing a mapping and the reverse. Scalars and dynamic values are opaque.</p>
 */
public final class MergeEngine {

    private static final Logger LOG = Logger.getLogger(MergeEngine.class);

    private MergeEngine() {
    }

    /**
     * Merges layers left to right.
     *
     * @param layers layers in increasing precedence
     * @return the merged tree; empty when there are no layers
     */
    public static MapNode merge(List<Layer> layers) {
        MapNode merged = MapNode.empty();
        for (Layer layer : layers) {
            merged = merge(merged, layer.tree());
            if (LOG.isDebugEnabled()) {
                LOG.debugf("Merged %s (%d top-level key(s))", layer.provenance(), layer.tree().size());
            }
        }
        return merged;
    }

    /**
     * Merges two trees.
     *
     * @param lower the lower precedence tree
     * @param higher the higher precedence tree
     * @return the merged tree
     */
    public static MapNode merge(MapNode lower, MapNode higher) {
        if (higher.isEmpty()) {
            return lower;
        }
        if (lower.isEmpty()) {
            return higher;
        }
        Map<String, ConfigNode> merged = new LinkedHashMap<>(lower.entries());
        for (Map.Entry<String, ConfigNode> entry : higher.entries().entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), MergeEngine::mergeNode);
        }
        return MapNode.of(merged);
    }

    private static ConfigNode mergeNode(ConfigNode lower, ConfigNode higher) {
        if (lower instanceof MapNode lowerMap && higher instanceof MapNode higherMap) {
            return merge(lowerMap, higherMap);
        }
        return higher;
    }
}
