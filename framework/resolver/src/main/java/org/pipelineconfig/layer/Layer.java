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

import java.util.Objects;

import org.pipelineconfig.node.MapNode;

/**
 * An immutable configuration tree contributing to the merge, tagged with its origin.
 *
 * @param provenance where the tree came from
 * @param tree the configuration tree
 */
public record Layer(Provenance provenance, MapNode tree) {

    public Layer {
        Objects.requireNonNull(provenance, "provenance must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
    }

    public static Layer defaults(MapNode tree) {
        return new Layer(Provenance.defaults(), tree);
    }

    public static Layer fragment(String path, MapNode tree) {
        return new Layer(Provenance.fragment(path), tree);
    }

    public static Layer profile(String name, MapNode tree) {
        return new Layer(Provenance.profile(name), tree);
    }

    public Layer withTree(MapNode replacement) {
        return replacement.equals(tree) ? this : new Layer(provenance, replacement);
    }

    @Override
    public String toString() {
        return provenance + " " + tree;
    }
}
