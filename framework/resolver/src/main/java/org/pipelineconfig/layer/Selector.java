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
import java.util.List;
import java.util.Objects;

import org.pipelineconfig.node.MapNode;

/**
 * Overrides that apply only to one named process.
 *
 * <p>Declared in a tree as a {@code $processName} key; {@code scope} is the path of the mapping that held it,
 * so {@code process { $chewbbaca.queue = "x" }} has scope {@code [process]} and overrides {@code {queue: "x"}}.</p>
 *
 * @param processName the exact process name matched
 * @param scope path of the mapping the selector was declared in
 * @param overrides the scoped assignments
 * @param declaredBy the layer that declared the selector
 */
public record Selector(String processName, List<String> scope, MapNode overrides, Provenance declaredBy) {

    public static final String PREFIX = "$";

    public Selector {
        Objects.requireNonNull(processName, "processName must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");
        Objects.requireNonNull(declaredBy, "declaredBy must not be null");
        scope = List.copyOf(scope);
    }

    public static boolean isSelectorKey(String key) {
        return key.length() > PREFIX.length() && key.startsWith(PREFIX);
    }

    /**
     * The overrides wrapped in their scope, ready to merge over a full tree.
     *
     * @return a tree rooted at the top level
     */
    public MapNode asOverlay() {
        return MapNode.nest(scope, overrides);
    }

    public Provenance provenance() {
        return Provenance.selector(processName);
    }

    @Override
    public String toString() {
        List<String> path = new ArrayList<>(scope);
        path.add(PREFIX + processName);
        return String.join(".", path) + " " + overrides + " (from " + declaredBy + ")";
    }
}
