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

/**
 * A node of a configuration tree: a {@link ScalarValue}, a {@link MapNode} or a {@link DynamicNode}.
 */
public interface ConfigNode {

    /**
     * Whether this node is a mapping scope that merges key by key.
     *
     * @return true for {@link MapNode} instances
     */
    default boolean isMapping() {
        return this instanceof MapNode;
    }
}
