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

import java.util.Objects;

import org.pipelineconfig.dynamic.DynamicValue;

/**
 * Tree leaf holding a value that is computed per attempt.
 *
 * @param value the dynamic value
 */
public record DynamicNode(DynamicValue value) implements ConfigNode {

    public DynamicNode {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String toString() {
        return "{ " + value.expression() + " }";
    }
}
