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

package org.pipelineconfig.dynamic;

import java.util.Objects;
import java.util.function.Function;

import org.pipelineconfig.node.ScalarValue;

/**
 * Dynamic value backed by a function supplied by the host application.
 *
 * @param expression description shown in diagnostics
 * @param function pure function of the runtime context
 */
public record ComputedValue(String expression, Function<RuntimeContext, ScalarValue> function) implements DynamicValue {

    public ComputedValue {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }

    @Override
    public ScalarValue evaluate(RuntimeContext context) {
        ScalarValue value = function.apply(context);
        if (value == null) {
            throw new IllegalStateException("Dynamic value '" + expression + "' produced no value for attempt " + context.attempt());
        }
        return value;
    }
}
