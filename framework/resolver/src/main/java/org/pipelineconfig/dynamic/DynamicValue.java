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

import org.pipelineconfig.node.ScalarValue;

/**
 * A configuration value computed from the {@link RuntimeContext} of one task attempt.
 *
 * <p>Implementations must be pure: the same context always yields the same scalar, and evaluation
 * reads no shared mutable state. Many attempts of many processes evaluate the same instance concurrently.</p>
 */
public interface DynamicValue {

    /**
     * Computes the value for one attempt.
     *
     * @param context the attempt being resolved
     * @return the scalar value, never {@code null}
     */
    ScalarValue evaluate(RuntimeContext context);

    /**
     * Source text of the expression, used in diagnostics.
     *
     * @return the expression text without the surrounding braces
     */
    String expression();
}
