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

import org.pipelineconfig.node.ScalarValue;

/**
 * Chooses between two scalars by comparing the attempt number with a fixed threshold,
 * e.g. {@code task.attempt <= 7 ? "retry" : "ignore"}.
 *
 * @param comparison operator applied as {@code attempt <op> threshold}
 * @param threshold the fixed right-hand operand
 * @param whenTrue value while the comparison holds
 * @param whenFalse value otherwise
 */
public record AttemptConditional(
    Comparison comparison,
    long threshold,
    ScalarValue whenTrue,
    ScalarValue whenFalse
) implements DynamicValue {

    public AttemptConditional {
        Objects.requireNonNull(comparison, "comparison must not be null");
        Objects.requireNonNull(whenTrue, "whenTrue must not be null");
        Objects.requireNonNull(whenFalse, "whenFalse must not be null");
    }

    /**
     * The retry policy that retries up to {@code limit} attempts and ignores the failure afterwards.
     *
     * @param limit the last attempt that is still retried
     * @return the policy
     */
    public static AttemptConditional retryWhileAttemptAtMost(int limit) {
        return new AttemptConditional(
            Comparison.LESS_OR_EQUAL,
            limit,
            ScalarValue.ofString("retry"),
            ScalarValue.ofString("ignore"));
    }

    @Override
    public ScalarValue evaluate(RuntimeContext context) {
        return comparison.test(context.attempt(), threshold) ? whenTrue : whenFalse;
    }

    @Override
    public String expression() {
        return "task.attempt " + comparison.symbol() + " " + threshold + " ? " + whenTrue + " : " + whenFalse;
    }
}
