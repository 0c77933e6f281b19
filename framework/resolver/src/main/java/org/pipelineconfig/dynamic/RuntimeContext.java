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

/**
 * Per-evaluation input of dynamic values.
 *
 * @param attempt the task attempt number, starting at 1
 */
public record RuntimeContext(int attempt) {

    private static final RuntimeContext FIRST_ATTEMPT = new RuntimeContext(1);

    public RuntimeContext {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
        }
    }

    public static RuntimeContext firstAttempt() {
        return FIRST_ATTEMPT;
    }

    public static RuntimeContext attempt(int attempt) {
        return attempt == 1 ? FIRST_ATTEMPT : new RuntimeContext(attempt);
    }

    public RuntimeContext nextAttempt() {
        return new RuntimeContext(attempt + 1);
    }
}
