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

package org.pipelineconfig.error;

/**
 * Raised while loading when a dynamic value expression cannot be compiled.
 */
public class InvalidDynamicValueException extends ConfigurationException {

    private final String expression;

    /**
     * Creates a new InvalidDynamicValueException.
     *
     * @param origin where the expression was declared
     * @param expression the expression text
     * @param reason why it was rejected
     */
    public InvalidDynamicValueException(String origin, String expression, String reason) {
        super(origin, "Invalid dynamic value '{ " + expression + " }' at " + origin + ": " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
