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

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

import org.pipelineconfig.node.MemorySize;
import org.pipelineconfig.node.ScalarType;
import org.pipelineconfig.node.ScalarValue;

/**
 * Multiplies a numeric, size or duration scalar by the attempt number, e.g. {@code 4.GB * task.attempt}.
 *
 * @param base the value for the first attempt
 */
public record AttemptScaled(ScalarValue base) implements DynamicValue {

    public AttemptScaled {
        Objects.requireNonNull(base, "base must not be null");
        if (base.type() == ScalarType.STRING || base.type() == ScalarType.BOOLEAN) {
            throw new IllegalArgumentException("Cannot scale a " + base.type() + " value by the attempt number");
        }
    }

    @Override
    public ScalarValue evaluate(RuntimeContext context) {
        long attempt = context.attempt();
        try {
            return scale(attempt);
        } catch (ArithmeticException e) {
            throw new IllegalStateException(
                "Dynamic value '" + expression() + "' overflows for attempt " + context.attempt(), e);
        }
    }

    private ScalarValue scale(long attempt) {
        return switch (base.type()) {
            case INTEGER -> ScalarValue.ofInteger(Math.multiplyExact((Long) base.value(), attempt));
            case DECIMAL -> ScalarValue.ofDecimal(((BigDecimal) base.value()).multiply(BigDecimal.valueOf(attempt)));
            case SIZE -> ScalarValue.ofSize(((MemorySize) base.value()).multiply(attempt));
            case DURATION -> ScalarValue.ofDuration(((Duration) base.value()).multipliedBy(attempt));
            default -> throw new IllegalStateException("Unsupported scaled type " + base.type());
        };
    }

    @Override
    public String expression() {
        return base.asText() + " * task.attempt";
    }
}
