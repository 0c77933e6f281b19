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

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed scalar leaf of a configuration tree.
 *
 * <p>The Java type of {@code value} is fixed by {@code type}: String, Long, BigDecimal, Boolean,
 * {@link MemorySize} or {@link Duration}. Scalars are opaque while merging; only consumers interpret units.</p>
 *
 * @param type the scalar kind
 * @param value the typed value
 */
public record ScalarValue(ScalarType type, Object value) implements ConfigNode {

    public ScalarValue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Class<?> expected = switch (type) {
            case STRING -> String.class;
            case INTEGER -> Long.class;
            case DECIMAL -> BigDecimal.class;
            case BOOLEAN -> Boolean.class;
            case SIZE -> MemorySize.class;
            case DURATION -> Duration.class;
        };
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(
                "Scalar of type " + type + " requires a " + expected.getSimpleName() + " but got " + value.getClass().getName());
        }
    }

    public static ScalarValue ofString(String value) {
        return new ScalarValue(ScalarType.STRING, value);
    }

    public static ScalarValue ofInteger(long value) {
        return new ScalarValue(ScalarType.INTEGER, value);
    }

    public static ScalarValue ofDecimal(BigDecimal value) {
        return new ScalarValue(ScalarType.DECIMAL, value);
    }

    public static ScalarValue ofBoolean(boolean value) {
        return new ScalarValue(ScalarType.BOOLEAN, value);
    }

    public static ScalarValue ofSize(MemorySize value) {
        return new ScalarValue(ScalarType.SIZE, value);
    }

    public static ScalarValue ofDuration(Duration value) {
        return new ScalarValue(ScalarType.DURATION, value);
    }

    /**
     * Canonical text form of the value, as a consumer reading plain strings would see it.
     *
     * @return the rendered value
     */
    public String asText() {
        return switch (type) {
            case DECIMAL -> ((BigDecimal) value).toPlainString();
            case DURATION -> DurationLiterals.format((Duration) value);
            default -> value.toString();
        };
    }

    /**
     * Value suitable for generic serializers: numbers and booleans stay typed, everything else is text.
     *
     * @return a Long, BigDecimal, Boolean or String
     */
    public Object toPlainValue() {
        return switch (type) {
            case INTEGER, DECIMAL, BOOLEAN -> value;
            default -> asText();
        };
    }

    @Override
    public String toString() {
        return type == ScalarType.STRING ? "\"" + value + "\"" : asText();
    }
}
