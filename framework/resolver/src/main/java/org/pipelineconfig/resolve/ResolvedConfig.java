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

package org.pipelineconfig.resolve;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.pipelineconfig.dynamic.RuntimeContext;
import org.pipelineconfig.error.MissingKeyException;
import org.pipelineconfig.node.ConfigNode;
import org.pipelineconfig.node.DurationLiterals;
import org.pipelineconfig.node.DynamicNode;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.node.MemorySize;
import org.pipelineconfig.node.ScalarType;
import org.pipelineconfig.node.ScalarValue;

/**
 * Fully evaluated configuration of one process at one attempt.
 *
 * <p>Keys are dotted paths such as {@code process.memory}; every value is a scalar. Instances are immutable.</p>
 */
public final class ResolvedConfig {

    private final String processName;
    private final int attempt;
    private final Map<String, ScalarValue> values;

    private ResolvedConfig(String processName, int attempt, Map<String, ScalarValue> values) {
        this.processName = processName;
        this.attempt = attempt;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Evaluates the dynamic values of a merged tree and flattens it.
     *
     * @param processName the process the tree was merged for
     * @param context the runtime context
     * @param tree the merged tree, selectors already applied
     * @return the resolved configuration
     */
    public static ResolvedConfig evaluate(String processName, RuntimeContext context, MapNode tree) {
        Objects.requireNonNull(processName, "processName must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Map<String, ScalarValue> values = new LinkedHashMap<>();
        flatten("", tree, context, values);
        return new ResolvedConfig(processName, context.attempt(), values);
    }

    /**
     * Creates a resolved configuration from already flat values.
     *
     * @param processName the process name
     * @param attempt the attempt number
     * @param values dotted key to value
     * @return the resolved configuration
     */
    public static ResolvedConfig of(String processName, int attempt, Map<String, ScalarValue> values) {
        return new ResolvedConfig(processName, new RuntimeContext(attempt).attempt(), values);
    }

    private static void flatten(String prefix, MapNode node, RuntimeContext context, Map<String, ScalarValue> out) {
        for (Map.Entry<String, ConfigNode> entry : node.entries().entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            ConfigNode value = entry.getValue();
            if (value instanceof MapNode child) {
                flatten(key, child, context, out);
            } else if (value instanceof DynamicNode dynamic) {
                out.put(key, dynamic.value().evaluate(context));
            } else if (value instanceof ScalarValue scalar) {
                out.put(key, scalar);
            }
        }
    }

    public String processName() {
        return processName;
    }

    public int attempt() {
        return attempt;
    }

    public Optional<ScalarValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Returns the value of a key that must be present.
     *
     * @param key the dotted key
     * @return the value
     * @throws MissingKeyException if the key is not set
     */
    public ScalarValue require(String key) {
        ScalarValue value = values.get(key);
        if (value == null) {
            throw new MissingKeyException(key, processName);
        }
        return value;
    }

    public String getString(String key, String defaultValue) {
        return get(key).map(ScalarValue::asText).orElse(defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        Optional<ScalarValue> value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        ScalarValue scalar = value.get();
        try {
            return switch (scalar.type()) {
                case INTEGER -> (Long) scalar.value();
                case DECIMAL -> ((BigDecimal) scalar.value()).longValueExact();
                case STRING -> Long.parseLong(((String) scalar.value()).trim());
                default -> throw invalid(key, scalar, "an integer");
            };
        } catch (ArithmeticException | NumberFormatException e) {
            throw invalid(key, scalar, "an integer");
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Optional<ScalarValue> value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        ScalarValue scalar = value.get();
        if (scalar.type() == ScalarType.BOOLEAN) {
            return (Boolean) scalar.value();
        }
        if (scalar.type() == ScalarType.STRING) {
            String text = ((String) scalar.value()).trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw invalid(key, scalar, "a boolean");
    }

    public Optional<MemorySize> getMemory(String key) {
        Optional<ScalarValue> value = get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        ScalarValue scalar = value.get();
        try {
            MemorySize size = switch (scalar.type()) {
                case SIZE -> (MemorySize) scalar.value();
                case INTEGER -> new MemorySize((Long) scalar.value());
                case STRING -> MemorySize.parse((String) scalar.value());
                default -> throw invalid(key, scalar, "a memory size");
            };
            return Optional.of(size);
        } catch (IllegalArgumentException e) {
            throw invalid(key, scalar, "a memory size");
        }
    }

    public MemorySize getMemory(String key, MemorySize defaultValue) {
        return getMemory(key).orElse(defaultValue);
    }

    public Optional<Duration> getDuration(String key) {
        Optional<ScalarValue> value = get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        ScalarValue scalar = value.get();
        try {
            Duration duration = switch (scalar.type()) {
                case DURATION -> (Duration) scalar.value();
                case STRING -> DurationLiterals.parse((String) scalar.value());
                default -> throw invalid(key, scalar, "a duration");
            };
            return Optional.of(duration);
        } catch (IllegalArgumentException e) {
            throw invalid(key, scalar, "a duration");
        }
    }

    public Duration getDuration(String key, Duration defaultValue) {
        return getDuration(key).orElse(defaultValue);
    }

    /**
     * Returns the keys under a prefix with the prefix removed, e.g. {@code section("process")} maps
     * {@code process.memory} to {@code memory}.
     *
     * @param prefix the dotted prefix, without trailing dot
     * @return the sub-map, possibly empty
     */
    public Map<String, ScalarValue> section(String prefix) {
        String start = prefix + ".";
        Map<String, ScalarValue> section = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key.startsWith(start)) {
                section.put(key.substring(start.length()), value);
            }
        });
        return Collections.unmodifiableMap(section);
    }

    public Map<String, ScalarValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    private IllegalArgumentException invalid(String key, ScalarValue value, String expected) {
        return new IllegalArgumentException("Configuration key '" + key + "' of process '" + processName
            + "' must be " + expected + " but was " + value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ResolvedConfig that)) {
            return false;
        }
        return attempt == that.attempt && processName.equals(that.processName) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processName, attempt, values);
    }

    @Override
    public String toString() {
        return "ResolvedConfig{process=" + processName + ", attempt=" + attempt + ", values=" + values + "}";
    }
}
