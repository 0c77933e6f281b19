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

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import org.pipelineconfig.node.MemorySize;

/**
 * Typed view of the {@code process} scope of a resolved configuration, as handed to an executor.
 *
 * @param processName the process the directives apply to
 * @param attempt the attempt the directives were resolved for
 * @param cpus number of CPUs, at least 1
 * @param memory memory limit, if set
 * @param time wall-clock limit, if set
 * @param container container image, joined with {@code process.version} as {@code image:version} when both are set
 * @param queue scheduler queue, if set
 * @param executor executor name, if set
 * @param clusterOptions raw scheduler options, if set
 * @param errorStrategy what to do when the attempt fails
 * @param maxRetries retry ceiling, not negative
 */
public record ProcessDirectives(
    String processName,
    int attempt,
    int cpus,
    Optional<MemorySize> memory,
    Optional<Duration> time,
    Optional<String> container,
    Optional<String> queue,
    Optional<String> executor,
    Optional<String> clusterOptions,
    ErrorStrategy errorStrategy,
    int maxRetries) {

    public static final String SCOPE = "process";

    public static final int DEFAULT_CPUS = 1;
    public static final int DEFAULT_MAX_RETRIES = 0;

    /**
     * What the executor does after a failed attempt.
     */
    public enum ErrorStrategy {
        RETRY,
        IGNORE,
        TERMINATE,
        FINISH;

        /**
         * Parses a strategy name, ignoring case.
         *
         * @param value the name
         * @return the strategy
         * @throws IllegalArgumentException for unknown names
         */
        public static ErrorStrategy fromValue(String value) {
            return ErrorStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Reads the {@code process.*} keys of a resolved configuration.
     *
     * @param resolved the resolved configuration
     * @return the directives
     * @throws IllegalArgumentException if a directive has a value of the wrong kind
     */
    public static ProcessDirectives from(ResolvedConfig resolved) {
        int cpus = toInt(resolved, "cpus", DEFAULT_CPUS);
        if (cpus < 1) {
            throw invalid(resolved, "cpus", "must be at least 1 but was " + cpus);
        }
        int maxRetries = toInt(resolved, "maxRetries", DEFAULT_MAX_RETRIES);
        if (maxRetries < 0) {
            throw invalid(resolved, "maxRetries", "must not be negative but was " + maxRetries);
        }

        String strategyText = resolved.getString(key("errorStrategy"), ErrorStrategy.TERMINATE.value());
        ErrorStrategy errorStrategy;
        try {
            errorStrategy = ErrorStrategy.fromValue(strategyText);
        } catch (IllegalArgumentException e) {
            throw invalid(resolved, "errorStrategy", "unknown strategy '" + strategyText + "'");
        }

        return new ProcessDirectives(
            resolved.processName(),
            resolved.attempt(),
            cpus,
            resolved.getMemory(key("memory")),
            resolved.getDuration(key("time")),
            container(resolved),
            text(resolved, "queue"),
            text(resolved, "executor"),
            text(resolved, "clusterOptions"),
            errorStrategy,
            maxRetries);
    }

    /**
     * Whether another attempt should be scheduled after this one fails.
     *
     * @return true when the strategy is retry and the retry ceiling has not been reached
     */
    public boolean shouldRetry() {
        return errorStrategy == ErrorStrategy.RETRY && attempt <= maxRetries;
    }

    private static Optional<String> container(ResolvedConfig resolved) {
        Optional<String> image = text(resolved, "container");
        Optional<String> version = text(resolved, "version");
        if (image.isPresent() && version.isPresent() && !image.get().contains(":")) {
            return Optional.of(image.get() + ":" + version.get());
        }
        return image;
    }

    private static Optional<String> text(ResolvedConfig resolved, String name) {
        return resolved.get(key(name)).map(value -> value.asText()).filter(value -> !value.isBlank());
    }

    private static int toInt(ResolvedConfig resolved, String name, int defaultValue) {
        long value = resolved.getLong(key(name), defaultValue);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw invalid(resolved, name, "is out of range: " + value);
        }
        return (int) value;
    }

    private static String key(String name) {
        return SCOPE + "." + name;
    }

    private static IllegalArgumentException invalid(ResolvedConfig resolved, String name, String reason) {
        return new IllegalArgumentException(
            "Directive '" + key(name) + "' of process '" + resolved.processName() + "' " + reason);
    }
}
