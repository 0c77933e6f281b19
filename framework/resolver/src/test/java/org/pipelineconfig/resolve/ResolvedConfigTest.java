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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.pipelineconfig.dynamic.AttemptConditional;
import org.pipelineconfig.dynamic.AttemptScaled;
import org.pipelineconfig.dynamic.RuntimeContext;
import org.pipelineconfig.error.MissingKeyException;
import org.pipelineconfig.node.DynamicNode;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.node.MemorySize;
import org.pipelineconfig.node.ScalarValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResolvedConfigTest {

    private final MapNode tree = MapNode.builder()
        .put(List.of("process", "cpus"), ScalarValue.ofInteger(2))
        .put(List.of("process", "memory"), new DynamicNode(new AttemptScaled(ScalarValue.ofSize(MemorySize.parse("4GB")))))
        .put(List.of("process", "errorStrategy"), new DynamicNode(AttemptConditional.retryWhileAttemptAtMost(2)))
        .put(List.of("process", "time"), ScalarValue.ofString("2h"))
        .put(List.of("process", "ext", "debug"), ScalarValue.ofBoolean(true))
        .put(List.of("executor"), ScalarValue.ofString("slurm"))
        .build();

    @Test
    void flattensAndEvaluatesForTheAttempt() {
        ResolvedConfig first = ResolvedConfig.evaluate("assembly", RuntimeContext.firstAttempt(), tree);
        ResolvedConfig third = ResolvedConfig.evaluate("assembly", RuntimeContext.attempt(3), tree);

        assertEquals(List.of("process.cpus", "process.memory", "process.errorStrategy", "process.time",
            "process.ext.debug", "executor"), List.copyOf(first.asMap().keySet()));
        assertEquals(MemorySize.parse("4GB"), first.getMemory("process.memory").orElseThrow());
        assertEquals("retry", first.getString("process.errorStrategy", null));
        assertEquals(MemorySize.parse("12GB"), third.getMemory("process.memory").orElseThrow());
        assertEquals("ignore", third.getString("process.errorStrategy", null));
        assertEquals(3, third.attempt());
        assertEquals("assembly", third.processName());
    }

    @Test
    void evaluationIsRepeatable() {
        RuntimeContext second = RuntimeContext.attempt(2);

        assertEquals(ResolvedConfig.evaluate("assembly", second, tree), ResolvedConfig.evaluate("assembly", second, tree));
    }

    @Test
    void typedAccessorsConvertTextAndApplyDefaults() {
        ResolvedConfig resolved = ResolvedConfig.evaluate("assembly", RuntimeContext.firstAttempt(), tree);

        assertEquals(2L, resolved.getLong("process.cpus", 1));
        assertEquals(1L, resolved.getLong("process.maxRetries", 1));
        assertTrue(resolved.getBoolean("process.ext.debug", false));
        assertEquals(Duration.ofHours(2), resolved.getDuration("process.time", Duration.ZERO));
        assertEquals(MemorySize.parse("1GB"), resolved.getMemory("process.disk", MemorySize.parse("1GB")));
        assertEquals("fallback", resolved.getString("process.queue", "fallback"));
    }

    @Test
    void typedAccessorsRejectWrongKinds() {
        ResolvedConfig resolved = ResolvedConfig.evaluate("assembly", RuntimeContext.firstAttempt(), tree);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> resolved.getLong("executor", 0));
        assertTrue(error.getMessage().contains("executor"));
        assertTrue(error.getMessage().contains("assembly"));
        assertThrows(IllegalArgumentException.class, () -> resolved.getMemory("process.ext.debug"));
        assertThrows(IllegalArgumentException.class, () -> resolved.getDuration("process.cpus"));
        assertThrows(IllegalArgumentException.class, () -> resolved.getBoolean("executor", false));
    }

    @Test
    void requireFailsForMissingKeys() {
        ResolvedConfig resolved = ResolvedConfig.evaluate("assembly", RuntimeContext.firstAttempt(), tree);

        assertEquals(ScalarValue.ofString("slurm"), resolved.require("executor"));
        MissingKeyException error = assertThrows(MissingKeyException.class, () -> resolved.require("process.container"));
        assertEquals("process.container", error.key());
        assertEquals("assembly", error.source());
    }

    @Test
    void sectionStripsThePrefix() {
        ResolvedConfig resolved = ResolvedConfig.evaluate("assembly", RuntimeContext.firstAttempt(), tree);

        Map<String, ScalarValue> process = resolved.section("process");

        assertEquals(5, process.size());
        assertEquals(ScalarValue.ofBoolean(true), process.get("ext.debug"));
        assertFalse(process.containsKey("executor"));
    }

    @Test
    void flatValuesCanBeWrappedDirectly() {
        Map<String, ScalarValue> values = new LinkedHashMap<>();
        values.put("process.cpus", ScalarValue.ofDecimal(new BigDecimal("4")));

        ResolvedConfig resolved = ResolvedConfig.of("qc", 2, values);

        assertEquals(4L, resolved.getLong("process.cpus", 1));
        assertEquals(Optional.empty(), resolved.get("process.memory"));
        assertThrows(IllegalArgumentException.class, () -> ResolvedConfig.of("qc", 0, values));
    }
}
