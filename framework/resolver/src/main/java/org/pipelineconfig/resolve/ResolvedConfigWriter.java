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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pipelineconfig.node.ScalarValue;

/**
 * Renders resolved configurations as JSON for executors running outside the JVM.
 *
 * <p>The document shape is {@code {"process": ..., "attempt": ..., "config": {...}}}. Integers, decimals and
 * booleans stay JSON-typed; sizes and durations are written in their text form.</p>
 */
public class ResolvedConfigWriter {

    private final ObjectMapper objectMapper;

    /**
     * Creates a writer producing indented JSON.
     */
    public ResolvedConfigWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    /**
     * Creates a writer using the given mapper.
     *
     * @param objectMapper the mapper
     */
    public ResolvedConfigWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the JSON tree of a resolved configuration.
     *
     * @param resolved the resolved configuration
     * @return the JSON object
     */
    public ObjectNode toTree(ResolvedConfig resolved) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("process", resolved.processName());
        root.put("attempt", resolved.attempt());
        ObjectNode config = root.putObject("config");
        for (Map.Entry<String, ScalarValue> entry : resolved.asMap().entrySet()) {
            config.set(entry.getKey(), objectMapper.valueToTree(entry.getValue().toPlainValue()));
        }
        return root;
    }

    /**
     * Serializes a resolved configuration.
     *
     * @param resolved the resolved configuration
     * @return the JSON text
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(ResolvedConfig resolved) {
        try {
            return objectMapper.writeValueAsString(toTree(resolved));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration of process " + resolved.processName(), e);
        }
    }

    /**
     * Writes a resolved configuration to a file, replacing it if present.
     *
     * @param resolved the resolved configuration
     * @param target the file to write
     * @throws IOException if the file cannot be written
     */
    public void write(ResolvedConfig resolved, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), toTree(resolved));
    }
}
