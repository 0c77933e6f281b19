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

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when fragments include each other in a loop.
 */
public class CyclicIncludeException extends ConfigurationException {

    private final List<Path> cycle;

    /**
     * Creates a new CyclicIncludeException.
     *
     * @param cycle the include chain, starting and ending with the same fragment
     */
    public CyclicIncludeException(List<Path> cycle) {
        super(cycle.get(cycle.size() - 1).toString(), "Cyclic configuration include: " + render(cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<Path> cycle() {
        return cycle;
    }

    private static String render(List<Path> cycle) {
        return cycle.stream()
            .map(Path::toString)
            .collect(Collectors.joining(" -> "));
    }
}
