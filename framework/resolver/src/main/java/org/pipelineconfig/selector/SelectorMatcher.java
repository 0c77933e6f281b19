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

package org.pipelineconfig.selector;

import java.util.List;
import java.util.Objects;

import org.pipelineconfig.layer.Selector;

/**
 * Finds the selectors that apply to a process.
 *
 * <p>Matching is exact on the process name. Declaration order is kept so later selectors win when merged.</p>
 */
public final class SelectorMatcher {

    private SelectorMatcher() {
    }

    /**
     * @param processName the concrete process name
     * @param selectors all selectors of the stack, in declaration order
     * @return the matching selectors in declaration order, possibly empty
     */
    public static List<Selector> match(String processName, List<Selector> selectors) {
        Objects.requireNonNull(processName, "processName must not be null");
        return selectors.stream()
            .filter(selector -> selector.processName().equals(processName))
            .toList();
    }
}
