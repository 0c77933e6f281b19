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

package org.pipelineconfig.fragment;

import java.util.List;

/**
 * Parsed form of one configuration source, before includes are resolved.
 *
 * @param name the fragment name used in diagnostics
 * @param statements top-level statements in textual order
 */
public record Fragment(String name, List<FragmentStatement> statements) {

    public Fragment {
        statements = List.copyOf(statements);
    }
}
