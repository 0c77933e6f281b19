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

/**
 * Turns fragment text into statements.
 */
public interface FragmentParser {

    /**
     * Parses fragment content.
     *
     * @param name the fragment name used in diagnostics
     * @param content the fragment text
     * @return the parsed fragment
     * @throws org.pipelineconfig.error.FragmentParseException on unsupported syntax
     * @throws org.pipelineconfig.error.InvalidDynamicValueException on a malformed dynamic expression
     */
    Fragment parse(String name, String content);
}
