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
 * Position of a statement inside a fragment. Lines and columns start at 1.
 *
 * @param fragment the fragment name, usually its path
 * @param line the line number
 * @param column the column number
 */
public record SourceLocation(String fragment, int line, int column) {

    @Override
    public String toString() {
        return fragment + ":" + line + ":" + column;
    }
}
