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

package org.pipelineconfig.layer;

import java.util.Objects;

/**
 * Where a layer or selector came from.
 *
 * @param kind the source kind, which also fixes the precedence bucket of a layer
 * @param source fragment path, profile name or process name; empty for defaults
 */
public record Provenance(Kind kind, String source) {

    /**
     * Source kinds in increasing precedence.
     */
    public enum Kind {
        DEFAULTS,
        FRAGMENT,
        PROFILE,
        SELECTOR
    }

    public Provenance {
        Objects.requireNonNull(kind, "kind must not be null");
        source = source == null ? "" : source;
    }

    public static Provenance defaults() {
        return new Provenance(Kind.DEFAULTS, "");
    }

    public static Provenance fragment(String path) {
        return new Provenance(Kind.FRAGMENT, path);
    }

    public static Provenance profile(String name) {
        return new Provenance(Kind.PROFILE, name);
    }

    public static Provenance selector(String processName) {
        return new Provenance(Kind.SELECTOR, "$" + processName);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case DEFAULTS -> "defaults";
            case FRAGMENT -> "fragment:" + source;
            case PROFILE -> "profile:" + source;
            case SELECTOR -> "selector:" + source;
        };
    }
}
