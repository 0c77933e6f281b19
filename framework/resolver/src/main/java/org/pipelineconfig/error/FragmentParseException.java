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

import org.pipelineconfig.fragment.SourceLocation;

/**
 * Raised when a fragment contains syntax or structure the loader does not accept.
 */
public class FragmentParseException extends ConfigurationException {

    private final SourceLocation location;

    public FragmentParseException(SourceLocation location, String message) {
        super(location.fragment(), message + " at " + location);
        this.location = location;
    }

    public FragmentParseException(SourceLocation location, String message, Throwable cause) {
        super(location.fragment(), message + " at " + location, cause);
        this.location = location;
    }

    /**
     * Creates an exception for a structural problem that has no single statement position.
     *
     * @param source the fragment or layer identity
     * @param message the error message
     */
    public FragmentParseException(String source, String message) {
        super(source, message + " in " + source);
        this.location = null;
    }

    /**
     * Position of the offending statement.
     *
     * @return the location, or {@code null} for structural problems spanning a whole layer
     */
    public SourceLocation location() {
        return location;
    }
}
