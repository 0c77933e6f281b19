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

/**
 * Base class for configuration failures. These are configuration bugs, not transient faults, and are never retried.
 */
public class ConfigurationException extends RuntimeException {

    private final String source;

    /**
     * Creates a new ConfigurationException.
     *
     * @param source identity of the offending fragment, profile or selector
     * @param message the error message
     */
    public ConfigurationException(String source, String message) {
        super(message);
        this.source = source;
    }

    /**
     * Creates a new ConfigurationException with a cause.
     *
     * @param source identity of the offending fragment, profile or selector
     * @param message the error message
     * @param cause the underlying cause
     */
    public ConfigurationException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * Identity of the configuration element that caused the failure.
     *
     * @return a fragment path, profile name or selector pattern
     */
    public String source() {
        return source;
    }
}
