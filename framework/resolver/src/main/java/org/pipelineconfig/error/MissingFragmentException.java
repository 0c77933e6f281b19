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

import org.pipelineconfig.fragment.SourceLocation;

/**
 * Raised when a root or included fragment cannot be found or read.
 */
public class MissingFragmentException extends ConfigurationException {

    private final Path path;

    public MissingFragmentException(Path path, SourceLocation includedAt) {
        super(path.toString(), describe(path, includedAt));
        this.path = path;
    }

    public MissingFragmentException(Path path, SourceLocation includedAt, Throwable cause) {
        super(path.toString(), "Failed to read configuration fragment " + path + suffix(includedAt), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    private static String describe(Path path, SourceLocation includedAt) {
        return "Configuration fragment not found: " + path + suffix(includedAt);
    }

    private static String suffix(SourceLocation includedAt) {
        return includedAt == null ? "" : " (included at " + includedAt + ")";
    }
}
