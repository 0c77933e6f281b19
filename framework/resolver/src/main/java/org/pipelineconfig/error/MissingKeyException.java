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
 * Raised at resolution time when a required key has no value in any layer.
 */
public class MissingKeyException extends ConfigurationException {

    private final String key;

    public MissingKeyException(String key, String processName) {
        super(processName, "Required configuration key '" + key + "' is not set for process '" + processName + "'");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
