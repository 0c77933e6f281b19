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

import java.util.Set;
import java.util.TreeSet;

/**
 * Raised when activation requests a profile that no fragment defines.
 */
public class UnknownProfileException extends ConfigurationException {

    private final Set<String> availableProfiles;

    public UnknownProfileException(String profile, Set<String> availableProfiles) {
        super(profile, "Unknown configuration profile '" + profile + "'. Available profiles: " + new TreeSet<>(availableProfiles));
        this.availableProfiles = Set.copyOf(availableProfiles);
    }

    public Set<String> availableProfiles() {
        return availableProfiles;
    }
}
