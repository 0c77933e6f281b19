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

package org.pipelineconfig.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Settings of the configuration engine itself.
 * <p>
 * To point at the root fragment: pipelineconfig.root=conf/main.config
 * To activate profiles: pipelineconfig.profiles=standard,slurm
 * To require keys on every resolve: pipelineconfig.required-keys=process.memory,process.container
 */
@ConfigMapping(prefix = "pipelineconfig")
public interface ResolverSettings {

    /**
     * Path of the root configuration fragment.
     *
     * @return the root fragment path, if configured
     */
    Optional<String> root();

    /**
     * Profiles to activate, in activation order. Later profiles override earlier ones.
     *
     * @return the profile names, if configured
     */
    Optional<List<String>> profiles();

    /**
     * Whether an included fragment that does not exist fails the load.
     * <p>
     * When disabled the include is skipped with a warning. A missing root fragment always fails.
     *
     * @return {@code true} to fail on missing includes
     */
    @WithDefault("true")
    @WithName("fail-on-missing-include")
    boolean failOnMissingInclude();

    /**
     * Whether the built-in defaults shipped with the engine form the lowest layer.
     *
     * @return {@code true} to load the built-in defaults
     */
    @WithDefault("true")
    @WithName("built-in-defaults")
    boolean builtInDefaults();

    /**
     * Dotted keys that every resolved configuration must contain.
     *
     * @return the required keys, if configured
     */
    @WithName("required-keys")
    Optional<List<String>> requiredKeys();
}
