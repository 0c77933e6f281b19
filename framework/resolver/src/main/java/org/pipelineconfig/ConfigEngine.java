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

package org.pipelineconfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.pipelineconfig.config.ResolverSettings;
import org.pipelineconfig.fragment.DefaultsResourceLoader;
import org.pipelineconfig.fragment.FragmentLoader;
import org.pipelineconfig.layer.Layer;
import org.pipelineconfig.layer.LayerStack;
import org.pipelineconfig.merge.MergeEngine;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.profile.ProfileRegistry;

/**
 * Entry point that loads a layered configuration once and hands out a {@link LoadedConfiguration}.
 *
 * <p>Loading reads the built-in defaults, the root fragment with everything it includes, collects the declared
 * profiles, activates the requested ones and merges the selector-free layers. Any failure aborts the load; no
 * partial configuration is ever returned.</p>
 */
public class ConfigEngine {

    private static final Logger LOG = Logger.getLogger(ConfigEngine.class);

    private final boolean failOnMissingInclude;
    private final boolean builtInDefaults;
    private final List<Layer> extraDefaults;
    private final List<String> requiredKeys;
    private final Optional<Path> configuredRoot;
    private final List<String> configuredProfiles;

    private ConfigEngine(Builder builder) {
        this.failOnMissingInclude = builder.failOnMissingInclude;
        this.builtInDefaults = builder.builtInDefaults;
        this.extraDefaults = List.copyOf(builder.extraDefaults);
        this.requiredKeys = List.copyOf(builder.requiredKeys);
        this.configuredRoot = Optional.ofNullable(builder.root);
        this.configuredProfiles = List.copyOf(builder.profiles);
    }

    /**
     * Creates an engine with default behaviour: strict includes, built-in defaults, no required keys.
     *
     * @return the engine
     */
    public static ConfigEngine create() {
        return builder().build();
    }

    /**
     * Creates an engine from externally supplied settings.
     *
     * @param settings the engine settings
     * @return the engine
     */
    public static ConfigEngine fromSettings(ResolverSettings settings) {
        Builder builder = builder()
            .failOnMissingInclude(settings.failOnMissingInclude())
            .builtInDefaults(settings.builtInDefaults())
            .requiredKeys(settings.requiredKeys().orElse(List.of()))
            .profiles(settings.profiles().orElse(List.of()));
        settings.root().filter(root -> !root.isBlank()).map(Path::of).ifPresent(builder::root);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the configured root fragment with the configured profiles.
     *
     * @return the loaded configuration
     * @throws IllegalStateException if no root fragment is configured
     */
    public LoadedConfiguration load() {
        Path root = configuredRoot.orElseThrow(() -> new IllegalStateException(
            "No root configuration fragment configured; set pipelineconfig.root"));
        return load(root, configuredProfiles);
    }

    /**
     * Loads a root fragment without activating any profile.
     *
     * @param rootFragment the root fragment
     * @return the loaded configuration
     */
    public LoadedConfiguration load(Path rootFragment) {
        return load(rootFragment, List.of());
    }

    /**
     * Loads a root fragment and activates profiles in the given order.
     *
     * @param rootFragment the root fragment
     * @param profiles the profiles to activate; later ones override earlier ones
     * @return the loaded configuration
     * @throws org.pipelineconfig.error.ConfigurationException if any fragment or profile is invalid
     */
    public LoadedConfiguration load(Path rootFragment, List<String> profiles) {
        Objects.requireNonNull(rootFragment, "rootFragment must not be null");
        Objects.requireNonNull(profiles, "profiles must not be null");

        List<Layer> baseLayers = new ArrayList<>();
        if (builtInDefaults) {
            DefaultsResourceLoader.load().ifPresent(baseLayers::add);
        }
        baseLayers.addAll(extraDefaults);
        baseLayers.addAll(new FragmentLoader(failOnMissingInclude).load(rootFragment));

        ProfileRegistry registry = ProfileRegistry.fromLayers(baseLayers);
        List<Layer> profileLayers = registry.activate(profiles);

        LayerStack stack = LayerStack.builder()
            .addAll(ProfileRegistry.stripProfiles(baseLayers))
            .addAll(profileLayers)
            .build();
        MapNode base = MergeEngine.merge(stack.layers());

        LOG.infof("Loaded configuration %s: %d layer(s), %d selector(s), profiles %s",
            rootFragment, stack.layers().size(), stack.selectors().size(), registry.names());
        return new LoadedConfiguration(stack, base, profileLayers.stream().map(layer -> layer.provenance().source()).toList(),
            registry.names(), requiredKeys);
    }

    /**
     * Builder for {@link ConfigEngine}.
     */
    public static final class Builder {

        private boolean failOnMissingInclude = true;
        private boolean builtInDefaults = true;
        private final List<Layer> extraDefaults = new ArrayList<>();
        private final List<String> requiredKeys = new ArrayList<>();
        private final List<String> profiles = new ArrayList<>();
        private Path root;

        private Builder() {
        }

        public Builder failOnMissingInclude(boolean failOnMissingInclude) {
            this.failOnMissingInclude = failOnMissingInclude;
            return this;
        }

        public Builder builtInDefaults(boolean builtInDefaults) {
            this.builtInDefaults = builtInDefaults;
            return this;
        }

        /**
         * Adds a defaults tree above the built-in defaults and below every fragment.
         *
         * @param defaults the defaults tree
         * @return this builder
         */
        public Builder defaults(MapNode defaults) {
            this.extraDefaults.add(Layer.defaults(defaults));
            return this;
        }

        public Builder requiredKeys(List<String> keys) {
            keys.stream().filter(key -> !key.isBlank()).map(String::trim).forEach(requiredKeys::add);
            return this;
        }

        public Builder requiredKey(String key) {
            return requiredKeys(List.of(key));
        }

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder profiles(List<String> profiles) {
            this.profiles.addAll(profiles);
            return this;
        }

        public ConfigEngine build() {
            return new ConfigEngine(this);
        }
    }
}
