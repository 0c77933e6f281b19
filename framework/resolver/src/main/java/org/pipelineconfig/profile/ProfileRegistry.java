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

package org.pipelineconfig.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.error.UnknownProfileException;
import org.pipelineconfig.layer.Layer;
import org.pipelineconfig.merge.MergeEngine;
import org.pipelineconfig.node.ConfigNode;
import org.pipelineconfig.node.MapNode;

/**
 * Named profiles available for activation.
 *
 * <p>Profiles are read from the top-level {@code profiles} mapping of the loaded layers. When several layers
 * define the same profile the definitions merge in layer order. The registry is an immutable value.</p>
 */
public final class ProfileRegistry {

    public static final String PROFILES_KEY = "profiles";

    private static final Logger LOG = Logger.getLogger(ProfileRegistry.class);

    private final Map<String, MapNode> profiles;

    private ProfileRegistry(Map<String, MapNode> profiles) {
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }

    /**
     * Creates a registry from explicit profile trees.
     *
     * @param profiles profile name to profile tree
     * @return the registry
     */
    public static ProfileRegistry of(Map<String, MapNode> profiles) {
        return new ProfileRegistry(profiles);
    }

    /**
     * Collects the profiles declared by the given layers.
     *
     * @param layers defaults and fragment layers in precedence order
     * @return the registry
     * @throws FragmentParseException if {@code profiles} or a profile body is not a mapping
     */
    public static ProfileRegistry fromLayers(List<Layer> layers) {
        Map<String, MapNode> profiles = new LinkedHashMap<>();
        for (Layer layer : layers) {
            Optional<ConfigNode> declared = layer.tree().get(PROFILES_KEY);
            if (declared.isEmpty()) {
                continue;
            }
            if (!(declared.get() instanceof MapNode definitions)) {
                throw invalid(layer, "'" + PROFILES_KEY + "' must be a block of named profiles");
            }
            for (Map.Entry<String, ConfigNode> entry : definitions.entries().entrySet()) {
                if (!(entry.getValue() instanceof MapNode body)) {
                    throw invalid(layer, "Profile '" + entry.getKey() + "' must be a block");
                }
                profiles.merge(entry.getKey(), body, MergeEngine::merge);
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Discovered configuration profiles %s", profiles.keySet());
        }
        return new ProfileRegistry(profiles);
    }

    /**
     * Removes the {@code profiles} mapping from layers once the registry has been built from them.
     *
     * @param layers the layers
     * @return the layers without profile definitions
     */
    public static List<Layer> stripProfiles(List<Layer> layers) {
        List<Layer> stripped = new ArrayList<>(layers.size());
        for (Layer layer : layers) {
            stripped.add(layer.withTree(layer.tree().without(PROFILES_KEY)));
        }
        return stripped;
    }

    public Set<String> names() {
        return profiles.keySet();
    }

    public boolean contains(String name) {
        return profiles.containsKey(name);
    }

    public Optional<MapNode> profile(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /**
     * Produces one profile layer per requested name, in request order.
     *
     * <p>Blank names are ignored and a name requested twice is activated once, at its first position.</p>
     *
     * @param names the profiles to activate
     * @return the profile layers
     * @throws UnknownProfileException if any name is not defined
     */
    public List<Layer> activate(List<String> names) {
        Set<String> requested = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String trimmed = name.trim();
            if (!profiles.containsKey(trimmed)) {
                throw new UnknownProfileException(trimmed, profiles.keySet());
            }
            if (!requested.add(trimmed)) {
                LOG.debugf("Profile %s requested more than once, keeping its first position", trimmed);
            }
        }
        List<Layer> layers = new ArrayList<>(requested.size());
        for (String name : requested) {
            layers.add(Layer.profile(name, profiles.get(name)));
        }
        if (!layers.isEmpty()) {
            LOG.infof("Activated configuration profiles %s", requested);
        }
        return layers;
    }

    @Override
    public String toString() {
        return "ProfileRegistry" + profiles.keySet();
    }

    private static FragmentParseException invalid(Layer layer, String message) {
        return new FragmentParseException(layer.provenance().toString(), message);
    }
}
