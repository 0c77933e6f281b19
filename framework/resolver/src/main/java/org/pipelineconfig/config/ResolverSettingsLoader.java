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
import java.util.Map;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

/**
 * Builds {@link ResolverSettings} outside of a managed container.
 */
public final class ResolverSettingsLoader {

    static final String OVERRIDES_SOURCE = "pipelineconfig-overrides";
    static final int OVERRIDES_ORDINAL = 400;

    private static final Logger LOG = Logger.getLogger(ResolverSettingsLoader.class);

    private ResolverSettingsLoader() {
    }

    /**
     * Reads settings from system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}.
     *
     * @return the settings
     */
    public static ResolverSettings load() {
        return load(Map.of());
    }

    /**
     * Reads settings from the default sources, with the given properties taking precedence over all of them.
     *
     * @param overrides property name to value, e.g. {@code pipelineconfig.profiles -> standard,slurm}
     * @return the settings
     */
    public static ResolverSettings load(Map<String, String> overrides) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withMapping(ResolverSettings.class);
        if (!overrides.isEmpty()) {
            builder.withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE, OVERRIDES_ORDINAL));
        }
        SmallRyeConfig config = builder.build();
        ResolverSettings settings = config.getConfigMapping(ResolverSettings.class);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Resolver settings: root=%s, profiles=%s, failOnMissingInclude=%s, builtInDefaults=%s",
                settings.root().orElse("<unset>"),
                settings.profiles().orElse(List.of()),
                settings.failOnMissingInclude(),
                settings.builtInDefaults());
        }
        return settings;
    }
}
