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

package org.pipelineconfig.fragment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.pipelineconfig.error.MissingFragmentException;
import org.pipelineconfig.layer.Layer;

/**
 * Loads the built-in defaults layer shipped on the classpath.
 */
public final class DefaultsResourceLoader {

    public static final String RESOURCE = "META-INF/pipelineconfig/defaults.config";

    private static final Logger LOG = Logger.getLogger(DefaultsResourceLoader.class);

    private DefaultsResourceLoader() {
    }

    /**
     * Loads the built-in defaults.
     *
     * @return the defaults layer, if the resource is present
     */
    public static Optional<Layer> load() {
        return load(RESOURCE);
    }

    /**
     * Loads a defaults layer from a classpath resource written in block syntax. Includes are not allowed.
     *
     * @param resource the classpath resource name
     * @return the defaults layer, or empty when the resource is not visible
     */
    public static Optional<Layer> load(String resource) {
        ClassLoader classLoader = resolveClassLoader();
        InputStream stream = openResource(classLoader, resource);
        if (stream == null) {
            LOG.debugf("Configuration defaults resource %s not found", resource);
            return Optional.empty();
        }
        String name = "classpath:" + resource;
        String content;
        try (InputStream streamToRead = stream) {
            content = new String(streamToRead.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MissingFragmentException(Path.of(resource), null, e);
        }
        Fragment fragment = new BlockFragmentParser().parse(name, content);
        Layer layer = Layer.defaults(FragmentLoader.toTree(fragment));
        LOG.debugf("Loaded configuration defaults from %s", name);
        return Optional.of(layer);
    }

    private static ClassLoader resolveClassLoader() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = DefaultsResourceLoader.class.getClassLoader();
        }
        return classLoader;
    }

    private static InputStream openResource(ClassLoader classLoader, String resource) {
        InputStream stream = classLoader != null ? classLoader.getResourceAsStream(resource) : null;
        if (stream == null) {
            stream = DefaultsResourceLoader.class.getResourceAsStream("/" + resource);
        }
        return stream;
    }
}
