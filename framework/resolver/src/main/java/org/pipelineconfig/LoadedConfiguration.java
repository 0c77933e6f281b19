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

import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.jboss.logging.Logger;
import org.pipelineconfig.dynamic.RuntimeContext;
import org.pipelineconfig.layer.LayerStack;
import org.pipelineconfig.layer.Selector;
import org.pipelineconfig.merge.MergeEngine;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.resolve.ProcessDirectives;
import org.pipelineconfig.resolve.ResolvedConfig;
import org.pipelineconfig.selector.SelectorMatcher;

/**
 * Result of a successful load: the merged base tree plus the selectors still to apply per process.
 *
 * <p>Instances are immutable. {@link #resolve(String, RuntimeContext)} only reads shared state, so it may be called
 * from any number of threads at once.</p>
 */
public final class LoadedConfiguration {

    private static final Logger LOG = Logger.getLogger(LoadedConfiguration.class);

    private final LayerStack stack;
    private final MapNode base;
    private final List<String> activeProfiles;
    private final Set<String> availableProfiles;
    private final List<String> requiredKeys;

    LoadedConfiguration(LayerStack stack, MapNode base, List<String> activeProfiles, Set<String> availableProfiles,
                        List<String> requiredKeys) {
        this.stack = Objects.requireNonNull(stack, "stack must not be null");
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.activeProfiles = List.copyOf(activeProfiles);
        this.availableProfiles = Set.copyOf(availableProfiles);
        this.requiredKeys = List.copyOf(requiredKeys);
    }

    /**
     * Resolves the configuration of a process at an attempt.
     *
     * @param processName the process name
     * @param context the runtime context
     * @return the fully evaluated configuration
     * @throws org.pipelineconfig.error.MissingKeyException if a required key is absent
     */
    public ResolvedConfig resolve(String processName, RuntimeContext context) {
        Objects.requireNonNull(processName, "processName must not be null");
        Objects.requireNonNull(context, "context must not be null");
        MapNode tree = base;
        List<Selector> matching = SelectorMatcher.match(processName, stack.selectors());
        for (Selector selector : matching) {
            tree = MergeEngine.merge(tree, selector.asOverlay());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Resolving process %s attempt %d with %d selector(s)", processName, context.attempt(), matching.size());
        }
        ResolvedConfig resolved = ResolvedConfig.evaluate(processName, context, tree);
        for (String key : requiredKeys) {
            resolved.require(key);
        }
        return resolved;
    }

    /**
     * Resolves the configuration of a process at an attempt.
     *
     * @param processName the process name
     * @param attempt the attempt number, starting at 1
     * @return the fully evaluated configuration
     */
    public ResolvedConfig resolve(String processName, int attempt) {
        return resolve(processName, RuntimeContext.attempt(attempt));
    }

    /**
     * Resolves a process and reads its executor directives.
     *
     * @param processName the process name
     * @param attempt the attempt number, starting at 1
     * @return the directives
     */
    public ProcessDirectives directives(String processName, int attempt) {
        return ProcessDirectives.from(resolve(processName, attempt));
    }

    public LayerStack stack() {
        return stack;
    }

    /**
     * Merged tree of all layers, before selectors and dynamic values are applied.
     *
     * @return the base tree
     */
    public MapNode baseTree() {
        return base;
    }

    public List<String> activeProfiles() {
        return activeProfiles;
    }

    public Set<String> availableProfiles() {
        return availableProfiles;
    }

    public List<String> requiredKeys() {
        return requiredKeys;
    }

    @Override
    public String toString() {
        return "LoadedConfiguration{" + stack + ", activeProfiles=" + activeProfiles + "}";
    }
}
