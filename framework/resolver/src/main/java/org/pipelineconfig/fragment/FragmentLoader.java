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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jboss.logging.Logger;
import org.pipelineconfig.error.CyclicIncludeException;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.error.MissingFragmentException;
import org.pipelineconfig.layer.Layer;
import org.pipelineconfig.layer.Selector;
import org.pipelineconfig.node.MapNode;

/**
 * Loads a root fragment and everything it includes into an ordered list of layers.
 *
 * <p>An include behaves as if the target's top-level content were written at the include point, inside the
 * enclosing block. The loader splits every fragment at its include points, so the result is one layer per
 * contiguous run of statements, in textual order: statements after an include override the included
 * fragment, and a later include overrides an earlier one.</p>
 */
public class FragmentLoader {

    private static final Logger LOG = Logger.getLogger(FragmentLoader.class);

    private final boolean failOnMissingInclude;
    private final FragmentParser blockParser = new BlockFragmentParser();
    private final FragmentParser yamlParser = new YamlFragmentParser();

    /**
     * Creates a loader that fails on missing includes.
     */
    public FragmentLoader() {
        this(true);
    }

    /**
     * Creates a new FragmentLoader.
     *
     * @param failOnMissingInclude whether a missing included fragment is fatal; the root fragment always is
     */
    public FragmentLoader(boolean failOnMissingInclude) {
        this.failOnMissingInclude = failOnMissingInclude;
    }

    /**
     * Loads the root fragment and its includes.
     *
     * @param rootFragment path of the root fragment
     * @return fragment layers in precedence order
     * @throws MissingFragmentException if a fragment cannot be found or read
     * @throws CyclicIncludeException if fragments include each other in a loop
     * @throws FragmentParseException if a fragment is malformed
     */
    public List<Layer> load(Path rootFragment) {
        Objects.requireNonNull(rootFragment, "rootFragment must not be null");
        LoadRun run = new LoadRun();
        run.loadFragment(rootFragment, List.of(), null);
        LOG.debugf("Loaded %d fragment layer(s) from %s", run.layers.size(), rootFragment);
        return List.copyOf(run.layers);
    }

    /**
     * Converts a single self-contained fragment into a tree. Includes are rejected.
     *
     * @param fragment the parsed fragment
     * @return the fragment's tree
     */
    public static MapNode toTree(Fragment fragment) {
        TreeWriter writer = new TreeWriter(fragment.name(), null, null);
        writer.statements(fragment.statements(), List.of(), false);
        return writer.current.build();
    }

    FragmentParser parserFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? yamlParser : blockParser;
    }

    private final class LoadRun {

        private final List<Layer> layers = new ArrayList<>();
        private final List<Path> inProgress = new ArrayList<>();

        void loadFragment(Path path, List<String> scope, SourceLocation includedAt) {
            Path absolute = path.toAbsolutePath().normalize();
            if (!Files.isRegularFile(absolute)) {
                if (includedAt != null && !failOnMissingInclude) {
                    LOG.warnf("Skipping missing configuration fragment %s included at %s", absolute, includedAt);
                    return;
                }
                throw new MissingFragmentException(absolute, includedAt);
            }
            Path fragmentPath;
            String content;
            try {
                fragmentPath = absolute.toRealPath();
                content = Files.readString(fragmentPath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new MissingFragmentException(absolute, includedAt, e);
            }

            int cycleStart = inProgress.indexOf(fragmentPath);
            if (cycleStart >= 0) {
                List<Path> cycle = new ArrayList<>(inProgress.subList(cycleStart, inProgress.size()));
                cycle.add(fragmentPath);
                throw new CyclicIncludeException(cycle);
            }

            Fragment fragment = parserFor(fragmentPath).parse(fragmentPath.toString(), content);
            LOG.debugf("Parsed configuration fragment %s (%d statement(s))", fragmentPath, fragment.statements().size());

            inProgress.add(fragmentPath);
            TreeWriter writer = new TreeWriter(fragmentPath.toString(), fragmentPath, this);
            writer.statements(fragment.statements(), scope, false);
            writer.flush();
            inProgress.remove(inProgress.size() - 1);
        }
    }

    /**
     * Writes statements into the current segment tree. A {@code null} run means includes are not allowed.
     */
    private static final class TreeWriter {

        private final String fragmentName;
        private final Path fragmentPath;
        private final LoadRun run;
        private MapNode.Builder current = MapNode.builder();

        private TreeWriter(String fragmentName, Path fragmentPath, LoadRun run) {
            this.fragmentName = fragmentName;
            this.fragmentPath = fragmentPath;
            this.run = run;
        }

        void statements(List<FragmentStatement> statements, List<String> scope, boolean inSelector) {
            for (FragmentStatement statement : statements) {
                if (statement instanceof IncludeStatement include) {
                    include(include, scope, inSelector);
                } else if (statement instanceof AssignmentStatement assignment) {
                    checkSelectors(assignment.keyPath(), inSelector, assignment.location());
                    if (Selector.isSelectorKey(assignment.keyPath().get(assignment.keyPath().size() - 1))) {
                        throw new FragmentParseException(assignment.location(),
                            "A selector must scope a key, e.g. $process.key = value");
                    }
                    current.put(concat(scope, assignment.keyPath()), assignment.value());
                } else if (statement instanceof BlockStatement block) {
                    boolean selector = checkSelectors(block.keyPath(), inSelector, block.location());
                    List<String> path = concat(scope, block.keyPath());
                    current.ensure(path);
                    statements(block.statements(), path, inSelector || selector);
                }
            }
        }

        private void include(IncludeStatement include, List<String> scope, boolean inSelector) {
            if (run == null) {
                throw new FragmentParseException(include.location(), "includeConfig is not allowed in " + fragmentName);
            }
            if (inSelector) {
                throw new FragmentParseException(include.location(), "includeConfig is not allowed inside a selector");
            }
            Path target = Path.of(include.target());
            if (!target.isAbsolute() && fragmentPath.getParent() != null) {
                target = fragmentPath.getParent().resolve(target);
            }
            flush();
            run.loadFragment(target, scope, include.location());
        }

        void flush() {
            if (run != null && !current.isEmpty()) {
                run.layers.add(Layer.fragment(fragmentName, current.build()));
                current = MapNode.builder();
            }
        }

        private static boolean checkSelectors(List<String> keyPath, boolean inSelector, SourceLocation location) {
            long selectors = keyPath.stream().filter(Selector::isSelectorKey).count();
            if (selectors > 1 || (selectors == 1 && inSelector)) {
                throw new FragmentParseException(location, "Selectors cannot be nested");
            }
            return selectors == 1;
        }

        private static List<String> concat(List<String> scope, List<String> keyPath) {
            List<String> path = new ArrayList<>(scope.size() + keyPath.size());
            path.addAll(scope);
            path.addAll(keyPath);
            return path;
        }
    }
}
