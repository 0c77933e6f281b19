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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pipelineconfig.error.CyclicIncludeException;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.error.MissingFragmentException;
import org.pipelineconfig.layer.Layer;
import org.pipelineconfig.layer.Provenance;
import org.pipelineconfig.merge.MergeEngine;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.node.MemorySize;
import org.pipelineconfig.node.ScalarValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FragmentLoaderTest {

    @TempDir
    Path tempDir;

    private final FragmentLoader loader = new FragmentLoader();

    @Test
    void includeIsInlinedAtItsPosition() throws Exception {
        // Given
        Path main = write("main.config", """
            process.memory = "1GB"
            includeConfig "extra.config"
            process.cpus = 4
            """);
        write("extra.config", """
            process {
                memory = "2GB"
                cpus = 2
            }
            """);

        // When
        List<Layer> layers = loader.load(main);

        // Then
        assertEquals(3, layers.size());
        assertEquals(Provenance.fragment(main.toRealPath().toString()), layers.get(0).provenance());
        assertEquals(Provenance.fragment(tempDir.resolve("extra.config").toRealPath().toString()), layers.get(1).provenance());
        MapNode merged = MergeEngine.merge(layers);
        assertEquals(Optional.of(ScalarValue.ofString("2GB")), merged.find(List.of("process", "memory")));
        assertEquals(Optional.of(ScalarValue.ofInteger(4)), merged.find(List.of("process", "cpus")));
    }

    @Test
    void laterIncludeOverridesEarlierInclude() throws Exception {
        Path main = write("main.config", """
            includeConfig "first.config"
            includeConfig "second.config"
            """);
        write("first.config", "process.queue = 'first'\n");
        write("second.config", "process.queue = 'second'\n");

        MapNode merged = MergeEngine.merge(loader.load(main));

        assertEquals(Optional.of(ScalarValue.ofString("second")), merged.find(List.of("process", "queue")));
    }

    @Test
    void includeInsideBlockIsScopedToTheBlock() throws Exception {
        Path main = write("main.config", """
            profiles {
                big { includeConfig "big.config" }
            }
            """);
        write("big.config", "process.memory = 8.GB\n");

        MapNode merged = MergeEngine.merge(loader.load(main));

        assertEquals(Optional.of(ScalarValue.ofSize(MemorySize.parse("8GB"))),
            merged.find(List.of("profiles", "big", "process", "memory")));
    }

    @Test
    void relativeIncludesResolveAgainstTheIncludingFragment() throws Exception {
        Path main = write("conf/main.config", "includeConfig 'sub/child.config'\n");
        write("conf/sub/child.config", "includeConfig '../sibling.config'\nprocess.cpus = 2\n");
        write("conf/sibling.config", "process.queue = 'sibling'\n");

        MapNode merged = MergeEngine.merge(loader.load(main));

        assertEquals(Optional.of(ScalarValue.ofString("sibling")), merged.find(List.of("process", "queue")));
        assertEquals(Optional.of(ScalarValue.ofInteger(2)), merged.find(List.of("process", "cpus")));
    }

    @Test
    void mixesYamlAndBlockFragments() throws Exception {
        Path main = write("main.config", "includeConfig 'resources.yaml'\nprocess.cpus = 8\n");
        write("resources.yaml", "process:\n  memory: 4.GB\n  cpus: 2\n");

        MapNode merged = MergeEngine.merge(loader.load(main));

        assertEquals(Optional.of(ScalarValue.ofSize(MemorySize.parse("4GB"))), merged.find(List.of("process", "memory")));
        assertEquals(Optional.of(ScalarValue.ofInteger(8)), merged.find(List.of("process", "cpus")));
    }

    @Test
    void detectsIncludeCycle() throws Exception {
        Path a = write("a.config", "includeConfig 'b.config'\n");
        write("b.config", "includeConfig 'a.config'\n");

        CyclicIncludeException error = assertThrows(CyclicIncludeException.class, () -> loader.load(a));

        Path realA = a.toRealPath();
        assertEquals(List.of(realA, tempDir.resolve("b.config").toRealPath(), realA), error.cycle());
    }

    @Test
    void detectsSelfInclude() throws Exception {
        Path a = write("a.config", "x = 1\nincludeConfig 'a.config'\n");

        CyclicIncludeException error = assertThrows(CyclicIncludeException.class, () -> loader.load(a));

        assertEquals(2, error.cycle().size());
    }

    @Test
    void sharedIncludeIsNotACycle() throws Exception {
        Path main = write("main.config", "includeConfig 'left.config'\nincludeConfig 'right.config'\n");
        write("left.config", "includeConfig 'common.config'\n");
        write("right.config", "includeConfig 'common.config'\n");
        write("common.config", "process.executor = 'slurm'\n");

        List<Layer> layers = loader.load(main);

        assertEquals(2, layers.size());
    }

    @Test
    void missingRootFails() {
        Path missing = tempDir.resolve("nowhere.config");

        MissingFragmentException error = assertThrows(MissingFragmentException.class, () -> new FragmentLoader(false).load(missing));

        assertEquals(missing.toAbsolutePath().normalize(), error.path());
    }

    @Test
    void missingIncludeFailsByDefault() throws Exception {
        Path main = write("main.config", "x = 1\nincludeConfig 'gone.config'\n");

        MissingFragmentException error = assertThrows(MissingFragmentException.class, () -> loader.load(main));

        assertTrue(error.getMessage().contains("gone.config"));
        assertTrue(error.getMessage().contains("main.config:2:1"));
    }

    @Test
    void missingIncludeIsSkippedWhenLenient() throws Exception {
        Path main = write("main.config", "x = 1\nincludeConfig 'gone.config'\ny = 2\n");

        List<Layer> layers = new FragmentLoader(false).load(main);

        MapNode merged = MergeEngine.merge(layers);
        assertEquals(2, merged.size());
    }

    @Test
    void rejectsMisplacedSelectors() throws Exception {
        Path nested = write("nested.config", "$a { $b.cpus = 1 }\n");
        Path bare = write("bare.config", "$a = 1\n");
        Path included = write("included.config", "$a { includeConfig 'other.config' }\n");

        assertTrue(assertThrows(FragmentParseException.class, () -> loader.load(nested)).getMessage().contains("nested"));
        assertThrows(FragmentParseException.class, () -> loader.load(bare));
        assertThrows(FragmentParseException.class, () -> loader.load(included));
    }

    @Test
    void selfContainedTreeRejectsIncludes() {
        Fragment fragment = new BlockFragmentParser().parse("defaults", "includeConfig 'x.config'\n");

        assertThrows(FragmentParseException.class, () -> FragmentLoader.toTree(fragment));
    }

    private Path write(String relative, String content) throws Exception {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return path;
    }
}
