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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pipelineconfig.config.ResolverSettingsLoader;
import org.pipelineconfig.error.CyclicIncludeException;
import org.pipelineconfig.error.MissingKeyException;
import org.pipelineconfig.error.UnknownProfileException;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.node.MemorySize;
import org.pipelineconfig.node.ScalarValue;
import org.pipelineconfig.resolve.ProcessDirectives;
import org.pipelineconfig.resolve.ResolvedConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigEngineTest {

    @TempDir
    Path tempDir;

    private Path main;

    @BeforeEach
    void writeFragments() throws Exception {
        main = write("pipeline.config", """
            process {
                memory = "1GB"
                container = "flowcraft/base"
                version = "1.0"
                $integrity_coverage.memory = { 4.GB * task.attempt }
            }

            includeConfig "profiles.config"
            """);
        write("profiles.config", """
            profiles {
                incd {
                    process.executor = "slurm"
                    process.memory = "2GB"
                    process.$chewbbaca.queue = "chewBBACA"
                }
                oneida {
                    process.memory = "4GB"
                }
                slurmOneida {
                    process {
                        executor = "slurm"
                        clusterOptions = "--qos=oneida"
                        $chewbbaca.clusterOptions = "--qos=chewbbaca"
                    }
                }
            }
            """);
    }

    @Test
    void baseConfigurationUsesFragmentValues() {
        LoadedConfiguration loaded = ConfigEngine.create().load(main);

        ResolvedConfig resolved = loaded.resolve("assembly_mapping", 1);

        assertEquals("1GB", resolved.getString("process.memory", null));
        assertEquals(Set.of("incd", "oneida", "slurmOneida"), loaded.availableProfiles());
        assertTrue(loaded.activeProfiles().isEmpty());
    }

    @Test
    void oneidaProfileRaisesMemory() {
        ResolvedConfig resolved = ConfigEngine.create().load(main, List.of("oneida")).resolve("assembly_mapping", 1);

        assertEquals("4GB", resolved.getString("process.memory", null));
    }

    @Test
    void incdProfileSetsMemoryAndRoutesOnlyChewbbacaToItsQueue() {
        LoadedConfiguration loaded = ConfigEngine.create().load(main, List.of("incd"));

        ResolvedConfig chewbbaca = loaded.resolve("chewbbaca", 1);
        assertEquals("chewBBACA", chewbbaca.getString("process.queue", null));
        assertEquals(MemorySize.parse("2GB"), chewbbaca.getMemory("process.memory").orElseThrow());

        ResolvedConfig assemblyMapping = loaded.resolve("assembly_mapping", 1);
        assertFalse(assemblyMapping.contains("process.queue"));
        assertEquals("slurm", assemblyMapping.getString("process.executor", null));
        assertEquals(MemorySize.parse("2GB"), assemblyMapping.getMemory("process.memory").orElseThrow());
    }

    @Test
    void slurmOneidaProfileOverridesClusterOptionsForChewbbaca() {
        LoadedConfiguration loaded = ConfigEngine.create().load(main, List.of("slurmOneida"));

        assertEquals("--qos=chewbbaca", loaded.resolve("chewbbaca", 1).getString("process.clusterOptions", null));
        assertEquals("--qos=oneida", loaded.resolve("prokka", 1).getString("process.clusterOptions", null));
    }

    @Test
    void builtInRetryPolicyRetriesSevenTimesThenIgnores() {
        LoadedConfiguration loaded = ConfigEngine.create().load(main);

        for (int attempt = 1; attempt <= 7; attempt++) {
            assertEquals("retry", loaded.resolve("assembly_mapping", attempt).getString("process.errorStrategy", null),
                "attempt " + attempt);
        }
        assertEquals("ignore", loaded.resolve("assembly_mapping", 8).getString("process.errorStrategy", null));
        assertEquals(7L, loaded.resolve("assembly_mapping", 8).getLong("process.maxRetries", 0));
        assertEquals(1L, loaded.resolve("assembly_mapping", 8).getLong("process.cpus", 0));
    }

    @Test
    void attemptScaledMemoryGrowsPerAttempt() {
        LoadedConfiguration loaded = ConfigEngine.create().load(main);

        assertEquals(MemorySize.parse("4GB"), loaded.resolve("integrity_coverage", 1).getMemory("process.memory").orElseThrow());
        assertEquals(MemorySize.parse("12GB"), loaded.resolve("integrity_coverage", 3).getMemory("process.memory").orElseThrow());
        assertEquals(MemorySize.parse("1GB"), loaded.resolve("other", 3).getMemory("process.memory").orElseThrow());
    }

    @Test
    void precedenceIsDefaultsThenFragmentsThenProfilesThenSelectors() throws Exception {
        Path layered = write("layered.config", """
            process.queue = "fragment"
            process.$special.queue = "selector"
            profiles {
                p { process.queue = "profile" }
            }
            """);
        Path bare = write("bare.config", "process.cpus = 2\n");
        ConfigEngine engine = ConfigEngine.builder()
            .defaults(MapNode.nest(List.of("process", "queue"), ScalarValue.ofString("defaults")))
            .build();

        assertEquals("defaults", engine.load(bare).resolve("special", 1).getString("process.queue", null));
        assertEquals("fragment", engine.load(layered).resolve("other", 1).getString("process.queue", null));
        assertEquals("profile", engine.load(layered, List.of("p")).resolve("other", 1).getString("process.queue", null));
        assertEquals("selector", engine.load(layered, List.of("p")).resolve("special", 1).getString("process.queue", null));
    }

    @Test
    void laterProfilesOverrideEarlierOnes() {
        LoadedConfiguration loaded = ConfigEngine.create().load(main, List.of("incd", "slurmOneida", "incd"));

        assertEquals(List.of("incd", "slurmOneida"), loaded.activeProfiles());
        ResolvedConfig chewbbaca = loaded.resolve("chewbbaca", 1);
        assertEquals("chewBBACA", chewbbaca.getString("process.queue", null));
        assertEquals("--qos=chewbbaca", chewbbaca.getString("process.clusterOptions", null));
    }

    @Test
    void unknownProfileFailsTheLoad() {
        UnknownProfileException error = assertThrows(UnknownProfileException.class,
            () -> ConfigEngine.create().load(main, List.of("standard")));

        assertTrue(error.getMessage().contains("incd"));
    }

    @Test
    void cyclicIncludeFailsTheLoad() throws Exception {
        Path a = write("a.config", "includeConfig 'b.config'\n");
        write("b.config", "includeConfig 'a.config'\n");

        assertThrows(CyclicIncludeException.class, () -> ConfigEngine.create().load(a));
    }

    @Test
    void builtInDefaultsCanBeDisabled() throws Exception {
        Path bare = write("bare.config", "process.cpus = 2\n");

        ResolvedConfig resolved = ConfigEngine.builder().builtInDefaults(false).build().load(bare).resolve("qc", 1);

        assertEquals(1, resolved.size());
        assertFalse(resolved.contains("process.errorStrategy"));
    }

    @Test
    void requiredKeysAreCheckedOnResolve() throws Exception {
        Path bare = write("bare.config", "process.cpus = 2\n$qc.process.container = 'flowcraft/qc'\n");
        LoadedConfiguration loaded = ConfigEngine.builder().requiredKey("process.container").build().load(bare);

        assertEquals("flowcraft/qc", loaded.resolve("qc", 1).getString("process.container", null));
        MissingKeyException error = assertThrows(MissingKeyException.class, () -> loaded.resolve("trimming", 1));
        assertEquals("process.container", error.key());
        assertEquals("trimming", error.source());
    }

    @Test
    void directivesJoinContainerAndVersion() {
        ProcessDirectives directives = ConfigEngine.create().load(main, List.of("incd")).directives("chewbbaca", 2);

        assertEquals("flowcraft/base:1.0", directives.container().orElseThrow());
        assertEquals("chewBBACA", directives.queue().orElseThrow());
        assertEquals(ProcessDirectives.ErrorStrategy.RETRY, directives.errorStrategy());
        assertTrue(directives.shouldRetry());
    }

    @Test
    void engineReadsRootAndProfilesFromSettings() {
        ConfigEngine engine = ConfigEngine.fromSettings(ResolverSettingsLoader.load(Map.of(
            "pipelineconfig.root", main.toString(),
            "pipelineconfig.profiles", "oneida")));

        LoadedConfiguration loaded = engine.load();

        assertEquals(List.of("oneida"), loaded.activeProfiles());
        assertEquals("4GB", loaded.resolve("qc", 1).getString("process.memory", null));
    }

    @Test
    void loadWithoutConfiguredRootFails() {
        assertThrows(IllegalStateException.class, () -> ConfigEngine.create().load());
    }

    @Test
    void concurrentResolutionMatchesSequentialResolution() throws Exception {
        LoadedConfiguration loaded = ConfigEngine.create().load(main, List.of("incd", "slurmOneida"));
        List<String> processes = List.of("chewbbaca", "integrity_coverage", "prokka", "assembly_mapping");
        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            String process = processes.get(i % processes.size());
            int attempt = 1 + (i % 9);
            ResolvedConfig expected = loaded.resolve(process, attempt);
            tasks.add(() -> expected.equals(loaded.resolve(process, attempt)));
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                assertTrue(result.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    private Path write(String name, String content) throws Exception {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content);
        return path;
    }
}
