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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.error.UnknownProfileException;
import org.pipelineconfig.layer.Layer;
import org.pipelineconfig.layer.Provenance;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.node.ScalarValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileRegistryTest {

    private final Layer first = Layer.fragment("main.config", MapNode.builder()
        .put(List.of("process", "memory"), ScalarValue.ofString("1GB"))
        .put(List.of("profiles", "oneida", "process", "memory"), ScalarValue.ofString("4GB"))
        .put(List.of("profiles", "incd", "process", "executor"), ScalarValue.ofString("slurm"))
        .build());
    private final Layer second = Layer.fragment("extra.config", MapNode.builder()
        .put(List.of("profiles", "oneida", "process", "cpus"), ScalarValue.ofInteger(8))
        .build());

    @Test
    void collectsAndMergesProfileDefinitions() {
        ProfileRegistry registry = ProfileRegistry.fromLayers(List.of(first, second));

        assertEquals(Set.of("oneida", "incd"), registry.names());
        MapNode oneida = registry.profile("oneida").orElseThrow();
        assertEquals(Optional.of(ScalarValue.ofString("4GB")), oneida.find(List.of("process", "memory")));
        assertEquals(Optional.of(ScalarValue.ofInteger(8)), oneida.find(List.of("process", "cpus")));
    }

    @Test
    void stripsProfileDefinitionsFromLayers() {
        List<Layer> stripped = ProfileRegistry.stripProfiles(List.of(first, second));

        assertFalse(stripped.get(0).tree().containsKey(ProfileRegistry.PROFILES_KEY));
        assertTrue(stripped.get(0).tree().containsKey("process"));
        assertTrue(stripped.get(1).tree().isEmpty());
    }

    @Test
    void activatesInRequestOrderOnce() {
        ProfileRegistry registry = ProfileRegistry.fromLayers(List.of(first, second));

        List<Layer> layers = registry.activate(List.of("incd", " ", "oneida", "incd"));

        assertEquals(List.of(Provenance.profile("incd"), Provenance.profile("oneida")),
            layers.stream().map(Layer::provenance).toList());
    }

    @Test
    void unknownProfileNamesAvailableOnes() {
        ProfileRegistry registry = ProfileRegistry.fromLayers(List.of(first));

        UnknownProfileException error = assertThrows(UnknownProfileException.class,
            () -> registry.activate(List.of("oneida", "standard")));

        assertEquals("standard", error.source());
        assertEquals(Set.of("oneida", "incd"), error.availableProfiles());
        assertTrue(error.getMessage().contains("[incd, oneida]"));
    }

    @Test
    void noProfilesRequestedActivatesNothing() {
        assertTrue(ProfileRegistry.of(Map.of()).activate(List.of()).isEmpty());
    }

    @Test
    void profileBodyMustBeABlock() {
        Layer flat = Layer.fragment("bad.config", MapNode.nest(List.of("profiles", "oneida"), ScalarValue.ofString("4GB")));
        Layer scalar = Layer.fragment("worse.config", MapNode.of(Map.of("profiles", ScalarValue.ofInteger(1))));

        assertThrows(FragmentParseException.class, () -> ProfileRegistry.fromLayers(List.of(flat)));
        assertThrows(FragmentParseException.class, () -> ProfileRegistry.fromLayers(List.of(scalar)));
    }
}
