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

package org.pipelineconfig.layer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.node.MapNode;
import org.pipelineconfig.node.ScalarValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LayerStackTest {

    @Test
    void ordersLayersByKindWhateverTheInsertionOrder() {
        Layer profile = Layer.profile("oneida", tree("process.memory", "4GB"));
        Layer fragment = Layer.fragment("main.config", tree("process.memory", "2GB"));
        Layer defaults = Layer.defaults(tree("process.memory", "1GB"));

        LayerStack stack = LayerStack.builder().add(profile).add(fragment).add(defaults).build();

        assertEquals(List.of(defaults, fragment, profile), stack.layers());
    }

    @Test
    void extractsSelectorsWithScopeAndDeclaringLayer() {
        MapNode tree = MapNode.builder()
            .put(List.of("process", "memory"), ScalarValue.ofString("1GB"))
            .put(List.of("process", "$chewbbaca", "queue"), ScalarValue.ofString("chewBBACA"))
            .put(List.of("$prokka", "process", "cpus"), ScalarValue.ofInteger(8))
            .build();
        Layer fragment = Layer.fragment("main.config", tree);

        LayerStack stack = LayerStack.builder().add(fragment).build();

        assertEquals(2, stack.selectors().size());
        Selector chewbbaca = stack.selectors().get(0);
        assertEquals("chewbbaca", chewbbaca.processName());
        assertEquals(List.of("process"), chewbbaca.scope());
        assertEquals(fragment.provenance(), chewbbaca.declaredBy());
        assertEquals(Optional.of(ScalarValue.ofString("chewBBACA")),
            chewbbaca.asOverlay().find(List.of("process", "queue")));

        Selector prokka = stack.selectors().get(1);
        assertEquals(List.of(), prokka.scope());
        assertEquals(Provenance.selector("prokka"), prokka.provenance());

        MapNode stripped = stack.layers().get(0).tree();
        assertFalse(stripped.containsKey("$prokka"));
        assertEquals(1, ((MapNode) stripped.get("process").orElseThrow()).size());
    }

    @Test
    void selectorsKeepDeclarationOrderAcrossLayers() {
        Layer fragment = Layer.fragment("main.config", MapNode.nest(List.of("$a", "cpus"), ScalarValue.ofInteger(1)));
        Layer profile = Layer.profile("p", MapNode.nest(List.of("$a", "cpus"), ScalarValue.ofInteger(2)));

        LayerStack stack = LayerStack.builder().add(profile).add(fragment).build();

        assertEquals(Provenance.fragment("main.config"), stack.selectors().get(0).declaredBy());
        assertEquals(Provenance.profile("p"), stack.selectors().get(1).declaredBy());
    }

    @Test
    void rejectsSelectorLayersAndScalarSelectors() {
        assertThrows(IllegalArgumentException.class,
            () -> LayerStack.builder().add(new Layer(Provenance.selector("x"), MapNode.empty())));

        Layer scalarSelector = Layer.fragment("bad.config", MapNode.of(Map.of("$x", ScalarValue.ofInteger(1))));
        FragmentParseException error = assertThrows(FragmentParseException.class,
            () -> LayerStack.builder().add(scalarSelector).build());
        assertEquals("fragment:bad.config", error.source());
    }

    @Test
    void rendersProvenance() {
        assertEquals("defaults", Provenance.defaults().toString());
        assertEquals("fragment:conf/main.config", Provenance.fragment("conf/main.config").toString());
        assertEquals("profile:oneida", Provenance.profile("oneida").toString());
        assertEquals("selector:$chewbbaca", Provenance.selector("chewbbaca").toString());
    }

    private static MapNode tree(String dottedKey, String value) {
        return MapNode.nest(List.of(dottedKey.split("\\.")), ScalarValue.ofString(value));
    }
}
