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

import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.node.ConfigNode;
import org.pipelineconfig.node.DynamicNode;
import org.pipelineconfig.node.ScalarValue;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * Reads fragments written as YAML mappings.
 *
 * <p>Keys may be dotted and may contain {@code $process} selector segments. {@code includeConfig} takes a
 * path or a list of paths. A string wrapped in braces is a dynamic value, and a plain {@code 4.GB} or
 * {@code 2.h} is a size or duration literal.</p>
 */
public class YamlFragmentParser implements FragmentParser {

    /**
     * Creates a new YamlFragmentParser.
     */
    public YamlFragmentParser() {
    }

    @Override
    public Fragment parse(String name, String content) {
        Node root;
        try {
            root = new Yaml().compose(new StringReader(content));
        } catch (MarkedYAMLException e) {
            throw new FragmentParseException(location(name, e.getProblemMark()), "Invalid YAML: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new FragmentParseException(new SourceLocation(name, 1, 1), "Invalid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            return new Fragment(name, List.of());
        }
        if (!(root instanceof MappingNode mapping)) {
            throw new FragmentParseException(location(name, root.getStartMark()), "YAML fragment root is not a mapping");
        }
        return new Fragment(name, statements(name, mapping));
    }

    private List<FragmentStatement> statements(String name, MappingNode mapping) {
        List<FragmentStatement> statements = new ArrayList<>();
        for (NodeTuple tuple : mapping.getValue()) {
            Node keyNode = tuple.getKeyNode();
            Node valueNode = tuple.getValueNode();
            SourceLocation location = location(name, keyNode.getStartMark());
            if (!(keyNode instanceof ScalarNode keyScalar) || keyScalar.getValue().isBlank()) {
                throw new FragmentParseException(location, "YAML keys must be non-empty scalars");
            }
            String key = keyScalar.getValue().trim();
            if (key.equals(BlockFragmentParser.INCLUDE_DIRECTIVE)) {
                statements.addAll(includes(name, valueNode, location));
                continue;
            }
            List<String> keyPath = keyPath(key, location);
            if (valueNode instanceof MappingNode child) {
                statements.add(new BlockStatement(keyPath, statements(name, child), location));
            } else if (valueNode instanceof ScalarNode scalar) {
                statements.add(new AssignmentStatement(keyPath, scalar(name, scalar), location));
            } else {
                throw new FragmentParseException(location, "Lists are not supported for key '" + key + "'");
            }
        }
        return statements;
    }

    private List<FragmentStatement> includes(String name, Node valueNode, SourceLocation location) {
        List<Node> targets = valueNode instanceof SequenceNode sequence ? sequence.getValue() : List.of(valueNode);
        List<FragmentStatement> includes = new ArrayList<>();
        for (Node target : targets) {
            if (!(target instanceof ScalarNode scalar) || scalar.getTag().equals(Tag.NULL) || scalar.getValue().isBlank()) {
                throw new FragmentParseException(location(name, target.getStartMark()), "includeConfig expects a path or a list of paths");
            }
            includes.add(new IncludeStatement(scalar.getValue(), location(name, target.getStartMark())));
        }
        return includes;
    }

    private List<String> keyPath(String key, SourceLocation location) {
        List<String> segments = Arrays.asList(key.split("\\.", -1));
        for (String segment : segments) {
            if (segment.isBlank() || segment.equals("$")) {
                throw new FragmentParseException(location, "Invalid key '" + key + "'");
            }
        }
        return segments;
    }

    private ConfigNode scalar(String name, ScalarNode node) {
        SourceLocation location = location(name, node.getStartMark());
        Tag tag = node.getTag();
        String text = node.getValue();
        try {
            if (tag.equals(Tag.NULL)) {
                throw new FragmentParseException(location, "Null values are not supported");
            }
            if (tag.equals(Tag.BOOL)) {
                String normalized = text.toLowerCase(Locale.ROOT);
                return ScalarValue.ofBoolean(normalized.equals("true") || normalized.equals("yes") || normalized.equals("on"));
            }
            if (tag.equals(Tag.INT)) {
                return ScalarValue.ofInteger(Long.decode(text.replace("_", "")));
            }
            if (tag.equals(Tag.FLOAT)) {
                return ScalarValue.ofDecimal(new BigDecimal(text.replace("_", "")));
            }
        } catch (NumberFormatException e) {
            throw new FragmentParseException(location, "Unsupported number '" + text + "'", e);
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}") && trimmed.length() >= 2) {
            String expression = trimmed.substring(1, trimmed.length() - 1).trim();
            return new DynamicNode(DynamicExpressionParser.parse(expression, location.toString()));
        }
        if (node.getScalarStyle() == DumperOptions.ScalarStyle.PLAIN) {
            try {
                return ScalarLiterals.unitLiteral(trimmed).map(ConfigNode.class::cast).orElse(ScalarValue.ofString(text));
            } catch (IllegalArgumentException e) {
                throw new FragmentParseException(location, e.getMessage(), e);
            }
        }
        return ScalarValue.ofString(text);
    }

    private static SourceLocation location(String name, Mark mark) {
        if (mark == null) {
            return new SourceLocation(name, 1, 1);
        }
        return new SourceLocation(name, mark.getLine() + 1, mark.getColumn() + 1);
    }
}
