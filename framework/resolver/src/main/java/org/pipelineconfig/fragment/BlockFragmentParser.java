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

import java.util.ArrayList;
import java.util.List;

import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.fragment.FragmentTokenizer.Kind;
import org.pipelineconfig.fragment.FragmentTokenizer.Token;
import org.pipelineconfig.node.ConfigNode;
import org.pipelineconfig.node.DynamicNode;
import org.pipelineconfig.node.ScalarValue;

/**
 * Parser for the nested-block fragment syntax.
 *
 * <pre>
 * includeConfig "resources.config"
 * process {
 *     memory = "1GB"
 *     errorStrategy = { task.attempt &lt;= 7 ? "retry" : "ignore" }
 *     $chewbbaca.queue = "chewBBACA"
 * }
 * profiles {
 *     oneida { process.memory = 4.GB }
 * }
 * </pre>
 */
public class BlockFragmentParser implements FragmentParser {

    static final String INCLUDE_DIRECTIVE = "includeConfig";

    /**
     * Creates a new BlockFragmentParser.
     */
    public BlockFragmentParser() {
    }

    @Override
    public Fragment parse(String name, String content) {
        List<Token> tokens = FragmentTokenizer.tokenize(name, content);
        StatementReader reader = new StatementReader(name, content, tokens);
        return new Fragment(name, reader.statements(false));
    }

    private static final class StatementReader {

        private final String fragment;
        private final String content;
        private final TokenCursor cursor;

        private StatementReader(String fragment, String content, List<Token> tokens) {
            this.fragment = fragment;
            this.content = content;
            this.cursor = new TokenCursor(tokens);
        }

        List<FragmentStatement> statements(boolean nested) {
            List<FragmentStatement> statements = new ArrayList<>();
            while (true) {
                skipSeparators();
                Token token = cursor.peek();
                if (token.kind() == Kind.EOF) {
                    if (nested) {
                        throw error(token, "Unclosed block, expected '}'");
                    }
                    return statements;
                }
                if (token.isSymbol("}")) {
                    if (!nested) {
                        throw error(token, "Unexpected '}'");
                    }
                    return statements;
                }
                statements.add(statement());
                expectStatementEnd();
            }
        }

        private FragmentStatement statement() {
            Token first = cursor.peek();
            if (first.isIdentifier(INCLUDE_DIRECTIVE) && cursor.peek(1).kind() == Kind.STRING) {
                cursor.next();
                return new IncludeStatement(cursor.next().text(), location(first));
            }
            List<String> keyPath = keyPath();
            Token operator = cursor.next();
            if (operator.isSymbol("=")) {
                return new AssignmentStatement(keyPath, value(), location(first));
            }
            if (operator.isSymbol("{")) {
                List<FragmentStatement> body = statements(true);
                cursor.next();
                return new BlockStatement(keyPath, body, location(first));
            }
            throw error(operator, "Expected '=' or '{' after '" + String.join(".", keyPath) + "'");
        }

        private List<String> keyPath() {
            List<String> path = new ArrayList<>();
            path.add(segment());
            while (cursor.nextIfSymbol(".")) {
                path.add(segment());
            }
            return path;
        }

        private String segment() {
            Token token = cursor.next();
            if (token.kind() == Kind.IDENTIFIER) {
                return token.text();
            }
            if (token.kind() == Kind.SELECTOR) {
                return "$" + token.text();
            }
            if (token.kind() == Kind.STRING && !token.text().isBlank()) {
                return token.text();
            }
            throw error(token, "Expected a configuration key but found '" + describe(token) + "'");
        }

        private ConfigNode value() {
            Token token = cursor.next();
            try {
                switch (token.kind()) {
                    case STRING:
                        return ScalarValue.ofString(token.text());
                    case NUMBER:
                        if (cursor.peek().isSymbol(".") && cursor.peek(1).kind() == Kind.IDENTIFIER) {
                            cursor.next();
                            return ScalarLiterals.withUnit(token.text(), cursor.next().text());
                        }
                        return ScalarLiterals.number(token.text());
                    case IDENTIFIER:
                        if (token.text().equals("true") || token.text().equals("false")) {
                            return ScalarValue.ofBoolean(Boolean.parseBoolean(token.text()));
                        }
                        break;
                    case SYMBOL:
                        if (token.isSymbol("{")) {
                            return dynamicValue(token);
                        }
                        break;
                    default:
                        break;
                }
            } catch (IllegalArgumentException e) {
                throw new FragmentParseException(location(token), e.getMessage(), e);
            }
            throw error(token, "Unsupported value '" + describe(token) + "'");
        }

        private DynamicNode dynamicValue(Token open) {
            List<Token> body = new ArrayList<>();
            int depth = 1;
            while (true) {
                Token token = cursor.next();
                if (token.kind() == Kind.EOF) {
                    throw error(open, "Unclosed dynamic value, expected '}'");
                }
                if (token.isSymbol("{")) {
                    depth++;
                } else if (token.isSymbol("}") && --depth == 0) {
                    String expression = content.substring(open.end(), token.start()).trim();
                    return new DynamicNode(DynamicExpressionParser.parse(body, expression, location(open).toString()));
                }
                body.add(token);
            }
        }

        private void skipSeparators() {
            while (cursor.peek().kind() == Kind.NEWLINE || cursor.peek().isSymbol(";")) {
                cursor.next();
            }
        }

        private void expectStatementEnd() {
            Token token = cursor.peek();
            if (token.kind() == Kind.NEWLINE || token.kind() == Kind.EOF || token.isSymbol(";") || token.isSymbol("}")) {
                return;
            }
            throw error(token, "Expected end of statement but found '" + describe(token) + "'");
        }

        private SourceLocation location(Token token) {
            return new SourceLocation(fragment, token.line(), token.column());
        }

        private FragmentParseException error(Token token, String message) {
            return new FragmentParseException(location(token), message);
        }

        private static String describe(Token token) {
            return switch (token.kind()) {
                case EOF -> "end of fragment";
                case NEWLINE -> "end of line";
                case SELECTOR -> "$" + token.text();
                default -> token.text();
            };
        }
    }
}
