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

import org.pipelineconfig.dynamic.AttemptConditional;
import org.pipelineconfig.dynamic.AttemptScaled;
import org.pipelineconfig.dynamic.Comparison;
import org.pipelineconfig.dynamic.DynamicValue;
import org.pipelineconfig.error.FragmentParseException;
import org.pipelineconfig.error.InvalidDynamicValueException;
import org.pipelineconfig.fragment.FragmentTokenizer.Kind;
import org.pipelineconfig.fragment.FragmentTokenizer.Token;
import org.pipelineconfig.node.ScalarValue;

/**
 * Compiles the body of a dynamic value literal.
 *
 * <p>Two forms are accepted, both referencing {@code task.attempt}:</p>
 * <ul>
 *   <li>{@code task.attempt <= 7 ? "retry" : "ignore"}, with any of {@code < <= > >= == !=}, the attempt on
 *   either side and optional parentheses around the condition</li>
 *   <li>{@code 4.GB * task.attempt}, {@code task.attempt * 2.h} or {@code task.attempt} alone</li>
 * </ul>
 */
public final class DynamicExpressionParser {

    private DynamicExpressionParser() {
    }

    /**
     * Compiles an expression given as text.
     *
     * @param expression the expression without the surrounding braces
     * @param origin where the expression was declared, used in errors
     * @return the compiled value
     * @throws InvalidDynamicValueException if the expression is not one of the accepted forms
     */
    public static DynamicValue parse(String expression, String origin) {
        List<Token> tokens;
        try {
            tokens = FragmentTokenizer.tokenize(origin, expression);
        } catch (FragmentParseException e) {
            throw new InvalidDynamicValueException(origin, expression.trim(), e.getMessage());
        }
        return parse(tokens, expression.trim(), origin);
    }

    static DynamicValue parse(List<Token> tokens, String expression, String origin) {
        List<Token> significant = new ArrayList<>();
        for (Token token : tokens) {
            if (token.kind() != Kind.NEWLINE && token.kind() != Kind.EOF) {
                significant.add(token);
            }
        }
        int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
        significant.add(new Token(Kind.EOF, "", 0, 0, end, end));
        return new ExpressionReader(significant, expression, origin).read();
    }

    private static final class ExpressionReader {

        private final List<Token> tokens;
        private final TokenCursor cursor;
        private final String expression;
        private final String origin;

        private ExpressionReader(List<Token> tokens, String expression, String origin) {
            this.tokens = tokens;
            this.cursor = new TokenCursor(tokens);
            this.expression = expression;
            this.origin = origin;
        }

        DynamicValue read() {
            if (cursor.atEnd()) {
                throw invalid("the expression is empty");
            }
            DynamicValue value = containsSymbol("?") ? conditional() : scaled();
            if (!cursor.atEnd()) {
                throw invalid("unexpected '" + cursor.peek().text() + "'");
            }
            return value;
        }

        private DynamicValue conditional() {
            int parentheses = 0;
            while (cursor.nextIfSymbol("(")) {
                parentheses++;
            }
            Comparison comparison;
            long threshold;
            if (isAttempt()) {
                readAttempt();
                comparison = comparison();
                threshold = integer();
            } else {
                threshold = integer();
                comparison = comparison().mirrored();
                if (!isAttempt()) {
                    throw invalid("the condition must compare task.attempt with an integer");
                }
                readAttempt();
            }
            for (int i = 0; i < parentheses; i++) {
                if (!cursor.nextIfSymbol(")")) {
                    throw invalid("unbalanced parentheses");
                }
            }
            expect("?");
            ScalarValue whenTrue = literal();
            expect(":");
            ScalarValue whenFalse = literal();
            return new AttemptConditional(comparison, threshold, whenTrue, whenFalse);
        }

        private DynamicValue scaled() {
            ScalarValue base;
            if (isAttempt()) {
                readAttempt();
                base = cursor.nextIfSymbol("*") ? literal() : ScalarValue.ofInteger(1);
            } else {
                base = literal();
                if (!cursor.nextIfSymbol("*")) {
                    throw invalid("the expression does not reference task.attempt");
                }
                if (!isAttempt()) {
                    throw invalid("only task.attempt can be used as a multiplier");
                }
                readAttempt();
            }
            try {
                return new AttemptScaled(base);
            } catch (IllegalArgumentException e) {
                throw invalid(e.getMessage());
            }
        }

        private boolean isAttempt() {
            return cursor.peek().isIdentifier("task")
                && cursor.peek(1).isSymbol(".")
                && cursor.peek(2).isIdentifier("attempt");
        }

        private void readAttempt() {
            cursor.next();
            cursor.next();
            cursor.next();
        }

        private Comparison comparison() {
            Token token = cursor.next();
            if (token.kind() != Kind.SYMBOL) {
                throw invalid("expected a comparison operator but found '" + token.text() + "'");
            }
            return Comparison.fromSymbol(token.text())
                .orElseThrow(() -> invalid("expected a comparison operator but found '" + token.text() + "'"));
        }

        private long integer() {
            Token token = cursor.next();
            if (token.kind() != Kind.NUMBER || token.text().indexOf('.') >= 0) {
                throw invalid("expected an integer but found '" + token.text() + "'");
            }
            try {
                return Long.parseLong(token.text());
            } catch (NumberFormatException e) {
                throw invalid("integer out of range: " + token.text());
            }
        }

        private ScalarValue literal() {
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
                    default:
                        break;
                }
            } catch (IllegalArgumentException e) {
                throw invalid(e.getMessage());
            }
            throw invalid("expected a literal value but found '" + token.text() + "'");
        }

        private void expect(String symbol) {
            if (!cursor.nextIfSymbol(symbol)) {
                throw invalid("expected '" + symbol + "' but found '" + cursor.peek().text() + "'");
            }
        }

        private boolean containsSymbol(String symbol) {
            return tokens.stream().anyMatch(token -> token.isSymbol(symbol));
        }

        private InvalidDynamicValueException invalid(String reason) {
            return new InvalidDynamicValueException(origin, expression, reason);
        }
    }
}
