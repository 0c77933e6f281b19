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

/**
 * Splits block-syntax fragment text into tokens. Newlines are kept because they end statements.
 */
final class FragmentTokenizer {

    enum Kind {
        IDENTIFIER,
        SELECTOR,
        STRING,
        NUMBER,
        SYMBOL,
        NEWLINE,
        EOF
    }

    /**
     * @param kind the token kind
     * @param text identifier, selector name without {@code $}, unescaped string content, number or symbol text
     * @param line 1-based line
     * @param column 1-based column
     * @param start offset of the first character in the source
     * @param end offset after the last character in the source
     */
    record Token(Kind kind, String text, int line, int column, int start, int end) {

        boolean isSymbol(String symbol) {
            return kind == Kind.SYMBOL && text.equals(symbol);
        }

        boolean isIdentifier(String name) {
            return kind == Kind.IDENTIFIER && text.equals(name);
        }
    }

    private static final List<String> TWO_CHAR_SYMBOLS = List.of("<=", ">=", "==", "!=");
    private static final String SINGLE_CHAR_SYMBOLS = "{}=.;?:*()<>";

    private final String fragment;
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int column = 1;

    private FragmentTokenizer(String fragment, String source) {
        this.fragment = fragment;
        this.source = source;
    }

    static List<Token> tokenize(String fragment, String source) {
        return new FragmentTokenizer(fragment, source).run();
    }

    private List<Token> run() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                tokens.add(new Token(Kind.NEWLINE, "\n", line, column, pos, pos + 1));
                advance();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#' || startsWith("//")) {
                skipLine();
            } else if (startsWith("/*")) {
                skipBlockComment();
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else if (Character.isDigit(c) || (c == '-' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (isIdentifierStart(c)) {
                readIdentifier(Kind.IDENTIFIER, pos, line, column);
            } else if (c == '$') {
                readSelector();
            } else {
                readSymbol(c);
            }
        }
        tokens.add(new Token(Kind.EOF, "", line, column, pos, pos));
        return tokens;
    }

    private void readString(char quote) {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        advance();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw error(startLine, startColumn, "Unterminated string literal");
            }
            char c = source.charAt(pos);
            if (c == quote) {
                advance();
                break;
            }
            if (c == '\\') {
                advance();
                if (pos >= source.length()) {
                    throw error(startLine, startColumn, "Unterminated string literal");
                }
                char escaped = source.charAt(pos);
                switch (escaped) {
                    case 'n' -> text.append('\n');
                    case 't' -> text.append('\t');
                    case '\\', '\'', '"', '$' -> text.append(escaped);
                    default -> throw error(line, column, "Unsupported escape sequence '\\" + escaped + "'");
                }
                advance();
                continue;
            }
            text.append(c);
            advance();
        }
        tokens.add(new Token(Kind.STRING, text.toString(), startLine, startColumn, start, pos));
    }

    private void readNumber() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        if (source.charAt(pos) == '-') {
            advance();
        }
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            advance();
        }
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            advance();
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                advance();
            }
        }
        tokens.add(new Token(Kind.NUMBER, source.substring(start, pos), startLine, startColumn, start, pos));
    }

    private void readSelector() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        advance();
        if (pos >= source.length() || !isIdentifierStart(source.charAt(pos))) {
            throw error(startLine, startColumn, "Expected a process name after '$'");
        }
        readIdentifier(Kind.SELECTOR, start, startLine, startColumn);
    }

    private void readIdentifier(Kind kind, int start, int startLine, int startColumn) {
        int nameStart = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
        tokens.add(new Token(kind, source.substring(nameStart, pos), startLine, startColumn, start, pos));
    }

    private void readSymbol(char c) {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        for (String symbol : TWO_CHAR_SYMBOLS) {
            if (startsWith(symbol)) {
                advance();
                advance();
                tokens.add(new Token(Kind.SYMBOL, symbol, startLine, startColumn, start, pos));
                return;
            }
        }
        if (SINGLE_CHAR_SYMBOLS.indexOf(c) < 0) {
            throw error(startLine, startColumn, "Unexpected character '" + c + "'");
        }
        advance();
        tokens.add(new Token(Kind.SYMBOL, String.valueOf(c), startLine, startColumn, start, pos));
    }

    private void skipLine() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            advance();
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        while (!startsWith("*/")) {
            if (pos >= source.length()) {
                throw error(startLine, startColumn, "Unterminated block comment");
            }
            advance();
        }
        advance();
        advance();
    }

    private boolean startsWith(String text) {
        return source.startsWith(text, pos);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private FragmentParseException error(int atLine, int atColumn, String message) {
        return new FragmentParseException(new SourceLocation(fragment, atLine, atColumn), message);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
