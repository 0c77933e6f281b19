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

import java.util.List;

import org.pipelineconfig.fragment.FragmentTokenizer.Kind;
import org.pipelineconfig.fragment.FragmentTokenizer.Token;

/**
 * Read position over a token list. The list always ends with an EOF token.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int index;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        int at = Math.min(index + ahead, tokens.size() - 1);
        return tokens.get(at);
    }

    Token next() {
        Token token = peek();
        if (token.kind() != Kind.EOF) {
            index++;
        }
        return token;
    }

    boolean atEnd() {
        return peek().kind() == Kind.EOF;
    }

    boolean nextIfSymbol(String symbol) {
        if (peek().isSymbol(symbol)) {
            index++;
            return true;
        }
        return false;
    }
}
