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

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.pipelineconfig.node.DurationLiterals;
import org.pipelineconfig.node.MemorySize;
import org.pipelineconfig.node.ScalarValue;

/**
 * Conversion of number and unit literals shared by the fragment parsers.
 */
final class ScalarLiterals {

    private static final Pattern UNIT_LITERAL = Pattern.compile("^(-?\\d+(?:\\.\\d+)?)\\.([A-Za-z]+)$");

    private ScalarLiterals() {
    }

    static ScalarValue number(String text) {
        if (text.indexOf('.') >= 0) {
            return ScalarValue.ofDecimal(new BigDecimal(text));
        }
        try {
            return ScalarValue.ofInteger(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Integer literal out of range: " + text, e);
        }
    }

    /**
     * Converts {@code 4} + {@code GB} or {@code 2} + {@code h} into a size or duration scalar.
     */
    static ScalarValue withUnit(String number, String unit) {
        BigDecimal amount = new BigDecimal(number);
        if (MemorySize.isUnit(unit)) {
            return ScalarValue.ofSize(MemorySize.of(amount, unit));
        }
        if (DurationLiterals.isUnit(unit)) {
            return ScalarValue.ofDuration(DurationLiterals.of(amount, unit));
        }
        throw new IllegalArgumentException("Unknown unit '" + unit + "'");
    }

    /**
     * Recognises a plain {@code 4.GB} style literal written as text.
     */
    static Optional<ScalarValue> unitLiteral(String text) {
        Matcher matcher = UNIT_LITERAL.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String unit = matcher.group(2);
        if (!MemorySize.isUnit(unit) && !DurationLiterals.isUnit(unit)) {
            return Optional.empty();
        }
        return Optional.of(withUnit(matcher.group(1), unit));
    }
}
