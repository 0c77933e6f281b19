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

package org.pipelineconfig.node;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and rendering of duration literals such as {@code 30s}, {@code 2.h} or {@code 1.5h}.
 */
public final class DurationLiterals {

    private static final Pattern LITERAL = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*\\.?\\s*([A-Za-z]+)\\s*$");
    private static final Map<String, Long> UNIT_MILLIS = new LinkedHashMap<>();

    static {
        UNIT_MILLIS.put("ms", 1L);
        UNIT_MILLIS.put("milli", 1L);
        UNIT_MILLIS.put("millis", 1L);
        UNIT_MILLIS.put("s", 1_000L);
        UNIT_MILLIS.put("sec", 1_000L);
        UNIT_MILLIS.put("second", 1_000L);
        UNIT_MILLIS.put("seconds", 1_000L);
        UNIT_MILLIS.put("m", 60_000L);
        UNIT_MILLIS.put("min", 60_000L);
        UNIT_MILLIS.put("minute", 60_000L);
        UNIT_MILLIS.put("minutes", 60_000L);
        UNIT_MILLIS.put("h", 3_600_000L);
        UNIT_MILLIS.put("hour", 3_600_000L);
        UNIT_MILLIS.put("hours", 3_600_000L);
        UNIT_MILLIS.put("d", 86_400_000L);
        UNIT_MILLIS.put("day", 86_400_000L);
        UNIT_MILLIS.put("days", 86_400_000L);
    }

    private DurationLiterals() {
    }

    /**
     * Whether the given text names a duration unit.
     *
     * @param unit candidate unit
     * @return true for ms, s, m/min, h, d and their long forms
     */
    public static boolean isUnit(String unit) {
        return unit != null && UNIT_MILLIS.containsKey(unit.toLowerCase(Locale.ROOT));
    }

    public static Duration of(BigDecimal amount, String unit) {
        Long millis = unit == null ? null : UNIT_MILLIS.get(unit.toLowerCase(Locale.ROOT));
        if (millis == null) {
            throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
        try {
            return Duration.ofMillis(amount.multiply(BigDecimal.valueOf(millis))
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration " + amount.toPlainString() + " " + unit + " is out of range", e);
        }
    }

    /**
     * Parses a duration literal.
     *
     * @param text e.g. {@code 500ms}, {@code 30 s}, {@code 2.h}
     * @return the duration
     * @throws IllegalArgumentException if the text is not a duration literal
     */
    public static Duration parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Duration must not be null");
        }
        Matcher matcher = LITERAL.matcher(text);
        if (!matcher.matches() || !isUnit(matcher.group(2))) {
            throw new IllegalArgumentException("Not a duration: '" + text + "'");
        }
        return of(new BigDecimal(matcher.group(1)), matcher.group(2));
    }

    /**
     * Renders with the largest unit that divides the duration exactly.
     *
     * @param duration the duration
     * @return text such as {@code 4h}, {@code 90m} or {@code 1500ms}
     */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis != 0) {
            if (millis % 86_400_000L == 0) {
                return millis / 86_400_000L + "d";
            }
            if (millis % 3_600_000L == 0) {
                return millis / 3_600_000L + "h";
            }
            if (millis % 60_000L == 0) {
                return millis / 60_000L + "m";
            }
            if (millis % 1_000L == 0) {
                return millis / 1_000L + "s";
            }
        }
        return millis + "ms";
    }
}
