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
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Memory amount in bytes, using 1024-based units.
 *
 * @param bytes the amount in bytes; never negative
 */
public record MemorySize(long bytes) {

    private static final List<String> UNITS = List.of("B", "KB", "MB", "GB", "TB", "PB");
    private static final Pattern LITERAL = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*\\.?\\s*([A-Za-z]*)\\s*$");

    public MemorySize {
        if (bytes < 0) {
            throw new IllegalArgumentException("Memory size must not be negative: " + bytes);
        }
    }

    /**
     * Creates a size from an amount expressed in the given unit.
     *
     * @param amount the amount, may be fractional
     * @param unit one of B, KB, MB, GB, TB, PB (case-insensitive)
     * @return the size, rounded to whole bytes
     */
    public static MemorySize of(BigDecimal amount, String unit) {
        int exponent = unitExponent(unit)
            .orElseThrow(() -> new IllegalArgumentException("Unknown memory unit: " + unit));
        BigDecimal bytes = amount.multiply(BigDecimal.valueOf(1024L).pow(exponent))
            .setScale(0, RoundingMode.HALF_UP);
        try {
            return new MemorySize(bytes.longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Memory size " + amount.toPlainString() + " " + unit + " is out of range", e);
        }
    }

    /**
     * Parses {@code 4GB}, {@code 4 GB}, {@code 4.GB}, {@code 1.5 GB}; a bare number is a byte count.
     *
     * @param text the literal
     * @return the parsed size
     * @throws IllegalArgumentException if the text is not a memory literal
     */
    public static MemorySize parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Memory size must not be null");
        }
        Matcher matcher = LITERAL.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a memory size: '" + text + "'");
        }
        String unit = matcher.group(2).isEmpty() ? "B" : matcher.group(2);
        if (unitExponent(unit).isEmpty()) {
            throw new IllegalArgumentException("Not a memory size: '" + text + "'");
        }
        return of(new BigDecimal(matcher.group(1)), unit);
    }

    /**
     * Whether the given text names a memory unit.
     *
     * @param unit candidate unit
     * @return true for B, KB, MB, GB, TB, PB in any case
     */
    public static boolean isUnit(String unit) {
        return unitExponent(unit).isPresent();
    }

    public MemorySize multiply(long factor) {
        return new MemorySize(Math.multiplyExact(bytes, factor));
    }

    public long toMegabytes() {
        return bytes / (1024L * 1024L);
    }

    private static Optional<Integer> unitExponent(String unit) {
        if (unit == null) {
            return Optional.empty();
        }
        int index = UNITS.indexOf(unit.trim().toUpperCase(Locale.ROOT));
        return index < 0 ? Optional.empty() : Optional.of(index);
    }

    /**
     * Renders with the largest unit that divides the byte count exactly, e.g. {@code 8 GB} or {@code 1536 MB}.
     */
    @Override
    public String toString() {
        int exponent = 0;
        long amount = bytes;
        while (exponent < UNITS.size() - 1 && amount != 0 && amount % 1024L == 0) {
            amount /= 1024L;
            exponent++;
        }
        return amount + " " + UNITS.get(exponent);
    }
}
