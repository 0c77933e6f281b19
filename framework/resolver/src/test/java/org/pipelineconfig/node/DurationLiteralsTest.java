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
import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DurationLiteralsTest {

    @Test
    void parsesShortAndLongUnits() {
        assertEquals(Duration.ofMillis(10), DurationLiterals.parse("10ms"));
        assertEquals(Duration.ofSeconds(30), DurationLiterals.parse("30s"));
        assertEquals(Duration.ofMinutes(5), DurationLiterals.parse("5m"));
        assertEquals(Duration.ofMinutes(5), DurationLiterals.parse("5min"));
        assertEquals(Duration.ofHours(2), DurationLiterals.parse("2 hours"));
        assertEquals(Duration.ofDays(1), DurationLiterals.parse("1d"));
    }

    @Test
    void parsesDottedAndFractionalLiterals() {
        assertEquals(Duration.ofHours(2), DurationLiterals.parse("2.h"));
        assertEquals(Duration.ofMinutes(90), DurationLiterals.parse("1.5h"));
        assertEquals(Duration.ofMinutes(90), DurationLiterals.of(new BigDecimal("1.5"), "h"));
    }

    @Test
    void rejectsLiteralsWithoutKnownUnit() {
        assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("30"));
        assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("3 weeks"));
        assertThrows(IllegalArgumentException.class, () -> DurationLiterals.of(BigDecimal.ONE, "fortnight"));
    }

    @Test
    void oversizedLiteralIsOutOfRange() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> DurationLiterals.parse("999999999999999999.d"));
        assertTrue(error.getMessage().contains("out of range"));
    }

    @Test
    void formatsWithLargestExactUnit() {
        assertEquals("4h", DurationLiterals.format(Duration.ofHours(4)));
        assertEquals("90m", DurationLiterals.format(Duration.ofMinutes(90)));
        assertEquals("2d", DurationLiterals.format(Duration.ofHours(48)));
        assertEquals("45s", DurationLiterals.format(Duration.ofSeconds(45)));
        assertEquals("1500ms", DurationLiterals.format(Duration.ofMillis(1500)));
    }

    @Test
    void recognisesUnits() {
        assertTrue(DurationLiterals.isUnit("H"));
        assertTrue(DurationLiterals.isUnit("seconds"));
        assertFalse(DurationLiterals.isUnit("GB"));
    }
}
