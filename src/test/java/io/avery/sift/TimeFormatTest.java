/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.sift;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

public class TimeFormatTest {
    @Test
    void testTwoDigitYearWithTrailingDot() {
        TimeFormat format = TimeFormat.of("%y.%m.%d.");

        assertEquals(LocalDateTime.of(2021, 3, 5, 0, 0), format.parse("21.03.05."));
        assertEquals(LocalDateTime.of(1999, 12, 31, 0, 0), format.parse("99.12.31."));
    }

    @Test
    void testDateAndTime() {
        TimeFormat format = TimeFormat.of("%Y-%m-%d %H:%M:%S");

        assertEquals(LocalDateTime.of(2020, 1, 2, 13, 4, 5), format.parse("2020-01-02 13:04:05"));
    }

    @Test
    void testTwelveHourClockAndNames() {
        TimeFormat format = TimeFormat.of("%d %b %Y %I:%M %p");

        assertEquals(LocalDateTime.of(2021, 7, 9, 15, 30), format.parse("09 Jul 2021 03:30 PM"));
        assertEquals(LocalDateTime.of(2021, 7, 9, 3, 30), format.parse("09 jul 2021 03:30 am"));
    }

    @Test
    void testYearMonthOnly() {
        assertEquals(LocalDateTime.of(2021, 2, 1, 0, 0), TimeFormat.of("%Y/%m").parse("2021/02"));
    }

    @Test
    void testPattern() {
        assertEquals(LocalDateTime.of(2021, 3, 5, 0, 0), TimeFormat.of("yyyyMMdd").parse("20210305"));
    }

    @Test
    void testLiteralPercent() {
        assertEquals(LocalDateTime.of(2021, 3, 5, 0, 0), TimeFormat.of("%Y%m%d%%").parse("20210305%"));
    }

    @Test
    void testMismatch() {
        TimeFormat format = TimeFormat.of("%y.%m.%d.");

        assertThrows(DateTimeParseException.class, () -> format.parse("2021-03-05"));
        assertThrows(DateTimeParseException.class, () -> format.parse("21.13.05."));
    }

    @Test
    void testImpossibleDatesDoNotRollOver() {
        TimeFormat dotted = TimeFormat.of("%y.%m.%d.");
        TimeFormat dashed = TimeFormat.of("%Y-%m-%d");

        assertThrows(DateTimeParseException.class, () -> dotted.parse("24.02.30."));
        assertThrows(DateTimeParseException.class, () -> dotted.parse("21.02.29."));
        assertEquals(LocalDateTime.of(2024, 2, 29, 0, 0), dotted.parse("24.02.29."));
        assertThrows(DateTimeParseException.class, () -> dashed.parse("2021-04-31"));
        assertThrows(DateTimeParseException.class, () -> TimeFormat.of("%Y-%m-%d %H:%M").parse("2021-01-01 24:00"));
        assertThrows(DateTimeParseException.class, () -> TimeFormat.of("%Y %j").parse("2021 366"));
    }

    @Test
    void testImpossibleDatesInPattern() {
        TimeFormat format = TimeFormat.of("yyyy-MM-dd");

        assertEquals(LocalDateTime.of(2021, 4, 30, 0, 0), format.parse("2021-04-30"));
        assertThrows(DateTimeParseException.class, () -> format.parse("2021-04-31"));
    }

    @Test
    void testUnpaddedNumbers() {
        assertEquals(LocalDateTime.of(2021, 3, 5, 0, 0), TimeFormat.of("%y.%m.%d.").parse("21.3.5."));
        assertEquals(LocalDateTime.of(2021, 3, 5, 0, 0), TimeFormat.of("%y.%m.%d.").parse("21.03.5."));
        assertEquals(LocalDateTime.of(2021, 3, 5, 9, 7), TimeFormat.of("%Y-%m-%d %H:%M").parse("2021-3-5 9:07"));
        assertEquals(LocalDateTime.of(2021, 3, 5, 0, 0), TimeFormat.of("%Y%m%d").parse("20210305"));
        assertThrows(DateTimeParseException.class, () -> TimeFormat.of("%y.%m.%d.").parse("21.123.5."));
    }

    @Test
    void testTimeOfDayIsNeverDropped() {
        TimeFormat format = TimeFormat.of("%Y-%m-%d %H");

        assertEquals(LocalDateTime.of(2021, 1, 1, 9, 0), format.parse("2021-01-01 09"));
        assertThrows(ConfigException.class, () -> TimeFormat.of("%Y-%m-%d %I"));
    }

    @Test
    void testInvalidFormat() {
        assertThrows(ConfigException.class, () -> TimeFormat.of("%Q"));
        assertThrows(ConfigException.class, () -> TimeFormat.of("%Y%"));
        assertThrows(ConfigException.class, () -> TimeFormat.of(""));
        assertThrows(ConfigException.class, () -> TimeFormat.of("yyyy{"));
    }
}
