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

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * A calendar period that time-points are bucketed by.
 */
public enum Period {
    /** Single calendar days. */
    DAY {
        @Override
        LocalDate startOf(LocalDate date) {
            return date;
        }

        @Override
        LocalDate endOf(LocalDate start) {
            return start;
        }
    },
    /** Monday-to-Sunday weeks, identified by the Sunday that ends them. */
    WEEK {
        @Override
        LocalDate startOf(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        LocalDate endOf(LocalDate start) {
            return start.plusDays(6);
        }
    },
    /** Calendar months. */
    MONTH {
        @Override
        LocalDate startOf(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        LocalDate endOf(LocalDate start) {
            return start.with(TemporalAdjusters.lastDayOfMonth());
        }
    },
    /** Calendar years. */
    YEAR {
        @Override
        LocalDate startOf(LocalDate date) {
            return date.withDayOfYear(1);
        }

        @Override
        LocalDate endOf(LocalDate start) {
            return start.with(TemporalAdjusters.lastDayOfYear());
        }
    };

    abstract LocalDate startOf(LocalDate date);

    abstract LocalDate endOf(LocalDate start);

    /**
     * Returns the bucket of this period that contains the given date.
     *
     * @param date the date
     * @return the containing bucket
     */
    public Bucket bucketOf(LocalDate date) {
        LocalDate start = startOf(date);
        return new Bucket(this, start, endOf(start));
    }

    /**
     * Parses a period token: {@code d}/{@code day}, {@code w}/{@code week}/{@code isoWeekEndingSunday},
     * {@code m}/{@code month} or {@code y}/{@code year}, in any case.
     *
     * @param token the token
     * @return the period
     * @throws ConfigException if the token is not recognized
     */
    public static Period of(String token) {
        if (token != null) {
            switch (token.toLowerCase(Locale.ROOT)) {
                case "d": case "day": return DAY;
                case "w": case "week": case "isoweekendingsunday": return WEEK;
                case "m": case "month": return MONTH;
                case "y": case "year": return YEAR;
                default: break;
            }
        }
        throw new ConfigException("Incorrect period '" + token
                                  + "', period must be one of [d, w, m, y] or [day, isoWeekEndingSunday, month, year]");
    }
}
