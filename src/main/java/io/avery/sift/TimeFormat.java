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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;

/**
 * A compiled time format, used to parse raw timestamp strings into {@link LocalDateTime time-points}.
 *
 * <p>A format string containing {@code '%'} is read as a strftime-style string, supporting the directives:
 *
 * <pre>
 *     %Y  year with century (2020)             %H  hour, 24-hour clock (0-23)
 *     %y  year without century (69-99 = 19xx)  %I  hour, 12-hour clock (1-12), needs %p
 *     %m  month number (1-12)                  %p  AM/PM
 *     %d  day of month (1-31)                  %M  minute (0-59)
 *     %b  month, abbreviated (Jan)             %S  second (00-59)
 *     %B  month, full name (January)           %f  fraction of second (1-6 digits)
 *     %a  weekday, abbreviated (Mon)           %j  day of year (1-366)
 *     %A  weekday, full name (Monday)          %%  a literal '%'
 * </pre>
 *
 * <p>Numeric directives other than {@code %Y} and {@code %y} accept values with or without zero padding, unless
 * another numeric directive follows directly, as in {@code %Y%m%d}; then they take their full width.
 *
 * <p>Any other string is read as a {@link DateTimeFormatter} pattern. Names are English and matched case-insensitively.
 * Date-only formats parse to midnight, and year-month or year-only formats to the first day of the period. Formats
 * with time-of-day directives only parse to full time-points.
 *
 * <p>Dates and times are resolved strictly: {@code 2021-02-29} or {@code 24:00} fail to parse rather than rolling
 * over to a neighboring value.
 */
public final class TimeFormat {
    private static final String NUMERIC_DIRECTIVES = "YymdHIMSfj";
    private static final String TIME_DIRECTIVES = "HIpMSf";

    private final String source;
    private final DateTimeFormatter formatter;
    private final boolean timeOfDay;

    private TimeFormat(String source, DateTimeFormatter formatter, boolean timeOfDay) {
        this.source = source;
        this.formatter = formatter;
        this.timeOfDay = timeOfDay;
    }

    /**
     * Compiles the given format string.
     *
     * @param source a strftime-style string or a {@code DateTimeFormatter} pattern
     * @return the compiled format
     * @throws ConfigException if the string is empty, has an unknown {@code %} directive, uses {@code %I} without
     *         {@code %p}, or is an illegal pattern
     */
    public static TimeFormat of(String source) {
        Objects.requireNonNull(source);
        if (source.isEmpty())
            throw new ConfigException("Time format must not be empty");
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
        boolean timeOfDay = false;
        if (source.indexOf('%') >= 0)
            timeOfDay = appendStrftime(builder, source);
        else {
            try {
                builder.appendPattern(source);
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Illegal time format '" + source + "'", e);
            }
            // Lets 'yyyy' resolve under the strict resolver.
            builder.parseDefaulting(ChronoField.ERA, 1);
        }
        DateTimeFormatter formatter = builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
        return new TimeFormat(source, formatter, timeOfDay);
    }

    /**
     * Appends the directives of the given strftime-style string, returning {@code true} if it has time-of-day
     * directives.
     */
    private static boolean appendStrftime(DateTimeFormatterBuilder builder, String source) {
        boolean timeOfDay = false;
        boolean clockHour = false;
        boolean ampm = false;
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (++i == source.length())
                throw new ConfigException("Dangling '%' at end of time format '" + source + "'");
            char directive = source.charAt(i);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            if (literal.length() > 0) {
                builder.appendLiteral(literal.toString());
                literal.setLength(0);
            }
            boolean fixed = numericDirectiveAt(source, i + 1);
            timeOfDay |= TIME_DIRECTIVES.indexOf(directive) >= 0;
            switch (directive) {
                case 'Y': builder.appendValue(ChronoField.YEAR, 4); break;
                case 'y': builder.appendValueReduced(ChronoField.YEAR, 2, 2, 1969); break;
                case 'm': appendNumber(builder, ChronoField.MONTH_OF_YEAR, 2, fixed); break;
                case 'd': appendNumber(builder, ChronoField.DAY_OF_MONTH, 2, fixed); break;
                case 'H': appendNumber(builder, ChronoField.HOUR_OF_DAY, 2, fixed); break;
                case 'I': appendNumber(builder, ChronoField.CLOCK_HOUR_OF_AMPM, 2, fixed); clockHour = true; break;
                case 'p': builder.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT); ampm = true; break;
                case 'M': appendNumber(builder, ChronoField.MINUTE_OF_HOUR, 2, fixed); break;
                case 'S': appendNumber(builder, ChronoField.SECOND_OF_MINUTE, 2, fixed); break;
                case 'f': builder.appendFraction(ChronoField.MICRO_OF_SECOND, 1, 6, false); break;
                case 'j': appendNumber(builder, ChronoField.DAY_OF_YEAR, 3, fixed); break;
                case 'a': builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT); break;
                case 'A': builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL); break;
                case 'b': builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT); break;
                case 'B': builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL); break;
                default:
                    throw new ConfigException("Unknown directive '%" + directive + "' in time format '" + source + "'");
            }
        }
        if (literal.length() > 0)
            builder.appendLiteral(literal.toString());
        if (clockHour && !ampm)
            throw new ConfigException("Time format '" + source + "' uses %I without %p");
        return timeOfDay;
    }

    private static boolean numericDirectiveAt(String source, int i) {
        return i + 1 < source.length() && source.charAt(i) == '%'
            && NUMERIC_DIRECTIVES.indexOf(source.charAt(i + 1)) >= 0;
    }

    private static void appendNumber(DateTimeFormatterBuilder builder, ChronoField field, int width, boolean fixed) {
        if (fixed)
            builder.appendValue(field, width);
        else
            builder.appendValue(field, 1, width, SignStyle.NOT_NEGATIVE);
    }

    /**
     * Parses the given text as a time-point.
     *
     * @param text the text to parse
     * @return the parsed time-point
     * @throws java.time.format.DateTimeParseException if the text does not conform to this format
     */
    public LocalDateTime parse(CharSequence text) {
        if (timeOfDay)
            return formatter.parse(text, LocalDateTime::from);
        TemporalAccessor parsed = formatter.parseBest(text, LocalDateTime::from, LocalDate::from, YearMonth::from,
                                                      Year::from);
        if (parsed instanceof LocalDateTime)
            return (LocalDateTime) parsed;
        if (parsed instanceof LocalDate)
            return ((LocalDate) parsed).atStartOfDay();
        if (parsed instanceof YearMonth)
            return ((YearMonth) parsed).atDay(1).atStartOfDay();
        return ((Year) parsed).atDay(1).atStartOfDay();
    }

    /**
     * Returns the format string this format was compiled from.
     *
     * @return the format string
     */
    @Override
    public String toString() {
        return source;
    }
}
