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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Re-materializes a raw timestamp column as {@link LocalDateTime} time-points.
 */
public final class TimeNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(TimeNormalizer.class);

    private TimeNormalizer() {}

    /**
     * Returns a copy of the given table in which the named column holds the time-points parsed from its values with
     * the given format. The column keeps its name and position; all other columns are unchanged. Values that are
     * already time-points are kept as they are.
     *
     * <p>Either every value parses, or nothing is returned.
     *
     * @param table the input table
     * @param column the name of the timestamp column
     * @param format the format string, as accepted by {@link TimeFormat#of(String)}
     * @return a new table with the column normalized
     * @throws SchemaException if the table has no such column
     * @throws ConfigException if the format string is not recognized
     * @throws TimeParseException if any value does not conform to the format
     */
    public static RecordSet normalize(RecordSet table, String column, String format) {
        return normalize(table, column, TimeFormat.of(format));
    }

    /**
     * Returns a copy of the given table in which the named column holds the time-points parsed from its values with
     * the given format.
     *
     * @param table the input table
     * @param column the name of the timestamp column
     * @param format the compiled format
     * @return a new table with the column normalized
     * @throws SchemaException if the table has no such column
     * @throws TimeParseException if any value does not conform to the format
     * @see #normalize(RecordSet, String, String)
     */
    public static RecordSet normalize(RecordSet table, String column, TimeFormat format) {
        Objects.requireNonNull(format);
        FieldPin<Object> raw = table.header().pin(column);
        LocalDateTime[] parsed = new LocalDateTime[table.size()];
        for (int i = 0; i < parsed.length; i++)
            parsed[i] = parse(table.get(i).get(raw), i, format);

        RecordSet result = table.withColumn(raw.index, raw.field().<LocalDateTime>replacement(), parsed);
        LOG.debug("Normalized column '{}' of {} records with format '{}'", column, result.size(), format);
        return result;
    }

    private static LocalDateTime parse(Object value, int row, TimeFormat format) {
        if (value instanceof LocalDateTime)
            return (LocalDateTime) value;
        if (!(value instanceof CharSequence))
            throw new TimeParseException(value, row, format.toString(), null);
        try {
            return format.parse((CharSequence) value);
        } catch (DateTimeParseException e) {
            throw new TimeParseException(value, row, format.toString(), e);
        }
    }
}
