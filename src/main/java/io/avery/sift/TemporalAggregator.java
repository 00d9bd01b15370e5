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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Counts the records of a table per calendar {@link Period period} of a time-point column.
 */
public final class TemporalAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(TemporalAggregator.class);

    private TemporalAggregator() {}

    /**
     * Shorthand for {@code countByPeriod(table, timeColumn, Period.of(period), dropZero, ascending)}.
     *
     * @throws ConfigException if the period token is not recognized
     */
    public static RecordSet countByPeriod(RecordSet table, String timeColumn, String period, boolean dropZero,
                                          boolean ascending) {
        return countByPeriod(table, timeColumn, Period.of(period), dropZero, ascending);
    }

    /**
     * Counts the records of the given table per bucket of the given period.
     *
     * <p>Records are first counted per exact time-point, and the exact counts are then summed into buckets. Every
     * bucket between the earliest and the latest time-point is produced, with count 0 if no record falls in it,
     * unless {@code dropZero} is set, in which case buckets with count 0 are removed. The result is a count table of
     * a {@link Bucket} field named after the time column, and {@link Counts#COUNT}, ordered by bucket.
     *
     * @param table the input table
     * @param timeColumn the name of a column of {@link LocalDateTime} or {@link LocalDate} values
     * @param period the bucket period
     * @param dropZero whether to remove buckets with count 0
     * @param ascending whether buckets are ordered earliest-first
     * @return a new count table
     * @throws SchemaException if the table has no such column
     * @throws ValidationException if a value of the column is not a time-point
     */
    public static RecordSet countByPeriod(RecordSet table, String timeColumn, Period period, boolean dropZero,
                                          boolean ascending) {
        FieldPin<Object> pin = table.header().pin(timeColumn);
        for (int i = 0; i < table.size(); i++) {
            Object value = table.get(i).get(pin);
            if (!(value instanceof LocalDateTime) && !(value instanceof LocalDate))
                throw new ValidationException(i, "value of column '" + timeColumn + "' is not a time-point: " + value);
        }

        // Count per exact time-point, then sum into buckets.
        RecordSet exact = table.stream()
            .aggregate(aggregate -> aggregate
                .keyField(pin.field)
                .aggField(Counts.COUNT, Collectors.counting())
            )
            .toRecordSet();
        TreeMap<Bucket, Long> buckets = new TreeMap<>();
        for (int i = 0; i < exact.size(); i++) {
            Record record = exact.get(i);
            buckets.merge(period.bucketOf(toDate(record.get(pin.field))), record.get(Counts.COUNT), Long::sum);
        }
        if (!buckets.isEmpty())
            for (Bucket b = buckets.firstKey(); b.compareTo(buckets.lastKey()) < 0; b = b.next())
                buckets.putIfAbsent(b, 0L);

        List<Map.Entry<Bucket, Long>> entries = new ArrayList<>(buckets.entrySet());
        if (dropZero)
            entries.removeIf(e -> e.getValue() == 0L);
        if (!ascending)
            Collections.reverse(entries);

        Field<Bucket> bucketField = new Field<>(timeColumn);
        RecordSet result = RecordStream.aux(entries.stream())
            .mapToRecord(into -> into
                .field(bucketField, Map.Entry::getKey)
                .field(Counts.COUNT, Map.Entry::getValue)
            )
            .toRecordSet();
        LOG.debug("Counted {} records into {} {} buckets of column '{}'", table.size(), result.size(), period,
                  timeColumn);
        return result;
    }

    private static LocalDate toDate(Object timePoint) {
        if (timePoint instanceof LocalDateTime)
            return ((LocalDateTime) timePoint).toLocalDate();
        return (LocalDate) timePoint;
    }
}
