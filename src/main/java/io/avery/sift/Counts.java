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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields and helpers shared by count tables. A count table is a {@link RecordSet} whose first field is the group key
 * (a category value or a {@link Bucket time bucket}), followed by {@link #COUNT} and, optionally,
 * {@link #PERCENTAGE}. Its record order is the requested sort order.
 */
public final class Counts {
    private Counts() {}

    /**
     * The number of records in a group.
     */
    public static final Field<Long> COUNT = new Field<>("count");

    /**
     * A group's share of the total count, as a percentage rounded to 4 decimal places.
     */
    public static final Field<Double> PERCENTAGE = new Field<>("percentage");

    static final int PERCENTAGE_SCALE = 4;

    /**
     * Returns {@code count * 100 / total}, rounded half-even to 4 decimal places.
     *
     * @param count the group count
     * @param total the total count across all groups
     * @return the percentage
     */
    public static double percentage(long count, long total) {
        if (total == 0)
            return 0.0;
        return BigDecimal.valueOf(count * 100.0 / total)
            .setScale(PERCENTAGE_SCALE, RoundingMode.HALF_EVEN)
            .doubleValue();
    }

    /**
     * Reads a count table into an insertion-ordered map from group key to count.
     *
     * @param counts the count table
     * @return the counts by key, in table order
     * @param <K> the key type
     * @throws SchemaException if the table has no {@link #COUNT} field
     */
    public static <K> Map<K, Long> asMap(RecordSet counts) {
        FieldPin<Long> countPin = counts.header().pin(COUNT);
        Map<K, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < counts.size(); i++) {
            Record record = counts.get(i);
            map.put(Utils.cast(record.values[0]), record.get(countPin));
        }
        return map;
    }
}
