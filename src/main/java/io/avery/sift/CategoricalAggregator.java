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

import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Counts the records of a table per distinct value of a categorical column.
 */
public final class CategoricalAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(CategoricalAggregator.class);

    private CategoricalAggregator() {}

    /**
     * Counts the records of the given table per distinct value of the named column.
     *
     * <p>The result is a count table of the category field (the input table's own field), {@link Counts#COUNT} and,
     * if requested, {@link Counts#PERCENTAGE}, computed against the total over all groups. Groups appear in order of
     * first occurrence, and sorting by count is stable, so ties keep that order. Records whose category is
     * {@code null} are skipped: they form no group and do not count toward the percentage total.
     *
     * @param table the input table
     * @param column the name of the categorical column
     * @param sort how to order groups by count
     * @param withPercentage whether to add the percentage field
     * @return a new count table
     * @throws SchemaException if the table has no such column
     */
    public static RecordSet countByCategory(RecordSet table, String column, SortOrder sort, boolean withPercentage) {
        return countByCategory(table, table.header().field(column), sort, withPercentage);
    }

    /**
     * Counts the records of the given table per distinct value of the given field.
     *
     * @param table the input table
     * @param category the categorical field
     * @param sort how to order groups by count
     * @param withPercentage whether to add the percentage field
     * @return a new count table
     * @throws SchemaException if the table does not contain the field
     * @see #countByCategory(RecordSet, String, SortOrder, boolean)
     */
    public static RecordSet countByCategory(RecordSet table, Field<?> category, SortOrder sort,
                                            boolean withPercentage) {
        Objects.requireNonNull(sort);
        RecordStream counts = table.stream()
            .filter(record -> record.get(category) != null)
            .aggregate(aggregate -> aggregate
                .keyField(category)
                .aggField(Counts.COUNT, Collectors.counting())
            );
        if (sort == SortOrder.ASCENDING)
            counts = counts.sorted(Comparator.comparing(Counts.COUNT::get));
        else if (sort == SortOrder.DESCENDING)
            counts = counts.sorted(Comparator.comparing(Counts.COUNT::get, Comparator.reverseOrder()));
        RecordSet result = counts.toRecordSet();

        if (withPercentage) {
            long total = 0;
            for (Long count : result.column(Counts.COUNT))
                total += count;
            long finalTotal = total;
            result = result.stream()
                .select(select -> select
                    .allFields()
                    .field(Counts.PERCENTAGE, record -> Counts.percentage(record.get(Counts.COUNT), finalTotal))
                )
                .toRecordSet();
        }
        LOG.debug("Counted {} records into {} groups of column '{}'", table.size(), result.size(), category);
        return result;
    }

    /**
     * Shorthand for {@code countByCategory(table, column, SortOrder.of(sort), withPercentage)}.
     */
    public static RecordSet countByCategory(RecordSet table, String column, String sort, boolean withPercentage) {
        return countByCategory(table, column, SortOrder.of(sort), withPercentage);
    }
}
