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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Fixed report recipes, chaining the table operations into one result table each.
 *
 * <p>The static recipes take every column and format explicitly. The instance recipes take them from
 * {@link ReportSettings}.
 */
public final class Reports {
    private static final Logger LOG = LoggerFactory.getLogger(Reports.class);

    /**
     * The value of the spacer columns that separate the blocks of {@link #topNAcrossColumns}.
     */
    public static final String SPACER = "|";

    private final ReportSettings settings;

    public Reports(ReportSettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    /**
     * Counts, per calendar month, the records whose text column satisfies the given keyword set. Timestamps are
     * normalized with the given format first. Every month between the first and last matching record is present,
     * earliest first.
     *
     * @param table the input table
     * @param textColumn the name of the text column
     * @param timeColumn the name of the raw timestamp column
     * @param format the timestamp format string
     * @param keywords the keywords that matching records include
     * @return a count table of monthly buckets
     * @throws SchemaException if a column is absent
     * @throws ConfigException if the format is not recognized
     * @throws TimeParseException if a timestamp does not match the format
     */
    public static RecordSet monthlyKeywordCounts(RecordSet table, String textColumn, String timeColumn, String format,
                                                 KeywordSet keywords) {
        RecordSet normalized = TimeNormalizer.normalize(table, timeColumn, format);
        RecordSet matching = KeywordFilter.include(normalized, textColumn, keywords);
        return TemporalAggregator.countByPeriod(matching, timeColumn, Period.MONTH, false, true);
    }

    /**
     * {@link #monthlyKeywordCounts(RecordSet, String, String, String, KeywordSet)}, with the time column and format
     * from the settings.
     */
    public RecordSet monthlyKeywordCounts(RecordSet table, String textColumn, KeywordSet keywords) {
        return monthlyKeywordCounts(table, textColumn, settings.timeColumn(), settings.timeFormat(), keywords);
    }

    /**
     * Ranks the categories of each of the given columns by count, and lays the top {@code n} of each side by side.
     *
     * <p>Each column contributes a block of its category field, a count field and, if requested, a percentage field
     * (against the column's full total, not the top {@code n}). Blocks appear in the given column order, separated by
     * a spacer field whose every value is {@link #SPACER}. Spacers go only between blocks, never before the first
     * block or after the last, so a single column yields a table with no spacer at all. The result always has exactly {@code n} rows; a column with
     * fewer than {@code n} categories leaves its remaining rows {@code null}.
     *
     * @param table the input table
     * @param columns the names of the categorical columns
     * @param n the number of top categories per column
     * @param withPercentage whether blocks include a percentage field
     * @return the side-by-side ranking table
     * @throws SchemaException if a column is absent
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public static RecordSet topNAcrossColumns(RecordSet table, List<String> columns, int n, boolean withPercentage) {
        if (n < 0)
            throw new IllegalArgumentException("n must not be negative: " + n);
        List<RecordSet> blocks = new ArrayList<>(columns.size());
        for (String column : columns)
            blocks.add(CategoricalAggregator.countByCategory(table, column, SortOrder.DESCENDING, withPercentage)
                           .stream()
                           .limit(n)
                           .toRecordSet());

        RecordSet result = RecordStream.aux(IntStream.range(0, n).boxed())
            .mapToRecord(into -> {
                for (int b = 0; b < blocks.size(); b++) {
                    if (b > 0)
                        into.field(new Field<String>(SPACER), row -> SPACER);
                    RecordSet block = blocks.get(b);
                    List<Field<?>> fields = block.header().fields();
                    for (int f = 0; f < fields.size(); f++)
                        blockField(into, block, fields.get(f), f);
                }
            })
            .toRecordSet();
        LOG.debug("Ranked top {} of columns {}", n, columns);
        return result;
    }

    private static <T> void blockField(IntoAPI<Integer> into, RecordSet block, Field<T> field, int index) {
        into.field(field.<T>replacement(),
                   row -> row < block.size() ? Utils.<T>cast(block.get(row).values[index]) : null);
    }

    /**
     * Counts the records per URL entity, among the records whose filter column equals the given value. Counts are
     * ordered descending, with percentages.
     *
     * @param table the input table
     * @param filterColumn the name of the column that selects records
     * @param filterValue the value that selected records hold in the filter column
     * @param urlColumn the name of the URL column
     * @param extractor the entity extractor
     * @return a count table of entities
     * @throws SchemaException if a column is absent
     * @throws ValidationException if a selected record's URL is outside the extractor's site family
     */
    public static RecordSet countPerEntityFromUrl(RecordSet table, String filterColumn, Object filterValue,
                                                  String urlColumn, UrlEntityExtractor extractor) {
        FieldPin<Object> pin = table.header().pin(filterColumn);
        RecordSet selected = table.stream()
            .filter(record -> Objects.equals(record.get(pin), filterValue))
            .toRecordSet();
        RecordSet withEntity = extractor.extractEntity(selected, urlColumn);
        Field<?>[] fields = withEntity.header().fields;
        return CategoricalAggregator.countByCategory(withEntity, fields[fields.length - 1], SortOrder.DESCENDING, true);
    }

    /**
     * {@link #countPerEntityFromUrl(RecordSet, String, Object, String, UrlEntityExtractor)}, with the site family and
     * identifier column from the settings.
     */
    public RecordSet countPerEntityFromUrl(RecordSet table, String filterColumn, Object filterValue,
                                           String urlColumn) {
        return countPerEntityFromUrl(table, filterColumn, filterValue, urlColumn, extractor());
    }

    /**
     * {@link #countPerEntityFromUrl(RecordSet, String, Object, String, UrlEntityExtractor)}, with every column and the
     * site family from the settings.
     */
    public RecordSet countPerEntityFromUrl(RecordSet table) {
        return countPerEntityFromUrl(table, settings.entityFilterColumn(), settings.entityFilterValue(),
                                     settings.urlColumn(), extractor());
    }

    private UrlEntityExtractor extractor() {
        return new UrlEntityExtractor(settings.siteFamily(), settings.entityColumn());
    }
}
