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

import io.avery.sift.KeywordSet.Polarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Keeps the rows of a table whose text column does, or does not, contain a set of keywords.
 *
 * @see KeywordSet
 */
public final class KeywordFilter {
    private static final Logger LOG = LoggerFactory.getLogger(KeywordFilter.class);

    private KeywordFilter() {}

    /**
     * Returns the rows of the given table for which the keyword set holds against the named column, testing each
     * keyword for presence. Row order and all columns are preserved.
     *
     * @param table the input table
     * @param column the name of the text column
     * @param keywords the keywords
     * @return a new table of the matching rows
     * @throws SchemaException if the table has no such column
     * @throws ValidationException if a value of the column is not text
     */
    public static RecordSet include(RecordSet table, String column, KeywordSet keywords) {
        return filter(table, column, keywords, Polarity.INCLUDE);
    }

    /**
     * Returns the rows of the given table for which the keyword set holds against the named column, testing each
     * keyword for absence. For a single keyword this keeps exactly the rows that {@link #include} drops.
     *
     * @param table the input table
     * @param column the name of the text column
     * @param keywords the keywords
     * @return a new table of the matching rows
     * @throws SchemaException if the table has no such column
     * @throws ValidationException if a value of the column is not text
     */
    public static RecordSet exclude(RecordSet table, String column, KeywordSet keywords) {
        return filter(table, column, keywords, Polarity.EXCLUDE);
    }

    /**
     * Shorthand for {@code include(table, column, KeywordSet.of(keywords, logic))}.
     *
     * @throws ConfigException if two or more keywords are given without logic {@code "and"} or {@code "or"}
     */
    public static RecordSet include(RecordSet table, String column, List<String> keywords, String logic) {
        return include(table, column, KeywordSet.of(keywords, logic));
    }

    /**
     * Shorthand for {@code exclude(table, column, KeywordSet.of(keywords, logic))}.
     *
     * @throws ConfigException if two or more keywords are given without logic {@code "and"} or {@code "or"}
     */
    public static RecordSet exclude(RecordSet table, String column, List<String> keywords, String logic) {
        return exclude(table, column, KeywordSet.of(keywords, logic));
    }

    private static RecordSet filter(RecordSet table, String column, KeywordSet keywords, Polarity polarity) {
        Objects.requireNonNull(keywords);
        FieldPin<Object> pin = table.header().pin(column);
        for (int i = 0; i < table.size(); i++)
            if (!(table.get(i).get(pin) instanceof CharSequence))
                throw new ValidationException(i, "value of column '" + column + "' is not text: "
                    + table.get(i).get(pin));

        RecordSet result = table.stream()
            .filter(record -> keywords.test(record.get(pin).toString(), polarity))
            .toRecordSet();
        LOG.debug("{} {} on column '{}' kept {} of {} records", polarity, keywords, column, result.size(), table.size());
        return result;
    }
}
