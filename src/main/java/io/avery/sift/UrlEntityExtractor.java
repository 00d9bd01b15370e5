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

import java.util.Objects;

/**
 * Derives an entity identifier from URLs of one site family. For a URL split on {@code '/'}, the third token is the
 * domain and the fourth the entity path; the identifier joins them, so {@code https://cafe.naver.com/myroom/123}
 * identifies {@code cafe.naver.com/myroom}.
 */
public final class UrlEntityExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(UrlEntityExtractor.class);

    private final String siteFamily;
    private final String entityColumn;

    /**
     * Creates an extractor for URLs whose domain contains the given site family marker.
     *
     * @param siteFamily the substring every URL domain must contain
     * @param entityColumn the name of the derived identifier column
     */
    public UrlEntityExtractor(String siteFamily, String entityColumn) {
        this.siteFamily = Objects.requireNonNull(siteFamily);
        this.entityColumn = Objects.requireNonNull(entityColumn);
    }

    /**
     * Returns a copy of the given table with an identifier column derived from the named URL column appended. Every
     * URL is validated before any identifier is derived.
     *
     * @param table the input table
     * @param urlColumn the name of the URL column
     * @return a new table with the identifier column appended
     * @throws SchemaException if the table has no such column
     * @throws ValidationException if any URL is not text, has no domain, or has a domain outside the site family
     */
    public RecordSet extractEntity(RecordSet table, String urlColumn) {
        FieldPin<Object> url = table.header().pin(urlColumn);
        for (int i = 0; i < table.size(); i++)
            validate(table.get(i).get(url), i);

        Field<String> entity = new Field<>(entityColumn);
        RecordSet result = table.stream()
            .select(select -> select
                .allFields()
                .field(entity, record -> entityOf(record.get(url).toString()))
            )
            .toRecordSet();
        LOG.debug("Extracted '{}' from column '{}' of {} records", entityColumn, urlColumn, result.size());
        return result;
    }

    /**
     * Returns the entity identifier of the given URL, without validating its site family.
     *
     * @param url the URL
     * @return the domain and the following path token, joined by {@code '/'}
     */
    static String entityOf(String url) {
        String[] tokens = url.split("/", -1);
        if (tokens.length < 4)
            return tokens[2];
        return tokens[2] + '/' + tokens[3];
    }

    private void validate(Object value, int row) {
        if (!(value instanceof CharSequence))
            throw new ValidationException(row, "URL is not text: " + value);
        String[] tokens = value.toString().split("/", -1);
        if (tokens.length < 3)
            throw new ValidationException(row, "URL has no domain: " + value);
        if (!tokens[2].contains(siteFamily))
            throw new ValidationException(row, "URL values must be " + siteFamily + " URLs: " + value);
    }

    @Override
    public String toString() {
        return "UrlEntityExtractor[" + siteFamily + " -> " + entityColumn + "]";
    }
}
