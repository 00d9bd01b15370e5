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

package io.avery.sift.text;

import io.avery.sift.Field;
import io.avery.sift.RecordSet;
import io.avery.sift.RecordStream;
import io.avery.sift.ValidationException;
import io.avery.sift.csv.CsvTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts the nouns of a text column into a frequency table of {@link #TERMS} and {@link #FREQUENCY}, most frequent
 * first. Terms with equal frequency keep their order of first appearance.
 */
public final class NounFrequencyExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(NounFrequencyExtractor.class);

    public static final Field<String> TERMS = new Field<>("TERMS");
    public static final Field<Long> FREQUENCY = new Field<>("FREQUENCY");

    private final NounAnalyzer analyzer;

    public NounFrequencyExtractor(NounAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer);
    }

    /**
     * Counts the nouns of the named text column.
     *
     * @param table the input table
     * @param column the name of the text column
     * @param minCount the least frequency a term must have to be kept
     * @return a new frequency table
     * @throws io.avery.sift.SchemaException if the table has no such column
     * @throws ValidationException if a value is not text
     */
    public RecordSet extract(RecordSet table, String column, long minCount) {
        List<Object> values = table.column(table.header().field(column));
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!(value instanceof CharSequence))
                throw new ValidationException(i, "Expected text in column '" + column + "', got: " + value);
            for (String noun : analyzer.nouns(value.toString()))
                counts.merge(noun, 1L, Long::sum);
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>();
        for (Map.Entry<String, Long> e : counts.entrySet())
            if (e.getValue() >= minCount)
                entries.add(e);
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        LOG.debug("Kept {} of {} distinct terms with frequency >= {}", entries.size(), counts.size(), minCount);
        return RecordStream.aux(entries.stream())
            .mapToRecord(into -> into
                .field(TERMS, Map.Entry::getKey)
                .field(FREQUENCY, Map.Entry::getValue)
            )
            .toRecordSet();
    }

    /**
     * Writes a frequency table to the given file as UTF-8.
     *
     * @param frequencies the frequency table
     * @param path the file
     * @see #write(RecordSet, Path, Charset)
     */
    public static void write(RecordSet frequencies, Path path) {
        write(frequencies, path, StandardCharsets.UTF_8);
    }

    /**
     * Writes a frequency table to the given file.
     *
     * @param frequencies the frequency table
     * @param path the file
     * @param charset the file encoding
     */
    public static void write(RecordSet frequencies, Path path, Charset charset) {
        CsvTables.write(frequencies, path, charset);
    }
}
