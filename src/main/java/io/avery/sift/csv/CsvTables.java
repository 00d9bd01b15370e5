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

package io.avery.sift.csv;

import io.avery.sift.Field;
import io.avery.sift.Record;
import io.avery.sift.RecordSet;
import io.avery.sift.ResourceMissingException;
import io.avery.sift.ValidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes {@link RecordSet tables} as comma-separated files with a header row.
 *
 * <p>Read tables have one {@code Field<String>} per header column, in file order; cells missing from short rows read
 * as {@code null}. Written cells are the string form of each value, with {@code null} written as an empty cell.
 */
public final class CsvTables {
    private static final Logger LOG = LoggerFactory.getLogger(CsvTables.class);

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .build();

    private CsvTables() {}

    /**
     * Reads the given file.
     *
     * @param path the file
     * @param charset the file encoding
     * @return the table
     * @throws ResourceMissingException if the file does not exist
     * @throws ValidationException if the header row is malformed
     * @throws UncheckedIOException if the file cannot be read
     */
    public static RecordSet read(Path path, Charset charset) {
        if (!Files.isRegularFile(path))
            throw new ResourceMissingException(path);
        try (Reader reader = Files.newBufferedReader(path, charset)) {
            RecordSet table = read(reader);
            LOG.debug("Read {} records of {} from {}", table.size(), table.header(), path);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /**
     * Reads a table from the given reader. The reader is not closed.
     *
     * @param reader the source
     * @return the table
     * @throws ValidationException if the header row is malformed
     * @throws UncheckedIOException if the source cannot be read
     */
    public static RecordSet read(Reader reader) {
        CSVParser parser;
        try {
            parser = READ_FORMAT.parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed CSV header: " + e.getMessage());
        }
        List<Field<String>> fields = new ArrayList<>();
        for (String name : parser.getHeaderNames())
            fields.add(new Field<>(name));
        return parser.stream().collect(RecordSet.<CSVRecord>collector(into -> {
            for (int i = 0; i < fields.size(); i++) {
                int j = i;
                into.field(fields.get(j), (CSVRecord row) -> j < row.size() ? row.get(j) : null);
            }
        }));
    }

    /**
     * Writes the given table to the given file, replacing any existing content.
     *
     * @param table the table
     * @param path the file
     * @param charset the file encoding
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void write(RecordSet table, Path path, Charset charset) {
        try (Writer writer = Files.newBufferedWriter(path, charset)) {
            write(table, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        LOG.info("Saved {} records to {}", table.size(), path);
    }

    /**
     * Writes the given table to the given destination, header row first.
     *
     * @param table the table
     * @param out the destination
     * @throws UncheckedIOException if the destination cannot be written
     */
    public static void write(RecordSet table, Appendable out) {
        String[] names = table.header().fields().stream().map(Field::name).toArray(String[]::new);
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(names).build();
        try {
            CSVPrinter printer = new CSVPrinter(out, format);
            for (int i = 0; i < table.size(); i++) {
                Record record = table.get(i);
                printer.printRecord(record.values());
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
