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

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * A lazy, single-use pipeline over the records of a table. {@link #select} and {@link #aggregate} produce records
 * with a new header; {@link #filter}, {@link #sorted} and {@link #limit} keep the header. The header of any stage is
 * known up front through {@link #header()}, before any record flows.
 *
 * <p>Record-streams are sequential, and keep encounter order unless sorted.
 */
public class RecordStream {
    final Header header;
    final Stream<Record> stream;

    RecordStream(Header header, Stream<Record> stream) {
        this.header = header;
        this.stream = stream;
    }

    /**
     * Returns the header of the records of this stage.
     *
     * @return the header
     */
    public Header header() {
        return header;
    }

    /**
     * Wraps a stream of plain objects, so that they can be {@link Aux#mapToRecord mapped to records}.
     *
     * @param source the objects
     * @return the wrapped stream
     * @param <T> the type of the objects
     */
    public static <T> Aux<T> aux(Stream<T> source) {
        return new Aux<>(Objects.requireNonNull(source).sequential());
    }

    /**
     * Collects the records into a table with this stage's header. This is a terminal operation.
     *
     * @return the table
     */
    public RecordSet toRecordSet() {
        Object[][] rows = stream.map(record -> record.values).toArray(Object[][]::new);
        return new RecordSet(header, rows);
    }

    /**
     * Maps each record to one new record, with the fields defined on the {@link SelectAPI configurator}.
     *
     * @param config defines the output fields
     * @return the next stage
     */
    public RecordStream select(Consumer<SelectAPI> config) {
        return new SelectAPI(this).accept(config);
    }

    /**
     * Groups the records by key, and maps each group to one new record, with the key and aggregate fields defined on
     * the {@link AggregateAPI configurator}. Groups come out in order of their first record. Grouping waits for the
     * whole input.
     *
     * @param config defines the key and aggregate fields
     * @return the next stage
     */
    public RecordStream aggregate(Consumer<AggregateAPI> config) {
        return new AggregateAPI(this).accept(config);
    }

    /**
     * Keeps the records that satisfy the given predicate.
     *
     * @param predicate the predicate
     * @return the next stage
     */
    public RecordStream filter(Predicate<? super Record> predicate) {
        return new RecordStream(header, stream.filter(predicate));
    }

    /**
     * Orders the records by the given comparator. Records that compare equal keep their order.
     *
     * @param comparator the comparator
     * @return the next stage
     */
    public RecordStream sorted(Comparator<? super Record> comparator) {
        return new RecordStream(header, stream.sorted(comparator));
    }

    /**
     * Keeps at most the first {@code maxSize} records.
     *
     * @param maxSize the maximum number of records
     * @return the next stage
     */
    public RecordStream limit(long maxSize) {
        return new RecordStream(header, stream.limit(maxSize));
    }

    /**
     * A stream of plain objects, on the way to becoming records.
     *
     * @param <T> the type of the objects
     */
    public static class Aux<T> {
        final Stream<T> stream;

        Aux(Stream<T> stream) {
            this.stream = stream;
        }

        /**
         * Maps each object to a record, with the fields defined on the {@link IntoAPI configurator}.
         *
         * @param config defines the record fields
         * @return a record-stream
         */
        public RecordStream mapToRecord(Consumer<IntoAPI<T>> config) {
            return new IntoAPI<T>().accept(this, config);
        }
    }
}
