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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collector;
import java.util.stream.Stream;

/**
 * An immutable, ordered table of {@link Record records} with a common {@link Header header}. Every table operation
 * takes a record-set and returns a new one; a record-set is never modified after it is built, so the same record-set
 * may feed any number of independent operations, including concurrently.
 */
public class RecordSet {
    private final Header header;
    private final Object[][] rows;

    RecordSet(Header header, Object[][] rows) {
        this.header = header;
        this.rows = rows;
    }

    /**
     * Returns the header of every record of this table.
     *
     * @return the header
     */
    public Header header() {
        return header;
    }

    /**
     * Starts a record-stream over the records of this table, in order. The table can be streamed any number of
     * times.
     *
     * @return a new record-stream
     */
    public RecordStream stream() {
        return new RecordStream(header, Stream.of(rows).map(row -> new Record(header, row)));
    }

    /**
     * Returns the record at the given position.
     *
     * @param index the zero-based position of the record
     * @return the record at the given position
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Record get(int index) {
        return new Record(header, rows[index]);
    }

    /**
     * Returns the values of the given field across all records, in record order.
     *
     * @param field the field
     * @return the values of the field, in record order
     * @param <T> the value type of the field
     * @throws SchemaException if this record-set's header does not contain the field
     */
    public <T> List<T> column(Field<T> field) {
        int index = header.pin(field).index;
        List<T> values = new ArrayList<>(rows.length);
        for (Object[] row : rows)
            values.add(Utils.cast(row[index]));
        return values;
    }

    /**
     * Returns a copy of this record-set in which the first field named as the given field is replaced by the given
     * field and values. If there is no field with that name, the field and values are appended instead. This
     * record-set is not modified.
     *
     * @param field the new field
     * @param values the new field's values, in record order
     * @return a new record-set with the column replaced or appended
     * @param <T> the value type of the new field
     * @throws IllegalArgumentException if the number of values differs from the number of records
     */
    public <T> RecordSet withColumn(Field<T> field, List<? extends T> values) {
        Objects.requireNonNull(field);
        int index = header.fields.length;
        for (int i = 0; i < header.fields.length; i++)
            if (header.fields[i].name().equals(field.name())) {
                index = i;
                break;
            }
        return withColumn(index, field, values.toArray());
    }

    /**
     * Returns a copy of this record-set with the field at the given index replaced by the given field and values, or,
     * if the index equals the header size, with the field and values appended.
     */
    RecordSet withColumn(int index, Field<?> field, Object[] columnValues) {
        if (columnValues.length != rows.length)
            throw new IllegalArgumentException("Expected " + rows.length + " values, got " + columnValues.length);
        List<Field<?>> fields = new ArrayList<>(header.fields());
        int width = index == fields.size() ? fields.size() + 1 : fields.size();
        if (index == fields.size())
            fields.add(field);
        else
            fields.set(index, field);
        Object[][] next = new Object[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            next[i] = Arrays.copyOf(rows[i], width);
            next[i][index] = columnValues[i];
        }
        return new RecordSet(Header.of(fields), next);
    }

    /**
     * Returns the number of records.
     *
     * @return the number of records
     */
    public int size() {
        return rows.length;
    }

    /**
     * Returns {@code true} if this table has no records. An empty table still has a header.
     *
     * @return {@code true} if there are no records
     */
    public boolean isEmpty() {
        return rows.length == 0;
    }

    /**
     * Returns a collector of plain objects into a table, one record per object, with the fields defined on the
     * {@link IntoAPI configurator}.
     *
     * @param config defines the record fields
     * @return a collector into a table, in encounter order
     * @param <T> the type of the objects
     */
    public static <T> Collector<T, ?, RecordSet> collector(Consumer<IntoAPI<T>> config) {
        return new IntoAPI<T>().collector(config);
    }

    /**
     * Returns {@code true} if the given object is a table with an equal header and equal rows, in the same order.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecordSet))
            return false;
        RecordSet that = (RecordSet) o;
        return header.equals(that.header) && Arrays.deepEquals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + Arrays.deepHashCode(rows);
    }

    /**
     * Returns the header fields, then the values of each record, one per line. For example:
     *
     * <pre>{@code
     * RecordSet[
     *     [channel, count, percentage],
     *     [A, 3, 60.0],
     *     [B, 1, 20.0]
     * ]
     * }</pre>
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RecordSet[\n\t").append(Arrays.toString(header.fields));
        for (Object[] row : rows)
            sb.append(",\n\t").append(Arrays.toString(row));
        return sb.append("\n]").toString();
    }
}
