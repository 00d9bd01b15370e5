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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * One row of a {@link RecordSet table}. A record holds one value per field of its {@link Header header}, in header
 * order. Values are looked up by field, or by {@link FieldPin pin} to skip the index search.
 *
 * <p>Records are only created by table operations, and never change after creation.
 */
public class Record {
    final Header header;
    final Object[] values;

    Record(Header header, Object[] values) {
        this.header = header;
        this.values = values;
    }

    public Header header() {
        return header;
    }

    /**
     * Returns the values of this record, in header order.
     *
     * @return an unmodifiable list of the values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    /**
     * Returns this record's value for the given field.
     *
     * @param field the field
     * @return the value for the field, possibly {@code null}
     * @param <T> the value type of the field
     * @throws SchemaException if the header does not contain the field
     */
    public <T> T get(Field<T> field) {
        int index = header.indexOf(field);
        if (index < 0)
            throw new SchemaException("Invalid field: " + field);
        return Utils.cast(values[index]);
    }

    /**
     * Returns this record's value for the given pin's field.
     *
     * @param pin the pin
     * @return the value for the pin's field, possibly {@code null}
     * @param <T> the value type of the field
     * @throws SchemaException if the header does not hold the pin's field at the pin's index
     */
    public <T> T get(FieldPin<T> pin) {
        if (!pin.matches(header))
            throw new SchemaException("Invalid field-pin: " + pin);
        return Utils.cast(values[pin.index]);
    }

    /**
     * Returns {@code true} if the given object is a record with an equal header and equal values.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Record))
            return false;
        Record that = (Record) o;
        return header.equals(that.header) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + Arrays.hashCode(values);
    }

    /**
     * Returns the {@code field=value} pairs of this record, as in {@code Record{channel=A, count=3}}.
     */
    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "Record{", "}");
        for (int i = 0; i < values.length; i++)
            joiner.add(header.fields[i] + "=" + values[i]);
        return joiner.toString();
    }
}
