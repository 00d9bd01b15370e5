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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The ordered fields of the records of a {@link RecordSet table} or {@link RecordStream record-stream}. Fields are
 * found by identity through {@link #indexOf(Field)} and {@link #pin(Field)}, or by name through
 * {@link #field(String)} and {@link #pin(String)}.
 */
public class Header {
    final Map<Field<?>, Integer> indexByField;
    final Field<?>[] fields;

    Header(Map<Field<?>, Integer> indexByField) {
        this.indexByField = indexByField;
        this.fields = new Field<?>[indexByField.size()];
        for (Map.Entry<Field<?>, Integer> e : indexByField.entrySet())
            fields[e.getValue()] = e.getKey();
    }

    /**
     * Creates a header over the given fields, in order.
     *
     * @throws IllegalArgumentException if a field repeats
     */
    static Header of(List<? extends Field<?>> fields) {
        Map<Field<?>, Integer> indexByField = new HashMap<>();
        for (int i = 0; i < fields.size(); i++)
            if (indexByField.putIfAbsent(Objects.requireNonNull(fields.get(i)), i) != null)
                throw new IllegalArgumentException("Duplicate field: " + fields.get(i));
        return new Header(indexByField);
    }

    /**
     * Returns the position of the given field, or {@code -1} if it is not in this header.
     *
     * @param field the field
     * @return the position of the field, or {@code -1}
     */
    public int indexOf(Field<?> field) {
        return indexByField.getOrDefault(Objects.requireNonNull(field), -1);
    }

    /**
     * Returns the first field with the given name.
     *
     * @param name the field name
     * @return the first field with the name
     * @param <T> the value type the caller expects of the field
     * @throws SchemaException if no field has the name
     */
    public <T> Field<T> field(String name) {
        Objects.requireNonNull(name);
        for (Field<?> field : fields)
            if (field.name().equals(name))
                return Utils.cast(field);
        throw new SchemaException("No column named '" + name + "' in " + this);
    }

    /**
     * Binds the given field to its position in this header.
     *
     * @param field the field
     * @return a pin for the field
     * @param <T> the value type of the field
     * @throws SchemaException if the field is not in this header
     */
    public <T> FieldPin<T> pin(Field<T> field) {
        int index = indexOf(field);
        if (index < 0)
            throw new SchemaException("Invalid field: " + field);
        return new FieldPin<>(field, index);
    }

    /**
     * Binds the first field with the given name to its position in this header.
     *
     * @param name the field name
     * @return a pin for the named field
     * @param <T> the value type the caller expects of the field
     * @throws SchemaException if no field has the name
     */
    public <T> FieldPin<T> pin(String name) {
        return pin(this.<T>field(name));
    }

    /**
     * Returns the fields, in order.
     *
     * @return an unmodifiable list of the fields
     */
    public List<Field<?>> fields() {
        return Collections.unmodifiableList(Arrays.asList(fields));
    }

    /**
     * Returns {@code true} if the given object is a header of the same fields, in the same order.
     */
    @Override
    public boolean equals(Object o) {
        return o == this || (o instanceof Header && Arrays.equals(fields, ((Header) o).fields));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(fields);
    }

    @Override
    public String toString() {
        return "Header" + Arrays.toString(fields);
    }
}
