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

import java.util.Objects;

/**
 * A field bound to its position in one header. Looking a value up through a pin skips the header's index search,
 * which matters when the same column is read from every record of a table. A pin resolves only on records whose
 * header holds its field at its index.
 *
 * @param <T> the value type of the field
 * @see Header#pin(Field)
 */
public final class FieldPin<T> {
    final Field<T> field;
    final int index;

    FieldPin(Field<T> field, int index) {
        this.field = Objects.requireNonNull(field);
        this.index = index;
    }

    boolean matches(Header header) {
        return index < header.fields.length && header.fields[index] == field;
    }

    /**
     * Shorthand for {@code record.get(this)}, so that {@code pin::get} can serve as a function.
     *
     * @param record the record
     * @return the record's value for this pin's field
     * @throws SchemaException if the record's header does not hold this pin's field at this pin's index
     */
    public T get(Record record) {
        return record.get(this);
    }

    public Field<T> field() {
        return field;
    }

    public int index() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FieldPin))
            return false;
        FieldPin<?> that = (FieldPin<?>) o;
        return index == that.index && field == that.field;
    }

    @Override
    public int hashCode() {
        return 31 * field.hashCode() + index;
    }

    /**
     * Returns the field name and index, as in {@code channel@2}.
     */
    @Override
    public String toString() {
        return field.name() + "@" + index;
    }
}
