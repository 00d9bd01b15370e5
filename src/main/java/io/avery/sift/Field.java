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
 * A typed column of a {@link RecordSet table}. Fields are compared by identity, so two distinct fields may carry the
 * same name; name-based lookup goes through {@link Header#field(String)}, which resolves the first field with the
 * name.
 *
 * <p>Operations that rewrite a column never reuse its field. They put a {@link #replacement() replacement} in its
 * place, so a field held by the caller keeps describing the values of the table it came from.
 *
 * @param <T> the value type of the field
 */
public final class Field<T> {
    private final String name;

    /**
     * Creates a new field with the given name.
     *
     * @param name the field name
     */
    public Field(String name) {
        this.name = Objects.requireNonNull(name);
    }

    /**
     * Returns a new field with this field's name, for a column whose values are rewritten, possibly to another type.
     *
     * @return a distinct field with the same name
     * @param <U> the value type of the new field
     */
    public <U> Field<U> replacement() {
        return new Field<>(name);
    }

    /**
     * Shorthand for {@code record.get(this)}, so that {@code field::get} can serve as a function.
     *
     * @param record the record
     * @return the record's value for this field
     * @throws SchemaException if the record's header does not contain this field
     */
    public T get(Record record) {
        return record.get(this);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
