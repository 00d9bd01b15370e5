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

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Configures a select operation on a {@link RecordStream record-stream}, which maps every input record to one output
 * record. Output fields are either carried over from the input, or computed from each input record.
 *
 * <p>Output fields appear in order of definition. Redefining a field replaces its definition in place.
 *
 * @see RecordStream#select
 */
public class SelectAPI {
    private final RecordStream stream;
    private final Definitions<Function<? super Record, ?>> definitions = new Definitions<>();

    SelectAPI(RecordStream stream) {
        this.stream = stream;
    }

    /**
     * Carries over every input field, in input order.
     *
     * @return this configurator
     */
    public SelectAPI allFields() {
        Field<?>[] fields = stream.header.fields;
        for (int i = 0; i < fields.length; i++)
            carry(new FieldPin<>(fields[i], i));
        return this;
    }

    /**
     * Carries over the given input field.
     *
     * @param field the field
     * @return this configurator
     * @throws SchemaException if the input header does not contain the field
     */
    public SelectAPI field(Field<?> field) {
        return carry(stream.header.pin(field));
    }

    /**
     * Defines (or redefines) the given field as computed from each input record by the given function.
     *
     * @param field the field
     * @param mapper computes the field value from an input record
     * @return this configurator
     * @param <T> the value type of the field
     */
    public <T> SelectAPI field(Field<T> field, Function<? super Record, ? extends T> mapper) {
        definitions.define(field, mapper);
        return this;
    }

    private SelectAPI carry(FieldPin<?> pin) {
        definitions.define(pin.field, record -> record.get(pin));
        return this;
    }

    RecordStream accept(Consumer<SelectAPI> config) {
        config.accept(this);
        Header header = definitions.header();
        List<Function<? super Record, ?>> mappers = definitions.snapshot();
        return new RecordStream(header, stream.stream.map(record -> {
            Object[] values = new Object[mappers.size()];
            for (int i = 0; i < values.length; i++)
                values[i] = mappers.get(i).apply(record);
            return new Record(header, values);
        }));
    }
}
