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
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * Configures how plain objects become {@link Record records}: each defined field is computed from the object by a
 * function, and the defined fields form the header of the resulting records, in order of definition.
 *
 * @see RecordStream.Aux#mapToRecord
 * @see RecordSet#collector
 * @param <T> the type of the objects
 */
public class IntoAPI<T> {
    private final Definitions<Function<? super T, ?>> definitions = new Definitions<>();

    IntoAPI() {} // Prevent default public constructor

    /**
     * Defines (or redefines) the given field as computed from each object by the given function.
     *
     * @param field the field
     * @param mapper computes the field value from an object
     * @return this configurator
     * @param <U> the value type of the field
     */
    public <U> IntoAPI<T> field(Field<U> field, Function<? super T, ? extends U> mapper) {
        definitions.define(field, mapper);
        return this;
    }

    RecordStream accept(RecordStream.Aux<T> source, Consumer<IntoAPI<T>> config) {
        config.accept(this);
        Header header = definitions.header();
        List<Function<? super T, ?>> mappers = definitions.snapshot();
        return new RecordStream(header, source.stream.map(it -> new Record(header, valuesOf(mappers, it))));
    }

    Collector<T, ?, RecordSet> collector(Consumer<IntoAPI<T>> config) {
        config.accept(this);
        Header header = definitions.header();
        List<Function<? super T, ?>> mappers = definitions.snapshot();
        return Collector.<T, List<Object[]>, RecordSet>of(
            ArrayList::new,
            (rows, it) -> rows.add(valuesOf(mappers, it)),
            (left, right) -> {
                left.addAll(right);
                return left;
            },
            rows -> new RecordSet(header, rows.toArray(new Object[0][]))
        );
    }

    private static <T> Object[] valuesOf(List<Function<? super T, ?>> mappers, T it) {
        Object[] values = new Object[mappers.size()];
        for (int i = 0; i < values.length; i++)
            values[i] = mappers.get(i).apply(it);
        return values;
    }
}
