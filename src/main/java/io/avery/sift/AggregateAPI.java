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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configures an aggregate operation on a {@link RecordStream record-stream}.
 *
 * <p>Key fields together partition the input records: records with equal key values fall in the same group. Each
 * aggregate field is computed per group by a {@link Collector} over the group's records. Every group yields one
 * output record, and groups are emitted in order of their first input record.
 *
 * <p>Output fields appear in order of definition. Redefining a field replaces its definition in place.
 *
 * @see RecordStream#aggregate
 */
public class AggregateAPI {
    private final RecordStream stream;
    private final Definitions<Object> definitions = new Definitions<>();

    AggregateAPI(RecordStream stream) {
        this.stream = stream;
    }

    /**
     * Defines (or redefines) the given input field as a key.
     *
     * @param field the field
     * @return this configurator
     * @throws SchemaException if the input header does not contain the field
     */
    public AggregateAPI keyField(Field<?> field) {
        FieldPin<?> pin = stream.header.pin(field);
        return keyField(field, record -> record.get(pin));
    }

    /**
     * Defines (or redefines) the given field as a key computed from each input record by the given function.
     *
     * @param field the field
     * @param mapper computes the key value from an input record
     * @return this configurator
     */
    public AggregateAPI keyField(Field<?> field, Function<? super Record, ?> mapper) {
        definitions.define(field, new Key(Objects.requireNonNull(mapper)));
        return this;
    }

    /**
     * Defines (or redefines) the given field as an aggregate, collected over the records of each group.
     *
     * @param field the field
     * @param collector collects the field value from the records of a group
     * @return this configurator
     * @param <T> the value type of the field
     */
    public <T> AggregateAPI aggField(Field<T> field, Collector<? super Record, ?, ? extends T> collector) {
        definitions.define(field, Objects.requireNonNull(collector));
        return this;
    }

    RecordStream accept(Consumer<AggregateAPI> config) {
        config.accept(this);
        Header header = definitions.header();
        List<Object> defs = definitions.snapshot();

        // Group by the list of key values, collecting each group into the array of aggregate values. The output
        // record interleaves both back into definition order.
        List<Integer> keySlots = new ArrayList<>();
        List<Integer> aggSlots = new ArrayList<>();
        List<Function<? super Record, ?>> keys = new ArrayList<>();
        List<Collector<? super Record, ?, ?>> aggs = new ArrayList<>();
        for (int i = 0; i < defs.size(); i++) {
            Object def = defs.get(i);
            if (def instanceof Key) {
                keySlots.add(i);
                keys.add(((Key) def).mapper);
            } else {
                aggSlots.add(i);
                aggs.add(Utils.cast(def));
            }
        }
        if (keys.isEmpty())
            throw new IllegalStateException("Aggregate requires at least one key field");

        Function<Record, List<Object>> classifier = record -> {
            Object[] values = new Object[keys.size()];
            for (int i = 0; i < values.length; i++)
                values[i] = keys.get(i).apply(record);
            return Arrays.asList(values);
        };
        Collector<Record, ?, Map<List<Object>, Object[]>> grouping =
            Collectors.groupingBy(classifier, LinkedHashMap::new, combine(aggs));

        // Deferred, so that grouping happens when the returned stream is consumed.
        Stream<Record> grouped = Stream.of(stream)
            .flatMap(s -> s.stream.collect(grouping).entrySet().stream())
            .map(group -> {
                Object[] values = new Object[defs.size()];
                for (int i = 0; i < keySlots.size(); i++)
                    values[keySlots.get(i)] = group.getKey().get(i);
                for (int i = 0; i < aggSlots.size(); i++)
                    values[aggSlots.get(i)] = group.getValue()[i];
                return new Record(header, values);
            });
        return new RecordStream(header, grouped);
    }

    /**
     * Returns a collector that runs all of the given collectors side by side, finishing into an array of their
     * results.
     */
    private static Collector<Record, Object[], Object[]> combine(List<Collector<? super Record, ?, ?>> collectors) {
        List<Collector<Record, Object, Object>> cs = new ArrayList<>(collectors.size());
        for (Collector<? super Record, ?, ?> c : collectors)
            cs.add(Utils.cast(c));
        int size = cs.size();
        return Collector.of(
            () -> {
                Object[] containers = new Object[size];
                for (int i = 0; i < size; i++)
                    containers[i] = cs.get(i).supplier().get();
                return containers;
            },
            (containers, record) -> {
                for (int i = 0; i < size; i++)
                    cs.get(i).accumulator().accept(containers[i], record);
            },
            (left, right) -> {
                for (int i = 0; i < size; i++)
                    left[i] = cs.get(i).combiner().apply(left[i], right[i]);
                return left;
            },
            containers -> {
                Object[] results = new Object[size];
                for (int i = 0; i < size; i++)
                    results[i] = cs.get(i).finisher().apply(containers[i]);
                return results;
            }
        );
    }

    private static final class Key {
        final Function<? super Record, ?> mapper;

        Key(Function<? super Record, ?> mapper) {
            this.mapper = mapper;
        }
    }
}
