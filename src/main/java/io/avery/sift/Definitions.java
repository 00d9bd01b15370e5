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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The field definitions collected by a configurator, in order of first definition. Redefining a field replaces its
 * definition but keeps its position.
 *
 * @param <D> the definition type
 */
final class Definitions<D> {
    private final Map<Field<?>, Integer> indexByField = new HashMap<>();
    private final List<D> definitions = new ArrayList<>();

    void define(Field<?> field, D definition) {
        Objects.requireNonNull(field);
        Objects.requireNonNull(definition);
        Integer index = indexByField.putIfAbsent(field, definitions.size());
        if (index == null)
            definitions.add(definition);
        else
            definitions.set(index, definition);
    }

    /**
     * Returns a header over the defined fields, in definition order.
     */
    Header header() {
        return new Header(new HashMap<>(indexByField));
    }

    /**
     * Returns a snapshot of the definitions, indexed like {@link #header()}.
     */
    List<D> snapshot() {
        return List.copyOf(definitions);
    }
}
