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

package io.avery.sift.text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A text processing capability over a batch of texts, such as sentence splitting, spacing correction or spell
 * checking. Output order follows input order. Stages that rewrite each text in place return one output per input;
 * stages that split texts may return more.
 */
@FunctionalInterface
public interface TextTransformer {
    /**
     * Transforms the given texts.
     *
     * @param texts the input texts
     * @return the output texts, in input order
     */
    List<String> transform(List<String> texts);

    /**
     * Returns a transformer that applies the given function to each text.
     *
     * @param fn the per-text function
     * @return a one-to-one transformer
     */
    static TextTransformer perText(UnaryOperator<String> fn) {
        return texts -> {
            List<String> out = new ArrayList<>(texts.size());
            for (String text : texts)
                out.add(fn.apply(text));
            return out;
        };
    }
}
