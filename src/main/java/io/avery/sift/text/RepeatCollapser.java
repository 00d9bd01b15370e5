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
import java.util.regex.Pattern;

/**
 * Collapses characters repeated beyond a limit, as in {@code "ㅋㅋㅋㅋㅋ"} to {@code "ㅋㅋ"}, then collapses whitespace
 * runs to a single space and trims.
 */
public final class RepeatCollapser implements TextTransformer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Pattern repeats;
    private final String replacement;

    /**
     * Creates a collapser that keeps at most the given number of repetitions of any word character.
     *
     * @param maxRepeats the number of repetitions to keep
     * @throws IllegalArgumentException if {@code maxRepeats} is less than 1
     */
    public RepeatCollapser(int maxRepeats) {
        if (maxRepeats < 1)
            throw new IllegalArgumentException("maxRepeats must be at least 1: " + maxRepeats);
        this.repeats = Pattern.compile("(\\w)\\1{" + maxRepeats + ",}", Pattern.UNICODE_CHARACTER_CLASS);
        this.replacement = "$1".repeat(maxRepeats);
    }

    /**
     * Creates a collapser that keeps at most two repetitions.
     */
    public RepeatCollapser() {
        this(2);
    }

    /**
     * Collapses one text.
     *
     * @param text the text
     * @return the collapsed text
     */
    public String collapse(String text) {
        text = repeats.matcher(text).replaceAll(replacement);
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    @Override
    public List<String> transform(List<String> texts) {
        List<String> out = new ArrayList<>(texts.size());
        for (String text : texts)
            out.add(collapse(text));
        return out;
    }
}
