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
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strips punctuation, digits and HTML tags from texts, lower-cases them, and collapses whitespace.
 */
public final class PunctuationStripper implements TextTransformer {
    private static final Pattern PUNCTUATION = Pattern.compile("[@%\\\\*=()/~#&+á?Ã¡|.:;!\\-,_$'\"]");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");

    /**
     * Strips one text.
     *
     * @param text the text
     * @return the stripped text
     */
    public String strip(String text) {
        text = PUNCTUATION.matcher(text).replaceAll("");
        text = DIGITS.matcher(text).replaceAll("");
        text = text.toLowerCase(Locale.ROOT);
        text = HTML_TAG.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    @Override
    public List<String> transform(List<String> texts) {
        List<String> out = new ArrayList<>(texts.size());
        for (String text : texts)
            out.add(strip(text));
        return out;
    }
}
