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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalizes punctuation through substitution tables. Each text is rewritten in three steps:
 *
 * <ol>
 *     <li>typographic and symbol characters are substituted ({@code ’} to {@code '}, {@code ×} to {@code x},
 *     {@code π} to {@code pi}, ...);</li>
 *     <li>every punctuation character is padded with a space on each side;</li>
 *     <li>special characters are substituted (zero-width space, ellipsis, byte-order mark),</li>
 * </ol>
 *
 * and the result is trimmed.
 */
public final class PunctuationNormalizer implements TextTransformer {
    static final String STANDARD_PUNCTUATION =
        "/-'?!.,#$%()*+:;<=>@[\\]^_`{|}~\"“”’∞θ÷α•à−β∅³π‘₹´°£€×™√²—–&";

    private static final Map<String, String> STANDARD_SYMBOLS = new LinkedHashMap<>();
    private static final Map<String, String> STANDARD_SPECIALS = new LinkedHashMap<>();

    static {
        String[][] symbols = {
            { "‘", "'" }, { "₹", "e" }, { "´", "'" }, { "°", "" }, { "€", "e" }, { "™", "tm" }, { "√", " sqrt " },
            { "×", "x" }, { "²", "2" }, { "—", "-" }, { "–", "-" }, { "’", "'" }, { "_", "-" }, { "`", "'" },
            { "“", "\"" }, { "”", "\"" }, { "£", "e" }, { "∞", "infinity" }, { "θ", "theta" }, { "÷", "/" },
            { "α", "alpha" }, { "•", "." }, { "à", "a" }, { "−", "-" }, { "β", "beta" }, { "∅", "" }, { "³", "3" },
            { "π", "pi" },
        };
        for (String[] pair : symbols)
            STANDARD_SYMBOLS.put(pair[0], pair[1]);
        STANDARD_SPECIALS.put("\u200b", " ");
        STANDARD_SPECIALS.put("…", " ... ");
        STANDARD_SPECIALS.put("\ufeff", "");
    }

    private final Map<String, String> symbols;
    private final String punctuation;
    private final Map<String, String> specials;

    /**
     * Creates a normalizer with the given tables. Substitutions apply in map iteration order.
     *
     * @param symbols substitutions applied before padding
     * @param punctuation the characters to pad with spaces
     * @param specials substitutions applied after padding
     */
    public PunctuationNormalizer(Map<String, String> symbols, String punctuation, Map<String, String> specials) {
        this.symbols = new LinkedHashMap<>(symbols);
        this.punctuation = Objects.requireNonNull(punctuation);
        this.specials = new LinkedHashMap<>(specials);
    }

    /**
     * Returns a normalizer with the standard tables.
     *
     * @return the standard normalizer
     */
    public static PunctuationNormalizer standard() {
        return new PunctuationNormalizer(STANDARD_SYMBOLS, STANDARD_PUNCTUATION, STANDARD_SPECIALS);
    }

    /**
     * Normalizes one text.
     *
     * @param text the text
     * @return the normalized text
     */
    public String normalize(String text) {
        for (Map.Entry<String, String> e : symbols.entrySet())
            text = text.replace(e.getKey(), e.getValue());
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (punctuation.indexOf(c) >= 0)
                sb.append(' ').append(c).append(' ');
            else
                sb.append(c);
        }
        text = sb.toString();
        for (Map.Entry<String, String> e : specials.entrySet())
            text = text.replace(e.getKey(), e.getValue());
        return text.trim();
    }

    @Override
    public List<String> transform(List<String> texts) {
        List<String> out = new ArrayList<>(texts.size());
        for (String text : texts)
            out.add(normalize(text));
        return out;
    }
}
