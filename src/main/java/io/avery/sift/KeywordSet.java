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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A keyword predicate tree: single keywords at the leaves, combined by {@link Logic#AND AND} or {@link Logic#OR OR}.
 *
 * <p>A leaf holds for a value when its keyword is a substring of the value, or, when evaluated with
 * {@link Polarity#EXCLUDE exclude} polarity, when it is <em>not</em>. Combinators join the per-keyword truth values,
 * so {@code AND} of {@code ["love", "cafe"]} holds for any value containing both keywords, in any order and at any
 * distance. The empty keyword is a substring of every value.
 *
 * <p>An {@code AND} with no children holds for every value, and an {@code OR} with no children for none.
 */
public abstract class KeywordSet {
    KeywordSet() {} // Prevent extension outside this package

    /**
     * How multiple keywords combine.
     */
    public enum Logic {
        AND, OR;

        /**
         * Parses a combinator token, which must be exactly {@code "and"} or {@code "or"}.
         *
         * @param token the token
         * @return the combinator
         * @throws ConfigException if the token is not exactly {@code "and"} or {@code "or"}
         */
        public static Logic of(String token) {
            if ("and".equals(token))
                return AND;
            if ("or".equals(token))
                return OR;
            throw new ConfigException("Multiple keywords require logic 'and' or 'or', got: " + token);
        }
    }

    /**
     * Whether leaves test for the presence or the absence of their keyword.
     */
    public enum Polarity {
        INCLUDE, EXCLUDE
    }

    /**
     * Returns a set of one keyword.
     *
     * @param keyword the keyword
     * @return a single-keyword set
     */
    public static KeywordSet of(String keyword) {
        return new Leaf(keyword);
    }

    /**
     * Returns a set of the given keywords, joined by the given combinator token. A list of two or more keywords must
     * carry a combinator of exactly {@code "and"} or {@code "or"}; for shorter lists the token is ignored and may be
     * {@code null}. An empty list holds for every value.
     *
     * @param keywords the keywords
     * @param logic the combinator token, {@code "and"} or {@code "or"}
     * @return the keyword set
     * @throws ConfigException if the list has two or more keywords and the combinator is not {@code "and"} or
     * {@code "or"}
     */
    public static KeywordSet of(List<String> keywords, String logic) {
        List<KeywordSet> leaves = new ArrayList<>(keywords.size());
        for (String keyword : keywords)
            leaves.add(new Leaf(keyword));
        if (leaves.size() == 1)
            return leaves.get(0);
        if (leaves.isEmpty())
            return new Combinator(Logic.AND, leaves);
        return new Combinator(Logic.of(logic), leaves);
    }

    /**
     * Returns a set that holds when all of the given sets hold.
     *
     * @param children the sets to combine
     * @return the conjunction
     */
    public static KeywordSet all(KeywordSet... children) {
        return new Combinator(Logic.AND, Arrays.asList(children));
    }

    /**
     * Returns a set that holds when any of the given sets holds.
     *
     * @param children the sets to combine
     * @return the disjunction
     */
    public static KeywordSet any(KeywordSet... children) {
        return new Combinator(Logic.OR, Arrays.asList(children));
    }

    /**
     * Evaluates this set against the given value.
     *
     * @param value the value to search
     * @param polarity whether leaves test for presence or absence of their keyword
     * @return {@code true} if this set holds for the value
     */
    public abstract boolean test(String value, Polarity polarity);

    /**
     * Returns the keywords at the leaves of this set, in order.
     *
     * @return the leaf keywords
     */
    public abstract List<String> keywords();

    static final class Leaf extends KeywordSet {
        final String keyword;

        Leaf(String keyword) {
            this.keyword = Objects.requireNonNull(keyword);
        }

        @Override
        public boolean test(String value, Polarity polarity) {
            return value.contains(keyword) == (polarity == Polarity.INCLUDE);
        }

        @Override
        public List<String> keywords() {
            return List.of(keyword);
        }

        @Override
        public String toString() {
            return '"' + keyword + '"';
        }
    }

    static final class Combinator extends KeywordSet {
        final Logic logic;
        final List<KeywordSet> children;

        Combinator(Logic logic, List<KeywordSet> children) {
            this.logic = logic;
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
            this.children.forEach(Objects::requireNonNull);
        }

        @Override
        public boolean test(String value, Polarity polarity) {
            if (logic == Logic.AND) {
                for (KeywordSet child : children)
                    if (!child.test(value, polarity))
                        return false;
                return true;
            }
            for (KeywordSet child : children)
                if (child.test(value, polarity))
                    return true;
            return false;
        }

        @Override
        public List<String> keywords() {
            List<String> keywords = new ArrayList<>();
            for (KeywordSet child : children)
                keywords.addAll(child.keywords());
            return keywords;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(logic.name()).append('(');
            String delimiter = "";
            for (KeywordSet child : children) {
                sb.append(delimiter).append(child);
                delimiter = ", ";
            }
            return sb.append(')').toString();
        }
    }
}
