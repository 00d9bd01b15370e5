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

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.avery.sift.RecordSets.unsafeRecordSet;
import static org.junit.jupiter.api.Assertions.*;

public class KeywordFilterTest {
    private static final Field<String> TEXT = new Field<>("text");
    private static final Field<Integer> ID = new Field<>("id");

    private static final RecordSet DATA = unsafeRecordSet(new Object[][]{
        { ID, TEXT },
        { 0, "I love cafes" },
        { 1, "cafes are loud" },
        { 2, "love the cafes here" },
        { 3, "nothing to see" }
    });

    @Test
    void testIncludeAnd() {
        RecordSet result = KeywordFilter.include(DATA, "text", List.of("love", "cafes"), "and");

        assertEquals(List.of(0, 2), result.column(ID));
    }

    @Test
    void testIncludeOr() {
        RecordSet result = KeywordFilter.include(DATA, "text", List.of("loud", "see"), "or");

        assertEquals(List.of(1, 3), result.column(ID));
    }

    @Test
    void testExcludeAnd() {
        // Keeps records that contain none of the keywords.
        RecordSet result = KeywordFilter.exclude(DATA, "text", List.of("love", "loud"), "and");

        assertEquals(List.of(3), result.column(ID));
    }

    @Test
    void testExcludeOr() {
        // Keeps records that lack at least one of the keywords.
        RecordSet result = KeywordFilter.exclude(DATA, "text", List.of("love", "cafes"), "or");

        assertEquals(List.of(1, 3), result.column(ID));
    }

    @Test
    void testSingleKeywordIgnoresLogic() {
        RecordSet included = KeywordFilter.include(DATA, "text", List.of("cafes"), null);
        RecordSet excluded = KeywordFilter.exclude(DATA, "text", List.of("cafes"), "whatever");

        assertEquals(List.of(0, 1, 2), included.column(ID));
        assertEquals(List.of(3), excluded.column(ID));
    }

    private static final List<List<String>> KEYWORD_LISTS = List.of(
        List.of("love", "cafes"),
        List.of("loud", "see"),
        List.of("love", "here", "I"),
        List.of("cafes", ""),
        List.of("nope", "love")
    );

    private static Set<Integer> ids(RecordSet table) {
        return new HashSet<>(table.column(ID));
    }

    @Test
    void testIncludeAndExcludePartitionSingleKeyword() {
        for (String keyword : List.of("love", "cafes", "e", "", "nope")) {
            Set<Integer> included = ids(KeywordFilter.include(DATA, "text", KeywordSet.of(keyword)));
            Set<Integer> excluded = ids(KeywordFilter.exclude(DATA, "text", KeywordSet.of(keyword)));

            Set<Integer> overlap = new HashSet<>(included);
            overlap.retainAll(excluded);
            Set<Integer> union = new HashSet<>(included);
            union.addAll(excluded);

            assertEquals(Set.of(), overlap, keyword);
            assertEquals(ids(DATA), union, keyword);
        }
    }

    @Test
    void testIncludeAndIsIntersectionOfSingleKeywords() {
        for (List<String> keywords : KEYWORD_LISTS) {
            Set<Integer> expected = ids(DATA);
            for (String keyword : keywords)
                expected.retainAll(ids(KeywordFilter.include(DATA, "text", List.of(keyword), null)));

            assertEquals(expected, ids(KeywordFilter.include(DATA, "text", keywords, "and")), keywords.toString());
        }
    }

    @Test
    void testIncludeOrIsUnionOfSingleKeywords() {
        for (List<String> keywords : KEYWORD_LISTS) {
            Set<Integer> expected = new HashSet<>();
            for (String keyword : keywords)
                expected.addAll(ids(KeywordFilter.include(DATA, "text", List.of(keyword), null)));

            assertEquals(expected, ids(KeywordFilter.include(DATA, "text", keywords, "or")), keywords.toString());
        }
    }

    @Test
    void testEmptyKeywordMatchesEverything() {
        assertEquals(DATA, KeywordFilter.include(DATA, "text", KeywordSet.of("")));
        assertEquals(DATA, KeywordFilter.include(DATA, "text", List.of(), null));
    }

    @Test
    void testNestedKeywordSet() {
        KeywordSet keywords = KeywordSet.any(
            KeywordSet.all(KeywordSet.of("love"), KeywordSet.of("here")),
            KeywordSet.of("nothing")
        );

        RecordSet result = KeywordFilter.include(DATA, "text", keywords);

        assertEquals(List.of(2, 3), result.column(ID));
        assertEquals(List.of("love", "here", "nothing"), keywords.keywords());
    }

    @Test
    void testInvalidLogic() {
        assertThrows(ConfigException.class, () -> KeywordFilter.include(DATA, "text", List.of("a", "b"), "xor"));
        assertThrows(ConfigException.class, () -> KeywordFilter.include(DATA, "text", List.of("a", "b"), null));
        assertThrows(ConfigException.class, () -> KeywordFilter.exclude(DATA, "text", List.of("a", "b"), "AND"));
    }

    @Test
    void testMissingColumn() {
        assertThrows(SchemaException.class, () -> KeywordFilter.include(DATA, "body", KeywordSet.of("love")));
    }

    @Test
    void testNonTextValue() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT },
            { "love" },
            { null }
        });

        ValidationException e = assertThrows(ValidationException.class,
                                             () -> KeywordFilter.include(data, "text", KeywordSet.of("love")));
        assertEquals(1, e.row());
    }

    @Test
    void testInputUnchanged() {
        RecordSet before = DATA.stream().toRecordSet();

        KeywordFilter.exclude(DATA, "text", KeywordSet.of("love"));

        assertEquals(before, DATA);
    }
}
