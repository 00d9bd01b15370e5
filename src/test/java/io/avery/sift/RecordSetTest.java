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

import java.util.Comparator;
import java.util.List;

import static io.avery.sift.RecordSets.unsafeRecordSet;
import static org.junit.jupiter.api.Assertions.*;

public class RecordSetTest {
    private static final Field<String> TEXT = new Field<>("text");
    private static final Field<String> CHANNEL = new Field<>("channel");

    @Test
    void testHeaderLookupByName() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT, CHANNEL },
            { "a", "x" }
        });

        assertSame(CHANNEL, data.header().field("channel"));
        assertEquals(1, data.header().pin("channel").index());
        assertSame(CHANNEL, data.header().pin("channel").field());
        assertThrows(SchemaException.class, () -> data.header().field("missing"));
        assertThrows(SchemaException.class, () -> data.header().pin("missing"));
    }

    @Test
    void testReplacementKeepsOldFieldOnOldTable() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT, CHANNEL },
            { "a", "x" }
        });
        Field<Integer> length = TEXT.replacement();

        RecordSet result = data.withColumn(length, List.of(1));

        assertNotSame(TEXT, length);
        assertEquals("text", length.name());
        assertEquals(List.of(1), result.column(length));
        assertEquals(-1, result.header().indexOf(TEXT));
        assertEquals(List.of("a"), data.column(TEXT));
    }

    @Test
    void testColumn() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT, CHANNEL },
            { "a", "x" },
            { "b", "y" },
            { "c", null }
        });

        assertEquals(List.of("x", "y"), data.column(CHANNEL).subList(0, 2));
        assertNull(data.column(CHANNEL).get(2));
        assertThrows(SchemaException.class, () -> data.column(new Field<>("channel")));
    }

    @Test
    void testWithColumnReplacesByName() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT, CHANNEL },
            { "a", "x" },
            { "b", "y" }
        });
        Field<Integer> replacement = new Field<>("text");

        RecordSet replaced = data.withColumn(replacement, List.of(1, 2));

        RecordSet expected = unsafeRecordSet(new Object[][]{
            { replacement, CHANNEL },
            { 1, "x" },
            { 2, "y" }
        });
        assertEquals(expected, replaced);
        assertEquals("a", data.get(0).get(TEXT));
    }

    @Test
    void testWithColumnAppends() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT },
            { "a" },
            { "b" }
        });
        Field<Boolean> flag = new Field<>("flag");

        RecordSet appended = data.withColumn(flag, List.of(true, false));

        assertEquals(List.of(TEXT, flag), appended.header().fields());
        assertEquals(List.of(true, false), appended.column(flag));
        assertThrows(IllegalArgumentException.class, () -> data.withColumn(flag, List.of(true)));
    }

    @Test
    void testSelectProjection() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT, CHANNEL },
            { "a", "x" },
            { "b", "y" }
        });

        RecordSet projected = data.stream()
            .select(select -> select
                .field(CHANNEL)
                .field(TEXT, record -> record.get(TEXT).toUpperCase())
            )
            .toRecordSet();

        RecordSet expected = unsafeRecordSet(new Object[][]{
            { CHANNEL, TEXT },
            { "x", "A" },
            { "y", "B" }
        });
        assertEquals(expected, projected);
    }

    @Test
    void testLimitAndSorted() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT },
            { "b" },
            { "c" },
            { "a" }
        });

        RecordSet result = data.stream()
            .sorted(Comparator.comparing(TEXT::get))
            .limit(2)
            .toRecordSet();

        assertEquals(List.of("a", "b"), result.column(TEXT));
    }

    @Test
    void testStreamIsRepeatable() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { TEXT },
            { "a" },
            { "b" },
            { "c" }
        });

        assertEquals(2, data.stream().filter(record -> !record.get(TEXT).equals("b")).toRecordSet().size());
        assertEquals(3, data.stream().toRecordSet().size());
        assertEquals(data, data.stream().toRecordSet());
    }
}
