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

import java.util.List;
import java.util.Map;

import static io.avery.sift.RecordSets.unsafeRecordSet;
import static org.junit.jupiter.api.Assertions.*;

public class CategoricalAggregatorTest {
    private static final Field<String> CHANNEL = new Field<>("channel");

    private static final RecordSet DATA = unsafeRecordSet(new Object[][]{
        { CHANNEL },
        { "A" },
        { "B" },
        { "A" },
        { "C" },
        { "A" }
    });

    @Test
    void testDescendingWithPercentage() {
        RecordSet result = CategoricalAggregator.countByCategory(DATA, "channel", SortOrder.DESCENDING, true);

        RecordSet expected = unsafeRecordSet(new Object[][]{
            { CHANNEL, Counts.COUNT, Counts.PERCENTAGE },
            { "A", 3L, 60.0 },
            { "B", 1L, 20.0 },
            { "C", 1L, 20.0 }
        });
        assertEquals(expected, result);
    }

    @Test
    void testAscendingKeepsFirstSeenOrderForTies() {
        RecordSet result = CategoricalAggregator.countByCategory(DATA, "channel", "ascending", false);

        RecordSet expected = unsafeRecordSet(new Object[][]{
            { CHANNEL, Counts.COUNT },
            { "B", 1L },
            { "C", 1L },
            { "A", 3L }
        });
        assertEquals(expected, result);
    }

    @Test
    void testUnsorted() {
        RecordSet result = CategoricalAggregator.countByCategory(DATA, "channel", "neither", false);

        assertEquals(List.of("A", "B", "C"), result.column(CHANNEL));
    }

    @Test
    void testCountsSumToRecordCount() {
        RecordSet result = CategoricalAggregator.countByCategory(DATA, "channel", SortOrder.NONE, false);

        long total = 0;
        for (Long count : result.column(Counts.COUNT))
            total += count;
        assertEquals(DATA.size(), total);
    }

    @Test
    void testPercentagesSumToHundred() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { CHANNEL },
            { "x" },
            { "y" },
            { "z" }
        });

        RecordSet result = CategoricalAggregator.countByCategory(data, "channel", SortOrder.DESCENDING, true);

        double sum = 0;
        for (Double percentage : result.column(Counts.PERCENTAGE)) {
            assertEquals(33.3333, percentage);
            sum += percentage;
        }
        assertEquals(100.0, sum, 0.001);
    }

    @Test
    void testNullCategoriesAreSkipped() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { CHANNEL },
            { null },
            { "A" },
            { null },
            { "B" },
            { "A" }
        });

        RecordSet result = CategoricalAggregator.countByCategory(data, "channel", SortOrder.DESCENDING, true);
        Map<String, Long> counts = Counts.asMap(result);

        assertFalse(counts.containsKey(null));
        assertEquals(2L, counts.get("A"));
        assertEquals(1L, counts.get("B"));
        assertEquals(List.of(66.6667, 33.3333), result.column(Counts.PERCENTAGE));
    }

    @Test
    void testEmptyTable() {
        RecordSet data = unsafeRecordSet(new Object[][]{
            { CHANNEL }
        });

        RecordSet result = CategoricalAggregator.countByCategory(data, "channel", SortOrder.DESCENDING, true);

        assertTrue(result.isEmpty());
        assertEquals(List.of(CHANNEL, Counts.COUNT, Counts.PERCENTAGE), result.header().fields());
    }

    @Test
    void testMissingColumn() {
        assertThrows(SchemaException.class,
                     () -> CategoricalAggregator.countByCategory(DATA, "channel2", SortOrder.DESCENDING, true));
    }

    @Test
    void testPercentageRounding() {
        assertEquals(66.6667, Counts.percentage(2, 3));
        assertEquals(0.0, Counts.percentage(0, 0));
        assertEquals(100.0, Counts.percentage(7, 7));
    }
}
