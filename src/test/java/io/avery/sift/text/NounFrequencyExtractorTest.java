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

import io.avery.sift.Field;
import io.avery.sift.RecordSet;
import io.avery.sift.csv.CsvTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.avery.sift.RecordSets.unsafeRecordSet;
import static org.junit.jupiter.api.Assertions.*;

public class NounFrequencyExtractorTest {
    private static final Field<String> TEXT = new Field<>("text");

    // Treats every whitespace-separated token of two or more characters as a noun.
    private final NounFrequencyExtractor extractor = new NounFrequencyExtractor(text -> {
        List<String> nouns = new ArrayList<>();
        for (String token : text.split("\\s+"))
            if (token.length() >= 2)
                nouns.add(token);
        return nouns;
    });

    private static final RecordSet DATA = unsafeRecordSet(new Object[][]{
        { TEXT },
        { "카페 커피 a 카페" },
        { "커피 케이크" },
        { "카페 디저트" }
    });

    @Test
    void testExtract() {
        RecordSet result = extractor.extract(DATA, "text", 1);

        assertEquals(List.of(NounFrequencyExtractor.TERMS, NounFrequencyExtractor.FREQUENCY),
                     result.header().fields());
        assertEquals(List.of("카페", "커피", "케이크", "디저트"), result.column(NounFrequencyExtractor.TERMS));
        assertEquals(List.of(3L, 2L, 1L, 1L), result.column(NounFrequencyExtractor.FREQUENCY));
    }

    @Test
    void testMinCount() {
        RecordSet result = extractor.extract(DATA, "text", 2);

        assertEquals(List.of("카페", "커피"), result.column(NounFrequencyExtractor.TERMS));
    }

    @Test
    void testWrite(@TempDir Path dir) {
        Path file = dir.resolve("frequencies.csv");

        NounFrequencyExtractor.write(extractor.extract(DATA, "text", 2), file);

        RecordSet read = CsvTables.read(file, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList("카페", "3"), read.get(0).values());
        assertEquals("FREQUENCY", read.header().fields().get(1).name());
    }
}
