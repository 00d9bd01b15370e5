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

package io.avery.sift.csv;

import io.avery.sift.Counts;
import io.avery.sift.Field;
import io.avery.sift.RecordSet;
import io.avery.sift.ResourceMissingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static io.avery.sift.RecordSets.unsafeRecordSet;
import static org.junit.jupiter.api.Assertions.*;

public class CsvTablesTest {
    @Test
    void testRead() {
        String csv = "text,채널2,URL1\n"
            + "\"hello, world\",카페,https://cafe.naver.com/a/1\n"
            + "bye,블로그,\n";

        RecordSet table = CsvTables.read(new StringReader(csv));

        assertEquals(2, table.size());
        assertEquals("채널2", table.header().fields().get(1).name());
        assertEquals(Arrays.asList("hello, world", "카페", "https://cafe.naver.com/a/1"), table.get(0).values());
        Field<String> url = table.header().field("URL1");
        assertEquals("", table.get(1).get(url));
    }

    @Test
    void testReadHeaderOnly() {
        RecordSet table = CsvTables.read(new StringReader("a,b\n"));

        assertTrue(table.isEmpty());
        assertEquals(2, table.header().fields().size());
    }

    @Test
    void testWrite() {
        Field<String> channel = new Field<>("channel");
        RecordSet counts = unsafeRecordSet(new Object[][]{
            { channel, Counts.COUNT, Counts.PERCENTAGE },
            { "A", 3L, 60.0 },
            { "B, C", 2L, 40.0 },
            { null, 0L, 0.0 }
        });
        StringBuilder out = new StringBuilder();

        CsvTables.write(counts, out);

        assertEquals("channel,count,percentage\r\n"
                         + "A,3,60.0\r\n"
                         + "\"B, C\",2,40.0\r\n"
                         + ",0,0.0\r\n", out.toString());
    }

    @Test
    void testFileRoundTrip(@TempDir Path dir) {
        Field<String> name = new Field<>("name");
        RecordSet table = unsafeRecordSet(new Object[][]{
            { name },
            { "카페" },
            { "line\nbreak" }
        });
        Path file = dir.resolve("out.csv");

        CsvTables.write(table, file, StandardCharsets.UTF_8);
        RecordSet read = CsvTables.read(file, StandardCharsets.UTF_8);

        assertTrue(Files.exists(file));
        assertEquals(List.of("카페", "line\nbreak"), read.column(read.header().field("name")));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.csv");

        ResourceMissingException e = assertThrows(ResourceMissingException.class,
                                                  () -> CsvTables.read(missing, StandardCharsets.UTF_8));
        assertEquals(missing, e.path());
    }
}
