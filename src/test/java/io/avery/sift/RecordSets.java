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

import java.util.Arrays;

/**
 * Table fixtures for tests.
 */
public final class RecordSets {
    private RecordSets() {}

    /**
     * Builds a table from an array whose first row holds the fields and whose remaining rows hold values. Values are
     * not checked against the field types.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static RecordSet unsafeRecordSet(Object[][] arr) {
        Object[] fields = arr[0];
        return RecordStream.aux(Arrays.stream(arr, 1, arr.length))
            .mapToRecord(into -> {
                for (int i = 0; i < fields.length; i++) {
                    int j = i;
                    into.field((Field) fields[j], a -> a[j]);
                }
            })
            .toRecordSet();
    }
}
