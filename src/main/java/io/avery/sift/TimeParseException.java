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

/**
 * Thrown when a value does not conform to the time format declared for its column.
 */
public class TimeParseException extends SiftException {
    private final Object value;
    private final int row;

    public TimeParseException(Object value, int row, String format, Throwable cause) {
        super("Row " + row + ": value '" + value + "' does not match time format '" + format + "'", cause);
        this.value = value;
        this.row = row;
    }

    /**
     * Returns the offending value.
     *
     * @return the offending value
     */
    public Object value() {
        return value;
    }

    /**
     * Returns the zero-based index of the offending row.
     *
     * @return the offending row index
     */
    public int row() {
        return row;
    }
}
