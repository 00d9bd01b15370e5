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

import java.time.LocalDate;
import java.util.Objects;

/**
 * A closed calendar interval of one {@link Period period}. Buckets of the same period order by their start date.
 * A bucket's string form is its closing date, as in {@code 2024-01-31} for January 2024.
 */
public final class Bucket implements Comparable<Bucket> {
    private final Period period;
    private final LocalDate start;
    private final LocalDate end;

    Bucket(Period period, LocalDate start, LocalDate end) {
        this.period = period;
        this.start = start;
        this.end = end;
    }

    public Period period() {
        return period;
    }

    /**
     * Returns the first day of this bucket.
     *
     * @return the first day
     */
    public LocalDate start() {
        return start;
    }

    /**
     * Returns the last day of this bucket.
     *
     * @return the last day
     */
    public LocalDate end() {
        return end;
    }

    /**
     * Returns the bucket of the same period immediately following this one.
     *
     * @return the next bucket
     */
    public Bucket next() {
        return period.bucketOf(end.plusDays(1));
    }

    @Override
    public int compareTo(Bucket o) {
        return start.compareTo(o.start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Bucket))
            return false;
        Bucket other = (Bucket) o;
        return period == other.period && start.equals(other.start);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, start);
    }

    @Override
    public String toString() {
        return end.toString();
    }
}
