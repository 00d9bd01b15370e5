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

/**
 * Filtering, counting and summarizing of tabular text records, such as scraped posts tagged with a channel, a
 * timestamp and a URL. Tables are immutable {@link io.avery.sift.RecordSet record-sets}; every operation takes a
 * table and returns a new one. For example:
 *
 * <pre>{@code
 *     RecordSet posts = CsvTables.read(Paths.get("posts.csv"), StandardCharsets.UTF_8);
 *
 *     RecordSet monthly = TemporalAggregator.countByPeriod(
 *         KeywordFilter.include(
 *             TimeNormalizer.normalize(posts, "date", "%y.%m.%d."),
 *             "text", List.of("love", "cafes"), "and"),
 *         "date", "m", false, true);
 * }</pre>
 *
 * <p>Here we parse the raw {@code date} column into time-points, keep the posts whose text contains both keywords,
 * and count them per calendar month, with empty months present as zero counts.
 *
 * <h2><a id="Tables">Tables, Headers, and Fields</a></h2>
 *
 * <p>A table is an ordered list of {@link io.avery.sift.Record records} sharing one {@link io.avery.sift.Header
 * header}. Each column of the header is a {@link io.avery.sift.Field}, a typed and opaque object compared by identity.
 * Components address columns by name; the first field with a name wins. Operations that derive a column from another,
 * like time normalization, replace the field with a new one of the same name and the new value type.
 *
 * <h2><a id="Counts">Count tables</a></h2>
 *
 * <p>Aggregations produce count tables: a key field, {@link io.avery.sift.Counts#COUNT}, and optionally
 * {@link io.avery.sift.Counts#PERCENTAGE}. Keys of categorical counts are the category values, in order of first
 * occurrence unless sorted. Keys of temporal counts are {@link io.avery.sift.Bucket buckets}, labelled by their closing
 * date.
 *
 * <h2><a id="Errors">Errors</a></h2>
 *
 * <p>Every failure is an unchecked {@link io.avery.sift.SiftException}. Components validate their whole input before
 * producing a table, so a failed operation never yields a partial result.
 */
package io.avery.sift;
