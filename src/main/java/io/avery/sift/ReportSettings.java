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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Properties;

/**
 * Dataset-specific settings of the {@link Reports report recipes}: which columns hold the timestamp, the channel
 * and the URL, how timestamps are formatted, and which URL site family identifies entities.
 *
 * <p>Settings are read from {@code sift.properties} on the classpath, or from any {@link Properties}. Absent keys
 * take the defaults below.
 *
 * <pre>
 *     sift.report.time-column           date
 *     sift.report.time-format           %y.%m.%d.
 *     sift.report.entity-filter-column  채널2
 *     sift.report.entity-filter-value   카페
 *     sift.report.url-column            URL1
 *     sift.report.site-family           cafe
 *     sift.report.entity-column         CafeName
 *     sift.text.loanword-file           confused_loanwords.txt
 * </pre>
 */
public final class ReportSettings {
    private static final Logger LOG = LoggerFactory.getLogger(ReportSettings.class);

    static final String RESOURCE = "sift.properties";

    private final String timeColumn;
    private final String timeFormat;
    private final String entityFilterColumn;
    private final String entityFilterValue;
    private final String urlColumn;
    private final String siteFamily;
    private final String entityColumn;
    private final Path loanwordFile;

    private ReportSettings(Properties props) {
        this.timeColumn = props.getProperty("sift.report.time-column", "date");
        this.timeFormat = props.getProperty("sift.report.time-format", "%y.%m.%d.");
        this.entityFilterColumn = props.getProperty("sift.report.entity-filter-column", "채널2");
        this.entityFilterValue = props.getProperty("sift.report.entity-filter-value", "카페");
        this.urlColumn = props.getProperty("sift.report.url-column", "URL1");
        this.siteFamily = props.getProperty("sift.report.site-family", "cafe");
        this.entityColumn = props.getProperty("sift.report.entity-column", "CafeName");
        this.loanwordFile = Paths.get(props.getProperty("sift.text.loanword-file", "confused_loanwords.txt"));
    }

    /**
     * Returns the settings in {@code sift.properties} on the classpath, or the defaults if there is no such resource.
     *
     * @return the settings
     * @throws UncheckedIOException if the resource exists but cannot be read
     */
    public static ReportSettings load() {
        Properties props = new Properties();
        try (InputStream in = ReportSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null)
                LOG.debug("No {} on the classpath, using defaults", RESOURCE);
            else {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return new ReportSettings(props);
    }

    /**
     * Returns settings read from the given properties, with defaults for absent keys.
     *
     * @param props the properties
     * @return the settings
     */
    public static ReportSettings from(Properties props) {
        return new ReportSettings(Objects.requireNonNull(props));
    }

    /**
     * Returns the default settings.
     *
     * @return the default settings
     */
    public static ReportSettings defaults() {
        return new ReportSettings(new Properties());
    }

    public String timeColumn() {
        return timeColumn;
    }

    public String timeFormat() {
        return timeFormat;
    }

    public String entityFilterColumn() {
        return entityFilterColumn;
    }

    public String entityFilterValue() {
        return entityFilterValue;
    }

    public String urlColumn() {
        return urlColumn;
    }

    public String siteFamily() {
        return siteFamily;
    }

    public String entityColumn() {
        return entityColumn;
    }

    public Path loanwordFile() {
        return loanwordFile;
    }

    @Override
    public String toString() {
        return "ReportSettings{timeColumn=" + timeColumn + ", timeFormat=" + timeFormat
            + ", entityFilterColumn=" + entityFilterColumn + ", entityFilterValue=" + entityFilterValue
            + ", urlColumn=" + urlColumn + ", siteFamily=" + siteFamily + ", entityColumn=" + entityColumn
            + ", loanwordFile=" + loanwordFile + "}";
    }
}
