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

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ReportSettingsTest {
    @Test
    void testDefaults() {
        ReportSettings settings = ReportSettings.defaults();

        assertEquals("date", settings.timeColumn());
        assertEquals("%y.%m.%d.", settings.timeFormat());
        assertEquals("채널2", settings.entityFilterColumn());
        assertEquals("카페", settings.entityFilterValue());
        assertEquals("URL1", settings.urlColumn());
        assertEquals("cafe", settings.siteFamily());
        assertEquals("CafeName", settings.entityColumn());
        assertEquals(Paths.get("confused_loanwords.txt"), settings.loanwordFile());
    }

    @Test
    void testOverrides() {
        Properties props = new Properties();
        props.setProperty("sift.report.site-family", "blog");
        props.setProperty("sift.report.entity-column", "BlogName");

        ReportSettings settings = ReportSettings.from(props);

        assertEquals("blog", settings.siteFamily());
        assertEquals("BlogName", settings.entityColumn());
        assertEquals("URL1", settings.urlColumn());
    }

    @Test
    void testLoadFromClasspath() {
        // src/test/resources/sift.properties overrides the time column.
        ReportSettings settings = ReportSettings.load();

        assertEquals("posted", settings.timeColumn());
        assertEquals("채널2", settings.entityFilterColumn());
    }
}
