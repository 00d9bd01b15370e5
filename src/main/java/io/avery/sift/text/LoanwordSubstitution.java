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

import io.avery.sift.ResourceMissingException;
import io.avery.sift.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces commonly-confused loanword spellings with their standard form. Substitutions are plain substring
 * replacements, applied in the order they were loaded.
 */
public final class LoanwordSubstitution implements TextTransformer {
    private static final Logger LOG = LoggerFactory.getLogger(LoanwordSubstitution.class);

    private final Map<String, String> substitutions;

    /**
     * Creates a substitution stage over the given table, applied in map iteration order.
     *
     * @param substitutions the confused spellings, mapped to their standard forms
     */
    public LoanwordSubstitution(Map<String, String> substitutions) {
        this.substitutions = Collections.unmodifiableMap(new LinkedHashMap<>(substitutions));
    }

    /**
     * Loads substitutions from a UTF-8 text file of {@code confused<TAB>standard} lines. Blank lines are skipped;
     * surrounding whitespace on each line is ignored.
     *
     * @param path the substitution file
     * @return a substitution stage over the loaded table
     * @throws ResourceMissingException if the file does not exist
     * @throws ValidationException if a non-blank line has no tab separator
     * @throws UncheckedIOException if the file cannot be read
     */
    public static LoanwordSubstitution load(Path path) {
        if (!Files.isRegularFile(path))
            throw new ResourceMissingException(path);
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        Map<String, String> substitutions = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty())
                continue;
            int tab = line.indexOf('\t');
            if (tab < 0)
                throw new ValidationException("Expected a tab-separated pair at " + path + " line " + (i + 1) + ": "
                                                  + line);
            substitutions.put(line.substring(0, tab), line.substring(tab + 1).strip());
        }
        LOG.debug("Loaded {} loanword substitutions from {}", substitutions.size(), path);
        return new LoanwordSubstitution(substitutions);
    }

    /**
     * Returns the substitution table.
     *
     * @return an unmodifiable view of the substitution table
     */
    public Map<String, String> substitutions() {
        return substitutions;
    }

    /**
     * Applies every substitution to one text.
     *
     * @param text the text
     * @return the text with every confused spelling replaced
     */
    public String substitute(String text) {
        for (Map.Entry<String, String> e : substitutions.entrySet())
            text = text.replace(e.getKey(), e.getValue());
        return text;
    }

    @Override
    public List<String> transform(List<String> texts) {
        List<String> out = new ArrayList<>(texts.size());
        for (String text : texts)
            out.add(substitute(text));
        return out;
    }
}
