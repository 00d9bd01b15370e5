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
import io.avery.sift.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered chain of named {@link TextTransformer text stages}. Each stage receives the previous stage's output.
 *
 * <pre>{@code
 * TextPipeline pipeline = TextPipeline.builder()
 *     .stage("normalize", PunctuationNormalizer.standard())
 *     .stage("loanwords", LoanwordSubstitution.load(settings.loanwordFile()))
 *     .stage("strip", new PunctuationStripper())
 *     .stage("collapse", new RepeatCollapser())
 *     .build();
 * }</pre>
 */
public final class TextPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(TextPipeline.class);

    private final List<String> names;
    private final List<TextTransformer> stages;

    private TextPipeline(List<String> names, List<TextTransformer> stages) {
        this.names = names;
        this.stages = stages;
    }

    /**
     * Returns a new, empty pipeline builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the stage names, in order.
     *
     * @return the stage names
     */
    public List<String> stageNames() {
        return Collections.unmodifiableList(names);
    }

    /**
     * Runs every stage over the given texts, in order.
     *
     * @param texts the input texts
     * @return the output of the last stage, or the input if there are no stages
     */
    public List<String> run(List<String> texts) {
        List<String> current = texts;
        for (int i = 0; i < stages.size(); i++) {
            LOG.debug("Running stage '{}' over {} texts", names.get(i), current.size());
            current = Objects.requireNonNull(stages.get(i).transform(current), names.get(i));
        }
        LOG.info("Processed {} texts through {} stages", texts.size(), stages.size());
        return current;
    }

    /**
     * Runs every stage over the values of the named column and returns a copy of the table with the column replaced by
     * the output.
     *
     * @param table the input table
     * @param column the name of the text column
     * @return a new table with the column replaced
     * @throws io.avery.sift.SchemaException if the table has no such column
     * @throws ValidationException if a value is not text, or if the stages change the number of texts
     */
    public RecordSet applyTo(RecordSet table, String column) {
        Field<Object> field = table.header().field(column);
        List<Object> values = table.column(field);
        List<String> texts = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!(value instanceof CharSequence))
                throw new ValidationException(i, "Expected text in column '" + column + "', got: " + value);
            texts.add(value.toString());
        }
        List<String> out = run(texts);
        if (out.size() != texts.size())
            throw new ValidationException("Stages turned " + texts.size() + " texts into " + out.size()
                                              + "; cannot replace column '" + column + "'");
        return table.withColumn(field.<String>replacement(), out);
    }

    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<TextTransformer> stages = new ArrayList<>();

        Builder() {} // Prevent default public constructor

        /**
         * Appends a named stage.
         *
         * @param name the stage name, used in logs
         * @param stage the stage
         * @return this builder
         */
        public Builder stage(String name, TextTransformer stage) {
            names.add(Objects.requireNonNull(name));
            stages.add(Objects.requireNonNull(stage));
            return this;
        }

        public TextPipeline build() {
            return new TextPipeline(new ArrayList<>(names), new ArrayList<>(stages));
        }
    }
}
