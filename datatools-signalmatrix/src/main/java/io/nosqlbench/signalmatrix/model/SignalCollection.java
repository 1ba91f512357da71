package io.nosqlbench.signalmatrix.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.signalmatrix.MatrixConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered set of signal intervals with named value columns.
 *
 * <p>Numeric columns hold one {@code double} per signal, with {@link Double#NaN}
 * marking a missing value. Text columns hold one label per signal and are
 * only used to restrict which target a signal may be mapped to.
 *
 * <pre>{@code
 * SignalCollection signals = SignalCollection.builder()
 *     .add(GenomicInterval.of("chr1", 1, 2), 1.0)
 *     .add(GenomicInterval.of("chr1", 4, 5), 2.0)
 *     .build("score");
 * }</pre>
 */
public final class SignalCollection {

    private final List<GenomicInterval> intervals;
    private final Map<String, double[]> numericColumns;
    private final Map<String, String[]> textColumns;

    private SignalCollection(List<GenomicInterval> intervals,
                             Map<String, double[]> numericColumns,
                             Map<String, String[]> textColumns) {
        this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
        this.numericColumns = new LinkedHashMap<>();
        this.textColumns = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : numericColumns.entrySet()) {
            checkLength(e.getKey(), e.getValue().length);
            this.numericColumns.put(e.getKey(), e.getValue().clone());
        }
        for (Map.Entry<String, String[]> e : textColumns.entrySet()) {
            checkLength(e.getKey(), e.getValue().length);
            if (this.numericColumns.containsKey(e.getKey())) {
                throw new IllegalArgumentException("column '" + e.getKey() + "' is defined twice");
            }
            this.textColumns.put(e.getKey(), e.getValue().clone());
        }
    }

    private void checkLength(String column, int length) {
        if (length != intervals.size()) {
            throw new IllegalArgumentException("column '" + column + "' has " + length
                + " values but there are " + intervals.size() + " signals");
        }
    }

    /**
     * Creates a collection from intervals only; every signal carries the implicit value 1.
     */
    public static SignalCollection of(List<GenomicInterval> intervals) {
        Objects.requireNonNull(intervals, "intervals cannot be null");
        return new SignalCollection(intervals, Map.of(), Map.of());
    }

    /**
     * Creates a collection with a single numeric column.
     */
    public static SignalCollection of(List<GenomicInterval> intervals, String column, double[] values) {
        Objects.requireNonNull(intervals, "intervals cannot be null");
        Objects.requireNonNull(column, "column cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        return new SignalCollection(intervals, Map.of(column, values), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public GenomicInterval interval(int index) {
        return intervals.get(index);
    }

    public List<GenomicInterval> intervals() {
        return intervals;
    }

    public Set<String> numericColumnNames() {
        return Collections.unmodifiableSet(numericColumns.keySet());
    }

    public Set<String> textColumnNames() {
        return Collections.unmodifiableSet(textColumns.keySet());
    }

    public boolean hasNumericColumn(String column) {
        return numericColumns.containsKey(column);
    }

    public boolean hasTextColumn(String column) {
        return textColumns.containsKey(column);
    }

    /**
     * Returns the values selected by {@code column}, as a fresh array.
     *
     * @param column a numeric column name, or {@code null} for the implicit all-ones column
     * @return one value per signal
     * @throws MatrixConfigurationException if the column does not exist
     */
    public double[] values(String column) {
        if (column == null) {
            double[] ones = new double[intervals.size()];
            Arrays.fill(ones, 1.0);
            return ones;
        }
        double[] values = numericColumns.get(column);
        if (values == null) {
            throw new MatrixConfigurationException("signal has no numeric column '" + column + "'"
                + (textColumns.containsKey(column) ? " (it is a text column)" : ""));
        }
        return values.clone();
    }

    /**
     * Returns a text column as a fresh array.
     *
     * @throws MatrixConfigurationException if the column does not exist
     */
    public String[] labels(String column) {
        String[] labels = textColumns.get(column);
        if (labels == null) {
            throw new MatrixConfigurationException("signal has no text column '" + column + "'");
        }
        return labels.clone();
    }

    /**
     * Accumulates signals row by row. Every signal added must supply a value for
     * each column named in {@link #build(String...)}, in the same order.
     */
    public static final class Builder {
        private final List<GenomicInterval> intervals = new ArrayList<>();
        private final List<double[]> rows = new ArrayList<>();
        private final Map<String, String[]> textColumns = new LinkedHashMap<>();
        private final Map<String, double[]> extraNumeric = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(GenomicInterval interval, double... values) {
            Objects.requireNonNull(interval, "interval cannot be null");
            intervals.add(interval);
            rows.add(values.clone());
            return this;
        }

        public Builder add(String seqId, long start, long end, double... values) {
            return add(GenomicInterval.of(seqId, start, end), values);
        }

        /** Attaches a whole numeric column; its length must equal the final signal count. */
        public Builder numericColumn(String name, double[] values) {
            extraNumeric.put(Objects.requireNonNull(name, "name cannot be null"), values.clone());
            return this;
        }

        /** Attaches a whole text column; its length must equal the final signal count. */
        public Builder textColumn(String name, String[] labels) {
            textColumns.put(Objects.requireNonNull(name, "name cannot be null"), labels.clone());
            return this;
        }

        /**
         * Builds the collection, naming the per-row values given to {@link #add}.
         *
         * @param columnNames one name per value passed to each {@code add} call
         */
        public SignalCollection build(String... columnNames) {
            for (int r = 0; r < rows.size(); r++) {
                if (rows.get(r).length != columnNames.length) {
                    throw new IllegalArgumentException("signal " + (r + 1) + " has " + rows.get(r).length
                        + " values, expected " + columnNames.length);
                }
            }
            Map<String, double[]> numeric = new LinkedHashMap<>();
            for (int c = 0; c < columnNames.length; c++) {
                double[] column = new double[rows.size()];
                for (int r = 0; r < rows.size(); r++) {
                    column[r] = rows.get(r)[c];
                }
                numeric.put(columnNames[c], column);
            }
            numeric.putAll(extraNumeric);
            return new SignalCollection(intervals, numeric, textColumns);
        }
    }
}
