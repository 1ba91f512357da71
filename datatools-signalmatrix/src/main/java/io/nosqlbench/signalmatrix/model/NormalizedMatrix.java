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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A signal matrix normalized to target regions, with its column layout and
 * provenance.
 *
 * <h2>Layout</h2>
 *
 * <p>Rows follow the target collection order. Columns are split into three
 * contiguous segments, any of which may be empty:
 *
 * <pre>{@code
 *   | u1 u2 ... un | t1 ... tk | d1 d2 ... dm |
 *     upstream       target      downstream
 * }</pre>
 *
 * <p>Column 1 is always the position furthest upstream of the 5' end, whatever
 * the strand of the row's region.
 *
 * <h2>Immutability</h2>
 *
 * <p>Instances never change. The value buffer is copied on the way in and on
 * the way out. Subsetting and binding return new matrices whose segment ranges
 * and failed-row indices are recomputed for the new shape.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * NormalizedMatrix mat = MatrixOrchestrator.normalizeToMatrix(signals, targets, options);
 * double[] tss = mat.row(0);
 * NormalizedMatrix expressed = mat.subsetRows(0, 2, 5);
 * System.out.println(mat.describe());
 * }</pre>
 */
public final class NormalizedMatrix {

    private final double[][] values;
    private final int columns;
    private final ColumnRange upstreamRange;
    private final ColumnRange targetRange;
    private final ColumnRange downstreamRange;
    private final long upstreamExtend;
    private final long downstreamExtend;
    private final boolean smoothed;
    private final boolean targetIsSinglePoint;
    private final double emptyValue;
    private final List<Integer> failedRows;
    private final List<String> rowNames;
    private final List<String> columnNames;
    private final String signalName;
    private final String targetName;
    private final List<String> warnings;

    private NormalizedMatrix(Builder builder) {
        Objects.requireNonNull(builder.values, "values cannot be null");
        this.values = copy(builder.values);
        this.upstreamRange = Objects.requireNonNull(builder.upstreamRange, "upstreamRange cannot be null");
        this.targetRange = Objects.requireNonNull(builder.targetRange, "targetRange cannot be null");
        this.downstreamRange = Objects.requireNonNull(builder.downstreamRange, "downstreamRange cannot be null");
        if (upstreamRange.from() != 0
            || targetRange.from() != upstreamRange.to()
            || downstreamRange.from() != targetRange.to()) {
            throw new IllegalArgumentException("column ranges must be contiguous from 0, got upstream="
                + upstreamRange + ", target=" + targetRange + ", downstream=" + downstreamRange);
        }
        this.columns = downstreamRange.to();
        for (int r = 0; r < values.length; r++) {
            if (values[r].length != columns) {
                throw new IllegalArgumentException("row " + r + " has " + values[r].length
                    + " columns, expected " + columns);
            }
        }
        if (builder.upstreamExtend < 0 || builder.downstreamExtend < 0) {
            throw new IllegalArgumentException("extend cannot be negative");
        }
        this.upstreamExtend = builder.upstreamExtend;
        this.downstreamExtend = builder.downstreamExtend;
        this.smoothed = builder.smoothed;
        this.targetIsSinglePoint = builder.targetIsSinglePoint;
        this.emptyValue = builder.emptyValue;
        this.failedRows = List.copyOf(builder.failedRows);
        for (int row : failedRows) {
            if (row < 1 || row > values.length) {
                throw new IllegalArgumentException("failed row " + row + " is outside 1.." + values.length);
            }
        }
        if (builder.rowNames != null && builder.rowNames.size() != values.length) {
            throw new IllegalArgumentException("got " + builder.rowNames.size() + " row names for "
                + values.length + " rows");
        }
        this.rowNames = builder.rowNames == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.rowNames));
        this.columnNames = builder.columnNames != null
            ? List.copyOf(builder.columnNames)
            : defaultColumnNames(upstreamRange, targetRange, downstreamRange);
        if (columnNames.size() != columns) {
            throw new IllegalArgumentException("got " + columnNames.size() + " column names for "
                + columns + " columns");
        }
        this.signalName = builder.signalName;
        this.targetName = builder.targetName;
        this.warnings = List.copyOf(builder.warnings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with every field of this matrix.
    public Builder toBuilder() {
        return new Builder()
            .values(values)
            .ranges(upstreamRange, targetRange, downstreamRange)
            .extend(upstreamExtend, downstreamExtend)
            .smoothed(smoothed)
            .targetIsSinglePoint(targetIsSinglePoint)
            .emptyValue(emptyValue)
            .failedRows(failedRows)
            .rowNames(rowNames)
            .columnNames(columnNames)
            .signalName(signalName)
            .targetName(targetName)
            .warnings(warnings);
    }

    /// Column labels `u1..un`, `t1..tk`, `d1..dm`.
    public static List<String> defaultColumnNames(ColumnRange upstream, ColumnRange target, ColumnRange downstream) {
        List<String> names = new ArrayList<>(upstream.size() + target.size() + downstream.size());
        for (int i = 1; i <= upstream.size(); i++) {
            names.add("u" + i);
        }
        for (int i = 1; i <= target.size(); i++) {
            names.add("t" + i);
        }
        for (int i = 1; i <= downstream.size(); i++) {
            names.add("d" + i);
        }
        return names;
    }

    public int rowCount() {
        return values.length;
    }

    public int columnCount() {
        return columns;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /// Returns a copy of the 0-based row.
    public double[] row(int row) {
        return values[row].clone();
    }

    /// Returns a copy of the whole buffer.
    public double[][] values() {
        return copy(values);
    }

    public ColumnRange upstreamRange() {
        return upstreamRange;
    }

    public ColumnRange targetRange() {
        return targetRange;
    }

    public ColumnRange downstreamRange() {
        return downstreamRange;
    }

    public long upstreamExtend() {
        return upstreamExtend;
    }

    public long downstreamExtend() {
        return downstreamExtend;
    }

    public boolean smoothed() {
        return smoothed;
    }

    public boolean targetIsSinglePoint() {
        return targetIsSinglePoint;
    }

    public double emptyValue() {
        return emptyValue;
    }

    /// Returns the 1-based indices of rows where smoothing failed, ascending.
    public List<Integer> failedRows() {
        return failedRows;
    }

    /// Returns row labels, or null when the target regions were unnamed.
    public List<String> rowNames() {
        return rowNames;
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public String signalName() {
        return signalName;
    }

    public String targetName() {
        return targetName;
    }

    /// Returns the parameter corrections applied while building this matrix.
    public List<String> warnings() {
        return warnings;
    }

    /**
     * Returns the matrix restricted to the given 0-based rows, in the given order.
     * Segment layout and scalar metadata are kept; failed rows are renumbered to
     * their new positions and dropped when not selected.
     */
    public NormalizedMatrix subsetRows(int... rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        double[][] sub = new double[rows.length][];
        List<String> names = rowNames == null ? null : new ArrayList<>(rows.length);
        Set<Integer> failedBefore = new HashSet<>(failedRows);
        List<Integer> failed = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            int r = rows[i];
            if (r < 0 || r >= values.length) {
                throw new IndexOutOfBoundsException("row " + r + " is outside 0.." + (values.length - 1));
            }
            sub[i] = values[r];
            if (names != null) {
                names.add(rowNames.get(r));
            }
            if (failedBefore.contains(r + 1)) {
                failed.add(i + 1);
            }
        }
        return toBuilder().values(sub).rowNames(names).failedRows(failed).build();
    }

    /**
     * Returns the matrix restricted to the given 0-based columns.
     *
     * <p>Columns must be strictly increasing so the three segments stay contiguous;
     * each new segment holds the selected columns that fell in the old one.
     *
     * @throws IllegalArgumentException if the columns are not strictly increasing
     */
    public NormalizedMatrix subsetColumns(int... cols) {
        Objects.requireNonNull(cols, "cols cannot be null");
        int up = 0;
        int tg = 0;
        int down = 0;
        List<String> names = new ArrayList<>(cols.length);
        for (int i = 0; i < cols.length; i++) {
            int c = cols[i];
            if (c < 0 || c >= columns) {
                throw new IndexOutOfBoundsException("column " + c + " is outside 0.." + (columns - 1));
            }
            if (i > 0 && c <= cols[i - 1]) {
                throw new IllegalArgumentException("columns must be strictly increasing, got "
                    + Arrays.toString(cols));
            }
            if (upstreamRange.contains(c)) {
                up++;
            } else if (targetRange.contains(c)) {
                tg++;
            } else {
                down++;
            }
            names.add(columnNames.get(c));
        }
        double[][] sub = new double[values.length][cols.length];
        for (int r = 0; r < values.length; r++) {
            for (int i = 0; i < cols.length; i++) {
                sub[r][i] = values[r][cols[i]];
            }
        }
        ColumnRange u = ColumnRange.ofSize(0, up);
        ColumnRange t = ColumnRange.ofSize(u.to(), tg);
        ColumnRange d = ColumnRange.ofSize(t.to(), down);
        return toBuilder().values(sub).ranges(u, t, d).columnNames(names).build();
    }

    /**
     * Returns a matrix with this matrix's metadata and a new value buffer of the
     * same column count. Failed rows are cleared when the row count changes.
     */
    public NormalizedMatrix withValues(double[][] newValues) {
        Objects.requireNonNull(newValues, "newValues cannot be null");
        for (double[] row : newValues) {
            if (row.length != columns) {
                throw new IllegalArgumentException("x and y should have same number of columns: expected "
                    + columns + ", got " + row.length);
            }
        }
        Builder b = toBuilder().values(newValues);
        if (newValues.length != values.length) {
            b.failedRows(List.of()).rowNames(null);
        }
        return b.build();
    }

    /**
     * Stacks matrices with identical column layout. Metadata comes from the first;
     * failed rows are offset into the combined numbering and the result counts as
     * smoothed only when every part was.
     */
    public static NormalizedMatrix bindRows(List<NormalizedMatrix> parts) {
        Objects.requireNonNull(parts, "parts cannot be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts cannot be empty");
        }
        NormalizedMatrix first = parts.get(0);
        int total = 0;
        boolean allNamed = true;
        boolean allSmoothed = true;
        for (NormalizedMatrix part : parts) {
            if (!first.sameLayout(part)) {
                throw new IllegalArgumentException("matrices must share column layout to be bound by rows");
            }
            total += part.rowCount();
            allNamed &= part.rowNames != null;
            allSmoothed &= part.smoothed;
        }
        double[][] bound = new double[total][];
        List<String> names = allNamed ? new ArrayList<>(total) : null;
        List<Integer> failed = new ArrayList<>();
        int offset = 0;
        for (NormalizedMatrix part : parts) {
            System.arraycopy(part.values, 0, bound, offset, part.rowCount());
            if (names != null) {
                names.addAll(part.rowNames);
            }
            for (int row : part.failedRows) {
                failed.add(row + offset);
            }
            offset += part.rowCount();
        }
        return first.toBuilder()
            .values(bound)
            .rowNames(names)
            .failedRows(failed)
            .smoothed(allSmoothed)
            .build();
    }

    /// Returns true when `other` has the same column count and segment ranges.
    public boolean sameLayout(NormalizedMatrix other) {
        return columns == other.columns
            && upstreamRange.equals(other.upstreamRange)
            && targetRange.equals(other.targetRange)
            && downstreamRange.equals(other.downstreamRange);
    }

    /**
     * Formats a short human-readable summary of the layout.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Normalize ").append(signalName != null ? signalName : "signal")
          .append(" to ").append(targetName != null ? targetName : "target").append(":\n");
        sb.append("  Upstream ").append(upstreamExtend).append(" bp (")
          .append(plural(upstreamRange.size(), "window")).append(")\n");
        sb.append("  Downstream ").append(downstreamExtend).append(" bp (")
          .append(plural(downstreamRange.size(), "window")).append(")\n");
        if (targetRange.isEmpty()) {
            sb.append("  Not include target regions\n");
        } else if (targetIsSinglePoint) {
            sb.append("  Include target regions (width = 1)\n");
        } else {
            sb.append("  Include target regions (").append(plural(targetRange.size(), "window")).append(")\n");
        }
        sb.append("  ").append(plural(values.length, "signal region")).append("\n");
        if (!failedRows.isEmpty()) {
            sb.append("  Smoothing failed for ").append(plural(failedRows.size(), "row")).append("\n");
        }
        return sb.toString();
    }

    private static String plural(int n, String noun) {
        return n + " " + noun + (n > 1 ? "s" : "");
    }

    private static double[][] copy(double[][] source) {
        double[][] out = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            out[i] = source[i].clone();
        }
        return out;
    }

    @Override
    public String toString() {
        return "NormalizedMatrix{" + rowCount() + "x" + columns
            + ", upstream=" + upstreamRange
            + ", target=" + targetRange
            + ", downstream=" + downstreamRange
            + ", extend=[" + upstreamExtend + ", " + downstreamExtend + "]"
            + ", smoothed=" + smoothed
            + ", failedRows=" + failedRows
            + '}';
    }

    /// Builder for [NormalizedMatrix]. Ranges and values are required.
    public static final class Builder {
        private double[][] values;
        private ColumnRange upstreamRange;
        private ColumnRange targetRange;
        private ColumnRange downstreamRange;
        private long upstreamExtend;
        private long downstreamExtend;
        private boolean smoothed;
        private boolean targetIsSinglePoint;
        private double emptyValue;
        private List<Integer> failedRows = List.of();
        private List<String> rowNames;
        private List<String> columnNames;
        private String signalName;
        private String targetName;
        private List<String> warnings = List.of();

        private Builder() {
        }

        public Builder values(double[][] values) {
            this.values = values;
            return this;
        }

        public Builder ranges(ColumnRange upstream, ColumnRange target, ColumnRange downstream) {
            this.upstreamRange = upstream;
            this.targetRange = target;
            this.downstreamRange = downstream;
            return this;
        }

        public Builder extend(long upstream, long downstream) {
            this.upstreamExtend = upstream;
            this.downstreamExtend = downstream;
            return this;
        }

        public Builder smoothed(boolean smoothed) {
            this.smoothed = smoothed;
            return this;
        }

        public Builder targetIsSinglePoint(boolean targetIsSinglePoint) {
            this.targetIsSinglePoint = targetIsSinglePoint;
            return this;
        }

        public Builder emptyValue(double emptyValue) {
            this.emptyValue = emptyValue;
            return this;
        }

        public Builder failedRows(List<Integer> failedRows) {
            this.failedRows = Objects.requireNonNull(failedRows, "failedRows cannot be null");
            return this;
        }

        public Builder rowNames(List<String> rowNames) {
            this.rowNames = rowNames;
            return this;
        }

        /// Sets explicit column labels; when unset, `u1..`, `t1..`, `d1..` are derived.
        public Builder columnNames(List<String> columnNames) {
            this.columnNames = columnNames;
            return this;
        }

        public Builder signalName(String signalName) {
            this.signalName = signalName;
            return this;
        }

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = Objects.requireNonNull(warnings, "warnings cannot be null");
            return this;
        }

        public NormalizedMatrix build() {
            return new NormalizedMatrix(this);
        }
    }
}
