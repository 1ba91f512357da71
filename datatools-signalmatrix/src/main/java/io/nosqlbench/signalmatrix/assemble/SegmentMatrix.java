package io.nosqlbench.signalmatrix.assemble;

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

import java.util.Arrays;

/// A dense `rows x columns` block for one segment (upstream, target or
/// downstream). Column count is explicit so zero-row and zero-column blocks
/// keep their shape.
public final class SegmentMatrix {

    private final int rows;
    private final int columns;
    private final double[][] values;

    SegmentMatrix(int rows, int columns, double[][] values) {
        this.rows = rows;
        this.columns = columns;
        this.values = values;
    }

    /// Creates a block filled with `fill`.
    public static SegmentMatrix filled(int rows, int columns, double fill) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("negative shape " + rows + "x" + columns);
        }
        double[][] values = new double[rows][columns];
        if (fill != 0.0) {
            for (double[] row : values) {
                Arrays.fill(row, fill);
            }
        }
        return new SegmentMatrix(rows, columns, values);
    }

    /// Creates a block with no columns.
    public static SegmentMatrix empty(int rows) {
        return filled(rows, 0, 0.0);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /// Returns the 0-based columns `[from, to)` as a new block.
    public SegmentMatrix columnSlice(int from, int to) {
        if (from < 0 || to > columns || to < from) {
            throw new IndexOutOfBoundsException("slice [" + from + ", " + to + ") of " + columns + " columns");
        }
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++) {
            out[r] = Arrays.copyOfRange(values[r], from, to);
        }
        return new SegmentMatrix(rows, to - from, out);
    }

    double[][] buffer() {
        return values;
    }
}
