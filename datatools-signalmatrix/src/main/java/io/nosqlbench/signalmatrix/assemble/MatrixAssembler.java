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

import io.nosqlbench.signalmatrix.ColumnCountMismatchException;
import io.nosqlbench.signalmatrix.model.ColumnRange;
import io.nosqlbench.signalmatrix.model.TargetCollection;
import io.nosqlbench.signalmatrix.model.Window;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Places per-window values into matrix cells and joins segment blocks.
///
/// ## Placement
///
/// Windows are grouped by owner; owner `i` fills row `i - 1`. For owners on the
/// reverse strand the window order is flipped, so column 1 is always the
/// 5'-most position:
///
/// ```
///   + strand:  w1 w2 w3 w4  ──►  columns 1 2 3 4
///   - strand:  w1 w2 w3 w4  ──►  columns 4 3 2 1
/// ```
///
/// Every owner that produced windows must have produced the same number. Owners
/// with no windows keep the empty value across their row.
public final class MatrixAssembler {

    private static final Logger logger = LogManager.getLogger(MatrixAssembler.class);

    private MatrixAssembler() {
    }

    /// Scatters window values into a `targets.size() x windowCount` block.
    ///
    /// @param windows the windows, each tagged with its 1-based owner and window index
    /// @param values one value per window, in the same order
    /// @param targets the owning regions; their strand decides column orientation
    /// @param emptyValue fill for cells without a window
    /// @return the segment block
    /// @throws ColumnCountMismatchException if owners produced different window counts
    public static SegmentMatrix assemble(List<Window> windows, double[] values, TargetCollection targets,
                                         double emptyValue) {
        Objects.requireNonNull(windows, "windows cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(targets, "targets cannot be null");
        if (values.length != windows.size()) {
            throw new IllegalArgumentException("got " + values.length + " values for " + windows.size() + " windows");
        }

        int rows = targets.size();
        int[] perOwner = new int[rows];
        for (Window w : windows) {
            if (w.ownerIndex() > rows) {
                throw new IllegalArgumentException("window owner " + w.ownerIndex() + " exceeds " + rows + " targets");
            }
            perOwner[w.ownerIndex() - 1]++;
        }

        int columns = -1;
        for (int owner = 0; owner < rows; owner++) {
            if (perOwner[owner] == 0) {
                continue;
            }
            if (columns < 0) {
                columns = perOwner[owner];
            } else if (perOwner[owner] != columns) {
                throw new ColumnCountMismatchException(owner + 1, columns, perOwner[owner]);
            }
        }
        if (columns < 0) {
            logger.debug("No windows for {} targets, segment has no columns", rows);
            return SegmentMatrix.empty(rows);
        }

        SegmentMatrix block = SegmentMatrix.filled(rows, columns, emptyValue);
        double[][] cells = block.buffer();
        for (int i = 0; i < windows.size(); i++) {
            Window w = windows.get(i);
            int row = w.ownerIndex() - 1;
            if (w.windowIndex() > columns) {
                throw new IllegalArgumentException("window index " + w.windowIndex() + " exceeds " + columns
                    + " windows of owner " + w.ownerIndex());
            }
            int col = targets.interval(row).strand().isReverse()
                ? columns - w.windowIndex()
                : w.windowIndex() - 1;
            cells[row][col] = values[i];
        }
        return block;
    }

    /// Joins the three segment blocks left to right and records their ranges.
    ///
    /// @throws IllegalArgumentException if the blocks have different row counts
    public static AssembledMatrix concatenate(SegmentMatrix upstream, SegmentMatrix target, SegmentMatrix downstream) {
        Objects.requireNonNull(upstream, "upstream cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(downstream, "downstream cannot be null");
        int rows = upstream.rows();
        if (target.rows() != rows || downstream.rows() != rows) {
            throw new IllegalArgumentException("segments have different row counts: "
                + upstream.rows() + ", " + target.rows() + ", " + downstream.rows());
        }
        ColumnRange u = ColumnRange.ofSize(0, upstream.columns());
        ColumnRange t = ColumnRange.ofSize(u.to(), target.columns());
        ColumnRange d = ColumnRange.ofSize(t.to(), downstream.columns());

        double[][] out = new double[rows][d.to()];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(upstream.buffer()[r], 0, out[r], u.from(), u.size());
            System.arraycopy(target.buffer()[r], 0, out[r], t.from(), t.size());
            System.arraycopy(downstream.buffer()[r], 0, out[r], d.from(), d.size());
        }
        return new AssembledMatrix(out, u, t, d);
    }
}
