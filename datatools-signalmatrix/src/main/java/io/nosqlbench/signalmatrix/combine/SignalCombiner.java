package io.nosqlbench.signalmatrix.combine;

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
import io.nosqlbench.signalmatrix.model.NormalizedMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Combines matrices that were normalized against the same targets into one.
 *
 * <pre>{@code
 *   m1[r][c], m2[r][c], ..., mn[r][c]  ──reducer──►  out[r][c]
 * }</pre>
 *
 * <p>Inputs must have the same number of rows and the same column layout. The
 * result keeps every other property of the first input.
 */
public final class SignalCombiner {

    private static final Logger logger = LogManager.getLogger(SignalCombiner.class);

    private SignalCombiner() {
    }

    /**
     * Combines with {@link CellReducer#MEAN}.
     */
    public static NormalizedMatrix combine(List<NormalizedMatrix> matrices) {
        return combine(matrices, CellReducer.MEAN);
    }

    /**
     * Combines cell by cell.
     *
     * @param matrices the inputs, at least one
     * @param reducer reduces one cell's values across the inputs
     * @return a matrix with the first input's metadata and the reduced values
     * @throws MatrixConfigurationException if the list is empty or shapes differ
     */
    public static NormalizedMatrix combine(List<NormalizedMatrix> matrices, CellReducer reducer) {
        Objects.requireNonNull(matrices, "matrices cannot be null");
        Objects.requireNonNull(reducer, "reducer cannot be null");
        if (matrices.isEmpty()) {
            throw new MatrixConfigurationException("at least one matrix is required to combine");
        }
        NormalizedMatrix first = matrices.get(0);
        for (int i = 1; i < matrices.size(); i++) {
            NormalizedMatrix m = matrices.get(i);
            if (m.rowCount() != first.rowCount() || !first.sameLayout(m)) {
                throw new MatrixConfigurationException("matrix " + (i + 1) + " (" + m.rowCount() + "x"
                    + m.columnCount() + ") does not match the layout of the first ("
                    + first.rowCount() + "x" + first.columnCount() + ")");
            }
        }

        int rows = first.rowCount();
        int cols = first.columnCount();
        double[][] out = new double[rows][cols];
        double[] cell = new double[matrices.size()];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                for (int i = 0; i < cell.length; i++) {
                    cell[i] = matrices.get(i).get(r, c);
                }
                out[r][c] = reducer.reduce(cell.clone(), r);
            }
        }
        logger.debug("Combined {} matrices of {}x{}", matrices.size(), rows, cols);
        return first.withValues(out);
    }
}
