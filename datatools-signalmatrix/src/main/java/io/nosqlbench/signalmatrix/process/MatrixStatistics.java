package io.nosqlbench.signalmatrix.process;

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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Range and quantiles of all non-missing cells of a matrix.
 *
 * <h2>Missing Values</h2>
 *
 * <p>{@code NaN} cells are skipped. A matrix with no finite cell has
 * {@link #count()} zero and {@code NaN} bounds.
 *
 * <h2>Quantiles</h2>
 *
 * <p>Quantiles interpolate linearly between order statistics
 * ({@link Percentile.EstimationType#R_7}), so {@code quantile(0)} is the minimum
 * and {@code quantile(1)} the maximum.
 */
public final class MatrixStatistics {

    private final double[] observed;
    private final double min;
    private final double max;

    private MatrixStatistics(double[] observed, double min, double max) {
        this.observed = observed;
        this.min = min;
        this.max = max;
    }

    /**
     * Collects the non-missing cells of {@code values}.
     *
     * @param values row-major matrix values
     * @return computed statistics
     */
    public static MatrixStatistics compute(double[][] values) {
        Objects.requireNonNull(values, "values cannot be null");

        int count = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v)) count++;
            }
        }

        double[] observed = new double[count];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int i = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (Double.isNaN(v)) continue;
                observed[i++] = v;
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }
        if (count == 0) {
            return new MatrixStatistics(observed, Double.NaN, Double.NaN);
        }
        return new MatrixStatistics(observed, min, max);
    }

    /**
     * Returns the number of non-missing cells.
     */
    public int count() {
        return observed.length;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /**
     * Returns the {@code p}-quantile of the non-missing cells.
     *
     * @param p probability in [0, 1]
     * @return the quantile, or {@code NaN} when there are no cells
     */
    public double quantile(double p) {
        if (!(p >= 0 && p <= 1)) {
            throw new IllegalArgumentException("p must be in [0, 1], got: " + p);
        }
        if (observed.length == 0) {
            return Double.NaN;
        }
        if (p == 0) {
            return min;
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(observed, p * 100.0);
    }
}
