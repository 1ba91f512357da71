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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.IntStream;

/**
 * Finishes an assembled matrix: optional row smoothing, quantile trimming and
 * clamping to the original value range.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 *   input ──► record [min_v, max_v] ──► smooth rows ──► trim to [q_low, q_high] ──► clamp to [min_v, max_v]
 * }</pre>
 *
 * <ul>
 *   <li>The range is taken before smoothing, so a smoother that overshoots can
 *       never push values outside what was observed.</li>
 *   <li>A row whose smoothing fails is kept exactly as it was and its 1-based
 *       index is reported. Failures never abort processing.</li>
 *   <li>Quantiles are computed after smoothing, over non-missing cells.</li>
 *   <li>{@code NaN} cells stay {@code NaN} through trimming and clamping.</li>
 * </ul>
 *
 * <p>Rows are independent, so smoothing may run in parallel; each task writes
 * only its own row.
 */
public final class PostProcessor {

    private static final Logger logger = LogManager.getLogger(PostProcessor.class);

    private final RowSmoother smoother;
    private final boolean parallel;

    public PostProcessor(RowSmoother smoother) {
        this(smoother, false);
    }

    /**
     * @param smoother the row smoother used when smoothing is requested
     * @param parallel whether rows are smoothed concurrently
     */
    public PostProcessor(RowSmoother smoother, boolean parallel) {
        this.smoother = Objects.requireNonNull(smoother, "smoother cannot be null");
        this.parallel = parallel;
    }

    /**
     * Processes a matrix. The input array is not modified.
     *
     * @param input row-major values
     * @param smooth whether to smooth each row
     * @param trim quantile trimming to apply
     * @return processed values and failed rows
     */
    public PostProcessResult process(double[][] input, boolean smooth, TrimSpec trim) {
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(trim, "trim cannot be null");

        double[][] values = new double[input.length][];
        for (int r = 0; r < input.length; r++) {
            values[r] = input[r].clone();
        }

        MatrixStatistics before = MatrixStatistics.compute(values);
        List<Integer> failedRows = smooth ? smoothRows(values) : List.of();

        if (before.count() == 0) {
            logger.debug("Matrix has no non-missing values, skipping trim and clamp");
            return new PostProcessResult(values, failedRows);
        }

        MatrixStatistics after = smooth ? MatrixStatistics.compute(values) : before;
        if (after.count() > 0) {
            double q1 = after.quantile(trim.low());
            double q2 = after.quantile(1.0 - trim.high());
            logger.debug("Trimming to [{}, {}] for trim {}", q1, q2, trim);
            clamp(values, q1, q2);
        }
        clamp(values, before.min(), before.max());
        return new PostProcessResult(values, failedRows);
    }

    private List<Integer> smoothRows(double[][] values) {
        Queue<Integer> failures = new ConcurrentLinkedQueue<>();
        IntStream rows = IntStream.range(0, values.length);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(r -> {
            if (!smoothRow(values, r)) {
                failures.add(r + 1);
            }
        });

        List<Integer> failed = new ArrayList<>(failures);
        Collections.sort(failed);
        if (failed.size() == 1) {
            logger.warn("Smoothing is failed for one row because there are very few signals overlapped to it. "
                + "Row {} keeps its unsmoothed values; consider removing it.", failed.get(0));
        } else if (failed.size() > 1) {
            logger.warn("Smoothing failed for {} rows because there are very few signals overlapped to them. "
                + "These rows keep their unsmoothed values; see failedRows() to remove them.", failed.size());
        }
        return failed;
    }

    private boolean smoothRow(double[][] values, int r) {
        double[] original = values[r];
        SmoothingResult result;
        try {
            result = smoother.smooth(original.clone());
        } catch (RuntimeException e) {
            logger.debug("Smoother threw on row {}: {}", r + 1, e.toString());
            return false;
        }
        if (result == null || !result.isSuccess()) {
            logger.debug("Smoothing failed on row {}: {}", r + 1,
                result == null ? "no result" : result.failureReason());
            return false;
        }
        if (result.values().length != original.length) {
            logger.debug("Smoother returned {} values for row {} of length {}",
                result.values().length, r + 1, original.length);
            return false;
        }
        values[r] = result.values().clone();
        return true;
    }

    private static void clamp(double[][] values, double lo, double hi) {
        for (double[] row : values) {
            for (int c = 0; c < row.length; c++) {
                double v = row[c];
                if (v <= lo) {
                    row[c] = lo;
                } else if (v >= hi) {
                    row[c] = hi;
                }
            }
        }
    }
}
