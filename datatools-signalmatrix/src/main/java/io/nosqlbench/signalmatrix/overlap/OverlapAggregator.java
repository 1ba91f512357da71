package io.nosqlbench.signalmatrix.overlap;

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
import io.nosqlbench.signalmatrix.model.GenomicInterval;
import io.nosqlbench.signalmatrix.model.MeanMode;
import io.nosqlbench.signalmatrix.model.SignalCollection;
import io.nosqlbench.signalmatrix.model.TargetCollection;
import io.nosqlbench.signalmatrix.model.Window;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes one value per window from the signals overlapping it.
 *
 * <h2>Process</h2>
 *
 * <pre>{@code
 * signals ──┐
 *           ├──► overlap join ──► mapping filter ──► per-window accumulate ──► MeanMode formula
 * windows ──┘
 * }</pre>
 *
 * <ol>
 *   <li>Overlaps are computed on coordinates only; strand is ignored.</li>
 *   <li>An optional mapping column keeps only pairs whose signal label names the
 *       window's owner: numeric labels are compared with the owner's 1-based row,
 *       text labels with the owner's name.</li>
 *   <li>Signals with a {@code NaN} value contribute to no sum.</li>
 *   <li>Windows without any surviving pair receive the caller's empty value.</li>
 * </ol>
 *
 * <p>A window whose overlapping signals are all {@code NaN} is not empty: it gets
 * {@code NaN} for {@link MeanMode#ABSOLUTE} and {@link MeanMode#WEIGHTED} (mean of
 * nothing) and {@code 0} for {@link MeanMode#W0} and {@link MeanMode#COVERAGE}.
 */
public final class OverlapAggregator {

    private static final Logger logger = LogManager.getLogger(OverlapAggregator.class);

    private final IntervalOverlapIndex index;

    /**
     * Creates an aggregator using {@link SortedIntervalOverlapIndex}.
     */
    public OverlapAggregator() {
        this(new SortedIntervalOverlapIndex());
    }

    public OverlapAggregator(IntervalOverlapIndex index) {
        this.index = Objects.requireNonNull(index, "index cannot be null");
    }

    /**
     * Aggregates signal values into windows.
     *
     * @param signals the signals; not modified
     * @param windows the windows, typically from {@code WindowSplitter.splitAll}
     * @param owners the regions the windows were generated from; names are used by text mapping
     * @param valueColumn numeric signal column to read, or null for the implicit value 1
     * @param meanMode how partially overlapping values are summarized
     * @param emptyValue value for windows that no signal overlaps
     * @param mappingColumn signal column restricting which owner a signal may contribute to, or null
     * @return one value per window, in window order
     * @throws MatrixConfigurationException if a column is missing, or text mapping is requested on unnamed owners
     */
    public double[] aggregate(SignalCollection signals, List<Window> windows, TargetCollection owners,
                              String valueColumn, MeanMode meanMode, double emptyValue, String mappingColumn) {
        Objects.requireNonNull(signals, "signals cannot be null");
        Objects.requireNonNull(windows, "windows cannot be null");
        Objects.requireNonNull(owners, "owners cannot be null");
        Objects.requireNonNull(meanMode, "meanMode cannot be null");

        double[] values = signals.values(valueColumn);
        OwnerFilter filter = mappingColumn == null ? null : OwnerFilter.resolve(signals, owners, mappingColumn);

        List<GenomicInterval> windowIntervals = new ArrayList<>(windows.size());
        for (Window w : windows) {
            windowIntervals.add(w.interval());
        }
        List<OverlapPair> pairs = index.findOverlaps(signals.intervals(), windowIntervals);

        int n = windows.size();
        boolean[] hit = new boolean[n];
        int[] count = new int[n];
        double[] sumValue = new double[n];
        double[] sumWeighted = new double[n];
        long[] sumOverlap = new long[n];
        List<List<long[]>> extents = meanMode == MeanMode.W0 ? new ArrayList<>(n) : null;
        if (extents != null) {
            for (int i = 0; i < n; i++) {
                extents.add(null);
            }
        }

        int kept = 0;
        for (OverlapPair pair : pairs) {
            int s = pair.queryIndex();
            int w = pair.subjectIndex();
            if (filter != null && !filter.accepts(s, windows.get(w).ownerIndex())) {
                continue;
            }
            kept++;
            hit[w] = true;
            double v = values[s];
            if (Double.isNaN(v)) {
                continue;
            }
            long ov = pair.overlapWidth();
            count[w]++;
            sumValue[w] += v;
            sumWeighted[w] += v * ov;
            sumOverlap[w] += ov;
            if (extents != null) {
                if (extents.get(w) == null) {
                    extents.set(w, new ArrayList<>());
                }
                extents.get(w).add(new long[]{pair.overlapStart(), pair.overlapEnd()});
            }
        }

        double[] result = new double[n];
        for (int w = 0; w < n; w++) {
            if (!hit[w]) {
                result[w] = emptyValue;
                continue;
            }
            long windowWidth = windows.get(w).width();
            switch (meanMode) {
                case ABSOLUTE:
                    result[w] = count[w] > 0 ? sumValue[w] / count[w] : Double.NaN;
                    break;
                case WEIGHTED:
                    result[w] = sumOverlap[w] > 0 ? sumWeighted[w] / sumOverlap[w] : Double.NaN;
                    break;
                case W0:
                    long uncovered = windowWidth - coveredBases(extents.get(w));
                    result[w] = sumWeighted[w] / (sumOverlap[w] + uncovered);
                    break;
                case COVERAGE:
                    result[w] = sumWeighted[w] / windowWidth;
                    break;
                default:
                    throw new IllegalStateException("Unhandled mean mode: " + meanMode);
            }
        }
        logger.debug("Aggregated {} overlap pairs ({} kept) into {} windows using {}",
            pairs.size(), kept, n, meanMode);
        return result;
    }

    /// Counts the bases covered by the union of the given extents.
    static long coveredBases(List<long[]> extents) {
        if (extents == null || extents.isEmpty()) {
            return 0;
        }
        long[][] sorted = extents.toArray(new long[0][]);
        Arrays.sort(sorted, (a, b) -> Long.compare(a[0], b[0]));
        long covered = 0;
        long curStart = sorted[0][0];
        long curEnd = sorted[0][1];
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i][0] <= curEnd + 1) {
                curEnd = Math.max(curEnd, sorted[i][1]);
            } else {
                covered += curEnd - curStart + 1;
                curStart = sorted[i][0];
                curEnd = sorted[i][1];
            }
        }
        covered += curEnd - curStart + 1;
        return covered;
    }

    /// Decides whether a signal may contribute to a given owner.
    private static final class OwnerFilter {
        private final double[] numericLabels;
        private final String[] textLabels;
        private final TargetCollection owners;

        private OwnerFilter(double[] numericLabels, String[] textLabels, TargetCollection owners) {
            this.numericLabels = numericLabels;
            this.textLabels = textLabels;
            this.owners = owners;
        }

        static OwnerFilter resolve(SignalCollection signals, TargetCollection owners, String column) {
            if (signals.hasNumericColumn(column)) {
                return new OwnerFilter(signals.values(column), null, owners);
            }
            if (signals.hasTextColumn(column)) {
                if (!owners.hasNames()) {
                    throw new MatrixConfigurationException("`mapping_column` '" + column
                        + "' in signal is mapped to the names of target, which means target should have names.");
                }
                return new OwnerFilter(null, signals.labels(column), owners);
            }
            throw new MatrixConfigurationException("signal has no mapping column '" + column + "'");
        }

        boolean accepts(int signal, int ownerIndex) {
            if (numericLabels != null) {
                double label = numericLabels[signal];
                return !Double.isNaN(label) && label == ownerIndex;
            }
            String label = textLabels[signal];
            return label != null && label.equals(owners.name(ownerIndex - 1));
        }
    }
}
