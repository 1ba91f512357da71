package io.nosqlbench.signalmatrix;

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

import io.nosqlbench.signalmatrix.assemble.AssembledMatrix;
import io.nosqlbench.signalmatrix.assemble.MatrixAssembler;
import io.nosqlbench.signalmatrix.assemble.SegmentMatrix;
import io.nosqlbench.signalmatrix.config.Adjusted;
import io.nosqlbench.signalmatrix.config.NormalizeOptions;
import io.nosqlbench.signalmatrix.config.ParameterChecks;
import io.nosqlbench.signalmatrix.config.ParameterChecks.ExtendSettings;
import io.nosqlbench.signalmatrix.model.GenomicInterval;
import io.nosqlbench.signalmatrix.model.NormalizedMatrix;
import io.nosqlbench.signalmatrix.model.SignalCollection;
import io.nosqlbench.signalmatrix.model.TargetCollection;
import io.nosqlbench.signalmatrix.model.Window;
import io.nosqlbench.signalmatrix.overlap.IntervalOverlapIndex;
import io.nosqlbench.signalmatrix.overlap.OverlapAggregator;
import io.nosqlbench.signalmatrix.overlap.SortedIntervalOverlapIndex;
import io.nosqlbench.signalmatrix.process.PostProcessResult;
import io.nosqlbench.signalmatrix.process.PostProcessor;
import io.nosqlbench.signalmatrix.window.SplitDirection;
import io.nosqlbench.signalmatrix.window.WindowSplitter;
import io.nosqlbench.signalmatrix.window.WindowWidth;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds a {@link NormalizedMatrix} from signals and targets.
 *
 * <h2>Layout</h2>
 *
 * <pre>{@code
 *            upstream            target            downstream
 *   ... ─────────────────|=====================|───────────────── ...
 *        u1 u2 ... un       t1 t2 ... tk          d1 d2 ... dm
 *        (width w)          (k equal parts)       (width w)
 * }</pre>
 *
 * <p>Columns always read in the target's own direction: for {@code -} strand
 * targets upstream lies to the right on the reference and the row is flipped.
 *
 * <h2>Steps</h2>
 *
 * <ol>
 *   <li>Reconcile extension with target ratio, and switch off the target body for
 *       single-point targets.</li>
 *   <li>Round each extension down to a multiple of an absolute window width.</li>
 *   <li>Split flanks into windows from the target outward, and the target body into
 *       {@code k} windows.</li>
 *   <li>Aggregate overlapping signal into each window and assemble the segments.</li>
 *   <li>Smooth, trim and clamp.</li>
 * </ol>
 *
 * <p>Every parameter correction is logged at WARN and kept in
 * {@link NormalizedMatrix#warnings()}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(signals, targets,
 *     NormalizeOptions.builder().extend(10).windowWidth(2).build());
 * }</pre>
 */
public final class MatrixOrchestrator {

    private static final Logger logger = LogManager.getLogger(MatrixOrchestrator.class);

    public static final String DEFAULT_SIGNAL_NAME = "signal";
    public static final String DEFAULT_TARGET_NAME = "target";

    private final OverlapAggregator aggregator;

    public MatrixOrchestrator() {
        this(new SortedIntervalOverlapIndex());
    }

    /**
     * @param overlapIndex the overlap search used for every segment
     */
    public MatrixOrchestrator(IntervalOverlapIndex overlapIndex) {
        this.aggregator = new OverlapAggregator(Objects.requireNonNull(overlapIndex, "overlapIndex cannot be null"));
    }

    /**
     * Normalizes signals around targets with the default overlap search.
     *
     * @see #normalize(SignalCollection, TargetCollection, NormalizeOptions)
     */
    public static NormalizedMatrix normalizeToMatrix(SignalCollection signals, TargetCollection targets,
                                                     NormalizeOptions options) {
        return new MatrixOrchestrator().normalize(signals, targets, options);
    }

    /**
     * Normalizes signals around targets.
     *
     * @param signals the signal intervals and their columns
     * @param targets the target regions, one row each
     * @param options normalization options
     * @return the matrix, one row per target
     * @throws MatrixConfigurationException if the options cannot be applied to these inputs
     * @throws ColumnCountMismatchException if targets produced different numbers of windows
     */
    public NormalizedMatrix normalize(SignalCollection signals, TargetCollection targets, NormalizeOptions options) {
        Objects.requireNonNull(signals, "signals cannot be null");
        Objects.requireNonNull(targets, "targets cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        if (targets.isEmpty()) {
            throw new MatrixConfigurationException("`target` cannot be empty");
        }

        List<String> warnings = new ArrayList<>();

        ExtendSettings settings = note(ParameterChecks.reconcileExtendAndRatio(
            options.upstreamExtend(), options.downstreamExtend(), options.effectiveTargetRatio()), warnings);

        boolean singlePoint = targets.allSinglePoint();
        boolean requested = options.includeTarget() != null ? options.includeTarget() : targets.anyWiderThanOne();
        boolean includeTarget = note(ParameterChecks.resolveIncludeTarget(requested, singlePoint), warnings);

        long upstream = settings.upstream();
        long downstream = settings.downstream();
        WindowWidth width = null;
        if (!settings.isZero()) {
            Double w = options.effectiveWindowWidth();
            if (w == null) {
                throw new MatrixConfigurationException("`w` must be given when `extend` is not 0");
            }
            width = note(WindowWidth.parse(w), warnings);
            if (!width.isRelative()) {
                upstream = note(ParameterChecks.roundExtendToWidth(upstream, width.basePairs(), "upstream"), warnings);
                downstream = note(ParameterChecks.roundExtendToWidth(downstream, width.basePairs(), "downstream"), warnings);
            }
        }

        double emptyValue = options.effectiveEmptyValue();
        logger.debug("Normalizing {} signals over {} targets: extend=[{}, {}], w={}, includeTarget={}, singlePoint={}",
            signals.size(), targets.size(), upstream, downstream, width, includeTarget, singlePoint);

        SegmentMatrix up;
        SegmentMatrix down;
        if (singlePoint) {
            SegmentMatrix[] halves = splitAroundPoint(signals, targets, options, width, upstream, downstream, emptyValue);
            up = halves[0];
            down = halves[1];
        } else {
            up = upstream <= 0
                ? SegmentMatrix.empty(targets.size())
                : segment(signals, targets, upstreamFlanks(targets, upstream), width, null,
                    r -> r.strand().isReverse() ? SplitDirection.NORMAL : SplitDirection.REVERSE, options, emptyValue);
            down = downstream <= 0
                ? SegmentMatrix.empty(targets.size())
                : segment(signals, targets, downstreamFlanks(targets, downstream), width, null,
                    r -> r.strand().isReverse() ? SplitDirection.REVERSE : SplitDirection.NORMAL, options, emptyValue);
        }

        SegmentMatrix body;
        if (includeTarget) {
            int k;
            if (upstream == 0 && downstream == 0) {
                k = options.k() != null ? options.k()
                    : (int) Math.max(1L, Math.min(NormalizeOptions.DEFAULT_MAX_TARGET_WINDOWS, targets.minWidth()));
            } else {
                k = ParameterChecks.targetWindowCount(up.columns() + down.columns(), settings.targetRatio());
            }
            body = segment(signals, targets, targets.intervals(), null, k,
                r -> SplitDirection.NORMAL, options, emptyValue);
        } else {
            body = SegmentMatrix.empty(targets.size());
        }

        AssembledMatrix assembled = MatrixAssembler.concatenate(up, body, down);
        PostProcessResult processed = new PostProcessor(options.smoother(), options.parallel())
            .process(assembled.values(), options.smooth(), options.trim());

        NormalizedMatrix matrix = NormalizedMatrix.builder()
            .values(processed.values())
            .ranges(assembled.upstream(), assembled.target(), assembled.downstream())
            .extend(upstream, downstream)
            .smoothed(options.smooth())
            .targetIsSinglePoint(singlePoint)
            .emptyValue(emptyValue)
            .failedRows(processed.failedRows())
            .rowNames(targets.hasNames() ? targets.names() : null)
            .signalName(options.signalName() != null ? options.signalName() : DEFAULT_SIGNAL_NAME)
            .targetName(options.targetName() != null ? options.targetName() : DEFAULT_TARGET_NAME)
            .warnings(warnings)
            .build();
        logger.info("Normalized {} targets into {} x {} matrix ({} upstream, {} target, {} downstream columns)",
            targets.size(), matrix.rowCount(), matrix.columnCount(),
            assembled.upstream().size(), assembled.target().size(), assembled.downstream().size());
        return matrix;
    }

    private SegmentMatrix[] splitAroundPoint(SignalCollection signals, TargetCollection targets,
                                             NormalizeOptions options, WindowWidth width,
                                             long upstream, long downstream, double emptyValue) {
        if (upstream + downstream == 0) {
            return new SegmentMatrix[]{SegmentMatrix.empty(targets.size()), SegmentMatrix.empty(targets.size())};
        }
        List<GenomicInterval> around = new ArrayList<>(targets.size());
        for (GenomicInterval t : targets.intervals()) {
            if (t.strand().isReverse()) {
                around.add(new GenomicInterval(t.seqId(), t.end() - downstream + 1, t.end() + upstream, t.strand()));
            } else {
                around.add(new GenomicInterval(t.seqId(), t.start() - upstream, t.start() + downstream - 1, t.strand()));
            }
        }
        SegmentMatrix both = segment(signals, targets, around, width, null,
            r -> r.strand().isReverse() ? SplitDirection.REVERSE : SplitDirection.NORMAL, options, emptyValue);
        int split = (int) Math.rint((double) upstream / (upstream + downstream) * both.columns());
        return new SegmentMatrix[]{both.columnSlice(0, split), both.columnSlice(split, both.columns())};
    }

    private static List<GenomicInterval> upstreamFlanks(TargetCollection targets, long upstream) {
        List<GenomicInterval> flanks = new ArrayList<>(targets.size());
        for (GenomicInterval t : targets.intervals()) {
            if (t.strand().isReverse()) {
                flanks.add(new GenomicInterval(t.seqId(), t.end() + 1, t.end() + upstream, t.strand()));
            } else {
                flanks.add(new GenomicInterval(t.seqId(), t.start() - upstream, t.start() - 1, t.strand()));
            }
        }
        return flanks;
    }

    private static List<GenomicInterval> downstreamFlanks(TargetCollection targets, long downstream) {
        List<GenomicInterval> flanks = new ArrayList<>(targets.size());
        for (GenomicInterval t : targets.intervals()) {
            if (t.strand().isReverse()) {
                flanks.add(new GenomicInterval(t.seqId(), t.start() - downstream, t.start() - 1, t.strand()));
            } else {
                flanks.add(new GenomicInterval(t.seqId(), t.end() + 1, t.end() + downstream, t.strand()));
            }
        }
        return flanks;
    }

    private SegmentMatrix segment(SignalCollection signals, TargetCollection targets, List<GenomicInterval> regions,
                                  WindowWidth width, Integer count, Function<GenomicInterval, SplitDirection> direction,
                                  NormalizeOptions options, double emptyValue) {
        List<Window> windows = WindowSplitter.splitAll(regions, width, count, direction, false);
        double[] values = aggregator.aggregate(signals, windows, targets, options.valueColumn(),
            options.meanMode(), emptyValue, options.mappingColumn());
        return MatrixAssembler.assemble(windows, values, targets, emptyValue);
    }

    private static <T> T note(Adjusted<T> adjusted, List<String> warnings) {
        adjusted.warning().ifPresent(w -> {
            logger.warn(w);
            warnings.add(w);
        });
        return adjusted.value();
    }
}
