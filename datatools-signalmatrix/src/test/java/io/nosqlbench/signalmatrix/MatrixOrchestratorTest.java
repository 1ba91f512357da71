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

import io.nosqlbench.signalmatrix.config.NormalizeOptions;
import io.nosqlbench.signalmatrix.model.ColumnRange;
import io.nosqlbench.signalmatrix.model.GenomicInterval;
import io.nosqlbench.signalmatrix.model.MeanMode;
import io.nosqlbench.signalmatrix.model.NormalizedMatrix;
import io.nosqlbench.signalmatrix.model.SignalCollection;
import io.nosqlbench.signalmatrix.model.Strand;
import io.nosqlbench.signalmatrix.model.TargetCollection;
import io.nosqlbench.signalmatrix.overlap.IntervalOverlapIndex;
import io.nosqlbench.signalmatrix.overlap.SortedIntervalOverlapIndex;
import io.nosqlbench.signalmatrix.process.SmoothingResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MatrixOrchestratorTest {

    private static final GenomicInterval GENE = GenomicInterval.of("chr1", 21, 30, Strand.FORWARD);

    /// One signal in the first upstream window, one inside the gene and one in
    /// the last downstream window, for a 10bp extension split into 2bp windows.
    private static SignalCollection markers() {
        return SignalCollection.builder()
            .add("chr1", 11, 12, 1)
            .add("chr1", 25, 26, 3)
            .add("chr1", 39, 40, 5)
            .build("score");
    }

    private static NormalizeOptions.Builder tenByTwo() {
        return NormalizeOptions.builder().extend(10).windowWidth(2).valueColumn("score");
    }

    // ==================== Layout ====================

    @Test
    void testForwardTargetLayout() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            tenByTwo().build());

        assertEquals(1, m.rowCount());
        assertEquals(11, m.columnCount());
        assertEquals(new ColumnRange(0, 5), m.upstreamRange());
        assertEquals(new ColumnRange(5, 6), m.targetRange());
        assertEquals(new ColumnRange(6, 11), m.downstreamRange());
        assertArrayEquals(new double[]{1, 0, 0, 0, 0, 3, 0, 0, 0, 0, 5}, m.row(0), 1e-12);
        assertEquals(10, m.upstreamExtend());
        assertEquals(10, m.downstreamExtend());
        assertTrue(m.warnings().isEmpty());
        assertTrue(m.failedRows().isEmpty());
        assertFalse(m.targetIsSinglePoint());
        assertNull(m.rowNames());
        assertEquals("signal", m.signalName());
        assertEquals(List.of("u1", "u2", "u3", "u4", "u5", "t1", "d1", "d2", "d3", "d4", "d5"), m.columnNames());
    }

    @Test
    void testReverseTargetReadsInItsOwnDirection() {
        GenomicInterval minus = GENE.withStrand(Strand.REVERSE);

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(minus),
            tenByTwo().build());

        assertArrayEquals(new double[]{5, 0, 0, 0, 0, 3, 0, 0, 0, 0, 1}, m.row(0), 1e-12);
    }

    @Test
    void testRelativeDefaultWidthForShortExtension() {
        // 10 / 50 = 0.2 of each flank, which is again 2bp
        NormalizeOptions options = NormalizeOptions.builder().extend(10).valueColumn("score").build();
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE), options);

        assertEquals(0.2, options.effectiveWindowWidth());
        assertArrayEquals(new double[]{1, 0, 0, 0, 0, 3, 0, 0, 0, 0, 5}, m.row(0), 1e-12);
        assertTrue(m.warnings().isEmpty());
    }

    @Test
    void testDefaultOptions() {
        TargetCollection targets = TargetCollection.of(GenomicInterval.of("chr1", 10_001, 12_000));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(SignalCollection.of(List.of()), targets,
            NormalizeOptions.defaults());

        assertEquals(50, m.upstreamRange().size());
        assertEquals(11, m.targetRange().size());
        assertEquals(50, m.downstreamRange().size());
        assertTrue(m.warnings().isEmpty());
        assertEquals(0.0, m.get(0, 60));
    }

    @Test
    void testTargetRatioControlsTargetColumns() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            tenByTwo().targetRatio(0.5).build());

        assertEquals(10, m.targetRange().size());
        assertEquals(20, m.columnCount());
    }

    @Test
    void testExcludedTarget() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            tenByTwo().includeTarget(false).build());

        assertTrue(m.targetRange().isEmpty());
        assertArrayEquals(new double[]{1, 0, 0, 0, 0, 0, 0, 0, 0, 5}, m.row(0), 1e-12);
    }

    @Test
    void testMeanModeAppliesToEverySegment() {
        SignalCollection wide = SignalCollection.builder()
            .add("chr1", 11, 11, 4)
            .add("chr1", 21, 25, 10)
            .build("score");

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(wide, TargetCollection.of(GENE),
            tenByTwo().meanMode(MeanMode.COVERAGE).build());

        assertEquals(2.0, m.get(0, 0), 1e-12);
        assertEquals(5.0, m.get(0, 5), 1e-12);
    }

    // ==================== Single-point targets ====================

    @Test
    void testSinglePointTargetSplitsOneCombinedRegion() {
        SignalCollection signals = SignalCollection.builder()
            .add("chr1", 15, 16, 2)
            .add("chr1", 33, 34, 7)
            .build("score");
        TargetCollection tss = TargetCollection.of(GenomicInterval.of("chr1", 25, 25));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(signals, tss, tenByTwo().build());

        assertTrue(m.targetIsSinglePoint());
        assertEquals(new ColumnRange(0, 5), m.upstreamRange());
        assertTrue(m.targetRange().isEmpty());
        assertEquals(new ColumnRange(5, 10), m.downstreamRange());
        assertArrayEquals(new double[]{2, 0, 0, 0, 0, 0, 0, 0, 0, 7}, m.row(0), 1e-12);
        assertTrue(m.warnings().isEmpty());
    }

    @Test
    void testSinglePointIgnoresRequestedTarget() {
        TargetCollection tss = TargetCollection.of(GenomicInterval.of("chr1", 25, 25));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), tss,
            tenByTwo().includeTarget(true).build());

        assertTrue(m.targetRange().isEmpty());
        assertEquals(1, m.warnings().size());
        assertThat(m.warnings().get(0)).contains("include_target");
    }

    @Test
    void testSinglePointUnevenExtension() {
        TargetCollection tss = TargetCollection.of(GenomicInterval.of("chr1", 100, 100));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(SignalCollection.of(List.of()), tss,
            NormalizeOptions.builder().extend(6, 2).windowWidth(2).build());

        assertEquals(3, m.upstreamRange().size());
        assertEquals(1, m.downstreamRange().size());
    }

    @Test
    void testSinglePointSplitTieRoundsToEven() {
        // 5 relative windows over [20, 29], split at 2.5
        TargetCollection tss = TargetCollection.of(GenomicInterval.of("chr1", 25, 25));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(SignalCollection.of(List.of()), tss,
            NormalizeOptions.builder().extend(5).windowWidth(0.2).build());

        assertEquals(2, m.upstreamRange().size());
        assertEquals(3, m.downstreamRange().size());
    }

    // ==================== Parameter corrections ====================

    @Test
    void testIndivisibleExtensionIsRounded() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            NormalizeOptions.builder().extend(11).windowWidth(2).valueColumn("score").build());

        assertEquals(10, m.upstreamExtend());
        assertEquals(10, m.downstreamExtend());
        assertEquals(2, m.warnings().size());
        assertEquals(11, m.columnCount());
    }

    @Test
    void testRatioOfOneDropsFlanks() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            tenByTwo().targetRatio(1.0).build());

        assertEquals(0, m.upstreamExtend());
        assertEquals(1, m.warnings().size());
        assertEquals(new ColumnRange(0, 0), m.upstreamRange());
        assertEquals(new ColumnRange(0, 10), m.targetRange());
        // 25.5 and 26.4 both round to base 26, so two columns read it
        assertArrayEquals(new double[]{0, 0, 0, 0, 3, 3, 3, 0, 0, 0}, m.row(0), 1e-12);
    }

    @Test
    void testZeroExtensionUsesK() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            NormalizeOptions.builder().extend(0).k(5).valueColumn("score").build());

        assertTrue(m.warnings().isEmpty());
        assertEquals(5, m.columnCount());
        assertArrayEquals(new double[]{0, 0, 3, 3, 0}, m.row(0), 1e-12);
    }

    @Test
    void testTargetWindowsSpanFromStartToEnd() {
        SignalCollection single = SignalCollection.builder().add("chr1", 27, 27, 9).build("score");

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(single, TargetCollection.of(GENE),
            NormalizeOptions.builder().extend(0).k(3).valueColumn("score").build());

        assertArrayEquals(new double[]{0, 0, 9}, m.row(0), 1e-12);
    }

    @Test
    void testTargetWindowCountTieRoundsToEven() {
        // 10 flank columns at ratio 0.2 asks for 2.5 target columns
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE),
            tenByTwo().targetRatio(0.2).build());

        assertEquals(2, m.targetRange().size());
        assertEquals(12, m.columnCount());
    }

    // ==================== Rows ====================

    @Test
    void testRowNamesFromTargets() {
        TargetCollection named = TargetCollection.of(
            List.of(GENE, GenomicInterval.of("chr2", 21, 30)), List.of("geneA", "geneB"));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), named,
            tenByTwo().signalName("H3K4me3").targetName("genes").build());

        assertEquals(List.of("geneA", "geneB"), m.rowNames());
        assertEquals("H3K4me3", m.signalName());
        assertEquals("genes", m.targetName());
        assertArrayEquals(new double[11], m.row(1), 1e-12);
    }

    @Test
    void testSmoothingFailuresAreReported() {
        SignalCollection.Builder signals = SignalCollection.builder();
        for (long s = 11; s < 40; s += 2) {
            signals.add("chr1", s, s + 1, s);
        }
        TargetCollection targets = TargetCollection.of(GENE, GenomicInterval.of("chr2", 21, 30));

        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(signals.build("score"), targets,
            tenByTwo().smooth(true).parallel(true).build());

        assertEquals(List.of(2), m.failedRows());
        assertTrue(m.smoothed());
        assertTrue(Double.isNaN(m.emptyValue()));
        for (double v : m.row(1)) {
            assertTrue(Double.isNaN(v));
        }
        for (double v : m.row(0)) {
            assertTrue(v >= 11 && v <= 39, "smoothed value " + v + " within observed range");
        }
    }

    @Test
    void testCustomSmootherFailures() {
        NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(markers(), TargetCollection.of(GENE, GENE),
            tenByTwo().smooth(true).smoother(row -> SmoothingResult.failure("nope")).emptyValue(0).build());

        assertEquals(List.of(1, 2), m.failedRows());
        assertArrayEquals(new double[]{1, 0, 0, 0, 0, 3, 0, 0, 0, 0, 5}, m.row(1), 1e-12);
    }

    // ==================== Errors and collaborators ====================

    @Test
    void testEmptyTargetsRejected() {
        assertThrows(MatrixConfigurationException.class, () -> MatrixOrchestrator.normalizeToMatrix(
            markers(), TargetCollection.of(List.of()), NormalizeOptions.defaults()));
    }

    @Test
    void testUnknownValueColumnRejected() {
        assertThrows(MatrixConfigurationException.class, () -> MatrixOrchestrator.normalizeToMatrix(
            markers(), TargetCollection.of(GENE), tenByTwo().valueColumn("depth").build()));
    }

    @Test
    void testCustomOverlapIndexIsUsedForEverySegment() {
        AtomicInteger calls = new AtomicInteger();
        IntervalOverlapIndex sorted = new SortedIntervalOverlapIndex();
        IntervalOverlapIndex counting = (query, subject) -> {
            calls.incrementAndGet();
            return sorted.findOverlaps(query, subject);
        };

        NormalizedMatrix m = new MatrixOrchestrator(counting).normalize(markers(), TargetCollection.of(GENE),
            tenByTwo().build());

        assertEquals(3, calls.get());
        assertEquals(5.0, m.get(0, 10));
    }
}
