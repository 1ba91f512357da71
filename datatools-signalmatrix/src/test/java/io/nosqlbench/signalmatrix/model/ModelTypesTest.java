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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ModelTypesTest {

    // ==================== GenomicInterval ====================

    @Test
    void testIntervalWidthAndOverlap() {
        GenomicInterval a = GenomicInterval.of("chr1", 10, 19);
        GenomicInterval b = GenomicInterval.of("chr1", 15, 30, Strand.REVERSE);

        assertEquals(10, a.width());
        assertTrue(a.overlaps(b));
        assertEquals(5, a.overlapWidth(b));
        assertEquals(0, a.overlapWidth(GenomicInterval.of("chr2", 10, 19)));
        assertFalse(a.overlaps(GenomicInterval.of("chr1", 20, 25)));
    }

    @Test
    void testZeroWidthIntervalAllowed() {
        assertEquals(0, GenomicInterval.of("chr1", 5, 4).width());
        assertThrows(IllegalArgumentException.class, () -> GenomicInterval.of("chr1", 5, 3));
    }

    @Test
    void testStrandSymbols() {
        assertEquals(Strand.FORWARD, Strand.fromSymbol('+'));
        assertEquals(Strand.REVERSE, Strand.fromSymbol("-"));
        assertEquals(Strand.UNSTRANDED, Strand.fromSymbol('.'));
        assertEquals(Strand.UNSTRANDED, Strand.fromSymbol('*'));
        assertThrows(IllegalArgumentException.class, () -> Strand.fromSymbol("++"));
        assertEquals("chr1:1-2(-)", GenomicInterval.of("chr1", 1, 2).withStrand(Strand.REVERSE).toString());
    }

    @Test
    void testWindowIndicesAreOneBased() {
        GenomicInterval gi = GenomicInterval.of("chr1", 1, 2);
        assertThrows(IllegalArgumentException.class, () -> new Window(gi, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new Window(gi, 1, 0));
    }

    @Test
    void testMeanModeNames() {
        assertEquals(MeanMode.W0, MeanMode.fromName("W0"));
        assertEquals(MeanMode.COVERAGE, MeanMode.fromName(" coverage "));
        assertEquals("weighted", MeanMode.WEIGHTED.configName());
        assertThrows(IllegalArgumentException.class, () -> MeanMode.fromName("median"));
    }

    @Test
    void testColumnRange() {
        ColumnRange r = ColumnRange.ofSize(3, 2);

        assertEquals(2, r.size());
        assertTrue(r.contains(3));
        assertFalse(r.contains(5));
        assertArrayEquals(new int[]{4, 5}, r.indices());
        assertTrue(ColumnRange.empty(7).isEmpty());
        assertEquals(0, ColumnRange.empty(7).indices().length);
    }

    // ==================== SignalCollection ====================

    @Test
    void testSignalColumns() {
        SignalCollection signals = SignalCollection.builder()
            .add("chr1", 1, 10, 1.5, 2)
            .add("chr1", 20, 30, 2.5, 3)
            .textColumn("gene", new String[]{"a", "b"})
            .build("score", "depth");

        assertEquals(2, signals.size());
        assertThat(signals.numericColumnNames()).containsExactly("score", "depth");
        assertArrayEquals(new double[]{2, 3}, signals.values("depth"));
        assertArrayEquals(new double[]{1, 1}, signals.values(null));
        assertArrayEquals(new String[]{"a", "b"}, signals.labels("gene"));
        assertTrue(signals.hasTextColumn("gene"));
        assertFalse(signals.hasNumericColumn("gene"));
    }

    @Test
    void testUnknownSignalColumnThrows() {
        SignalCollection signals = SignalCollection.of(List.of(GenomicInterval.of("chr1", 1, 2)));

        assertThrows(MatrixConfigurationException.class, () -> signals.values("score"));
        assertThrows(MatrixConfigurationException.class, () -> signals.labels("gene"));
    }

    @Test
    void testSignalRowLengthChecked() {
        SignalCollection.Builder builder = SignalCollection.builder().add("chr1", 1, 2, 1, 2);
        assertThrows(IllegalArgumentException.class, () -> builder.build("score"));
    }

    // ==================== TargetCollection ====================

    @Test
    void testTargetWidthQueries() {
        TargetCollection points = TargetCollection.of(GenomicInterval.of("chr1", 5, 5), GenomicInterval.of("chr1", 9, 9));
        TargetCollection mixed = TargetCollection.of(GenomicInterval.of("chr1", 5, 5), GenomicInterval.of("chr1", 9, 20));

        assertTrue(points.allSinglePoint());
        assertFalse(points.anyWiderThanOne());
        assertFalse(mixed.allSinglePoint());
        assertEquals(1, mixed.minWidth());
    }

    @Test
    void testTargetNames() {
        TargetCollection named = TargetCollection.of(List.of(GenomicInterval.of("chr1", 1, 10)), List.of("geneA"));

        assertEquals("geneA", named.name(0));
        TargetCollection shifted = named.mapIntervals(gi -> GenomicInterval.of(gi.seqId(), gi.start() + 1, gi.end() + 1));
        assertEquals(List.of("geneA"), shifted.names());
        assertEquals(2, shifted.interval(0).start());
        assertNull(TargetCollection.of(GenomicInterval.of("chr1", 1, 10)).name(0));
        assertThrows(IllegalArgumentException.class,
            () -> TargetCollection.of(List.of(GenomicInterval.of("chr1", 1, 10)), List.of("a", "b")));
    }
}
