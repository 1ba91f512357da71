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
import io.nosqlbench.signalmatrix.model.GenomicInterval;
import io.nosqlbench.signalmatrix.model.Strand;
import io.nosqlbench.signalmatrix.model.TargetCollection;
import io.nosqlbench.signalmatrix.model.Window;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MatrixAssemblerTest {

    private static List<Window> windowsFor(int owner, int count) {
        List<Window> windows = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            windows.add(new Window(GenomicInterval.of("chr1", i * 10L, i * 10L + 9), owner, i));
        }
        return windows;
    }

    // ==================== assemble ====================

    @Test
    void testForwardOwnersFillLeftToRight() {
        List<Window> windows = new ArrayList<>(windowsFor(1, 3));
        windows.addAll(windowsFor(2, 3));
        TargetCollection targets = TargetCollection.of(
            GenomicInterval.of("chr1", 1, 100, Strand.FORWARD),
            GenomicInterval.of("chr1", 1, 100, Strand.UNSTRANDED));

        SegmentMatrix block = MatrixAssembler.assemble(windows, new double[]{1, 2, 3, 4, 5, 6}, targets, 0);

        assertEquals(2, block.rows());
        assertEquals(3, block.columns());
        assertArrayEquals(new double[]{1, 2, 3}, block.buffer()[0]);
        assertArrayEquals(new double[]{4, 5, 6}, block.buffer()[1]);
    }

    @Test
    void testReverseStrandOwnerIsFlipped() {
        TargetCollection targets = TargetCollection.of(GenomicInterval.of("chr1", 1, 100, Strand.REVERSE));

        SegmentMatrix block = MatrixAssembler.assemble(windowsFor(1, 4), new double[]{1, 2, 3, 4}, targets, 0);

        assertArrayEquals(new double[]{4, 3, 2, 1}, block.buffer()[0]);
    }

    @Test
    void testOwnerWithoutWindowsKeepsEmptyValue() {
        TargetCollection targets = TargetCollection.of(
            GenomicInterval.of("chr1", 1, 100),
            GenomicInterval.of("chr1", 1, 100),
            GenomicInterval.of("chr1", 1, 100));
        List<Window> windows = new ArrayList<>(windowsFor(1, 2));
        windows.addAll(windowsFor(3, 2));

        SegmentMatrix block = MatrixAssembler.assemble(windows, new double[]{1, 2, 3, 4}, targets, Double.NaN);

        assertEquals(2, block.columns());
        assertTrue(Double.isNaN(block.get(1, 0)));
        assertTrue(Double.isNaN(block.get(1, 1)));
        assertEquals(3.0, block.get(2, 0));
    }

    @Test
    void testNoWindowsGivesZeroColumns() {
        TargetCollection targets = TargetCollection.of(GenomicInterval.of("chr1", 1, 100));

        SegmentMatrix block = MatrixAssembler.assemble(List.of(), new double[0], targets, 0);

        assertEquals(1, block.rows());
        assertEquals(0, block.columns());
    }

    @Test
    void testDifferentWindowCountsThrow() {
        TargetCollection targets = TargetCollection.of(
            GenomicInterval.of("chr1", 1, 100),
            GenomicInterval.of("chr1", 1, 100));
        List<Window> windows = new ArrayList<>(windowsFor(1, 3));
        windows.addAll(windowsFor(2, 2));

        ColumnCountMismatchException e = assertThrows(ColumnCountMismatchException.class,
            () -> MatrixAssembler.assemble(windows, new double[5], targets, 0));

        assertEquals(2, e.getOwnerIndex());
        assertEquals(3, e.getExpectedColumns());
        assertEquals(2, e.getActualColumns());
    }

    @Test
    void testValueCountMustMatchWindows() {
        TargetCollection targets = TargetCollection.of(GenomicInterval.of("chr1", 1, 100));
        assertThrows(IllegalArgumentException.class,
            () -> MatrixAssembler.assemble(windowsFor(1, 3), new double[2], targets, 0));
    }

    // ==================== concatenate ====================

    @Test
    void testConcatenateRecordsRanges() {
        SegmentMatrix up = SegmentMatrix.filled(2, 2, 1);
        SegmentMatrix target = SegmentMatrix.empty(2);
        SegmentMatrix down = SegmentMatrix.filled(2, 3, 3);

        AssembledMatrix m = MatrixAssembler.concatenate(up, target, down);

        assertEquals(new ColumnRange(0, 2), m.upstream());
        assertEquals(new ColumnRange(2, 2), m.target());
        assertEquals(new ColumnRange(2, 5), m.downstream());
        assertEquals(5, m.columns());
        assertArrayEquals(new double[]{1, 1, 3, 3, 3}, m.values()[1]);
    }

    @Test
    void testConcatenateRejectsRowMismatch() {
        assertThrows(IllegalArgumentException.class, () -> MatrixAssembler.concatenate(
            SegmentMatrix.empty(2), SegmentMatrix.empty(3), SegmentMatrix.empty(2)));
    }

    @Test
    void testColumnSlice() {
        SegmentMatrix block = new SegmentMatrix(1, 4, new double[][]{{1, 2, 3, 4}});

        SegmentMatrix left = block.columnSlice(0, 1);
        SegmentMatrix right = block.columnSlice(1, 4);

        assertEquals(1, left.columns());
        assertArrayEquals(new double[]{2, 3, 4}, right.buffer()[0]);
        assertThrows(IndexOutOfBoundsException.class, () -> block.columnSlice(2, 5));
    }
}
