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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NormalizedMatrixTest {

    private NormalizedMatrix matrix;

    @BeforeEach
    void setUp() {
        matrix = NormalizedMatrix.builder()
            .values(new double[][]{
                {1, 2, 3, 4, 5},
                {6, 7, 8, 9, 10},
                {11, 12, 13, 14, 15}})
            .ranges(new ColumnRange(0, 2), new ColumnRange(2, 3), new ColumnRange(3, 5))
            .extend(10, 10)
            .rowNames(List.of("a", "b", "c"))
            .failedRows(List.of(2))
            .smoothed(true)
            .signalName("H3K4me3")
            .targetName("genes")
            .build();
    }

    // ==================== Construction ====================

    @Test
    void testDefaultColumnNames() {
        assertEquals(List.of("u1", "u2", "t1", "d1", "d2"), matrix.columnNames());
        assertEquals(3, matrix.rowCount());
        assertEquals(5, matrix.columnCount());
        assertEquals(9.0, matrix.get(1, 3));
    }

    @Test
    void testValuesAreCopied() {
        double[][] values = matrix.values();
        values[0][0] = 99;
        double[] row = matrix.row(0);
        row[1] = 99;

        assertEquals(1.0, matrix.get(0, 0));
        assertEquals(2.0, matrix.get(0, 1));
    }

    @Test
    void testRangesMustBeContiguous() {
        assertThrows(IllegalArgumentException.class, () -> matrix.toBuilder()
            .ranges(new ColumnRange(0, 2), new ColumnRange(3, 3), new ColumnRange(3, 5))
            .build());
    }

    @Test
    void testFailedRowsMustBeInRange() {
        assertThrows(IllegalArgumentException.class, () -> matrix.toBuilder().failedRows(List.of(4)).build());
        assertThrows(IllegalArgumentException.class, () -> matrix.toBuilder().failedRows(List.of(0)).build());
    }

    @Test
    void testRowNameCountChecked() {
        assertThrows(IllegalArgumentException.class, () -> matrix.toBuilder().rowNames(List.of("a")).build());
    }

    // ==================== Subsetting ====================

    @Test
    void testSubsetRowsRenumbersFailedRows() {
        NormalizedMatrix sub = matrix.subsetRows(2, 1);

        assertEquals(2, sub.rowCount());
        assertArrayEquals(new double[]{11, 12, 13, 14, 15}, sub.row(0));
        assertEquals(List.of("c", "b"), sub.rowNames());
        assertEquals(List.of(2), sub.failedRows());
        assertEquals(matrix.upstreamRange(), sub.upstreamRange());
        assertTrue(sub.smoothed());
    }

    @Test
    void testSubsetRowsDropsUnselectedFailures() {
        assertTrue(matrix.subsetRows(0).failedRows().isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.subsetRows(3));
    }

    @Test
    void testSubsetRowsRenumbersManyFailures() {
        int n = 400;
        double[][] values = new double[n][5];
        List<Integer> failures = new ArrayList<>();
        for (int r = 1; r <= n; r += 2) {
            failures.add(r);
        }
        NormalizedMatrix big = matrix.toBuilder().values(values).rowNames(null).failedRows(failures).build();
        int[] reversed = new int[n];
        for (int i = 0; i < n; i++) {
            reversed[i] = n - 1 - i;
        }

        NormalizedMatrix sub = big.subsetRows(reversed);

        assertEquals(n / 2, sub.failedRows().size());
        assertEquals(2, sub.failedRows().get(0));
        assertEquals(n, sub.failedRows().get(n / 2 - 1));
        assertThat(sub.failedRows()).isSorted();
    }

    @Test
    void testSubsetColumnsRecountsSegments() {
        NormalizedMatrix sub = matrix.subsetColumns(1, 2, 4);

        assertEquals(new ColumnRange(0, 1), sub.upstreamRange());
        assertEquals(new ColumnRange(1, 2), sub.targetRange());
        assertEquals(new ColumnRange(2, 3), sub.downstreamRange());
        assertEquals(List.of("u2", "t1", "d2"), sub.columnNames());
        assertArrayEquals(new double[]{7, 8, 10}, sub.row(1));
    }

    @Test
    void testSubsetColumnsCanDropASegment() {
        NormalizedMatrix sub = matrix.subsetColumns(0, 1, 3, 4);

        assertTrue(sub.targetRange().isEmpty());
        assertEquals(4, sub.columnCount());
    }

    @Test
    void testSubsetColumnsMustIncrease() {
        assertThrows(IllegalArgumentException.class, () -> matrix.subsetColumns(2, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.subsetColumns(5));
    }

    // ==================== Replacing and binding ====================

    @Test
    void testWithValuesKeepsMetadata() {
        NormalizedMatrix replaced = matrix.withValues(new double[][]{
            {0, 0, 0, 0, 0}, {1, 1, 1, 1, 1}, {2, 2, 2, 2, 2}});

        assertEquals(List.of(2), replaced.failedRows());
        assertEquals(List.of("a", "b", "c"), replaced.rowNames());
        assertEquals(2.0, replaced.get(2, 4));
    }

    @Test
    void testWithValuesOfDifferentRowCountClearsRowMetadata() {
        NormalizedMatrix replaced = matrix.withValues(new double[][]{{0, 0, 0, 0, 0}});

        assertTrue(replaced.failedRows().isEmpty());
        assertNull(replaced.rowNames());
    }

    @Test
    void testWithValuesRequiresSameColumns() {
        assertThrows(IllegalArgumentException.class, () -> matrix.withValues(new double[][]{{1, 2}}));
    }

    @Test
    void testBindRowsOffsetsFailedRows() {
        NormalizedMatrix other = matrix.toBuilder().smoothed(false).build();

        NormalizedMatrix bound = NormalizedMatrix.bindRows(List.of(matrix, other));

        assertEquals(6, bound.rowCount());
        assertEquals(List.of(2, 5), bound.failedRows());
        assertEquals(List.of("a", "b", "c", "a", "b", "c"), bound.rowNames());
        assertFalse(bound.smoothed());
        assertArrayEquals(matrix.row(0), bound.row(3));
    }

    @Test
    void testBindRowsRequiresSameLayout() {
        NormalizedMatrix narrower = matrix.subsetColumns(0, 1, 2, 3);

        assertFalse(matrix.sameLayout(narrower));
        assertThrows(IllegalArgumentException.class, () -> NormalizedMatrix.bindRows(List.of(matrix, narrower)));
        assertThrows(IllegalArgumentException.class, () -> NormalizedMatrix.bindRows(List.of()));
    }

    @Test
    void testBindRowsDropsNamesWhenAnyPartIsUnnamed() {
        NormalizedMatrix unnamed = matrix.toBuilder().rowNames(null).build();

        assertNull(NormalizedMatrix.bindRows(List.of(matrix, unnamed)).rowNames());
    }

    // ==================== Description ====================

    @Test
    void testDescribe() {
        String text = matrix.describe();

        assertThat(text)
            .startsWith("Normalize H3K4me3 to genes:")
            .contains("Upstream 10 bp (2 windows)")
            .contains("Downstream 10 bp (2 windows)")
            .contains("Include target regions (1 window)")
            .contains("3 signal regions")
            .contains("Smoothing failed for 1 row");
    }

    @Test
    void testDescribeWithoutTarget() {
        NormalizedMatrix noTarget = matrix.subsetColumns(0, 1, 3, 4);

        assertThat(noTarget.describe()).contains("Not include target regions");
    }
}
