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
import io.nosqlbench.signalmatrix.model.ColumnRange;
import io.nosqlbench.signalmatrix.model.NormalizedMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SignalCombinerTest {

    private static final double NaN = Double.NaN;

    private static NormalizedMatrix matrix(String signalName, double[][] values) {
        return NormalizedMatrix.builder()
            .values(values)
            .ranges(new ColumnRange(0, 1), new ColumnRange(1, 2), new ColumnRange(2, 3))
            .extend(100, 100)
            .signalName(signalName)
            .build();
    }

    private final NormalizedMatrix a = matrix("a", new double[][]{{1, 2, NaN}, {4, 5, 6}});
    private final NormalizedMatrix b = matrix("b", new double[][]{{3, 4, NaN}, {NaN, 7, 0}});
    private final NormalizedMatrix c = matrix("c", new double[][]{{8, 0, NaN}, {1, 9, 3}});

    @Test
    void testMeanIgnoresMissing() {
        NormalizedMatrix combined = SignalCombiner.combine(List.of(a, b));

        assertArrayEquals(new double[]{2, 3, NaN}, combined.row(0), 1e-12);
        assertArrayEquals(new double[]{4, 6, 3}, combined.row(1), 1e-12);
    }

    @Test
    void testMedianMaxMin() {
        List<NormalizedMatrix> all = List.of(a, b, c);

        assertArrayEquals(new double[]{3, 2, NaN}, SignalCombiner.combine(all, CellReducer.MEDIAN).row(0), 1e-12);
        assertArrayEquals(new double[]{4, 9, 6}, SignalCombiner.combine(all, CellReducer.MAX).row(1), 1e-12);
        assertArrayEquals(new double[]{1, 5, 0}, SignalCombiner.combine(all, CellReducer.MIN).row(1), 1e-12);
    }

    @Test
    void testMedianOfEvenCountAveragesMiddle() {
        assertEquals(2.5, CellReducer.MEDIAN.reduce(new double[]{4, 1, 3, 2}, 0), 1e-12);
    }

    @Test
    void testReducerSeesRowIndex() {
        CellReducer rowTagged = (values, row) -> row * 100 + values.length;

        NormalizedMatrix combined = SignalCombiner.combine(List.of(a, b, c), rowTagged);

        assertEquals(3.0, combined.get(0, 0));
        assertEquals(103.0, combined.get(1, 2));
    }

    @Test
    void testMetadataFromFirst() {
        NormalizedMatrix combined = SignalCombiner.combine(List.of(b, a));

        assertEquals("b", combined.signalName());
        assertEquals(b.targetRange(), combined.targetRange());
        assertEquals(100, combined.upstreamExtend());
    }

    @Test
    void testShapeMismatchRejected() {
        NormalizedMatrix oneRow = matrix("d", new double[][]{{1, 2, 3}});

        assertThrows(MatrixConfigurationException.class, () -> SignalCombiner.combine(List.of(a, oneRow)));
        assertThrows(MatrixConfigurationException.class, () -> SignalCombiner.combine(List.of(a, a.subsetColumns(0, 1))));
        assertThrows(MatrixConfigurationException.class, () -> SignalCombiner.combine(List.of()));
    }
}
