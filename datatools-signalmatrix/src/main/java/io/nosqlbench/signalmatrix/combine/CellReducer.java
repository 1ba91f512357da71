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

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.function.Function;

/// Reduces the values of one cell, taken across several matrices, to one value.
///
/// The built-in reducers skip `NaN` and return `NaN` when nothing is left.
@FunctionalInterface
public interface CellReducer {

    /// Mean of the non-missing values.
    CellReducer MEAN = ignoringNaN(DescriptiveStatistics::getMean);

    /// Median of the non-missing values.
    CellReducer MEDIAN = ignoringNaN(s -> s.getPercentile(50));

    CellReducer MAX = ignoringNaN(DescriptiveStatistics::getMax);

    CellReducer MIN = ignoringNaN(DescriptiveStatistics::getMin);

    /// @param values the cell's value in each input, in input order
    /// @param row the 0-based row of the cell
    /// @return the combined value
    double reduce(double[] values, int row);

    /// Wraps a statistic so that it only sees non-missing values.
    static CellReducer ignoringNaN(Function<DescriptiveStatistics, Double> statistic) {
        return (values, row) -> {
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (double v : values) {
                if (!Double.isNaN(v)) {
                    stats.addValue(v);
                }
            }
            return stats.getN() == 0 ? Double.NaN : statistic.apply(stats);
        };
    }
}
