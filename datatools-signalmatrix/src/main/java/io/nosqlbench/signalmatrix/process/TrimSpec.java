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

import io.nosqlbench.signalmatrix.MatrixConfigurationException;

/// Fractions of extreme values to clip at each end of the value distribution.
///
/// `TrimSpec(0.01, 0.01)` clips values below the 1st percentile and above the
/// 99th percentile.
///
/// @param low fraction clipped at the low end, in [0, 1)
/// @param high fraction clipped at the high end, in [0, 1)
public record TrimSpec(double low, double high) {

    /// No trimming.
    public static final TrimSpec NONE = new TrimSpec(0, 0);

    public TrimSpec {
        if (!(low >= 0 && low < 1) || !(high >= 0 && high < 1)) {
            throw new MatrixConfigurationException("trim fractions must be in [0, 1), got [" + low + ", " + high + "]");
        }
        if (low + high >= 1) {
            throw new MatrixConfigurationException("trim fractions must sum to less than 1, got [" + low + ", " + high + "]");
        }
    }

    /// Uses the same fraction at both ends.
    public static TrimSpec of(double both) {
        return new TrimSpec(both, both);
    }

    public static TrimSpec of(double low, double high) {
        return new TrimSpec(low, high);
    }

    public boolean isNone() {
        return low == 0 && high == 0;
    }
}
