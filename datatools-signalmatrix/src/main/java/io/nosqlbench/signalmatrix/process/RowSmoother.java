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

/// Smooths one matrix row.
///
/// ## Contract
///
/// - The input may contain `NaN` for missing cells and may be modified.
/// - On success, the result holds a vector of the same length.
/// - When the row cannot be smoothed (too few points, a failed fit), return
///   [SmoothingResult#failure(String)] rather than throwing. The caller then keeps
///   the row as it was and reports its index.
///
/// @see LoessRowSmoother
@FunctionalInterface
public interface RowSmoother {

    /// Smooths a row.
    ///
    /// @param row the row values
    /// @return the smoothed row or a failure
    SmoothingResult smooth(double[] row);
}
