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

import java.util.List;

/// Post-processed matrix values and the rows smoothing could not handle.
///
/// @param values the finished values, same shape as the input
/// @param failedRows 1-based indices of rows where smoothing failed, ascending
public record PostProcessResult(double[][] values, List<Integer> failedRows) {

    public PostProcessResult {
        failedRows = List.copyOf(failedRows);
    }
}
