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

import io.nosqlbench.signalmatrix.model.ColumnRange;

/// The concatenated upstream, target and downstream blocks with the column
/// range each occupies.
///
/// @param values row-major values, `rows x (upstream + target + downstream)` columns
/// @param upstream the upstream columns
/// @param target the target body columns
/// @param downstream the downstream columns
public record AssembledMatrix(double[][] values, ColumnRange upstream, ColumnRange target, ColumnRange downstream) {

    public int rows() {
        return values.length;
    }

    public int columns() {
        return downstream.to();
    }
}
