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

/// A half-open, 0-based range of matrix columns `[from, to)`.
///
/// @param from first column, inclusive
/// @param to end column, exclusive
public record ColumnRange(int from, int to) {

    public ColumnRange {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("invalid column range [" + from + ", " + to + ")");
        }
    }

    public static ColumnRange empty(int at) {
        return new ColumnRange(at, at);
    }

    /// Creates the range of `size` columns starting at `from`.
    public static ColumnRange ofSize(int from, int size) {
        return new ColumnRange(from, from + size);
    }

    public int size() {
        return to - from;
    }

    public boolean isEmpty() {
        return to == from;
    }

    public boolean contains(int column) {
        return column >= from && column < to;
    }

    /// Returns the 1-based column numbers of this range, empty when the range is empty.
    public int[] indices() {
        int[] result = new int[size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = from + i + 1;
        }
        return result;
    }
}
