package io.nosqlbench.signalmatrix;

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

/// Exception thrown when target regions produced different numbers of windows,
/// so their rows cannot share one set of matrix columns.
public class ColumnCountMismatchException extends MatrixConfigurationException {

    private final int ownerIndex;
    private final int expectedColumns;
    private final int actualColumns;

    public ColumnCountMismatchException(int ownerIndex, int expectedColumns, int actualColumns) {
        super(String.format("Numbers of columns are not the same: region %d produced %d windows, expected %d.",
              ownerIndex, actualColumns, expectedColumns));
        this.ownerIndex = ownerIndex;
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }

    /// Returns the 1-based index of the first region whose window count differed.
    public int getOwnerIndex() {
        return ownerIndex;
    }

    public int getExpectedColumns() {
        return expectedColumns;
    }

    public int getActualColumns() {
        return actualColumns;
    }
}
