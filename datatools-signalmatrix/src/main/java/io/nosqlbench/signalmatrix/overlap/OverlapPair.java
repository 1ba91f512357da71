package io.nosqlbench.signalmatrix.overlap;

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

/// One overlapping (query, subject) pair and the extent they share.
///
/// @param queryIndex 0-based index into the query list
/// @param subjectIndex 0-based index into the subject list
/// @param overlapStart first shared base
/// @param overlapEnd last shared base
public record OverlapPair(int queryIndex, int subjectIndex, long overlapStart, long overlapEnd) {

    public OverlapPair {
        if (overlapEnd < overlapStart) {
            throw new IllegalArgumentException("empty overlap [" + overlapStart + ", " + overlapEnd + "]");
        }
    }

    /// Returns the number of shared bases.
    public long overlapWidth() {
        return overlapEnd - overlapStart + 1;
    }
}
