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

import io.nosqlbench.signalmatrix.model.GenomicInterval;

import java.util.List;

/// Finds all overlapping pairs between two interval lists.
///
/// ## Contract
///
/// - Two intervals overlap when they are on the same sequence and share at
///   least one base. Strand is never considered.
/// - The join is many-to-many: every overlapping pair is reported once.
/// - Inputs are not modified.
///
/// [SortedIntervalOverlapIndex] is the default implementation. Any other
/// index meeting the contract can be passed to the aggregator instead.
public interface IntervalOverlapIndex {

    /// Returns every overlapping (query, subject) pair with its shared extent.
    ///
    /// @param query the first interval list (signals)
    /// @param subject the second interval list (windows)
    /// @return all overlapping pairs
    List<OverlapPair> findOverlaps(List<GenomicInterval> query, List<GenomicInterval> subject);
}
