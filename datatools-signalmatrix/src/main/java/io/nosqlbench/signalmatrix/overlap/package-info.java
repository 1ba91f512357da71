/// Overlap search between windows and signals, and per-window aggregation.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.signalmatrix.overlap.IntervalOverlapIndex}: overlap search seam
/// - {@link io.nosqlbench.signalmatrix.overlap.SortedIntervalOverlapIndex}: default sorted-array search
/// - {@link io.nosqlbench.signalmatrix.overlap.OverlapAggregator}: one value per window, by mean mode
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
