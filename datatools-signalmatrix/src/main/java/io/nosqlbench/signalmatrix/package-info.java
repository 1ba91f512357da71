/// Normalizes genomic signals around target regions into a heatmap matrix.
///
/// Start with {@link io.nosqlbench.signalmatrix.MatrixOrchestrator#normalizeToMatrix}.
/// Sub-packages hold the stages it runs:
///
/// - `window`: splitting regions into windows
/// - `overlap`: summarizing overlapping signal per window
/// - `assemble`: placing window values into rows and columns
/// - `process`: smoothing and trimming
/// - `combine`: merging matrices normalized against the same targets
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
