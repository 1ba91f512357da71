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

import java.util.Objects;

/// Outcome of smoothing one row: either the smoothed values or the reason
/// smoothing was not possible.
///
/// @param values the smoothed row, null on failure
/// @param failureReason why smoothing failed, null on success
public record SmoothingResult(double[] values, String failureReason) {

    public SmoothingResult {
        if ((values == null) == (failureReason == null)) {
            throw new IllegalArgumentException("exactly one of values or failureReason must be set");
        }
    }

    public static SmoothingResult success(double[] values) {
        return new SmoothingResult(Objects.requireNonNull(values, "values cannot be null"), null);
    }

    public static SmoothingResult failure(String reason) {
        return new SmoothingResult(null, reason == null ? "unknown" : reason);
    }

    public boolean isSuccess() {
        return values != null;
    }
}
