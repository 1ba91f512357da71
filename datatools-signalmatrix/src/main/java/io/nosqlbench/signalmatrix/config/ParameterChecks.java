package io.nosqlbench.signalmatrix.config;

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

import io.nosqlbench.signalmatrix.MatrixConfigurationException;

/// Validation steps that correct inconsistent parameters instead of failing.
///
/// Each returns the value to use plus, when a correction was made, a warning
/// for the caller to surface. Hard errors throw [MatrixConfigurationException].
public final class ParameterChecks {

    /// Tolerance for treating a target ratio as exactly 1.
    public static final double RATIO_EPSILON = 1e-6;

    private ParameterChecks() {
    }

    /// Extension lengths and target ratio after reconciliation.
    ///
    /// @param upstream upstream extension in bp
    /// @param downstream downstream extension in bp
    /// @param targetRatio fraction of columns given to the target body
    public record ExtendSettings(long upstream, long downstream, double targetRatio) {

        public boolean isZero() {
            return upstream == 0 && downstream == 0;
        }
    }

    /// Rejects negative extensions.
    ///
    /// @throws MatrixConfigurationException if either side is negative
    public static void requireNonNegativeExtend(long upstream, long downstream) {
        if (upstream < 0 || downstream < 0) {
            throw new MatrixConfigurationException("`extend` cannot be negative, got [" + upstream + ", " + downstream + "]");
        }
    }

    /// Makes extension and target ratio agree.
    ///
    /// - A ratio of 1 (or more in magnitude) leaves no room for flanks, so the
    ///   extension is reset to 0.
    /// - With no extension there is nothing but target, so the ratio is reset to 1.
    ///
    /// @throws MatrixConfigurationException if the ratio is negative or not a number
    public static Adjusted<ExtendSettings> reconcileExtendAndRatio(long upstream, long downstream, double targetRatio) {
        requireNonNegativeExtend(upstream, downstream);
        if (Double.isNaN(targetRatio) || targetRatio < 0 && targetRatio > -1) {
            throw new MatrixConfigurationException("`target_ratio` must be in [0, 1], got: " + targetRatio);
        }
        boolean zeroExtend = upstream == 0 && downstream == 0;
        if (Math.abs(targetRatio - 1) < RATIO_EPSILON || Math.abs(targetRatio) >= 1) {
            ExtendSettings settings = new ExtendSettings(0, 0, 1.0);
            if (!zeroExtend) {
                return Adjusted.corrected(settings,
                    "Reset `extend` to 0 when `target_ratio` is larger than or equal to 1.");
            }
            return Adjusted.unchanged(settings);
        }
        if (zeroExtend) {
            return Adjusted.corrected(new ExtendSettings(0, 0, 1.0),
                "Reset `target_ratio` to 1 when `extend` is 0.");
        }
        return Adjusted.unchanged(new ExtendSettings(upstream, downstream, targetRatio));
    }

    /// Single-point targets have no body to show, so including them is switched off.
    public static Adjusted<Boolean> resolveIncludeTarget(boolean requested, boolean targetIsSinglePoint) {
        if (!targetIsSinglePoint) {
            return Adjusted.unchanged(requested);
        }
        if (requested) {
            return Adjusted.corrected(false, "Width of `target` are all 1, `include_target` is set to `FALSE`.");
        }
        return Adjusted.unchanged(false);
    }

    /// Rounds an extension down to a whole number of windows.
    ///
    /// @param extend extension in bp, non-negative
    /// @param windowWidth absolute window width in bp
    /// @param side "upstream" or "downstream", used in the warning
    public static Adjusted<Long> roundExtendToWidth(long extend, long windowWidth, String side) {
        if (windowWidth < 1) {
            throw new MatrixConfigurationException("window width must be >= 1, got: " + windowWidth);
        }
        if (extend <= 0) {
            return Adjusted.unchanged(extend);
        }
        long remainder = extend % windowWidth;
        if (remainder == 0) {
            return Adjusted.unchanged(extend);
        }
        long rounded = extend - remainder;
        return Adjusted.corrected(rounded, "Length of " + side + " extension (" + extend
            + ") is not completely divisible by `w` (" + windowWidth + "), reduced to " + rounded + ".");
    }

    /// Computes how many target windows keep the target at `targetRatio` of the
    /// total width: `round(flankColumns * r / (1 - r))` with ties to even, at least 1.
    public static int targetWindowCount(int flankColumns, double targetRatio) {
        if (targetRatio >= 1) {
            throw new MatrixConfigurationException("target window count is undefined for target_ratio >= 1");
        }
        long k = (long) Math.rint(flankColumns * targetRatio / (1 - targetRatio));
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, k));
    }
}
