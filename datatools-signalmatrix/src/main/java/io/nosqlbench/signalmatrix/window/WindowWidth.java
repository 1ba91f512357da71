package io.nosqlbench.signalmatrix.window;

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
import io.nosqlbench.signalmatrix.config.Adjusted;

/// A window width, either an absolute number of base pairs or a fraction of
/// each region's own width.
///
/// Use [#parse(double)] to turn a raw configuration value into a width; it
/// truncates non-integral absolute widths with a warning rather than failing.
public final class WindowWidth {

    private final boolean relative;
    private final long basePairs;
    private final double fraction;

    private WindowWidth(boolean relative, long basePairs, double fraction) {
        this.relative = relative;
        this.basePairs = basePairs;
        this.fraction = fraction;
    }

    /// Creates an absolute width.
    ///
    /// @param basePairs window length, at least 1
    public static WindowWidth absolute(long basePairs) {
        if (basePairs < 1) {
            throw new MatrixConfigurationException("absolute window width must be >= 1, got: " + basePairs);
        }
        return new WindowWidth(false, basePairs, Double.NaN);
    }

    /// Creates a width relative to each region.
    ///
    /// @param fraction a value in (0, 1)
    public static WindowWidth relative(double fraction) {
        if (!(fraction > 0 && fraction < 1)) {
            throw new MatrixConfigurationException("relative window width must be in (0, 1), got: " + fraction);
        }
        return new WindowWidth(true, 0, fraction);
    }

    /// Interprets a raw width: values in (0, 1) are relative, values >= 1 are
    /// absolute and truncated to an integer.
    ///
    /// @throws MatrixConfigurationException if `w` is not positive or not finite
    public static Adjusted<WindowWidth> parse(double w) {
        if (Double.isNaN(w) || Double.isInfinite(w) || w <= 0) {
            throw new MatrixConfigurationException("`w` is wrong: window width must be positive, got: " + w);
        }
        if (w < 1) {
            return Adjusted.unchanged(relative(w));
        }
        long truncated = (long) w;
        if (truncated != w) {
            return Adjusted.corrected(absolute(truncated),
                "Window width " + w + " is not an integer, truncated to " + truncated + ".");
        }
        return Adjusted.unchanged(absolute(truncated));
    }

    public boolean isRelative() {
        return relative;
    }

    /// Returns the absolute width in base pairs; only meaningful when not relative.
    public long basePairs() {
        return basePairs;
    }

    public double fraction() {
        return fraction;
    }

    /// Returns the window length to use for a region of the given width.
    /// Relative widths drop the fractional base and never go below 1.
    public long resolve(long regionWidth) {
        if (!relative) {
            return basePairs;
        }
        return Math.max(1L, (long) (regionWidth * fraction));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WindowWidth)) return false;
        WindowWidth that = (WindowWidth) o;
        return relative == that.relative
            && basePairs == that.basePairs
            && Double.compare(fraction, that.fraction) == 0;
    }

    @Override
    public int hashCode() {
        return relative ? Double.hashCode(fraction) : Long.hashCode(basePairs);
    }

    @Override
    public String toString() {
        return relative ? (fraction * 100) + "%" : basePairs + "bp";
    }
}
