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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Default row smoother: local regression over the non-missing cells.
///
/// ## Fitting
///
/// ```
/// row ──► finite points (x = column, y = value)
///             │
///             ├── LOESS, primary bandwidth ──ok──► fitted points
///             │        │ failed / non-finite
///             │        ▼
///             └── LOESS, fallback bandwidth ──ok──► fitted points
///                      │ failed
///                      ▼
///                   failure
///
/// fitted points ──► linear interpolation at missing columns,
///                   constant beyond the first and last point
/// ```
///
/// Rows with fewer than two finite cells fail.
public final class LoessRowSmoother implements RowSmoother {

    private static final Logger logger = LogManager.getLogger(LoessRowSmoother.class);

    public static final double DEFAULT_BANDWIDTH = 0.3;
    public static final double DEFAULT_FALLBACK_BANDWIDTH = 0.75;

    private final double bandwidth;
    private final double fallbackBandwidth;
    private final int robustnessIterations;

    public LoessRowSmoother() {
        this(DEFAULT_BANDWIDTH, DEFAULT_FALLBACK_BANDWIDTH, 0);
    }

    /// @param bandwidth fraction of points used for each local fit, in (0, 1]
    /// @param fallbackBandwidth bandwidth tried when the first fit fails, in (0, 1]
    /// @param robustnessIterations robustness iterations for each fit
    public LoessRowSmoother(double bandwidth, double fallbackBandwidth, int robustnessIterations) {
        checkBandwidth(bandwidth);
        checkBandwidth(fallbackBandwidth);
        if (robustnessIterations < 0) {
            throw new IllegalArgumentException("robustnessIterations cannot be negative");
        }
        this.bandwidth = bandwidth;
        this.fallbackBandwidth = fallbackBandwidth;
        this.robustnessIterations = robustnessIterations;
    }

    private static void checkBandwidth(double b) {
        if (!(b > 0 && b <= 1)) {
            throw new IllegalArgumentException("bandwidth must be in (0, 1], got: " + b);
        }
    }

    @Override
    public SmoothingResult smooth(double[] row) {
        int finite = 0;
        for (double v : row) {
            if (Double.isFinite(v)) finite++;
        }
        if (finite < 2) {
            return SmoothingResult.failure("Too few data points.");
        }
        double[] x = new double[finite];
        double[] y = new double[finite];
        int j = 0;
        for (int i = 0; i < row.length; i++) {
            if (Double.isFinite(row[i])) {
                x[j] = i + 1;
                y[j] = row[i];
                j++;
            }
        }

        double[] fitted = fit(x, y, bandwidth);
        if (fitted == null) {
            logger.trace("Primary fit failed for row of {} points, trying bandwidth {}", finite, fallbackBandwidth);
            fitted = fit(x, y, fallbackBandwidth);
        }
        if (fitted == null) {
            return SmoothingResult.failure("error when doing loess smoothing");
        }
        return SmoothingResult.success(fill(row.length, x, fitted));
    }

    private double[] fit(double[] x, double[] y, double bw) {
        try {
            double[] fitted = new LoessInterpolator(bw, robustnessIterations).smooth(x, y);
            for (double v : fitted) {
                if (!Double.isFinite(v)) {
                    return null;
                }
            }
            return fitted;
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            logger.trace("LOESS fit with bandwidth {} failed: {}", bw, e.getMessage());
            return null;
        }
    }

    private static double[] fill(int length, double[] x, double[] fitted) {
        double[] out = new double[length];
        PolynomialSplineFunction line = new LinearInterpolator().interpolate(x, fitted);
        double first = x[0];
        double last = x[x.length - 1];
        for (int i = 0; i < length; i++) {
            double pos = i + 1;
            if (pos <= first) {
                out[i] = fitted[0];
            } else if (pos >= last) {
                out[i] = fitted[fitted.length - 1];
            } else {
                out[i] = line.value(pos);
            }
        }
        return out;
    }
}
