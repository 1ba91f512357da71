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
import io.nosqlbench.signalmatrix.model.MeanMode;
import io.nosqlbench.signalmatrix.process.LoessRowSmoother;
import io.nosqlbench.signalmatrix.process.RowSmoother;
import io.nosqlbench.signalmatrix.process.TrimSpec;

import java.util.Objects;

/// Options for normalizing signals to a matrix.
///
/// # Overview
///
/// Several options default to values that depend on the targets or on other
/// options. Those are held as `null` here and resolved when the matrix is built:
/// - **windowWidth**: `max(extend) / 50`
/// - **emptyValue**: `NaN` when smoothing, `0` otherwise
/// - **includeTarget**: true when any target is wider than one base
/// - **targetRatio**: `1` when both extensions are 0, `0.1` otherwise
/// - **k**: `min(20, narrowest target width)`
///
/// # Usage
///
/// ```java
/// NormalizeOptions options = NormalizeOptions.builder()
///     .extend(3000, 2000)
///     .windowWidth(50)
///     .valueColumn("score")
///     .meanMode(MeanMode.WEIGHTED)
///     .smooth(true)
///     .build();
///
/// NormalizedMatrix m = MatrixOrchestrator.normalizeToMatrix(signals, targets, options);
/// ```
///
/// @see NormalizeOptionsConfig
public final class NormalizeOptions {

    public static final long DEFAULT_EXTEND = 5000L;
    public static final double DEFAULT_TARGET_RATIO = 0.1;
    public static final int DEFAULT_MAX_TARGET_WINDOWS = 20;
    public static final int WIDTH_DIVISOR = 50;

    private final long upstreamExtend;
    private final long downstreamExtend;
    private final Double windowWidth;
    private final String valueColumn;
    private final String mappingColumn;
    private final Double emptyValue;
    private final MeanMode meanMode;
    private final Boolean includeTarget;
    private final Double targetRatio;
    private final Integer k;
    private final boolean smooth;
    private final RowSmoother smoother;
    private final TrimSpec trim;
    private final boolean parallel;
    private final String signalName;
    private final String targetName;

    private NormalizeOptions(Builder builder) {
        this.upstreamExtend = builder.upstreamExtend;
        this.downstreamExtend = builder.downstreamExtend;
        this.windowWidth = builder.windowWidth;
        this.valueColumn = builder.valueColumn;
        this.mappingColumn = builder.mappingColumn;
        this.emptyValue = builder.emptyValue;
        this.meanMode = builder.meanMode;
        this.includeTarget = builder.includeTarget;
        this.targetRatio = builder.targetRatio;
        this.k = builder.k;
        this.smooth = builder.smooth;
        this.smoother = builder.smoother;
        this.trim = builder.trim;
        this.parallel = builder.parallel;
        this.signalName = builder.signalName;
        this.targetName = builder.targetName;
    }

    public long upstreamExtend() {
        return upstreamExtend;
    }

    public long downstreamExtend() {
        return downstreamExtend;
    }

    /// Returns the window width as given: at least 1 for base pairs, in (0, 1)
    /// for a fraction of each region, or `null` for the default.
    ///
    /// @return the window width, or null
    public Double windowWidth() {
        return windowWidth;
    }

    /// Returns the window width, falling back to `max(extend) / 50`.
    ///
    /// The fallback is a whole number of bases when the longer extension is at
    /// least 50 bp. Below that it stays fractional and is read as a relative width.
    ///
    /// @return the window width, or null when both extensions are 0
    public Double effectiveWindowWidth() {
        if (windowWidth != null) {
            return windowWidth;
        }
        long max = Math.max(upstreamExtend, downstreamExtend);
        if (max <= 0) {
            return null;
        }
        if (max >= WIDTH_DIVISOR) {
            return (double) (max / WIDTH_DIVISOR);
        }
        return (double) max / WIDTH_DIVISOR;
    }

    public String valueColumn() {
        return valueColumn;
    }

    public String mappingColumn() {
        return mappingColumn;
    }

    public Double emptyValue() {
        return emptyValue;
    }

    /// Returns the empty value, falling back to `NaN` when smoothing and `0` otherwise.
    public double effectiveEmptyValue() {
        if (emptyValue != null) {
            return emptyValue;
        }
        return smooth ? Double.NaN : 0.0;
    }

    public MeanMode meanMode() {
        return meanMode;
    }

    public Boolean includeTarget() {
        return includeTarget;
    }

    public Double targetRatio() {
        return targetRatio;
    }

    /// Returns the target ratio, falling back to `1` for zero extension and `0.1` otherwise.
    public double effectiveTargetRatio() {
        if (targetRatio != null) {
            return targetRatio;
        }
        return upstreamExtend == 0 && downstreamExtend == 0 ? 1.0 : DEFAULT_TARGET_RATIO;
    }

    public Integer k() {
        return k;
    }

    public boolean smooth() {
        return smooth;
    }

    public RowSmoother smoother() {
        return smoother;
    }

    public TrimSpec trim() {
        return trim;
    }

    /// Returns whether rows are smoothed concurrently.
    public boolean parallel() {
        return parallel;
    }

    public String signalName() {
        return signalName;
    }

    public String targetName() {
        return targetName;
    }

    /// Returns the default options.
    ///
    /// @return options with 5000 bp on both sides and all other values defaulted
    public static NormalizeOptions defaults() {
        return new Builder().build();
    }

    /// Returns a new builder.
    ///
    /// @return a new builder instance
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with these options' values.
    ///
    /// @return a builder pre-populated with current values
    public Builder toBuilder() {
        return new Builder()
            .extend(this.upstreamExtend, this.downstreamExtend)
            .windowWidth(this.windowWidth)
            .valueColumn(this.valueColumn)
            .mappingColumn(this.mappingColumn)
            .emptyValue(this.emptyValue)
            .meanMode(this.meanMode)
            .includeTarget(this.includeTarget)
            .targetRatio(this.targetRatio)
            .k(this.k)
            .smooth(this.smooth)
            .smoother(this.smoother)
            .trim(this.trim)
            .parallel(this.parallel)
            .signalName(this.signalName)
            .targetName(this.targetName);
    }

    @Override
    public String toString() {
        return "NormalizeOptions{" +
            "extend=[" + upstreamExtend + ", " + downstreamExtend + "]" +
            ", windowWidth=" + windowWidth +
            ", valueColumn=" + valueColumn +
            ", mappingColumn=" + mappingColumn +
            ", emptyValue=" + emptyValue +
            ", meanMode=" + meanMode +
            ", includeTarget=" + includeTarget +
            ", targetRatio=" + targetRatio +
            ", k=" + k +
            ", smooth=" + smooth +
            ", trim=" + trim +
            ", parallel=" + parallel +
            '}';
    }

    /// Builder for NormalizeOptions.
    public static final class Builder {
        private long upstreamExtend = DEFAULT_EXTEND;
        private long downstreamExtend = DEFAULT_EXTEND;
        private Double windowWidth;
        private String valueColumn;
        private String mappingColumn;
        private Double emptyValue;
        private MeanMode meanMode = MeanMode.ABSOLUTE;
        private Boolean includeTarget;
        private Double targetRatio;
        private Integer k;
        private boolean smooth = false;
        private RowSmoother smoother = new LoessRowSmoother();
        private TrimSpec trim = TrimSpec.NONE;
        private boolean parallel = false;
        private String signalName;
        private String targetName;

        Builder() {
        }

        /// Sets the same extension on both sides.
        ///
        /// @param extend bases to extend upstream and downstream
        /// @return this builder
        public Builder extend(long extend) {
            return extend(extend, extend);
        }

        /// Sets the upstream and downstream extensions.
        ///
        /// @return this builder
        /// @throws MatrixConfigurationException if either side is negative
        public Builder extend(long upstream, long downstream) {
            ParameterChecks.requireNonNegativeExtend(upstream, downstream);
            this.upstreamExtend = upstream;
            this.downstreamExtend = downstream;
            return this;
        }

        /// Sets the window width; `null` restores the default.
        ///
        /// @param w bases per window (>= 1), or a fraction of each region in (0, 1)
        /// @return this builder
        public Builder windowWidth(Double w) {
            this.windowWidth = w;
            return this;
        }

        public Builder windowWidth(double w) {
            return windowWidth(Double.valueOf(w));
        }

        /// Sets the numeric signal column; `null` counts each signal as 1.
        public Builder valueColumn(String valueColumn) {
            this.valueColumn = valueColumn;
            return this;
        }

        /// Sets the signal column that restricts which target a signal maps to.
        public Builder mappingColumn(String mappingColumn) {
            this.mappingColumn = mappingColumn;
            return this;
        }

        public Builder emptyValue(Double emptyValue) {
            this.emptyValue = emptyValue;
            return this;
        }

        public Builder emptyValue(double emptyValue) {
            return emptyValue(Double.valueOf(emptyValue));
        }

        public Builder meanMode(MeanMode meanMode) {
            this.meanMode = Objects.requireNonNull(meanMode, "meanMode cannot be null");
            return this;
        }

        public Builder includeTarget(Boolean includeTarget) {
            this.includeTarget = includeTarget;
            return this;
        }

        public Builder includeTarget(boolean includeTarget) {
            return includeTarget(Boolean.valueOf(includeTarget));
        }

        public Builder targetRatio(Double targetRatio) {
            this.targetRatio = targetRatio;
            return this;
        }

        public Builder targetRatio(double targetRatio) {
            return targetRatio(Double.valueOf(targetRatio));
        }

        /// Sets the number of target windows used when there is no extension.
        ///
        /// @param k window count (must be >= 1), or null for the default
        /// @return this builder
        /// @throws MatrixConfigurationException if k < 1
        public Builder k(Integer k) {
            if (k != null && k < 1) {
                throw new MatrixConfigurationException("`k` must be >= 1, got: " + k);
            }
            this.k = k;
            return this;
        }

        public Builder k(int k) {
            return k(Integer.valueOf(k));
        }

        public Builder smooth(boolean smooth) {
            this.smooth = smooth;
            return this;
        }

        public Builder smoother(RowSmoother smoother) {
            this.smoother = Objects.requireNonNull(smoother, "smoother cannot be null");
            return this;
        }

        public Builder trim(TrimSpec trim) {
            this.trim = Objects.requireNonNull(trim, "trim cannot be null");
            return this;
        }

        /// Sets symmetric trimming.
        public Builder trim(double fraction) {
            return trim(TrimSpec.of(fraction));
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder signalName(String signalName) {
            this.signalName = signalName;
            return this;
        }

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        /// Builds the NormalizeOptions.
        ///
        /// @return the configured options
        public NormalizeOptions build() {
            return new NormalizeOptions(this);
        }
    }
}
