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

import java.util.Optional;

/// A parameter value after validation, with the warning raised if the value
/// had to be corrected.
///
/// @param value the value to use
/// @param warning the diagnostic describing the correction, absent when the input was used as given
/// @param <T> the parameter type
public record Adjusted<T>(T value, Optional<String> warning) {

    public Adjusted {
        warning = warning == null ? Optional.empty() : warning;
    }

    /// The input was acceptable as given.
    public static <T> Adjusted<T> unchanged(T value) {
        return new Adjusted<>(value, Optional.empty());
    }

    /// The input was replaced by `value`; `warning` says why.
    public static <T> Adjusted<T> corrected(T value, String warning) {
        return new Adjusted<>(value, Optional.of(warning));
    }

    public boolean wasCorrected() {
        return warning.isPresent();
    }
}
