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

/// Thrown when a normalization cannot proceed because its parameters or inputs
/// are inconsistent: a missing window width or count, a non-positive width,
/// a negative extension, or a mapping restriction that cannot be resolved.
///
/// No partial result is produced when this is thrown.
public class MatrixConfigurationException extends IllegalArgumentException {

    public MatrixConfigurationException(String message) {
        super(message);
    }

    public MatrixConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
