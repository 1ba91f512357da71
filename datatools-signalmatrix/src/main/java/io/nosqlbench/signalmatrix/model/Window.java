package io.nosqlbench.signalmatrix.model;

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

/// One sub-interval produced by splitting a region, tagged with the region it
/// came from.
///
/// @param interval the window coordinates; carries the owner's strand
/// @param ownerIndex 1-based position of the owning region in its collection
/// @param windowIndex 1-based left-to-right position within the owner, before any strand flip
public record Window(GenomicInterval interval, int ownerIndex, int windowIndex) {

    public Window {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (ownerIndex < 1) {
            throw new IllegalArgumentException("ownerIndex must be >= 1, got: " + ownerIndex);
        }
        if (windowIndex < 1) {
            throw new IllegalArgumentException("windowIndex must be >= 1, got: " + windowIndex);
        }
    }

    public long width() {
        return interval.width();
    }
}
