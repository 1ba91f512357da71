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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/// The regions to analyze, in output row order.
///
/// Names are optional. When present there is one per region; they label the
/// matrix rows and are what a textual mapping restriction compares against.
public final class TargetCollection {

    private final List<GenomicInterval> intervals;
    private final List<String> names;

    private TargetCollection(List<GenomicInterval> intervals, List<String> names) {
        Objects.requireNonNull(intervals, "intervals cannot be null");
        this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
        if (names != null) {
            if (names.size() != intervals.size()) {
                throw new IllegalArgumentException("got " + names.size() + " names for "
                    + intervals.size() + " target regions");
            }
            this.names = Collections.unmodifiableList(new ArrayList<>(names));
        } else {
            this.names = null;
        }
    }

    public static TargetCollection of(List<GenomicInterval> intervals) {
        return new TargetCollection(intervals, null);
    }

    public static TargetCollection of(List<GenomicInterval> intervals, List<String> names) {
        Objects.requireNonNull(names, "names cannot be null");
        return new TargetCollection(intervals, names);
    }

    public static TargetCollection of(GenomicInterval... intervals) {
        return new TargetCollection(List.of(intervals), null);
    }

    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public GenomicInterval interval(int index) {
        return intervals.get(index);
    }

    public List<GenomicInterval> intervals() {
        return intervals;
    }

    public boolean hasNames() {
        return names != null;
    }

    /// Returns the region names, or null when the regions are unnamed.
    public List<String> names() {
        return names;
    }

    /// Returns the name of the region at 0-based `index`, or null when unnamed.
    public String name(int index) {
        return names == null ? null : names.get(index);
    }

    /// Returns true when every region has width at most 1.
    public boolean allSinglePoint() {
        for (GenomicInterval interval : intervals) {
            if (interval.width() > 1) {
                return false;
            }
        }
        return true;
    }

    public boolean anyWiderThanOne() {
        return !intervals.isEmpty() && !allSinglePoint();
    }

    /// Returns the smallest region width, or 0 for an empty collection.
    public long minWidth() {
        long min = Long.MAX_VALUE;
        for (GenomicInterval interval : intervals) {
            min = Math.min(min, interval.width());
        }
        return intervals.isEmpty() ? 0 : min;
    }

    /// Returns a collection of the regions transformed by `mapper`, keeping names.
    public TargetCollection mapIntervals(UnaryOperator<GenomicInterval> mapper) {
        List<GenomicInterval> mapped = new ArrayList<>(intervals.size());
        for (GenomicInterval interval : intervals) {
            mapped.add(mapper.apply(interval));
        }
        return new TargetCollection(mapped, names);
    }
}
