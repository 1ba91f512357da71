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

/// A closed genomic interval `[start, end]` on one sequence, using 1-based
/// coordinates as is conventional for genome annotations.
///
/// A width of zero (`end == start - 1`) is representable so that empty flanks
/// can be described, but such intervals cannot be split into windows.
///
/// @param seqId the sequence (chromosome) identifier
/// @param start the first base, inclusive
/// @param end the last base, inclusive
/// @param strand the strand
public record GenomicInterval(String seqId, long start, long end, Strand strand) {

    public GenomicInterval {
        Objects.requireNonNull(seqId, "seqId cannot be null");
        Objects.requireNonNull(strand, "strand cannot be null");
        if (end < start - 1) {
            throw new IllegalArgumentException(
                "end must not precede start - 1, got [" + start + ", " + end + "]");
        }
    }

    /// Creates an unstranded interval.
    public static GenomicInterval of(String seqId, long start, long end) {
        return new GenomicInterval(seqId, start, end, Strand.UNSTRANDED);
    }

    public static GenomicInterval of(String seqId, long start, long end, Strand strand) {
        return new GenomicInterval(seqId, start, end, strand);
    }

    /// Returns the number of bases covered, `end - start + 1`.
    public long width() {
        return end - start + 1;
    }

    /// Returns a copy with the given strand.
    public GenomicInterval withStrand(Strand newStrand) {
        return newStrand == strand ? this : new GenomicInterval(seqId, start, end, newStrand);
    }

    /// Returns true if this interval shares at least one base with `other`.
    /// Strand is not considered.
    public boolean overlaps(GenomicInterval other) {
        return seqId.equals(other.seqId) && start <= other.end && other.start <= end;
    }

    /// Returns the number of shared bases with `other`, or 0 when disjoint.
    public long overlapWidth(GenomicInterval other) {
        if (!seqId.equals(other.seqId)) {
            return 0;
        }
        long lo = Math.max(start, other.start);
        long hi = Math.min(end, other.end);
        return hi >= lo ? hi - lo + 1 : 0;
    }

    @Override
    public String toString() {
        return seqId + ":" + start + "-" + end + "(" + strand.symbol() + ")";
    }
}
