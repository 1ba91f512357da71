package io.nosqlbench.signalmatrix.overlap;

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

import io.nosqlbench.signalmatrix.model.GenomicInterval;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Overlap join over start-sorted subject arrays.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * Per sequence:
 *   1. Sort subjects by start; keep maxEnd[j] = max(end[0..j])
 *   2. For each query [qs, qe]:
 *      a. Binary search the last subject with start <= qe
 *      b. Walk left while maxEnd[j] >= qs, reporting subjects with end >= qs
 * }</pre>
 *
 * <p>Sorting costs O(m log m) for m subjects and each query O(log m) plus the
 * subjects walked. For windows, which rarely nest, the walk touches little
 * more than the reported pairs, so the join is O((n + m) log m + pairs).
 *
 * <p>Pairs are returned grouped by query index, ascending, and within one
 * query by subject start. Zero-width intervals overlap nothing.
 */
public final class SortedIntervalOverlapIndex implements IntervalOverlapIndex {

    @Override
    public List<OverlapPair> findOverlaps(List<GenomicInterval> query, List<GenomicInterval> subject) {
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(subject, "subject cannot be null");

        Map<String, SequenceIndex> bySeq = buildIndex(subject);
        List<OverlapPair> pairs = new ArrayList<>();
        List<OverlapPair> scratch = new ArrayList<>();

        for (int q = 0; q < query.size(); q++) {
            GenomicInterval qi = query.get(q);
            SequenceIndex index = bySeq.get(qi.seqId());
            if (index == null || qi.width() < 1) {
                continue;
            }
            scratch.clear();
            int last = index.lastStartingAtOrBefore(qi.end());
            for (int j = last; j >= 0 && index.maxEnd[j] >= qi.start(); j--) {
                if (index.ends[j] >= qi.start()) {
                    long lo = Math.max(qi.start(), index.starts[j]);
                    long hi = Math.min(qi.end(), index.ends[j]);
                    scratch.add(new OverlapPair(q, index.original[j], lo, hi));
                }
            }
            for (int i = scratch.size() - 1; i >= 0; i--) {
                pairs.add(scratch.get(i));
            }
        }
        return pairs;
    }

    private static Map<String, SequenceIndex> buildIndex(List<GenomicInterval> subject) {
        Map<String, List<Integer>> grouped = new HashMap<>();
        for (int i = 0; i < subject.size(); i++) {
            if (subject.get(i).width() < 1) {
                continue;
            }
            grouped.computeIfAbsent(subject.get(i).seqId(), k -> new ArrayList<>()).add(i);
        }
        Map<String, SequenceIndex> index = new HashMap<>();
        for (Map.Entry<String, List<Integer>> e : grouped.entrySet()) {
            index.put(e.getKey(), new SequenceIndex(subject, e.getValue()));
        }
        return index;
    }

    private static final class SequenceIndex {
        final int[] original;
        final long[] starts;
        final long[] ends;
        final long[] maxEnd;

        SequenceIndex(List<GenomicInterval> subject, List<Integer> members) {
            Integer[] order = members.toArray(new Integer[0]);
            Arrays.sort(order, Comparator.comparingLong((Integer i) -> subject.get(i).start())
                .thenComparingInt(i -> i));
            int n = order.length;
            original = new int[n];
            starts = new long[n];
            ends = new long[n];
            maxEnd = new long[n];
            long running = Long.MIN_VALUE;
            for (int j = 0; j < n; j++) {
                GenomicInterval gi = subject.get(order[j]);
                original[j] = order[j];
                starts[j] = gi.start();
                ends[j] = gi.end();
                running = Math.max(running, gi.end());
                maxEnd[j] = running;
            }
        }

        /// Returns the largest j with starts[j] <= pos, or -1.
        int lastStartingAtOrBefore(long pos) {
            int lo = 0;
            int hi = starts.length;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (starts[mid] <= pos) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo - 1;
        }
    }
}
