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
import io.nosqlbench.signalmatrix.model.GenomicInterval;
import io.nosqlbench.signalmatrix.model.Window;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Splits regions into ordered, non-overlapping windows.
 *
 * <h2>Splitting Modes</h2>
 *
 * <ul>
 *   <li><b>By count</b> - exactly {@code k} windows of near-equal size. The
 *       {@code k + 1} boundaries are spaced evenly over {@code [start, end]} and
 *       rounded half to even; the first window starts at {@code start} and the
 *       last one ends exactly at {@code end}.</li>
 *   <li><b>By width</b> - consecutive windows of a fixed length, starting from one
 *       boundary (see {@link SplitDirection}). The window left over at the far
 *       boundary is shorter than the others and is only kept on request.</li>
 * </ul>
 *
 * <p>Windows are always returned left to right along the genome. Strand plays no
 * part in the geometry; generated windows inherit the region's strand so later
 * stages can orient columns.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * List<GenomicInterval> w = WindowSplitter.splitByWidth(region, WindowWidth.absolute(2),
 *     SplitDirection.NORMAL, false);
 * List<Window> all = WindowSplitter.splitAll(regions, null, 20, r -> SplitDirection.NORMAL, false);
 * }</pre>
 */
public final class WindowSplitter {

    private static final Logger logger = LogManager.getLogger(WindowSplitter.class);

    private WindowSplitter() {
    }

    /**
     * Splits one region by count if {@code count} is given, otherwise by width.
     *
     * @param interval the region to split
     * @param width the window width, ignored when {@code count} is set
     * @param count the number of windows, or null to split by width
     * @param direction where width-based splitting starts
     * @param keepShort whether to keep a trailing window shorter than the width
     * @return the windows, left to right
     * @throws MatrixConfigurationException if neither width nor count is given
     */
    public static List<GenomicInterval> split(GenomicInterval interval, WindowWidth width, Integer count,
                                              SplitDirection direction, boolean keepShort) {
        if (count != null) {
            return splitByCount(interval, count);
        }
        if (width == null) {
            throw new MatrixConfigurationException("You should define either `w` or `k`.");
        }
        return splitByWidth(interval, width, direction, keepShort);
    }

    /**
     * Splits a region into exactly {@code k} windows.
     *
     * <p>The {@code k + 1} boundaries are spaced evenly from {@code start} to
     * {@code end}, then rounded half to even. Window {@code i} starts at boundary
     * {@code i} and ends one base before boundary {@code i + 1}, or at that
     * boundary when the two round to the same base. The last window ends at
     * {@code end}. When the region is narrower than {@code k}, bases repeat across
     * windows but the count stays {@code k}.
     */
    public static List<GenomicInterval> splitByCount(GenomicInterval interval, int k) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (k < 1) {
            throw new MatrixConfigurationException("`k` must be >= 1, got: " + k);
        }
        long width = checkedWidth(interval);
        if (width < k) {
            logger.debug("Region {} is narrower than k={}, windows will share bases", interval, k);
        }
        long s = interval.start();
        long e = interval.end();
        double step = (double) (e - s) / k;
        List<GenomicInterval> windows = new ArrayList<>(k);
        long from = s;
        for (int i = 1; i <= k; i++) {
            long next = i == k ? e : (long) Math.rint(s + i * step);
            long to = i < k && next > from ? next - 1 : next;
            windows.add(new GenomicInterval(interval.seqId(), from, to, interval.strand()));
            from = next;
        }
        return windows;
    }

    /**
     * Splits a region into windows of a fixed width.
     */
    public static List<GenomicInterval> splitByWidth(GenomicInterval interval, WindowWidth width,
                                                     SplitDirection direction, boolean keepShort) {
        Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(width, "width cannot be null");
        Objects.requireNonNull(direction, "direction cannot be null");
        long regionWidth = checkedWidth(interval);
        long w = width.resolve(regionWidth);
        long s = interval.start();
        long e = interval.end();
        List<GenomicInterval> windows = new ArrayList<>((int) Math.min(Integer.MAX_VALUE, regionWidth / w + 1));

        if (direction == SplitDirection.NORMAL) {
            for (long x = s; x <= e; x += w) {
                long y = Math.min(x + w - 1, e);
                if (keepShort || y - x + 1 == w) {
                    windows.add(new GenomicInterval(interval.seqId(), x, y, interval.strand()));
                }
            }
        } else {
            for (long y = e; y >= s; y -= w) {
                long x = Math.max(y - w + 1, s);
                if (keepShort || y - x + 1 == w) {
                    windows.add(new GenomicInterval(interval.seqId(), x, y, interval.strand()));
                }
            }
            Collections.reverse(windows);
        }
        return windows;
    }

    /**
     * Splits every region and tags each window with its owner.
     *
     * @param regions the regions, in owner order
     * @param width the window width, ignored when {@code count} is set
     * @param count the number of windows per region, or null to split by width
     * @param direction chooses the split direction per region
     * @param keepShort whether to keep trailing short windows
     * @return all windows, grouped by owner in region order, each group left to right
     */
    public static List<Window> splitAll(List<GenomicInterval> regions, WindowWidth width, Integer count,
                                        Function<GenomicInterval, SplitDirection> direction, boolean keepShort) {
        Objects.requireNonNull(regions, "regions cannot be null");
        Objects.requireNonNull(direction, "direction cannot be null");
        List<Window> windows = new ArrayList<>();
        for (int owner = 0; owner < regions.size(); owner++) {
            GenomicInterval region = regions.get(owner);
            List<GenomicInterval> parts = split(region, width, count, direction.apply(region), keepShort);
            for (int i = 0; i < parts.size(); i++) {
                windows.add(new Window(parts.get(i), owner + 1, i + 1));
            }
        }
        logger.debug("Split {} regions into {} windows", regions.size(), windows.size());
        return windows;
    }

    public static List<Window> splitAll(List<GenomicInterval> regions, WindowWidth width, Integer count,
                                        SplitDirection direction, boolean keepShort) {
        return splitAll(regions, width, count, r -> direction, keepShort);
    }

    private static long checkedWidth(GenomicInterval interval) {
        long width = interval.width();
        if (width < 1) {
            throw new MatrixConfigurationException("cannot split region of width " + width + ": " + interval);
        }
        return width;
    }
}
