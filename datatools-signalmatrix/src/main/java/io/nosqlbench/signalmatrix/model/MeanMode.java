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

import java.util.Locale;

/**
 * How signal values that partially overlap a window are summarized into one value.
 *
 * <p>Given one 17bp window with four overlapping signals and 4bp not covered by any:
 *
 * <pre>{@code
 *       40      50     20     values in signal
 *     ++++++   +++    +++++   signal
 *            30               values in signal
 *          ++++++             signal
 *       =================     window (17bp)
 *         4  6  3      3      overlap
 *
 *     ABSOLUTE: (40 + 30 + 50 + 20) / 4
 *     WEIGHTED: (40*4 + 30*6 + 50*3 + 20*3) / (4 + 6 + 3 + 3)
 *     W0:       (40*4 + 30*6 + 50*3 + 20*3) / (4 + 6 + 3 + 3 + 4)
 *     COVERAGE: (40*4 + 30*6 + 50*3 + 20*3) / 17
 * }</pre>
 *
 * <ul>
 *   <li><b>ABSOLUTE</b> suits values measured only at sites, such as CpG methylation.</li>
 *   <li><b>W0</b> suits per-base attributes where uncovered bases mean zero, such as read coverage.</li>
 *   <li><b>COVERAGE</b> suits binary presence values, such as counting transcripts at a position.</li>
 * </ul>
 */
public enum MeanMode {
    ABSOLUTE,
    WEIGHTED,
    W0,
    COVERAGE;

    /**
     * Returns the configuration name of this mode ("absolute", "weighted", "w0", "coverage").
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode name, case-insensitively.
     *
     * @param name the mode name
     * @return the mean mode
     * @throws IllegalArgumentException if the name is not one of the four modes
     */
    public static MeanMode fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("mean mode name cannot be null");
        }
        for (MeanMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
            "Unknown mean mode: '" + name + "', expected one of absolute, weighted, w0, coverage");
    }
}
