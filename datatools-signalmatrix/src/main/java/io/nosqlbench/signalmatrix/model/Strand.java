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

/// Strand of a genomic interval.
///
/// Only [#REVERSE] changes how generated columns are oriented; [#UNSTRANDED]
/// intervals are laid out like forward ones.
public enum Strand {
    FORWARD('+'),
    REVERSE('-'),
    UNSTRANDED('*');

    private final char symbol;

    Strand(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isReverse() {
        return this == REVERSE;
    }

    /// Parses a strand symbol (`+`, `-`, `*` or `.`).
    ///
    /// @param symbol the strand symbol
    /// @return the matching strand
    /// @throws IllegalArgumentException if the symbol is not recognized
    public static Strand fromSymbol(char symbol) {
        switch (symbol) {
            case '+':
                return FORWARD;
            case '-':
                return REVERSE;
            case '*':
            case '.':
                return UNSTRANDED;
            default:
                throw new IllegalArgumentException("Unknown strand symbol: '" + symbol + "'");
        }
    }

    public static Strand fromSymbol(String symbol) {
        if (symbol == null || symbol.length() != 1) {
            throw new IllegalArgumentException("Unknown strand symbol: " + symbol);
        }
        return fromSymbol(symbol.charAt(0));
    }
}
