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

/**
 * Where fixed-width splitting starts. The remainder, if any, ends up at the
 * opposite boundary.
 *
 * <pre>{@code
 *   ----->----  one region, split by 3bp windows
 *   aaabbbccc   NORMAL,  keepShort = false
 *   aaabbbcccd  NORMAL,  keepShort = true
 *    aaabbbccc  REVERSE, keepShort = false
 *   abbbcccddd  REVERSE, keepShort = true
 * }</pre>
 */
public enum SplitDirection {
    /** Windows start at the region start. */
    NORMAL,
    /** Windows start at the region end; output is still ordered left to right. */
    REVERSE
}
