/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.jobtracing;

import static com.palantir.logsafe.Preconditions.checkArgument;
import static com.palantir.logsafe.Preconditions.checkState;

import com.palantir.logsafe.SafeArg;

/** Counts down the number of spans that may still be added to an exported tree. */
final class FrameBudget {
    private final int maxFrames;
    private int used;

    FrameBudget(int maxFrames) {
        checkArgument(maxFrames >= 1, "maxFrames must be at least 1", SafeArg.of("maxFrames", maxFrames));
        this.maxFrames = maxFrames;
    }

    boolean hasRemaining() {
        return used < maxFrames;
    }

    void consume() {
        checkState(hasRemaining(), "Frame budget exhausted", SafeArg.of("maxFrames", maxFrames));
        used++;
    }

    int used() {
        return used;
    }
}
