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

/** Static factories for common {@link SamplingGate sampling gates}. */
public final class SamplingGates {

    private SamplingGates() {}

    /** Traces every job. This is the default gate. */
    public static SamplingGate always() {
        return AlwaysSample.INSTANCE;
    }

    /** Traces no job. */
    public static SamplingGate never() {
        return NeverSample.INSTANCE;
    }

    private enum AlwaysSample implements SamplingGate {
        INSTANCE;

        @Override
        public boolean shouldSample(JobDescriptor _job) {
            return true;
        }
    }

    private enum NeverSample implements SamplingGate {
        INSTANCE;

        @Override
        public boolean shouldSample(JobDescriptor _job) {
            return false;
        }
    }
}
