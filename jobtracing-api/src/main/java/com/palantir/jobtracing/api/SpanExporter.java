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

package com.palantir.jobtracing.api;

/**
 * Ships finished span trees to a telemetry backend. Implementations may buffer or batch asynchronously; the tree is
 * immutable and may be retained freely.
 */
@FunctionalInterface
public interface SpanExporter {

    /**
     * Exports a finished span tree. The tree already holds at most {@code maxFrames} spans; the bound is passed on so
     * that implementations which encode further frame-like data (e.g. stack traces) can apply the same limit.
     *
     * <p>Failures are reported by throwing; callers decide whether a failed export is surfaced.
     */
    void export(SpanTree spanTree, int maxFrames);
}
