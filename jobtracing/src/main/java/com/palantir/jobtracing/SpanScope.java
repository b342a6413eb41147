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

import java.util.Optional;

/** A nested span scope opened by {@link TraceContext#withCurrentSpan(String)}. */
public interface SpanScope extends CloseableSpan {

    /** The span opened by this scope, or empty if no job trace was active on this thread. */
    Optional<RecordingSpan> span();

    /** Sets an attribute on this scope's span, if there is one. */
    default SpanScope putAttribute(String key, String value) {
        span().ifPresent(span -> span.putAttribute(key, value));
        return this;
    }
}
