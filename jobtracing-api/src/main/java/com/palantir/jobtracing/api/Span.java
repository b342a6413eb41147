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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.palantir.logsafe.SafeArg;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A completed span. Spans form a tree: each span owns its {@link #getChildren() children}, ordered by the time they
 * were opened, and refers to its parent by {@link #getParentSpanId() id} only.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class Span {

    public abstract String getTraceId();

    public abstract Optional<String> getParentSpanId();

    public abstract String getSpanId();

    public abstract String getName();

    @Value.Default
    public SpanKind kind() {
        return SpanKind.UNSPECIFIED;
    }

    public abstract long getStartTimeMicroSeconds();

    public abstract long getEndTimeMicroSeconds();

    public abstract long getDurationNanoSeconds();

    /** Returns the key-value metadata with which this span was annotated, e.g. the queue a job was pulled from. */
    public abstract Map<String, String> getAttributes();

    public abstract List<Span> getChildren();

    @Value.Check
    protected final void check() {
        checkArgument(
                getEndTimeMicroSeconds() >= getStartTimeMicroSeconds(),
                "A span cannot end before it starts",
                SafeArg.of("spanId", getSpanId()),
                SafeArg.of("startTimeMicroSeconds", getStartTimeMicroSeconds()),
                SafeArg.of("endTimeMicroSeconds", getEndTimeMicroSeconds()));
        checkArgument(getDurationNanoSeconds() >= 0, "Duration must be non-negative", SafeArg.of("spanId", getSpanId()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSpan.Builder {}
}
