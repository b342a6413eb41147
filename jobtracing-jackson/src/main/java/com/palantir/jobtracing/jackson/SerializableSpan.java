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

package com.palantir.jobtracing.jackson;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanKind;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** One line of a JSON lines export: a span without its children, which refer back to it by parent id. */
@Value.Immutable
@JsonSerialize(as = ImmutableSerializableSpan.class)
@JsonDeserialize(as = ImmutableSerializableSpan.class)
abstract class SerializableSpan {

    public abstract String getTraceId();

    public abstract Optional<String> getParentSpanId();

    public abstract String getSpanId();

    public abstract String getName();

    @Value.Default
    public SpanKind getKind() {
        return SpanKind.UNSPECIFIED;
    }

    public abstract long getStartTimeMicroSeconds();

    public abstract long getEndTimeMicroSeconds();

    public abstract long getDurationNanoSeconds();

    public abstract Map<String, String> getAttributes();

    /** Only written for root spans of truncated trees. */
    public abstract Optional<Integer> getDroppedSpanCount();

    static SerializableSpan fromSpan(Span span, Optional<Integer> droppedSpanCount) {
        return ImmutableSerializableSpan.builder()
                .traceId(span.getTraceId())
                .parentSpanId(span.getParentSpanId())
                .spanId(span.getSpanId())
                .name(span.getName())
                .kind(span.kind())
                .startTimeMicroSeconds(span.getStartTimeMicroSeconds())
                .endTimeMicroSeconds(span.getEndTimeMicroSeconds())
                .durationNanoSeconds(span.getDurationNanoSeconds())
                .attributes(span.getAttributes())
                .droppedSpanCount(droppedSpanCount)
                .build();
    }

    /** Converts this span back, attaching already converted {@code children}. */
    Span asSpan(Iterable<Span> children) {
        return Span.builder()
                .traceId(getTraceId())
                .parentSpanId(getParentSpanId())
                .spanId(getSpanId())
                .name(getName())
                .kind(getKind())
                .startTimeMicroSeconds(getStartTimeMicroSeconds())
                .endTimeMicroSeconds(getEndTimeMicroSeconds())
                .durationNanoSeconds(getDurationNanoSeconds())
                .attributes(getAttributes())
                .addAllChildren(children)
                .build();
    }
}
