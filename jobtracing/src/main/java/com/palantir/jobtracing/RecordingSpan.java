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

import static com.palantir.logsafe.Preconditions.checkNotNull;
import static com.palantir.logsafe.Preconditions.checkState;

import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanKind;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/**
 * A span that is still being recorded. The name is fixed when the span is opened; kind and attributes may change
 * until the span is {@link #isEnded() ended}, after which the span is read-only.
 *
 * <p>Spans are owned by the {@link TraceContext} that opened them and are not thread-safe: they must only be
 * touched by the thread running the traced job.
 */
public final class RecordingSpan {
    private static final Clock CLOCK = Clock.systemUTC();
    private static final long NOT_ENDED = -1L;

    private final String traceId;
    private final String spanId;

    @Nullable
    private final RecordingSpan parent;

    private final String name;

    // Wall-clock and monotonic readings taken together when the root span opened. Every span of the trace
    // derives its timestamps from these so that children always fall within their parent.
    private final long anchorMicroSeconds;
    private final long anchorClockNanoSeconds;

    private final long startClockNanoSeconds;
    private final Map<String, String> attributes = new HashMap<>();
    private final List<RecordingSpan> children = new ArrayList<>();
    private SpanKind kind = SpanKind.UNSPECIFIED;
    private long durationNanoSeconds = NOT_ENDED;

    private RecordingSpan(String traceId, @Nullable RecordingSpan parent, String name) {
        this.traceId = traceId;
        this.spanId = Ids.randomId();
        this.parent = parent;
        this.name = checkNotNull(name, "span name is required");
        if (parent == null) {
            this.anchorMicroSeconds = nowInMicroSeconds();
            this.anchorClockNanoSeconds = System.nanoTime();
            this.startClockNanoSeconds = anchorClockNanoSeconds;
        } else {
            this.anchorMicroSeconds = parent.anchorMicroSeconds;
            this.anchorClockNanoSeconds = parent.anchorClockNanoSeconds;
            this.startClockNanoSeconds = System.nanoTime();
        }
    }

    static RecordingSpan root(String traceId, String name) {
        return new RecordingSpan(traceId, null, name);
    }

    /** Opens a child of this span. Children are kept in the order they were opened. */
    RecordingSpan startChild(String childName) {
        checkState(!isEnded(), "Cannot open a child of an ended span", UnsafeArg.of("span", name));
        RecordingSpan child = new RecordingSpan(traceId, this, childName);
        children.add(child);
        return child;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    public Optional<String> getParentSpanId() {
        return parent == null ? Optional.empty() : Optional.of(parent.spanId);
    }

    @Nullable
    RecordingSpan parent() {
        return parent;
    }

    public String getName() {
        return name;
    }

    public SpanKind kind() {
        return kind;
    }

    public RecordingSpan setKind(SpanKind newKind) {
        checkOpen("setKind");
        this.kind = checkNotNull(newKind, "kind is required");
        return this;
    }

    /** Sets an attribute on this span, replacing any earlier value for the same key. */
    public RecordingSpan putAttribute(String key, String value) {
        checkOpen("putAttribute");
        attributes.put(checkNotNull(key, "attribute key is required"), checkNotNull(value, "attribute value is required"));
        return this;
    }

    /** Applies the tags produced by {@code translator} for {@code data} as attributes of this span. */
    public <S> RecordingSpan tag(TagTranslator<? super S> translator, S data) {
        checkOpen("tag");
        if (!translator.isEmpty(data)) {
            translator.translate(AttributeAdapter.INSTANCE, this, data);
        }
        return this;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<RecordingSpan> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public long getStartTimeMicroSeconds() {
        return toMicroSeconds(startClockNanoSeconds);
    }

    /** The end time of this span, or empty while the span is still open. */
    public OptionalLong getEndTimeMicroSeconds() {
        return isEnded() ? OptionalLong.of(endTimeMicroSeconds()) : OptionalLong.empty();
    }

    public boolean isEnded() {
        return durationNanoSeconds != NOT_ENDED;
    }

    void end() {
        checkState(!isEnded(), "Span already ended", UnsafeArg.of("span", name), SafeArg.of("spanId", spanId));
        durationNanoSeconds = Math.max(0L, System.nanoTime() - startClockNanoSeconds);
    }

    /** Counts this span and all of its descendants. */
    int countSpans() {
        int count = 0;
        Deque<RecordingSpan> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            RecordingSpan span = pending.pop();
            count++;
            span.children.forEach(pending::push);
        }
        return count;
    }

    /**
     * Converts this ended span and as many descendants as {@code budget} allows, visiting spans in depth-first
     * pre-order, into an immutable {@link Span}.
     */
    Span toSpan(FrameBudget budget) {
        checkState(isEnded(), "Only ended spans can be exported", UnsafeArg.of("span", name));
        budget.consume();
        Span.Builder builder = Span.builder()
                .traceId(traceId)
                .parentSpanId(getParentSpanId())
                .spanId(spanId)
                .name(name)
                .kind(kind)
                .startTimeMicroSeconds(getStartTimeMicroSeconds())
                .endTimeMicroSeconds(endTimeMicroSeconds())
                .durationNanoSeconds(durationNanoSeconds)
                .putAllAttributes(attributes);
        for (RecordingSpan child : children) {
            if (!budget.hasRemaining()) {
                break;
            }
            builder.addChildren(child.toSpan(budget));
        }
        return builder.build();
    }

    private long endTimeMicroSeconds() {
        return toMicroSeconds(startClockNanoSeconds + durationNanoSeconds);
    }

    private long toMicroSeconds(long clockNanoSeconds) {
        return anchorMicroSeconds + (clockNanoSeconds - anchorClockNanoSeconds) / 1000;
    }

    private void checkOpen(String operation) {
        checkState(
                !isEnded(),
                "Spans cannot be modified once ended",
                SafeArg.of("operation", operation),
                UnsafeArg.of("span", name));
    }

    private static long nowInMicroSeconds() {
        Instant now = CLOCK.instant();
        return (1000000 * now.getEpochSecond()) + (now.getNano() / 1000);
    }

    @Override
    public String toString() {
        return "RecordingSpan{name='" + name + "', spanId='" + spanId + "', traceId='" + traceId + "', kind=" + kind
                + ", ended=" + isEnded() + ", children=" + children.size() + '}';
    }

    private enum AttributeAdapter implements TagTranslator.TagAdapter<RecordingSpan> {
        INSTANCE;

        @Override
        public void tag(RecordingSpan target, String key, String value) {
            target.putAttribute(key, value);
        }

        @Override
        public void tag(RecordingSpan target, Map<String, String> tags) {
            tags.forEach(target::putAttribute);
        }
    }
}
