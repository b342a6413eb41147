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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.immutables.value.Value;

/**
 * The finished spans of one traced execution: a single root span and everything reachable through its children.
 * Trees handed to a {@link SpanExporter} may have been truncated, in which case {@link #getDroppedSpanCount()} reports
 * how many spans were left out.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class SpanTree {

    public abstract Span getRoot();

    /** The number of recorded spans that are not part of this tree because the tree was truncated. */
    @Value.Default
    public int getDroppedSpanCount() {
        return 0;
    }

    public final String getTraceId() {
        return getRoot().getTraceId();
    }

    /** Every span of this tree in depth-first pre-order: each parent precedes its children. */
    @Value.Lazy
    public List<Span> orderedSpans() {
        List<Span> ordered = new ArrayList<>();
        Deque<Span> pending = new ArrayDeque<>();
        pending.push(getRoot());
        while (!pending.isEmpty()) {
            Span span = pending.pop();
            ordered.add(span);
            List<Span> children = span.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return Collections.unmodifiableList(ordered);
    }

    public final int size() {
        return orderedSpans().size();
    }

    public static SpanTree of(Span root) {
        return builder().root(root).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSpanTree.Builder {}
}
