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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.jobtracing.api.SpanTree;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Keeps every exported tree in memory so tests can inspect what a traced job produced. */
public final class RecordingSpanExporter implements SpanExporter {

    // Jobs finish on many worker threads, so using a concurrent datastructure rather than an ArrayList.
    private final Queue<SpanTree> trees = new ConcurrentLinkedQueue<>();

    @Override
    public void export(SpanTree spanTree, int _maxFrames) {
        trees.add(spanTree);
    }

    /** Every tree exported so far, in export order. */
    public List<SpanTree> getTrees() {
        return ImmutableList.copyOf(trees);
    }

    public int exportCount() {
        return trees.size();
    }

    /** The single tree exported so far; fails if there were none or several. */
    public SpanTree onlyTree() {
        return Iterables.getOnlyElement(trees);
    }

    public void clear() {
        trees.clear();
    }
}
