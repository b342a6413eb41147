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

import com.google.common.collect.ImmutableList;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.jobtracing.api.SpanTree;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.List;

/** Static factories for the built-in {@link SpanExporter span exporters}. */
public final class SpanExporters {

    private SpanExporters() {}

    /** Logs every span of each exported tree at INFO. This is the default exporter. */
    public static SpanExporter logging() {
        return LoggingSpanExporter.INSTANCE;
    }

    /** Discards every tree. */
    public static SpanExporter noop() {
        return NoopSpanExporter.INSTANCE;
    }

    /**
     * Hands each tree to every delegate in order. All delegates are invoked even if some fail; the first failure is
     * then rethrown with any later failures attached as suppressed exceptions.
     */
    public static SpanExporter composite(List<? extends SpanExporter> exporters) {
        checkArgument(!exporters.isEmpty(), "At least one exporter is required");
        return exporters.size() == 1 ? exporters.get(0) : new CompositeSpanExporter(exporters);
    }

    public static SpanExporter composite(SpanExporter first, SpanExporter... rest) {
        return composite(ImmutableList.<SpanExporter>builder().add(first).add(rest).build());
    }

    private enum LoggingSpanExporter implements SpanExporter {
        INSTANCE;

        private static final SafeLogger log = SafeLoggerFactory.get(LoggingSpanExporter.class);

        @Override
        public void export(SpanTree spanTree, int maxFrames) {
            for (Span span : spanTree.orderedSpans()) {
                log.info(
                        "Job span {} of trace {} took {} ns",
                        UnsafeArg.of("name", span.getName()),
                        SafeArg.of("traceId", span.getTraceId()),
                        SafeArg.of("durationNanoSeconds", span.getDurationNanoSeconds()),
                        SafeArg.of("spanId", span.getSpanId()));
                if (log.isDebugEnabled()) {
                    log.debug(
                            "Job span details",
                            SafeArg.of("spanId", span.getSpanId()),
                            SafeArg.of("parentSpanId", span.getParentSpanId().orElse(null)),
                            SafeArg.of("kind", span.kind()),
                            UnsafeArg.of("attributes", span.getAttributes()));
                }
            }
            if (spanTree.getDroppedSpanCount() > 0) {
                log.info(
                        "Dropped {} spans of trace {} beyond the export limit",
                        SafeArg.of("droppedSpanCount", spanTree.getDroppedSpanCount()),
                        SafeArg.of("traceId", spanTree.getTraceId()),
                        SafeArg.of("maxFrames", maxFrames));
            }
        }
    }

    private enum NoopSpanExporter implements SpanExporter {
        INSTANCE;

        @Override
        public void export(SpanTree _spanTree, int _maxFrames) {}
    }

    private static final class CompositeSpanExporter implements SpanExporter {
        private final List<SpanExporter> delegates;

        CompositeSpanExporter(List<? extends SpanExporter> delegates) {
            this.delegates = ImmutableList.copyOf(delegates);
        }

        @Override
        public void export(SpanTree spanTree, int maxFrames) {
            RuntimeException failure = null;
            for (SpanExporter delegate : delegates) {
                try {
                    delegate.export(spanTree, maxFrames);
                } catch (RuntimeException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }

        @Override
        public String toString() {
            return "CompositeSpanExporter{delegates=" + delegates + '}';
        }
    }
}
