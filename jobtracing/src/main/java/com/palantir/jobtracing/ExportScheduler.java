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
import static com.palantir.logsafe.Preconditions.checkNotNull;
import static com.palantir.logsafe.Preconditions.checkState;

import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.jobtracing.api.SpanTree;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;

/**
 * Hands the span tree of a finished job to an exporter exactly once.
 *
 * <p>The first call for a context moves it from {@link TraceContext.State#SCOPE_OPEN SCOPE_OPEN} to
 * {@link TraceContext.State#EXPORTING EXPORTING}, exports, and leaves it {@link TraceContext.State#CLOSED CLOSED}
 * whether or not the exporter succeeded. Any later call is logged and ignored.
 *
 * <p>Trees larger than {@code maxFrames} are truncated to their first {@code maxFrames} spans in depth-first
 * pre-order. The root span is therefore always exported, every exported span's parent is exported, and the spans
 * dropped are the latest-opened ones at the bottom of the tree.
 */
public final class ExportScheduler {
    private static final SafeLogger log = SafeLoggerFactory.get(ExportScheduler.class);

    private ExportScheduler() {}

    /**
     * Exports the finished tree of {@code context}. The context's root scope must already be closed. Exporter failures
     * propagate to the caller.
     */
    public static void exportOnCompletion(TraceContext context, SpanExporter exporter, int maxFrames) {
        checkNotNull(context, "context is required");
        checkNotNull(exporter, "exporter is required");
        checkArgument(maxFrames >= 1, "maxFrames must be at least 1", SafeArg.of("maxFrames", maxFrames));
        checkState(
                context.isRootClosed(),
                "The root scope must be closed before its trace is exported",
                SafeArg.of("traceId", context.getTraceId()));

        if (!context.beginExport()) {
            log.warn(
                    "Ignoring repeated export of a job trace",
                    SafeArg.of("traceId", context.getTraceId()),
                    SafeArg.of("state", context.getState()));
            return;
        }

        try {
            SpanTree tree = context.toSpanTree(maxFrames);
            if (tree.getDroppedSpanCount() > 0) {
                log.debug(
                        "Truncated job trace before export",
                        SafeArg.of("traceId", context.getTraceId()),
                        SafeArg.of("maxFrames", maxFrames),
                        SafeArg.of("droppedSpanCount", tree.getDroppedSpanCount()));
            }
            exporter.export(tree, maxFrames);
        } finally {
            context.finishExport();
        }
    }
}
