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

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.MustBeClosed;
import com.palantir.jobtracing.api.SpanTree;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import javax.annotation.Nullable;
import org.slf4j.MDC;

/**
 * Tracks the span tree of one traced job execution and which of its spans is current.
 *
 * <p>A context is installed in a thread-local for the lifetime of its {@link RootScope}, so spans opened through
 * {@link #withCurrentSpan(String)} by code running inside the job attach to that job's tree only. Scopes nest
 * strictly: a scope may only be closed once every scope opened inside it has been closed. Apart from the export
 * state, which may be read from any thread, a context must only be used by the thread that opened it.
 */
public final class TraceContext {

    private static final SafeLogger log = SafeLoggerFactory.get(TraceContext.class);

    /** The key under which the job's trace id is inserted into SLF4J {@link MDC MDCs}. */
    public static final String TRACE_ID_KEY = "jobTraceId";

    // Thread-safe since thread-local
    private static final ThreadLocal<TraceContext> currentContext = new ThreadLocal<>();

    private static final AtomicReferenceFieldUpdater<TraceContext, State> stateUpdater =
            AtomicReferenceFieldUpdater.newUpdater(TraceContext.class, State.class, "state");

    /** Lifecycle of a traced job, see {@link ExportScheduler}. */
    public enum State {
        /** The root scope is open, or closed but not yet handed to the export scheduler. */
        SCOPE_OPEN,
        /** The span tree is being handed to the exporter. */
        EXPORTING,
        /** Export has been attempted; terminal. */
        CLOSED
    }

    private final String traceId;
    private final RecordingSpan root;
    private final Thread owner;

    @Nullable
    private final TraceContext previousContext;

    @Nullable
    private final String previousMdcTraceId;

    private RecordingSpan current;
    private volatile State state = State.SCOPE_OPEN;

    private TraceContext(
            String traceId,
            String rootName,
            @Nullable TraceContext previousContext,
            @Nullable String previousMdcTraceId) {
        this.traceId = traceId;
        this.root = RecordingSpan.root(traceId, rootName);
        this.owner = Thread.currentThread();
        this.previousContext = previousContext;
        this.previousMdcTraceId = previousMdcTraceId;
        this.current = root;
    }

    /**
     * Starts a new trace whose root span is named {@code rootName} and makes it current on this thread. A context
     * that is already installed, e.g. when a job runs another job inline, is restored when the returned scope closes.
     */
    @MustBeClosed
    public static RootScope openRootScope(String rootName) {
        checkNotNull(rootName, "rootName is required");
        TraceContext context = new TraceContext(Ids.randomId(), rootName, currentContext.get(), MDC.get(TRACE_ID_KEY));
        currentContext.set(context);
        MDC.put(TRACE_ID_KEY, context.traceId);
        log.debug("Opened job trace", SafeArg.of("traceId", context.traceId));
        return new RootScope(context);
    }

    /**
     * Opens a child of this thread's current span and makes it current until the returned scope is closed. If no job
     * is being traced on this thread the returned scope does nothing.
     */
    @MustBeClosed
    public static SpanScope withCurrentSpan(String name) {
        checkNotNull(name, "name is required");
        TraceContext context = currentContext.get();
        if (context == null) {
            return NoopSpanScope.INSTANCE;
        }
        return context.openChild(name);
    }

    /** The context of the job being traced on this thread, if any. */
    public static Optional<TraceContext> current() {
        return Optional.ofNullable(currentContext.get());
    }

    /** The current span of the job being traced on this thread, if any. */
    public static Optional<RecordingSpan> currentSpan() {
        TraceContext context = currentContext.get();
        return context == null ? Optional.empty() : Optional.of(context.current);
    }

    public String getTraceId() {
        return traceId;
    }

    public State getState() {
        return state;
    }

    /** True once the root scope has been closed and the tree is final. */
    public boolean isRootClosed() {
        return root.isEnded();
    }

    RecordingSpan root() {
        return root;
    }

    private SpanScope openChild(String name) {
        checkOwner();
        checkState(!root.isEnded(), "Cannot open a span after the root scope closed", SafeArg.of("traceId", traceId));
        RecordingSpan parent = current;
        RecordingSpan child = parent.startChild(name);
        current = child;
        return new ChildScope(this, child);
    }

    private void closeChild(RecordingSpan span) {
        checkOwner();
        checkState(!span.isEnded(), "Span scope already closed", UnsafeArg.of("span", span.getName()));
        checkState(
                current == span,
                "Span scopes must be closed in the reverse order they were opened",
                UnsafeArg.of("span", span.getName()),
                UnsafeArg.of("currentSpan", current.getName()),
                SafeArg.of("traceId", traceId));
        span.end();
        current = checkNotNull(span.parent(), "Child spans always have a parent");
    }

    void closeRoot() {
        checkOwner();
        checkState(!root.isEnded(), "Root scope already closed", SafeArg.of("traceId", traceId));
        endLeakedScopes();
        root.end();
        current = root;
        uninstall();
        log.debug("Closed job trace", SafeArg.of("traceId", traceId));
    }

    /** Scopes left open by the job would otherwise keep the tree from being exported. */
    private void endLeakedScopes() {
        while (current != root) {
            log.warn(
                    "Span scope was not closed before its job finished; ending it with the root scope",
                    UnsafeArg.of("span", current.getName()),
                    SafeArg.of("traceId", traceId));
            current.end();
            current = checkNotNull(current.parent(), "Child spans always have a parent");
        }
    }

    private void uninstall() {
        TraceContext installed = currentContext.get();
        if (installed != this) {
            log.warn(
                    "Closing a job trace which is not installed on this thread",
                    SafeArg.of("traceId", traceId),
                    SafeArg.of("installedTraceId", installed == null ? null : installed.traceId));
        }
        if (previousContext == null) {
            currentContext.remove();
        } else {
            currentContext.set(previousContext);
        }
        if (previousMdcTraceId == null) {
            MDC.remove(TRACE_ID_KEY);
        } else {
            MDC.put(TRACE_ID_KEY, previousMdcTraceId);
        }
    }

    /** Moves the context into {@link State#EXPORTING}; returns false if an export was already started. */
    boolean beginExport() {
        return stateUpdater.compareAndSet(this, State.SCOPE_OPEN, State.EXPORTING);
    }

    void finishExport() {
        state = State.CLOSED;
    }

    /** Builds the finished tree, keeping the first {@code maxFrames} spans in depth-first pre-order. */
    SpanTree toSpanTree(int maxFrames) {
        checkState(root.isEnded(), "The root scope must be closed first", SafeArg.of("traceId", traceId));
        FrameBudget budget = new FrameBudget(maxFrames);
        int recorded = root.countSpans();
        return SpanTree.builder()
                .root(root.toSpan(budget))
                .droppedSpanCount(recorded - budget.used())
                .build();
    }

    private void checkOwner() {
        checkState(
                Thread.currentThread() == owner,
                "Job trace scopes must be used on the thread that opened them",
                SafeArg.of("traceId", traceId),
                SafeArg.of("owner", owner.getName()));
    }

    @VisibleForTesting
    static void clearCurrentContext() {
        currentContext.remove();
        MDC.remove(TRACE_ID_KEY);
    }

    @Override
    public String toString() {
        return "TraceContext{traceId='" + traceId + "', state=" + state + ", root=" + root + ", current=" + current
                + '}';
    }

    private static final class ChildScope implements SpanScope {
        private final TraceContext context;
        private final RecordingSpan span;

        ChildScope(TraceContext context, RecordingSpan span) {
            this.context = context;
            this.span = span;
        }

        @Override
        public Optional<RecordingSpan> span() {
            return Optional.of(span);
        }

        @Override
        public void close() {
            context.closeChild(span);
        }
    }

    private enum NoopSpanScope implements SpanScope {
        INSTANCE;

        @Override
        public Optional<RecordingSpan> span() {
            return Optional.empty();
        }

        @Override
        public void close() {}
    }
}
