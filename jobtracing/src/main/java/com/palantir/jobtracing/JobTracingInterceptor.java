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

import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.concurrent.Callable;

/**
 * Entry point invoked by a job runner around each job execution.
 *
 * <p>Jobs the {@link SamplingGate} rejects run untouched. Every other job runs inside a fresh {@link RootScope}
 * whose span is named and annotated by the {@link JobSpanBuilder}; once the job returns or throws, the scope is
 * closed and the finished tree is exported through the {@link ExportScheduler}. The job's own result or exception is
 * always what the caller observes: an export failure is only thrown when the job itself succeeded, and is logged
 * otherwise.
 *
 * <pre>{@code
 * JobTracingInterceptor interceptor = JobTracingInterceptor.create(config);
 * interceptor.handle(JobDescriptor.of(payload), () -> worker.perform(payload));
 * }</pre>
 *
 * <p>This class is thread-safe; each job's trace state is confined to the thread running it.
 */
public final class JobTracingInterceptor {
    private static final SafeLogger log = SafeLoggerFactory.get(JobTracingInterceptor.class);

    private final SamplingGate samplingGate;
    private final JobSpanBuilder spanBuilder;
    private final SpanExporter exporter;
    private final int maxExportFrames;

    private JobTracingInterceptor(JobTracingConfig config) {
        this.samplingGate = config.samplingGate();
        this.spanBuilder = new JobSpanBuilder(config);
        this.exporter = config.exporter();
        this.maxExportFrames = config.maxExportFrames();
    }

    public static JobTracingInterceptor create(JobTracingConfig config) {
        return new JobTracingInterceptor(checkNotNull(config, "config is required"));
    }

    /** Runs {@code next}, tracing it if the sampling gate selects {@code job}, and returns its result. */
    public <T> T handle(JobDescriptor job, Callable<T> next) throws Exception {
        checkNotNull(job, "job is required");
        checkNotNull(next, "next is required");

        if (!samplingGate.shouldSample(job)) {
            log.debug("Running job without tracing", UnsafeArg.of("job", job));
            return next.call();
        }

        RootScope rootScope = TraceContext.openRootScope(spanBuilder.rootSpanName(job));
        T result;
        try {
            spanBuilder.configureRoot(rootScope.span(), job);
            result = next.call();
        } catch (Throwable jobFailure) {
            completeAfterFailure(rootScope, jobFailure);
            throw jobFailure;
        }
        complete(rootScope);
        return result;
    }

    /** Like {@link #handle(JobDescriptor, Callable)} for job bodies without a result. */
    public void handle(JobDescriptor job, JobBody next) throws Exception {
        checkNotNull(next, "next is required");
        handle(job, () -> {
            next.run();
            return null;
        });
    }

    /** Wraps {@code delegate} so that it runs through this interceptor, e.g. when submitted to an executor. */
    public <T> Callable<T> wrap(JobDescriptor job, Callable<T> delegate) {
        checkNotNull(job, "job is required");
        checkNotNull(delegate, "delegate is required");
        return () -> handle(job, delegate);
    }

    private void complete(RootScope rootScope) {
        rootScope.close();
        ExportScheduler.exportOnCompletion(rootScope.context(), exporter, maxExportFrames);
    }

    private void completeAfterFailure(RootScope rootScope, Throwable jobFailure) {
        try {
            complete(rootScope);
        } catch (RuntimeException | Error exportFailure) {
            log.warn(
                    "Failed to export the trace of a failed job, rethrowing the job's failure",
                    SafeArg.of("traceId", rootScope.context().getTraceId()),
                    SafeArg.of("jobFailure", jobFailure.getClass().getName()),
                    exportFailure);
        }
    }

    @Override
    public String toString() {
        return "JobTracingInterceptor{samplingGate=" + samplingGate + ", spanBuilder=" + spanBuilder + ", exporter="
                + exporter + ", maxExportFrames=" + maxExportFrames + '}';
    }
}
