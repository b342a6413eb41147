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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.jobtracing.api.SpanKind;
import com.palantir.jobtracing.api.SpanTree;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class JobTracingInterceptorTest {

    private static final JobDescriptor MAILER_JOB = JobDescriptor.of(ImmutableMap.of(
            "class", "MailerJob",
            "queue", "default",
            "jid", "b4a577edbccf1d805744efa9",
            "args", "[42]"));

    @Mock
    private SpanExporter mockExporter;

    @Mock
    private SamplingGate mockGate;

    @Mock
    private Callable<String> next;

    @Captor
    private ArgumentCaptor<SpanTree> treeCaptor;

    private final RecordingSpanExporter exporter = new RecordingSpanExporter();

    @AfterEach
    public void after() {
        TraceContext.clearCurrentContext();
    }

    @Test
    public void testUnsampledJobRunsWithoutTracing() throws Exception {
        when(mockGate.shouldSample(MAILER_JOB)).thenReturn(false);
        AtomicInteger calls = new AtomicInteger();
        JobTracingInterceptor interceptor = interceptor(config().samplingGate(mockGate).exporter(mockExporter));

        String result = interceptor.handle(MAILER_JOB, () -> {
            calls.incrementAndGet();
            assertThat(TraceContext.current()).isEmpty();
            try (SpanScope scope = TraceContext.withCurrentSpan("nested")) {
                assertThat(scope.span()).isEmpty();
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(1);
        verify(mockGate).shouldSample(MAILER_JOB);
        verify(mockExporter, never()).export(any(), anyInt());
    }

    @Test
    public void testUnsampledJobFailurePropagatesUntouched() throws Exception {
        IOException failure = new IOException("smtp down");
        when(next.call()).thenThrow(failure);
        JobTracingInterceptor interceptor =
                interceptor(config().samplingGate(SamplingGates.never()).exporter(mockExporter));

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, next)).isSameAs(failure);
        verify(next).call();
        verify(mockExporter, never()).export(any(), anyInt());
    }

    @Test
    public void testSampledJobExportsRootSpanOnce() throws Exception {
        JobTracingInterceptor interceptor = interceptor(config());
        List<TraceContext> seen = new ArrayList<>();

        String result = interceptor.handle(MAILER_JOB, () -> {
            seen.add(TraceContext.current().orElseThrow());
            assertThat(TraceContext.currentSpan().orElseThrow().getName()).isEqualTo("jobs/default/MailerJob");
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(TraceContext.current()).isEmpty();
        assertThat(exporter.exportCount()).isOne();
        assertThat(seen).singleElement().satisfies(context -> {
            assertThat(context.getState()).isEqualTo(TraceContext.State.CLOSED);
            assertThat(context.getTraceId()).isEqualTo(exporter.onlyTree().getTraceId());
        });

        Span root = exporter.onlyTree().getRoot();
        assertThat(root.getName()).isEqualTo("jobs/default/MailerJob");
        assertThat(root.kind()).isEqualTo(SpanKind.SERVER);
        assertThat(root.getParentSpanId()).isEmpty();
        assertThat(root.getEndTimeMicroSeconds()).isGreaterThanOrEqualTo(root.getStartTimeMicroSeconds());
        assertThat(root.getAttributes())
                .containsExactlyInAnyOrderEntriesOf(ImmutableMap.of(
                        JobSpanBuilder.HOST_ATTRIBUTE, "worker-1",
                        "jid", "b4a577edbccf1d805744efa9",
                        "queue", "default"));
    }

    @Test
    public void testNestedSpansAttachToRoot() throws Exception {
        JobTracingInterceptor interceptor = interceptor(config());

        interceptor.handle(MAILER_JOB, () -> {
            try (SpanScope render = TraceContext.withCurrentSpan("render")) {
                render.putAttribute("template", "welcome");
                try (SpanScope ignored = TraceContext.withCurrentSpan("render.partial")) {
                    // no-op
                }
            }
            try (SpanScope ignored = TraceContext.withCurrentSpan("deliver")) {
                // no-op
            }
        });

        assertThat(SpanTreeRenderer.render(exporter.onlyTree()))
                .isEqualTo("jobs/default/MailerJob\n  render\n    render.partial\n  deliver\n");
        assertThat(exporter.onlyTree().getRoot().getChildren().get(0).getAttributes())
                .containsEntry("template", "welcome");
    }

    @Test
    public void testJobFailureIsRethrownAfterExport() throws Exception {
        IllegalStateException failure = new IllegalStateException("template missing");
        JobTracingInterceptor interceptor = interceptor(config());

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, () -> {
                    assertThat(exporter.exportCount()).isZero();
                    throw failure;
                }))
                .isSameAs(failure)
                .satisfies(thrown -> assertThat(thrown.getSuppressed()).isEmpty());

        assertThat(exporter.exportCount()).isOne();
        assertThat(exporter.onlyTree().getRoot().kind()).isEqualTo(SpanKind.SERVER);
        assertThat(TraceContext.current()).isEmpty();
    }

    @Test
    public void testCheckedJobFailureIsRethrownUnwrapped() throws Exception {
        IOException failure = new IOException("smtp down");
        when(next.call()).thenThrow(failure);
        JobTracingInterceptor interceptor = interceptor(config());

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, next)).isSameAs(failure);
        verify(next, times(1)).call();
        assertThat(exporter.exportCount()).isOne();
    }

    @Test
    public void testCancelledJobIsExported() {
        JobTracingInterceptor interceptor = interceptor(config());

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, () -> {
                    throw new InterruptedException("worker shutting down");
                }))
                .isInstanceOf(InterruptedException.class);
        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, () -> {
                    throw new CancellationException("job cancelled");
                }))
                .isInstanceOf(CancellationException.class);

        assertThat(exporter.exportCount()).isEqualTo(2);
    }

    @Test
    public void testErrorsFromJobAreExported() {
        JobTracingInterceptor interceptor = interceptor(config());
        StackOverflowError error = new StackOverflowError();

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, () -> {
                    throw error;
                }))
                .isSameAs(error);
        assertThat(exporter.exportCount()).isOne();
    }

    @Test
    public void testExportFailurePropagatesWhenJobSucceeds() throws Exception {
        RuntimeException exportFailure = new RuntimeException("collector unavailable");
        doThrow(exportFailure).when(mockExporter).export(any(), anyInt());
        JobTracingInterceptor interceptor = interceptor(config().exporter(mockExporter));

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, () -> "done")).isSameAs(exportFailure);
        verify(mockExporter).export(any(), anyInt());
        assertThat(TraceContext.current()).isEmpty();
    }

    @Test
    public void testExportFailureDoesNotMaskJobFailure() throws Exception {
        RuntimeException exportFailure = new RuntimeException("collector unavailable");
        IllegalArgumentException jobFailure = new IllegalArgumentException("bad recipient");
        doThrow(exportFailure).when(mockExporter).export(any(), anyInt());
        JobTracingInterceptor interceptor = interceptor(config().exporter(mockExporter));

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, () -> {
                    throw jobFailure;
                }))
                .isSameAs(jobFailure)
                .satisfies(thrown -> assertThat(thrown.getSuppressed()).isEmpty());
        verify(mockExporter).export(any(), anyInt());
    }

    @Test
    public void testSamplingFailurePropagatesWithoutRunningJob() throws Exception {
        RuntimeException samplingFailure = new RuntimeException("sampler misconfigured");
        when(mockGate.shouldSample(MAILER_JOB)).thenThrow(samplingFailure);
        JobTracingInterceptor interceptor = interceptor(config().samplingGate(mockGate).exporter(mockExporter));

        assertThatThrownBy(() -> interceptor.handle(MAILER_JOB, next)).isSameAs(samplingFailure);
        verify(next, never()).call();
        verify(mockExporter, never()).export(any(), anyInt());
        assertThat(TraceContext.current()).isEmpty();
    }

    @Test
    public void testSamplingGateSeesTheJob() throws Exception {
        JobTracingInterceptor interceptor = interceptor(
                config().samplingGate(job -> job.get("queue").filter("critical"::equals).isPresent()));

        interceptor.handle(MAILER_JOB, () -> "default queue");
        interceptor.handle(JobDescriptor.of(ImmutableMap.of("class", "PagerJob", "queue", "critical")), () -> "page");

        assertThat(exporter.onlyTree().getRoot().getName()).isEqualTo("jobs/critical/PagerJob");
    }

    @Test
    public void testExportIsTruncatedToConfiguredFrames() throws Exception {
        JobTracingInterceptor interceptor = interceptor(config().maxExportFrames(5).exporter(mockExporter));

        interceptor.handle(MAILER_JOB, () -> {
            for (int i = 0; i < 10; i++) {
                try (SpanScope ignored = TraceContext.withCurrentSpan("step-" + i)) {
                    // no-op
                }
            }
        });

        verify(mockExporter).export(treeCaptor.capture(), eq(5));
        assertThat(treeCaptor.getValue().size()).isEqualTo(5);
        assertThat(treeCaptor.getValue().getDroppedSpanCount()).isEqualTo(6);
    }

    @Test
    public void testJobRunInlineByAnotherJobGetsItsOwnTrace() throws Exception {
        JobTracingInterceptor interceptor = interceptor(config());
        JobDescriptor inlineJob = JobDescriptor.of(ImmutableMap.of("class", "AuditJob", "queue", "low"));

        interceptor.handle(MAILER_JOB, () -> interceptor.handle(inlineJob, () -> "audited"));

        assertThat(exporter.getTrees())
                .extracting(tree -> tree.getRoot().getName())
                .containsExactly("jobs/low/AuditJob", "jobs/default/MailerJob");
        assertThat(exporter.getTrees()).allSatisfy(tree -> assertThat(tree.size()).isOne());
    }

    @Test
    public void testWrappedCallableRunsThroughInterceptor() throws Exception {
        JobTracingInterceptor interceptor = interceptor(config());
        Callable<String> wrapped = interceptor.wrap(MAILER_JOB, () -> "done");

        assertThat(exporter.exportCount()).isZero();
        assertThat(wrapped.call()).isEqualTo("done");
        assertThat(exporter.exportCount()).isOne();
    }

    private JobTracingConfig.Builder config() {
        JobTracingConfig.Builder builder = JobTracingConfig.builder();
        builder.tracePrefix("jobs")
                .addNameAttributeKeys("queue", "class")
                .addSpanAttributeKeys("jid", "queue", "missing")
                .hostName("worker-1")
                .exporter(exporter);
        return builder;
    }

    private static JobTracingInterceptor interceptor(JobTracingConfig.Builder config) {
        return JobTracingInterceptor.create(config.build());
    }
}
