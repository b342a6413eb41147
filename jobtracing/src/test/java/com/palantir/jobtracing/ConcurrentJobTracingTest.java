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

import com.google.common.collect.ImmutableMap;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanTree;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class ConcurrentJobTracingTest {
    private static final int JOBS = 1000;

    private final RecordingSpanExporter exporter = new RecordingSpanExporter();
    private ExecutorService executor;

    @BeforeEach
    public void before() {
        executor = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    public void after() throws InterruptedException {
        executor.shutdownNow();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    public void testEachSampledJobExportsItsOwnTreeExactlyOnce() throws Exception {
        JobTracingInterceptor interceptor = JobTracingInterceptor.create(JobTracingConfig.builder()
                .tracePrefix("jobs")
                .addNameAttributeKeys("id")
                .addSpanAttributeKeys("id")
                .hostName("worker-1")
                .samplingGate(job -> Integer.parseInt(job.get("id").orElseThrow()) % 3 != 0)
                .exporter(exporter)
                .build());
        CountDownLatch start = new CountDownLatch(1);

        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < JOBS; i++) {
            String id = Integer.toString(i);
            JobDescriptor job = JobDescriptor.of(ImmutableMap.of("id", id));
            Callable<String> body = () -> {
                start.await();
                try (SpanScope work = TraceContext.withCurrentSpan("work-" + id)) {
                    Thread.yield();
                    try (SpanScope ignored = TraceContext.withCurrentSpan("io-" + id)) {
                        Thread.yield();
                    }
                    work.putAttribute("id", id);
                }
                if (Integer.parseInt(id) % 7 == 0) {
                    throw new IllegalStateException("job " + id + " failed");
                }
                return id;
            };
            results.add(executor.submit(interceptor.wrap(job, body)));
        }
        start.countDown();

        int failed = 0;
        for (Future<String> result : results) {
            try {
                result.get(30, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                failed++;
            }
        }

        int sampled = countSampled();
        assertThat(failed).isEqualTo((JOBS + 6) / 7);
        assertThat(exporter.exportCount()).isEqualTo(sampled);
        assertThat(exporter.getTrees())
                .extracting(SpanTree::getTraceId)
                .doesNotHaveDuplicates();

        for (SpanTree tree : exporter.getTrees()) {
            String id = tree.getRoot().getAttributes().get("id");
            assertThat(Integer.parseInt(id) % 3).isNotZero();
            assertThat(tree.getRoot().getName()).isEqualTo("jobs/" + id);
            assertThat(tree.size()).isEqualTo(3);
            Span work = tree.getRoot().getChildren().get(0);
            assertThat(work.getName()).isEqualTo("work-" + id);
            assertThat(work.getAttributes()).containsEntry("id", id);
            assertThat(work.getChildren()).extracting(Span::getName).containsExactly("io-" + id);
            assertThat(tree.orderedSpans()).allSatisfy(span -> assertThat(span.getTraceId())
                    .isEqualTo(tree.getTraceId()));
        }
    }

    private static int countSampled() {
        int sampled = 0;
        for (int i = 0; i < JOBS; i++) {
            if (i % 3 != 0) {
                sampled++;
            }
        }
        return sampled;
    }
}
