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
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.common.collect.ImmutableList;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.jobtracing.api.SpanKind;
import com.palantir.jobtracing.api.SpanTree;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public final class SpanExportersTest {

    private static final SpanTree TREE = SpanTree.builder()
            .root(Span.builder()
                    .traceId("0000000000000001")
                    .spanId("0000000000000002")
                    .name("jobs/default/MailerJob")
                    .kind(SpanKind.SERVER)
                    .startTimeMicroSeconds(1_000)
                    .endTimeMicroSeconds(1_500)
                    .durationNanoSeconds(500_000)
                    .putAttributes("queue", "default")
                    .addChildren(Span.builder()
                            .traceId("0000000000000001")
                            .parentSpanId("0000000000000002")
                            .spanId("0000000000000003")
                            .name("deliver")
                            .startTimeMicroSeconds(1_100)
                            .endTimeMicroSeconds(1_200)
                            .durationNanoSeconds(100_000)
                            .build())
                    .build())
            .droppedSpanCount(2)
            .build();

    @Test
    public void testLoggingExporterLogsEverySpanAndTheDroppedCount() {
        Logger logger = (Logger) LoggerFactory.getLogger(SpanExporters.class.getName() + "$LoggingSpanExporter");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SpanExporters.logging().export(TREE, 2);
        } finally {
            logger.detachAppender(appender);
        }

        List<ILoggingEvent> infos = appender.list.stream()
                .filter(event -> event.getLevel() == Level.INFO)
                .collect(Collectors.toList());
        assertThat(infos).hasSize(3);
        assertThat(infos.get(0).getArgumentArray()).contains(UnsafeArg.of("name", "jobs/default/MailerJob"));
        assertThat(infos.get(1).getArgumentArray()).contains(UnsafeArg.of("name", "deliver"));
        assertThat(infos.get(2).getMessage()).isEqualTo("Dropped {} spans of trace {} beyond the export limit");
        assertThat(infos.get(2).getArgumentArray())
                .containsExactly(
                        SafeArg.of("droppedSpanCount", 2),
                        SafeArg.of("traceId", "0000000000000001"),
                        SafeArg.of("maxFrames", 2));
    }

    @Test
    public void testCompositeInvokesEveryExporter() {
        RecordingSpanExporter first = new RecordingSpanExporter();
        RecordingSpanExporter second = new RecordingSpanExporter();

        SpanExporters.composite(first, second).export(TREE, 10);

        assertThat(first.onlyTree()).isSameAs(TREE);
        assertThat(second.onlyTree()).isSameAs(TREE);
    }

    @Test
    public void testCompositeRethrowsFirstFailureAfterRunningAll() {
        RuntimeException firstFailure = new RuntimeException("first");
        RuntimeException secondFailure = new RuntimeException("second");
        RecordingSpanExporter recording = new RecordingSpanExporter();
        SpanExporter composite = SpanExporters.composite(
                (_tree, _maxFrames) -> {
                    throw firstFailure;
                },
                recording,
                (_tree, _maxFrames) -> {
                    throw secondFailure;
                });

        assertThatThrownBy(() -> composite.export(TREE, 10))
                .isSameAs(firstFailure)
                .hasSuppressedException(secondFailure);
        assertThat(recording.exportCount()).isOne();
    }

    @Test
    public void testCompositeOfOneIsTheExporterItself() {
        RecordingSpanExporter only = new RecordingSpanExporter();
        assertThat(SpanExporters.composite(ImmutableList.of(only))).isSameAs(only);
    }

    @Test
    public void testNoopExporterDiscards() {
        assertThatCode(() -> SpanExporters.noop().export(TREE, 1)).doesNotThrowAnyException();
    }

    @Test
    public void testTreeIsOrderedDepthFirst() {
        assertThat(TREE.orderedSpans()).extracting(Span::getName).containsExactly("jobs/default/MailerJob", "deliver");
        assertThat(TREE.size()).isEqualTo(2);
        assertThat(TREE.getTraceId()).isEqualTo("0000000000000001");
    }
}
