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

import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import org.immutables.value.Value;

/**
 * Settings read once when a {@link JobTracingInterceptor} is created.
 *
 * <pre>{@code
 * JobTracingConfig config = JobTracingConfig.builder()
 *         .tracePrefix("jobs")
 *         .addNameAttributeKeys("queue", "class")
 *         .addSpanAttributeKeys("jid", "retry_count")
 *         .exporter(exporter)
 *         .build();
 * }</pre>
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class JobTracingConfig {
    private static final SafeLogger log = SafeLoggerFactory.get(JobTracingConfig.class);

    static final int DEFAULT_MAX_EXPORT_FRAMES = 10;

    /** First segment of every root span name. */
    @Value.Default
    public String tracePrefix() {
        return "jobs";
    }

    /** Job fields whose values follow {@link #tracePrefix()} in the root span name, in order. */
    public abstract List<String> nameAttributeKeys();

    /** Job fields copied onto the root span as attributes when present. */
    public abstract List<String> spanAttributeKeys();

    /** Recorded on every root span under {@link JobSpanBuilder#HOST_ATTRIBUTE}. */
    @Value.Default
    public String hostName() {
        return localHostName();
    }

    @Value.Default
    public SamplingGate samplingGate() {
        return SamplingGates.always();
    }

    /** Upper bound on the number of spans handed to the exporter for one job. */
    @Value.Default
    public int maxExportFrames() {
        return DEFAULT_MAX_EXPORT_FRAMES;
    }

    @Value.Default
    public SpanExporter exporter() {
        return SpanExporters.logging();
    }

    /** Extra translators applied to the root span after the configured job attributes. */
    public abstract List<TagTranslator<JobDescriptor>> additionalTags();

    @Value.Check
    protected final void check() {
        checkArgument(
                maxExportFrames() >= 1,
                "maxExportFrames must be at least 1",
                SafeArg.of("maxExportFrames", maxExportFrames()));
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Unable to resolve the local host name, recording it as unknown", e);
            return "unknown";
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableJobTracingConfig.Builder {}
}
