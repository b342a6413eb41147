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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.palantir.jobtracing.api.SpanKind;
import java.util.ArrayList;
import java.util.List;

/** Names and annotates the root span of a traced job from the job's descriptor. */
public final class JobSpanBuilder {
    /** The attribute recording which host ran the job. */
    public static final String HOST_ATTRIBUTE = "http.host";

    private static final Joiner SEPARATOR = Joiner.on('/');

    private final String tracePrefix;
    private final List<String> nameAttributeKeys;
    private final String hostName;
    private final TagTranslator<JobDescriptor> attributes;

    JobSpanBuilder(JobTracingConfig config) {
        checkNotNull(config, "config is required");
        this.tracePrefix = config.tracePrefix();
        this.nameAttributeKeys = ImmutableList.copyOf(config.nameAttributeKeys());
        this.hostName = config.hostName();
        this.attributes = new CompositeTagTranslator<>(ImmutableList.<TagTranslator<JobDescriptor>>builder()
                .add(new JobAttributeTagTranslator(config.spanAttributeKeys()))
                .addAll(config.additionalTags())
                .build());
    }

    /**
     * Joins the trace prefix and the job's value for each name key with {@code /}. A key the job lacks contributes an
     * empty segment, so {@code jobs//MailerJob} names a job with no queue.
     */
    public String rootSpanName(JobDescriptor job) {
        List<String> segments = new ArrayList<>(nameAttributeKeys.size() + 1);
        segments.add(tracePrefix);
        for (String key : nameAttributeKeys) {
            segments.add(job.get(key).orElse(""));
        }
        return SEPARATOR.join(segments);
    }

    /** Marks {@code span} as the server side of the job and records the host and the configured job attributes. */
    public void configureRoot(RecordingSpan span, JobDescriptor job) {
        span.setKind(SpanKind.SERVER);
        span.putAttribute(HOST_ATTRIBUTE, hostName);
        span.tag(attributes, job);
    }

    @Override
    public String toString() {
        return "JobSpanBuilder{tracePrefix='" + tracePrefix + "', nameAttributeKeys=" + nameAttributeKeys
                + ", hostName='" + hostName + "', attributes=" + attributes + '}';
    }
}
