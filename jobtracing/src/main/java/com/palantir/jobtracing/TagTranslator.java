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

import java.util.Map;

/**
 * Turns fields of a job into attributes of its root span. {@link JobTracingConfig#additionalTags()} takes these in
 * addition to the plain key copy done for {@link JobTracingConfig#spanAttributeKeys()}.
 *
 * @param <S> what the attributes are read from, usually {@link JobDescriptor}
 */
public interface TagTranslator<S> {

    /**
     * Writes the attributes for {@code data} onto {@code target} through {@code adapter}, e.g. to record a job's
     * priority under a name of its own:
     *
     * <pre>{@code
     * enum PriorityTagTranslator implements TagTranslator<JobDescriptor> {
     *     INSTANCE;
     *     <T> void translate(TagAdapter<T> adapter, T target, JobDescriptor job) {
     *         job.get("priority").ifPresent(priority -> adapter.tag(target, "job.priority", priority));
     *     }
     * }
     * }</pre>
     */
    <T> void translate(TagAdapter<T> adapter, T target, S data);

    /** Lets {@link RecordingSpan#tag} skip jobs for which this translator writes nothing. */
    default boolean isEmpty(S _data) {
        return false;
    }

    /** Receives attributes on behalf of a span. */
    interface TagAdapter<T> {
        void tag(T target, String key, String value);

        void tag(T target, Map<String, String> tags);
    }
}
