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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the job a worker is about to run, e.g. its class, queue and arguments, as supplied by the job
 * runner. Values are rendered with {@link String#valueOf(Object)} when they become span names or attributes; null
 * values are treated as absent.
 */
public final class JobDescriptor {
    private static final JobDescriptor EMPTY = new JobDescriptor(ImmutableMap.of());

    private final ImmutableMap<String, Object> fields;

    private JobDescriptor(ImmutableMap<String, Object> fields) {
        this.fields = fields;
    }

    public static JobDescriptor of(Map<String, ?> fields) {
        checkNotNull(fields, "fields are required");
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builderWithExpectedSize(fields.size());
        fields.forEach((key, value) -> {
            if (key != null && value != null) {
                builder.put(key, value);
            }
        });
        return new JobDescriptor(builder.buildOrThrow());
    }

    public static JobDescriptor empty() {
        return EMPTY;
    }

    /** The value for {@code key} rendered as a string, or empty if the job has no such field. */
    public Optional<String> get(String key) {
        Object value = fields.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public boolean contains(String key) {
        return fields.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof JobDescriptor && fields.equals(((JobDescriptor) other).fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "JobDescriptor{fields=" + fields + '}';
    }
}
