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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Copies the configured job fields onto the span, under the field's own key. Absent fields are skipped. */
final class JobAttributeTagTranslator implements TagTranslator<JobDescriptor> {

    private final List<String> keys;

    JobAttributeTagTranslator(List<String> keys) {
        this.keys = ImmutableList.copyOf(keys);
    }

    @Override
    public <T> void translate(TagAdapter<T> adapter, T target, JobDescriptor job) {
        for (String key : keys) {
            job.get(key).ifPresent(value -> adapter.tag(target, key, value));
        }
    }

    @Override
    public boolean isEmpty(JobDescriptor job) {
        return keys.isEmpty();
    }

    @Override
    public String toString() {
        return "JobAttributeTagTranslator{keys=" + keys + '}';
    }
}
