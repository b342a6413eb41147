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

/**
 * Decides, once per job and before any span is created, whether a job execution is traced. Implementations must be
 * side-effect free; a gate that throws fails the job's handling rather than silently skipping the job.
 */
@FunctionalInterface
public interface SamplingGate {
    boolean shouldSample(JobDescriptor job);
}
