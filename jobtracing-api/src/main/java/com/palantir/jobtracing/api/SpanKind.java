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

package com.palantir.jobtracing.api;

/** The role a span plays in the traced interaction. */
public enum SpanKind {
    /** No role was recorded, the default for spans opened by nested instrumentation. */
    UNSPECIFIED,

    /** The server-side handling of work, e.g. a worker executing a queued job. */
    SERVER,

    /** An outgoing call made on behalf of the traced work. */
    CLIENT
}
