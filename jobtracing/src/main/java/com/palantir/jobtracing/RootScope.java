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
 * The outermost scope of a traced job. Closing it ends the root span, ends any scopes leaked by the job, and
 * uninstalls the {@link TraceContext} from the current thread. The finished tree is then ready for
 * {@link ExportScheduler#exportOnCompletion export}.
 */
public final class RootScope implements CloseableSpan {
    private final TraceContext context;

    RootScope(TraceContext context) {
        this.context = context;
    }

    public TraceContext context() {
        return context;
    }

    public RecordingSpan span() {
        return context.root();
    }

    @Override
    public void close() {
        context.closeRoot();
    }

    @Override
    public String toString() {
        return "RootScope{context=" + context + '}';
    }
}
