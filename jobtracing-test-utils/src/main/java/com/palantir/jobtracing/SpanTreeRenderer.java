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

import com.google.common.base.Strings;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanTree;

/**
 * Renders the shape of a span tree as indented span names, one per line, e.g.
 *
 * <pre>
 * jobs/default/MailerJob
 *   render
 *     template
 *   deliver
 * </pre>
 */
public final class SpanTreeRenderer {
    private static final int INDENT = 2;

    private SpanTreeRenderer() {}

    public static String render(SpanTree tree) {
        StringBuilder sb = new StringBuilder();
        render(tree.getRoot(), 0, sb);
        return sb.toString();
    }

    private static void render(Span span, int depth, StringBuilder sb) {
        sb.append(Strings.repeat(" ", depth * INDENT)).append(span.getName()).append('\n');
        for (Span child : span.getChildren()) {
            render(child, depth + 1, sb);
        }
    }
}
