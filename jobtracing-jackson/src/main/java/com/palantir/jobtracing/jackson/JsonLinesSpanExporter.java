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

package com.palantir.jobtracing.jackson;

import static com.palantir.logsafe.Preconditions.checkNotNull;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.palantir.jobtracing.api.Span;
import com.palantir.jobtracing.api.SpanExporter;
import com.palantir.jobtracing.api.SpanTree;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Writes each exported tree as newline-delimited JSON, one span per line in depth-first pre-order. Children refer to
 * their parent through {@code parentSpanId}; {@link #read(Path)} reassembles the trees.
 *
 * <p>Exports are serialized so that lines of concurrently finishing jobs never interleave.
 */
public final class JsonLinesSpanExporter implements SpanExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new GuavaModule())
            .registerModule(new Jdk8Module())
            .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Nullable
    private final OutputStream stream;

    @Nullable
    private final Path file;

    private JsonLinesSpanExporter(@Nullable OutputStream stream, @Nullable Path file) {
        this.stream = stream;
        this.file = file;
    }

    /** Appends to {@code stream}, flushing after every tree. The stream is never closed by this exporter. */
    public static JsonLinesSpanExporter toStream(OutputStream stream) {
        return new JsonLinesSpanExporter(checkNotNull(stream, "stream is required"), null);
    }

    /** Appends to {@code file}, creating it and its parent directories as needed. */
    public static JsonLinesSpanExporter toFile(Path file) {
        return new JsonLinesSpanExporter(null, checkNotNull(file, "file is required"));
    }

    @Override
    public synchronized void export(SpanTree spanTree, int _maxFrames) {
        try {
            if (stream != null) {
                write(stream, spanTree);
                stream.flush();
            } else {
                Path target = checkNotNull(file, "Exporter has neither a stream nor a file");
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                try (OutputStream out = Files.newOutputStream(
                        target, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    write(out, spanTree);
                }
            }
        } catch (IOException e) {
            throw new SafeRuntimeException(
                    "Failed to export job span tree",
                    e,
                    SafeArg.of("traceId", spanTree.getTraceId()),
                    UnsafeArg.of("file", file));
        }
    }

    private static void write(OutputStream out, SpanTree spanTree) throws IOException {
        for (Span span : spanTree.orderedSpans()) {
            Optional<Integer> dropped = span == spanTree.getRoot() && spanTree.getDroppedSpanCount() > 0
                    ? Optional.of(spanTree.getDroppedSpanCount())
                    : Optional.empty();
            out.write(mapper.writeValueAsBytes(SerializableSpan.fromSpan(span, dropped)));
            out.write('\n');
        }
    }

    /** Reads back every tree written to {@code file}, in the order their root spans appear. */
    public static List<SpanTree> read(Path file) throws IOException {
        List<SerializableSpan> roots = new ArrayList<>();
        ListMultimap<String, SerializableSpan> childrenByParent = ArrayListMultimap.create();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            SerializableSpan span = mapper.readValue(line, SerializableSpan.class);
            if (span.getParentSpanId().isPresent()) {
                childrenByParent.put(key(span.getTraceId(), span.getParentSpanId().get()), span);
            } else {
                roots.add(span);
            }
        }

        ImmutableList.Builder<SpanTree> trees = ImmutableList.builder();
        for (SerializableSpan root : roots) {
            trees.add(SpanTree.builder()
                    .root(assemble(root, childrenByParent))
                    .droppedSpanCount(root.getDroppedSpanCount().orElse(0))
                    .build());
        }
        return trees.build();
    }

    private static Span assemble(SerializableSpan span, ListMultimap<String, SerializableSpan> childrenByParent) {
        List<Span> children = new ArrayList<>();
        for (SerializableSpan child : childrenByParent.get(key(span.getTraceId(), span.getSpanId()))) {
            children.add(assemble(child, childrenByParent));
        }
        return span.asSpan(children);
    }

    private static String key(String traceId, String spanId) {
        return traceId + '/' + spanId;
    }

    @Override
    public String toString() {
        return "JsonLinesSpanExporter{stream=" + stream + ", file=" + file + '}';
    }
}
