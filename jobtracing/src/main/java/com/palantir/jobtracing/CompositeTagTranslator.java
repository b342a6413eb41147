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

/** Applies several translators in order; later translators win when they emit the same key. */
final class CompositeTagTranslator<S> implements TagTranslator<S> {

    private final List<TagTranslator<? super S>> translators;

    CompositeTagTranslator(List<? extends TagTranslator<? super S>> translators) {
        this.translators = ImmutableList.copyOf(translators);
    }

    @Override
    public <T> void translate(TagAdapter<T> adapter, T target, S data) {
        for (TagTranslator<? super S> translator : translators) {
            if (!translator.isEmpty(data)) {
                translator.translate(adapter, target, data);
            }
        }
    }

    @Override
    public boolean isEmpty(S data) {
        for (TagTranslator<? super S> translator : translators) {
            if (!translator.isEmpty(data)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "CompositeTagTranslator{translators=" + translators + '}';
    }
}
