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

import java.io.Closeable;

/** A root or nested job span that ends when closed. Open it in a try-with-resources block on the job's thread. */
public interface CloseableSpan extends Closeable {

    /**
     * Ends the span and makes its parent current again. Must be called on the job's thread. A nested scope must be
     * closed after every scope opened inside it, while the root scope ends any such scope it finds still open.
     */
    @Override
    void close();
}
