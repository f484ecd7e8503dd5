/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.eduflow.workflow.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Access to the external system that owns content items.
 *
 * <p>Implementations perform their own I/O and complete the returned futures
 * asynchronously. The engine waits on them for at most the configured
 * collaborator timeout.</p>
 */
public interface ContentStore {

    /**
     * Length of the content body in characters, used by {@code min_content_length}.
     */
    CompletableFuture<Integer> getContentLength(String contentUid);

    /**
     * The store's own workflow state for the item; completes with {@code null}
     * when the item has none.
     */
    CompletableFuture<NativeWorkflowSnapshot> getNativeWorkflowState(String contentUid);

    CompletableFuture<Void> setNativeWorkflowState(String contentUid, NativeWorkflowSnapshot snapshot);
}
