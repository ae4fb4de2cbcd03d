package dev.mars.pgprojection.api.messaging;

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

import dev.mars.pgprojection.api.session.ProjectionSession;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Creates message batches bound to a projection session.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface MessageOutbox {

    CompletableFuture<MessageBatch> createBatch(ProjectionSession session);

    /**
     * Outbox that accepts messages and drops them. Used when no outbox is configured.
     */
    MessageOutbox NONE = session -> CompletableFuture.completedFuture(new MessageBatch() {
        @Override
        public CompletableFuture<Void> publish(Object message, Map<String, String> headers) {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public int getPendingCount() {
            return 0;
        }
    });
}
