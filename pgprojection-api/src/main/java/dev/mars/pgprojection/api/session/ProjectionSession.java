package dev.mars.pgprojection.api.session;

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

import dev.mars.pgprojection.api.log.EventAppender;
import dev.mars.pgprojection.api.messaging.MessageBatch;
import dev.mars.pgprojection.api.projection.ShardExecutionMode;
import dev.mars.pgprojection.api.storage.DocumentStorage;
import dev.mars.pgprojection.api.storage.StorageOperation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The unit-of-work boundary a projection applies its changes through.
 *
 * For async projections there is one session per tenant per batch. For inline
 * projections the session is the one that appended the events.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface ProjectionSession {

    String getTenantId();

    /**
     * @return The shard mode, or null when applying inline
     */
    ShardExecutionMode getExecutionMode();

    void queueOperation(StorageOperation operation);

    /**
     * Queues several operations so that they are accepted together or not at all.
     */
    void queueOperations(List<? extends StorageOperation> operations);

    /**
     * Queues operations together with an action that runs only when they are accepted,
     * such as publishing the messages that belong with them.
     */
    default void queueOperations(List<? extends StorageOperation> operations, Runnable onAccepted) {
        queueOperations(operations);
        onAccepted.run();
    }

    /**
     * Loads a document, going through the session identity map when the session has one.
     *
     * @return A future completing with the document or null
     */
    <TDoc, TId> CompletableFuture<TDoc> load(DocumentStorage<TDoc, TId> storage, TId id);

    /**
     * Returns the outbound message batch of the current unit of work, creating it on first use.
     */
    CompletableFuture<MessageBatch> currentMessageBatch();

    /**
     * @return The appender for raised events, or null when the session cannot append
     */
    EventAppender getEventAppender();
}
