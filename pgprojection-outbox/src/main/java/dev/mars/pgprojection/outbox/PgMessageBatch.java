package dev.mars.pgprojection.outbox;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgprojection.api.messaging.MessageBatch;
import dev.mars.pgprojection.api.session.ChangeSet;
import dev.mars.pgprojection.api.session.CommitContext;
import dev.mars.pgprojection.pg.session.PgCommitContext;
import dev.mars.pgprojection.pg.storage.PgOperationExecutor;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Buffers the messages published while a projection batch is built and writes them to the
 * outbox table from the batch's pre-commit hook, so they commit or roll back with the
 * read-model changes.
 *
 * <p>A message is serialized when it is published. The {@value #TOPIC_HEADER} header,
 * when present, overrides the outbox's default topic.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgMessageBatch implements MessageBatch {
    private static final Logger logger = LoggerFactory.getLogger(PgMessageBatch.class);

    public static final String TOPIC_HEADER = "topic";

    private final ObjectMapper objectMapper;
    private final String defaultTopic;
    private final String batchId;
    private final String tenantId;
    private final List<PgOutboxInsertOperation> pending = new ArrayList<>();

    PgMessageBatch(ObjectMapper objectMapper, String defaultTopic, String batchId, String tenantId) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.defaultTopic = Objects.requireNonNull(defaultTopic, "Default topic cannot be null");
        this.batchId = batchId;
        this.tenantId = tenantId;
    }

    @Override
    public CompletableFuture<Void> publish(Object message, Map<String, String> headers) {
        if (message == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Message cannot be null"));
        }
        Map<String, String> safeHeaders = headers != null ? headers : Map.of();

        PgOutboxInsertOperation operation;
        try {
            operation = new PgOutboxInsertOperation(
                safeHeaders.getOrDefault(TOPIC_HEADER, defaultTopic),
                message.getClass().getName(),
                objectMapper.writeValueAsString(message),
                objectMapper.writeValueAsString(safeHeaders),
                batchId,
                tenantId);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("Failed to serialize message " + message.getClass().getName(), e));
        }

        synchronized (pending) {
            pending.add(operation);
        }
        logger.debug("Buffered {} for topic {} in outbox batch {}", operation, operation.getTopic(), batchId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public int getPendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    public String getBatchId() {
        return batchId;
    }

    private List<PgOutboxInsertOperation> snapshot() {
        synchronized (pending) {
            return new ArrayList<>(pending);
        }
    }

    @Override
    public CompletableFuture<Void> beforeCommit(CommitContext context, ChangeSet changes) {
        List<PgOutboxInsertOperation> operations = snapshot();
        if (operations.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        if (context instanceof PgCommitContext) {
            PgCommitContext pgContext = (PgCommitContext) context;
            return ReactiveUtils.toCompletableFuture(PgOperationExecutor.execute(pgContext.getClient(), operations));
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PgOutboxInsertOperation operation : operations) {
            chain = chain.thenCompose(v -> context.execute(operation));
        }
        return chain;
    }

    @Override
    public CompletableFuture<Void> afterCommit(CommitContext context, ChangeSet changes) {
        int written;
        synchronized (pending) {
            written = pending.size();
            pending.clear();
        }
        if (written > 0) {
            logger.info("Committed {} outbox message(s) for batch {}", written, batchId);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String toString() {
        return "PgMessageBatch{" + batchId + ", pending=" + getPendingCount() + '}';
    }
}
