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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgprojection.api.messaging.MessageBatch;
import dev.mars.pgprojection.api.messaging.MessageOutbox;
import dev.mars.pgprojection.api.session.ProjectionSession;
import dev.mars.pgprojection.pg.schema.PgSchemaInitializer;
import dev.mars.pgprojection.pg.util.JsonMapping;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * PostgreSQL message outbox for projection side effects.
 *
 * <p>Each projection update batch gets one {@link PgMessageBatch}; its messages are inserted
 * into {@code pgp_outbox} inside the batch transaction. A relay claims pending messages with
 * {@link #claimPending(String, int)}, which uses {@code FOR UPDATE SKIP LOCKED} so several relays
 * can share a topic, and acknowledges them with {@link #markCompleted(Collection)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgMessageOutbox implements MessageOutbox {
    private static final Logger logger = LoggerFactory.getLogger(PgMessageOutbox.class);

    public static final String OUTBOX_SCRIPT = "/db/pgprojection-outbox.sql";

    private static final TypeReference<Map<String, String>> HEADERS = new TypeReference<>() {
    };

    private final Pool pool;
    private final ObjectMapper objectMapper;
    private final String defaultTopic;

    public PgMessageOutbox(Pool pool, String defaultTopic) {
        this(pool, JsonMapping.createDefaultObjectMapper(), defaultTopic);
    }

    public PgMessageOutbox(Pool pool, ObjectMapper objectMapper, String defaultTopic) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.defaultTopic = Objects.requireNonNull(defaultTopic, "Default topic cannot be null");
    }

    /**
     * Creates the outbox table if it does not exist.
     */
    public CompletableFuture<Void> initializeSchema() {
        return ReactiveUtils.toCompletableFuture(new PgSchemaInitializer(pool).runScript(OUTBOX_SCRIPT)
            .onSuccess(v -> logger.info("Outbox schema initialized")));
    }

    @Override
    public CompletableFuture<MessageBatch> createBatch(ProjectionSession session) {
        PgMessageBatch batch = new PgMessageBatch(objectMapper, defaultTopic, UUID.randomUUID().toString(),
                session != null ? session.getTenantId() : null);
        logger.debug("Created outbox batch {}", batch.getBatchId());
        return CompletableFuture.completedFuture(batch);
    }

    /**
     * Claims up to {@code limit} pending messages of a topic, oldest first, marking them as processing.
     */
    public CompletableFuture<List<OutboxMessage>> claimPending(String topic, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1: " + limit);
        }
        String sql = """
            UPDATE pgp_outbox
            SET status = 'PROCESSING', processed_at = NOW()
            WHERE id IN (
                SELECT id FROM pgp_outbox
                WHERE topic = $1 AND status = 'PENDING'
                ORDER BY id ASC
                LIMIT $2
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id, topic, message_type, payload, headers, created_at
            """;
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(topic, limit))
                .map(this::toMessages)
                .onSuccess(messages -> logger.debug("Claimed {} outbox message(s) for topic {}", messages.size(), topic)));
    }

    /**
     * Marks claimed messages as delivered.
     */
    public CompletableFuture<Void> markCompleted(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        String sql = "UPDATE pgp_outbox SET status = 'COMPLETED', processed_at = NOW() "
            + "WHERE id = ANY($1) AND status = 'PROCESSING'";
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(ids.toArray(new Long[0])))
                .onSuccess(rows -> logger.debug("Completed {} outbox message(s)", rows.rowCount()))
                .<Void>mapEmpty());
    }

    private List<OutboxMessage> toMessages(RowSet<Row> rows) {
        List<OutboxMessage> messages = new ArrayList<>(rows.size());
        for (Row row : rows) {
            try {
                messages.add(new OutboxMessage(
                    row.getLong("id"),
                    row.getString("topic"),
                    row.getString("message_type"),
                    objectMapper.readTree(JsonMapping.jsonText(row.getValue("payload"))),
                    objectMapper.readValue(JsonMapping.jsonText(row.getValue("headers")), HEADERS),
                    row.getOffsetDateTime("created_at").toInstant()));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to read outbox message " + row.getLong("id"), e);
            }
        }
        messages.sort(Comparator.comparingLong(OutboxMessage::getId));
        return messages;
    }

    @Override
    public String toString() {
        return "PgMessageOutbox{defaultTopic=" + defaultTopic + '}';
    }
}
