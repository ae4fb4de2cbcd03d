package dev.mars.pgprojection.pg.events;

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
import dev.mars.pgprojection.api.Event;
import dev.mars.pgprojection.api.SimpleEvent;
import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.log.EventAppender;
import dev.mars.pgprojection.api.log.EventLogReader;
import dev.mars.pgprojection.api.log.SequenceGenerator;
import dev.mars.pgprojection.api.log.SequenceMark;
import dev.mars.pgprojection.api.log.ShardProgress;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.pg.storage.PgOperationExecutor;
import dev.mars.pgprojection.pg.util.JsonMapping;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * The event log on PostgreSQL: the global event sequence, range reads for the high-water
 * detector and the projection daemon, and append operations for newly raised events.
 *
 * <p>Payloads are stored as jsonb under the name given by the {@link EventTypeRegistry}.
 * Rows whose type cannot be resolved are read back with a {@code JsonNode} payload, which
 * no projection handles, so they keep their place in the sequence without being applied.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgEventLog implements SequenceGenerator, EventLogReader, EventAppender {
    private static final Logger logger = LoggerFactory.getLogger(PgEventLog.class);

    private static final TypeReference<Map<String, String>> HEADERS = new TypeReference<>() {};

    private final Pool pool;
    private final ObjectMapper objectMapper;
    private final EventTypeRegistry eventTypes;
    private final StreamIdentity streamIdentity;

    public PgEventLog(Pool pool) {
        this(pool, JsonMapping.createDefaultObjectMapper(), new EventTypeRegistry(), StreamIdentity.AS_STRING);
    }

    public PgEventLog(Pool pool, ObjectMapper objectMapper, EventTypeRegistry eventTypes,
                      StreamIdentity streamIdentity) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        this.eventTypes = Objects.requireNonNull(eventTypes, "Event type registry cannot be null");
        this.streamIdentity = Objects.requireNonNull(streamIdentity, "Stream identity cannot be null");
    }

    public EventTypeRegistry getEventTypes() {
        return eventTypes;
    }

    @Override
    public CompletableFuture<Long> nextSequence() {
        return ReactiveUtils.toCompletableFuture(
            pool.query("SELECT nextval('pgp_events_sequence')").execute()
                .map(rows -> rows.iterator().next().getLong(0)));
    }

    @Override
    public CompletableFuture<Long> highestAssigned() {
        return ReactiveUtils.toCompletableFuture(
            pool.query("SELECT last_value FROM pgp_events_sequence").execute()
                .map(rows -> rows.iterator().next().getLong(0)));
    }

    @Override
    public CompletableFuture<Optional<ShardProgress>> fetchProgress(String name) {
        String sql = "SELECT name, last_seq_id, last_updated FROM pgp_event_progression WHERE name = $1";
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(name))
                .map(rows -> {
                    if (rows.size() == 0) {
                        return Optional.<ShardProgress>empty();
                    }
                    Row row = rows.iterator().next();
                    return Optional.of(new ShardProgress(row.getString("name"), row.getLong("last_seq_id"),
                            row.getOffsetDateTime("last_updated").toInstant()));
                }));
    }

    @Override
    public CompletableFuture<List<SequenceMark>> fetchSequenceMarks(long afterExclusive, long upToInclusive, int limit) {
        String sql = "SELECT seq_id, timestamp FROM pgp_events WHERE seq_id > $1 AND seq_id <= $2 "
            + "ORDER BY seq_id LIMIT $3";
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(afterExclusive, upToInclusive, limit))
                .map(rows -> {
                    List<SequenceMark> marks = new ArrayList<>(rows.size());
                    for (Row row : rows) {
                        marks.add(new SequenceMark(row.getLong("seq_id"),
                                row.getOffsetDateTime("timestamp").toInstant()));
                    }
                    return marks;
                }));
    }

    @Override
    public CompletableFuture<List<Event<?>>> fetchEvents(long floorExclusive, long ceilingInclusive) {
        String sql = "SELECT seq_id, id, stream_id, version, type, data, headers, tenant_id, timestamp "
            + "FROM pgp_events WHERE seq_id > $1 AND seq_id <= $2 ORDER BY seq_id";
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(floorExclusive, ceilingInclusive))
                .map(rows -> {
                    List<Event<?>> events = new ArrayList<>(rows.size());
                    for (Row row : rows) {
                        events.add(mapRowToEvent(row));
                    }
                    logger.debug("Fetched {} event(s) in ({}, {}]", events.size(), floorExclusive, ceilingInclusive);
                    return events;
                }));
    }

    /**
     * Reads one stream's events in version order through the given client.
     */
    public Future<List<Event<?>>> fetchStream(SqlClient client, String streamId, String tenantId) {
        String sql = "SELECT seq_id, id, stream_id, version, type, data, headers, tenant_id, timestamp "
            + "FROM pgp_events WHERE tenant_id = $1 AND stream_id = $2 ORDER BY version";
        return client.preparedQuery(sql).execute(Tuple.of(tenantId, streamId))
            .map(rows -> {
                List<Event<?>> events = new ArrayList<>(rows.size());
                for (Row row : rows) {
                    events.add(mapRowToEvent(row));
                }
                return events;
            });
    }

    private Event<?> mapRowToEvent(Row row) {
        String type = row.getString("type");
        String dataJson = JsonMapping.jsonText(row.getValue("data"));
        String headersJson = JsonMapping.jsonText(row.getValue("headers"));

        Object payload;
        Map<String, String> headers;
        try {
            Optional<Class<?>> payloadType = eventTypes.resolve(type);
            if (payloadType.isPresent()) {
                payload = objectMapper.readValue(dataJson, payloadType.get());
            } else {
                logger.debug("Reading event {} of unknown type '{}' as JSON", row.getLong("seq_id"), type);
                payload = objectMapper.readTree(dataJson);
            }
            headers = objectMapper.readValue(headersJson, HEADERS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize event " + row.getLong("seq_id") + " of type " + type, e);
        }

        SimpleEvent.Builder<Object> builder = SimpleEvent.builder(payload)
            .eventId(row.getUUID("id"))
            .sequence(row.getLong("seq_id"))
            .version(row.getLong("version"))
            .eventType(type)
            .tenantId(row.getString("tenant_id"))
            .timestamp(row.getOffsetDateTime("timestamp").toInstant())
            .headers(headers);
        String stream = row.getString("stream_id");
        if (streamIdentity == StreamIdentity.AS_GUID) {
            builder.streamId(UUID.fromString(stream));
        } else {
            builder.streamKey(stream);
        }
        return builder.build();
    }

    /**
     * Builds the operations appending a stream action's events: one stream version operation
     * followed by one insert per event, all for the action's tenant.
     */
    @Override
    public List<StorageOperation> appendOperations(StreamAction action) {
        if (action.getEvents().isEmpty()) {
            return List.of();
        }

        String streamId = action.getStreamIdentity().toString();
        PgStreamOperation stream = new PgStreamOperation(streamId, action.getTenantId(), action.getEvents().size(),
                action.getActionType(), action.getExpectedVersion());

        List<StorageOperation> operations = new ArrayList<>(action.getEvents().size() + 1);
        operations.add(stream);
        int position = 0;
        for (Event<?> event : action.getEvents()) {
            operations.add(new PgAppendEventOperation(event, stream, position++,
                    eventTypes.nameOf(event.getPayloadType()), toJson(event.getPayload()), toJson(event.getHeaders())));
        }
        return operations;
    }

    /**
     * Appends a stream action's events in their own transaction.
     */
    public CompletableFuture<Void> append(StreamAction action) {
        List<StorageOperation> operations = appendOperations(action);
        return ReactiveUtils.toCompletableFuture(
            pool.withTransaction(conn -> PgOperationExecutor.execute(conn, operations))
                .onSuccess(v -> logger.debug("Appended {} event(s) to stream {}", action.getEvents().size(),
                        action.getStreamIdentity())));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
