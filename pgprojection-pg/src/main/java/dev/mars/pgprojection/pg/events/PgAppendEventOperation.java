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

import dev.mars.pgprojection.api.Event;
import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.pg.storage.PgOperation;
import io.vertx.sqlclient.Tuple;

import java.time.ZoneOffset;

/**
 * Inserts one event into the log. The sequence number comes from the event sequence and
 * the version from the stream operation executed before it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgAppendEventOperation extends PgOperation {

    private static final String SQL =
        "INSERT INTO pgp_events (seq_id, id, stream_id, version, type, data, headers, tenant_id, timestamp) "
        + "VALUES (nextval('pgp_events_sequence'), $1, $2, $3, $4, $5::jsonb, $6::jsonb, $7, $8)";

    private final Event<?> event;
    private final PgStreamOperation stream;
    private final int position;
    private final String type;
    private final String dataJson;
    private final String headersJson;

    PgAppendEventOperation(Event<?> event, PgStreamOperation stream, int position, String type,
                           String dataJson, String headersJson) {
        super(stream.getTenantId());
        this.event = event;
        this.stream = stream;
        this.position = position;
        this.type = type;
        this.dataJson = dataJson;
        this.headersJson = headersJson;
    }

    @Override
    public String getSql() {
        return SQL;
    }

    @Override
    public Tuple getParameters() {
        return Tuple.of(event.getEventId(), stream.getStreamId(), stream.firstVersion() + position, type,
                dataJson, headersJson, getTenantId(), event.getTimestamp().atOffset(ZoneOffset.UTC));
    }

    public Event<?> getEvent() {
        return event;
    }

    @Override
    public Class<?> getDocumentType() {
        return null;
    }

    @Override
    public OperationRole getRole() {
        return OperationRole.EVENTS;
    }

    @Override
    public String toString() {
        return "PgAppendEventOperation{" + type + " -> '" + stream.getStreamId() + "' tenant=" + getTenantId() + '}';
    }
}
