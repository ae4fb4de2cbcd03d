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

import dev.mars.pgprojection.api.StreamActionType;
import dev.mars.pgprojection.api.error.ConcurrencyException;
import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.pg.storage.PgOperation;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;

/**
 * Moves a stream's version forward by the number of events appended to it and records
 * the resulting version so the event inserts that follow can number themselves.
 *
 * <p>Starting a stream fails if it already exists. An expected version makes the update
 * conditional on the stored version. Otherwise the stream is created or incremented.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgStreamOperation extends PgOperation {

    private static final String START_SQL =
        "INSERT INTO pgp_streams (id, tenant_id, version) VALUES ($1, $2, $3) "
        + "ON CONFLICT (tenant_id, id) DO NOTHING RETURNING version";

    private static final String EXPECTED_SQL =
        "UPDATE pgp_streams SET version = version + $3, last_modified = NOW() "
        + "WHERE id = $1 AND tenant_id = $2 AND version = $4 RETURNING version";

    private static final String APPEND_SQL =
        "INSERT INTO pgp_streams AS s (id, tenant_id, version) VALUES ($1, $2, $3) "
        + "ON CONFLICT (tenant_id, id) DO UPDATE SET version = s.version + EXCLUDED.version, "
        + "last_modified = NOW() RETURNING s.version";

    private final String streamId;
    private final int eventCount;
    private final StreamActionType actionType;
    private final Long expectedVersion;
    private long resolvedVersion = -1;

    PgStreamOperation(String streamId, String tenantId, int eventCount, StreamActionType actionType,
                      Long expectedVersion) {
        super(tenantId);
        this.streamId = streamId;
        this.eventCount = eventCount;
        this.actionType = actionType;
        this.expectedVersion = expectedVersion;
    }

    private boolean isStart() {
        return actionType == StreamActionType.START || (expectedVersion != null && expectedVersion == 0);
    }

    @Override
    public String getSql() {
        if (isStart()) {
            return START_SQL;
        }
        return expectedVersion != null ? EXPECTED_SQL : APPEND_SQL;
    }

    @Override
    public Tuple getParameters() {
        if (!isStart() && expectedVersion != null) {
            return Tuple.of(streamId, getTenantId(), (long) eventCount, expectedVersion);
        }
        return Tuple.of(streamId, getTenantId(), (long) eventCount);
    }

    @Override
    public void postprocess(RowSet<Row> result) {
        if (result.rowCount() == 0 || !result.iterator().hasNext()) {
            throw new ConcurrencyException("stream", streamId, isStart() ? Long.valueOf(0) : expectedVersion, null);
        }
        resolvedVersion = result.iterator().next().getLong(0);
    }

    /**
     * @return The version of the first appended event, available once this operation has executed
     */
    long firstVersion() {
        if (resolvedVersion < 0) {
            throw new IllegalStateException("Stream " + streamId + " version is not resolved yet");
        }
        return resolvedVersion - eventCount + 1;
    }

    public String getStreamId() {
        return streamId;
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
        return "PgStreamOperation{" + actionType + " '" + streamId + "' tenant=" + getTenantId()
                + ", events=" + eventCount + ", expectedVersion=" + expectedVersion + '}';
    }
}
