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

import dev.mars.pgprojection.api.error.ProgressionOutOfOrderException;
import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.pg.storage.PgOperation;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;

/**
 * Moves a shard's recorded progression from {@code floor} to {@code ceiling}. The move only
 * applies when the stored progression still equals the floor, so two writers processing the
 * same range cannot both commit.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgProgressOperation extends PgOperation {

    private static final String INSERT_SQL =
        "INSERT INTO pgp_event_progression AS p (name, last_seq_id, last_updated) VALUES ($1, $2, NOW()) "
        + "ON CONFLICT (name) DO UPDATE SET last_seq_id = EXCLUDED.last_seq_id, last_updated = NOW() "
        + "WHERE p.last_seq_id = 0 RETURNING p.name";

    private static final String UPDATE_SQL =
        "UPDATE pgp_event_progression SET last_seq_id = $2, last_updated = NOW() "
        + "WHERE name = $1 AND last_seq_id = $3 RETURNING name";

    private final String shardName;
    private final long floor;
    private final long ceiling;

    PgProgressOperation(String shardName, long floor, long ceiling) {
        super(null);
        this.shardName = shardName;
        this.floor = floor;
        this.ceiling = ceiling;
    }

    @Override
    public String getSql() {
        return floor == 0 ? INSERT_SQL : UPDATE_SQL;
    }

    @Override
    public Tuple getParameters() {
        return floor == 0 ? Tuple.of(shardName, ceiling) : Tuple.of(shardName, ceiling, floor);
    }

    @Override
    public void postprocess(RowSet<Row> result) {
        if (result.rowCount() == 0) {
            throw new ProgressionOutOfOrderException(shardName, floor);
        }
    }

    public String getShardName() {
        return shardName;
    }

    public long getFloor() {
        return floor;
    }

    public long getCeiling() {
        return ceiling;
    }

    @Override
    public Class<?> getDocumentType() {
        return null;
    }

    @Override
    public OperationRole getRole() {
        return OperationRole.PROGRESSION;
    }

    @Override
    public String toString() {
        return "PgProgressOperation{" + shardName + " " + floor + " -> " + ceiling + '}';
    }
}
