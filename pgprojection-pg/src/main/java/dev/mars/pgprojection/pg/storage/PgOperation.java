package dev.mars.pgprojection.pg.storage;

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

import dev.mars.pgprojection.api.storage.StorageOperation;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;

/**
 * A storage operation rendered as one parameterised PostgreSQL statement.
 *
 * <p>SQL and parameters are read when the operation executes, not when it is queued,
 * so settings applied after queueing (such as a revision) and values resolved by earlier
 * operations in the same transaction are honoured. Consecutive operations with identical
 * SQL are executed as one Vert.x batch.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public abstract class PgOperation implements StorageOperation {

    private final String tenantId;

    protected PgOperation(String tenantId) {
        this.tenantId = tenantId;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    public abstract String getSql();

    public abstract Tuple getParameters();

    /**
     * Inspects the result of this operation's statement. Throwing fails the enclosing
     * transaction.
     */
    public void postprocess(RowSet<Row> result) {
    }
}
