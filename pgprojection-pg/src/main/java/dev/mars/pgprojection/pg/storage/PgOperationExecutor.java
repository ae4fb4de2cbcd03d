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
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes queued operations in order on one client, usually a transaction's connection.
 *
 * <p>Runs of consecutive operations sharing the same SQL go to the server as a single
 * {@code executeBatch}; every operation still sees its own result.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class PgOperationExecutor {
    private static final Logger logger = LoggerFactory.getLogger(PgOperationExecutor.class);

    private PgOperationExecutor() {
    }

    public static Future<Void> execute(SqlClient client, List<? extends StorageOperation> operations) {
        List<List<PgOperation>> runs;
        try {
            runs = groupRuns(operations);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        Future<Void> chain = Future.succeededFuture();
        for (List<PgOperation> run : runs) {
            chain = chain.compose(v -> executeRun(client, run));
        }
        return chain;
    }

    static List<List<PgOperation>> groupRuns(List<? extends StorageOperation> operations) {
        List<List<PgOperation>> runs = new ArrayList<>();
        List<PgOperation> current = null;
        String currentSql = null;
        for (StorageOperation operation : operations) {
            if (!(operation instanceof PgOperation)) {
                throw new IllegalArgumentException("Operation cannot be executed against PostgreSQL: " + operation);
            }
            PgOperation pgOperation = (PgOperation) operation;
            String sql = pgOperation.getSql();
            if (current == null || !sql.equals(currentSql)) {
                current = new ArrayList<>();
                currentSql = sql;
                runs.add(current);
            }
            current.add(pgOperation);
        }
        return runs;
    }

    private static Future<Void> executeRun(SqlClient client, List<PgOperation> run) {
        String sql = run.get(0).getSql();
        if (run.size() == 1) {
            PgOperation operation = run.get(0);
            return client.preparedQuery(sql).execute(operation.getParameters())
                .map(result -> {
                    operation.postprocess(result);
                    return null;
                });
        }

        List<Tuple> batch = new ArrayList<>(run.size());
        for (PgOperation operation : run) {
            batch.add(operation.getParameters());
        }
        logger.trace("Executing batch of {} x {}", run.size(), sql);
        return client.preparedQuery(sql).executeBatch(batch)
            .map(result -> {
                RowSet<Row> current = result;
                for (PgOperation operation : run) {
                    operation.postprocess(current);
                    current = current.next();
                }
                return null;
            });
    }
}
