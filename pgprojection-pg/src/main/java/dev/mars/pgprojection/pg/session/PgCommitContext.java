package dev.mars.pgprojection.pg.session;

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

import dev.mars.pgprojection.api.session.CommitContext;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.pg.storage.PgOperationExecutor;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.sqlclient.SqlClient;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Commit context handed to commit listeners. Before commit it wraps the batch transaction's
 * connection; after commit it wraps the pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgCommitContext implements CommitContext {

    private final SqlClient client;
    private final String tenantId;

    public PgCommitContext(SqlClient client, String tenantId) {
        this.client = Objects.requireNonNull(client, "Client cannot be null");
        this.tenantId = tenantId;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    /**
     * @return The client statements of this context run on
     */
    public SqlClient getClient() {
        return client;
    }

    @Override
    public CompletableFuture<Void> execute(StorageOperation operation) {
        return ReactiveUtils.toCompletableFuture(PgOperationExecutor.execute(client, List.of(operation)));
    }
}
