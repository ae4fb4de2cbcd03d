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

import dev.mars.pgprojection.api.SimpleEvent;
import dev.mars.pgprojection.api.batch.BatchSession;
import dev.mars.pgprojection.api.batch.OperationPage;
import dev.mars.pgprojection.api.batch.UpdateBatch;
import dev.mars.pgprojection.pg.storage.PgOperationExecutor;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes projection update batches on PostgreSQL.
 *
 * <p>Each batch runs in one transaction using Vert.x {@code Pool.withTransaction}: the
 * batch's pre-update listeners first, then every page in order. Any failure rolls the whole
 * batch back. Post-update listeners run once the transaction has committed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgBatchSession implements BatchSession {
    private static final Logger logger = LoggerFactory.getLogger(PgBatchSession.class);

    private final Pool pool;
    private final String tenantId;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PgBatchSession(Pool pool) {
        this(pool, SimpleEvent.DEFAULT_TENANT);
    }

    public PgBatchSession(Pool pool, String tenantId) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID cannot be null");
    }

    @Override
    public CompletableFuture<Void> executeBatch(UpdateBatch batch) {
        if (closed.get()) {
            return ReactiveUtils.failedFuture(new IllegalStateException("Batch session is closed"));
        }

        List<OperationPage> pages;
        try {
            pages = batch.buildPages();
        } catch (IllegalStateException e) {
            return ReactiveUtils.failedFuture(e);
        }

        Future<Void> committed = pool.withTransaction(conn -> {
            PgCommitContext context = new PgCommitContext(conn, tenantId);
            return ReactiveUtils.fromCompletableFuture(batch.preUpdate(context))
                .compose(v -> executePages(conn, pages));
        });

        return ReactiveUtils.toCompletableFuture(
            committed
                .onSuccess(v -> logger.debug("Committed {} page(s) for {}", pages.size(), batch))
                .compose(v -> ReactiveUtils.fromCompletableFuture(
                    batch.postUpdate(new PgCommitContext(pool, tenantId)))));
    }

    private Future<Void> executePages(SqlConnection conn, List<OperationPage> pages) {
        Future<Void> chain = Future.succeededFuture();
        for (OperationPage page : pages) {
            chain = chain.compose(v -> {
                logger.trace("Executing page {} with {} operation(s)", page.getIndex(), page.size());
                return PgOperationExecutor.execute(conn, page.getOperations());
            });
        }
        return chain;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Marks the session closed. The pool belongs to the connection manager and stays open.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Closed batch session for tenant {}", tenantId);
        }
    }
}
