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

import dev.mars.pgprojection.api.error.ConcurrencyException;
import dev.mars.pgprojection.api.error.StreamLockedException;
import dev.mars.pgprojection.api.projection.ProjectionLifecycle;
import dev.mars.pgprojection.core.aggregation.AggregationRuntime;
import dev.mars.pgprojection.pg.events.PgEventLog;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a single-stream aggregate for a command that is about to append to its stream.
 *
 * <p>The stream version is read first, optionally locking the stream row with
 * {@code FOR UPDATE NOWAIT}. A version other than the expected one raises
 * {@link ConcurrencyException}; a row locked by another transaction raises
 * {@link StreamLockedException}. Inline projections read the stored document, any other
 * lifecycle folds the stream's events.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgAggregateFetcher<TDoc, TId> {
    private static final Logger logger = LoggerFactory.getLogger(PgAggregateFetcher.class);

    private final AggregationRuntime<TDoc, TId> runtime;
    private final PgDocumentStorage<TDoc, TId> storage;
    private final PgEventLog eventLog;

    public PgAggregateFetcher(AggregationRuntime<TDoc, TId> runtime, PgDocumentStorage<TDoc, TId> storage,
                              PgEventLog eventLog) {
        this.runtime = Objects.requireNonNull(runtime, "Runtime cannot be null");
        this.storage = storage;
        this.eventLog = Objects.requireNonNull(eventLog, "Event log cannot be null");
        if (!runtime.getSlicer().isSingleStream()) {
            throw new IllegalArgumentException("Fetch for writing needs a single-stream projection: "
                    + runtime.getProjection().getName());
        }
        if (storage == null && runtime.getProjection().getLifecycle() == ProjectionLifecycle.INLINE) {
            throw new IllegalArgumentException("Inline projection " + runtime.getProjection().getName()
                    + " needs document storage");
        }
    }

    /**
     * Fetches the aggregate inside the caller's transaction.
     *
     * @param conn A connection with an open transaction
     * @param streamId The stream identity
     * @param tenantId The tenant
     * @param expectedVersion The version the caller expects the stream to be at, or null for any
     * @param forUpdate Whether to lock the stream row until the transaction ends
     */
    public CompletableFuture<WritableAggregate<TDoc>> fetchForWriting(SqlConnection conn, Object streamId,
                                                                      String tenantId, Long expectedVersion,
                                                                      boolean forUpdate) {
        String key = streamId.toString();
        String sql = "SELECT version FROM pgp_streams WHERE tenant_id = $1 AND id = $2"
            + (forUpdate ? " FOR UPDATE NOWAIT" : "");

        Future<Long> version = conn.preparedQuery(sql).execute(Tuple.of(tenantId, key))
            .map(rows -> rows.size() == 0 ? 0L : rows.iterator().next().getLong("version"))
            .recover(error -> {
                if (forUpdate && PgStorageFailureClassifier.isLockNotAvailable(error)) {
                    logger.debug("Stream {} is locked by another transaction", key);
                    return Future.failedFuture(new StreamLockedException(streamId, error));
                }
                return Future.failedFuture(error);
            });

        return ReactiveUtils.toCompletableFuture(version.compose(current -> {
            if (expectedVersion != null && expectedVersion != current.longValue()) {
                return Future.failedFuture(new ConcurrencyException("stream", streamId, expectedVersion, current));
            }
            return loadAggregate(conn, streamId, key, tenantId)
                .map(aggregate -> new WritableAggregate<>(streamId, aggregate, current));
        }));
    }

    private Future<TDoc> loadAggregate(SqlConnection conn, Object streamId, String key, String tenantId) {
        TId id = runtime.getProjection().getIdentityType().isInstance(streamId)
                ? runtime.getProjection().getIdentityType().cast(streamId)
                : null;
        if (runtime.getProjection().getLifecycle() == ProjectionLifecycle.INLINE) {
            if (id == null) {
                return Future.failedFuture(new IllegalArgumentException("Stream id " + streamId
                        + " is not a " + runtime.getProjection().getIdentityType().getSimpleName()));
            }
            return storage.load(conn, id, tenantId);
        }
        return eventLog.fetchStream(conn, key, tenantId)
            .map(events -> events.isEmpty()
                    ? null
                    : runtime.aggregateLive(id != null ? id : runtime.identityFromEvent(events.get(0)), events));
    }
}
