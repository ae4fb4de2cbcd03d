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

import dev.mars.pgprojection.api.log.ProgressionStore;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Shard progression and the persisted high-water mark in {@code pgp_event_progression}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgProgressionStore implements ProgressionStore {
    private static final Logger logger = LoggerFactory.getLogger(PgProgressionStore.class);

    private final Pool pool;

    public PgProgressionStore(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
    }

    @Override
    public StorageOperation markProgress(String shardName, long floor, long ceiling) {
        if (ceiling < floor) {
            throw new IllegalArgumentException("Ceiling " + ceiling + " is below floor " + floor + " for " + shardName);
        }
        return new PgProgressOperation(shardName, floor, ceiling);
    }

    @Override
    public CompletableFuture<Void> saveHighWaterMark(long mark) {
        String sql = "INSERT INTO pgp_event_progression (name, last_seq_id, last_updated) VALUES ($1, $2, NOW()) "
            + "ON CONFLICT (name) DO UPDATE SET last_seq_id = EXCLUDED.last_seq_id, last_updated = NOW()";
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(HIGH_WATER_MARK, mark))
                .<Void>mapEmpty()
                .onSuccess(v -> logger.debug("Persisted high water mark {}", mark)));
    }
}
