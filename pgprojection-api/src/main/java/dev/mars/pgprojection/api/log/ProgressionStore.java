package dev.mars.pgprojection.api.log;

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

import java.util.concurrent.CompletableFuture;

/**
 * Durable per-shard progression.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface ProgressionStore {

    /** Progression row name holding the detected high-water mark. */
    String HIGH_WATER_MARK = "HighWaterMark";

    /**
     * Builds an operation that moves a shard from {@code floor} to {@code ceiling}.
     * Queued into the same batch as the range's read-model changes so both commit together.
     * Executing it fails with a concurrency error if the stored progress is not {@code floor}.
     */
    StorageOperation markProgress(String shardName, long floor, long ceiling);

    CompletableFuture<Void> saveHighWaterMark(long mark);
}
