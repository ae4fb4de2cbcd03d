package dev.mars.pgprojection.core.aggregation;

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

import java.util.Optional;

/**
 * Per-tenant, in-memory cache of the last known aggregate for each identity.
 *
 * Holds no durable state; losing it only costs extra loads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface AggregateCache<TId, TDoc> {

    Optional<TDoc> tryFind(TId id);

    void store(TId id, TDoc aggregate);

    void remove(TId id);

    /**
     * Evicts entries beyond the limit.
     */
    void compactIfNecessary();

    int size();
}
