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
 * Pass-through cache used when caching is disabled: always misses, stores nothing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class NulloAggregateCache<TId, TDoc> implements AggregateCache<TId, TDoc> {

    @Override
    public Optional<TDoc> tryFind(TId id) {
        return Optional.empty();
    }

    @Override
    public void store(TId id, TDoc aggregate) {
        // nothing to keep
    }

    @Override
    public void remove(TId id) {
        // nothing to evict
    }

    @Override
    public void compactIfNecessary() {
        // nothing to compact
    }

    @Override
    public int size() {
        return 0;
    }
}
