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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;

/**
 * Bounded aggregate cache backed by Caffeine.
 *
 * <p>The size bound is enforced by Caffeine's eviction policy, which favours recently
 * and frequently used identities. Maintenance runs on the calling thread, and
 * {@link #compactIfNecessary()} forces any pending eviction.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class RecentlyUsedCache<TId, TDoc> implements AggregateCache<TId, TDoc> {

    private final int limit;
    private final Cache<TId, TDoc> entries;

    public RecentlyUsedCache(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Cache limit must be at least 1: " + limit);
        }
        this.limit = limit;
        this.entries = Caffeine.newBuilder()
            .maximumSize(limit)
            .executor(Runnable::run)
            .build();
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public Optional<TDoc> tryFind(TId id) {
        return Optional.ofNullable(entries.getIfPresent(id));
    }

    @Override
    public void store(TId id, TDoc aggregate) {
        if (aggregate == null) {
            entries.invalidate(id);
        } else {
            entries.put(id, aggregate);
        }
    }

    @Override
    public void remove(TId id) {
        entries.invalidate(id);
    }

    @Override
    public void compactIfNecessary() {
        entries.cleanUp();
    }

    @Override
    public int size() {
        return (int) entries.estimatedSize();
    }
}
