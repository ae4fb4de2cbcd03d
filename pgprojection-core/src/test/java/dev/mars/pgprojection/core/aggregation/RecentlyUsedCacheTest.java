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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class RecentlyUsedCacheTest {

    @Test
    void testCompactsToLimit() {
        RecentlyUsedCache<String, String> cache = new RecentlyUsedCache<>(2);
        for (String id : List.of("a", "b", "c", "d", "e")) {
            cache.store(id, id.toUpperCase());
        }

        cache.compactIfNecessary();

        assertEquals(2, cache.size());
        assertEquals(2, cache.getLimit());
    }

    @Test
    void testFindsStoredAggregate() {
        RecentlyUsedCache<String, String> cache = new RecentlyUsedCache<>(5);
        cache.store("a", "A");

        assertEquals("A", cache.tryFind("a").orElseThrow());
        assertTrue(cache.tryFind("b").isEmpty());
    }

    @Test
    void testStoringNullRemoves() {
        RecentlyUsedCache<String, String> cache = new RecentlyUsedCache<>(5);
        cache.store("a", "A");

        cache.store("a", null);

        assertTrue(cache.tryFind("a").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void testRemove() {
        RecentlyUsedCache<String, String> cache = new RecentlyUsedCache<>(5);
        cache.store("a", "A");
        cache.remove("a");
        cache.remove("missing");

        assertEquals(0, cache.size());
    }

    @Test
    void testLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RecentlyUsedCache<String, String>(0));
    }

    @Test
    void testNulloCacheKeepsNothing() {
        NulloAggregateCache<String, String> cache = new NulloAggregateCache<>();
        cache.store("a", "A");
        cache.compactIfNecessary();

        assertTrue(cache.tryFind("a").isEmpty());
        assertEquals(0, cache.size());
    }
}
