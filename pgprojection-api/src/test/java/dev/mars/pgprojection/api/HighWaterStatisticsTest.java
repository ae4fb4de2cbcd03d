package dev.mars.pgprojection.api;

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

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class HighWaterStatisticsTest {

    @Test
    void testChangeDetection() {
        Instant now = Instant.now();

        HighWaterStatistics moved = new HighWaterStatistics(5, 9, 12, null, now);
        HighWaterStatistics stable = new HighWaterStatistics(9, 9, 9, now, now);

        assertTrue(moved.hasChanged());
        assertTrue(moved.hasPendingSequences());
        assertFalse(stable.hasChanged());
        assertFalse(stable.hasPendingSequences());
    }

    @Test
    void testCurrentMarkCannotExceedHighest() {
        assertThrows(IllegalArgumentException.class,
                () -> new HighWaterStatistics(0, 5, 4, null, Instant.now()));
    }

    @Test
    void testEventRangeBounds() {
        EventRange range = EventRange.of("Trip:All", 10, 20);

        assertFalse(range.contains(10));
        assertTrue(range.contains(11));
        assertTrue(range.contains(20));
        assertEquals(10, range.size());
        assertThrows(IllegalArgumentException.class, () -> EventRange.of("Trip:All", 5, 4));
    }
}
