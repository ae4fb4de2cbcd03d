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

import java.util.List;
import java.util.Objects;

/**
 * A contiguous sequence window selected for one processing pass of one shard.
 *
 * The floor is exclusive and the ceiling inclusive, so a range {@code (10, 20]}
 * covers sequences 11 through 20. Consecutive ranges of one shard chain by
 * using the previous ceiling as the next floor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class EventRange {

    private final String shardName;
    private final long floor;
    private final long ceiling;
    private final List<Event<?>> events;

    public EventRange(String shardName, long floor, long ceiling, List<Event<?>> events) {
        this.shardName = Objects.requireNonNull(shardName, "Shard name cannot be null");
        if (floor < 0) {
            throw new IllegalArgumentException("Floor cannot be negative: " + floor);
        }
        if (ceiling < floor) {
            throw new IllegalArgumentException("Ceiling " + ceiling + " is below floor " + floor);
        }
        this.floor = floor;
        this.ceiling = ceiling;
        this.events = events != null ? List.copyOf(events) : List.of();
    }

    public static EventRange of(String shardName, long floor, long ceiling) {
        return new EventRange(shardName, floor, ceiling, List.of());
    }

    public String getShardName() {
        return shardName;
    }

    public long getFloor() {
        return floor;
    }

    public long getCeiling() {
        return ceiling;
    }

    public List<Event<?>> getEvents() {
        return events;
    }

    public boolean contains(long sequence) {
        return sequence > floor && sequence <= ceiling;
    }

    public long size() {
        return ceiling - floor;
    }

    public EventRange withEvents(List<Event<?>> loaded) {
        return new EventRange(shardName, floor, ceiling, loaded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventRange that = (EventRange) o;
        return floor == that.floor && ceiling == that.ceiling && shardName.equals(that.shardName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shardName, floor, ceiling);
    }

    @Override
    public String toString() {
        return "EventRange{" + shardName + " (" + floor + ", " + ceiling + "], events=" + events.size() + '}';
    }
}
