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

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of high-water detection state.
 *
 * <ul>
 *   <li>{@code currentMark} - highest sequence known to be contiguous from the start of the log</li>
 *   <li>{@code lastMark} - the previously confirmed mark</li>
 *   <li>{@code highestSequence} - the highest sequence the generator has handed out</li>
 *   <li>{@code lastUpdated} - when the mark was last persisted, null if never</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class HighWaterStatistics {

    private final long lastMark;
    private final long currentMark;
    private final long highestSequence;
    private final Instant lastUpdated;
    private final Instant timestamp;

    public HighWaterStatistics(long lastMark, long currentMark, long highestSequence,
                               Instant lastUpdated, Instant timestamp) {
        if (currentMark > highestSequence) {
            throw new IllegalArgumentException(
                "Current mark " + currentMark + " cannot exceed highest sequence " + highestSequence);
        }
        this.lastMark = lastMark;
        this.currentMark = currentMark;
        this.highestSequence = highestSequence;
        this.lastUpdated = lastUpdated;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public long getLastMark() {
        return lastMark;
    }

    public long getCurrentMark() {
        return currentMark;
    }

    public long getHighestSequence() {
        return highestSequence;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Whether the detector moved the mark beyond the last confirmed one.
     */
    public boolean hasChanged() {
        return currentMark > lastMark;
    }

    /**
     * Whether there are sequences handed out that are not yet safe to consume.
     */
    public boolean hasPendingSequences() {
        return currentMark < highestSequence;
    }

    @Override
    public String toString() {
        return "HighWaterStatistics{" +
                "lastMark=" + lastMark +
                ", currentMark=" + currentMark +
                ", highestSequence=" + highestSequence +
                ", lastUpdated=" + lastUpdated +
                ", timestamp=" + timestamp +
                '}';
    }
}
