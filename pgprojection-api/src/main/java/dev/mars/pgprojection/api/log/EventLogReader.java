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

import dev.mars.pgprojection.api.Event;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the event log used by the high-water detector and shard loops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventLogReader {

    CompletableFuture<Optional<ShardProgress>> fetchProgress(String name);

    /**
     * Reads committed sequence numbers in ascending order.
     *
     * @param afterExclusive lower bound, exclusive
     * @param upToInclusive upper bound, inclusive
     * @param limit maximum number of marks to return
     */
    CompletableFuture<List<SequenceMark>> fetchSequenceMarks(long afterExclusive, long upToInclusive, int limit);

    /**
     * Reads the events of a range in ascending sequence order.
     */
    CompletableFuture<List<Event<?>>> fetchEvents(long floorExclusive, long ceilingInclusive);
}
