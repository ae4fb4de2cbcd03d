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
import java.util.Map;
import java.util.UUID;

/**
 * Represents an immutable event committed to the projection event log.
 *
 * Every event carries a global sequence number assigned at commit time and a
 * per-stream version. Sequence numbers are monotonic but not necessarily
 * contiguous: a transaction that reserved a number and then rolled back leaves
 * a permanent gap, and a transaction still in flight leaves a temporary one.
 *
 * A stream is identified either by a {@link UUID} or by a string key, never both.
 *
 * @param <T> The type of event payload
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface Event<T> {

    /**
     * Gets the unique identifier of the event.
     *
     * @return The event ID
     */
    UUID getEventId();

    /**
     * Gets the global sequence number assigned when the event was committed.
     * Zero for an event that has not been appended yet.
     *
     * @return The global sequence
     */
    long getSequence();

    /**
     * Gets the stream identity when streams are identified by UUID.
     *
     * @return The stream id, or null if the stream is identified by key
     */
    UUID getStreamId();

    /**
     * Gets the stream identity when streams are identified by string key.
     *
     * @return The stream key, or null if the stream is identified by UUID
     */
    String getStreamKey();

    /**
     * Gets the version of this event within its stream, starting at 1.
     *
     * @return The stream version
     */
    long getVersion();

    /**
     * Gets the event type tag.
     *
     * @return The event type
     */
    String getEventType();

    /**
     * Gets the payload of the event.
     *
     * @return The event payload
     */
    T getPayload();

    /**
     * Gets the tenant the event belongs to.
     *
     * @return The tenant ID
     */
    String getTenantId();

    /**
     * Gets the commit timestamp of the event.
     *
     * @return The timestamp
     */
    Instant getTimestamp();

    /**
     * Gets the headers associated with the event.
     *
     * @return The event headers, never null
     */
    Map<String, String> getHeaders();

    /**
     * Returns the stream identity regardless of whether it is a UUID or a key.
     *
     * @return The stream id or key
     */
    default Object getStreamIdentity() {
        return getStreamId() != null ? getStreamId() : getStreamKey();
    }

    /**
     * Returns the runtime type of the payload, used to dispatch handlers.
     *
     * @return The payload class
     */
    default Class<?> getPayloadType() {
        T payload = getPayload();
        return payload == null ? Void.class : payload.getClass();
    }
}
