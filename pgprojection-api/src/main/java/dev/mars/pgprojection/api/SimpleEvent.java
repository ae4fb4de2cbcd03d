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
import java.util.Objects;
import java.util.UUID;

/**
 * Simple immutable implementation of the Event interface.
 *
 * @param <T> The type of event payload
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class SimpleEvent<T> implements Event<T> {

    public static final String DEFAULT_TENANT = "*DEFAULT*";

    private final UUID eventId;
    private final long sequence;
    private final UUID streamId;
    private final String streamKey;
    private final long version;
    private final String eventType;
    private final T payload;
    private final String tenantId;
    private final Instant timestamp;
    private final Map<String, String> headers;

    private SimpleEvent(Builder<T> builder) {
        this.eventId = builder.eventId != null ? builder.eventId : UUID.randomUUID();
        this.sequence = builder.sequence;
        this.streamId = builder.streamId;
        this.streamKey = builder.streamKey;
        this.version = builder.version;
        this.payload = Objects.requireNonNull(builder.payload, "Payload cannot be null");
        this.eventType = builder.eventType != null ? builder.eventType : payload.getClass().getSimpleName();
        this.tenantId = builder.tenantId != null ? builder.tenantId : DEFAULT_TENANT;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.headers = builder.headers != null ? Map.copyOf(builder.headers) : Map.of();

        if (streamId == null && streamKey == null) {
            throw new IllegalArgumentException("Event must belong to a stream (id or key)");
        }
        if (streamId != null && streamKey != null) {
            throw new IllegalArgumentException("Event stream cannot have both an id and a key");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence cannot be negative: " + sequence);
        }
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative: " + version);
        }
    }

    public static <T> Builder<T> builder(T payload) {
        return new Builder<T>().payload(payload);
    }

    @Override
    public UUID getEventId() {
        return eventId;
    }

    @Override
    public long getSequence() {
        return sequence;
    }

    @Override
    public UUID getStreamId() {
        return streamId;
    }

    @Override
    public String getStreamKey() {
        return streamKey;
    }

    @Override
    public long getVersion() {
        return version;
    }

    @Override
    public String getEventType() {
        return eventType;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Creates a copy of this event with the given stream version.
     */
    public SimpleEvent<T> withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    /**
     * Creates a copy of this event with the given sequence and version, as assigned on append.
     */
    public SimpleEvent<T> withSequence(long newSequence, long newVersion) {
        return toBuilder().sequence(newSequence).version(newVersion).build();
    }

    public SimpleEvent<T> withTenant(String newTenantId) {
        return toBuilder().tenantId(newTenantId).build();
    }

    private Builder<T> toBuilder() {
        return new Builder<T>()
                .eventId(eventId)
                .sequence(sequence)
                .streamId(streamId)
                .streamKey(streamKey)
                .version(version)
                .eventType(eventType)
                .payload(payload)
                .tenantId(tenantId)
                .timestamp(timestamp)
                .headers(headers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleEvent<?> that = (SimpleEvent<?>) o;
        return sequence == that.sequence &&
                version == that.version &&
                Objects.equals(eventId, that.eventId) &&
                Objects.equals(streamId, that.streamId) &&
                Objects.equals(streamKey, that.streamKey) &&
                Objects.equals(tenantId, that.tenantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, sequence, streamId, streamKey, version, tenantId);
    }

    @Override
    public String toString() {
        return "SimpleEvent{" +
                "eventId=" + eventId +
                ", sequence=" + sequence +
                ", stream=" + getStreamIdentity() +
                ", version=" + version +
                ", eventType='" + eventType + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }

    public static final class Builder<T> {
        private UUID eventId;
        private long sequence;
        private UUID streamId;
        private String streamKey;
        private long version;
        private String eventType;
        private T payload;
        private String tenantId;
        private Instant timestamp;
        private Map<String, String> headers;

        public Builder<T> eventId(UUID eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder<T> sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder<T> streamId(UUID streamId) {
            this.streamId = streamId;
            return this;
        }

        public Builder<T> streamKey(String streamKey) {
            this.streamKey = streamKey;
            return this;
        }

        public Builder<T> version(long version) {
            this.version = version;
            return this;
        }

        public Builder<T> eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder<T> payload(T payload) {
            this.payload = payload;
            return this;
        }

        public Builder<T> tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder<T> timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder<T> headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public SimpleEvent<T> build() {
            return new SimpleEvent<>(this);
        }
    }
}
