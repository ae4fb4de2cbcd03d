package dev.mars.pgprojection.outbox;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message read back from the outbox table.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class OutboxMessage {

    private final long id;
    private final String topic;
    private final String messageType;
    private final JsonNode payload;
    private final Map<String, String> headers;
    private final Instant createdAt;

    public OutboxMessage(long id, String topic, String messageType, JsonNode payload, Map<String, String> headers,
                         Instant createdAt) {
        this.id = id;
        this.topic = Objects.requireNonNull(topic, "Topic cannot be null");
        this.messageType = messageType;
        this.payload = payload;
        this.headers = headers != null ? new HashMap<>(headers) : new HashMap<>();
        this.createdAt = Objects.requireNonNull(createdAt, "Created timestamp cannot be null");
    }

    public long getId() {
        return id;
    }

    public String getTopic() {
        return topic;
    }

    /**
     * @return The class name of the published message
     */
    public String getMessageType() {
        return messageType;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "OutboxMessage{id=" + id + ", topic='" + topic + "', type=" + messageType + ", createdAt=" + createdAt + '}';
    }
}
