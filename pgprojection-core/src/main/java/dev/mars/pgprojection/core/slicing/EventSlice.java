package dev.mars.pgprojection.core.slicing;

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
import dev.mars.pgprojection.api.StreamActionType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One aggregate identity's events for a single processing pass.
 *
 * <p>Created by an {@link EventSlicer}, given its prior aggregate by the update batch
 * (from the cache or a multi-get load), folded by the aggregation runtime, and
 * discarded once the batch commits. Side effects raised while folding are collected
 * here and turned into operations by the runtime.</p>
 *
 * @param <TDoc> The aggregate document type
 * @param <TId> The identity type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class EventSlice<TDoc, TId> {

    private final TId id;
    private final String tenantId;
    private final List<Event<?>> events = new ArrayList<>();
    private final List<RaisedEvent> raisedEvents = new ArrayList<>();
    private final List<PublishedMessage> publishedMessages = new ArrayList<>();
    private StreamActionType actionType = StreamActionType.APPEND;
    private volatile TDoc aggregate;

    public EventSlice(TId id, String tenantId) {
        this.id = Objects.requireNonNull(id, "Slice identity cannot be null");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID cannot be null");
    }

    public EventSlice(TId id, String tenantId, List<? extends Event<?>> events) {
        this(id, tenantId);
        this.events.addAll(events);
    }

    public TId getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public List<Event<?>> getEvents() {
        return Collections.unmodifiableList(events);
    }

    void addEvent(Event<?> event) {
        events.add(event);
    }

    void sortEvents(Comparator<Event<?>> order) {
        events.sort(order);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int count() {
        return events.size();
    }

    /**
     * @return The last event of the slice, or null when empty
     */
    public Event<?> getLastEvent() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public StreamActionType getActionType() {
        return actionType;
    }

    public void setActionType(StreamActionType actionType) {
        this.actionType = Objects.requireNonNull(actionType, "Action type cannot be null");
    }

    /**
     * The prior aggregate before folding, and the resulting aggregate afterwards.
     */
    public TDoc getAggregate() {
        return aggregate;
    }

    public void setAggregate(TDoc aggregate) {
        this.aggregate = aggregate;
    }

    /**
     * Raises an event onto the aggregate's own stream.
     */
    public void raiseEvent(Object payload) {
        raiseEvent(id, payload);
    }

    /**
     * Raises an event onto another stream. Only honoured while running continuously.
     */
    public void raiseEvent(Object streamIdentity, Object payload) {
        raisedEvents.add(new RaisedEvent(streamIdentity, payload));
    }

    public void publishMessage(Object message) {
        publishMessage(message, Map.of());
    }

    public void publishMessage(Object message, Map<String, String> headers) {
        publishedMessages.add(new PublishedMessage(message, headers));
    }

    public List<RaisedEvent> getRaisedEvents() {
        return Collections.unmodifiableList(raisedEvents);
    }

    public List<PublishedMessage> getPublishedMessages() {
        return Collections.unmodifiableList(publishedMessages);
    }

    @Override
    public String toString() {
        return "EventSlice{id=" + id + ", tenant=" + tenantId + ", events=" + events.size()
                + ", action=" + actionType + '}';
    }

    /**
     * An event raised as a side effect, appended with the batch.
     */
    public static final class RaisedEvent {
        private final Object streamIdentity;
        private final Object payload;

        RaisedEvent(Object streamIdentity, Object payload) {
            this.streamIdentity = Objects.requireNonNull(streamIdentity, "Stream identity cannot be null");
            this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        }

        public Object getStreamIdentity() {
            return streamIdentity;
        }

        public Object getPayload() {
            return payload;
        }
    }

    /**
     * An outbound message published as a side effect.
     */
    public static final class PublishedMessage {
        private final Object message;
        private final Map<String, String> headers;

        PublishedMessage(Object message, Map<String, String> headers) {
            this.message = Objects.requireNonNull(message, "Message cannot be null");
            this.headers = Map.copyOf(headers);
        }

        public Object getMessage() {
            return message;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }
    }
}
