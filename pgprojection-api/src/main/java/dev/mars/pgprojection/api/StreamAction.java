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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A set of events appended to one stream within one unit of work.
 *
 * Used both by inline projections (the streams touched by the current session)
 * and for events raised as side effects of an async projection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class StreamAction {

    private final Object streamIdentity;
    private final String tenantId;
    private final StreamActionType actionType;
    private final List<Event<?>> events;
    private final Long expectedVersion;

    public StreamAction(Object streamIdentity, String tenantId, StreamActionType actionType,
                        List<? extends Event<?>> events, Long expectedVersion) {
        this.streamIdentity = Objects.requireNonNull(streamIdentity, "Stream identity cannot be null");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID cannot be null");
        this.actionType = Objects.requireNonNull(actionType, "Action type cannot be null");
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.expectedVersion = expectedVersion;
    }

    public static StreamAction start(Object streamIdentity, String tenantId, List<? extends Event<?>> events) {
        return new StreamAction(streamIdentity, tenantId, StreamActionType.START, events, null);
    }

    public static StreamAction append(Object streamIdentity, String tenantId, List<? extends Event<?>> events) {
        return new StreamAction(streamIdentity, tenantId, StreamActionType.APPEND, events, null);
    }

    public Object getStreamIdentity() {
        return streamIdentity;
    }

    public String getTenantId() {
        return tenantId;
    }

    public StreamActionType getActionType() {
        return actionType;
    }

    public List<Event<?>> getEvents() {
        return events;
    }

    /**
     * @return The stream version the append expects to find, or null when unchecked
     */
    public Long getExpectedVersion() {
        return expectedVersion;
    }

    public boolean containsAnyOf(Set<Class<?>> payloadTypes) {
        for (Event<?> event : events) {
            for (Class<?> type : payloadTypes) {
                if (type.isAssignableFrom(event.getPayloadType())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "StreamAction{" + actionType + " " + streamIdentity + " tenant=" + tenantId
                + ", events=" + events.size() + ", expectedVersion=" + expectedVersion + '}';
    }
}
