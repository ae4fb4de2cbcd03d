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
import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.StreamActionType;
import dev.mars.pgprojection.api.session.ProjectionSession;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Slices by stream: the aggregate identity is the event's stream id or key.
 *
 * <p>Custom identifier types are supported through a conversion from the raw stream
 * identity (a {@link java.util.UUID} or a {@link String}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class SingleStreamSlicer<TDoc, TId> implements EventSlicer<TDoc, TId> {

    private static final Comparator<Event<?>> BY_VERSION = Comparator.comparingLong(Event::getVersion);

    private final Function<Object, TId> identityConversion;

    public SingleStreamSlicer(Function<Object, TId> identityConversion) {
        this.identityConversion = Objects.requireNonNull(identityConversion, "Identity conversion cannot be null");
    }

    /**
     * Slicer for aggregates keyed directly by the stream's UUID or string key.
     */
    @SuppressWarnings("unchecked")
    public static <TDoc, TId> SingleStreamSlicer<TDoc, TId> byStreamIdentity() {
        return new SingleStreamSlicer<>(raw -> (TId) raw);
    }

    public TId identityOf(Event<?> event) {
        Object raw = event.getStreamIdentity();
        if (raw == null) {
            throw new IllegalArgumentException("Event " + event.getEventId() + " has no stream identity");
        }
        return identityConversion.apply(raw);
    }

    @Override
    public CompletableFuture<List<TenantSliceGroup<TDoc, TId>>> sliceAsyncEvents(ProjectionSession session,
                                                                                 List<Event<?>> events) {
        Map<String, TenantSliceGroup<TDoc, TId>> groups = new LinkedHashMap<>();
        for (Event<?> event : events) {
            groups.computeIfAbsent(event.getTenantId(), TenantSliceGroup::new)
                  .addEvent(identityOf(event), event);
        }

        for (TenantSliceGroup<TDoc, TId> group : groups.values()) {
            for (EventSlice<TDoc, TId> slice : group.getSlices()) {
                // List.sort is stable, so equal versions keep their range order
                slice.sortEvents(BY_VERSION);
                slice.setActionType(slice.getEvents().get(0).getVersion() == 1
                        ? StreamActionType.START : StreamActionType.APPEND);
            }
        }
        return CompletableFuture.completedFuture(new ArrayList<>(groups.values()));
    }

    @Override
    public CompletableFuture<List<EventSlice<TDoc, TId>>> sliceInlineActions(ProjectionSession session,
                                                                             List<StreamAction> streams) {
        return CompletableFuture.completedFuture(transform(streams));
    }

    /**
     * One slice per stream action, keeping the action's start/append kind.
     */
    public List<EventSlice<TDoc, TId>> transform(List<StreamAction> streams) {
        List<EventSlice<TDoc, TId>> slices = new ArrayList<>(streams.size());
        for (StreamAction stream : streams) {
            EventSlice<TDoc, TId> slice = new EventSlice<>(
                identityConversion.apply(stream.getStreamIdentity()), stream.getTenantId(), stream.getEvents());
            slice.setActionType(stream.getActionType());
            slices.add(slice);
        }
        return slices;
    }

    @Override
    public boolean isSingleStream() {
        return true;
    }
}
