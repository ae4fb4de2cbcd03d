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
import dev.mars.pgprojection.api.error.ProjectionConfigurationException;
import dev.mars.pgprojection.api.session.ProjectionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Slices across streams using identity rules registered per event type.
 *
 * <p>A rule yields zero, one or many identities for an event, so one event can fan out
 * to several aggregates and one aggregate can collect events from many streams. Within
 * each resulting slice events are ordered by global sequence.</p>
 *
 * <p>Rules match on the payload class or any supertype of it. Every event type the
 * projection handles must have a rule; {@link #validate(Collection)} enforces this when
 * the projection is built.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class MultiStreamSlicer<TDoc, TId> implements EventSlicer<TDoc, TId> {
    private static final Logger logger = LoggerFactory.getLogger(MultiStreamSlicer.class);

    private static final Comparator<Event<?>> BY_SEQUENCE = Comparator.comparingLong(Event::getSequence);

    private final Map<Class<?>, Function<Event<?>, Collection<TId>>> rules = new LinkedHashMap<>();
    private final Map<Class<?>, Optional<Function<Event<?>, Collection<TId>>>> resolved = new ConcurrentHashMap<>();

    /**
     * Routes events of the given payload type to the single identity the function returns.
     * A null identity drops the event.
     */
    @SuppressWarnings("unchecked")
    public <E> MultiStreamSlicer<TDoc, TId> identity(Class<E> eventType, Function<E, TId> identity) {
        return register(eventType, event -> {
            TId id = identity.apply((E) event.getPayload());
            return id == null ? List.of() : List.of(id);
        });
    }

    /**
     * Routes events of the given payload type to every identity the function returns.
     */
    @SuppressWarnings("unchecked")
    public <E> MultiStreamSlicer<TDoc, TId> identities(Class<E> eventType, Function<E, Collection<TId>> identities) {
        return register(eventType, event -> {
            Collection<TId> ids = identities.apply((E) event.getPayload());
            return ids == null ? List.of() : ids;
        });
    }

    /**
     * Routes events using the full event, for rules that need the stream or headers.
     */
    public MultiStreamSlicer<TDoc, TId> identityFromEvent(Class<?> eventType, Function<Event<?>, TId> identity) {
        return register(eventType, event -> {
            TId id = identity.apply(event);
            return id == null ? List.of() : List.of(id);
        });
    }

    private MultiStreamSlicer<TDoc, TId> register(Class<?> eventType, Function<Event<?>, Collection<TId>> rule) {
        if (rules.putIfAbsent(eventType, rule) != null) {
            throw new ProjectionConfigurationException(
                "Identity rule for event type " + eventType.getName() + " is already registered");
        }
        resolved.clear();
        return this;
    }

    /**
     * Fails if any of the handled event types has no identity rule.
     */
    public void validate(Collection<Class<?>> handledEventTypes) {
        List<String> missing = handledEventTypes.stream()
            .filter(type -> ruleFor(type).isEmpty())
            .map(Class::getName)
            .sorted()
            .collect(Collectors.toList());

        if (!missing.isEmpty()) {
            throw new ProjectionConfigurationException(
                "No identity rule is registered for event type(s) " + String.join(", ", missing));
        }
    }

    public Set<Class<?>> getRegisteredEventTypes() {
        return Set.copyOf(rules.keySet());
    }

    private Optional<Function<Event<?>, Collection<TId>>> ruleFor(Class<?> payloadType) {
        return resolved.computeIfAbsent(payloadType, type -> {
            Function<Event<?>, Collection<TId>> exact = rules.get(type);
            if (exact != null) {
                return Optional.of(exact);
            }
            return rules.entrySet().stream()
                .filter(entry -> entry.getKey().isAssignableFrom(type))
                .map(Map.Entry::getValue)
                .findFirst();
        });
    }

    @Override
    public CompletableFuture<List<TenantSliceGroup<TDoc, TId>>> sliceAsyncEvents(ProjectionSession session,
                                                                                 List<Event<?>> events) {
        List<Event<?>> ordered = new ArrayList<>(events);
        ordered.sort(BY_SEQUENCE);

        Map<String, TenantSliceGroup<TDoc, TId>> groups = new LinkedHashMap<>();
        for (Event<?> event : ordered) {
            Optional<Function<Event<?>, Collection<TId>>> rule = ruleFor(event.getPayloadType());
            if (rule.isEmpty()) {
                logger.debug("No identity rule for {}, skipping event #{}", event.getEventType(), event.getSequence());
                continue;
            }

            Collection<TId> ids = rule.get().apply(event);
            if (ids.isEmpty()) {
                continue;
            }

            TenantSliceGroup<TDoc, TId> group = groups.computeIfAbsent(event.getTenantId(), TenantSliceGroup::new);
            // Distinct so that one event never lands twice in the same slice
            for (TId id : new LinkedHashSet<>(ids)) {
                group.addEvent(id, event);
            }
        }
        return CompletableFuture.completedFuture(new ArrayList<>(groups.values()));
    }

    @Override
    public CompletableFuture<List<EventSlice<TDoc, TId>>> sliceInlineActions(ProjectionSession session,
                                                                             List<StreamAction> streams) {
        List<Event<?>> events = streams.stream()
            .flatMap(stream -> stream.getEvents().stream())
            .collect(Collectors.toList());

        return sliceAsyncEvents(session, events)
            .thenApply(groups -> groups.stream()
                .flatMap(group -> group.getSlices().stream())
                .collect(Collectors.toList()));
    }

    @Override
    public boolean isSingleStream() {
        return false;
    }
}
