package dev.mars.pgprojection.core.aggregation;

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
import dev.mars.pgprojection.api.error.ProjectionConfigurationException;
import dev.mars.pgprojection.api.projection.ProjectionLifecycle;
import dev.mars.pgprojection.core.slicing.EventSlice;
import dev.mars.pgprojection.core.slicing.EventSlicer;
import dev.mars.pgprojection.core.slicing.MultiStreamSlicer;
import dev.mars.pgprojection.core.slicing.SingleStreamSlicer;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Definition of an aggregate projection: how events of each type create, change or
 * delete one aggregate document, and how events are sliced into aggregates.
 *
 * <pre>{@code
 * AggregateProjection<Trip, UUID> trips = AggregateProjection.builder(Trip.class, UUID.class)
 *     .create(TripStarted.class, started -> new Trip(started.getDay()))
 *     .applyInPlace(Travel.class, (trip, travel) -> trip.addDistance(travel.getDistance()))
 *     .apply(TripEnded.class, (trip, ended) -> trip.ended(ended.getDay()))
 *     .deleteOn(TripAborted.class)
 *     .build();
 * }</pre>
 *
 * @param <TDoc> The aggregate document type
 * @param <TId> The identity type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class AggregateProjection<TDoc, TId> {

    private final String name;
    private final Class<TDoc> documentType;
    private final Class<TId> identityType;
    private final ProjectionLifecycle lifecycle;
    private final EventSlicer<TDoc, TId> slicer;
    private final Map<Class<?>, AggregateHandler<TDoc>> handlers;
    private final Set<Class<?>> deleteTypes;
    private final Supplier<TDoc> defaultFactory;
    private final AggregateSideEffects<TDoc, TId> sideEffects;
    private final BiFunction<TDoc, Event<?>, TDoc> metadata;
    private final BiFunction<TDoc, Long, TDoc> versioning;
    private final Integer cacheLimitPerTenant;
    private final Map<Class<?>, Optional<AggregateHandler<TDoc>>> resolved = new ConcurrentHashMap<>();

    private AggregateProjection(Builder<TDoc, TId> builder, Map<Class<?>, AggregateHandler<TDoc>> handlers,
                                Supplier<TDoc> defaultFactory) {
        this.name = builder.name != null ? builder.name : builder.documentType.getSimpleName();
        this.documentType = builder.documentType;
        this.identityType = builder.identityType;
        this.lifecycle = builder.lifecycle;
        this.slicer = builder.slicer;
        this.handlers = Collections.unmodifiableMap(handlers);
        this.deleteTypes = Set.copyOf(builder.deleteTypes);
        this.defaultFactory = defaultFactory;
        this.sideEffects = builder.sideEffects;
        this.metadata = builder.metadata;
        this.versioning = builder.versioning;
        this.cacheLimitPerTenant = builder.cacheLimitPerTenant;
    }

    public static <TDoc, TId> Builder<TDoc, TId> builder(Class<TDoc> documentType, Class<TId> identityType) {
        return new Builder<>(documentType, identityType);
    }

    public String getName() {
        return name;
    }

    public Class<TDoc> getDocumentType() {
        return documentType;
    }

    public Class<TId> getIdentityType() {
        return identityType;
    }

    public ProjectionLifecycle getLifecycle() {
        return lifecycle;
    }

    public EventSlicer<TDoc, TId> getSlicer() {
        return slicer;
    }

    public Optional<AggregateSideEffects<TDoc, TId>> getSideEffects() {
        return Optional.ofNullable(sideEffects);
    }

    /**
     * @return The projection's own cache limit, or null to use the daemon default
     */
    public Integer getCacheLimitPerTenant() {
        return cacheLimitPerTenant;
    }

    /**
     * Every payload type that creates, applies to or deletes the aggregate.
     */
    public Set<Class<?>> getHandledEventTypes() {
        Set<Class<?>> types = new LinkedHashSet<>(handlers.keySet());
        types.addAll(deleteTypes);
        return types;
    }

    public boolean appliesTo(Class<?> payloadType) {
        return isDeleteType(payloadType) || handlerFor(payloadType) != null;
    }

    /**
     * Whether the slice contains an event that unconditionally deletes the aggregate.
     */
    public boolean matchesAnyDeleteType(EventSlice<TDoc, TId> slice) {
        for (Event<?> event : slice.getEvents()) {
            if (isDeleteType(event.getPayloadType())) {
                return true;
            }
        }
        return false;
    }

    private boolean isDeleteType(Class<?> payloadType) {
        for (Class<?> type : deleteTypes) {
            if (type.isAssignableFrom(payloadType)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The handler for the payload type or its closest registered supertype, or null
     */
    public AggregateHandler<TDoc> handlerFor(Class<?> payloadType) {
        return resolved.computeIfAbsent(payloadType, type -> {
            AggregateHandler<TDoc> exact = handlers.get(type);
            if (exact != null) {
                return Optional.of(exact);
            }
            return handlers.entrySet().stream()
                .filter(entry -> entry.getKey().isAssignableFrom(type))
                .map(Map.Entry::getValue)
                .findFirst();
        }).orElse(null);
    }

    /**
     * Folds one event into the aggregate.
     *
     * @param aggregate the current aggregate, or null when it does not exist
     * @return The next aggregate, or null when the aggregate is deleted or still absent
     */
    public TDoc fold(TDoc aggregate, Event<?> event) {
        AggregateHandler<TDoc> handler = handlerFor(event.getPayloadType());
        if (handler == null) {
            return aggregate;
        }

        if (aggregate != null && handler.shouldDelete(aggregate, event)) {
            return null;
        }

        TDoc current = aggregate;
        if (current == null) {
            if (handler.canCreate()) {
                return handler.create(event);
            }
            if (!handler.canApply()) {
                return null;
            }
            current = defaultFactory.get();
        }

        return handler.apply(current, event);
    }

    /**
     * Sets the version on the aggregate when a versioning hook is registered.
     */
    public TDoc applyVersion(TDoc aggregate, long version) {
        return versioning == null ? aggregate : versioning.apply(aggregate, version);
    }

    public TDoc applyMetadata(TDoc aggregate, Event<?> event) {
        return metadata == null ? aggregate : metadata.apply(aggregate, event);
    }

    @Override
    public String toString() {
        return "AggregateProjection{" + name + ", " + lifecycle
                + (slicer.isSingleStream() ? ", single-stream" : ", multi-stream") + '}';
    }

    private static final class RegisteredHandler<TDoc> implements AggregateHandler<TDoc> {
        private Function<Event<?>, TDoc> create;
        private BiFunction<TDoc, Event<?>, TDoc> apply;
        private BiPredicate<TDoc, Event<?>> delete;

        @Override
        public boolean canCreate() {
            return create != null;
        }

        @Override
        public boolean canApply() {
            return apply != null;
        }

        @Override
        public TDoc create(Event<?> event) {
            return create.apply(event);
        }

        @Override
        public TDoc apply(TDoc aggregate, Event<?> event) {
            return apply == null ? aggregate : apply.apply(aggregate, event);
        }

        @Override
        public boolean shouldDelete(TDoc aggregate, Event<?> event) {
            return delete != null && delete.test(aggregate, event);
        }
    }

    public static final class Builder<TDoc, TId> {
        private final Class<TDoc> documentType;
        private final Class<TId> identityType;
        private final Map<Class<?>, RegisteredHandler<TDoc>> handlers = new LinkedHashMap<>();
        private final Set<Class<?>> deleteTypes = new HashSet<>();
        private String name;
        private ProjectionLifecycle lifecycle = ProjectionLifecycle.ASYNC;
        private EventSlicer<TDoc, TId> slicer;
        private Supplier<TDoc> defaultFactory;
        private AggregateSideEffects<TDoc, TId> sideEffects;
        private BiFunction<TDoc, Event<?>, TDoc> metadata;
        private BiFunction<TDoc, Long, TDoc> versioning;
        private Integer cacheLimitPerTenant;

        private Builder(Class<TDoc> documentType, Class<TId> identityType) {
            this.documentType = Objects.requireNonNull(documentType, "Document type cannot be null");
            this.identityType = Objects.requireNonNull(identityType, "Identity type cannot be null");
        }

        public Builder<TDoc, TId> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<TDoc, TId> lifecycle(ProjectionLifecycle lifecycle) {
            this.lifecycle = Objects.requireNonNull(lifecycle, "Lifecycle cannot be null");
            return this;
        }

        /**
         * Slices by stream, converting the raw stream id or key to a custom identifier type.
         */
        public Builder<TDoc, TId> identity(Function<Object, TId> conversion) {
            this.slicer = new SingleStreamSlicer<>(conversion);
            return this;
        }

        public Builder<TDoc, TId> multiStream(MultiStreamSlicer<TDoc, TId> multiStreamSlicer) {
            this.slicer = Objects.requireNonNull(multiStreamSlicer, "Slicer cannot be null");
            return this;
        }

        @SuppressWarnings("unchecked")
        public <E> Builder<TDoc, TId> create(Class<E> eventType, Function<E, TDoc> creator) {
            Objects.requireNonNull(creator, "Creator cannot be null");
            RegisteredHandler<TDoc> handler = handlerFor(eventType);
            if (handler.create != null) {
                throw new ProjectionConfigurationException(
                    "Duplicate create handler for " + eventType.getName() + " on " + documentType.getName());
            }
            handler.create = event -> creator.apply((E) event.getPayload());
            return this;
        }

        /**
         * Registers an update that returns the next aggregate, for immutable documents.
         */
        @SuppressWarnings("unchecked")
        public <E> Builder<TDoc, TId> apply(Class<E> eventType, BiFunction<TDoc, E, TDoc> applier) {
            Objects.requireNonNull(applier, "Applier cannot be null");
            RegisteredHandler<TDoc> handler = handlerFor(eventType);
            if (handler.apply != null) {
                throw new ProjectionConfigurationException(
                    "Duplicate apply handler for " + eventType.getName() + " on " + documentType.getName());
            }
            handler.apply = (aggregate, event) -> applier.apply(aggregate, (E) event.getPayload());
            return this;
        }

        /**
         * Registers an update that mutates the aggregate in place.
         */
        public <E> Builder<TDoc, TId> applyInPlace(Class<E> eventType, BiConsumer<TDoc, E> mutator) {
            Objects.requireNonNull(mutator, "Mutator cannot be null");
            return apply(eventType, (aggregate, event) -> {
                mutator.accept(aggregate, event);
                return aggregate;
            });
        }

        /**
         * Any event of this type deletes the aggregate outright.
         */
        public Builder<TDoc, TId> deleteOn(Class<?> eventType) {
            deleteTypes.add(Objects.requireNonNull(eventType, "Event type cannot be null"));
            return this;
        }

        /**
         * Deletes the aggregate when the predicate holds for an event of this type.
         */
        @SuppressWarnings("unchecked")
        public <E> Builder<TDoc, TId> deleteWhen(Class<E> eventType, BiPredicate<TDoc, E> predicate) {
            Objects.requireNonNull(predicate, "Predicate cannot be null");
            RegisteredHandler<TDoc> handler = handlerFor(eventType);
            handler.delete = (aggregate, event) -> predicate.test(aggregate, (E) event.getPayload());
            return this;
        }

        public Builder<TDoc, TId> defaultFactory(Supplier<TDoc> factory) {
            this.defaultFactory = factory;
            return this;
        }

        public Builder<TDoc, TId> sideEffects(AggregateSideEffects<TDoc, TId> sideEffects) {
            this.sideEffects = sideEffects;
            return this;
        }

        /**
         * Hook applied for each event of a slice after folding, e.g. to stamp the last modified time.
         */
        public Builder<TDoc, TId> metadata(BiFunction<TDoc, Event<?>, TDoc> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Hook that stores the stream version on single-stream aggregates.
         */
        public Builder<TDoc, TId> versionWith(BiFunction<TDoc, Long, TDoc> versioning) {
            this.versioning = versioning;
            return this;
        }

        public Builder<TDoc, TId> cacheLimitPerTenant(int limit) {
            if (limit < 0) {
                throw new ProjectionConfigurationException("Cache limit cannot be negative: " + limit);
            }
            this.cacheLimitPerTenant = limit;
            return this;
        }

        private RegisteredHandler<TDoc> handlerFor(Class<?> eventType) {
            Objects.requireNonNull(eventType, "Event type cannot be null");
            return handlers.computeIfAbsent(eventType, type -> new RegisteredHandler<>());
        }

        public AggregateProjection<TDoc, TId> build() {
            if (handlers.isEmpty() && deleteTypes.isEmpty()) {
                throw new ProjectionConfigurationException(
                    "Projection for " + documentType.getName() + " handles no event types");
            }

            if (slicer == null) {
                slicer = SingleStreamSlicer.byStreamIdentity();
            }

            Supplier<TDoc> factory = defaultFactory;
            List<String> needsFactory = new ArrayList<>();
            handlers.forEach((type, handler) -> {
                if (!handler.canCreate() && handler.canApply()) {
                    needsFactory.add(type.getName());
                }
            });
            if (factory == null && !needsFactory.isEmpty()) {
                factory = noArgConstructor(needsFactory);
            }

            AggregateProjection<TDoc, TId> projection =
                new AggregateProjection<>(this, new LinkedHashMap<>(handlers), factory);

            if (slicer instanceof MultiStreamSlicer) {
                ((MultiStreamSlicer<TDoc, TId>) slicer).validate(projection.getHandledEventTypes());
            }
            return projection;
        }

        private Supplier<TDoc> noArgConstructor(List<String> eventTypes) {
            Constructor<TDoc> constructor;
            try {
                constructor = documentType.getDeclaredConstructor();
                constructor.setAccessible(true);
            } catch (NoSuchMethodException | RuntimeException e) {
                throw new ProjectionConfigurationException(String.format(
                    "There is no default constructor or default factory for %s, and no create handler for %s",
                    documentType.getName(), String.join(", ", eventTypes)), e);
            }
            return () -> {
                try {
                    return constructor.newInstance();
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException("Failed to construct " + documentType.getName(), e);
                }
            };
        }
    }
}
