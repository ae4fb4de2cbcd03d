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

import dev.mars.pgprojection.api.CancellationSignal;
import dev.mars.pgprojection.api.Event;
import dev.mars.pgprojection.api.SimpleEvent;
import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.StreamActionType;
import dev.mars.pgprojection.api.error.ApplyEventException;
import dev.mars.pgprojection.api.log.EventAppender;
import dev.mars.pgprojection.api.messaging.MessageBatch;
import dev.mars.pgprojection.api.projection.ProjectionLifecycle;
import dev.mars.pgprojection.api.projection.ShardExecutionMode;
import dev.mars.pgprojection.api.session.ProjectionSession;
import dev.mars.pgprojection.api.storage.DocumentStorage;
import dev.mars.pgprojection.api.storage.RevisionedOperation;
import dev.mars.pgprojection.api.storage.StorageFailureClassifier;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.core.config.DaemonSettings;
import dev.mars.pgprojection.core.metrics.ProjectionMetrics;
import dev.mars.pgprojection.core.slicing.EventSlice;
import dev.mars.pgprojection.core.slicing.EventSlicer;
import dev.mars.pgprojection.core.slicing.SingleStreamSlicer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Folds event slices into aggregate documents and queues the operations that persist them.
 *
 * <p>One runtime exists per aggregate document type. It owns that type's aggregate caches,
 * one per tenant. For each slice it:</p>
 * <ol>
 *   <li>deletes the aggregate outright when the slice contains a delete-trigger event type</li>
 *   <li>otherwise loads the prior aggregate when applying inline (async slices arrive preloaded)</li>
 *   <li>folds the events in slice order, wrapping non-storage failures with the offending event</li>
 *   <li>queues a delete when the aggregate was removed, or a revisioned upsert when it survives</li>
 * </ol>
 * <p>Side effects run only for continuously running async shards. Every operation a slice
 * produces is queued in one call, so a slice is either fully enqueued or not at all. The
 * slice's outbound messages ride with that call and are published only when it is accepted.</p>
 *
 * @param <TDoc> The aggregate document type
 * @param <TId> The identity type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class AggregationRuntime<TDoc, TId> {
    private static final Logger logger = LoggerFactory.getLogger(AggregationRuntime.class);

    private final AggregateProjection<TDoc, TId> projection;
    private final DocumentStorage<TDoc, TId> storage;
    private final StorageFailureClassifier failureClassifier;
    private final ProjectionMetrics metrics;
    private final int cacheLimitPerTenant;
    private final Map<String, AggregateCache<TId, TDoc>> caches = new ConcurrentHashMap<>();

    public AggregationRuntime(AggregateProjection<TDoc, TId> projection, DocumentStorage<TDoc, TId> storage,
                              DaemonSettings settings) {
        this(projection, storage, settings, StorageFailureClassifier.defaults(), ProjectionMetrics.disabled());
    }

    public AggregationRuntime(AggregateProjection<TDoc, TId> projection, DocumentStorage<TDoc, TId> storage,
                              DaemonSettings settings, StorageFailureClassifier failureClassifier,
                              ProjectionMetrics metrics) {
        this.projection = Objects.requireNonNull(projection, "Projection cannot be null");
        this.storage = storage;
        this.failureClassifier = Objects.requireNonNull(failureClassifier, "Failure classifier cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.cacheLimitPerTenant = projection.getCacheLimitPerTenant() != null
                ? projection.getCacheLimitPerTenant() : settings.getCacheLimitPerTenant();

        if (storage == null && projection.getLifecycle() != ProjectionLifecycle.LIVE) {
            throw new IllegalArgumentException("Storage is required for " + projection.getLifecycle()
                    + " projection " + projection.getName());
        }
    }

    public AggregateProjection<TDoc, TId> getProjection() {
        return projection;
    }

    public DocumentStorage<TDoc, TId> getStorage() {
        return storage;
    }

    public EventSlicer<TDoc, TId> getSlicer() {
        return projection.getSlicer();
    }

    public int getCacheLimitPerTenant() {
        return cacheLimitPerTenant;
    }

    /**
     * Applies one slice, queueing its operations into the session.
     *
     * @return A future that completes once the slice's operations are queued. Fold failures
     *         complete it with {@link ApplyEventException}; storage failures pass through unwrapped.
     */
    public CompletableFuture<Void> applyChanges(ProjectionSession session, EventSlice<TDoc, TId> slice,
                                                ProjectionLifecycle lifecycle, CancellationSignal cancellation) {
        if (cancellation.isCancellationRequested() || slice.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        requireStorage();

        boolean continuous = session.getExecutionMode() == ShardExecutionMode.CONTINUOUS;
        List<StorageOperation> operations = new ArrayList<>();

        CompletableFuture<Void> applied;
        if (projection.matchesAnyDeleteType(slice)) {
            applied = done()
                .thenCompose(v -> continuous ? processSideEffects(session, slice, operations) : done())
                .thenRun(() -> {
                    operations.add(storage.deleteForId(slice.getId(), slice.getTenantId()));
                    slice.setAggregate(null);
                    metrics.recordDeletion();
                });
        } else {
            applied = done()
                .thenCompose(v -> loadPrior(session, slice, lifecycle))
                .thenCompose(prior -> {
                    boolean exists = prior != null;
                    TDoc aggregate = foldEvents(slice, prior);
                    if (aggregate != null) {
                        aggregate = storage.assignIdentity(aggregate, slice.getId());
                    }
                    slice.setAggregate(aggregate);

                    return (continuous ? processSideEffects(session, slice, operations) : done())
                        .thenRun(() -> completeSlice(slice, exists, continuous, operations));
                });
        }

        return applied
            .thenCompose(v -> continuous && !slice.getPublishedMessages().isEmpty()
                    && !cancellation.isCancellationRequested()
                ? session.currentMessageBatch()
                : CompletableFuture.<MessageBatch>completedFuture(null))
            .thenAccept(messageBatch -> {
                if (cancellation.isCancellationRequested()) {
                    logger.debug("Dropping {} operation(s) and {} message(s) of cancelled slice {}",
                        operations.size(), slice.getPublishedMessages().size(), slice);
                    return;
                }
                if (messageBatch == null) {
                    session.queueOperations(operations);
                } else {
                    // Messages are published only once the slice's operations are accepted
                    session.queueOperations(operations, () -> publishAll(messageBatch, slice));
                }
                metrics.recordSliceApplied(projection.getName());
            })
            .whenComplete((v, error) -> {
                if (error != null) {
                    Throwable cause = StorageFailureClassifier.unwrap(error);
                    metrics.recordApplyFailure(projection.getName(), cause.getClass().getSimpleName());
                    logger.debug("Failed to apply {} for projection {}", slice, projection.getName(), cause);
                }
            });
    }

    private CompletableFuture<TDoc> loadPrior(ProjectionSession session, EventSlice<TDoc, TId> slice,
                                              ProjectionLifecycle lifecycle) {
        TDoc aggregate = slice.getAggregate();
        boolean knownAbsent = getSlicer().isSingleStream() && slice.getActionType() == StreamActionType.START;
        if (aggregate == null && lifecycle == ProjectionLifecycle.INLINE && !knownAbsent) {
            return session.load(storage, slice.getId());
        }
        return CompletableFuture.completedFuture(aggregate);
    }

    private TDoc foldEvents(EventSlice<TDoc, TId> slice, TDoc prior) {
        TDoc aggregate = prior;
        for (Event<?> event : slice.getEvents()) {
            try {
                aggregate = projection.fold(aggregate, event);
            } catch (Exception e) {
                throw classify(event, e);
            }
        }
        return aggregate;
    }

    private RuntimeException classify(Event<?> event, Exception failure) {
        Throwable cause = StorageFailureClassifier.unwrap(failure);
        if (cause instanceof ApplyEventException) {
            return (ApplyEventException) cause;
        }
        if (failureClassifier.isStorageFailure(cause)) {
            return cause instanceof RuntimeException ? (RuntimeException) cause : new CompletionException(cause);
        }
        return new ApplyEventException(event, failure);
    }

    private void completeSlice(EventSlice<TDoc, TId> slice, boolean exists, boolean continuous,
                               List<StorageOperation> operations) {
        TDoc aggregate = slice.getAggregate();
        Event<?> lastEvent = slice.getLastEvent();
        boolean singleStream = getSlicer().isSingleStream();

        if (aggregate != null) {
            if (singleStream) {
                aggregate = projection.applyVersion(aggregate, lastEvent.getVersion());
            }
            aggregate = projection.applyMetadata(aggregate, lastEvent);
            slice.setAggregate(aggregate);
        }

        if (aggregate == null) {
            if (exists) {
                operations.add(storage.deleteForId(slice.getId(), slice.getTenantId()));
                metrics.recordDeletion();
            }
            return;
        }

        RevisionedOperation upsert = storage.upsert(aggregate, slice.getTenantId());
        if (singleStream) {
            upsert.setRevision(lastEvent.getVersion());
            // Per-identity ordering is already serialized by the shard
            upsert.setIgnoreConcurrencyViolation(continuous);
        }
        operations.add(upsert);
        metrics.recordUpsert();
    }

    private CompletableFuture<Void> processSideEffects(ProjectionSession session, EventSlice<TDoc, TId> slice,
                                                       List<StorageOperation> operations) {
        if (projection.getSideEffects().isEmpty()) {
            return done();
        }

        try {
            projection.getSideEffects().get().raiseSideEffects(session, slice);
        } catch (Exception e) {
            Event<?> lastEvent = slice.getLastEvent();
            throw classify(lastEvent, e);
        }

        operations.addAll(buildRaisedEventOperations(session, slice));
        return done();
    }

    private void publishAll(MessageBatch batch, EventSlice<TDoc, TId> slice) {
        for (EventSlice.PublishedMessage message : slice.getPublishedMessages()) {
            batch.publish(message.getMessage(), message.getHeaders()).join();
        }
    }

    /**
     * Builds the append operations for events raised by a slice.
     *
     * <p>Raised events are grouped by target stream and stamped with the slice's tenant.
     * When a single-stream slice started its stream in this pass, the stream's version is
     * known, so raised events are given explicit versions continuing after the slice's
     * events and the append expects the stream to be at the slice's event count.</p>
     */
    public List<StorageOperation> buildRaisedEventOperations(ProjectionSession session, EventSlice<TDoc, TId> slice) {
        if (slice.getRaisedEvents().isEmpty()) {
            return List.of();
        }

        EventAppender appender = session.getEventAppender();
        if (appender == null) {
            throw new IllegalStateException("Session for tenant " + session.getTenantId()
                    + " cannot append events raised by " + projection.getName());
        }

        Instant now = Instant.now();
        Map<Object, List<EventSlice.RaisedEvent>> byStream = slice.getRaisedEvents().stream()
            .collect(Collectors.groupingBy(EventSlice.RaisedEvent::getStreamIdentity, LinkedHashMap::new,
                Collectors.toList()));

        boolean knownVersion = getSlicer().isSingleStream() && slice.getActionType() == StreamActionType.START;
        List<StorageOperation> operations = new ArrayList<>();
        for (Map.Entry<Object, List<EventSlice.RaisedEvent>> group : byStream.entrySet()) {
            Object streamIdentity = group.getKey();
            long version = knownVersion ? slice.count() : 0;
            Long expectedVersion = knownVersion ? version : null;

            List<Event<?>> events = new ArrayList<>();
            for (EventSlice.RaisedEvent raised : group.getValue()) {
                SimpleEvent.Builder<Object> builder = SimpleEvent.builder(raised.getPayload())
                    .tenantId(slice.getTenantId())
                    .timestamp(now)
                    .version(knownVersion ? ++version : 0);
                if (streamIdentity instanceof UUID) {
                    builder.streamId((UUID) streamIdentity);
                } else {
                    builder.streamKey(streamIdentity.toString());
                }
                events.add(builder.build());
            }

            StreamAction action = new StreamAction(streamIdentity, slice.getTenantId(), StreamActionType.APPEND,
                    events, expectedVersion);
            operations.addAll(appender.appendOperations(action));
        }
        return operations;
    }

    /**
     * Whether the slice is known to start a brand-new aggregate, so no load is needed.
     */
    public boolean isNew(EventSlice<TDoc, TId> slice) {
        return getSlicer().isSingleStream() && !slice.isEmpty() && slice.getEvents().get(0).getVersion() == 1;
    }

    public AggregateCache<TId, TDoc> cacheFor(String tenantId) {
        return caches.computeIfAbsent(tenantId, tenant -> cacheLimitPerTenant == 0
                ? new NulloAggregateCache<>()
                : new RecentlyUsedCache<>(cacheLimitPerTenant));
    }

    /**
     * Derives the aggregate identity from an event's stream. Multi-stream projections
     * compute identity while slicing, so this fails for them.
     */
    public TId identityFromEvent(Event<?> event) {
        if (!(getSlicer() instanceof SingleStreamSlicer)) {
            throw new UnsupportedOperationException(
                "Identity from event is not supported for multi-stream projection " + projection.getName());
        }
        return ((SingleStreamSlicer<TDoc, TId>) getSlicer()).identityOf(event);
    }

    /**
     * Applies the projection inside the unit of work that appended the given streams.
     */
    public CompletableFuture<Void> applyInline(ProjectionSession session, List<StreamAction> streams) {
        List<StreamAction> relevant = streams.stream()
            .filter(stream -> stream.getEvents().stream().anyMatch(e -> projection.appliesTo(e.getPayloadType())))
            .collect(Collectors.toList());

        if (relevant.isEmpty()) {
            return done();
        }

        return getSlicer().sliceInlineActions(session, relevant)
            .thenCompose(slices -> {
                CompletableFuture<Void> chain = done();
                for (EventSlice<TDoc, TId> slice : slices) {
                    chain = chain.thenCompose(v ->
                        applyChanges(session, slice, ProjectionLifecycle.INLINE, CancellationSignal.NONE));
                }
                return chain;
            });
    }

    /**
     * Folds events into an aggregate without touching storage.
     *
     * @return The aggregate, or null when the events delete it or never create it
     */
    public TDoc aggregateLive(TId id, List<? extends Event<?>> events) {
        if (events.isEmpty()) {
            return null;
        }

        EventSlice<TDoc, TId> slice = new EventSlice<>(id, events.get(0).getTenantId(), events);
        if (projection.matchesAnyDeleteType(slice)) {
            return null;
        }

        TDoc aggregate = foldEvents(slice, null);
        if (aggregate == null) {
            return null;
        }
        if (storage != null) {
            aggregate = storage.assignIdentity(aggregate, id);
        }
        if (getSlicer().isSingleStream()) {
            aggregate = projection.applyVersion(aggregate, slice.getLastEvent().getVersion());
        }
        return projection.applyMetadata(aggregate, slice.getLastEvent());
    }

    private void requireStorage() {
        if (storage == null) {
            throw new IllegalStateException("Projection " + projection.getName() + " has no storage");
        }
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String toString() {
        return "AggregationRuntime{" + projection + ", cacheLimitPerTenant=" + cacheLimitPerTenant + '}';
    }
}
