package dev.mars.pgprojection.core.batch;

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
import dev.mars.pgprojection.api.EventRange;
import dev.mars.pgprojection.api.batch.BatchSession;
import dev.mars.pgprojection.api.batch.OperationPage;
import dev.mars.pgprojection.api.batch.UpdateBatch;
import dev.mars.pgprojection.api.log.EventAppender;
import dev.mars.pgprojection.api.log.ProgressionStore;
import dev.mars.pgprojection.api.messaging.MessageBatch;
import dev.mars.pgprojection.api.messaging.MessageOutbox;
import dev.mars.pgprojection.api.projection.ProjectionLifecycle;
import dev.mars.pgprojection.api.projection.ShardExecutionMode;
import dev.mars.pgprojection.api.session.ChangeSet;
import dev.mars.pgprojection.api.session.CommitContext;
import dev.mars.pgprojection.api.session.CommitListener;
import dev.mars.pgprojection.api.session.ProjectionSession;
import dev.mars.pgprojection.api.storage.DocumentStorage;
import dev.mars.pgprojection.api.storage.StorageFailureClassifier;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.core.aggregation.AggregateCache;
import dev.mars.pgprojection.core.aggregation.AggregationRuntime;
import dev.mars.pgprojection.core.config.DaemonSettings;
import dev.mars.pgprojection.core.metrics.ProjectionMetrics;
import dev.mars.pgprojection.core.slicing.EventSlice;
import dev.mars.pgprojection.core.slicing.TenantSliceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Accumulates the storage operations of one processing pass into ordered, size-bounded
 * pages and executes them atomically through a {@link BatchSession}.
 *
 * <p>Operations arrive through an {@link OperationSink}: folding may run on several
 * threads, but a single consumer appends to the pages, so page contents always equal
 * the order in which operations were queued. A new page opens when the current one
 * reaches the configured update batch size.</p>
 *
 * <p>Once the cancellation signal fires no further operations are accepted and no new
 * page opens. Operations already paged are kept, and empty pages are never executed.</p>
 *
 * <p>Commit listeners registered for the shard, plus batch-scoped ones such as the
 * message batch, run once per execution with the whole change set. With no listeners
 * the hook step is skipped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ProjectionUpdateBatch implements UpdateBatch, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionUpdateBatch.class);

    private static final AtomicInteger BATCH_COUNTER = new AtomicInteger();

    private final String name;
    private final int updateBatchSize;
    private final int sliceParallelism;
    private final BatchSession session;
    private final ShardExecutionMode mode;
    private final CancellationSignal cancellation;
    private final MessageOutbox outbox;
    private final EventAppender eventAppender;
    private final boolean useIdentityMap;
    private final ProjectionMetrics metrics;
    private final EventRange range;
    private final List<CommitListener> shardListeners;
    private final List<CommitListener> batchListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> cacheEvictions = new CopyOnWriteArrayList<>();
    private final Map<String, ProjectionDocumentSession> sessions = new ConcurrentHashMap<>();

    private final OperationSink sink;
    private final AtomicReference<BatchState> state = new AtomicReference<>(BatchState.BUILDING);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Only touched by the sink's consumer thread until the batch is READY
    private final List<OperationPage> pages = new ArrayList<>();
    private OperationPage current;

    private final Object messageBatchLock = new Object();
    private CompletableFuture<MessageBatch> messageBatch;
    private CompletableFuture<Void> completion;
    private ExecutorService workers;

    private ProjectionUpdateBatch(Builder builder) {
        this.name = builder.range != null
                ? builder.range.getShardName() + "-" + BATCH_COUNTER.incrementAndGet()
                : "batch-" + BATCH_COUNTER.incrementAndGet();
        this.updateBatchSize = builder.settings.getUpdateBatchSize();
        this.sliceParallelism = builder.settings.getSliceParallelism();
        this.session = Objects.requireNonNull(builder.session, "Batch session cannot be null");
        this.mode = builder.mode;
        this.cancellation = builder.cancellation;
        this.outbox = builder.outbox;
        this.eventAppender = builder.eventAppender;
        this.useIdentityMap = builder.useIdentityMap;
        this.metrics = builder.metrics;
        this.range = builder.range;
        this.shardListeners = List.copyOf(builder.listeners);
        this.sink = new OperationSink(name, this::page);
    }

    public static Builder builder(BatchSession session) {
        return new Builder(session);
    }

    public String getName() {
        return name;
    }

    public BatchState getState() {
        return state.get();
    }

    /**
     * @return The shard mode, or null for an inline batch
     */
    public ShardExecutionMode getMode() {
        return mode;
    }

    public Optional<EventRange> getRange() {
        return Optional.ofNullable(range);
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    /**
     * Returns the session of one tenant, creating it on first use.
     */
    public ProjectionSession sessionFor(String tenantId) {
        return sessions.computeIfAbsent(tenantId,
            tenant -> new ProjectionDocumentSession(this, tenant, mode, eventAppender, useIdentityMap));
    }

    public void addListener(CommitListener listener) {
        batchListeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void queueOperation(StorageOperation operation) {
        queueOperations(List.of(operation));
    }

    /**
     * Queues operations that must land together. After cancellation they are dropped whole.
     *
     * @throws IllegalStateException when the batch is no longer building
     */
    public void queueOperations(List<StorageOperation> operations) {
        queueOperations(operations, null);
    }

    /**
     * Queues a group of operations with an action that runs on the paging thread right after
     * the group is paged. When the group is dropped the action never runs.
     */
    public void queueOperations(List<StorageOperation> operations, Runnable onAccepted) {
        if (operations.isEmpty() && onAccepted == null) {
            return;
        }
        if (cancellation.isCancellationRequested()) {
            logger.debug("Batch {} cancelled, dropping {} operation(s)", name, operations.size());
            return;
        }
        if (state.get() != BatchState.BUILDING) {
            throw new IllegalStateException("Batch " + name + " is " + state.get() + " and no longer accepts operations");
        }
        sink.post(new OperationSink.Group(List.copyOf(operations), onAccepted));
    }

    private void page(OperationSink.Group group) {
        List<StorageOperation> operations = group.getOperations();
        // Checked per group so that a group is paged whole or not at all
        if (cancellation.isCancellationRequested()) {
            logger.debug("Batch {} cancelled, not paging {} operation(s)", name, operations.size());
            return;
        }
        for (StorageOperation operation : operations) {
            if (current == null || current.isFull()) {
                current = new OperationPage(pages.size(), updateBatchSize);
                pages.add(current);
            }
            current.append(operation);
        }
        metrics.recordOperationsEnqueued(operations.size());
        group.accepted();
    }

    /**
     * Queues the operation that moves this batch's shard to the end of its range.
     */
    public void markProgress(ProgressionStore progressionStore) {
        EventRange eventRange = getRange()
            .orElseThrow(() -> new IllegalStateException("Batch " + name + " has no event range"));
        queueOperation(progressionStore.markProgress(eventRange.getShardName(), eventRange.getFloor(),
            eventRange.getCeiling()));
    }

    /**
     * Returns the message batch of this update batch, creating it and registering it as a
     * commit listener exactly once however many callers race for it.
     */
    public CompletableFuture<MessageBatch> currentMessageBatch(ProjectionSession owner) {
        synchronized (messageBatchLock) {
            if (messageBatch == null) {
                messageBatch = outbox.createBatch(owner).thenApply(created -> {
                    batchListeners.add(created);
                    return created;
                });
            }
            return messageBatch;
        }
    }

    /**
     * Applies the slices of every tenant group, one tenant after the other.
     */
    public <TDoc, TId> CompletableFuture<Void> processAggregation(AggregationRuntime<TDoc, TId> runtime,
                                                                  List<TenantSliceGroup<TDoc, TId>> groups) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (TenantSliceGroup<TDoc, TId> group : groups) {
            chain = chain.thenCompose(v -> processAggregation(runtime, group));
        }
        return chain;
    }

    /**
     * Applies one tenant's slices.
     *
     * <p>Slices are partitioned before any folding starts: new streams need no aggregate,
     * cached identities reuse the cached aggregate, and the rest are loaded with one
     * multi-get that also populates the cache. Folding then runs with bounded parallelism.
     * A failing slice does not stop its siblings; the first failure is reported once all
     * slices have finished.</p>
     */
    public <TDoc, TId> CompletableFuture<Void> processAggregation(AggregationRuntime<TDoc, TId> runtime,
                                                                  TenantSliceGroup<TDoc, TId> group) {
        String tenantId = group.getTenantId();
        ProjectionSession tenantSession = sessionFor(tenantId);
        AggregateCache<TId, TDoc> cache = runtime.cacheFor(tenantId);
        evictUnlessCommitted(cache, group);

        List<EventSlice<TDoc, TId>> ready = new ArrayList<>();
        List<EventSlice<TDoc, TId>> beingFetched = new ArrayList<>();
        for (EventSlice<TDoc, TId> slice : group.getSlices()) {
            if (cancellation.isCancellationRequested()) {
                break;
            }

            if (runtime.isNew(slice)) {
                ready.add(slice);
                continue;
            }

            Optional<TDoc> cached = cache.tryFind(slice.getId());
            if (cached.isPresent()) {
                slice.setAggregate(cached.get());
                ready.add(slice);
            } else {
                beingFetched.add(slice);
            }
        }

        metrics.recordCacheHits(ready.size() - countNew(runtime, ready));
        metrics.recordCacheMisses(beingFetched.size());

        CompletableFuture<List<EventSlice<TDoc, TId>>> resolved;
        if (cancellation.isCancellationRequested() || beingFetched.isEmpty()) {
            cache.compactIfNecessary();
            resolved = CompletableFuture.completedFuture(ready);
        } else {
            resolved = loadMissing(runtime.getStorage(), tenantId, cache, beingFetched)
                .thenApply(loaded -> {
                    List<EventSlice<TDoc, TId>> all = new ArrayList<>(ready);
                    all.addAll(loaded);
                    return all;
                });
        }

        return resolved.thenCompose(slices -> applyAll(runtime, tenantSession, slices)
            .thenApply(failed -> {
                refreshCache(cache, group, failed);
                return failed;
            })
            .thenCompose(failed -> {
                if (failed.isEmpty()) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                Throwable first = failed.values().iterator().next();
                logger.warn("{} of {} slice(s) failed for tenant {} in batch {}",
                    failed.size(), slices.size(), tenantId, name);
                return CompletableFuture.<Void>failedFuture(first);
            }));
    }

    private static <TDoc, TId> int countNew(AggregationRuntime<TDoc, TId> runtime, List<EventSlice<TDoc, TId>> slices) {
        int count = 0;
        for (EventSlice<TDoc, TId> slice : slices) {
            if (runtime.isNew(slice)) {
                count++;
            }
        }
        return count;
    }

    private <TDoc, TId> CompletableFuture<List<EventSlice<TDoc, TId>>> loadMissing(
            DocumentStorage<TDoc, TId> storage, String tenantId, AggregateCache<TId, TDoc> cache,
            List<EventSlice<TDoc, TId>> beingFetched) {
        List<TId> ids = beingFetched.stream().map(EventSlice::getId).collect(Collectors.toList());

        return storage.loadMany(ids, tenantId).thenApply(aggregates -> {
            Map<TId, TDoc> byId = new HashMap<>();
            for (TDoc aggregate : aggregates) {
                byId.put(storage.identity(aggregate), aggregate);
            }

            for (EventSlice<TDoc, TId> slice : beingFetched) {
                TDoc aggregate = byId.get(slice.getId());
                if (aggregate != null) {
                    slice.setAggregate(aggregate);
                    cache.store(slice.getId(), aggregate);
                }
            }
            logger.debug("Loaded {} of {} aggregate(s) for tenant {}", byId.size(), ids.size(), tenantId);
            return beingFetched;
        });
    }

    /**
     * Folds slices with at most {@code sliceParallelism} in flight.
     *
     * @return The failures keyed by slice identity, in the order they happened
     */
    private <TDoc, TId> CompletableFuture<Map<TId, Throwable>> applyAll(AggregationRuntime<TDoc, TId> runtime,
                                                                        ProjectionSession tenantSession,
                                                                        List<EventSlice<TDoc, TId>> slices) {
        Map<TId, Throwable> failed = Collections.synchronizedMap(new LinkedHashMap<>());
        if (slices.isEmpty()) {
            return CompletableFuture.completedFuture(failed);
        }

        Iterator<EventSlice<TDoc, TId>> queue = slices.iterator();
        ExecutorService pool = workers();
        List<CompletableFuture<Void>> lanes = new ArrayList<>();
        for (int i = 0; i < Math.min(sliceParallelism, slices.size()); i++) {
            lanes.add(nextSlice(runtime, tenantSession, queue, pool, failed));
        }
        return CompletableFuture.allOf(lanes.toArray(new CompletableFuture[0])).thenApply(v -> failed);
    }

    private <TDoc, TId> CompletableFuture<Void> nextSlice(AggregationRuntime<TDoc, TId> runtime,
                                                          ProjectionSession tenantSession,
                                                          Iterator<EventSlice<TDoc, TId>> queue,
                                                          ExecutorService pool, Map<TId, Throwable> failed) {
        EventSlice<TDoc, TId> slice;
        synchronized (queue) {
            if (!queue.hasNext() || cancellation.isCancellationRequested()) {
                return CompletableFuture.completedFuture(null);
            }
            slice = queue.next();
        }

        ProjectionLifecycle lifecycle = mode == null ? ProjectionLifecycle.INLINE : ProjectionLifecycle.ASYNC;
        return CompletableFuture
            .supplyAsync(() -> runtime.applyChanges(tenantSession, slice, lifecycle, cancellation), pool)
            .thenCompose(applied -> applied)
            .handle((v, error) -> {
                if (error != null) {
                    failed.put(slice.getId(), StorageFailureClassifier.unwrap(error));
                }
                return null;
            })
            .thenCompose(v -> nextSlice(runtime, tenantSession, queue, pool, failed));
    }

    /**
     * Folding mutates loaded and cached aggregates, so every identity of the group is
     * evicted again if this batch does not commit.
     */
    private <TDoc, TId> void evictUnlessCommitted(AggregateCache<TId, TDoc> cache, TenantSliceGroup<TDoc, TId> group) {
        List<TId> touched = group.getSlices().stream().map(EventSlice::getId).collect(Collectors.toList());
        cacheEvictions.add(() -> touched.forEach(cache::remove));
    }

    private void evictUncommittedAggregates() {
        if (cacheEvictions.isEmpty()) {
            return;
        }
        logger.debug("Batch {} did not commit, evicting {} cached group(s)", name, cacheEvictions.size());
        cacheEvictions.forEach(Runnable::run);
        cacheEvictions.clear();
    }

    private <TDoc, TId> void refreshCache(AggregateCache<TId, TDoc> cache, TenantSliceGroup<TDoc, TId> group,
                                          Map<TId, Throwable> failed) {
        boolean cancelled = cancellation.isCancellationRequested();
        for (EventSlice<TDoc, TId> slice : group.getSlices()) {
            // Never cache what will not be written
            if (cancelled || failed.containsKey(slice.getId()) || slice.getAggregate() == null) {
                cache.remove(slice.getId());
            } else {
                cache.store(slice.getId(), slice.getAggregate());
            }
        }
        cache.compactIfNecessary();
    }

    private synchronized ExecutorService workers() {
        if (workers == null) {
            workers = Executors.newFixedThreadPool(sliceParallelism, r -> {
                Thread t = new Thread(r, "pgprojection-fold-" + name);
                t.setDaemon(true);
                return t;
            });
        }
        return workers;
    }

    /**
     * Stops accepting operations and waits until every queued operation is paged.
     */
    public synchronized CompletableFuture<Void> waitForCompletion() {
        if (completion == null) {
            state.compareAndSet(BatchState.BUILDING, BatchState.DRAINING);
            completion = sink.complete().whenComplete((v, error) -> {
                if (error != null) {
                    state.set(BatchState.ROLLED_BACK);
                    evictUncommittedAggregates();
                    logger.error("Batch {} failed while paging operations", name, error);
                } else {
                    state.compareAndSet(BatchState.DRAINING, BatchState.READY);
                    logger.debug("Batch {} ready with {} page(s)", name, pages.size());
                }
            });
        }
        return completion;
    }

    @Override
    public List<OperationPage> buildPages() {
        BatchState currentState = state.get();
        if (currentState == BatchState.BUILDING || currentState == BatchState.DRAINING) {
            throw new IllegalStateException("Batch " + name + " is still " + currentState
                    + ", wait for completion before building pages");
        }
        return pages.stream().filter(page -> !page.isEmpty()).collect(Collectors.toList());
    }

    @Override
    public ChangeSet getChangeSet() {
        return new UnitOfWork(buildPages());
    }

    private List<CommitListener> listeners() {
        List<CommitListener> all = new ArrayList<>(shardListeners);
        all.addAll(batchListeners);
        return all;
    }

    @Override
    public CompletableFuture<Void> preUpdate(CommitContext context) {
        List<CommitListener> listeners = listeners();
        if (listeners.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        ChangeSet changes = getChangeSet();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (CommitListener listener : listeners) {
            chain = chain.thenCompose(v -> listener.beforeCommit(context, changes));
        }
        return chain;
    }

    @Override
    public CompletableFuture<Void> postUpdate(CommitContext context) {
        List<CommitListener> listeners = listeners();
        if (listeners.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        ChangeSet changes = getChangeSet();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (CommitListener listener : listeners) {
            chain = chain.thenCompose(v -> listener.afterCommit(context, changes));
        }
        return chain;
    }

    /**
     * Completes the batch and executes its pages in one transaction.
     */
    public CompletableFuture<Void> execute() {
        long started = System.nanoTime();
        return waitForCompletion().thenCompose(v -> {
            if (!state.compareAndSet(BatchState.READY, BatchState.EXECUTING)) {
                return CompletableFuture.<Void>failedFuture(
                    new IllegalStateException("Batch " + name + " cannot execute from state " + state.get()));
            }

            List<OperationPage> built = buildPages();
            if (built.isEmpty() && listeners().isEmpty()) {
                state.set(BatchState.COMMITTED);
                cacheEvictions.clear();
                logger.debug("Batch {} has nothing to execute", name);
                return CompletableFuture.<Void>completedFuture(null);
            }

            return session.executeBatch(this).whenComplete((result, error) -> {
                if (error != null) {
                    state.set(BatchState.ROLLED_BACK);
                    evictUncommittedAggregates();
                    logger.error("Batch {} rolled back after failure", name, error);
                } else {
                    state.set(BatchState.COMMITTED);
                    cacheEvictions.clear();
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                    metrics.recordBatchExecuted(built.size(), elapsed);
                    logger.info("Batch {} committed {} page(s) in {} ms", name, built.size(), elapsed.toMillis());
                }
            });
        });
    }

    /**
     * Completes the sink and releases the owned session and worker threads. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sink.close();
        if (state.get() != BatchState.COMMITTED) {
            evictUncommittedAggregates();
        }
        synchronized (this) {
            if (workers != null) {
                workers.shutdown();
            }
        }
        session.close();
        logger.debug("Batch {} closed in state {}", name, state.get());
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "ProjectionUpdateBatch{" + name + ", state=" + state.get() + '}';
    }

    public static class Builder {
        private final BatchSession session;
        private DaemonSettings settings = DaemonSettings.defaults();
        private ShardExecutionMode mode = ShardExecutionMode.CONTINUOUS;
        private CancellationSignal cancellation = CancellationSignal.NONE;
        private MessageOutbox outbox = MessageOutbox.NONE;
        private EventAppender eventAppender;
        private boolean useIdentityMap;
        private ProjectionMetrics metrics = ProjectionMetrics.disabled();
        private EventRange range;
        private final List<CommitListener> listeners = new ArrayList<>();

        private Builder(BatchSession session) {
            this.session = session;
        }

        public Builder settings(DaemonSettings settings) {
            this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
            return this;
        }

        /**
         * The shard mode; null builds an inline batch.
         */
        public Builder mode(ShardExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = Objects.requireNonNull(cancellation, "Cancellation cannot be null");
            return this;
        }

        public Builder outbox(MessageOutbox outbox) {
            this.outbox = Objects.requireNonNull(outbox, "Outbox cannot be null");
            return this;
        }

        public Builder eventAppender(EventAppender eventAppender) {
            this.eventAppender = eventAppender;
            return this;
        }

        public Builder useIdentityMap(boolean useIdentityMap) {
            this.useIdentityMap = useIdentityMap;
            return this;
        }

        public Builder metrics(ProjectionMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
            return this;
        }

        public Builder range(EventRange range) {
            this.range = range;
            return this;
        }

        public Builder listener(CommitListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public Builder listeners(List<? extends CommitListener> shardListeners) {
            shardListeners.forEach(this::listener);
            return this;
        }

        public ProjectionUpdateBatch build() {
            return new ProjectionUpdateBatch(this);
        }
    }
}
