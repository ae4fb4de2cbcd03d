package dev.mars.pgprojection.pg.session;

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
import dev.mars.pgprojection.api.EventRange;
import dev.mars.pgprojection.api.SimpleEvent;
import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.error.ProgressionOutOfOrderException;
import dev.mars.pgprojection.api.log.ShardProgress;
import dev.mars.pgprojection.api.session.ChangeSet;
import dev.mars.pgprojection.api.session.CommitContext;
import dev.mars.pgprojection.api.session.CommitListener;
import dev.mars.pgprojection.core.aggregation.AggregateProjection;
import dev.mars.pgprojection.core.aggregation.AggregationRuntime;
import dev.mars.pgprojection.core.batch.BatchState;
import dev.mars.pgprojection.core.batch.ProjectionUpdateBatch;
import dev.mars.pgprojection.core.config.DaemonSettings;
import dev.mars.pgprojection.core.slicing.TenantSliceGroup;
import dev.mars.pgprojection.core.testing.Account;
import dev.mars.pgprojection.core.testing.AccountEvents.Audited;
import dev.mars.pgprojection.core.testing.AccountEvents.Closed;
import dev.mars.pgprojection.core.testing.AccountEvents.Deposited;
import dev.mars.pgprojection.core.testing.AccountEvents.Opened;
import dev.mars.pgprojection.pg.PgTestSupport;
import dev.mars.pgprojection.pg.events.PgEventLog;
import dev.mars.pgprojection.pg.events.PgProgressionStore;
import dev.mars.pgprojection.pg.storage.PgDocumentStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.pgprojection.core.testing.AccountEvents.event;
import static dev.mars.pgprojection.core.testing.AccountProjections.accounts;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Runs events from the PostgreSQL log through aggregation and batch execution.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
class PgProjectionIntegrationTest extends PgTestSupport {

    private static final String SHARD = "Account:All";
    private static final String TENANT = SimpleEvent.DEFAULT_TENANT;

    private PgEventLog eventLog;
    private PgProgressionStore progression;
    private PgDocumentStorage<Account, String> storage;
    private final List<ProjectionUpdateBatch> batches = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        eventLog = new PgEventLog(pool);
        progression = new PgProgressionStore(pool);
        storage = PgDocumentStorage.<Account, String>builder(pool, Account.class)
            .identity(Account::getId)
            .assignIdentity(Account::withId)
            .build();
        await(storage.ensureStorage());
    }

    @AfterEach
    void tearDown() {
        batches.forEach(ProjectionUpdateBatch::close);
    }

    private void start(String stream, Object... payloads) throws Exception {
        await(eventLog.append(StreamAction.start(stream, TENANT, events(stream, payloads))));
    }

    private void append(String stream, Object... payloads) throws Exception {
        await(eventLog.append(StreamAction.append(stream, TENANT, events(stream, payloads))));
    }

    private static List<Event<?>> events(String stream, Object... payloads) {
        List<Event<?>> events = new ArrayList<>();
        for (Object payload : payloads) {
            events.add(event(stream, 0, 0, payload));
        }
        return events;
    }

    private ProjectionUpdateBatch batch(long floor, long ceiling, int pageSize, CancellationSignal cancellation,
                                        CommitListener... listeners) {
        ProjectionUpdateBatch batch = ProjectionUpdateBatch.builder(new PgBatchSession(pool))
            .settings(new DaemonSettings.Builder().updateBatchSize(pageSize).build())
            .range(EventRange.of(SHARD, floor, ceiling))
            .cancellation(cancellation)
            .eventAppender(eventLog)
            .listeners(List.of(listeners))
            .build();
        batches.add(batch);
        return batch;
    }

    private ProjectionUpdateBatch prepare(AggregationRuntime<Account, String> runtime, ProjectionUpdateBatch batch)
            throws Exception {
        EventRange range = batch.getRange().orElseThrow();
        List<Event<?>> events = await(eventLog.fetchEvents(range.getFloor(), range.getCeiling()));
        List<TenantSliceGroup<Account, String>> groups = await(runtime.getSlicer().sliceAsyncEvents(null, events));
        await(batch.processAggregation(runtime, groups));
        batch.markProgress(progression);
        return batch;
    }

    private ProjectionUpdateBatch project(AggregationRuntime<Account, String> runtime, long floor, long ceiling)
            throws Exception {
        ProjectionUpdateBatch batch = prepare(runtime, batch(floor, ceiling, 100, new CancellationSignal()));
        await(batch.execute());
        return batch;
    }

    private AggregationRuntime<Account, String> runtime(AggregateProjection<Account, String> projection,
                                                        PgDocumentStorage<Account, String> documents) {
        return new AggregationRuntime<>(projection, documents, DaemonSettings.defaults());
    }

    private long progressOf(String shard) throws Exception {
        return await(eventLog.fetchProgress(shard)).map(ShardProgress::lastSequence).orElse(-1L);
    }

    @Test
    void testNewStreamIsFoldedAndStoredAtStreamVersion() throws Exception {
        start("acct-1", new Opened("ann"), new Deposited(10), new Deposited(5));

        ProjectionUpdateBatch batch = project(runtime(accounts().build(), storage), 0, 3);

        Account account = await(storage.load("acct-1", TENANT));
        assertEquals(BatchState.COMMITTED, batch.getState());
        assertNotNull(account);
        assertEquals(15, account.getBalance());
        assertEquals(3, account.getVersion());
        assertEquals(3L, sql("SELECT version FROM pgp_doc_account WHERE id = 'acct-1'").iterator().next().getLong(0));
        assertEquals(3L, progressOf(SHARD));
    }

    @Test
    void testLaterRangeContinuesStoredAggregate() throws Exception {
        AggregationRuntime<Account, String> runtime = runtime(accounts().build(), storage);
        start("acct-1", new Opened("ann"), new Deposited(10));
        project(runtime, 0, 2);

        append("acct-1", new Deposited(7));
        project(runtime, 2, 3);

        Account account = await(storage.load("acct-1", TENANT));
        assertEquals(17, account.getBalance());
        assertEquals(3, account.getVersion());
        assertEquals(3L, progressOf(SHARD));
    }

    @Test
    void testDeleteEventRemovesDocument() throws Exception {
        AggregationRuntime<Account, String> runtime = runtime(accounts().build(), storage);
        start("acct-1", new Opened("ann"));
        start("acct-2", new Opened("bob"));
        project(runtime, 0, 2);

        append("acct-1", new Closed());
        project(runtime, 2, 3);

        assertNull(await(storage.load("acct-1", TENANT)));
        assertNotNull(await(storage.load("acct-2", TENANT)));
    }

    @Test
    void testUncachedRuntimeLoadsOnEveryRange() throws Exception {
        PgDocumentStorage<Account, String> watched = spy(storage);
        AggregationRuntime<Account, String> runtime = runtime(accounts().build(), watched);
        start("acct-1", new Opened("ann"));
        project(runtime, 0, 1);
        append("acct-1", new Deposited(1));
        project(runtime, 1, 2);
        append("acct-1", new Deposited(1));
        project(runtime, 2, 3);

        verify(watched, times(2)).loadMany(anyCollection(), eq(TENANT));
        assertEquals(2, await(storage.load("acct-1", TENANT)).getBalance());
    }

    @Test
    void testCachedRuntimeSkipsLoadingKnownAggregates() throws Exception {
        PgDocumentStorage<Account, String> watched = spy(storage);
        AggregationRuntime<Account, String> runtime = runtime(accounts().cacheLimitPerTenant(10).build(), watched);
        start("acct-1", new Opened("ann"));
        project(runtime, 0, 1);
        append("acct-1", new Deposited(1));
        project(runtime, 1, 2);
        append("acct-1", new Deposited(1));
        project(runtime, 2, 3);

        verify(watched, never()).loadMany(anyCollection(), eq(TENANT));
        assertTrue(runtime.cacheFor(TENANT).tryFind("acct-1").isPresent());
        assertEquals(2, await(storage.load("acct-1", TENANT)).getBalance());
    }

    @Test
    void testSmallPagesStillCommitEveryOperation() throws Exception {
        for (int i = 0; i < 5; i++) {
            start("acct-" + i, new Opened("owner-" + i));
        }
        ProjectionUpdateBatch batch = prepare(runtime(accounts().build(), storage),
                batch(0, 5, 2, new CancellationSignal()));

        await(batch.execute());

        assertEquals(3, batch.buildPages().size());
        assertEquals(5, count("pgp_doc_account"));
        assertEquals(5L, progressOf(SHARD));
    }

    @Test
    void testCancelledBatchWritesNothing() throws Exception {
        start("acct-1", new Opened("ann"));
        CancellationSignal cancellation = new CancellationSignal();
        ProjectionUpdateBatch batch = batch(0, 1, 100, cancellation);
        cancellation.cancel();

        prepare(runtime(accounts().build(), storage), batch);
        await(batch.execute());

        assertEquals(BatchState.COMMITTED, batch.getState());
        assertTrue(batch.buildPages().isEmpty());
        assertEquals(0, count("pgp_doc_account"));
        assertEquals(-1L, progressOf(SHARD));
    }

    @Test
    void testProgressConflictRollsBackDocuments() throws Exception {
        start("acct-1", new Opened("ann"));
        sql("INSERT INTO pgp_event_progression (name, last_seq_id, last_updated) VALUES ('" + SHARD + "', 5, NOW())");
        ProjectionUpdateBatch batch = prepare(runtime(accounts().build(), storage),
                batch(0, 1, 100, new CancellationSignal()));

        Throwable failure = awaitFailure(batch.execute());

        assertInstanceOf(ProgressionOutOfOrderException.class, failure);
        assertEquals(BatchState.ROLLED_BACK, batch.getState());
        assertEquals(0, count("pgp_doc_account"));
        assertEquals(5L, progressOf(SHARD));
    }

    @Test
    void testCommitListenerWritesInsideTransaction() throws Exception {
        start("acct-1", new Opened("ann"));
        AtomicInteger seen = new AtomicInteger();
        AtomicInteger visibleAfterCommit = new AtomicInteger();
        CommitListener listener = new CommitListener() {
            @Override
            public CompletableFuture<Void> beforeCommit(CommitContext context, ChangeSet changes) {
                seen.set(changes.getOperations().size());
                return context.execute(storage.upsert(new Account("audit", "system", 0), TENANT));
            }

            @Override
            public CompletableFuture<Void> afterCommit(CommitContext context, ChangeSet changes) {
                return storage.loadMany(List.of("acct-1", "audit"), TENANT)
                    .thenAccept(loaded -> visibleAfterCommit.set(loaded.size()));
            }
        };
        ProjectionUpdateBatch batch = prepare(runtime(accounts().build(), storage),
                batch(0, 1, 100, new CancellationSignal(), listener));

        await(batch.execute());

        assertEquals(2, seen.get());
        assertEquals(2, visibleAfterCommit.get());
        assertEquals(2, count("pgp_doc_account"));
    }

    @Test
    void testFailingListenerRollsBackBatch() throws Exception {
        start("acct-1", new Opened("ann"));
        CommitListener listener = new CommitListener() {
            @Override
            public CompletableFuture<Void> beforeCommit(CommitContext context, ChangeSet changes) {
                return CompletableFuture.failedFuture(new IllegalStateException("listener refused"));
            }

            @Override
            public CompletableFuture<Void> afterCommit(CommitContext context, ChangeSet changes) {
                return CompletableFuture.completedFuture(null);
            }
        };
        ProjectionUpdateBatch batch = prepare(runtime(accounts().build(), storage),
                batch(0, 1, 100, new CancellationSignal(), listener));

        Throwable failure = awaitFailure(batch.execute());

        assertInstanceOf(IllegalStateException.class, failure);
        assertEquals(0, count("pgp_doc_account"));
        assertEquals(-1L, progressOf(SHARD));
    }

    @Test
    void testEventsRaisedByNewStreamContinueItsVersions() throws Exception {
        AggregationRuntime<Account, String> runtime = runtime(accounts()
            .sideEffects((session, slice) -> slice.raiseEvent(new Audited("opened by " + slice.getAggregate().getOwner())))
            .build(), storage);
        start("acct-1", new Opened("ann"), new Deposited(3));

        project(runtime, 0, 2);

        List<Event<?>> stream = await(eventLog.fetchStream(pool, "acct-1", TENANT)
                .toCompletionStage().toCompletableFuture());
        assertEquals(List.of(1L, 2L, 3L), stream.stream().map(Event::getVersion).toList());
        assertEquals(new Audited("opened by ann"), stream.get(2).getPayload());
        assertEquals(3L, sql("SELECT version FROM pgp_streams WHERE id = 'acct-1'").iterator().next().getLong(0));
        assertEquals(3, await(storage.load("acct-1", TENANT)).getBalance());
    }
}
