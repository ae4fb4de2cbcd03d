package dev.mars.pgprojection.pg.storage;

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

import dev.mars.pgprojection.api.error.ConcurrencyException;
import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.api.storage.RevisionedOperation;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.core.testing.Account;
import dev.mars.pgprojection.pg.PgTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
class PgDocumentStorageIntegrationTest extends PgTestSupport {

    private static final String TENANT = "tenant-a";

    private PgDocumentStorage<Account, String> storage;

    @BeforeEach
    void setUp() throws Exception {
        storage = PgDocumentStorage.<Account, String>builder(pool, Account.class)
            .identity(Account::getId)
            .assignIdentity(Account::withId)
            .build();
        await(storage.ensureStorage());
    }

    private CompletableFuture<Void> executeAsync(StorageOperation... operations) {
        return pool.withTransaction(conn -> PgOperationExecutor.execute(conn, List.of(operations)))
            .toCompletionStage().toCompletableFuture();
    }

    private void execute(StorageOperation... operations) throws Exception {
        await(executeAsync(operations));
    }

    private long storedVersion(String id) throws Exception {
        return sql("SELECT version FROM " + storage.getTable() + " WHERE id = '" + id + "'").iterator().next().getLong(0);
    }

    @Test
    void testUpsertThenLoad() throws Exception {
        execute(storage.upsert(new Account("a-1", "ann", 25), TENANT));

        Account loaded = await(storage.load("a-1", TENANT));

        assertNotNull(loaded);
        assertEquals("ann", loaded.getOwner());
        assertEquals(25, loaded.getBalance());
        assertEquals("pgp_doc_account", storage.getTable());
    }

    @Test
    void testLoadMissingReturnsNull() throws Exception {
        assertNull(await(storage.load("missing", TENANT)));
        assertTrue(await(storage.loadMany(List.of(), TENANT)).isEmpty());
    }

    @Test
    void testLoadManyReturnsOnlyExistingDocumentsOfTenant() throws Exception {
        execute(storage.upsert(new Account("a-1", "ann", 1), TENANT),
                storage.upsert(new Account("a-2", "bob", 2), TENANT),
                storage.upsert(new Account("a-3", "cat", 3), "tenant-b"));

        List<Account> loaded = await(storage.loadMany(List.of("a-1", "a-2", "a-3", "missing"), TENANT));

        assertEquals(List.of("a-1", "a-2"), loaded.stream()
            .map(Account::getId)
            .sorted(Comparator.naturalOrder())
            .collect(Collectors.toList()));
    }

    @Test
    void testPlainUpsertIncrementsVersion() throws Exception {
        execute(storage.upsert(new Account("a-1", "ann", 1), TENANT));
        execute(storage.upsert(new Account("a-1", "ann", 2), TENANT));

        assertEquals(2, storedVersion("a-1"));
        assertEquals(2, await(storage.load("a-1", TENANT)).getBalance());
    }

    @Test
    void testDocumentIsSerializedWhenUpsertIsCreated() throws Exception {
        Account account = new Account("a-1", "ann", 10);
        RevisionedOperation upsert = storage.upsert(account, TENANT);
        account.deposit(90);

        execute(upsert);

        assertEquals(10, await(storage.load("a-1", TENANT)).getBalance());
    }

    @Test
    void testRevisionedUpsertRejectsStaleRevision() throws Exception {
        RevisionedOperation current = storage.upsert(new Account("a-1", "ann", 5), TENANT);
        current.setRevision(5);
        execute(current);

        RevisionedOperation stale = storage.upsert(new Account("a-1", "ann", 3), TENANT);
        stale.setRevision(3);
        Throwable failure = awaitFailure(executeAsync(stale));

        ConcurrencyException conflict = assertInstanceOf(ConcurrencyException.class, failure);
        assertEquals(3L, conflict.getExpectedVersion());
        assertEquals(5, storedVersion("a-1"));
        assertEquals(5, await(storage.load("a-1", TENANT)).getBalance());
    }

    @Test
    void testIgnoredConcurrencyViolationKeepsNewerDocument() throws Exception {
        RevisionedOperation current = storage.upsert(new Account("a-1", "ann", 5), TENANT);
        current.setRevision(5);
        execute(current);

        RevisionedOperation stale = storage.upsert(new Account("a-1", "ann", 3), TENANT);
        stale.setRevision(3);
        stale.setIgnoreConcurrencyViolation(true);
        RevisionedOperation newer = storage.upsert(new Account("a-1", "ann", 7), TENANT);
        newer.setRevision(7);
        execute(stale, newer);

        assertEquals(7, storedVersion("a-1"));
        assertEquals(7, await(storage.load("a-1", TENANT)).getBalance());
    }

    @Test
    void testDeleteRemovesOnlyTenantRow() throws Exception {
        execute(storage.upsert(new Account("a-1", "ann", 1), TENANT),
                storage.upsert(new Account("a-1", "ann", 1), "tenant-b"));

        StorageOperation delete = storage.deleteForId("a-1", TENANT);
        execute(delete);

        assertEquals(OperationRole.DELETION, delete.getRole());
        assertNull(await(storage.load("a-1", TENANT)));
        assertNotNull(await(storage.load("a-1", "tenant-b")));
    }

    @Test
    void testBatchedUpsertsAllApplied() throws Exception {
        StorageOperation[] upserts = new StorageOperation[20];
        for (int i = 0; i < upserts.length; i++) {
            upserts[i] = storage.upsert(new Account("a-" + i, "owner-" + i, i), TENANT);
        }

        execute(upserts);

        assertEquals(20, count(storage.getTable()));
        assertEquals(1, PgOperationExecutor.groupRuns(List.of(upserts)).size());
    }

    @Test
    void testUpsertWithoutIdentityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> storage.upsert(new Account("nobody"), TENANT));
    }
}
