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

import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.api.storage.RevisionedOperation;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.core.testing.Account;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlClient;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("core")
class PgOperationExecutorTest {

    private final PgDocumentStorage<Account, String> storage =
        PgDocumentStorage.<Account, String>builder(mock(Pool.class), Account.class)
            .identity(Account::getId)
            .assignIdentity(Account::withId)
            .build();

    @Test
    void testConsecutiveOperationsWithSameSqlShareARun() {
        StorageOperation first = storage.upsert(new Account("a", "ann", 1), "t");
        StorageOperation second = storage.upsert(new Account("b", "bob", 2), "t");
        StorageOperation delete = storage.deleteForId("c", "t");
        StorageOperation third = storage.upsert(new Account("d", "dan", 3), "t");

        List<List<PgOperation>> runs = PgOperationExecutor.groupRuns(List.of(first, second, delete, third));

        assertEquals(3, runs.size());
        assertEquals(List.of(first, second), runs.get(0));
        assertEquals(List.of(delete), runs.get(1));
        assertEquals(List.of(third), runs.get(2));
    }

    @Test
    void testRevisionedUpsertsRunSeparatelyFromPlainOnes() {
        RevisionedOperation plain = storage.upsert(new Account("a", "ann", 1), "t");
        RevisionedOperation revisioned = storage.upsert(new Account("b", "bob", 2), "t");
        revisioned.setRevision(4);

        assertEquals(2, PgOperationExecutor.groupRuns(List.of(plain, revisioned)).size());
    }

    @Test
    void testForeignOperationFailsWithoutTouchingClient() {
        SqlClient client = mock(SqlClient.class);
        StorageOperation foreign = new StorageOperation() {
            @Override
            public Class<?> getDocumentType() {
                return Account.class;
            }

            @Override
            public OperationRole getRole() {
                return OperationRole.OTHER;
            }

            @Override
            public String getTenantId() {
                return "t";
            }
        };

        Future<Void> result = PgOperationExecutor.execute(client, List.of(foreign));

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        verifyNoInteractions(client);
    }
}
