package dev.mars.pgprojection.core.testing;

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

import dev.mars.pgprojection.core.aggregation.AggregateProjection;
import dev.mars.pgprojection.core.testing.AccountEvents.Closed;
import dev.mars.pgprojection.core.testing.AccountEvents.Deposited;
import dev.mars.pgprojection.core.testing.AccountEvents.Opened;
import dev.mars.pgprojection.core.testing.AccountEvents.Withdrawn;

/**
 * Single-stream account projection shared by the tests.
 */
public final class AccountProjections {

    private AccountProjections() {
    }

    public static AggregateProjection.Builder<Account, String> accounts() {
        return AggregateProjection.builder(Account.class, String.class)
            .create(Opened.class, e -> new Account(e.owner()))
            .applyInPlace(Deposited.class, (account, e) -> account.deposit(e.amount()))
            .applyInPlace(Withdrawn.class, (account, e) -> account.withdraw(e.amount()))
            .deleteOn(Closed.class)
            .versionWith(Account::withVersion);
    }

    public static InMemoryDocumentStorage<Account, String> storage() {
        return new InMemoryDocumentStorage<>(Account.class, Account::getId, Account::withId);
    }
}
