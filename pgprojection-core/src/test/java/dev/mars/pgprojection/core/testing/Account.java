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

import java.util.ArrayList;
import java.util.List;

/**
 * Read model used across the engine tests.
 */
public class Account {

    private String id;
    private String owner;
    private long balance;
    private long version;
    private final List<Long> appliedSequences = new ArrayList<>();

    public Account() {
    }

    public Account(String owner) {
        this.owner = owner;
    }

    public Account(String id, String owner, long balance) {
        this.id = id;
        this.owner = owner;
        this.balance = balance;
    }

    public static Account withId(Account account, String id) {
        account.id = id;
        return account;
    }

    public static Account withVersion(Account account, long version) {
        account.version = version;
        return account;
    }

    public void deposit(long amount) {
        balance += amount;
    }

    public void withdraw(long amount) {
        balance -= amount;
    }

    public String getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public long getBalance() {
        return balance;
    }

    public long getVersion() {
        return version;
    }

    public List<Long> getAppliedSequences() {
        return appliedSequences;
    }

    @Override
    public String toString() {
        return "Account{" + id + ", " + owner + ", balance=" + balance + ", version=" + version + '}';
    }
}
