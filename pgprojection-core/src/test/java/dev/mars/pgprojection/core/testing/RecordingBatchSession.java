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

import dev.mars.pgprojection.api.SimpleEvent;
import dev.mars.pgprojection.api.batch.BatchSession;
import dev.mars.pgprojection.api.batch.OperationPage;
import dev.mars.pgprojection.api.batch.UpdateBatch;
import dev.mars.pgprojection.api.session.CommitContext;
import dev.mars.pgprojection.api.storage.StorageOperation;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Batch session that records executed operations in order and hands each one to an
 * optional consumer, standing in for the database transaction.
 */
public class RecordingBatchSession implements BatchSession, CommitContext {

    private final List<StorageOperation> executed = new CopyOnWriteArrayList<>();
    private final List<Integer> pageSizes = new CopyOnWriteArrayList<>();
    private final List<StorageOperation> hookOperations = new CopyOnWriteArrayList<>();
    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final Consumer<StorageOperation> target;

    public RecordingBatchSession() {
        this(operation -> { });
    }

    public RecordingBatchSession(Consumer<StorageOperation> target) {
        this.target = target;
    }

    public void failWith(RuntimeException failure) {
        this.failure.set(failure);
    }

    public List<StorageOperation> getExecuted() {
        return executed;
    }

    public List<Integer> getPageSizes() {
        return pageSizes;
    }

    public List<StorageOperation> getHookOperations() {
        return hookOperations;
    }

    public int getExecutions() {
        return executions.get();
    }

    public int getCloses() {
        return closes.get();
    }

    @Override
    public CompletableFuture<Void> executeBatch(UpdateBatch batch) {
        executions.incrementAndGet();
        return batch.preUpdate(this)
            .thenRun(() -> {
                for (OperationPage page : batch.buildPages()) {
                    pageSizes.add(page.size());
                    for (StorageOperation operation : page.getOperations()) {
                        if (failure.get() != null) {
                            throw failure.get();
                        }
                        executed.add(operation);
                        target.accept(operation);
                    }
                }
            })
            .thenCompose(v -> batch.postUpdate(this));
    }

    @Override
    public String getTenantId() {
        return SimpleEvent.DEFAULT_TENANT;
    }

    @Override
    public CompletableFuture<Void> execute(StorageOperation operation) {
        hookOperations.add(operation);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
