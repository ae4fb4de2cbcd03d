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

import dev.mars.pgprojection.api.storage.StorageOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Single-consumer, order-preserving queue of operation groups.
 *
 * <p>Any number of producers may post concurrently. Exactly one thread drains the queue
 * and hands each group to the target in the order the posts happened, so the target
 * never needs its own synchronisation. The first failure of the target is kept and
 * fails the future returned by {@link #complete()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class OperationSink implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(OperationSink.class);

    /**
     * Operations that must be paged together, plus an optional action run once they are.
     */
    public static final class Group {
        private final List<StorageOperation> operations;
        private final Runnable onAccepted;

        public Group(List<StorageOperation> operations, Runnable onAccepted) {
            this.operations = Objects.requireNonNull(operations, "Operations cannot be null");
            this.onAccepted = onAccepted;
        }

        public List<StorageOperation> getOperations() {
            return operations;
        }

        public void accepted() {
            if (onAccepted != null) {
                onAccepted.run();
            }
        }
    }

    private final ExecutorService consumer;
    private final Consumer<Group> target;
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private volatile CompletableFuture<Void> completion;

    public OperationSink(String name, Consumer<Group> target) {
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.consumer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pgprojection-sink-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Void> post(List<StorageOperation> operations) {
        return post(new Group(operations, null));
    }

    /**
     * Posts a group of operations.
     *
     * @return A future completing once the group has been handed to the target
     * @throws IllegalStateException if the sink has been completed
     */
    public synchronized CompletableFuture<Void> post(Group group) {
        if (completed.get()) {
            throw new IllegalStateException("Operation sink is completed");
        }
        try {
            return CompletableFuture.runAsync(() -> deliver(group), consumer);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Operation sink is completed", e);
        }
    }

    private void deliver(Group group) {
        try {
            target.accept(group);
        } catch (RuntimeException e) {
            if (failure.compareAndSet(null, e)) {
                logger.error("Failed to hand {} operation(s) to the target", group.getOperations().size(), e);
            }
            throw e;
        }
    }

    /**
     * Stops accepting posts; the returned future completes after every earlier post is drained,
     * exceptionally with the first delivery failure if there was one.
     */
    public synchronized CompletableFuture<Void> complete() {
        if (completion == null) {
            completed.set(true);
            completion = CompletableFuture.runAsync(() -> logger.debug("Operation sink drained"), consumer)
                .thenCompose(v -> {
                    Throwable first = failure.get();
                    return first == null
                        ? CompletableFuture.<Void>completedFuture(null)
                        : CompletableFuture.<Void>failedFuture(first);
                });
            consumer.shutdown();
        }
        return completion;
    }

    public boolean isCompleted() {
        return completed.get();
    }

    @Override
    public void close() {
        complete();
        try {
            if (!consumer.awaitTermination(10, TimeUnit.SECONDS)) {
                consumer.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
