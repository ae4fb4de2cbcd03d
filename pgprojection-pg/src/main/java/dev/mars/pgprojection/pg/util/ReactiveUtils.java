package dev.mars.pgprojection.pg.util;

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

import dev.mars.pgprojection.api.storage.StorageFailureClassifier;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Bridges between Vert.x futures used by the reactive PostgreSQL client and the
 * CompletableFuture based collaborator interfaces of the projection engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class ReactiveUtils {
    private static final Logger logger = LoggerFactory.getLogger(ReactiveUtils.class);

    private ReactiveUtils() {
        // Utility class
    }

    /**
     * Converts a Vert.x Future to a CompletableFuture.
     *
     * @param future The Vert.x Future to convert
     * @return CompletableFuture that completes when the Future completes
     */
    public static <T> CompletableFuture<T> toCompletableFuture(Future<T> future) {
        CompletableFuture<T> completableFuture = new CompletableFuture<>();

        future.onSuccess(result -> {
            logger.trace("Vert.x Future completed successfully");
            completableFuture.complete(result);
        }).onFailure(error -> {
            logger.trace("Vert.x Future failed: {}", error.getMessage());
            completableFuture.completeExceptionally(error);
        });

        return completableFuture;
    }

    /**
     * Converts a CompletableFuture to a Vert.x Future, unwrapping completion wrappers so
     * the Vert.x side sees the original failure.
     *
     * @param completableFuture The CompletableFuture to convert
     * @return Future that completes when the CompletableFuture completes
     */
    public static <T> Future<T> fromCompletableFuture(CompletableFuture<T> completableFuture) {
        Promise<T> promise = Promise.promise();

        completableFuture.whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = StorageFailureClassifier.unwrap(error);
                logger.trace("CompletableFuture failed: {}", cause.getMessage());
                promise.fail(cause);
            } else {
                promise.complete(result);
            }
        });

        return promise.future();
    }

    /**
     * Creates a failed CompletableFuture with the given error.
     *
     * @param error The error to wrap
     * @return Failed CompletableFuture
     */
    public static <T> CompletableFuture<T> failedFuture(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }
}
