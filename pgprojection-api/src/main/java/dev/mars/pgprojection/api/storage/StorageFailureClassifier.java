package dev.mars.pgprojection.api.storage;

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
import dev.mars.pgprojection.api.error.StreamLockedException;
import dev.mars.pgprojection.api.error.TransientDatabaseException;

import java.sql.SQLException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a failure came from the storage layer or driver.
 *
 * Storage failures propagate unwrapped so the orchestration layer can apply its
 * own retry policy. Anything else raised while folding is wrapped with the
 * offending event.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@FunctionalInterface
public interface StorageFailureClassifier {

    boolean isStorageFailure(Throwable failure);

    default StorageFailureClassifier or(StorageFailureClassifier other) {
        return failure -> isStorageFailure(failure) || other.isStorageFailure(failure);
    }

    /**
     * Classifies the projection's own storage exceptions and JDBC {@link SQLException}s.
     */
    static StorageFailureClassifier defaults() {
        return failure -> failure instanceof TransientDatabaseException
                || failure instanceof ConcurrencyException
                || failure instanceof StreamLockedException
                || failure instanceof SQLException;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
