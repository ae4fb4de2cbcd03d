package dev.mars.pgprojection.api.session;

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

import java.util.concurrent.CompletableFuture;

/**
 * The transaction a batch is executing in, as seen by commit listeners.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface CommitContext {

    String getTenantId();

    /**
     * Executes an additional operation in the batch transaction.
     * Only valid before commit; after commit the transaction is gone.
     */
    CompletableFuture<Void> execute(StorageOperation operation);
}
