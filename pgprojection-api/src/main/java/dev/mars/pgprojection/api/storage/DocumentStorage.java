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

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Storage collaborator for one aggregate document type.
 *
 * Loads return futures; writes return operations that are queued into a batch
 * rather than executed immediately.
 *
 * @param <TDoc> The document type
 * @param <TId> The identity type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface DocumentStorage<TDoc, TId> {

    Class<TDoc> getDocumentType();

    /**
     * Loads one document.
     *
     * @return A future completing with the document, or with null when it does not exist
     */
    CompletableFuture<TDoc> load(TId id, String tenantId);

    /**
     * Loads several documents in one round trip. Missing ids are simply absent from the result.
     */
    CompletableFuture<List<TDoc>> loadMany(Collection<TId> ids, String tenantId);

    RevisionedOperation upsert(TDoc document, String tenantId);

    StorageOperation deleteForId(TId id, String tenantId);

    TId identity(TDoc document);

    /**
     * Assigns the identity to the document.
     *
     * @return The document carrying the identity. Mutable documents return the same instance.
     */
    TDoc assignIdentity(TDoc document, TId id);
}
