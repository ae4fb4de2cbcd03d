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

/**
 * An opaque unit of work queued into a batch and executed by the storage layer.
 *
 * The projection engine never issues queries itself. It only produces these
 * operations and hands them to an {@link dev.mars.pgprojection.api.batch.UpdateBatch}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface StorageOperation {

    /**
     * @return The document type this operation writes, or null for log and progression operations
     */
    Class<?> getDocumentType();

    OperationRole getRole();

    String getTenantId();
}
