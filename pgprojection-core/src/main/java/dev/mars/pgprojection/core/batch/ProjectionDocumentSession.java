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

import dev.mars.pgprojection.api.log.EventAppender;
import dev.mars.pgprojection.api.messaging.MessageBatch;
import dev.mars.pgprojection.api.projection.ShardExecutionMode;
import dev.mars.pgprojection.api.session.ProjectionSession;
import dev.mars.pgprojection.api.storage.DocumentStorage;
import dev.mars.pgprojection.api.storage.StorageOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tenant-scoped session over a {@link ProjectionUpdateBatch}.
 *
 * <p>Queued operations go to the batch's sink. When the identity map is enabled, loads
 * of the same document within the session return the same instance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ProjectionDocumentSession implements ProjectionSession {

    private final ProjectionUpdateBatch batch;
    private final String tenantId;
    private final ShardExecutionMode mode;
    private final EventAppender eventAppender;
    private final Map<IdentityKey, Object> identityMap;

    ProjectionDocumentSession(ProjectionUpdateBatch batch, String tenantId, ShardExecutionMode mode,
                              EventAppender eventAppender, boolean useIdentityMap) {
        this.batch = Objects.requireNonNull(batch, "Batch cannot be null");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID cannot be null");
        this.mode = mode;
        this.eventAppender = eventAppender;
        this.identityMap = useIdentityMap ? new ConcurrentHashMap<>() : null;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public ShardExecutionMode getExecutionMode() {
        return mode;
    }

    @Override
    public void queueOperation(StorageOperation operation) {
        queueOperations(List.of(operation));
    }

    @Override
    public void queueOperations(List<? extends StorageOperation> operations) {
        batch.queueOperations(new ArrayList<>(operations));
    }

    @Override
    public void queueOperations(List<? extends StorageOperation> operations, Runnable onAccepted) {
        batch.queueOperations(new ArrayList<>(operations), onAccepted);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <TDoc, TId> CompletableFuture<TDoc> load(DocumentStorage<TDoc, TId> storage, TId id) {
        if (identityMap == null) {
            return storage.load(id, tenantId);
        }

        IdentityKey key = new IdentityKey(storage.getDocumentType(), id);
        Object tracked = identityMap.get(key);
        if (tracked != null) {
            return CompletableFuture.completedFuture((TDoc) tracked);
        }

        return storage.load(id, tenantId).thenApply(document -> {
            if (document == null) {
                return null;
            }
            Object existing = identityMap.putIfAbsent(key, document);
            return existing != null ? (TDoc) existing : document;
        });
    }

    public boolean isUsingIdentityMap() {
        return identityMap != null;
    }

    @Override
    public CompletableFuture<MessageBatch> currentMessageBatch() {
        return batch.currentMessageBatch(this);
    }

    @Override
    public EventAppender getEventAppender() {
        return eventAppender;
    }

    private static final class IdentityKey {
        private final Class<?> documentType;
        private final Object id;

        private IdentityKey(Class<?> documentType, Object id) {
            this.documentType = documentType;
            this.id = id;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof IdentityKey)) return false;
            IdentityKey that = (IdentityKey) o;
            return documentType.equals(that.documentType) && id.equals(that.id);
        }

        @Override
        public int hashCode() {
            return Objects.hash(documentType, id);
        }
    }
}
