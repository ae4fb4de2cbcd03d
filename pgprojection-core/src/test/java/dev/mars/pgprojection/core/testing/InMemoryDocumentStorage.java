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

import dev.mars.pgprojection.api.storage.DocumentStorage;
import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.api.storage.RevisionedOperation;
import dev.mars.pgprojection.api.storage.StorageOperation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Document storage backed by a map per tenant. Operations only take effect once
 * {@link #apply(StorageOperation)} is called for them.
 */
public class InMemoryDocumentStorage<TDoc, TId> implements DocumentStorage<TDoc, TId> {

    private final Class<TDoc> documentType;
    private final Function<TDoc, TId> identity;
    private final BiFunction<TDoc, TId, TDoc> assignIdentity;
    private final Map<String, Map<TId, TDoc>> documents = new ConcurrentHashMap<>();
    private final AtomicInteger loads = new AtomicInteger();
    private final AtomicInteger multiLoads = new AtomicInteger();
    private final AtomicReference<RuntimeException> loadFailure = new AtomicReference<>();

    public InMemoryDocumentStorage(Class<TDoc> documentType, Function<TDoc, TId> identity,
                                   BiFunction<TDoc, TId, TDoc> assignIdentity) {
        this.documentType = documentType;
        this.identity = identity;
        this.assignIdentity = assignIdentity;
    }

    public void store(String tenantId, TDoc document) {
        documents.computeIfAbsent(tenantId, t -> new ConcurrentHashMap<>()).put(identity.apply(document), document);
    }

    public Optional<TDoc> find(String tenantId, TId id) {
        return Optional.ofNullable(documents.getOrDefault(tenantId, Map.of()).get(id));
    }

    public int count(String tenantId) {
        return documents.getOrDefault(tenantId, Map.of()).size();
    }

    public int getLoads() {
        return loads.get();
    }

    public int getMultiLoads() {
        return multiLoads.get();
    }

    public void failLoadsWith(RuntimeException failure) {
        loadFailure.set(failure);
    }

    @SuppressWarnings("unchecked")
    public void apply(StorageOperation operation) {
        if (operation instanceof Upsert) {
            Upsert<TDoc> upsert = (Upsert<TDoc>) operation;
            store(upsert.getTenantId(), upsert.getDocument());
        } else if (operation instanceof Delete) {
            Delete<TId> delete = (Delete<TId>) operation;
            Map<TId, TDoc> tenantDocs = documents.get(delete.getTenantId());
            if (tenantDocs != null) {
                tenantDocs.remove(delete.getId());
            }
        }
    }

    @Override
    public Class<TDoc> getDocumentType() {
        return documentType;
    }

    @Override
    public CompletableFuture<TDoc> load(TId id, String tenantId) {
        loads.incrementAndGet();
        RuntimeException failure = loadFailure.get();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(find(tenantId, id).orElse(null));
    }

    @Override
    public CompletableFuture<List<TDoc>> loadMany(Collection<TId> ids, String tenantId) {
        multiLoads.incrementAndGet();
        RuntimeException failure = loadFailure.get();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        List<TDoc> found = new ArrayList<>();
        for (TId id : ids) {
            find(tenantId, id).ifPresent(found::add);
        }
        return CompletableFuture.completedFuture(found);
    }

    @Override
    public RevisionedOperation upsert(TDoc document, String tenantId) {
        return new Upsert<>(documentType, document, tenantId);
    }

    @Override
    public StorageOperation deleteForId(TId id, String tenantId) {
        return new Delete<>(documentType, id, tenantId);
    }

    @Override
    public TId identity(TDoc document) {
        return identity.apply(document);
    }

    @Override
    public TDoc assignIdentity(TDoc document, TId id) {
        return assignIdentity.apply(document, id);
    }

    public static final class Upsert<TDoc> implements RevisionedOperation {
        private final Class<TDoc> documentType;
        private final TDoc document;
        private final String tenantId;
        private long revision;
        private boolean ignoreConcurrencyViolation;

        Upsert(Class<TDoc> documentType, TDoc document, String tenantId) {
            this.documentType = documentType;
            this.document = document;
            this.tenantId = tenantId;
        }

        public TDoc getDocument() {
            return document;
        }

        @Override
        public Class<?> getDocumentType() {
            return documentType;
        }

        @Override
        public OperationRole getRole() {
            return OperationRole.UPSERT;
        }

        @Override
        public String getTenantId() {
            return tenantId;
        }

        @Override
        public long getRevision() {
            return revision;
        }

        @Override
        public void setRevision(long revision) {
            this.revision = revision;
        }

        @Override
        public boolean isIgnoreConcurrencyViolation() {
            return ignoreConcurrencyViolation;
        }

        @Override
        public void setIgnoreConcurrencyViolation(boolean ignore) {
            this.ignoreConcurrencyViolation = ignore;
        }

        @Override
        public String toString() {
            return "Upsert{" + document + ", revision=" + revision + '}';
        }
    }

    public static final class Delete<TId> implements StorageOperation {
        private final Class<?> documentType;
        private final TId id;
        private final String tenantId;

        Delete(Class<?> documentType, TId id, String tenantId) {
            this.documentType = documentType;
            this.id = id;
            this.tenantId = tenantId;
        }

        public TId getId() {
            return id;
        }

        @Override
        public Class<?> getDocumentType() {
            return documentType;
        }

        @Override
        public OperationRole getRole() {
            return OperationRole.DELETION;
        }

        @Override
        public String getTenantId() {
            return tenantId;
        }

        @Override
        public String toString() {
            return "Delete{" + id + '}';
        }
    }
}
