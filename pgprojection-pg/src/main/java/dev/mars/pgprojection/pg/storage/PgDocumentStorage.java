package dev.mars.pgprojection.pg.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgprojection.api.storage.DocumentStorage;
import dev.mars.pgprojection.api.storage.RevisionedOperation;
import dev.mars.pgprojection.api.storage.StorageOperation;
import dev.mars.pgprojection.pg.schema.PgSchemaInitializer;
import dev.mars.pgprojection.pg.util.JsonMapping;
import dev.mars.pgprojection.pg.util.ReactiveUtils;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Stores aggregate documents as jsonb rows in a per-type table keyed by tenant and id.
 *
 * <p>Documents are serialized with Jackson when an upsert is created, so later in-place
 * changes to a cached aggregate do not leak into an operation that is still queued.</p>
 *
 * @param <TDoc> The document type
 * @param <TId> The identity type, stored as its string form
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgDocumentStorage<TDoc, TId> implements DocumentStorage<TDoc, TId> {
    private static final Logger logger = LoggerFactory.getLogger(PgDocumentStorage.class);

    private final Pool pool;
    private final ObjectMapper objectMapper;
    private final Class<TDoc> documentType;
    private final String table;
    private final Function<TDoc, TId> identity;
    private final BiFunction<TDoc, TId, TDoc> identityAssignment;

    private PgDocumentStorage(Builder<TDoc, TId> builder) {
        this.pool = Objects.requireNonNull(builder.pool, "Pool cannot be null");
        this.documentType = Objects.requireNonNull(builder.documentType, "Document type cannot be null");
        this.identity = Objects.requireNonNull(builder.identity, "Identity function cannot be null");
        this.identityAssignment = builder.identityAssignment != null ? builder.identityAssignment : (doc, id) -> doc;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : JsonMapping.createDefaultObjectMapper();
        this.table = PgSchemaInitializer.validateTableName(builder.table != null
                ? builder.table
                : defaultTableName(documentType));
    }

    public static <TDoc, TId> Builder<TDoc, TId> builder(Pool pool, Class<TDoc> documentType) {
        return new Builder<>(pool, documentType);
    }

    public static String defaultTableName(Class<?> documentType) {
        return "pgp_doc_" + documentType.getSimpleName().toLowerCase(Locale.ROOT);
    }

    public String getTable() {
        return table;
    }

    /**
     * Creates the backing table if it does not exist.
     */
    public CompletableFuture<Void> ensureStorage() {
        return ReactiveUtils.toCompletableFuture(new PgSchemaInitializer(pool).ensureDocumentTable(table));
    }

    @Override
    public Class<TDoc> getDocumentType() {
        return documentType;
    }

    @Override
    public CompletableFuture<TDoc> load(TId id, String tenantId) {
        return ReactiveUtils.toCompletableFuture(load(pool, id, tenantId));
    }

    /**
     * Loads one document through the given client, typically a connection with an open transaction.
     */
    public Future<TDoc> load(SqlClient client, TId id, String tenantId) {
        String sql = "SELECT data FROM " + table + " WHERE tenant_id = $1 AND id = $2";
        return client.preparedQuery(sql).execute(Tuple.of(tenantId, String.valueOf(id)))
            .map(rows -> {
                if (rows.size() == 0) {
                    return null;
                }
                return deserialize(rows.iterator().next());
            });
    }

    @Override
    public CompletableFuture<List<TDoc>> loadMany(Collection<TId> ids, String tenantId) {
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        String[] keys = ids.stream().map(String::valueOf).distinct().toArray(String[]::new);
        String sql = "SELECT data FROM " + table + " WHERE tenant_id = $1 AND id = ANY($2)";
        return ReactiveUtils.toCompletableFuture(
            pool.preparedQuery(sql).execute(Tuple.of(tenantId, keys))
                .map(this::deserializeAll)
                .onSuccess(docs -> logger.debug("Loaded {} of {} {} document(s) for tenant {}",
                        docs.size(), keys.length, documentType.getSimpleName(), tenantId)));
    }

    @Override
    public RevisionedOperation upsert(TDoc document, String tenantId) {
        TId id = identity.apply(document);
        if (id == null) {
            throw new IllegalArgumentException("Cannot store " + documentType.getSimpleName() + " without an identity");
        }
        return new PgUpsertOperation<>(table, documentType, document, String.valueOf(id), serialize(document), tenantId);
    }

    @Override
    public StorageOperation deleteForId(TId id, String tenantId) {
        return new PgDeleteOperation(table, documentType, String.valueOf(id), tenantId);
    }

    @Override
    public TId identity(TDoc document) {
        return identity.apply(document);
    }

    @Override
    public TDoc assignIdentity(TDoc document, TId id) {
        return identityAssignment.apply(document, id);
    }

    private String serialize(TDoc document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + documentType.getSimpleName(), e);
        }
    }

    private List<TDoc> deserializeAll(RowSet<Row> rows) {
        List<TDoc> documents = new ArrayList<>(rows.size());
        for (Row row : rows) {
            documents.add(deserialize(row));
        }
        return documents;
    }

    private TDoc deserialize(Row row) {
        try {
            return objectMapper.readValue(JsonMapping.jsonText(row.getValue("data")), documentType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + documentType.getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return "PgDocumentStorage{" + documentType.getSimpleName() + " -> " + table + '}';
    }

    /**
     * Builder for PgDocumentStorage.
     */
    public static class Builder<TDoc, TId> {
        private final Pool pool;
        private final Class<TDoc> documentType;
        private ObjectMapper objectMapper;
        private String table;
        private Function<TDoc, TId> identity;
        private BiFunction<TDoc, TId, TDoc> identityAssignment;

        private Builder(Pool pool, Class<TDoc> documentType) {
            this.pool = pool;
            this.documentType = documentType;
        }

        public Builder<TDoc, TId> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder<TDoc, TId> table(String table) {
            this.table = table;
            return this;
        }

        public Builder<TDoc, TId> identity(Function<TDoc, TId> identity) {
            this.identity = identity;
            return this;
        }

        public Builder<TDoc, TId> assignIdentity(BiFunction<TDoc, TId, TDoc> identityAssignment) {
            this.identityAssignment = identityAssignment;
            return this;
        }

        public PgDocumentStorage<TDoc, TId> build() {
            return new PgDocumentStorage<>(this);
        }
    }
}
