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

import dev.mars.pgprojection.api.error.ConcurrencyException;
import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.api.storage.RevisionedOperation;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inserts or replaces one document row.
 *
 * <p>Without a revision the stored version is incremented. With a revision the row is only
 * replaced when the stored version is lower, otherwise the operation raises
 * {@link ConcurrencyException} unless concurrency violations are ignored.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgUpsertOperation<TDoc> extends PgOperation implements RevisionedOperation {
    private static final Logger logger = LoggerFactory.getLogger(PgUpsertOperation.class);

    private final String table;
    private final Class<TDoc> documentType;
    private final TDoc document;
    private final String id;
    private final String json;
    private long revision;
    private boolean ignoreConcurrencyViolation;

    PgUpsertOperation(String table, Class<TDoc> documentType, TDoc document, String id, String json, String tenantId) {
        super(tenantId);
        this.table = table;
        this.documentType = documentType;
        this.document = document;
        this.id = id;
        this.json = json;
    }

    @Override
    public String getSql() {
        if (revision > 0) {
            return "INSERT INTO " + table + " AS d (id, tenant_id, data, version, last_modified) "
                + "VALUES ($1, $2, $3::jsonb, $4, NOW()) "
                + "ON CONFLICT (tenant_id, id) DO UPDATE SET data = EXCLUDED.data, version = EXCLUDED.version, "
                + "last_modified = NOW() WHERE d.version < EXCLUDED.version RETURNING d.version";
        }
        return "INSERT INTO " + table + " AS d (id, tenant_id, data, version, last_modified) "
            + "VALUES ($1, $2, $3::jsonb, 1, NOW()) "
            + "ON CONFLICT (tenant_id, id) DO UPDATE SET data = EXCLUDED.data, version = d.version + 1, "
            + "last_modified = NOW() RETURNING d.version";
    }

    @Override
    public Tuple getParameters() {
        if (revision > 0) {
            return Tuple.of(id, getTenantId(), json, revision);
        }
        return Tuple.of(id, getTenantId(), json);
    }

    @Override
    public void postprocess(RowSet<Row> result) {
        if (revision > 0 && result.rowCount() == 0) {
            if (ignoreConcurrencyViolation) {
                logger.debug("Skipped stale upsert of {} '{}' at revision {}", documentType.getSimpleName(), id, revision);
                return;
            }
            throw new ConcurrencyException(documentType.getName(), id, revision, null);
        }
    }

    public TDoc getDocument() {
        return document;
    }

    public String getId() {
        return id;
    }

    public String getJson() {
        return json;
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
        return "PgUpsertOperation{" + table + " '" + id + "' tenant=" + getTenantId() + ", revision=" + revision + '}';
    }
}
