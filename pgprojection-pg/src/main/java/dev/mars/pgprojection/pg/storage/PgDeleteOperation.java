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

import dev.mars.pgprojection.api.storage.OperationRole;
import io.vertx.sqlclient.Tuple;

/**
 * Deletes one document row by tenant and id.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgDeleteOperation extends PgOperation {

    private final String table;
    private final Class<?> documentType;
    private final String id;

    PgDeleteOperation(String table, Class<?> documentType, String id, String tenantId) {
        super(tenantId);
        this.table = table;
        this.documentType = documentType;
        this.id = id;
    }

    @Override
    public String getSql() {
        return "DELETE FROM " + table + " WHERE tenant_id = $1 AND id = $2";
    }

    @Override
    public Tuple getParameters() {
        return Tuple.of(getTenantId(), id);
    }

    public String getId() {
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
    public String toString() {
        return "PgDeleteOperation{" + table + " '" + id + "' tenant=" + getTenantId() + '}';
    }
}
