package dev.mars.pgprojection.pg.schema;

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

import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Creates the event log, stream, progression and document tables used by the
 * PostgreSQL projection collaborators. Every statement is idempotent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgSchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(PgSchemaInitializer.class);

    public static final String SCHEMA_SCRIPT = "/db/pgprojection-schema.sql";

    private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final Pool pool;

    public PgSchemaInitializer(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
    }

    /**
     * Creates the event log, stream and progression tables.
     */
    public Future<Void> initializeSchema() {
        logger.info("Initializing projection schema");
        return runScript(SCHEMA_SCRIPT)
            .onSuccess(v -> logger.info("Projection schema initialized successfully"))
            .onFailure(error -> logger.error("Failed to initialize projection schema", error));
    }

    /**
     * Runs every statement of a classpath SQL script in one transaction.
     *
     * @param resourcePath The classpath location of the script
     */
    public Future<Void> runScript(String resourcePath) {
        return loadScript(resourcePath).compose(this::executeStatements);
    }

    /**
     * Creates the table backing a document type if it does not exist yet.
     *
     * @param tableName The table name, lower case letters, digits and underscores only
     */
    public Future<Void> ensureDocumentTable(String tableName) {
        validateTableName(tableName);
        String ddl = "CREATE TABLE IF NOT EXISTS " + tableName + " (\n"
            + "    id VARCHAR(255) NOT NULL,\n"
            + "    tenant_id VARCHAR(100) NOT NULL DEFAULT '*DEFAULT*',\n"
            + "    data JSONB NOT NULL,\n"
            + "    version BIGINT NOT NULL DEFAULT 1,\n"
            + "    last_modified TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT NOW(),\n"
            + "    PRIMARY KEY (tenant_id, id)\n"
            + ")";
        return executeStatements(List.of(ddl))
            .onSuccess(v -> logger.debug("Ensured document table {}", tableName));
    }

    public static String validateTableName(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name (allowed: lower case letters, digits, underscore): "
                    + tableName);
        }
        return tableName;
    }

    private Future<List<String>> loadScript(String resourcePath) {
        return Future.future(promise -> {
            try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
                if (is == null) {
                    promise.fail(new IllegalStateException("Schema script not found: " + resourcePath));
                    return;
                }
                promise.complete(parseSqlStatements(new String(is.readAllBytes(), StandardCharsets.UTF_8)));
            } catch (IOException e) {
                promise.fail(e);
            }
        });
    }

    private Future<Void> executeStatements(List<String> statements) {
        return pool.withTransaction(conn -> {
            Future<Void> chain = Future.succeededFuture();
            for (String statement : statements) {
                chain = chain.compose(v -> {
                    logger.trace("Executing: {}...", statement.substring(0, Math.min(60, statement.length())));
                    return conn.query(statement).execute().<Void>mapEmpty();
                });
            }
            return chain;
        });
    }

    static List<String> parseSqlStatements(String content) {
        StringBuilder withoutComments = new StringBuilder();
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith("--")) {
                withoutComments.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String statement : withoutComments.toString().split(";")) {
            String trimmed = statement.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }
}
