package dev.mars.pgprojection.pg.connection;

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

import dev.mars.pgprojection.pg.config.PgConnectionConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Owns the Vert.x reactive pool shared by the PostgreSQL projection collaborators.
 *
 * <p>When no {@link Vertx} instance is supplied the manager creates its own and closes
 * it together with the pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final PgConnectionConfig config;
    private final Pool pool;

    public PgConnectionManager(PgConnectionConfig config) {
        this(Vertx.vertx(), true, config);
    }

    public PgConnectionManager(Vertx vertx, PgConnectionConfig config) {
        this(vertx, false, config);
    }

    private PgConnectionManager(Vertx vertx, boolean ownsVertx, PgConnectionConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.ownsVertx = ownsVertx;
        this.config = Objects.requireNonNull(config, "Connection config cannot be null");
        this.pool = createReactivePool(config);
    }

    public Vertx getVertx() {
        return vertx;
    }

    public Pool getPool() {
        return pool;
    }

    public PgConnectionConfig getConfig() {
        return config;
    }

    private Pool createReactivePool(PgConnectionConfig connectionConfig) {
        Objects.requireNonNull(connectionConfig.getPassword(), "password");

        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(connectionConfig.getHost())
            .setPort(connectionConfig.getPort())
            .setDatabase(connectionConfig.getDatabase())
            .setUser(connectionConfig.getUsername())
            .setPassword(connectionConfig.getPassword());

        if (connectionConfig.isSslEnabled()) {
            connectOptions.setSslMode(SslMode.REQUIRE);
        } else {
            connectOptions.setSslMode(SslMode.DISABLE);
        }

        String schema = connectionConfig.getSchema();
        if (schema != null && !schema.isBlank()) {
            connectOptions.addProperty("search_path", normalizeSearchPath(schema));
        }
        connectOptions.addProperty("application_name", "pgprojection");

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(connectionConfig.getMaxPoolSize())
            .setConnectionTimeout(30)
            .setConnectionTimeoutUnit(TimeUnit.SECONDS);

        Pool created = PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();

        logger.info("Created Vert.x reactive pool for host: {}, database: {}, schema: {}",
                   connectionConfig.getHost(), connectionConfig.getDatabase(), schema);
        return created;
    }

    /**
     * Normalizes a configured schema list. Allows letters, digits, underscore and commas.
     */
    private static String normalizeSearchPath(String schemaConfig) {
        String s = schemaConfig.trim();
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema config (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            if (sb.length() > 0) sb.append(", ");
            sb.append(p);
        }
        return sb.toString();
    }

    /**
     * Closes the pool and, when owned, the Vert.x instance.
     */
    public Future<Void> closeAsync() {
        Future<Void> closed = pool.close()
            .recover(error -> {
                logger.warn("Error closing reactive pool: {}", error.getMessage());
                return Future.succeededFuture();
            });
        if (!ownsVertx) {
            return closed;
        }
        return closed.compose(v -> vertx.close());
    }

    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
            logger.info("Closed connection manager for database {}", config.getDatabase());
        } catch (Exception e) {
            logger.error("Error closing connection manager", e);
        }
    }
}
