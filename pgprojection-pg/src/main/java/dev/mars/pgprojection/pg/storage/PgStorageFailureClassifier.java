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

import dev.mars.pgprojection.api.storage.StorageFailureClassifier;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.ClosedConnectionException;

import java.net.ConnectException;

/**
 * Storage failure classification for the Vert.x PostgreSQL client. Server errors, lost
 * connections and refused connections are storage failures on top of the api defaults.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class PgStorageFailureClassifier {

    /** Lock not available, raised by {@code NOWAIT} row locks. */
    public static final String LOCK_NOT_AVAILABLE = "55P03";

    /** Statement issued in a transaction that has already failed. */
    public static final String IN_FAILED_TRANSACTION = "25P02";

    private PgStorageFailureClassifier() {
    }

    public static StorageFailureClassifier create() {
        return StorageFailureClassifier.defaults().or(PgStorageFailureClassifier::isPgFailure);
    }

    static boolean isPgFailure(Throwable failure) {
        return failure instanceof PgException
                || failure instanceof ClosedConnectionException
                || failure instanceof ConnectException;
    }

    /**
     * Whether the failure is PostgreSQL refusing a row lock that another transaction holds.
     */
    public static boolean isLockNotAvailable(Throwable failure) {
        Throwable cause = StorageFailureClassifier.unwrap(failure);
        if (!(cause instanceof PgException)) {
            return false;
        }
        String sqlState = ((PgException) cause).getSqlState();
        return LOCK_NOT_AVAILABLE.equals(sqlState) || IN_FAILED_TRANSACTION.equals(sqlState);
    }
}
