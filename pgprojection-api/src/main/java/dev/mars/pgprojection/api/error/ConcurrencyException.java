package dev.mars.pgprojection.api.error;

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
 * An optimistic concurrency check failed: the stored version was not the expected one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ConcurrencyException extends RuntimeException {

    private final String target;
    private final Object id;
    private final Long expectedVersion;
    private final Long actualVersion;

    public ConcurrencyException(String target, Object id, Long expectedVersion, Long actualVersion) {
        super(String.format("Unexpected version for %s '%s': expected %s, actual %s",
                target, id, expectedVersion, actualVersion));
        this.target = target;
        this.id = id;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    protected ConcurrencyException(String message, String target, Object id) {
        super(message);
        this.target = target;
        this.id = id;
        this.expectedVersion = null;
        this.actualVersion = null;
    }

    public String getTarget() {
        return target;
    }

    public Object getId() {
        return id;
    }

    public Long getExpectedVersion() {
        return expectedVersion;
    }

    public Long getActualVersion() {
        return actualVersion;
    }
}
