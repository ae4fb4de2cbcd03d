package dev.mars.pgprojection.core.config;

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

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the async projection daemon: batch paging, aggregate caching and high-water detection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class DaemonSettings {

    private final int updateBatchSize;
    private final int cacheLimitPerTenant;
    private final int sliceParallelism;
    private final Duration safeZone;
    private final int scanPageSize;
    private final Duration pollingInterval;
    private final Duration staleThreshold;

    private DaemonSettings(Builder builder) {
        this.updateBatchSize = builder.updateBatchSize;
        this.cacheLimitPerTenant = builder.cacheLimitPerTenant;
        this.sliceParallelism = builder.sliceParallelism;
        this.safeZone = Objects.requireNonNull(builder.safeZone, "Safe zone cannot be null");
        this.scanPageSize = builder.scanPageSize;
        this.pollingInterval = Objects.requireNonNull(builder.pollingInterval, "Polling interval cannot be null");
        this.staleThreshold = Objects.requireNonNull(builder.staleThreshold, "Stale threshold cannot be null");

        if (updateBatchSize < 1) {
            throw new IllegalArgumentException("Update batch size must be at least 1");
        }
        if (cacheLimitPerTenant < 0) {
            throw new IllegalArgumentException("Cache limit cannot be negative");
        }
        if (sliceParallelism < 1) {
            throw new IllegalArgumentException("Slice parallelism must be at least 1");
        }
        if (scanPageSize < 1) {
            throw new IllegalArgumentException("Scan page size must be at least 1");
        }
    }

    public static DaemonSettings defaults() {
        return new Builder().build();
    }

    /** Maximum number of operations per page. */
    public int getUpdateBatchSize() {
        return updateBatchSize;
    }

    /** Aggregates kept per tenant by each runtime; 0 disables caching. */
    public int getCacheLimitPerTenant() {
        return cacheLimitPerTenant;
    }

    public int getSliceParallelism() {
        return sliceParallelism;
    }

    public Duration getSafeZone() {
        return safeZone;
    }

    public int getScanPageSize() {
        return scanPageSize;
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    /** How long the mark may sit still before gaps outside the safe zone are skipped. */
    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    @Override
    public String toString() {
        return "DaemonSettings{" +
                "updateBatchSize=" + updateBatchSize +
                ", cacheLimitPerTenant=" + cacheLimitPerTenant +
                ", sliceParallelism=" + sliceParallelism +
                ", safeZone=" + safeZone +
                ", scanPageSize=" + scanPageSize +
                ", pollingInterval=" + pollingInterval +
                ", staleThreshold=" + staleThreshold +
                '}';
    }

    public static class Builder {
        private int updateBatchSize = 500;
        private int cacheLimitPerTenant = 0;
        private int sliceParallelism = 4;
        private Duration safeZone = Duration.ofSeconds(3);
        private int scanPageSize = 1000;
        private Duration pollingInterval = Duration.ofSeconds(1);
        private Duration staleThreshold = Duration.ofSeconds(3);

        public Builder updateBatchSize(int updateBatchSize) {
            this.updateBatchSize = updateBatchSize;
            return this;
        }

        public Builder cacheLimitPerTenant(int cacheLimitPerTenant) {
            this.cacheLimitPerTenant = cacheLimitPerTenant;
            return this;
        }

        public Builder sliceParallelism(int sliceParallelism) {
            this.sliceParallelism = sliceParallelism;
            return this;
        }

        public Builder safeZone(Duration safeZone) {
            this.safeZone = safeZone;
            return this;
        }

        public Builder scanPageSize(int scanPageSize) {
            this.scanPageSize = scanPageSize;
            return this;
        }

        public Builder pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder staleThreshold(Duration staleThreshold) {
            this.staleThreshold = staleThreshold;
            return this;
        }

        public DaemonSettings build() {
            return new DaemonSettings(this);
        }
    }
}
