package dev.mars.pgprojection.core.metrics;

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

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the projection engine.
 *
 * Until {@link #bindTo(MeterRegistry)} is called every record method is a no-op,
 * which is how metrics are disabled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ProjectionMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionMetrics.class);

    private final String instanceId;
    private MeterRegistry registry;

    // Counters
    private Counter slicesApplied;
    private Counter aggregatesUpserted;
    private Counter aggregatesDeleted;
    private Counter applyFailures;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter operationsEnqueued;
    private Counter pagesExecuted;

    // Timers
    private Timer batchExecutionTime;
    private Timer highWaterDetectionTime;

    // Gauges
    private final AtomicLong highWaterMark = new AtomicLong(0);

    public ProjectionMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * An instance that is never bound to a registry.
     */
    public static ProjectionMetrics disabled() {
        return new ProjectionMetrics("disabled");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        slicesApplied = Counter.builder("pgprojection.slices.applied")
            .description("Total number of event slices folded into aggregates")
            .tag("instance", instanceId)
            .register(registry);

        aggregatesUpserted = Counter.builder("pgprojection.aggregates.upserted")
            .description("Total number of aggregate upserts queued")
            .tag("instance", instanceId)
            .register(registry);

        aggregatesDeleted = Counter.builder("pgprojection.aggregates.deleted")
            .description("Total number of aggregate deletions queued")
            .tag("instance", instanceId)
            .register(registry);

        applyFailures = Counter.builder("pgprojection.slices.failed")
            .description("Total number of slices whose fold failed")
            .tag("instance", instanceId)
            .register(registry);

        cacheHits = Counter.builder("pgprojection.cache.hits")
            .description("Slices served from the aggregate cache")
            .tag("instance", instanceId)
            .register(registry);

        cacheMisses = Counter.builder("pgprojection.cache.misses")
            .description("Slices that needed an aggregate load")
            .tag("instance", instanceId)
            .register(registry);

        operationsEnqueued = Counter.builder("pgprojection.operations.enqueued")
            .description("Storage operations accepted by update batches")
            .tag("instance", instanceId)
            .register(registry);

        pagesExecuted = Counter.builder("pgprojection.pages.executed")
            .description("Operation pages executed against storage")
            .tag("instance", instanceId)
            .register(registry);

        batchExecutionTime = Timer.builder("pgprojection.batch.execution.time")
            .description("Time taken to execute an update batch")
            .tag("instance", instanceId)
            .register(registry);

        highWaterDetectionTime = Timer.builder("pgprojection.highwater.detection.time")
            .description("Time taken by one high water detection")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("pgprojection.highwater.mark", highWaterMark::get)
            .description("Current high water mark")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("Projection metrics registered for instance: {}", instanceId);
    }

    public void recordSliceApplied(String projection) {
        if (slicesApplied != null) {
            slicesApplied.increment();
        }
        if (registry != null) {
            Counter.builder("pgprojection.slices.applied.by.projection")
                .tag("instance", instanceId)
                .tag("projection", projection)
                .register(registry)
                .increment();
        }
    }

    public void recordUpsert() {
        if (aggregatesUpserted != null) {
            aggregatesUpserted.increment();
        }
    }

    public void recordDeletion() {
        if (aggregatesDeleted != null) {
            aggregatesDeleted.increment();
        }
    }

    public void recordApplyFailure(String projection, String errorType) {
        if (applyFailures != null) {
            applyFailures.increment();
        }
        if (registry != null) {
            Counter.builder("pgprojection.slices.failed.by.projection")
                .tag("instance", instanceId)
                .tag("projection", projection)
                .tag("error_type", errorType)
                .register(registry)
                .increment();
        }
    }

    public void recordCacheHits(int count) {
        if (cacheHits != null && count > 0) {
            cacheHits.increment(count);
        }
    }

    public void recordCacheMisses(int count) {
        if (cacheMisses != null && count > 0) {
            cacheMisses.increment(count);
        }
    }

    public void recordOperationsEnqueued(int count) {
        if (operationsEnqueued != null && count > 0) {
            operationsEnqueued.increment(count);
        }
    }

    public void recordBatchExecuted(int pages, Duration duration) {
        if (pagesExecuted != null) {
            pagesExecuted.increment(pages);
        }
        if (batchExecutionTime != null) {
            batchExecutionTime.record(duration);
        }
    }

    public void recordHighWaterDetection(long mark, Duration duration) {
        highWaterMark.set(mark);
        if (highWaterDetectionTime != null) {
            highWaterDetectionTime.record(duration);
        }
    }

    public long getHighWaterMark() {
        return highWaterMark.get();
    }

    public String getInstanceId() {
        return instanceId;
    }
}
