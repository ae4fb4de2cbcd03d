package dev.mars.pgprojection.core.highwater;

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

import dev.mars.pgprojection.api.CancellationSignal;
import dev.mars.pgprojection.api.HighWaterStatistics;
import dev.mars.pgprojection.api.log.ProgressionStore;
import dev.mars.pgprojection.core.config.DaemonSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link HighWaterDetector} on a fixed delay and persists advancing marks.
 *
 * <p>Each tick runs a strict detection. When the mark has not moved for longer than the
 * stale threshold while sequences are still pending, the tick falls back to a safe-zone
 * detection so that a permanently missing sequence does not stall every shard forever.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class HighWaterAgent implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HighWaterAgent.class);

    private final HighWaterDetector detector;
    private final ProgressionStore progressionStore;
    private final Duration pollingInterval;
    private final Duration staleThreshold;
    private final Clock clock;
    private final List<HighWaterListener> listeners = new CopyOnWriteArrayList<>();
    private final CancellationSignal cancellation = new CancellationSignal();

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private volatile Instant lastAdvanced;
    private volatile HighWaterStatistics lastStatistics;

    public HighWaterAgent(HighWaterDetector detector, ProgressionStore progressionStore, DaemonSettings settings) {
        this(detector, progressionStore, settings, Clock.systemUTC());
    }

    public HighWaterAgent(HighWaterDetector detector, ProgressionStore progressionStore,
                          DaemonSettings settings, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "Detector cannot be null");
        this.progressionStore = Objects.requireNonNull(progressionStore, "Progression store cannot be null");
        this.pollingInterval = settings.getPollingInterval();
        this.staleThreshold = settings.getStaleThreshold();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.lastAdvanced = clock.instant();
    }

    public void addListener(HighWaterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public synchronized void start() {
        if (running) {
            logger.warn("High water agent is already running");
            return;
        }
        if (cancellation.isCancellationRequested()) {
            throw new IllegalStateException("High water agent cannot be restarted after stop");
        }

        running = true;
        lastAdvanced = clock.instant();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pgprojection-high-water");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, pollingInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("High water agent started with polling interval {}", pollingInterval);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        cancellation.cancel();
        scheduler.shutdown();

        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("High water agent stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return The statistics of the most recent detection, or null before the first one
     */
    public HighWaterStatistics getLastStatistics() {
        return lastStatistics;
    }

    private void tick() {
        try {
            checkNow().join();
        } catch (Exception e) {
            if (cancellation.isCancellationRequested()) {
                logger.debug("High water detection interrupted by shutdown");
            } else {
                logger.error("High water detection failed, retrying in {}", pollingInterval, e);
            }
        }
    }

    /**
     * Runs one detection pass, persisting and publishing the mark when it advanced.
     */
    public CompletableFuture<HighWaterStatistics> checkNow() {
        return detector.detect(cancellation)
            .thenCompose(statistics -> {
                if (statistics.hasChanged()) {
                    return persist(statistics);
                }

                Duration still = Duration.between(lastAdvanced, clock.instant());
                if (statistics.hasPendingSequences() && still.compareTo(staleThreshold) >= 0) {
                    logger.info("High water mark stuck at {} for {}, detecting in safe zone",
                        statistics.getCurrentMark(), still);
                    return detector.detectInSafeZone(cancellation)
                        .thenCompose(safe -> safe.hasChanged() ? persist(safe) : record(safe));
                }
                return record(statistics);
            });
    }

    private CompletableFuture<HighWaterStatistics> persist(HighWaterStatistics statistics) {
        return progressionStore.saveHighWaterMark(statistics.getCurrentMark())
            .thenApply(v -> {
                lastAdvanced = clock.instant();
                lastStatistics = statistics;
                logger.info("High water mark advanced from {} to {}",
                    statistics.getLastMark(), statistics.getCurrentMark());
                for (HighWaterListener listener : listeners) {
                    try {
                        listener.onMarkAdvanced(statistics);
                    } catch (RuntimeException e) {
                        logger.warn("High water listener {} failed", listener, e);
                    }
                }
                return statistics;
            });
    }

    private CompletableFuture<HighWaterStatistics> record(HighWaterStatistics statistics) {
        lastStatistics = statistics;
        return CompletableFuture.completedFuture(statistics);
    }
}
