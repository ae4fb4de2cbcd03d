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
import dev.mars.pgprojection.api.log.EventLogReader;
import dev.mars.pgprojection.api.log.ProgressionStore;
import dev.mars.pgprojection.api.log.SequenceGenerator;
import dev.mars.pgprojection.api.log.SequenceMark;
import dev.mars.pgprojection.api.log.ShardProgress;
import dev.mars.pgprojection.core.config.DaemonSettings;
import dev.mars.pgprojection.core.metrics.ProjectionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Computes the largest contiguous, committed prefix of the global event sequence.
 *
 * <p>The detector reads the last persisted mark and the highest sequence handed out by
 * the generator, then scans committed sequence numbers in ascending pages from the last
 * mark. The scan stops at the first missing number. A gap is not an error: repeated
 * calls against a log with a permanent gap keep returning the mark just before it
 * until the gap is filled.</p>
 *
 * <p>{@link #detectInSafeZone(CancellationSignal)} additionally skips gaps whose next
 * committed event is older than {@code now - safeZone}, on the assumption that a
 * transaction that old has aborted rather than still being in flight.</p>
 *
 * <p>Detection never writes. Persisting the result belongs to {@link HighWaterAgent}.
 * Instances are driven by a single loop and are not safe for concurrent calls.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class HighWaterDetector {
    private static final Logger logger = LoggerFactory.getLogger(HighWaterDetector.class);

    private final SequenceGenerator sequenceGenerator;
    private final EventLogReader eventLogReader;
    private final Duration safeZone;
    private final int scanPageSize;
    private final Clock clock;
    private final ProjectionMetrics metrics;

    public HighWaterDetector(SequenceGenerator sequenceGenerator, EventLogReader eventLogReader,
                             DaemonSettings settings) {
        this(sequenceGenerator, eventLogReader, settings, Clock.systemUTC(), ProjectionMetrics.disabled());
    }

    public HighWaterDetector(SequenceGenerator sequenceGenerator, EventLogReader eventLogReader,
                             DaemonSettings settings, Clock clock, ProjectionMetrics metrics) {
        this.sequenceGenerator = Objects.requireNonNull(sequenceGenerator, "Sequence generator cannot be null");
        this.eventLogReader = Objects.requireNonNull(eventLogReader, "Event log reader cannot be null");
        this.safeZone = settings.getSafeZone();
        this.scanPageSize = settings.getScanPageSize();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    /**
     * Detects the high-water mark, stopping at the first gap.
     */
    public CompletableFuture<HighWaterStatistics> detect(CancellationSignal cancellation) {
        return detect(cancellation, null);
    }

    /**
     * Detects the high-water mark, skipping gaps that are older than the safe zone.
     */
    public CompletableFuture<HighWaterStatistics> detectInSafeZone(CancellationSignal cancellation) {
        return detect(cancellation, clock.instant().minus(safeZone));
    }

    private CompletableFuture<HighWaterStatistics> detect(CancellationSignal cancellation, Instant staleCutoff) {
        Instant started = clock.instant();
        return CompletableFuture.completedFuture(null)
            .thenCompose(v -> {
                cancellation.throwIfCancellationRequested();
                return eventLogReader.fetchProgress(ProgressionStore.HIGH_WATER_MARK);
            })
            .thenCompose(progress -> sequenceGenerator.highestAssigned()
                .thenCompose(highest -> {
                    long lastMark = progress.map(ShardProgress::lastSequence).orElse(0L);
                    Instant lastUpdated = progress.map(ShardProgress::lastUpdated).orElse(null);
                    // A mark can never sit above the generator, even after an external reset
                    long ceiling = Math.max(highest, lastMark);

                    return scan(cancellation, staleCutoff, lastMark, ceiling)
                        .thenApply(current -> {
                            HighWaterStatistics statistics = new HighWaterStatistics(
                                lastMark, current, ceiling, lastUpdated, clock.instant());
                            metrics.recordHighWaterDetection(current, Duration.between(started, clock.instant()));
                            logger.debug("High water detection{}: {}",
                                staleCutoff == null ? "" : " in safe zone", statistics);
                            return statistics;
                        });
                }));
    }

    private CompletableFuture<Long> scan(CancellationSignal cancellation, Instant staleCutoff,
                                         long current, long highest) {
        if (current >= highest) {
            return CompletableFuture.completedFuture(current);
        }
        cancellation.throwIfCancellationRequested();

        return eventLogReader.fetchSequenceMarks(current, highest, scanPageSize)
            .thenCompose(marks -> {
                ScanResult result = advance(marks, current, staleCutoff);
                if (result.stopped || marks.size() < scanPageSize) {
                    return CompletableFuture.completedFuture(result.mark);
                }
                return scan(cancellation, staleCutoff, result.mark, highest);
            });
    }

    private ScanResult advance(List<SequenceMark> marks, long start, Instant staleCutoff) {
        long current = start;
        for (SequenceMark mark : marks) {
            long sequence = mark.sequence();
            if (sequence == current + 1) {
                current = sequence;
                continue;
            }

            if (staleCutoff != null && mark.timestamp() != null && mark.timestamp().isBefore(staleCutoff)) {
                logger.warn("Skipping stale sequence gap ({}, {}) older than {}", current, sequence, staleCutoff);
                current = sequence;
                continue;
            }

            logger.debug("Sequence gap after {}, next committed sequence is {}", current, sequence);
            return new ScanResult(current, true);
        }
        return new ScanResult(current, false);
    }

    /**
     * Reads the persisted mark without scanning.
     */
    public CompletableFuture<Optional<ShardProgress>> fetchPersistedMark() {
        return eventLogReader.fetchProgress(ProgressionStore.HIGH_WATER_MARK);
    }

    private static final class ScanResult {
        private final long mark;
        private final boolean stopped;

        private ScanResult(long mark, boolean stopped) {
            this.mark = mark;
            this.stopped = stopped;
        }
    }
}
