package com.product.resolution.api;

import com.product.resolution.catalog.CatalogSnapshot;
import com.product.resolution.catalog.CatalogUnavailableException;
import com.product.resolution.core.model.RawCandidateRecord;
import com.product.resolution.logging.LogContext;
import com.product.resolution.matching.AmbiguousMatchWarning;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.rules.CandidateInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Resolves a batch of candidates in two phases.
 *
 * <p>Every candidate is first decided against one catalog snapshot. Deciding never writes, so it may
 * run on several threads. Decisions are then written one by one in input order through the single
 * writer, which re-reads each target so candidates that hit the same parent or key collapse into it.</p>
 *
 * <p>Candidates that fail are reported in {@link BatchResult#errors()} and the batch continues. After
 * {@link ResolutionOptions#getMaxConsecutiveFailures()} failures in a row the batch stops and the rest
 * is reported as unprocessed. A catalog failure while writing aborts the batch with
 * {@link BatchAbortedException}.</p>
 */
public class BatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final ResolutionService service;
    private final ResolutionOptions options;
    private final MetricsService metrics;

    public BatchProcessor(ResolutionService service, ResolutionOptions options, MetricsService metrics) {
        this.service = Objects.requireNonNull(service, "service is required");
        this.options = options != null ? options : ResolutionOptions.defaults();
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Resolves and writes a batch.
     *
     * @throws IllegalArgumentException    if the batch is larger than the configured maximum
     * @throws CatalogUnavailableException if the catalog cannot be read before anything is written
     * @throws BatchAbortedException       if the catalog fails while decisions are being written
     */
    public BatchResult process(List<RawCandidateRecord> candidates, RunStatistics stats) {
        Objects.requireNonNull(candidates, "candidates is required");
        Objects.requireNonNull(stats, "stats is required");
        if (candidates.size() > options.getMaxBatchSize()) {
            throw new IllegalArgumentException("Batch size " + candidates.size()
                    + " exceeds the limit of " + options.getMaxBatchSize() + ". Split the input.");
        }

        String batchId = LogContext.generateCorrelationId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            metrics.recordBatchSize(candidates.size());
            log.info("batch.started size={} parallelism={}", candidates.size(), options.getParallelism());

            CatalogSnapshot snapshot = service.snapshot();
            List<Decided> decided = decideAll(candidates, snapshot, batchId);
            Progress progress = new Progress(batchId, candidates.size(), start);
            writeAll(candidates, decided, stats, progress);

            BatchResult result = progress.result(false, 0);
            metrics.recordBatchDuration(result.duration(), result.stoppedEarly());
            log.info("batch.completed {}", result);
            return result;
        }
    }

    private List<Decided> decideAll(List<RawCandidateRecord> candidates, CatalogSnapshot snapshot, String batchId) {
        if (options.getParallelism() <= 1 || candidates.size() <= 1) {
            List<Decided> decided = new ArrayList<>(candidates.size());
            int failuresInRow = 0;
            for (int i = 0; i < candidates.size(); i++) {
                Decided d = decideOne(i, candidates.get(i), snapshot, batchId);
                decided.add(d);
                failuresInRow = d.isFailure() ? failuresInRow + 1 : 0;
                if (limitReached(failuresInRow)) {
                    break;
                }
            }
            return decided;
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(options.getParallelism(), candidates.size()));
        try {
            List<CompletableFuture<Decided>> futures = new ArrayList<>(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                int index = i;
                futures.add(CompletableFuture.supplyAsync(
                        () -> decideOne(index, candidates.get(index), snapshot, batchId), executor));
            }
            List<Decided> decided = new ArrayList<>(futures.size());
            for (CompletableFuture<Decided> future : futures) {
                decided.add(join(future));
            }
            return decided;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private Decided decideOne(int index, RawCandidateRecord raw, CatalogSnapshot snapshot, String batchId) {
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            return Decided.ok(service.decide(index, raw, snapshot));
        } catch (CandidateInputException e) {
            log.warn("candidate.rejected index={} field={} reason={}", index, e.getField(), e.getMessage());
            return Decided.failed(new CandidateError(index, raw.getBrand(), raw.getProductName(),
                    e.getField(), e.getMessage()));
        }
    }

    private static Decided join(CompletableFuture<Decided> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void writeAll(List<RawCandidateRecord> candidates, List<Decided> decided,
                          RunStatistics stats, Progress progress) {
        int failuresInRow = 0;
        for (int i = 0; i < decided.size(); i++) {
            Decided d = decided.get(i);
            stats.incrementProductsProcessed();
            if (d.isFailure()) {
                stats.incrementErrors();
                progress.errors.add(d.error());
                failuresInRow++;
                if (limitReached(failuresInRow)) {
                    progress.stop(candidates.size() - (i + 1));
                    log.warn("batch.stopped consecutiveFailures={} unprocessed={}",
                            failuresInRow, progress.unprocessed);
                    return;
                }
                continue;
            }
            failuresInRow = 0;
            ResolutionOutcome outcome = d.outcome();
            try (LogContext ctx = LogContext.forApply(progress.batchId, outcome.candidateKey())) {
                progress.record(service.apply(outcome, stats));
            } catch (RuntimeException e) {
                stats.incrementErrors();
                BatchResult partial = progress.result(true, candidates.size() - i);
                metrics.recordBatchDuration(partial.duration(), true);
                log.error("batch.aborted index={} key={} reason={}", i, outcome.candidateKey(), e.getMessage());
                throw new BatchAbortedException("Batch " + progress.batchId + " aborted at candidate " + i
                        + ": " + e.getMessage(), e, partial);
            }
        }
    }

    private boolean limitReached(int failuresInRow) {
        int max = options.getMaxConsecutiveFailures();
        return max > 0 && failuresInRow >= max;
    }

    private record Decided(ResolutionOutcome outcome, CandidateError error) {
        static Decided ok(ResolutionOutcome outcome) {
            return new Decided(outcome, null);
        }

        static Decided failed(CandidateError error) {
            return new Decided(null, error);
        }

        boolean isFailure() {
            return error != null;
        }
    }

    private static final class Progress {
        private final String batchId;
        private final int total;
        private final long startNanos;
        private final List<ResolutionOutcome> outcomes = new ArrayList<>();
        private final List<CandidateError> errors = new ArrayList<>();
        private final List<AmbiguousMatchWarning> warnings = new ArrayList<>();
        private int duplicatesPrevented;
        private boolean stoppedEarly;
        private int unprocessed;

        private Progress(String batchId, int total, long startNanos) {
            this.batchId = batchId;
            this.total = total;
            this.startNanos = startNanos;
        }

        private void record(ResolutionOutcome outcome) {
            outcomes.add(outcome);
            outcome.ambiguity().ifPresent(warnings::add);
            if (outcome.change().duplicatePrevented()) {
                duplicatesPrevented++;
            }
        }

        private void stop(int remaining) {
            stoppedEarly = true;
            unprocessed = remaining;
        }

        private BatchResult result(boolean forceStopped, int remaining) {
            return new BatchResult(batchId, total, outcomes, errors, warnings, duplicatesPrevented,
                    stoppedEarly || forceStopped, unprocessed + remaining,
                    Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }
}
