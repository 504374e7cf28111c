package com.agentBridge.agentGateway.batch;

import com.agentBridge.agentGateway.audit.AuditRecord;
import com.agentBridge.agentGateway.audit.LogSink;
import com.agentBridge.agentGateway.batch.exception.BatchNotFoundException;
import com.agentBridge.agentGateway.batch.exception.InvalidBatchException;
import com.agentBridge.agentGateway.batch.model.BatchEngineStats;
import com.agentBridge.agentGateway.batch.model.BatchRequestItem;
import com.agentBridge.agentGateway.batch.model.BatchStatus;
import com.agentBridge.agentGateway.batch.model.EntryResult;
import com.agentBridge.agentGateway.batch.model.EntryResultType;
import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.context.RequestContextHolder;
import com.agentBridge.agentGateway.gateway.dto.MessagesResponse;
import com.agentBridge.agentGateway.gateway.exception.ApiError;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs message batches in the background.
 *
 * Responsibilities:
 * - Validate and register submitted jobs, returning right away
 * - Run each job's entries with at most {@code concurrency} in flight, isolating failures per entry
 * - Cancel cooperatively: running entries finish, nothing new starts
 * - Keep jobs until their {@code expiresAt}, then purge them
 *
 * Entry work is admitted by the job itself (see {@link BatchJob#admitNext()}),
 * so worker threads never block waiting for a slot. Each admitted entry then
 * acquires its session inside the {@link MessageProcessor}, slot first and
 * session second.
 */
@Slf4j
public class BatchProcessingEngine {

    static final String ID_PREFIX = "msgbatch_";
    static final int MAX_CUSTOM_ID_LENGTH = 64;
    private static final String BATCH_PATH = "/v1/messages/batches";

    private final MessageProcessor processor;
    private final ExecutorService workers;
    private final LogSink logSink;
    private final BatchSettings settings;
    private final Clock clock;

    private final Cache<String, BatchJob> jobs;
    private final AtomicLong sequence = new AtomicLong();

    private volatile boolean stopped;
    private ScheduledExecutorService sweeper;

    public BatchProcessingEngine(MessageProcessor processor, ExecutorService workers, LogSink logSink,
                                 BatchSettings settings) {
        this(processor, workers, logSink, settings, Clock.systemUTC());
    }

    public BatchProcessingEngine(MessageProcessor processor, ExecutorService workers, LogSink logSink,
                                 BatchSettings settings, Clock clock) {
        if (settings.getConcurrency() < 1) {
            throw new IllegalArgumentException("Batch concurrency must be at least 1");
        }
        this.processor = processor;
        this.workers = workers;
        this.logSink = logSink;
        this.settings = settings;
        this.clock = clock;
        this.jobs = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new RetentionExpiry(clock))
                .removalListener((String id, BatchJob job, RemovalCause cause) ->
                        log.debug("Batch job removed - batchId: {}, cause: {}", id, cause))
                .build();
    }

    /**
     * Starts the retention sweeper.
     */
    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("batch-sweeper-");
        threadFactory.setDaemon(true);
        sweeper = Executors.newSingleThreadScheduledExecutor(threadFactory);
        long intervalMillis = settings.getSweepInterval().toMillis();
        sweeper.scheduleWithFixedDelay(this::sweepSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Batch engine started - concurrency: {}, maxBatchSize: {}, retention: {}",
                settings.getConcurrency(), settings.getMaxBatchSize(), settings.getRetention());
    }

    /**
     * Cancels in-progress jobs, stops the sweeper and shuts the worker pool down.
     */
    public void stop() {
        stopped = true;
        int canceled = 0;
        for (BatchJob job : jobs.asMap().values()) {
            if (job.cancel(clock.instant()) >= 0) {
                canceled++;
            }
        }
        synchronized (this) {
            if (sweeper != null) {
                sweeper.shutdownNow();
                sweeper = null;
            }
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Batch engine stopped - canceledJobs: {}", canceled);
    }

    /**
     * Registers a job and schedules its entries.
     *
     * @return the job in {@code IN_PROGRESS}; entries run in the background
     * @throws InvalidBatchException if the entries are empty, too many, or carry bad custom ids
     */
    public BatchJob submit(List<BatchRequestItem> items) {
        if (stopped) {
            throw new IllegalStateException("Batch engine is stopped");
        }
        validate(items);

        Instant now = clock.instant();
        List<BatchEntry> entries = new ArrayList<>(items.size());
        for (BatchRequestItem item : items) {
            entries.add(new BatchEntry(item.getCustomId(), item.getParams()));
        }
        BatchJob job = new BatchJob(generateBatchId(), sequence.incrementAndGet(), now,
                now.plus(settings.getRetention()), entries, settings.getConcurrency());
        jobs.put(job.getId(), job);
        log.info("Batch submitted - batchId: {}, entries: {}, expiresAt: {}", job.getId(), entries.size(), job.getExpiresAt());

        dispatch(job);
        return job;
    }

    /**
     * @throws BatchNotFoundException if the id is unknown or purged
     */
    public BatchJob status(String batchId) {
        BatchJob job = batchId == null ? null : jobs.getIfPresent(batchId);
        if (job == null) {
            throw new BatchNotFoundException(batchId);
        }
        return job;
    }

    /**
     * Cancels an in-progress job. Terminal jobs are returned unchanged.
     */
    public BatchJob cancel(String batchId) {
        BatchJob job = status(batchId);
        int canceled = job.cancel(clock.instant());
        if (canceled >= 0) {
            log.info("Batch canceled - batchId: {}, canceledEntries: {}, stillRunning: {}",
                    batchId, canceled, job.getRunning());
        } else {
            log.debug("Cancel ignored for terminal batch - batchId: {}, status: {}", batchId, job.getStatus());
        }
        return job;
    }

    /**
     * Entries in completion order. The returned cursor is single pass; call again
     * for a fresh one.
     */
    public BatchResults results(String batchId) {
        return new BatchResults(status(batchId));
    }

    /**
     * Lists jobs newest first.
     *
     * @param afterId only jobs older than this one
     * @param beforeId only jobs newer than this one
     */
    public BatchPage list(int limit, String afterId, String beforeId) {
        if (limit < 1) {
            throw new InvalidBatchException("limit must be at least 1");
        }
        List<BatchJob> sorted = new ArrayList<>(jobs.asMap().values());
        sorted.sort(Comparator.comparingLong(BatchJob::getSequence).reversed());

        if (afterId != null) {
            int cursor = indexOf(sorted, afterId);
            if (cursor >= 0) {
                sorted = sorted.subList(cursor + 1, sorted.size());
            }
        }
        if (beforeId != null) {
            int cursor = indexOf(sorted, beforeId);
            if (cursor >= 0) {
                sorted = sorted.subList(0, cursor);
            }
        }
        boolean hasMore = sorted.size() > limit;
        return new BatchPage(List.copyOf(sorted.subList(0, Math.min(limit, sorted.size()))), hasMore);
    }

    /**
     * Deletes a terminal job.
     *
     * @throws InvalidBatchException if the job is still in progress
     */
    public void delete(String batchId) {
        BatchJob job = status(batchId);
        if (job.getStatus() == BatchStatus.IN_PROGRESS) {
            throw new InvalidBatchException("Batch " + batchId + " is still in progress; cancel it before deleting");
        }
        jobs.invalidate(batchId);
        log.info("Batch deleted - batchId: {}", batchId);
    }

    public BatchEngineStats stats() {
        long total = 0;
        long inProgress = 0;
        long running = 0;
        for (BatchJob job : jobs.asMap().values()) {
            total++;
            if (job.getStatus() == BatchStatus.IN_PROGRESS) {
                inProgress++;
            }
            running += job.getRunning();
        }
        return BatchEngineStats.builder()
                .totalBatches(total)
                .inProgress(inProgress)
                .runningEntries(running)
                .concurrency(settings.getConcurrency())
                .build();
    }

    /**
     * Purges expired jobs now instead of waiting for the sweeper.
     */
    public void sweep() {
        jobs.cleanUp();
    }

    static String generateBatchId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    private void validate(List<BatchRequestItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidBatchException("requests must contain at least one entry");
        }
        if (items.size() > settings.getMaxBatchSize()) {
            throw new InvalidBatchException("requests must contain at most " + settings.getMaxBatchSize() + " entries");
        }
        Set<String> seen = new HashSet<>();
        for (BatchRequestItem item : items) {
            String customId = item.getCustomId();
            if (customId == null || customId.isEmpty() || customId.length() > MAX_CUSTOM_ID_LENGTH) {
                throw new InvalidBatchException("custom_id must be 1 to " + MAX_CUSTOM_ID_LENGTH + " characters");
            }
            if (!seen.add(customId)) {
                throw new InvalidBatchException("Duplicate custom_id: " + customId);
            }
            if (item.getParams() == null) {
                throw new InvalidBatchException("params is required for custom_id " + customId);
            }
        }
    }

    private void dispatch(BatchJob job) {
        BatchEntry entry;
        while ((entry = job.admitNext()) != null) {
            BatchEntry admitted = entry;
            try {
                workers.execute(() -> runEntry(job, admitted));
            } catch (RejectedExecutionException e) {
                log.warn("Batch entry rejected by worker pool - batchId: {}, customId: {}", job.getId(), admitted.getCustomId());
                finish(job, admitted, EntryResult.errored(ApiError.INTERNAL.getType(), "Batch engine is shutting down"), null);
            }
        }
    }

    private void runEntry(BatchJob job, BatchEntry entry) {
        if (job.getStatus() != BatchStatus.IN_PROGRESS) {
            // admitted before the cancel but not yet running: never reaches the backend
            finish(job, entry, EntryResult.canceled(), null);
            return;
        }
        RequestContext context = RequestContext.builder()
                .path(BATCH_PATH)
                .method("POST")
                .model(entry.getParams().getModel())
                .build();
        try (RequestContextHolder.Scope ignored = RequestContextHolder.bind(context)) {
            EntryResult result = null;
            try {
                CancellationToken cancellation = CancellationToken.withDeadline(settings.getEntryTimeout());
                MessagesResponse response = processor.process(entry.getParams(), context, cancellation);
                result = EntryResult.succeeded(response);
            } catch (RuntimeException e) {
                context.recordError(e);
                ApiError error = ApiError.of(e);
                log.warn("Batch entry failed - batchId: {}, customId: {}, errorType: {}, error: {}",
                        job.getId(), entry.getCustomId(), error.getType(), e.getMessage());
                result = EntryResult.errored(error.getType(), e.getMessage());
            } finally {
                if (result == null) {
                    log.error("Batch entry aborted - batchId: {}, customId: {}", job.getId(), entry.getCustomId());
                    context.recordError("Batch entry aborted");
                    result = EntryResult.errored(ApiError.INTERNAL.getType(), "Batch entry aborted");
                }
                finish(job, entry, result, context);
            }
        } finally {
            dispatch(job);
        }
    }

    private void finish(BatchJob job, BatchEntry entry, EntryResult result, RequestContext context) {
        boolean jobFinished = job.complete(entry, result, clock.instant());
        if (context != null) {
            recordEntry(job, entry, result, context);
        }
        if (jobFinished) {
            log.info("Batch finished - batchId: {}, status: {}, counts: {}, peakRunning: {}",
                    job.getId(), job.getStatus().getValue(), job.requestCounts(), job.getPeakRunning());
        }
    }

    private void recordEntry(BatchJob job, BatchEntry entry, EntryResult result, RequestContext context) {
        try {
            logSink.record(AuditRecord.builder(AuditRecord.BATCH_ENTRY_COMPLETED)
                    .outcome(result.getType() == EntryResultType.SUCCEEDED ? AuditRecord.Outcome.SUCCESS : AuditRecord.Outcome.FAILURE)
                    .field("batch_id", job.getId())
                    .field("custom_id", entry.getCustomId())
                    .field("request_id", context.getRequestId())
                    .field("session_id", context.getSessionId())
                    .field("model", context.getModel())
                    .field("result", result.getType().getValue())
                    .field("duration_ms", context.getDurationMillis())
                    .field("tokens_in", context.getTokensIn())
                    .field("tokens_out", context.getTokensOut())
                    .field("error_type", result.getErrorType())
                    .field("error", result.getErrorMessage())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Log sink failed to record batch entry - batchId: {}, customId: {}", job.getId(), entry.getCustomId(), e);
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Batch retention sweep failed", e);
        }
    }

    private static int indexOf(List<BatchJob> jobs, String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Each job lives until its own {@code expiresAt}; reads and updates do not extend it.
     */
    private static final class RetentionExpiry implements Expiry<String, BatchJob> {

        private final Clock clock;

        RetentionExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, BatchJob job, long currentTime) {
            return Math.max(0, Duration.between(clock.instant(), job.getExpiresAt()).toNanos());
        }

        @Override
        public long expireAfterUpdate(String key, BatchJob job, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, BatchJob job, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
