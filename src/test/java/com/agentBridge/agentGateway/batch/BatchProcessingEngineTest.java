package com.agentBridge.agentGateway.batch;

import com.agentBridge.agentGateway.audit.AuditRecord;
import com.agentBridge.agentGateway.backend.exception.BackendUnavailableException;
import com.agentBridge.agentGateway.batch.exception.BatchNotFoundException;
import com.agentBridge.agentGateway.batch.exception.InvalidBatchException;
import com.agentBridge.agentGateway.batch.model.BatchRequestItem;
import com.agentBridge.agentGateway.batch.model.BatchStatus;
import com.agentBridge.agentGateway.batch.model.EntryResult;
import com.agentBridge.agentGateway.batch.model.EntryResultType;
import com.agentBridge.agentGateway.batch.model.RequestCounts;
import com.agentBridge.agentGateway.context.RequestContextHolder;
import com.agentBridge.agentGateway.gateway.dto.ContentBlock;
import com.agentBridge.agentGateway.gateway.dto.MessageParam;
import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;
import com.agentBridge.agentGateway.gateway.dto.MessagesResponse;
import com.agentBridge.agentGateway.gateway.dto.Usage;
import com.agentBridge.agentGateway.support.ManualExecutor;
import com.agentBridge.agentGateway.support.MutableClock;
import com.agentBridge.agentGateway.support.RecordingLogSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchProcessingEngineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final RecordingLogSink sink = new RecordingLogSink();
    private final List<BatchProcessingEngine> engines = new ArrayList<>();

    @AfterEach
    void stopEngines() {
        engines.forEach(BatchProcessingEngine::stop);
    }

    /**
     * Drains a results cursor on another thread; returns once every entry has completed.
     */
    private static List<String> awaitAllResults(BatchProcessingEngine engine, String batchId) throws Exception {
        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            return reader.submit(() -> customIdsInCompletionOrder(engine.results(batchId))).get(10, TimeUnit.SECONDS);
        } finally {
            reader.shutdownNow();
        }
    }

    private BatchProcessingEngine engine(MessageProcessor processor, ExecutorService workers, int concurrency) {
        BatchSettings settings = BatchSettings.builder()
                .concurrency(concurrency)
                .maxBatchSize(10)
                .retention(Duration.ofDays(29))
                .sweepInterval(Duration.ofHours(1))
                .entryTimeout(Duration.ofSeconds(30))
                .build();
        BatchProcessingEngine engine = new BatchProcessingEngine(processor, workers, sink, settings, clock);
        engines.add(engine);
        return engine;
    }

    private static MessagesResponse reply(MessagesRequest request) {
        return MessagesResponse.builder()
                .id("msg_" + request.getMessages().get(0).getContent())
                .content(List.of(ContentBlock.text("done: " + request.getMessages().get(0).getContent())))
                .model(request.getModel())
                .stopReason("end_turn")
                .usage(new Usage(1, 1))
                .build();
    }

    private static List<BatchRequestItem> items(String... customIds) {
        List<BatchRequestItem> items = new ArrayList<>();
        for (String customId : customIds) {
            MessagesRequest params = MessagesRequest.builder()
                    .model("test-model")
                    .messages(List.of(new MessageParam("user", customId)))
                    .build();
            items.add(new BatchRequestItem(customId, params));
        }
        return items;
    }

    private static List<String> customIdsInCompletionOrder(BatchResults results) {
        List<String> ids = new ArrayList<>();
        while (results.hasNext()) {
            ids.add(results.next().getCustomId());
        }
        return ids;
    }

    @Test
    void allEntriesFinishWithoutExceedingConcurrency() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        MessageProcessor processor = (request, context, cancellation) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return reply(request);
        };
        BatchProcessingEngine engine = engine(processor, Executors.newCachedThreadPool(), 2);

        BatchJob job = engine.submit(items("e1", "e2", "e3", "e4", "e5"));
        assertThat(job.getId()).startsWith("msgbatch_").hasSize("msgbatch_".length() + 24);

        List<String> completed = awaitAllResults(engine, job.getId());

        assertThat(job.isFinished()).isTrue();
        assertThat(job.getStatus()).isEqualTo(BatchStatus.ENDED);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(job.getPeakRunning()).isBetween(1, 2);
        RequestCounts counts = job.requestCounts();
        assertThat(counts.getSucceeded()).isEqualTo(5);
        assertThat(counts.getProcessing()).isZero();
        assertThat(job.getEntries()).allMatch(entry -> entry.getResult().getType() == EntryResultType.SUCCEEDED);
        assertThat(completed).containsExactlyInAnyOrder("e1", "e2", "e3", "e4", "e5");
        assertThat(job.getEndedAt()).isNotNull();
    }

    @Test
    void failingEntryDoesNotAffectSiblings() {
        MessageProcessor processor = (request, context, cancellation) -> {
            if ("bad".equals(request.getMessages().get(0).getContent())) {
                throw new BackendUnavailableException("backend unreachable");
            }
            return reply(request);
        };
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine(processor, workers, 3);

        BatchJob job = engine.submit(items("ok-1", "bad", "ok-2"));
        workers.runAll();

        assertThat(job.getStatus()).isEqualTo(BatchStatus.ENDED);
        BatchEntry bad = job.getEntries().get(1);
        assertThat(bad.getResult().getType()).isEqualTo(EntryResultType.ERRORED);
        assertThat(bad.getResult().getErrorType()).isEqualTo("api_error");
        assertThat(bad.getResult().getErrorMessage()).isEqualTo("backend unreachable");
        assertThat(job.getEntries().get(0).getResult().getMessage().getContent().get(0).getText()).isEqualTo("done: ok-1");
        assertThat(job.requestCounts().getSucceeded()).isEqualTo(2);
        assertThat(job.requestCounts().getErrored()).isEqualTo(1);
    }

    @Test
    void entryAbortedByAnErrorStillFinishesTheJob() {
        MessageProcessor processor = (request, context, cancellation) -> {
            if ("boom".equals(request.getMessages().get(0).getContent())) {
                throw new StackOverflowError("deep");
            }
            return reply(request);
        };
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine(processor, workers, 1);

        BatchJob job = engine.submit(items("boom", "after"));
        assertThatThrownBy(workers::runNext).isInstanceOf(StackOverflowError.class);
        workers.runAll();

        assertThat(job.getStatus()).isEqualTo(BatchStatus.ENDED);
        assertThat(job.isFinished()).isTrue();
        EntryResult aborted = job.getEntries().get(0).getResult();
        assertThat(aborted.getType()).isEqualTo(EntryResultType.ERRORED);
        assertThat(aborted.getErrorType()).isEqualTo("api_error");
        assertThat(aborted.getErrorMessage()).isEqualTo("Batch entry aborted");
        assertThat(job.getEntries().get(1).getResult().getType()).isEqualTo(EntryResultType.SUCCEEDED);
        assertThat(customIdsInCompletionOrder(engine.results(job.getId()))).containsExactly("boom", "after");
    }

    @Test
    void cancelAfterFirstEntryKeepsItsResultAndCancelsTheRest() {
        ManualExecutor workers = new ManualExecutor();
        AtomicInteger processed = new AtomicInteger();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> {
            processed.incrementAndGet();
            return reply(request);
        }, workers, 1);
        BatchJob job = engine.submit(items("e1", "e2", "e3", "e4", "e5"));

        workers.runNext();
        engine.cancel(job.getId());
        workers.runAll();

        assertThat(processed.get()).isEqualTo(1);
        assertThat(job.getStatus()).isEqualTo(BatchStatus.CANCELED);
        assertThat(job.isFinished()).isTrue();
        assertThat(job.getCancelInitiatedAt()).isEqualTo(clock.instant());
        assertThat(job.getEntries().get(0).getResult().getType()).isEqualTo(EntryResultType.SUCCEEDED);
        assertThat(job.getEntries().subList(1, 5))
                .allMatch(entry -> entry.getResult().getType() == EntryResultType.CANCELED);
        assertThat(job.getEntries()).noneMatch(entry -> entry.getResult().getType() == EntryResultType.PENDING);
        assertThat(customIdsInCompletionOrder(engine.results(job.getId()))).first().isEqualTo("e1");
    }

    @Test
    void runningEntriesFinishWithRealResultsAfterCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        BatchProcessingEngine engine = engine((request, context, cancellation) -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return reply(request);
        }, Executors.newCachedThreadPool(), 2);

        BatchJob job = engine.submit(items("e1", "e2", "e3", "e4", "e5"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        engine.cancel(job.getId());
        assertThat(job.getStatus()).isEqualTo(BatchStatus.CANCELED);
        assertThat(job.isFinished()).isFalse();
        assertThat(job.requestCounts().getCanceled()).isEqualTo(3);

        release.countDown();
        awaitAllResults(engine, job.getId());

        assertThat(job.isFinished()).isTrue();
        RequestCounts counts = job.requestCounts();
        assertThat(counts.getSucceeded()).isEqualTo(2);
        assertThat(counts.getCanceled()).isEqualTo(3);
        assertThat(counts.getProcessing()).isZero();
        assertThat(job.getStatus()).isEqualTo(BatchStatus.CANCELED);
    }

    @Test
    void resultsFollowCompletionOrderAndBlockForRunningEntries() throws Exception {
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), workers, 3);
        BatchJob job = engine.submit(items("a", "b", "c"));
        BatchResults results = engine.results(job.getId());

        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            Future<List<String>> order = reader.submit(() -> customIdsInCompletionOrder(results));
            Thread.sleep(50);
            assertThat(order).isNotDone();

            workers.runAt(2);
            workers.runAt(1);
            workers.runAt(0);

            assertThat(order.get(5, TimeUnit.SECONDS)).containsExactly("c", "b", "a");
        } finally {
            reader.shutdownNow();
        }
    }

    @Test
    void resultsCursorIsSinglePass() {
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), workers, 2);
        BatchJob job = engine.submit(items("a", "b"));
        workers.runAll();

        BatchResults results = engine.results(job.getId());
        assertThat(customIdsInCompletionOrder(results)).containsExactly("a", "b");
        assertThat(results.hasNext()).isFalse();
        assertThatThrownBy(results::next).isInstanceOf(NoSuchElementException.class);

        assertThat(customIdsInCompletionOrder(engine.results(job.getId()))).containsExactly("a", "b");
    }

    @Test
    void entriesRunWithTheirOwnBoundContext() {
        List<String> paths = new ArrayList<>();
        List<String> requestIds = new ArrayList<>();
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> {
            paths.add(RequestContextHolder.current().getPath());
            requestIds.add(context.getRequestId());
            return reply(request);
        }, workers, 2);

        BatchJob job = engine.submit(items("a", "b"));
        workers.runAll();

        assertThat(paths).containsOnly("/v1/messages/batches");
        assertThat(requestIds).doesNotHaveDuplicates().allMatch(id -> id.startsWith("req_"));
        List<AuditRecord> records = sink.records(AuditRecord.BATCH_ENTRY_COMPLETED);
        assertThat(records).extracting(record -> record.get("custom_id")).containsExactly("a", "b");
        assertThat(records).allMatch(record -> job.getId().equals(record.get("batch_id")));
        assertThat(records).allMatch(record -> "succeeded".equals(record.get("result")));
    }

    @Test
    void submissionIsValidated() {
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), new ManualExecutor(), 2);

        assertThatThrownBy(() -> engine.submit(List.of())).isInstanceOf(InvalidBatchException.class);
        assertThatThrownBy(() -> engine.submit(items("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k")))
                .isInstanceOf(InvalidBatchException.class)
                .hasMessageContaining("at most 10");
        assertThatThrownBy(() -> engine.submit(items("dup", "dup")))
                .isInstanceOf(InvalidBatchException.class)
                .hasMessageContaining("Duplicate custom_id");
        assertThatThrownBy(() -> engine.submit(items("x".repeat(65))))
                .isInstanceOf(InvalidBatchException.class);
        assertThat(engine.stats().getTotalBatches()).isZero();
    }

    @Test
    void jobsArePurgedAfterRetention() {
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), workers, 1);
        BatchJob job = engine.submit(items("a"));
        workers.runAll();
        assertThat(job.getExpiresAt()).isEqualTo(Instant.parse("2025-01-30T00:00:00Z"));

        clock.advance(Duration.ofDays(28));
        assertThat(engine.status(job.getId()).getStatus()).isEqualTo(BatchStatus.ENDED);

        clock.advance(Duration.ofDays(1).plusSeconds(1));
        engine.sweep();

        assertThatThrownBy(() -> engine.status(job.getId())).isInstanceOf(BatchNotFoundException.class);
        assertThatThrownBy(() -> engine.results(job.getId())).isInstanceOf(BatchNotFoundException.class);
        assertThat(engine.list(10, null, null).data()).isEmpty();
    }

    @Test
    void unknownBatchIsNotFound() {
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), new ManualExecutor(), 1);

        assertThatThrownBy(() -> engine.status("msgbatch_missing"))
                .isInstanceOf(BatchNotFoundException.class)
                .hasMessageContaining("msgbatch_missing");
        assertThatThrownBy(() -> engine.cancel("msgbatch_missing")).isInstanceOf(BatchNotFoundException.class);
    }

    @Test
    void listPagesNewestFirst() {
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), new ManualExecutor(), 1);
        BatchJob first = engine.submit(items("a"));
        BatchJob second = engine.submit(items("a"));
        BatchJob third = engine.submit(items("a"));

        BatchPage page = engine.list(2, null, null);
        assertThat(page.data()).extracting(BatchJob::getId).containsExactly(third.getId(), second.getId());
        assertThat(page.hasMore()).isTrue();
        assertThat(page.firstId()).isEqualTo(third.getId());
        assertThat(page.lastId()).isEqualTo(second.getId());

        BatchPage next = engine.list(2, page.lastId(), null);
        assertThat(next.data()).extracting(BatchJob::getId).containsExactly(first.getId());
        assertThat(next.hasMore()).isFalse();

        BatchPage newer = engine.list(10, null, first.getId());
        assertThat(newer.data()).extracting(BatchJob::getId).containsExactly(third.getId(), second.getId());
    }

    @Test
    void onlyTerminalJobsCanBeDeleted() {
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), workers, 1);
        BatchJob job = engine.submit(items("a", "b"));

        assertThatThrownBy(() -> engine.delete(job.getId()))
                .isInstanceOf(InvalidBatchException.class)
                .hasMessageContaining("in progress");

        workers.runAll();
        engine.delete(job.getId());

        assertThatThrownBy(() -> engine.status(job.getId())).isInstanceOf(BatchNotFoundException.class);
    }

    @Test
    void cancelOfEndedJobChangesNothing() {
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), workers, 1);
        BatchJob job = engine.submit(items("a"));
        workers.runAll();

        engine.cancel(job.getId());

        assertThat(job.getStatus()).isEqualTo(BatchStatus.ENDED);
        assertThat(job.getCancelInitiatedAt()).isNull();
        assertThat(job.getEntries().get(0).getResult().getType()).isEqualTo(EntryResultType.SUCCEEDED);
    }

    @Test
    void stopCancelsJobsInProgress() {
        ManualExecutor workers = new ManualExecutor();
        BatchProcessingEngine engine = engine((request, context, cancellation) -> reply(request), workers, 1);
        BatchJob job = engine.submit(items("a", "b"));

        engine.stop();

        assertThat(job.getStatus()).isEqualTo(BatchStatus.CANCELED);
        assertThatThrownBy(() -> engine.submit(items("c"))).isInstanceOf(IllegalStateException.class);
    }
}
