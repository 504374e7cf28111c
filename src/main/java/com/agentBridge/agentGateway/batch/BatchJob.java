package com.agentBridge.agentGateway.batch;

import com.agentBridge.agentGateway.batch.model.BatchStatus;
import com.agentBridge.agentGateway.batch.model.EntryResult;
import com.agentBridge.agentGateway.batch.model.EntryResultType;
import com.agentBridge.agentGateway.batch.model.RequestCounts;
import com.agentBridge.agentGateway.cancellation.CanceledException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A submitted batch and its entries.
 *
 * Status moves {@code IN_PROGRESS -> ENDED} when every entry is terminal, or
 * {@code IN_PROGRESS -> CANCELED} on cancel. After cancel no entry starts;
 * entries that were never started become canceled and entries already running
 * keep the result they finish with. {@code endedAt} is set once nothing is
 * running any more.
 *
 * All state changes happen under one lock per job, which is also the
 * admission gate bounding how many entries run at once.
 */
public final class BatchJob {

    private final String id;
    private final long sequence;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final List<BatchEntry> entries;
    private final int concurrency;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition entryCompleted = lock.newCondition();
    private final List<BatchEntry> completionOrder = new ArrayList<>();

    private BatchStatus status = BatchStatus.IN_PROGRESS;
    private Instant endedAt;
    private Instant cancelInitiatedAt;
    private int running;
    private int peakRunning;
    private int nextToStart;

    BatchJob(String id, long sequence, Instant createdAt, Instant expiresAt, List<BatchEntry> entries, int concurrency) {
        this.id = id;
        this.sequence = sequence;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.concurrency = concurrency;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * @return entries in submission order
     */
    public List<BatchEntry> getEntries() {
        return entries;
    }

    public BatchStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public Instant getEndedAt() {
        lock.lock();
        try {
            return endedAt;
        } finally {
            lock.unlock();
        }
    }

    public Instant getCancelInitiatedAt() {
        lock.lock();
        try {
            return cancelInitiatedAt;
        } finally {
            lock.unlock();
        }
    }

    public int getRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return highest number of entries that were running at the same time
     */
    public int getPeakRunning() {
        lock.lock();
        try {
            return peakRunning;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True once the job is terminal and no entry is still running.
     */
    public boolean isFinished() {
        lock.lock();
        try {
            return endedAt != null;
        } finally {
            lock.unlock();
        }
    }

    public RequestCounts requestCounts() {
        RequestCounts counts = new RequestCounts();
        for (BatchEntry entry : entries) {
            EntryResultType type = entry.getResult().getType();
            switch (type) {
                case PENDING -> counts.setProcessing(counts.getProcessing() + 1);
                case SUCCEEDED -> counts.setSucceeded(counts.getSucceeded() + 1);
                case ERRORED -> counts.setErrored(counts.getErrored() + 1);
                case CANCELED -> counts.setCanceled(counts.getCanceled() + 1);
            }
        }
        return counts;
    }

    long getSequence() {
        return sequence;
    }

    /**
     * Admits the next never-started entry if the job is in progress and fewer than
     * {@code concurrency} entries are running. The admitted entry counts as running.
     *
     * @return the admitted entry, or null if nothing may start now
     */
    BatchEntry admitNext() {
        lock.lock();
        try {
            if (status != BatchStatus.IN_PROGRESS || running >= concurrency) {
                return null;
            }
            while (nextToStart < entries.size()) {
                BatchEntry entry = entries.get(nextToStart++);
                if (!entry.isTerminal() && !entry.isStarted()) {
                    entry.markStarted();
                    running++;
                    peakRunning = Math.max(peakRunning, running);
                    return entry;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the terminal result of a running entry.
     *
     * @return true if this completion finished the job
     */
    boolean complete(BatchEntry entry, EntryResult result, Instant now) {
        lock.lock();
        try {
            if (entry.isTerminal()) {
                return false;
            }
            entry.complete(result, now);
            completionOrder.add(entry);
            running--;
            boolean finished = false;
            if (status == BatchStatus.IN_PROGRESS && completionOrder.size() == entries.size()) {
                status = BatchStatus.ENDED;
                endedAt = now;
                finished = true;
            } else if (status == BatchStatus.CANCELED && running == 0 && endedAt == null) {
                endedAt = now;
                finished = true;
            }
            entryCompleted.signalAll();
            return finished;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an in-progress job to {@code CANCELED}; entries never started become canceled.
     *
     * @return number of entries canceled, or -1 if the job was already terminal
     */
    int cancel(Instant now) {
        lock.lock();
        try {
            if (status != BatchStatus.IN_PROGRESS) {
                return -1;
            }
            status = BatchStatus.CANCELED;
            cancelInitiatedAt = now;
            int canceled = 0;
            for (BatchEntry entry : entries) {
                if (!entry.isStarted() && !entry.isTerminal()) {
                    entry.complete(EntryResult.canceled(), now);
                    completionOrder.add(entry);
                    canceled++;
                }
            }
            if (running == 0) {
                endedAt = now;
            }
            entryCompleted.signalAll();
            return canceled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the entry at {@code position} in completion order exists.
     */
    BatchEntry awaitCompleted(int position) {
        lock.lock();
        try {
            while (completionOrder.size() <= position) {
                entryCompleted.await();
            }
            return completionOrder.get(position);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CanceledException("Interrupted while waiting for batch results");
        } finally {
            lock.unlock();
        }
    }
}
