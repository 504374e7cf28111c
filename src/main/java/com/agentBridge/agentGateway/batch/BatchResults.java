package com.agentBridge.agentGateway.batch;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Entries of a job in the order they completed. Blocks on {@link #next()} for
 * entries that are still running. Finite (one element per entry) and single pass.
 */
public final class BatchResults implements Iterator<BatchEntry> {

    private final BatchJob job;
    private int position;

    BatchResults(BatchJob job) {
        this.job = job;
    }

    public String getBatchId() {
        return job.getId();
    }

    @Override
    public boolean hasNext() {
        return position < job.getEntries().size();
    }

    @Override
    public BatchEntry next() {
        if (!hasNext()) {
            throw new NoSuchElementException("All results of batch " + job.getId() + " were returned");
        }
        BatchEntry entry = job.awaitCompleted(position);
        position++;
        return entry;
    }
}
