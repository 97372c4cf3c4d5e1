package com.skmarket.crawler.core;

import java.time.Duration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Sole writer of the {@link DedupStore}. Drains the channel on one thread, one batch at a time in
 * arrival order, and lets the checkpoint policy persist the store as pages accumulate.
 * Merging is idempotent, so batches may arrive in any order and more than once.
 */
@Slf4j
public class Aggregator {
    private final ResultChannel channel;
    @Getter private final DedupStore store;
    private final CheckpointPolicy checkpoints;
    private final Duration pollTimeout;
    @Getter private int pagesIngested;
    @Getter private int recordsReceived;
    @Getter private int recordsAdded;
    private boolean flushed;

    public Aggregator(ResultChannel channel, DedupStore store, CheckpointPolicy checkpoints, Duration pollTimeout) {
        this.channel = channel;
        this.store = store;
        this.checkpoints = checkpoints;
        this.pollTimeout = pollTimeout;
    }

    /**
     * Consumes batches until every producer has finished and the channel is empty.
     */
    public void run() throws InterruptedException {
        while (!channel.isDrained()) {
            PageBatch batch = channel.poll(pollTimeout);
            if (batch != null) {
                ingest(batch);
            }
        }
        log.info("All workers finished; {} page(s) ingested, {} new sale(s)", pagesIngested, recordsAdded);
    }

    public void ingest(PageBatch batch) {
        int added = store.ingest(batch);
        pagesIngested++;
        recordsReceived += batch.size();
        recordsAdded += added;
        log.info("Received page {} from worker {}: {} record(s), {} new (total pages: {})",
            batch.getPageNumber(), batch.getWorkerId(), batch.size(), added, pagesIngested);
        checkpoints.onPageIngested(batch, store);
    }

    public boolean checkpoint() {
        return checkpoints.checkpoint(store);
    }

    /**
     * Persists whatever has been ingested. Runs once per aggregator; later calls are no-ops.
     */
    public boolean finalFlush() {
        if (flushed) {
            return true;
        }
        flushed = true;
        return checkpoints.finalFlush(store);
    }

    public int getCheckpointsWritten() {
        return checkpoints.getCheckpointsWritten();
    }

    public int getCheckpointFailures() {
        return checkpoints.getFailures();
    }
}
