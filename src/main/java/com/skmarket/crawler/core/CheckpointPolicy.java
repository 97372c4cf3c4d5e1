package com.skmarket.crawler.core;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists the store every {@code everyPages} ingested pages and once more at the end of the run.
 * A failed write is logged and counted; the previous database file stays as it was and the next
 * scheduled checkpoint tries again.
 */
@Slf4j
public class CheckpointPolicy {
    private final int everyPages;
    private final ItemDatabase database;
    private final SnapshotWriter snapshots;
    private final List<SaleRecord> pendingSnapshot = new ArrayList<>();
    private int pagesSinceCheckpoint;
    @Getter private int checkpointsWritten;
    @Getter private int failures;
    @Getter private int batchNumber;

    /**
     * @param snapshots may be null to skip CSV snapshots
     */
    public CheckpointPolicy(int everyPages, ItemDatabase database, SnapshotWriter snapshots) {
        this.everyPages = everyPages;
        this.database = database;
        this.snapshots = snapshots;
    }

    /**
     * Records an ingested page and checkpoints when one is due.
     */
    public void onPageIngested(PageBatch batch, DedupStore store) {
        pagesSinceCheckpoint++;
        if (snapshots != null) {
            pendingSnapshot.addAll(batch.getRecords());
        }
        if (everyPages > 0 && pagesSinceCheckpoint >= everyPages) {
            batchNumber++;
            pagesSinceCheckpoint = 0;
            checkpoint(store, batchNumber);
        }
    }

    /**
     * @return true if the database was written
     */
    public boolean checkpoint(DedupStore store) {
        return checkpoint(store, null);
    }

    public boolean finalFlush(DedupStore store) {
        log.info("Final flush of {} item(s)", store.itemCount());
        Integer snapshotBatch = null;
        if (everyPages > 0 && pagesSinceCheckpoint > 0) {
            snapshotBatch = ++batchNumber;
        }
        return checkpoint(store, snapshotBatch);
    }

    private boolean checkpoint(DedupStore store, Integer snapshotBatch) {
        try {
            database.save(store);
            checkpointsWritten++;
            pagesSinceCheckpoint = 0;
        } catch (IOException e) {
            failures++;
            log.error("Checkpoint to {} failed, keeping previous file: {}", database.getPath(), e.toString());
            return false;
        }
        if (snapshots != null && !pendingSnapshot.isEmpty()) {
            snapshots.write(List.copyOf(pendingSnapshot), snapshotBatch);
            pendingSnapshot.clear();
        }
        return true;
    }
}
