package com.skmarket.crawler.core;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CrawlSummary {
    int pagesIngested;
    int recordsReceived;
    int recordsAdded;
    int itemCount;
    int recordCount;
    int checkpointsWritten;
    int checkpointFailures;
    boolean flushed;
    boolean cancelled;
    List<WorkerReport> workers;

    public int duplicatesDropped() {
        return recordsReceived - recordsAdded;
    }

    /**
     * Assigned pages that never reached the aggregator, across all workers.
     */
    public List<Integer> pagesMissed() {
        return workers.stream()
            .flatMap(w -> w.pagesMissed().stream())
            .sorted()
            .toList();
    }

    public boolean isComplete() {
        return workers.stream().allMatch(w -> w.getOutcome().coveredAssignment());
    }
}
