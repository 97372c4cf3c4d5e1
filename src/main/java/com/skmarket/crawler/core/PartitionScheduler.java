package com.skmarket.crawler.core;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits pages 1..totalPages into one disjoint target sequence per worker. Workers left without
 * pages (more workers than pages) still get an empty assignment and finish straight away.
 */
@Slf4j
@RequiredArgsConstructor
public class PartitionScheduler {
    private final PartitionStrategy strategy;

    public PartitionScheduler() {
        this(PartitionStrategy.STRIPED);
    }

    public List<WorkerAssignment> assign(int totalWorkers, int totalPages) {
        if (totalWorkers < 1) {
            throw new IllegalArgumentException("Need at least one worker, got " + totalWorkers);
        }
        if (totalPages < 0) {
            throw new IllegalArgumentException("Total pages must be >= 0, got " + totalPages);
        }
        List<WorkerAssignment> assignments = new ArrayList<>(totalWorkers);
        for (int worker = 1; worker <= totalWorkers; worker++) {
            List<Integer> pages = List.copyOf(strategy.pagesFor(worker, totalWorkers, totalPages));
            assignments.add(new WorkerAssignment(worker, strategy.stride(totalWorkers), pages));
        }
        log.info("Partitioned {} page(s) across {} worker(s) using {}", totalPages, totalWorkers, strategy);
        return assignments;
    }
}
