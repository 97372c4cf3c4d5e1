package com.skmarket.crawler.core;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * One crawl run: partitions the pages, starts a worker per assignment and aggregates their batches
 * on the calling thread.
 * <p>
 * A failed worker only costs its remaining pages. The run itself fails when no worker could open
 * a browser session, or when the merge loop breaks; whatever was ingested is still flushed.
 */
@Slf4j
public class CrawlEngine {
    private final Config config;
    private final PageDriver driver;
    @Getter private final CrawlControl control;
    private final Sleeper sleeper;
    private final ItemDatabase database;
    private final DedupStore initialStore;

    @Builder
    CrawlEngine(@NonNull Config config, @NonNull PageDriver driver, CrawlControl control, Sleeper sleeper,
                ItemDatabase database, DedupStore store) {
        this.config = config;
        this.driver = driver;
        this.control = control != null ? control : new CrawlControl();
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.database = database != null ? database : new ItemDatabase(config.getOutput().databasePath());
        this.initialStore = store;
    }

    public CrawlSummary run() throws IOException, InterruptedException {
        Config.Crawl crawl = config.getCrawl();
        DedupStore store = loadStore();
        SnapshotWriter snapshots = config.getOutput().isSnapshots() ? new SnapshotWriter(config.getOutput()) : null;
        CheckpointPolicy checkpoints = new CheckpointPolicy(config.getCheckpoint().getEveryPages(), database, snapshots);

        List<WorkerAssignment> assignments = new PartitionScheduler(crawl.getPartition())
            .assign(crawl.getWorkers(), crawl.getTotalPages());
        ResultChannel channel = new ResultChannel(config.getChannel().getCapacity());
        channel.registerProducers(assignments.size());
        Aggregator aggregator = new Aggregator(channel, store, checkpoints,
            Duration.ofMillis(config.getChannel().getPollTimeoutMs()));

        log.info("Starting crawl of {} page(s) from {} with {} worker(s)", crawl.getTotalPages(),
            crawl.historyUrl(), assignments.size());
        ExecutorService executor = Executors.newFixedThreadPool(assignments.size(), workerThreads());
        List<Future<WorkerReport>> futures = new ArrayList<>(assignments.size());
        try {
            for (WorkerAssignment assignment : assignments) {
                futures.add(executor.submit(CrawlWorker.builder()
                    .assignment(assignment)
                    .driver(driver)
                    .channel(channel)
                    .control(control)
                    .config(config)
                    .sleeper(sleeper)
                    .build()));
            }
            try {
                aggregator.run();
            } catch (InterruptedException e) {
                control.stop();
                aggregator.finalFlush();
                throw e;
            } catch (RuntimeException e) {
                log.error("Aggregator merge loop failed, stopping workers", e);
                control.stop();
                aggregator.finalFlush();
                throw new CrawlerException("Aggregator merge loop failed: " + e.getMessage(), e);
            }
        } finally {
            shutdown(executor);
        }

        List<WorkerReport> reports = collect(futures, assignments);
        boolean flushed = aggregator.finalFlush();
        for (WorkerReport report : reports) {
            if (!report.getOutcome().coveredAssignment()) {
                log.warn("Worker {} ended {} with {} page(s) not visited", report.getWorkerId(), report.getOutcome(),
                    report.pagesMissed().size());
            }
        }

        boolean anyWork = assignments.stream().anyMatch(a -> !a.isEmpty());
        if (anyWork && !control.isStopped() && reports.stream().noneMatch(WorkerReport::isSessionOpened)) {
            throw new CrawlerException("No browser session could be opened for any worker");
        }

        CrawlSummary summary = CrawlSummary.builder()
            .pagesIngested(aggregator.getPagesIngested())
            .recordsReceived(aggregator.getRecordsReceived())
            .recordsAdded(aggregator.getRecordsAdded())
            .itemCount(store.itemCount())
            .recordCount(store.recordCount())
            .checkpointsWritten(aggregator.getCheckpointsWritten())
            .checkpointFailures(aggregator.getCheckpointFailures())
            .flushed(flushed)
            .cancelled(control.isStopped())
            .workers(reports)
            .build();
        log.info("Crawl finished: {} page(s), {} record(s) received, {} new, {} duplicate(s), {} page(s) missed",
            summary.getPagesIngested(), summary.getRecordsReceived(), summary.getRecordsAdded(),
            summary.duplicatesDropped(), summary.pagesMissed().size());
        return summary;
    }

    private DedupStore loadStore() throws IOException {
        if (initialStore != null) {
            return initialStore;
        }
        return config.getOutput().isResume() ? database.load() : new DedupStore();
    }

    private List<WorkerReport> collect(List<Future<WorkerReport>> futures, List<WorkerAssignment> assignments)
            throws InterruptedException {
        List<WorkerReport> reports = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<WorkerReport> future = futures.get(i);
            WorkerAssignment assignment = assignments.get(i);
            if (!future.isDone()) {
                future.cancel(true);
                reports.add(failed(assignment));
                continue;
            }
            try {
                reports.add(future.get());
            } catch (ExecutionException e) {
                log.error("Worker {} crashed", assignment.getWorkerId(), e.getCause());
                reports.add(failed(assignment));
            } catch (CancellationException e) {
                reports.add(failed(assignment));
            }
        }
        return reports;
    }

    private static WorkerReport failed(WorkerAssignment assignment) {
        return new WorkerReport(assignment.getWorkerId(), WorkerOutcome.FAILED, false,
            assignment.getTargetPages(), List.of());
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getEngine().getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {} ms, interrupting", config.getEngine().getShutdownTimeoutMs());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread thread = new Thread(r, "crawl-worker-" + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }
}
