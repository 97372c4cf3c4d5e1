package com.skmarket.crawler.core;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Crawls the pages of one assignment with its own browser session and pushes one batch per
 * confirmed page onto the channel.
 * <p>
 * Every way out of {@link #call()} is a {@link WorkerReport}: navigation trouble ends this
 * worker only, the rest of the run carries on.
 */
@Slf4j
public class CrawlWorker implements Callable<WorkerReport> {
    private final WorkerAssignment assignment;
    private final PageDriver driver;
    private final ResultChannel channel;
    private final CrawlControl control;
    private final Config config;
    private final Sleeper sleeper;
    private final Retryer retryer;
    private final SaleRecordExtractor extractor;

    @Builder
    CrawlWorker(@NonNull WorkerAssignment assignment, @NonNull PageDriver driver, @NonNull ResultChannel channel,
                @NonNull CrawlControl control, @NonNull Config config, Sleeper sleeper) {
        this.assignment = assignment;
        this.driver = driver;
        this.channel = channel;
        this.control = control;
        this.config = config;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.retryer = new Retryer(config.getRetries(), this.sleeper);
        this.extractor = new SaleRecordExtractor(config.getSelectors(), config.getNavigation().getTableTimeoutMs());
    }

    public int getWorkerId() {
        return assignment.getWorkerId();
    }

    @Override
    public WorkerReport call() {
        int id = assignment.getWorkerId();
        WorkerState state = new WorkerState(id, assignment.getStride(), 1);
        try {
            if (assignment.isEmpty()) {
                log.info("Worker {} has no pages assigned, ending", id);
                return report(WorkerOutcome.NO_PAGES, state, false);
            }
            if (control.isStopped()) {
                return report(WorkerOutcome.CANCELLED, state, false);
            }

            PageSession opened;
            try {
                opened = driver.openSession();
            } catch (RuntimeException e) {
                log.error("Worker {}: could not open browser session: {}", id, e.getMessage());
                return report(WorkerOutcome.SESSION_FAILED, state, false);
            }

            try (PageSession session = opened) {
                return report(crawl(session, state), state, true);
            } catch (NavigationTimeoutException e) {
                log.warn("Worker {} timed out after page {}: {}", id, state.getCurrentConfirmedPage(), e.getMessage());
                return report(WorkerOutcome.TIMED_OUT, state, true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Worker {} interrupted on page {}", id, state.getCurrentConfirmedPage());
                return report(WorkerOutcome.CANCELLED, state, true);
            } catch (RuntimeException e) {
                log.error("Worker {} error on page {}", id, state.getCurrentConfirmedPage(), e);
                return report(WorkerOutcome.FAILED, state, true);
            }
        } finally {
            channel.producerDone();
        }
    }

    private WorkerOutcome crawl(PageSession session, WorkerState state) throws InterruptedException {
        int id = state.getWorkerId();
        Config.Navigation nav = config.getNavigation();
        String url = config.getCrawl().historyUrl();
        retryer.runWithRetry("navigate-history", () -> {
            session.navigate(url, nav.getNavigateTimeoutMs());
            session.waitForNetworkIdle(nav.getNetworkIdleTimeoutMs());
        });

        PollPolicy poll = PollPolicy.of(nav, sleeper);
        NavigationStateMachine navigator = NavigationStateMachine.builder()
            .session(session)
            .selectors(config.getSelectors())
            .poll(poll)
            .maxStalledClicks(nav.getMaxStalledClicks())
            .control(control)
            .limiter(new RateLimiter(config.getRateLimit()))
            .worker(state)
            .build();
        navigator.synchronizeStart();
        log.info("Worker {} starting at page {} with {} target page(s)", id, state.getCurrentConfirmedPage(),
            assignment.getTargetPages().size());

        Duration sendTimeout = Duration.ofMillis(config.getChannel().getSendTimeoutMs());
        for (int target : assignment.getTargetPages()) {
            if (!control.awaitRunnable(sleeper, poll.getInterval())) {
                log.info("Worker {}: stop requested before page {}", id, target);
                return WorkerOutcome.CANCELLED;
            }
            NavigationState reached = navigator.advanceTo(target);
            if (reached != NavigationState.CONFIRMED) {
                return endedBy(reached, target, state);
            }

            List<SaleRecord> records = retryer.runWithRetry("extract page " + target,
                () -> extractor.extract(session, target));
            if (!channel.send(new PageBatch(target, id, records), sendTimeout, control)) {
                return WorkerOutcome.CANCELLED;
            }
            state.visited(target);
            log.info("Worker {} scraped page {} with {} items", id, target, records.size());
        }
        log.info("Worker {} finished its pages (last page {})", id, state.getCurrentConfirmedPage());
        return WorkerOutcome.COMPLETED;
    }

    private WorkerOutcome endedBy(NavigationState reached, int target, WorkerState state) {
        int id = state.getWorkerId();
        return switch (reached) {
            case EXHAUSTED -> {
                log.info("Worker {} reached the last page ({}) before page {}", id, state.getCurrentConfirmedPage(), target);
                yield WorkerOutcome.EXHAUSTED;
            }
            case DESYNC_ABORTED -> {
                log.warn("Worker {} lost track of the page while heading to {}, ending", id, target);
                yield WorkerOutcome.DESYNC_ABORTED;
            }
            case CANCELLED -> WorkerOutcome.CANCELLED;
            default -> throw new IllegalStateException("Unexpected navigation state " + reached);
        };
    }

    private WorkerReport report(WorkerOutcome outcome, WorkerState state, boolean sessionOpened) {
        return new WorkerReport(state.getWorkerId(), outcome, sessionOpened,
            assignment.getTargetPages(), List.copyOf(state.getPagesVisited()));
    }
}
