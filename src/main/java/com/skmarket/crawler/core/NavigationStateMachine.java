package com.skmarket.crawler.core;

import static com.skmarket.crawler.core.NavigationState.ADVANCING_TO_TARGET;
import static com.skmarket.crawler.core.NavigationState.AT_START;
import static com.skmarket.crawler.core.NavigationState.CANCELLED;
import static com.skmarket.crawler.core.NavigationState.CONFIRMED;
import static com.skmarket.crawler.core.NavigationState.DESYNC_ABORTED;
import static com.skmarket.crawler.core.NavigationState.EXHAUSTED;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves a live session forward to a target page. The listing has no page URLs that can be trusted,
 * so every move is a click on "next" followed by polling the rendered page indicator until it
 * shows a higher page number than before.
 * <p>
 * One instance per worker, used only from that worker's thread.
 */
@Slf4j
public class NavigationStateMachine {
    static final Pattern PAGE_NUMBER = Pattern.compile("Page\\s+(\\d{1,9})");

    private final PageSession session;
    private final Config.Selectors selectors;
    private final PollPolicy poll;
    private final int maxStalledClicks;
    private final CrawlControl control;
    private final RateLimiter limiter;
    @Getter private final WorkerState worker;
    @Getter private NavigationState state = AT_START;

    @Builder
    NavigationStateMachine(@NonNull PageSession session, @NonNull Config.Selectors selectors, @NonNull PollPolicy poll,
                           int maxStalledClicks, @NonNull CrawlControl control, RateLimiter limiter,
                           @NonNull WorkerState worker) {
        this.session = session;
        this.selectors = selectors;
        this.poll = poll;
        this.maxStalledClicks = Math.max(1, maxStalledClicks);
        this.control = control;
        this.limiter = limiter != null ? limiter : RateLimiter.unlimited();
        this.worker = worker;
    }

    /**
     * Reads where the freshly loaded listing is. A missing or unreadable indicator means page 1.
     */
    public int synchronizeStart() throws InterruptedException {
        for (int attempt = 1; attempt <= poll.getAttempts(); attempt++) {
            OptionalInt page = readIndicator();
            if (page.isPresent()) {
                if (page.getAsInt() > worker.getCurrentConfirmedPage()) {
                    worker.confirm(page.getAsInt());
                }
                return worker.getCurrentConfirmedPage();
            }
            if (attempt < poll.getAttempts()) {
                poll.pause();
            }
        }
        log.debug("Worker {}: page indicator not readable, assuming page {}", worker.getWorkerId(),
            worker.getCurrentConfirmedPage());
        return worker.getCurrentConfirmedPage();
    }

    /**
     * Drives the session to {@code target}.
     *
     * @return {@link NavigationState#CONFIRMED} when the live page is the target, otherwise the terminal state reached
     * @throws NavigationTimeoutException when a driver call times out
     */
    public NavigationState advanceTo(int target) throws InterruptedException {
        if (state.isTerminal()) {
            throw new IllegalStateException("Worker " + worker.getWorkerId() + " navigation already ended in " + state);
        }
        worker.target(target);
        int stalledClicks = 0;
        while (true) {
            int confirmed = worker.getCurrentConfirmedPage();
            if (confirmed == target) {
                return moveTo(CONFIRMED);
            }
            if (confirmed > target) {
                log.warn("Worker {}: overshot target page {}, live page is {}", worker.getWorkerId(), target, confirmed);
                return moveTo(DESYNC_ABORTED);
            }
            if (!control.awaitRunnable(poll.getSleeper(), poll.getInterval())) {
                log.info("Worker {}: stop requested on page {}", worker.getWorkerId(), confirmed);
                return moveTo(CANCELLED);
            }
            moveTo(ADVANCING_TO_TARGET);

            Optional<PageElement> next = findNextButton();
            if (next.isEmpty()) {
                log.info("Worker {}: Next button not found on page {}", worker.getWorkerId(), confirmed);
                return moveTo(EXHAUSTED);
            }
            if (next.get().hasAttribute("disabled")) {
                log.info("Worker {}: Next button disabled on page {}", worker.getWorkerId(), confirmed);
                return moveTo(EXHAUSTED);
            }

            limiter.acquire();
            next.get().click();
            OptionalInt advanced = awaitPageAfter(confirmed);
            if (advanced.isPresent()) {
                worker.confirm(advanced.getAsInt());
                stalledClicks = 0;
                log.debug("Worker {} navigated to page {}", worker.getWorkerId(), advanced.getAsInt());
            } else {
                stalledClicks++;
                log.info("Worker {} expected page {} but is still on {} ({}/{} stalled clicks)",
                    worker.getWorkerId(), target, confirmed, stalledClicks, maxStalledClicks);
                if (stalledClicks >= maxStalledClicks) {
                    log.warn("Worker {}: page indicator stuck at {}, giving up on page {}",
                        worker.getWorkerId(), confirmed, target);
                    return moveTo(DESYNC_ABORTED);
                }
            }
        }
    }

    private OptionalInt awaitPageAfter(int previous) throws InterruptedException {
        for (int attempt = 0; attempt < poll.getAttempts(); attempt++) {
            poll.pause();
            OptionalInt page = readIndicator();
            if (page.isPresent() && page.getAsInt() > previous) {
                return page;
            }
        }
        return OptionalInt.empty();
    }

    private Optional<PageElement> findNextButton() {
        String container = selectors.getNavContainer();
        if (container == null || container.isBlank()) {
            return session.query(selectors.getNextButton());
        }
        return session.query(container).flatMap(c -> c.query(selectors.getNextButton()));
    }

    private OptionalInt readIndicator() {
        return session.query(selectors.getPageIndicator())
            .flatMap(PageElement::textContent)
            .map(NavigationStateMachine::parsePageNumber)
            .orElse(OptionalInt.empty());
    }

    static OptionalInt parsePageNumber(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        Matcher m = PAGE_NUMBER.matcher(text);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    private NavigationState moveTo(NavigationState next) {
        if (next != state) {
            log.trace("Worker {}: {} -> {}", worker.getWorkerId(), state, next);
        }
        state = next;
        return next;
    }
}
