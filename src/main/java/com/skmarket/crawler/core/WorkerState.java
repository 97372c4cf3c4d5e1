package com.skmarket.crawler.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Navigation progress of one worker. Owned and mutated by that worker only.
 */
@Getter
public class WorkerState {
    private final int workerId;
    private final int stride;
    private int currentConfirmedPage;
    private int nextTargetPage;
    private final List<Integer> pagesVisited = new ArrayList<>();

    public WorkerState(int workerId, int stride, int startPage) {
        this.workerId = workerId;
        this.stride = stride;
        this.currentConfirmedPage = startPage;
    }

    /**
     * Moves the confirmed page forward. The confirmed page never goes backwards.
     */
    public void confirm(int page) {
        if (page < currentConfirmedPage) {
            throw new IllegalStateException("Worker " + workerId + " cannot move back from page "
                + currentConfirmedPage + " to " + page);
        }
        currentConfirmedPage = page;
    }

    public void target(int page) {
        nextTargetPage = page;
    }

    public void visited(int page) {
        pagesVisited.add(page);
    }

    public List<Integer> getPagesVisited() {
        return Collections.unmodifiableList(pagesVisited);
    }
}
