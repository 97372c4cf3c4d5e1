package com.skmarket.crawler.core;

/**
 * Why a worker stopped. Only {@link #COMPLETED} and {@link #NO_PAGES} mean full coverage of the assignment.
 */
public enum WorkerOutcome {
    COMPLETED,
    NO_PAGES,
    EXHAUSTED,
    DESYNC_ABORTED,
    TIMED_OUT,
    CANCELLED,
    SESSION_FAILED,
    FAILED;

    public boolean coveredAssignment() {
        return this == COMPLETED || this == NO_PAGES;
    }
}
