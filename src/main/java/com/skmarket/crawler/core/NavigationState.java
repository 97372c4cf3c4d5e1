package com.skmarket.crawler.core;

public enum NavigationState {
    AT_START,
    ADVANCING_TO_TARGET,
    /** The live page is the target; extraction may run. */
    CONFIRMED,
    /** "Next" is missing or disabled: there are no more pages. A normal end. */
    EXHAUSTED,
    /** Clicking "next" stopped moving the page indicator, or moved it past the target. */
    DESYNC_ABORTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == EXHAUSTED || this == DESYNC_ABORTED || this == CANCELLED;
    }
}
