package com.skmarket.crawler.core;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Stop and pause flags shared by one run. Written by whoever controls the run, read by workers
 * between navigation steps. Cancellation is cooperative: nothing is interrupted.
 */
@Slf4j
public class CrawlControl {
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final AtomicBoolean paused = new AtomicBoolean();

    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Stop requested");
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Pause requested");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Resumed");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Blocks while paused, checking again every {@code interval}.
     *
     * @return false if a stop was requested, so the caller should wind down
     */
    public boolean awaitRunnable(Sleeper sleeper, Duration interval) throws InterruptedException {
        while (paused.get() && !stopped.get()) {
            sleeper.sleep(interval);
        }
        return !stopped.get();
    }
}
