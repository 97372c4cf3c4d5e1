package com.skmarket.crawler.core;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded conduit from workers to the aggregator. Senders block while it is full, which holds fast
 * workers to the aggregator's pace. The stream is over once every registered producer has called
 * {@link #producerDone()} and the queue has drained.
 */
@Slf4j
public class ResultChannel {
    private static final long SEND_SLICE_MS = 250;

    private final BlockingQueue<PageBatch> queue;
    private final AtomicInteger openProducers = new AtomicInteger();

    public ResultChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be >= 1, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public void registerProducers(int count) {
        openProducers.addAndGet(count);
    }

    public void producerDone() {
        int left = openProducers.decrementAndGet();
        if (left < 0) {
            throw new IllegalStateException("More producers finished than were registered");
        }
    }

    /**
     * Offers a batch, waiting up to {@code timeout} for room. Gives up early when {@code control} asks to stop.
     *
     * @return true if the batch was queued
     */
    public boolean send(PageBatch batch, Duration timeout, CrawlControl control) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (queue.offer(batch, Math.max(0, Math.min(SEND_SLICE_MS, remainingMs)), TimeUnit.MILLISECONDS)) {
                return true;
            }
            if (control.isStopped()) {
                log.debug("Stop requested, dropping page {} from worker {}", batch.getPageNumber(), batch.getWorkerId());
                return false;
            }
            if (remainingMs <= 0) {
                log.warn("Channel stayed full for {} ms, dropping page {} from worker {}",
                    timeout.toMillis(), batch.getPageNumber(), batch.getWorkerId());
                return false;
            }
        }
    }

    /**
     * @return the next batch, or null if none arrived within {@code timeout}
     */
    public PageBatch poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * True once all producers are done and nothing is left to read.
     */
    public boolean isDrained() {
        return openProducers.get() == 0 && queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }
}
