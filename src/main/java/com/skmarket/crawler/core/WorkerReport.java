package com.skmarket.crawler.core;

import java.util.List;
import lombok.Value;

/**
 * What one worker did: its terminal outcome and which of its target pages reached the channel.
 */
@Value
public class WorkerReport {
    int workerId;
    WorkerOutcome outcome;
    boolean sessionOpened;
    List<Integer> targetPages;
    List<Integer> pagesDelivered;

    public List<Integer> pagesMissed() {
        return targetPages.stream().filter(p -> !pagesDelivered.contains(p)).toList();
    }
}
