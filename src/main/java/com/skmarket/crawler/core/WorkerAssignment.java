package com.skmarket.crawler.core;

import java.util.List;
import lombok.Value;

@Value
public class WorkerAssignment {
    int workerId;
    int stride;
    List<Integer> targetPages;

    public boolean isEmpty() {
        return targetPages.isEmpty();
    }
}
