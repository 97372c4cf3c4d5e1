package com.skmarket.crawler.core;

import java.util.List;
import lombok.Value;

/**
 * All records extracted from one confirmed page. The unit of transfer from a worker to the aggregator.
 */
@Value
public class PageBatch {
    int pageNumber;
    int workerId;
    List<SaleRecord> records;

    public PageBatch(int pageNumber, int workerId, List<SaleRecord> records) {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page number must be >= 1, got " + pageNumber);
        }
        this.pageNumber = pageNumber;
        this.workerId = workerId;
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
