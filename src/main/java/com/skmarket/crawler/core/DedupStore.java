package com.skmarket.crawler.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Canonical item name to sale history map.
 * <p>
 * Not thread-safe. During a crawl only the aggregator thread touches it.
 */
@Slf4j
public class DedupStore {
    private final Map<String, ItemHistory> histories = new LinkedHashMap<>();

    /**
     * Appends the records of a batch, skipping any whose (itemName, timestamp, price) is already known.
     *
     * @return number of records actually added
     */
    public int ingest(PageBatch batch) {
        int added = 0;
        for (SaleRecord record : batch.getRecords()) {
            if (add(record)) {
                added++;
            }
        }
        if (added < batch.size()) {
            log.debug("Page {}: dropped {} duplicate record(s)", batch.getPageNumber(), batch.size() - added);
        }
        return added;
    }

    public boolean add(SaleRecord record) {
        return histories.computeIfAbsent(record.getItemName(), ItemHistory::new).add(record);
    }

    public Optional<ItemHistory> history(String itemName) {
        return Optional.ofNullable(histories.get(itemName));
    }

    public Optional<ItemStats> statsFor(String itemName) {
        return history(itemName)
            .filter(h -> h.size() > 0)
            .map(ItemStats::of);
    }

    public Set<String> itemNames() {
        return Collections.unmodifiableSet(histories.keySet());
    }

    public Collection<ItemHistory> histories() {
        return Collections.unmodifiableCollection(histories.values());
    }

    public int itemCount() {
        return histories.size();
    }

    public int recordCount() {
        return histories.values().stream().mapToInt(ItemHistory::size).sum();
    }
}
