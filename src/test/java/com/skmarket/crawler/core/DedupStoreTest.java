package com.skmarket.crawler.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class DedupStoreTest {

    private static SaleRecord sale(String name, long price, String timestamp) {
        return SaleRecord.builder().itemName(name).price(price).timestamp(timestamp).build();
    }

    @Test
    void shouldDropRecordsWithSameNameTimestampAndPrice() {
        DedupStore store = new DedupStore();
        PageBatch batch = new PageBatch(1, 1, List.of(
            sale("Iron Ore", 100, "2024-03-14T13:05:09"),
            sale("Iron Ore", 100, "2024-03-14T13:05:09"),
            sale("Iron Ore", 101, "2024-03-14T13:05:09"),
            sale("Iron Ore", 100, "2024-03-14T13:06:00")));

        assertThat(store.ingest(batch)).isEqualTo(3);
        assertThat(store.recordCount()).isEqualTo(3);
        assertThat(store.itemCount()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreQuantityAndStatusForIdentity() {
        DedupStore store = new DedupStore();
        store.add(sale("Potion", 300, "t1"));

        SaleRecord sameSaleMoreDetail = SaleRecord.builder()
            .itemName("Potion").price(300).timestamp("t1").quantity(3).status("Sold").build();

        assertThat(store.add(sameSaleMoreDetail)).isFalse();
        assertThat(store.history("Potion")).get().extracting(ItemHistory::size).isEqualTo(1);
    }

    @Test
    void shouldBeIdempotentForRepeatedBatches() {
        DedupStore store = new DedupStore();
        PageBatch batch = new PageBatch(4, 2, List.of(sale("A", 1, "t1"), sale("B", 2, "t2")));

        store.ingest(batch);
        int addedAgain = store.ingest(batch);

        assertThat(addedAgain).isZero();
        assertThat(store.recordCount()).isEqualTo(2);
        assertThat(store.itemNames()).containsExactly("A", "B");
    }

    @Test
    void shouldKeepArrivalOrderPerItem() {
        DedupStore store = new DedupStore();
        store.add(sale("A", 3, "t3"));
        store.add(sale("A", 1, "t1"));

        assertThat(store.history("A").orElseThrow().getSales())
            .extracting(SaleRecord::getTimestamp)
            .containsExactly("t3", "t1");
    }

    @Test
    void shouldComputeStatsForItem() {
        DedupStore store = new DedupStore();
        store.add(sale("A", 10, "t1"));
        store.add(sale("A", 40, "t2"));
        store.add(sale("A", 20, "t3"));
        store.add(sale("A", 30, "t4"));

        ItemStats stats = store.statsFor("A").orElseThrow();

        assertThat(stats.getSales()).isEqualTo(4);
        assertThat(stats.getMedianPrice()).isCloseTo(25.0, within(0.001));
        assertThat(stats.getAveragePrice()).isCloseTo(25.0, within(0.001));
        assertThat(stats.getMinPrice()).isEqualTo(10);
        assertThat(stats.getMaxPrice()).isEqualTo(40);
        assertThat(stats.getLastSold().getTimestamp()).isEqualTo("t4");
        assertThat(store.statsFor("unknown")).isEmpty();
    }

    @Test
    void shouldNotOverflowStatsForHugePrices() {
        DedupStore store = new DedupStore();
        store.add(sale("Relic", Long.MAX_VALUE, "t1"));
        store.add(sale("Relic", Long.MAX_VALUE - 1, "t2"));

        ItemStats stats = store.statsFor("Relic").orElseThrow();

        assertThat(stats.getMedianPrice()).isPositive().isCloseTo((double) Long.MAX_VALUE, within(1e6));
        assertThat(stats.getAveragePrice()).isPositive().isCloseTo((double) Long.MAX_VALUE, within(1e6));
    }
}
