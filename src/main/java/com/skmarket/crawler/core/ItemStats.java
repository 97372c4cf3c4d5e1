package com.skmarket.crawler.core;

import java.util.Arrays;
import java.util.List;
import lombok.Value;

/**
 * Price statistics of one item, used to judge live listings against history.
 */
@Value
public class ItemStats {
    String itemName;
    int sales;
    double averagePrice;
    double medianPrice;
    long minPrice;
    long maxPrice;
    SaleRecord lastSold;

    static ItemStats of(ItemHistory history) {
        List<SaleRecord> records = history.getSales();
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No sales for " + history.getItemName());
        }
        long[] prices = records.stream().mapToLong(SaleRecord::getPrice).sorted().toArray();
        int n = prices.length;
        double median = n % 2 == 1 ? prices[n / 2] : prices[n / 2 - 1] / 2.0 + prices[n / 2] / 2.0;
        double average = Arrays.stream(prices).asDoubleStream().average().orElse(0);
        return new ItemStats(history.getItemName(), n, average, median, prices[0], prices[n - 1], records.get(n - 1));
    }
}
