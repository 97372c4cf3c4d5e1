package com.skmarket.crawler.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One completed sale read from a history row. Price is in crowns, the smallest unit the site shows.
 */
@Value
@Builder
public class SaleRecord {
    @NonNull String itemName;
    long price;
    /** ISO-8601 local date-time when the row's date could be parsed, otherwise the raw text. */
    @NonNull String timestamp;
    @Builder.Default int quantity = 1;
    String status;

    public double pricePerUnit() {
        return quantity > 1 ? (double) price / quantity : price;
    }

    /**
     * Dedup identity. Quantity and status are payload and do not take part.
     */
    public Key key() {
        return new Key(itemName, timestamp, price);
    }

    @Value
    public static class Key {
        String itemName;
        String timestamp;
        long price;
    }
}
