package com.skmarket.crawler.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/**
 * Known sales of one item in arrival order. Never holds two records with the same
 * (timestamp, price); the name is fixed by the owning history.
 */
public class ItemHistory {
    @Getter private final String itemName;
    private final List<SaleRecord> sales = new ArrayList<>();
    private final Set<SaleRecord.Key> seen = new HashSet<>();

    public ItemHistory(String itemName) {
        this.itemName = itemName;
    }

    /**
     * @return true if the record was new and appended
     */
    boolean add(SaleRecord record) {
        if (!itemName.equals(record.getItemName())) {
            throw new IllegalArgumentException("Record for '" + record.getItemName() + "' added to history of '" + itemName + "'");
        }
        if (!seen.add(record.key())) {
            return false;
        }
        sales.add(record);
        return true;
    }

    public boolean contains(SaleRecord record) {
        return seen.contains(record.key());
    }

    public List<SaleRecord> getSales() {
        return Collections.unmodifiableList(sales);
    }

    public int size() {
        return sales.size();
    }
}
