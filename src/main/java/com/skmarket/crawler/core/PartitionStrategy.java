package com.skmarket.crawler.core;

import java.util.ArrayList;
import java.util.List;

/**
 * How pages 1..P are divided among W workers. Both strategies hand out every page exactly once.
 */
public enum PartitionStrategy {
    /** Worker i visits i, i+W, i+2W, ... Each worker clicks "next" W times between pages. */
    STRIPED {
        @Override
        List<Integer> pagesFor(int workerIndex, int totalWorkers, int totalPages) {
            List<Integer> pages = new ArrayList<>();
            for (int page = workerIndex; page <= totalPages; page += totalWorkers) {
                pages.add(page);
            }
            return pages;
        }

        @Override
        int stride(int totalWorkers) {
            return totalWorkers;
        }
    },
    /** Worker i visits one contiguous block; earlier blocks take the remainder pages. */
    SEQUENTIAL {
        @Override
        List<Integer> pagesFor(int workerIndex, int totalWorkers, int totalPages) {
            int base = totalPages / totalWorkers;
            int extra = totalPages % totalWorkers;
            int size = base + (workerIndex <= extra ? 1 : 0);
            int first = (workerIndex - 1) * base + Math.min(workerIndex - 1, extra) + 1;
            List<Integer> pages = new ArrayList<>(size);
            for (int page = first; page < first + size; page++) {
                pages.add(page);
            }
            return pages;
        }

        @Override
        int stride(int totalWorkers) {
            return 1;
        }
    };

    abstract List<Integer> pagesFor(int workerIndex, int totalWorkers, int totalPages);

    abstract int stride(int totalWorkers);
}
