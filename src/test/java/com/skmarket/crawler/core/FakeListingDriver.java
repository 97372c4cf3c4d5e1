package com.skmarket.crawler.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory history listing. Each session starts on page 1 and moves forward only through clicks
 * on the "next" button, like the real site. Selectors are matched by string against the configured ones.
 */
class FakeListingDriver implements PageDriver {
    private final Config.Selectors selectors;
    private final List<List<String[]>> pages;
    final AtomicInteger opened = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();
    final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    final Set<Integer> pagesWithoutTable = ConcurrentHashMap.newKeySet();
    final Set<Integer> pagesWithoutRows = ConcurrentHashMap.newKeySet();
    final AtomicInteger clicks = new AtomicInteger();
    volatile boolean failOpen;
    volatile boolean hideNext;
    /** Clicks stop moving the indicator once this page is reached. 0 means never. */
    volatile int stuckAtPage;
    volatile int pagesPerClick = 1;

    FakeListingDriver(Config.Selectors selectors, List<List<String[]>> pages) {
        this.selectors = selectors;
        this.pages = pages;
    }

    /**
     * Pages of {@code rowsPerPage} distinct sales each, named {@code Item <page>-<row>}.
     */
    static FakeListingDriver withPages(Config.Selectors selectors, int pageCount, int rowsPerPage) {
        List<List<String[]>> pages = new ArrayList<>();
        for (int p = 1; p <= pageCount; p++) {
            List<String[]> rows = new ArrayList<>();
            for (int r = 1; r <= rowsPerPage; r++) {
                rows.add(new String[]{"Item " + p + "-" + r, (p * 100 + r) + " cr", "3/14/2024", "1:05:09 PM"});
            }
            pages.add(rows);
        }
        return new FakeListingDriver(selectors, pages);
    }

    int pageCount() {
        return pages.size();
    }

    @Override
    public PageSession openSession() {
        if (failOpen) {
            throw new CrawlerException("browser failed to launch");
        }
        opened.incrementAndGet();
        FakeSession session = new FakeSession();
        sessions.add(session);
        return session;
    }

    class FakeSession implements PageSession {
        volatile int currentPage = 1;
        volatile boolean closedFlag;
        final List<String> navigations = new CopyOnWriteArrayList<>();

        @Override
        public void navigate(String url, long timeoutMs) {
            navigations.add(url);
            currentPage = 1;
        }

        @Override
        public void waitForNetworkIdle(long timeoutMs) {
        }

        @Override
        public void waitFor(String selector, long timeoutMs, WaitState state) {
            if (selector.equals(selectors.getTable()) && pagesWithoutTable.contains(currentPage)) {
                throw new NavigationTimeoutException("table not attached on page " + currentPage);
            }
        }

        @Override
        public List<PageElement> queryAll(String selector) {
            if (!selector.equals(selectors.getRows()) || pagesWithoutTable.contains(currentPage)
                    || pagesWithoutRows.contains(currentPage)) {
                return List.of();
            }
            List<PageElement> rows = new ArrayList<>();
            for (String[] row : pages.get(currentPage - 1)) {
                rows.add(row(row));
            }
            return rows;
        }

        @Override
        public Optional<PageElement> query(String selector) {
            if (selector.equals(selectors.getPageIndicator())) {
                return Optional.of(new FakeElement("Page " + currentPage + " of " + pages.size()));
            }
            if (selector.equals(selectors.getNavContainer())) {
                FakeElement container = new FakeElement("");
                if (!hideNext) {
                    container.children.put(selectors.getNextButton(), nextButton());
                }
                return Optional.of(container);
            }
            return Optional.empty();
        }

        private FakeElement nextButton() {
            FakeElement next = new FakeElement("Next");
            if (currentPage >= pages.size()) {
                next.attributes.put("disabled", "");
            }
            next.onClick = () -> {
                clicks.incrementAndGet();
                if (stuckAtPage > 0 && currentPage >= stuckAtPage) {
                    return;
                }
                currentPage = Math.min(pages.size(), currentPage + pagesPerClick);
            };
            return next;
        }

        private FakeElement row(String[] cells) {
            FakeElement row = new FakeElement("");
            putCell(row, selectors.getName(), cells[0]);
            putCell(row, selectors.getPrice(), cells[1]);
            putCell(row, selectors.getDate(), cells[2]);
            putCell(row, selectors.getTime(), cells[3]);
            if (cells.length > 4 && selectors.getStatus() != null) {
                putCell(row, selectors.getStatus(), cells[4]);
            }
            return row;
        }

        private void putCell(FakeElement row, String selector, String text) {
            if (text != null) {
                row.children.put(selector, new FakeElement(text));
            }
        }

        @Override
        public void close() {
            if (!closedFlag) {
                closedFlag = true;
                closed.incrementAndGet();
            }
        }
    }

    static class FakeElement implements PageElement {
        final String text;
        final Map<String, String> attributes = new HashMap<>();
        final Map<String, FakeElement> children = new HashMap<>();
        Runnable onClick = () -> { };

        FakeElement(String text) {
            this.text = text;
        }

        @Override
        public Optional<String> textContent() {
            return Optional.ofNullable(text);
        }

        @Override
        public Optional<String> getAttribute(String name) {
            return Optional.ofNullable(attributes.get(name));
        }

        @Override
        public void click() {
            onClick.run();
        }

        @Override
        public Optional<PageElement> query(String selector) {
            return Optional.ofNullable(children.get(selector));
        }
    }
}
