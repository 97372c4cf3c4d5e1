package com.skmarket.crawler.core;

import java.util.List;
import java.util.Optional;

/**
 * One browsing session: a single tab with its own rendering context and connections.
 * <p>
 * Calls that wait take an explicit timeout and throw {@link NavigationTimeoutException} when it elapses.
 * Other driver failures surface as {@link CrawlerException}.
 */
public interface PageSession extends AutoCloseable {

    void navigate(String url, long timeoutMs);

    void waitForNetworkIdle(long timeoutMs);

    void waitFor(String selector, long timeoutMs, WaitState state);

    List<PageElement> queryAll(String selector);

    Optional<PageElement> query(String selector);

    @Override
    void close();
}
