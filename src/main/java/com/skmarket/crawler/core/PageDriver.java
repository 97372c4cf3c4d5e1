package com.skmarket.crawler.core;

/**
 * Opens isolated browsing sessions. Each worker calls {@link #openSession()} on its own thread
 * and is the only user of the returned session.
 */
@FunctionalInterface
public interface PageDriver {
    PageSession openSession();
}
