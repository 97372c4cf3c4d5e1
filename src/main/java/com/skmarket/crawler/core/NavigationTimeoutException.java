package com.skmarket.crawler.core;

/**
 * A navigate, wait or click call on the page driver ran past its timeout.
 */
public class NavigationTimeoutException extends CrawlerException {
    public NavigationTimeoutException(String message) {
        super(message);
    }

    public NavigationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
