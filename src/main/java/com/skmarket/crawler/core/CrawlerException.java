package com.skmarket.crawler.core;

/**
 * Base failure of the crawl engine and its page driver.
 */
public class CrawlerException extends RuntimeException {
    public CrawlerException(String message) {
        super(message);
    }

    public CrawlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
