package com.skmarket.crawler.core;

/**
 * A single history row could not be turned into a sale record.
 */
public class ExtractionException extends RuntimeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
