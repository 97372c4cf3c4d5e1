package com.skmarket.crawler.core;

import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Retries a driver step that timed out, with exponential backoff. Other failures are not retried.
 */
@Slf4j
@RequiredArgsConstructor
public class Retryer {
    private final Config.Retries cfg;
    private final Sleeper sleeper;

    public <T> T runWithRetry(String opName, Supplier<T> step) throws InterruptedException {
        int maxAttempts = Math.max(1, cfg.getMaxAttempts());
        long delay = Math.max(0, cfg.getBackoffMs());
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return step.get();
            } catch (NavigationTimeoutException e) {
                log.warn("{} timed out on attempt {}/{}: {}", opName, attempts, maxAttempts, e.getMessage());
                if (attempts >= maxAttempts) {
                    throw e;
                }
                sleeper.sleep(Duration.ofMillis(delay));
                delay = Math.min(cfg.getMaxBackoffMs(), delay * 2);
            }
        }
    }

    public void runWithRetry(String opName, Runnable step) throws InterruptedException {
        runWithRetry(opName, () -> {
            step.run();
            return null;
        });
    }
}
