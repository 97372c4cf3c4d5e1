package com.skmarket.crawler.core;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Throttles page clicks of a single worker. A rate of zero or less turns throttling off.
 */
@Slf4j
public class RateLimiter {
    private final Bucket bucket;

    public RateLimiter(Config.RateLimit cfg) {
        if (cfg == null || cfg.getPermitsPerSecond() <= 0) {
            bucket = null;
            return;
        }
        int burst = Math.max(cfg.getBurst(), 1);
        Bandwidth limit;
        if (cfg.getPermitsPerSecond() >= 1) {
            long tokensPerSecond = Math.round(cfg.getPermitsPerSecond());
            limit = Bandwidth.builder()
                    .capacity(burst)
                    .refillGreedy(tokensPerSecond, Duration.ofSeconds(1))
                    .build();
        } else {
            long millisPerToken = Math.round(1000 / cfg.getPermitsPerSecond());
            limit = Bandwidth.builder()
                    .capacity(burst)
                    .refillGreedy(1, Duration.ofMillis(millisPerToken))
                    .build();
        }
        bucket = Bucket.builder().addLimit(limit).build();
        log.debug("Rate limit {} permits/s, burst {}", cfg.getPermitsPerSecond(), burst);
    }

    public static RateLimiter unlimited() {
        return new RateLimiter(null);
    }

    public boolean isEnabled() {
        return bucket != null;
    }

    public void acquire() throws InterruptedException {
        if (bucket != null) {
            bucket.asBlocking().consume(1);
        }
    }
}
