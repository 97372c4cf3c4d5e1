package com.skmarket.crawler.core;

import java.time.Duration;
import lombok.NonNull;
import lombok.Value;

/**
 * How long to keep re-reading rendered state after an interaction: up to {@code attempts} reads,
 * each preceded by a wait of {@code interval}.
 */
@Value
public class PollPolicy {
    int attempts;
    @NonNull Duration interval;
    @NonNull Sleeper sleeper;

    public PollPolicy(int attempts, Duration interval, Sleeper sleeper) {
        if (attempts < 1) {
            throw new IllegalArgumentException("Poll attempts must be >= 1, got " + attempts);
        }
        this.attempts = attempts;
        this.interval = interval;
        this.sleeper = sleeper;
    }

    public static PollPolicy of(Config.Navigation cfg, Sleeper sleeper) {
        return new PollPolicy(cfg.getPollAttempts(), Duration.ofMillis(cfg.getPollIntervalMs()), sleeper);
    }

    public void pause() throws InterruptedException {
        sleeper.sleep(interval);
    }
}
