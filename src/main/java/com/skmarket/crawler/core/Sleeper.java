package com.skmarket.crawler.core;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
    Sleeper NONE = duration -> { };

    void sleep(Duration duration) throws InterruptedException;
}
