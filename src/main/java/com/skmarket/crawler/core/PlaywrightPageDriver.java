package com.skmarket.crawler.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class PlaywrightPageDriver implements PageDriver {
    private final Config.Browser config;

    @Override
    public PageSession openSession() {
        BrowserSession session = new BrowserSession(config);
        session.start();
        log.debug("Opened browser session on {}", Thread.currentThread().getName());
        return session;
    }
}
