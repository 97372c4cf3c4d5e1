package com.skmarket.crawler;

import com.skmarket.crawler.core.Crawler;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class App {
    public static void main(String[] args) {
        try {
            if (args.length > 0) {
                Crawler.runWithConfigs(List.of(args));
            } else {
                Crawler.run();
            }
        } catch (Exception e) {
            log.error("Crawler failed", e);
            System.exit(1);
        }
    }
}
