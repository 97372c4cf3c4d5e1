package com.skmarket.crawler.core;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Crawler {

    private static final String CONFIG_DIR = "crawler-configs";
    private static final List<String> EXCLUDE_FILES = List.of(
        Paths.get(CONFIG_DIR, "sample.yaml").toString(),
        Paths.get(CONFIG_DIR, "sample.yml").toString()
    );

    public static void run() throws Exception {
        List<Path> configFiles = listConfigFiles()
            .stream()
            .filter(p -> EXCLUDE_FILES.stream().noneMatch(name -> p.toString().endsWith(name)))
            .toList();
        if (configFiles.isEmpty()) {
            log.info("No job configs found in {}, falling back to the default config", CONFIG_DIR);
            runWithConfig(Config.loadDefault());
            return;
        }
        runWithConfigs(configFiles.stream().map(Path::toString).collect(Collectors.toList()));
    }

    private static List<Path> listConfigFiles() throws Exception {
        // 1. Try external directory (for development)
        Path externalDir = Paths.get("src/main/resources", CONFIG_DIR);
        if (Files.isDirectory(externalDir)) {
            return yamlFiles(externalDir);
        }

        // 2. Try classpath; only exploded directories can be listed
        List<Path> result = new ArrayList<>();
        var resources = Thread.currentThread().getContextClassLoader().getResources(CONFIG_DIR);
        while (resources.hasMoreElements()) {
            var url = resources.nextElement();
            if ("file".equals(url.getProtocol())) {
                result.addAll(yamlFiles(Paths.get(url.toURI())));
            } else {
                log.warn("Cannot list job configs inside {}, pass config paths as arguments instead", url);
            }
        }
        return result;
    }

    private static List<Path> yamlFiles(Path dir) throws Exception {
        try (var stream = Files.list(dir)) {
            return stream
                .filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public static void runWithConfigs(List<String> configPaths) throws Exception {
        for (String configPath : configPaths) {
            Path path = Paths.get(configPath);

            if (Files.isDirectory(path)) {
                log.info("Processing config directory: {}", configPath);
                for (Path configFile : yamlFiles(path)) {
                    log.info("Processing config file {} in directory {}", configFile, path);
                    runWithConfig(Config.load(configFile));
                }
            } else if (Files.exists(path)) {
                log.info("Processing config file: {}", configPath);
                runWithConfig(Config.load(path));
            } else {
                log.error("Config file or directory not found: {}", configPath);
            }
        }
    }

    static CrawlSummary runWithConfig(Config config) throws Exception {
        CrawlEngine engine = CrawlEngine.builder()
            .config(config)
            .driver(new PlaywrightPageDriver(config.getBrowser()))
            .build();

        CountDownLatch finished = new CountDownLatch(1);
        long graceMs = config.getEngine().getShutdownTimeoutMs();
        Thread hook = new Thread(() -> {
            engine.getControl().stop();
            try {
                if (!finished.await(graceMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Crawl '{}' did not flush within {} ms of shutdown", config.getName(), graceMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            log.info("Starting crawl '{}'", config.getName());
            CrawlSummary summary = engine.run();
            if (!summary.isComplete()) {
                log.warn("Crawl '{}' finished with partial coverage: pages {} were not visited",
                    config.getName(), summary.pagesMissed());
            }
            log.info("Crawl '{}' completed: {} items, {} sales in database", config.getName(),
                summary.getItemCount(), summary.getRecordCount());
            return summary;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
        }
    }
}
