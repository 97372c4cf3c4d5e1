package com.skmarket.crawler.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.Data;
import lombok.extern.log4j.Log4j2;

@Log4j2
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    private String name = "sale-history";
    private Browser browser = new Browser();
    private Crawl crawl = new Crawl();
    private Navigation navigation = new Navigation();
    private Selectors selectors = new Selectors();
    private Retries retries = new Retries();
    private RateLimit rateLimit = new RateLimit();
    private Channel channel = new Channel();
    private Checkpoint checkpoint = new Checkpoint();
    private Output output = new Output();
    private Engine engine = new Engine();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Browser {
        private boolean headless = true;
        private int viewportWidth = 1280;
        private int viewportHeight = 1024;
        private List<String> blockedResourceTypes = List.of("image", "stylesheet", "font");
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Crawl {
        private String baseUrl = "https://www.sk-ah.com/";
        private String historyPath = "history";
        private int totalPages = 200;
        private int workers = 20;
        private PartitionStrategy partition = PartitionStrategy.STRIPED;

        public String historyUrl() {
            return UrlUtils.toAbsolute(baseUrl, historyPath).toString();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Navigation {
        private long navigateTimeoutMs = 60000;
        private long networkIdleTimeoutMs = 30000;
        private long tableTimeoutMs = 8000;
        private int pollAttempts = 10;
        private long pollIntervalMs = 500;
        private int maxStalledClicks = 10;
    }

    /**
     * Locators for the history listing. Row cell selectors are evaluated relative to a row.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Selectors {
        private String navContainer = "xpath=/html/body/div/main/div[2]/div/div[5]";
        private String nextButton = "xpath=.//button[contains(., 'Next')]";
        private String pageIndicator = "xpath=/html/body/div/main/div[2]/div/div[5]/div/p[1]";
        private String table = "xpath=/html/body/div/main/div[2]/div/div[4]/table";
        private String rows = "xpath=/html/body/div/main/div[2]/div/div[4]/table/tbody/tr";
        private String name = "xpath=./td[1]//span[not(ancestor::small)]";
        private String price = "xpath=./td[2]//div[contains(@class, 'justify-end')]";
        private String date = "xpath=./td[3]//div[contains(@class, 'justify-end')][1]";
        private String time = "xpath=./td[3]//small";
        private String status;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Retries {
        private int maxAttempts = 3;
        private long backoffMs = 1000;
        private long maxBackoffMs = 8000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimit {
        private double permitsPerSecond = 0;
        private int burst = 2;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Channel {
        private int capacity = 64;
        private long sendTimeoutMs = 300000;
        private long pollTimeoutMs = 1000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Checkpoint {
        private int everyPages = 40;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Output {
        private String dir = "sk_market_data";
        private String databaseFile = "item_database.json";
        private boolean snapshots = true;
        private boolean richSnapshot = false;
        private boolean resume = true;

        public Path databasePath() {
            return Path.of(dir).resolve(databaseFile);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Engine {
        private long shutdownTimeoutMs = 60000;
    }

    public static Config load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = Files.newInputStream(path)) {
            Config config = mapper.readValue(in, Config.class);
            log.debug("Loaded config '{}' from {}", config.getName(), path);
            return config;
        }
    }

    public static Config load(String configPath) throws IOException {
        return load(Path.of(configPath));
    }

    public static Config loadDefault() throws IOException {
        String[] defaultPaths = {
            "src/main/resources/crawler-config.yaml",
            "src/main/resources/crawler-config.yml",
            "crawler-config.yaml",
            "crawler-config.yml",
            "config/crawler-config.yaml",
            "config/crawler-config.yml"
        };

        for (String defaultPath : defaultPaths) {
            Path path = Path.of(defaultPath);
            if (Files.exists(path)) {
                log.info("Using default config file: {}", path);
                return load(path);
            }
        }

        throw new IOException("No default config file found in any of these locations: " +
                            String.join(", ", defaultPaths));
    }
}
