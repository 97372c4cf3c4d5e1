package com.skmarket.crawler.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ConfigTest {

    @Test
    void shouldProvideSiteDefaults() {
        Config config = new Config();

        assertThat(config.getCrawl().getWorkers()).isEqualTo(20);
        assertThat(config.getCrawl().getTotalPages()).isEqualTo(200);
        assertThat(config.getCrawl().historyUrl()).isEqualTo("https://www.sk-ah.com/history");
        assertThat(config.getCheckpoint().getEveryPages()).isEqualTo(40);
        assertThat(config.getOutput().databasePath()).isEqualTo(Path.of("sk_market_data", "item_database.json"));
        assertThat(config.getSelectors().getStatus()).isNull();
    }

    @Test
    void shouldLoadYamlOverridesAndKeepOtherDefaults() throws IOException, URISyntaxException {
        Path file = Path.of(getClass().getResource("/test-config.yaml").toURI());

        Config config = Config.load(file);

        assertThat(config.getName()).isEqualTo("test-run");
        assertThat(config.getBrowser().isHeadless()).isFalse();
        assertThat(config.getCrawl().getPartition()).isEqualTo(PartitionStrategy.SEQUENTIAL);
        assertThat(config.getCrawl().historyUrl()).isEqualTo("https://example.test/history");
        assertThat(config.getNavigation().getPollAttempts()).isEqualTo(4);
        assertThat(config.getNavigation().getMaxStalledClicks()).isEqualTo(10);
        assertThat(config.getRateLimit().getPermitsPerSecond()).isEqualTo(5.0);
        assertThat(config.getOutput().isRichSnapshot()).isTrue();
        assertThat(config.getOutput().isResume()).isFalse();
        assertThat(config.getSelectors().getNextButton()).isEqualTo("xpath=.//button[contains(., 'Next')]");
    }
}
