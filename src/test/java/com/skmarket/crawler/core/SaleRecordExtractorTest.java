package com.skmarket.crawler.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SaleRecordExtractorTest {

    private final Config.Selectors selectors = new Config.Selectors();
    private final SaleRecordExtractor extractor = new SaleRecordExtractor(selectors, 100);

    private List<SaleRecord> extractSingle(String[]... rows) {
        List<List<String[]>> pages = new ArrayList<>();
        pages.add(Arrays.asList(rows));
        FakeListingDriver driver = new FakeListingDriver(selectors, pages);
        return extractor.extract(driver.openSession(), 1);
    }

    @Test
    void shouldReadWellFormedRows() {
        List<SaleRecord> records = extractSingle(
            new String[]{"Iron Ore", "1,250 cr", "3/14/2024", "1:05:09 PM"},
            new String[]{"Copper Bar", "80", "12/1/2023", "9:00:00 AM"});

        assertThat(records).hasSize(2);
        SaleRecord first = records.get(0);
        assertThat(first.getItemName()).isEqualTo("Iron Ore");
        assertThat(first.getPrice()).isEqualTo(1250);
        assertThat(first.getQuantity()).isEqualTo(1);
        assertThat(first.getTimestamp()).isEqualTo("2024-03-14T13:05:09");
        assertThat(records.get(1).getTimestamp()).isEqualTo("2023-12-01T09:00:00");
    }

    @Test
    void shouldSplitQuantityFromName() {
        List<SaleRecord> records = extractSingle(new String[]{"Health Potion x3", "300", "3/14/2024", "1:05:09 PM"});

        assertThat(records).singleElement().satisfies(r -> {
            assertThat(r.getItemName()).isEqualTo("Health Potion");
            assertThat(r.getQuantity()).isEqualTo(3);
            assertThat(r.pricePerUnit()).isEqualTo(100.0);
        });
    }

    @Test
    void shouldSkipMalformedRowsAndKeepTheRest() {
        List<SaleRecord> records = extractSingle(
            new String[]{null, "100", "3/14/2024", "1:05:09 PM"},
            new String[]{"No Price", "n/a", "3/14/2024", "1:05:09 PM"},
            new String[]{"Missing Price Cell", null, "3/14/2024", "1:05:09 PM"},
            new String[]{"Good", "42", "3/14/2024", "1:05:09 PM"});

        assertThat(records).extracting(SaleRecord::getItemName).containsExactly("Good");
    }

    @Test
    void shouldFailWhenTableNeverAppears() {
        FakeListingDriver driver = FakeListingDriver.withPages(selectors, 1, 1);
        driver.pagesWithoutTable.add(1);
        PageSession session = driver.openSession();

        assertThatThrownBy(() -> extractor.extract(session, 1)).isInstanceOf(NavigationTimeoutException.class);
    }

    @Test
    void shouldReturnNothingForTableWithoutRows() {
        FakeListingDriver driver = FakeListingDriver.withPages(selectors, 1, 2);
        driver.pagesWithoutRows.add(1);

        assertThat(extractor.extract(driver.openSession(), 1)).isEmpty();
    }

    @Test
    void shouldKeepOnlyDigitsOfPrice() {
        assertThat(SaleRecordExtractor.parsePrice("1,234,567 cr")).isEqualTo(1234567L);
        assertThat(SaleRecordExtractor.parsePrice(" 15 ")).isEqualTo(15L);
        assertThatThrownBy(() -> SaleRecordExtractor.parsePrice("free")).isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> SaleRecordExtractor.parsePrice("99999999999999999999"))
            .isInstanceOf(ExtractionException.class);
    }

    @Test
    void shouldNormalizeTimestamps() {
        assertThat(SaleRecordExtractor.normalizeTimestamp("3/14/2024 1:05:09 PM")).isEqualTo("2024-03-14T13:05:09");
        assertThat(SaleRecordExtractor.normalizeTimestamp("3/14/2024 12:00:00 AM")).isEqualTo("2024-03-14T00:00:00");
        assertThat(SaleRecordExtractor.normalizeTimestamp("3/14/2024")).isEqualTo("2024-03-14T00:00:00");
        assertThat(SaleRecordExtractor.normalizeTimestamp("yesterday")).isEqualTo("yesterday");
    }

    @Test
    void shouldReadStatusWhenSelectorConfigured() {
        selectors.setStatus("xpath=./td[4]");

        List<SaleRecord> records = extractSingle(new String[]{"Iron Ore", "10", "3/14/2024", "1:05:09 PM", "Sold"});

        assertThat(records).singleElement().extracting(SaleRecord::getStatus).isEqualTo("Sold");
    }
}
