package com.skmarket.crawler.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the sale-history table of the page a session is showing.
 */
@Slf4j
@RequiredArgsConstructor
public class SaleRecordExtractor {
    private static final Pattern NAME_WITH_QUANTITY = Pattern.compile("^(.*?)\\s+x(\\d{1,9})$");
    private static final DateTimeFormatter SITE_DATE_TIME = DateTimeFormatter.ofPattern("M/d/yyyy h:mm:ss a", Locale.US);
    private static final DateTimeFormatter SITE_DATE = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);
    private static final DateTimeFormatter ISO_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final Config.Selectors selectors;
    private final long tableTimeoutMs;

    /**
     * Waits for the table, then reads every row. Rows that cannot be read are skipped; a table
     * without rows yields no records.
     *
     * @throws NavigationTimeoutException when the table is not attached within the timeout
     */
    public List<SaleRecord> extract(PageSession session, int pageNumber) {
        session.waitFor(selectors.getTable(), tableTimeoutMs, WaitState.ATTACHED);
        List<PageElement> rows = session.queryAll(selectors.getRows());
        if (rows.isEmpty()) {
            log.debug("No rows found in table on page {}", pageNumber);
            return List.of();
        }

        List<SaleRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            try {
                records.add(extractRow(rows.get(i)));
            } catch (ExtractionException e) {
                log.debug("Skipping row {} on page {}: {}", i, pageNumber, e.getMessage());
            } catch (CrawlerException e) {
                log.warn("Error processing row {} on page {}: {}", i, pageNumber, e.getMessage());
            }
        }
        log.debug("Extracted {}/{} rows from page {}", records.size(), rows.size(), pageNumber);
        return records;
    }

    SaleRecord extractRow(PageElement row) {
        String nameText = cell(row, selectors.getName())
            .orElseThrow(() -> new ExtractionException("name not found"));
        String rawPrice = cell(row, selectors.getPrice())
            .orElseThrow(() -> new ExtractionException("price not found"));
        long price = parsePrice(rawPrice);

        String date = cell(row, selectors.getDate()).orElse("");
        String time = cell(row, selectors.getTime()).orElse("");
        String status = selectors.getStatus() != null ? cell(row, selectors.getStatus()).orElse(null) : null;

        String name = nameText;
        int quantity = 1;
        Matcher m = NAME_WITH_QUANTITY.matcher(nameText);
        if (m.matches()) {
            name = m.group(1).trim();
            quantity = Math.max(1, Integer.parseInt(m.group(2)));
        }

        return SaleRecord.builder()
            .itemName(name)
            .price(price)
            .quantity(quantity)
            .status(status)
            .timestamp(normalizeTimestamp((date + " " + time).trim()))
            .build();
    }

    private Optional<String> cell(PageElement row, String selector) {
        return row.query(selector).flatMap(PageElement::trimmedText);
    }

    static long parsePrice(String raw) {
        String digits = raw.replaceAll("[^\\d]", "");
        if (digits.isEmpty()) {
            throw new ExtractionException("price '" + raw + "' has no digits");
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new ExtractionException("price '" + raw + "' out of range", e);
        }
    }

    /**
     * {@code 3/14/2024 1:05:09 PM} becomes {@code 2024-03-14T13:05:09}; a bare date becomes midnight.
     * Anything else is kept as it was scraped.
     */
    static String normalizeTimestamp(String raw) {
        return parse(raw, SITE_DATE_TIME, LocalDateTime::from)
            .or(() -> parse(raw, SITE_DATE, LocalDate::from).map(LocalDate::atStartOfDay))
            .map(ISO_SECONDS::format)
            .orElse(raw);
    }

    private static <T> Optional<T> parse(String raw, DateTimeFormatter format, TemporalQuery<T> query) {
        try {
            return Optional.of(format.parse(raw, query));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
