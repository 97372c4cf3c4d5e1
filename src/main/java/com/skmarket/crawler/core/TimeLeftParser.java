package com.skmarket.crawler.core;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts the auction "Time Left" column into minutes: {@code 1h30m} is 90, {@code 45m} is 45,
 * {@code 2h} is 120. The site shows {@code -} or {@code Very Short} for auctions about to close,
 * which count as 0.
 */
@Slf4j
public final class TimeLeftParser {
    private static final Pattern HOURS = Pattern.compile("(\\d+)\\s*h");
    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*m");

    private TimeLeftParser() {
    }

    public static int parseMinutes(String timeText) {
        if (timeText == null || timeText.isBlank()) {
            return 0;
        }
        String raw = timeText.trim().toLowerCase(Locale.ROOT);
        if (raw.equals("-") || raw.equals("very short")) {
            return 0;
        }
        Matcher hours = HOURS.matcher(raw);
        Matcher minutes = MINUTES.matcher(raw);
        boolean hasHours = hours.find();
        boolean hasMinutes = minutes.find();
        try {
            if (hasHours || hasMinutes) {
                int total = 0;
                if (hasHours) total = Math.multiplyExact(Integer.parseInt(hours.group(1)), 60);
                if (hasMinutes) total = Math.addExact(total, Integer.parseInt(minutes.group(1)));
                log.trace("Parsed time left '{}' -> {} minutes", timeText, total);
                return total;
            }
            return Integer.parseInt(raw);
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("Could not parse time left: '{}'", timeText);
            return 0;
        }
    }
}
