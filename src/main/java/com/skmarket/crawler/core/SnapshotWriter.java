package com.skmarket.crawler.core;

import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes CSV snapshots of freshly scraped history rows next to the item database.
 */
@Slf4j
public class SnapshotWriter {
    static final String[] SIMPLE_HEADER = {"name", "price", "datetime"};
    static final String[] RICH_HEADER = {"name", "quantity", "price", "price_per_unit", "status", "datetime"};
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path baseDir;
    private final boolean rich;
    private final Clock clock;

    public SnapshotWriter(Config.Output cfg) {
        this(Path.of(cfg.getDir()), cfg.isRichSnapshot(), Clock.systemDefaultZone());
    }

    SnapshotWriter(Path baseDir, boolean rich, Clock clock) {
        this.baseDir = baseDir;
        this.rich = rich;
        this.clock = clock;
    }

    /**
     * @param batchNumber checkpoint sequence number, or null for a one-off snapshot
     * @return the written file, empty when there was nothing to write or the write failed
     */
    public Optional<Path> write(List<SaleRecord> records, Integer batchNumber) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        String batchTag = batchNumber != null ? "_batch" + batchNumber : "";
        Path path = baseDir.resolve("history_snapshot" + batchTag + "_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".csv");
        try {
            Files.createDirectories(baseDir);
            try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                 CSVWriter csv = new CSVWriter(w)) {
                csv.writeNext(rich ? RICH_HEADER : SIMPLE_HEADER, false);
                for (SaleRecord r : records) {
                    csv.writeNext(rich ? richRow(r) : simpleRow(r), false);
                }
            }
            log.info("History snapshot saved to {} ({} rows)", path, records.size());
            return Optional.of(path);
        } catch (IOException e) {
            log.error("Failed to write snapshot {}", path, e);
            return Optional.empty();
        }
    }

    private String[] simpleRow(SaleRecord r) {
        return new String[]{r.getItemName(), String.valueOf(r.getPrice()), r.getTimestamp()};
    }

    private String[] richRow(SaleRecord r) {
        return new String[]{
            r.getItemName(),
            String.valueOf(r.getQuantity()),
            String.valueOf(r.getPrice()),
            formatUnitPrice(r.pricePerUnit()),
            toStringSafe(r.getStatus()),
            r.getTimestamp()
        };
    }

    private static String formatUnitPrice(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static String toStringSafe(Object v) {
        return v == null ? "" : String.valueOf(v);
    }
}
