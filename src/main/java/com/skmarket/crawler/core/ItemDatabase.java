package com.skmarket.crawler.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON file holding every known sale, keyed by item name:
 * <pre>
 * { "Iron Ore": [ {"price": 120, "timestamp": "2024-03-01T13:05:00", "type": "sale"} ] }
 * </pre>
 * Saves go to a sibling temp file that is synced and then moved over the database, so a crash
 * mid-write leaves the previous file untouched.
 */
@Slf4j
public class ItemDatabase {
    static final String TEMP_SUFFIX = ".tmp";
    private static final TypeReference<LinkedHashMap<String, List<Entry>>> DB_TYPE = new TypeReference<>() {};

    @Getter private final Path path;
    private final ObjectMapper objectMapper;

    public ItemDatabase(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DedupStore load() throws IOException {
        DedupStore store = new DedupStore();
        if (!Files.exists(path)) {
            log.info("No existing database at {}, starting empty", path);
            return store;
        }
        Map<String, List<Entry>> raw = objectMapper.readValue(path.toFile(), DB_TYPE);
        if (raw == null) {
            throw new IOException("Database " + path + " does not hold a JSON object");
        }
        raw.forEach((name, entries) -> {
            if (entries == null) return;
            for (Entry e : entries) {
                if (e == null || e.getTimestamp() == null) continue;
                store.add(e.toRecord(name));
            }
        });
        log.info("Loaded {} item(s) with {} sale(s) from {}", store.itemCount(), store.recordCount(), path);
        return store;
    }

    public void save(DedupStore store) throws IOException {
        Map<String, List<Entry>> raw = new LinkedHashMap<>();
        for (ItemHistory history : store.histories()) {
            List<Entry> entries = new ArrayList<>(history.size());
            for (SaleRecord r : history.getSales()) {
                entries.add(Entry.of(r));
            }
            raw.put(history.getItemName(), entries);
        }

        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = dir.resolve(path.getFileName() + TEMP_SUFFIX);
        try (OutputStream out = Files.newOutputStream(temp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            objectMapper.writeValue(out, raw);
        }
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported on {}, falling back to plain replace", dir);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("Database saved to {} ({} items, {} sales)", path, store.itemCount(), store.recordCount());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private long price;
        private String timestamp;
        private String type = "sale";
        private Integer quantity;
        private String status;

        static Entry of(SaleRecord r) {
            return new Entry(r.getPrice(), r.getTimestamp(), "sale",
                r.getQuantity() != 1 ? r.getQuantity() : null, r.getStatus());
        }

        SaleRecord toRecord(String itemName) {
            return SaleRecord.builder()
                .itemName(itemName)
                .price(price)
                .timestamp(timestamp)
                .quantity(quantity != null && quantity > 0 ? quantity : 1)
                .status(status)
                .build();
        }
    }
}
