package com.skmarket.crawler.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotWriterTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-14T13:05:09Z"), ZoneOffset.UTC);

    private final List<SaleRecord> records = List.of(
        SaleRecord.builder().itemName("Iron Ore").price(120).timestamp("2024-03-01T13:05:00").build(),
        SaleRecord.builder().itemName("Potion, Large").price(300).timestamp("2024-03-01T14:00:00").quantity(4).status("Sold").build());

    @Test
    void shouldWriteSimpleSnapshot() throws IOException {
        Path file = new SnapshotWriter(tempDir, false, clock).write(records, null).orElseThrow();

        assertThat(file.getFileName().toString()).isEqualTo("history_snapshot_20240314_130509.csv");
        assertThat(Files.readAllLines(file)).containsExactly(
            "name,price,datetime",
            "Iron Ore,120,2024-03-01T13:05:00",
            "\"Potion, Large\",300,2024-03-01T14:00:00");
    }

    @Test
    void shouldWriteRichSnapshotWithBatchTag() throws IOException {
        Path file = new SnapshotWriter(tempDir, true, clock).write(records, 7).orElseThrow();

        assertThat(file.getFileName().toString()).isEqualTo("history_snapshot_batch7_20240314_130509.csv");
        assertThat(Files.readAllLines(file)).containsExactly(
            "name,quantity,price,price_per_unit,status,datetime",
            "Iron Ore,1,120,120,,2024-03-01T13:05:00",
            "\"Potion, Large\",4,300,75,Sold,2024-03-01T14:00:00");
    }

    @Test
    void shouldSkipEmptySnapshot() {
        assertThat(new SnapshotWriter(tempDir, false, clock).write(List.of(), 1)).isEmpty();
    }
}
