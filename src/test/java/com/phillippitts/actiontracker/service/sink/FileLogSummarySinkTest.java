package com.phillippitts.actiontracker.service.sink;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileLogSummarySinkTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsTimestampedEntries() throws Exception {
        Path file = tempDir.resolve("logs/action_tracker.log");

        try (FileLogSummarySink sink = new FileLogSummarySink(file)) {
            sink.write("first summary");
            sink.write("second summary");
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(content).containsPattern("\\[\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\] INFO: \n");
        assertThat(content).contains("first summary");
        assertThat(content.indexOf("first summary")).isLessThan(content.indexOf("second summary"));
    }

    @Test
    void keepsExistingContent() throws Exception {
        Path file = tempDir.resolve("action_tracker.log");
        Files.writeString(file, "previous run\n");

        try (FileLogSummarySink sink = new FileLogSummarySink(file)) {
            sink.write("next run");
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(content).startsWith("previous run\n");
        assertThat(content).contains("next run");
    }
}
