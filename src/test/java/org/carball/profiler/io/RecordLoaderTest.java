package org.carball.profiler.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RecordLoaderTest {

    @TempDir
    Path tempDir;

    private RecordLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RecordLoader();
    }

    @Test
    void shouldLoadJsonArray() throws Exception {
        // Given
        Path file = tempDir.resolve("records.json");
        Files.writeString(file, """
            [
              {"id": 1, "name": "a", "tags": ["x", "y"], "meta": {"k": true}},
              {"id": 2.5, "name": null},
              null
            ]
            """);

        // When
        List<Map<String, Object>> records = loader.load(file);

        // Then
        assertThat(records).hasSize(3);
        assertThat(records.get(0)).containsKeys("id", "name", "tags", "meta");
        assertThat(records.get(0).get("id")).isEqualTo(1);
        assertThat(records.get(0).get("tags")).isEqualTo(List.of("x", "y"));
        assertThat(records.get(0).get("meta")).isEqualTo(Map.of("k", true));
        assertThat(records.get(1).get("id")).isEqualTo(2.5);
        assertThat(records.get(1)).containsEntry("name", null);
        assertThat(records.get(2)).isNull();
    }

    @Test
    void shouldLoadJsonLinesSkippingBlankLines() throws Exception {
        // Given
        Path file = tempDir.resolve("records.jsonl");
        Files.writeString(file, "{\"a\": 1}\n\n{\"b\": \"two\"}\n");

        // When
        List<Map<String, Object>> records = loader.load(file);

        // Then
        assertThat(records).hasSize(2);
        assertThat(records.get(1)).containsEntry("b", "two");
    }

    @Test
    void shouldRejectNonArrayDocument() throws Exception {
        Path file = tempDir.resolve("object.json");
        Files.writeString(file, "{\"a\": 1}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Expected a JSON array");
    }

    @Test
    void shouldRejectScalarRecords() throws Exception {
        Path file = tempDir.resolve("scalars.ndjson");
        Files.writeString(file, "{\"a\": 1}\n42\n");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Record 2");
    }

    @Test
    void shouldReportMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Records file not found");
    }
}
