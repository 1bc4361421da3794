package org.carball.profiler.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads records from a JSON array file or a JSON Lines file ({@code .jsonl}, {@code .ndjson}).
 */
@Slf4j
public class RecordLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RecordLoader() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<Map<String, Object>> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Records file not found: " + file);
        }

        List<Map<String, Object>> records = isJsonLines(file) ? loadJsonLines(file) : loadJsonArray(file);
        log.info("Loaded {} records from {}", records.size(), file);
        return records;
    }

    private List<Map<String, Object>> loadJsonArray(Path file) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of records in " + file);
        }

        List<Map<String, Object>> records = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            records.add(toRecord(node, file, index++));
        }
        return records;
    }

    private List<Map<String, Object>> loadJsonLines(Path file) throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                records.add(toRecord(objectMapper.readTree(line), file, lineNumber));
            }
        }
        return records;
    }

    private Map<String, Object> toRecord(JsonNode node, Path file, int position) throws IOException {
        if (node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IOException("Record " + position + " in " + file + " is not a JSON object");
        }
        return objectMapper.convertValue(node, RECORD_TYPE);
    }

    static boolean isJsonLines(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jsonl") || name.endsWith(".ndjson");
    }
}
