package org.carball.profiler.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an Avro schema ({@code .avsc}) as a JSON tree.
 */
@Slf4j
public class SchemaLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonNode load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Schema file not found: " + file);
        }

        JsonNode schema = objectMapper.readTree(file.toFile());
        if (schema == null || !schema.isObject()) {
            throw new IOException("Schema file " + file + " does not contain a JSON object");
        }
        log.info("Loaded schema '{}' from {}", schema.path("name").asText("(unnamed)"), file);
        return schema;
    }
}
