package org.carball.profiler.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Input of one profiling run.
 *
 * @param records records to profile, may be empty; a {@code null} element counts as a record without keys
 * @param schema  optional Avro-style schema descriptor
 * @param topK    maximum frequent values per column; {@code null} or non-positive means the default
 */
public record ProfileRequest(
    List<? extends Map<String, ?>> records,
    JsonNode schema,
    Integer topK
) {

    public ProfileRequest {
        records = records == null ? List.of() : records;
    }

    public static ProfileRequest of(List<? extends Map<String, ?>> records) {
        return new ProfileRequest(records, null, null);
    }

    public int resolveTopK(int defaultTopK) {
        return topK != null && topK > 0 ? topK : defaultTopK;
    }
}
