package org.carball.profiler.model.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A logical-type annotation from the schema, e.g. {@code timestamp-millis} over a long.
 */
public record LogicalType(String tag) {

    public static final LogicalType TIMESTAMP_MILLIS = new LogicalType("timestamp-millis");
    public static final LogicalType TIMESTAMP_MICROS = new LogicalType("timestamp-micros");

    public LogicalType {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Logical type tag must not be blank");
        }
    }

    public boolean isTimestamp() {
        return equals(TIMESTAMP_MILLIS) || equals(TIMESTAMP_MICROS);
    }

    /**
     * Converts a raw timestamp value to epoch milliseconds.
     */
    public double toEpochMillis(double raw) {
        return equals(TIMESTAMP_MICROS) ? raw / 1000 : raw;
    }

    @JsonValue
    @Override
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
