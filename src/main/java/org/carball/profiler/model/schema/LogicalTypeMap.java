package org.carball.profiler.model.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class LogicalTypeMap {

    private static final LogicalTypeMap EMPTY = new LogicalTypeMap(Map.of());

    private final Map<String, LogicalType> types;

    private LogicalTypeMap(Map<String, LogicalType> types) {
        this.types = types;
    }

    public static LogicalTypeMap empty() {
        return EMPTY;
    }

    public static LogicalTypeMap of(Map<String, LogicalType> types) {
        if (types.isEmpty()) {
            return EMPTY;
        }
        return new LogicalTypeMap(Collections.unmodifiableMap(new LinkedHashMap<>(types)));
    }

    public Optional<LogicalType> get(String column) {
        return Optional.ofNullable(types.get(column));
    }

    public Map<String, LogicalType> asMap() {
        return types;
    }

    public int size() {
        return types.size();
    }

    @Override
    public String toString() {
        return types.toString();
    }
}
