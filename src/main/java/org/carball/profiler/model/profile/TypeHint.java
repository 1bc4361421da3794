package org.carball.profiler.model.profile;

import com.fasterxml.jackson.annotation.JsonValue;
import org.carball.profiler.model.value.TypeCategory;

public enum TypeHint {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    OTHER("other"),
    DATETIME("datetime"),
    MIXED("mixed"),
    UNKNOWN("unknown");

    private final String label;

    TypeHint(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static TypeHint fromCategory(TypeCategory category) {
        return switch (category) {
            case STRING -> STRING;
            case NUMBER -> NUMBER;
            case BOOLEAN -> BOOLEAN;
            case OBJECT -> OBJECT;
            case ARRAY -> ARRAY;
            case OTHER -> OTHER;
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
