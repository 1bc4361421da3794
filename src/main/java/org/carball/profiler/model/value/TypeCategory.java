package org.carball.profiler.model.value;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse type of a non-null field value. Declaration order is the tie-break order
 * used when ranking category counts.
 */
public enum TypeCategory {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    OTHER("other");

    private final String label;

    TypeCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
