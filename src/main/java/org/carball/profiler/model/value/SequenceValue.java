package org.carball.profiler.model.value;

import java.util.List;

/**
 * A list or Java array. Elements are kept as raw objects and only serialized when a
 * frequency key is needed.
 */
public record SequenceValue(List<?> elements) implements FieldValue {

    @Override
    public TypeCategory category() {
        return TypeCategory.ARRAY;
    }
}
