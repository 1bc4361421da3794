package org.carball.profiler.model.value;

import java.util.Map;

public record MappingValue(Map<?, ?> entries) implements FieldValue {

    @Override
    public TypeCategory category() {
        return TypeCategory.OBJECT;
    }
}
