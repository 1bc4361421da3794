package org.carball.profiler.model.value;

public record BooleanValue(boolean value) implements FieldValue {

    @Override
    public TypeCategory category() {
        return TypeCategory.BOOLEAN;
    }
}
