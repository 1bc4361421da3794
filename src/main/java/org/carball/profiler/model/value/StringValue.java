package org.carball.profiler.model.value;

public record StringValue(String value) implements FieldValue {

    @Override
    public TypeCategory category() {
        return TypeCategory.STRING;
    }
}
