package org.carball.profiler.model.value;

public enum NullValue implements FieldValue {
    INSTANCE;

    @Override
    public TypeCategory category() {
        return null;
    }

    @Override
    public boolean isNull() {
        return true;
    }
}
