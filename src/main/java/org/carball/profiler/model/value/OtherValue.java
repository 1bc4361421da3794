package org.carball.profiler.model.value;

/**
 * Anything that is not a string, number, boolean, sequence or mapping.
 */
public record OtherValue(Object value) implements FieldValue {

    @Override
    public TypeCategory category() {
        return TypeCategory.OTHER;
    }
}
