package org.carball.profiler.model.value;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public final class FieldValues {

    private FieldValues() {
    }

    /**
     * Classifies a raw value. Sequences are checked before mappings; unknown types, primitive
     * arrays included, fall through to {@link OtherValue}.
     */
    public static FieldValue of(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof FieldValue fieldValue) {
            return fieldValue;
        }
        if (raw instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (raw instanceof Character character) {
            return new StringValue(character.toString());
        }
        if (raw instanceof Number number) {
            return new NumberValue(number);
        }
        if (raw instanceof Boolean bool) {
            return new BooleanValue(bool);
        }
        if (raw instanceof List<?> list) {
            return new SequenceValue(list);
        }
        if (raw instanceof Object[] array) {
            return new SequenceValue(Arrays.asList(array));
        }
        if (raw instanceof Map<?, ?> map) {
            return new MappingValue(map);
        }
        return new OtherValue(raw);
    }
}
