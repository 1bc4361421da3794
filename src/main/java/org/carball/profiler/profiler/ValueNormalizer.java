package org.carball.profiler.profiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.model.value.BooleanValue;
import org.carball.profiler.model.value.FieldValue;
import org.carball.profiler.model.value.MappingValue;
import org.carball.profiler.model.value.NumberValue;
import org.carball.profiler.model.value.OtherValue;
import org.carball.profiler.model.value.SequenceValue;
import org.carball.profiler.model.value.StringValue;

/**
 * Turns field values into the bounded strings used as frequency keys.
 */
@Slf4j
public class ValueNormalizer {

    public static final String UNSTRINGIFIABLE = "[Unstringifiable]";
    public static final String ELLIPSIS = "…";

    private final ObjectMapper objectMapper;
    private final int maxLength;

    public ValueNormalizer(int maxLength) {
        this(new ObjectMapper(), maxLength);
    }

    public ValueNormalizer(ObjectMapper objectMapper, int maxLength) {
        this.objectMapper = objectMapper;
        this.maxLength = maxLength;
    }

    /**
     * @return the truncated frequency key, or {@code null} for a null value
     */
    public String toKey(FieldValue value) {
        String canonical = canonicalize(value);
        return canonical == null ? null : truncate(canonical);
    }

    public String canonicalize(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value instanceof StringValue string) {
            return string.value();
        }
        if (value instanceof NumberValue number) {
            return number.toCanonicalString();
        }
        if (value instanceof BooleanValue bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof SequenceValue sequence) {
            return serialize(sequence.elements());
        }
        if (value instanceof MappingValue mapping) {
            return serialize(mapping.entries());
        }
        if (value instanceof OtherValue other) {
            return String.valueOf(other.value());
        }
        return String.valueOf(value);
    }

    public String truncate(String canonical) {
        if (canonical.length() <= maxLength) {
            return canonical;
        }
        return canonical.substring(0, maxLength) + ELLIPSIS;
    }

    private String serialize(Object structure) {
        try {
            return objectMapper.writeValueAsString(structure);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize {} value: {}", structure.getClass().getSimpleName(), e.getMessage());
            return UNSTRINGIFIABLE;
        }
    }
}
