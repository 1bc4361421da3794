package org.carball.profiler.model.value;

/**
 * A single record value, classified once when it enters the profiler.
 *
 * @see FieldValues#of(Object)
 */
public interface FieldValue {

    /**
     * @return the value's category, or {@code null} for {@link NullValue}
     */
    TypeCategory category();

    default boolean isNull() {
        return false;
    }

    /**
     * True only for numbers that are neither NaN nor infinite.
     */
    default boolean isFiniteNumber() {
        return false;
    }
}
