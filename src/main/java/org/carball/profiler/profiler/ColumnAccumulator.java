package org.carball.profiler.profiler;

import lombok.AccessLevel;
import lombok.Getter;
import org.carball.profiler.model.schema.LogicalType;
import org.carball.profiler.model.value.FieldValue;
import org.carball.profiler.model.value.NumberValue;
import org.carball.profiler.model.value.TypeCategory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Running statistics of one column during a single profiling pass.
 */
@Getter
public class ColumnAccumulator {

    private final String column;
    private final LogicalType logicalType;

    private long nullCount;
    private long nonNullCount;
    private long numericCount;
    @Getter(AccessLevel.NONE)
    private final Map<TypeCategory, Long> typeCounts = new EnumMap<>(TypeCategory.class);

    private Double numericMin;
    private Double numericMax;
    private Double temporalMin;
    private Double temporalMax;

    private final FrequencyTable frequencies;

    public ColumnAccumulator(String column, LogicalType logicalType, int maxDistinctValues) {
        this.column = column;
        this.logicalType = logicalType;
        this.frequencies = new FrequencyTable(maxDistinctValues);
        for (TypeCategory category : TypeCategory.values()) {
            typeCounts.put(category, 0L);
        }
    }

    /**
     * @param key frequency key of the value, ignored for nulls
     */
    public void accept(FieldValue value, String key) {
        if (value == null || value.isNull()) {
            nullCount++;
            return;
        }

        nonNullCount++;
        typeCounts.merge(value.category(), 1L, Long::sum);

        if (key != null) {
            frequencies.record(key);
        }

        if (value.isFiniteNumber()) {
            double number = ((NumberValue) value).doubleValue();
            numericCount++;
            updateNumericRange(number);
            if (isTimestamp()) {
                updateTemporalRange(logicalType.toEpochMillis(number));
            }
        }
    }

    private void updateNumericRange(double value) {
        if (numericMin == null || value < numericMin) {
            numericMin = value;
        }
        if (numericMax == null || value > numericMax) {
            numericMax = value;
        }
    }

    private void updateTemporalRange(double epochMillis) {
        if (temporalMin == null || epochMillis < temporalMin) {
            temporalMin = epochMillis;
        }
        if (temporalMax == null || epochMillis > temporalMax) {
            temporalMax = epochMillis;
        }
    }

    public boolean isTimestamp() {
        return logicalType != null && logicalType.isTimestamp();
    }

    public long getTypeCount(TypeCategory category) {
        return typeCounts.get(category);
    }

    public long getProcessedCount() {
        return nullCount + nonNullCount;
    }

    public boolean isOverflowed() {
        return frequencies.isOverflowed();
    }
}
