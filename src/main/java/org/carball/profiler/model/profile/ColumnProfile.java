package org.carball.profiler.model.profile;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Builder;
import lombok.Value;
import org.carball.profiler.model.schema.LogicalType;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"typeHint", "logicalType", "nullCount", "nullRate", "nonNullCount", "numericRatio",
        "topK", "topKLimited", "top1Rate", "min", "max", "minDisplay", "maxDisplay", "minMaxReason", "minMaxFlat"})
public class ColumnProfile {

    TypeHint typeHint;

    /** Null when the schema carries no logical type for the column. */
    LogicalType logicalType;

    long nullCount;
    double nullRate;
    long nonNullCount;
    double numericRatio;

    @Builder.Default
    List<TopKEntry> topK = List.of();

    boolean topKLimited;
    double top1Rate;

    // Present only when the column qualifies for extrema
    @JsonSerialize(using = ExtremaSerializer.class)
    Double min;
    @JsonSerialize(using = ExtremaSerializer.class)
    Double max;
    String minDisplay;
    String maxDisplay;

    String minMaxReason;
    boolean minMaxFlat;

    public boolean hasMinMax() {
        return min != null && max != null;
    }
}
