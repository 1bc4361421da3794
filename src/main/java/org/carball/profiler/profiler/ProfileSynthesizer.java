package org.carball.profiler.profiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.config.ProfilerLimits;
import org.carball.profiler.model.profile.ColumnProfile;
import org.carball.profiler.model.profile.TopKEntry;
import org.carball.profiler.model.profile.TypeHint;
import org.carball.profiler.model.value.TypeCategory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts the raw counters of an accumulator into a read-only {@link ColumnProfile}.
 */
@Slf4j
public class ProfileSynthesizer {

    static final String MIXED_REASON = "mixed types, no min/max computed";
    static final String NOT_NUMERIC_REASON = "not a numeric column, no min/max computed";

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final ProfilerLimits limits;

    public ProfileSynthesizer(ProfilerLimits limits) {
        this.limits = limits;
    }

    public ColumnProfile synthesize(ColumnAccumulator stats, long totalRecords, int topK) {
        long nonNullCount = stats.getNonNullCount();
        double nullRate = totalRecords > 0 ? (double) stats.getNullCount() / totalRecords : 0;
        double numericRatio = nonNullCount > 0 ? (double) stats.getNumericCount() / nonNullCount : 0;

        List<TopKEntry> topKValues = computeTopK(stats, nonNullCount, topK);
        double top1Rate = topKValues.isEmpty() ? 0 : topKValues.get(0).rate();

        ColumnProfile.ColumnProfileBuilder profile = ColumnProfile.builder()
                .typeHint(computeTypeHint(stats))
                .logicalType(stats.getLogicalType())
                .nullCount(stats.getNullCount())
                .nullRate(nullRate)
                .nonNullCount(nonNullCount)
                .numericRatio(numericRatio)
                .topK(topKValues)
                .topKLimited(stats.isOverflowed())
                .top1Rate(top1Rate);

        applyMinMax(profile, stats, numericRatio);

        ColumnProfile result = profile.build();
        log.debug("Column '{}': type={}, nullRate={}, topK={}, limited={}",
                stats.getColumn(), result.getTypeHint(), nullRate, topKValues.size(), result.isTopKLimited());
        return result;
    }

    TypeHint computeTypeHint(ColumnAccumulator stats) {
        long total = stats.getNonNullCount();
        if (total == 0) {
            return TypeHint.UNKNOWN;
        }
        if (stats.isTimestamp()) {
            return TypeHint.DATETIME;
        }

        // First category wins ties, in declaration order
        TypeCategory topType = TypeCategory.STRING;
        long topCount = -1;
        for (TypeCategory category : TypeCategory.values()) {
            long count = stats.getTypeCount(category);
            if (count > topCount) {
                topType = category;
                topCount = count;
            }
        }

        double ratio = (double) topCount / total;
        return ratio >= limits.getDominantTypeThreshold() ? TypeHint.fromCategory(topType) : TypeHint.MIXED;
    }

    private List<TopKEntry> computeTopK(ColumnAccumulator stats, long nonNullCount, int topK) {
        return stats.getFrequencies().mostFrequent(topK).stream()
                .map(entry -> toEntry(entry, nonNullCount))
                .collect(Collectors.toList());
    }

    private TopKEntry toEntry(Map.Entry<String, Long> entry, long nonNullCount) {
        double rate = nonNullCount > 0 ? (double) entry.getValue() / nonNullCount : 0;
        return new TopKEntry(entry.getKey(), entry.getValue(), rate);
    }

    private void applyMinMax(ColumnProfile.ColumnProfileBuilder profile,
                             ColumnAccumulator stats,
                             double numericRatio) {
        boolean eligible = numericRatio >= limits.getNumericThreshold();
        Double min = null;
        Double max = null;

        if (eligible && stats.isTimestamp() && stats.getTemporalMin() != null && stats.getTemporalMax() != null) {
            min = stats.getTemporalMin();
            max = stats.getTemporalMax();
            profile.minDisplay(formatTimestamp(min)).maxDisplay(formatTimestamp(max));
        } else if (eligible && !stats.isTimestamp() && stats.getNumericMin() != null && stats.getNumericMax() != null) {
            min = stats.getNumericMin();
            max = stats.getNumericMax();
        } else if (stats.getNonNullCount() > 0) {
            profile.minMaxReason(numericRatio > 0 ? MIXED_REASON : NOT_NUMERIC_REASON);
        }

        profile.min(min)
                .max(max)
                .minMaxFlat(min != null && max != null && min.doubleValue() == max.doubleValue());
    }

    /**
     * Renders epoch milliseconds as an ISO-8601 UTC instant; sub-millisecond parts are
     * truncated toward zero.
     */
    static String formatTimestamp(double epochMillis) {
        return DISPLAY_FORMAT.format(Instant.ofEpochMilli((long) epochMillis));
    }
}
