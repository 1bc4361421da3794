package org.carball.profiler.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Capacity constants and ratios of the single profiling pass.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class ProfilerLimits {

    /** Distinct frequency keys kept per column before the table overflows. */
    @Builder.Default
    @JsonProperty("max_distinct_values")
    int maxDistinctValues = 50_000;

    /** Frequency keys longer than this are truncated. */
    @Builder.Default
    @JsonProperty("max_value_length")
    int maxValueLength = 200;

    @Builder.Default
    @JsonProperty("numeric_threshold")
    double numericThreshold = 0.8;

    @Builder.Default
    @JsonProperty("dominant_type_threshold")
    double dominantTypeThreshold = 0.8;

    @Builder.Default
    @JsonProperty("progress_interval")
    int progressInterval = 1000;

    @Builder.Default
    @JsonProperty("default_top_k")
    int defaultTopK = 10;

    public static ProfilerLimits defaults() {
        return ProfilerLimits.builder().build();
    }

    /**
     * Rejects limits a profiling pass cannot run with and warns about questionable ratios.
     *
     * @throws IllegalArgumentException when a count or length limit is not positive
     */
    public void validate() {
        requirePositive("max_distinct_values", maxDistinctValues);
        requirePositive("max_value_length", maxValueLength);
        requirePositive("progress_interval", progressInterval);
        requirePositive("default_top_k", defaultTopK);

        if (numericThreshold <= 0 || numericThreshold > 1) {
            log.warn("Numeric threshold ({}) should be in (0, 1]", numericThreshold);
        }

        if (dominantTypeThreshold <= 0 || dominantTypeThreshold > 1) {
            log.warn("Dominant type threshold ({}) should be in (0, 1]", dominantTypeThreshold);
        }

        log.debug("Using limits: {}", getDescription());
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Limit " + name + " must be positive: " + value);
        }
    }

    public String getDescription() {
        return String.format(Locale.ROOT,
                "maxDistinct=%d, maxLength=%d, numeric>=%.2f, dominantType>=%.2f, progressEvery=%d, topK=%d",
                maxDistinctValues, maxValueLength, numericThreshold, dominantTypeThreshold,
                progressInterval, defaultTopK);
    }
}
