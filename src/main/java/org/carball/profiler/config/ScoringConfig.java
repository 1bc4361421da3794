package org.carball.profiler.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Weights and thresholds of the suspicious-column rules.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class ScoringConfig {

    @Builder.Default
    @JsonProperty("null_rate_threshold")
    double nullRateThreshold = 0.3;

    @Builder.Default
    @JsonProperty("null_rate_max")
    int nullRateMax = 40;

    @Builder.Default
    @JsonProperty("top1_rate_threshold")
    double top1RateThreshold = 0.95;

    @Builder.Default
    @JsonProperty("top1_rate_max")
    int top1RateMax = 30;

    @Builder.Default
    @JsonProperty("flat_value_score")
    int flatValueScore = 10;

    @Builder.Default
    @JsonProperty("freq_overflow_score")
    int freqOverflowScore = 8;

    public static ScoringConfig defaults() {
        return ScoringConfig.builder().build();
    }

    /**
     * Logs a warning for every value the scorer cannot use sensibly.
     */
    public void validate() {
        if (nullRateThreshold < 0 || nullRateThreshold >= 1) {
            log.warn("Null rate threshold ({}) should be in [0, 1)", nullRateThreshold);
        }

        if (top1RateThreshold < 0 || top1RateThreshold >= 1) {
            log.warn("Top1 rate threshold ({}) should be in [0, 1)", top1RateThreshold);
        }

        if (nullRateMax < 0 || top1RateMax < 0 || flatValueScore < 0 || freqOverflowScore < 0) {
            log.warn("Scores should not be negative: nullRateMax={}, top1RateMax={}, flatValueScore={}, freqOverflowScore={}",
                    nullRateMax, top1RateMax, flatValueScore, freqOverflowScore);
        }

        log.debug("Using scoring config: {}", getDescription());
    }

    public String getDescription() {
        return String.format(Locale.ROOT,
                "nullRate>=%.2f (max %d), top1Rate>=%.2f (max %d), flat=%d, overflow=%d",
                nullRateThreshold, nullRateMax, top1RateThreshold, top1RateMax,
                flatValueScore, freqOverflowScore);
    }
}
