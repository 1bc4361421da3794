package org.carball.profiler.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Everything a profiling run reads but never changes. Loaded from YAML as
 * <pre>
 * limits:
 *   max_distinct_values: 50000
 * scoring:
 *   null_rate_threshold: 0.3
 * </pre>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProfilerConfig {

    @Builder.Default
    @JsonProperty("limits")
    ProfilerLimits limits = ProfilerLimits.defaults();

    @Builder.Default
    @JsonProperty("scoring")
    ScoringConfig scoring = ScoringConfig.defaults();

    public static ProfilerConfig defaults() {
        return ProfilerConfig.builder().build();
    }

    public void validate() {
        limits.validate();
        scoring.validate();
    }

    public String getConfigurationSummary() {
        return "Limits: " + limits.getDescription() + " | Scoring: " + scoring.getDescription();
    }
}
