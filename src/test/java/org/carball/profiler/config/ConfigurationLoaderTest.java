package org.carball.profiler.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultConfiguration() throws Exception {
        // When
        ProfilerConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(null, new String[0]);

        // Then
        assertThat(config.getLimits().getMaxDistinctValues()).isEqualTo(50_000);
        assertThat(config.getLimits().getMaxValueLength()).isEqualTo(200);
        assertThat(config.getLimits().getNumericThreshold()).isEqualTo(0.8);
        assertThat(config.getLimits().getProgressInterval()).isEqualTo(1000);
        assertThat(config.getLimits().getDefaultTopK()).isEqualTo(10);
        assertThat(config.getScoring().getNullRateThreshold()).isEqualTo(0.3);
        assertThat(config.getScoring().getNullRateMax()).isEqualTo(40);
        assertThat(config.getScoring().getTop1RateThreshold()).isEqualTo(0.95);
        assertThat(config.getScoring().getTop1RateMax()).isEqualTo(30);
        assertThat(config.getScoring().getFlatValueScore()).isEqualTo(10);
        assertThat(config.getScoring().getFreqOverflowScore()).isEqualTo(8);
    }

    @Test
    void shouldLoadPartialYamlAndKeepOtherDefaults() throws Exception {
        // Given
        Path yaml = tempDir.resolve("profiler.yml");
        Files.writeString(yaml, """
            limits:
              max_distinct_values: 1000
            scoring:
              null_rate_threshold: 0.5
              flat_value_score: 15
            """);

        // When
        ProfilerConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(yaml, new String[0]);

        // Then
        assertThat(config.getLimits().getMaxDistinctValues()).isEqualTo(1000);
        assertThat(config.getLimits().getMaxValueLength()).isEqualTo(200);
        assertThat(config.getScoring().getNullRateThreshold()).isEqualTo(0.5);
        assertThat(config.getScoring().getFlatValueScore()).isEqualTo(15);
        assertThat(config.getScoring().getTop1RateMax()).isEqualTo(30);
    }

    @Test
    void shouldUseDefaultsForMissingSections() throws Exception {
        Path yaml = tempDir.resolve("scoring-only.yml");
        Files.writeString(yaml, """
            scoring:
              top1_rate_max: 50
            """);

        ProfilerConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(yaml, new String[0]);

        assertThat(config.getLimits().getMaxDistinctValues()).isEqualTo(50_000);
        assertThat(config.getScoring().getTop1RateMax()).isEqualTo(50);
    }

    @Test
    void shouldApplyOverridesInPriorityOrder() throws Exception {
        // Given
        Path yaml = tempDir.resolve("profiler.yml");
        Files.writeString(yaml, """
            scoring:
              null_rate_threshold: 0.5
              top1_rate_threshold: 0.9
            """);
        Map<String, String> env = Map.of(
                "PROFILER_NULL_RATE_THRESHOLD", "0.4",
                "PROFILER_TOP1_RATE_THRESHOLD", "0.8");
        String[] args = {"records.json", "--scoring.null-rate-threshold", "0.35"};

        // When
        ProfilerConfig config = new ConfigurationLoader(env).loadConfiguration(yaml, args);

        // Then - CLI > env vars > YAML
        assertThat(config.getScoring().getNullRateThreshold()).isEqualTo(0.35);
        assertThat(config.getScoring().getTop1RateThreshold()).isEqualTo(0.8);
    }

    @Test
    void shouldParseLimitArguments() throws Exception {
        // Given
        String[] args = {
                "--limits.max-distinct-values", "10",
                "--limits.default-top-k", "3",
                "--limits.progress-interval", "50",
                "--scoring.freq-overflow-score", "12"
        };

        // When
        ProfilerConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(null, args);

        // Then
        assertThat(config.getLimits().getMaxDistinctValues()).isEqualTo(10);
        assertThat(config.getLimits().getDefaultTopK()).isEqualTo(3);
        assertThat(config.getLimits().getProgressInterval()).isEqualTo(50);
        assertThat(config.getScoring().getFreqOverflowScore()).isEqualTo(12);
    }

    @Test
    void shouldIgnoreInvalidNumbers() throws Exception {
        String[] args = {"--scoring.null-rate-max", "lots"};

        ProfilerConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(null, args);

        assertThat(config.getScoring().getNullRateMax()).isEqualTo(40);
    }

    @Test
    void shouldRejectMissingConfigFile() {
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of())
                .loadConfiguration(tempDir.resolve("absent.yml"), new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    void shouldMatchDefaultsInBundledExample() throws Exception {
        // Given
        Path example = tempDir.resolve("profiler-config.example.yml");
        try (InputStream in = getClass().getResourceAsStream("/profiler-config.example.yml")) {
            assertThat(in).isNotNull();
            Files.copy(in, example);
        }

        // When
        ProfilerConfig config = new ConfigurationLoader(Map.of()).loadFile(example);

        // Then
        assertThat(config).isEqualTo(ProfilerConfig.defaults());
    }

    @Test
    void shouldRejectZeroMaxDistinctValuesFromArguments() {
        String[] args = {"records.json", "--limits.max-distinct-values", "0"};

        assertThatThrownBy(() -> new ConfigurationLoader(Map.of()).loadConfiguration(null, args))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_distinct_values");
    }

    @Test
    void shouldRejectNegativeMaxValueLengthFromEnvironment() {
        Map<String, String> env = Map.of("PROFILER_MAX_VALUE_LENGTH", "-1");

        assertThatThrownBy(() -> new ConfigurationLoader(env).loadConfiguration(null, new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_value_length");
    }

    @Test
    void shouldRejectZeroProgressIntervalFromYaml() throws Exception {
        // Given
        Path yaml = tempDir.resolve("bad-interval.yml");
        Files.writeString(yaml, """
            limits:
              progress_interval: 0
            """);

        // When / Then
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of()).loadConfiguration(yaml, new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("progress_interval");
    }

    @Test
    void shouldRejectZeroDefaultTopKFromEnvironment() {
        Map<String, String> env = Map.of("PROFILER_DEFAULT_TOP_K", "0");

        assertThatThrownBy(() -> new ConfigurationLoader(env).loadConfiguration(null, new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("default_top_k");
    }
}
