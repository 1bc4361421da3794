package org.carball.profiler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults.
     *
     * @param configFile optional YAML file, may be {@code null}
     */
    public ProfilerConfig loadConfiguration(Path configFile, String[] args) throws IOException {
        log.debug("Loading configuration");

        ProfilerConfig base = configFile != null ? loadFile(configFile) : ProfilerConfig.defaults();

        ProfilerLimits.ProfilerLimitsBuilder limits = base.getLimits().toBuilder();
        ScoringConfig.ScoringConfigBuilder scoring = base.getScoring().toBuilder();

        applyEnvironmentVariables(limits, scoring);
        applyCLIArguments(limits, scoring, args);

        ProfilerConfig config = ProfilerConfig.builder()
                .limits(limits.build())
                .scoring(scoring.build())
                .build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public ProfilerConfig loadFile(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        ProfilerConfig config = yamlMapper.readValue(configFile.toFile(), ProfilerConfig.class);
        if (config == null) {
            log.warn("Config file {} is empty, using defaults", configFile);
            return ProfilerConfig.defaults();
        }
        // Sections missing from the YAML come back as null
        ProfilerConfig.ProfilerConfigBuilder builder = config.toBuilder();
        if (config.getLimits() == null) {
            builder.limits(ProfilerLimits.defaults());
        }
        if (config.getScoring() == null) {
            builder.scoring(ScoringConfig.defaults());
        }
        log.info("Loaded configuration from: {}", configFile);
        return builder.build();
    }

    private void applyEnvironmentVariables(ProfilerLimits.ProfilerLimitsBuilder limits,
                                           ScoringConfig.ScoringConfigBuilder scoring) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String option = switch (entry.getKey()) {
                case "PROFILER_MAX_DISTINCT_VALUES" -> "--limits.max-distinct-values";
                case "PROFILER_MAX_VALUE_LENGTH" -> "--limits.max-value-length";
                case "PROFILER_NUMERIC_THRESHOLD" -> "--limits.numeric-threshold";
                case "PROFILER_DEFAULT_TOP_K" -> "--limits.default-top-k";
                case "PROFILER_NULL_RATE_THRESHOLD" -> "--scoring.null-rate-threshold";
                case "PROFILER_TOP1_RATE_THRESHOLD" -> "--scoring.top1-rate-threshold";
                default -> null;
            };
            if (option != null) {
                apply(limits, scoring, option, entry.getValue());
            }
        }
    }

    private void applyCLIArguments(ProfilerLimits.ProfilerLimitsBuilder limits,
                                   ScoringConfig.ScoringConfigBuilder scoring,
                                   String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith("--limits.") || args[i].startsWith("--scoring.")) {
                apply(limits, scoring, args[i], args[i + 1]);
            }
        }
    }

    private void apply(ProfilerLimits.ProfilerLimitsBuilder limits,
                       ScoringConfig.ScoringConfigBuilder scoring,
                       String option, String value) {
        try {
            switch (option) {
                case "--limits.max-distinct-values":
                    limits.maxDistinctValues(Integer.parseInt(value));
                    break;
                case "--limits.max-value-length":
                    limits.maxValueLength(Integer.parseInt(value));
                    break;
                case "--limits.numeric-threshold":
                    limits.numericThreshold(Double.parseDouble(value));
                    break;
                case "--limits.dominant-type-threshold":
                    limits.dominantTypeThreshold(Double.parseDouble(value));
                    break;
                case "--limits.progress-interval":
                    limits.progressInterval(Integer.parseInt(value));
                    break;
                case "--limits.default-top-k":
                    limits.defaultTopK(Integer.parseInt(value));
                    break;
                case "--scoring.null-rate-threshold":
                    scoring.nullRateThreshold(Double.parseDouble(value));
                    break;
                case "--scoring.null-rate-max":
                    scoring.nullRateMax(Integer.parseInt(value));
                    break;
                case "--scoring.top1-rate-threshold":
                    scoring.top1RateThreshold(Double.parseDouble(value));
                    break;
                case "--scoring.top1-rate-max":
                    scoring.top1RateMax(Integer.parseInt(value));
                    break;
                case "--scoring.flat-value-score":
                    scoring.flatValueScore(Integer.parseInt(value));
                    break;
                case "--scoring.freq-overflow-score":
                    scoring.freqOverflowScore(Integer.parseInt(value));
                    break;
                default:
                    log.warn("Unknown configuration option: {}", option);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", option, value);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --limits.max-distinct-values <num>    Distinct values tracked per column (default 50000)
              --limits.max-value-length <num>       Longer values are truncated (default 200)
              --limits.numeric-threshold <num>      Numeric share needed for min/max (default 0.8)
              --limits.dominant-type-threshold <num> Share needed for a single type hint (default 0.8)
              --limits.progress-interval <num>      Records between progress updates (default 1000)
              --limits.default-top-k <num>          Top-K when none is given (default 10)
              --scoring.null-rate-threshold <num>   Null rate that starts scoring (default 0.3)
              --scoring.null-rate-max <num>         Maximum null rate score (default 40)
              --scoring.top1-rate-threshold <num>   Top value share that starts scoring (default 0.95)
              --scoring.top1-rate-max <num>         Maximum top value score (default 30)
              --scoring.flat-value-score <num>      Score for min == max (default 10)
              --scoring.freq-overflow-score <num>   Score for a saturated frequency table (default 8)

            Environment Variables:
              PROFILER_MAX_DISTINCT_VALUES          Same as --limits.max-distinct-values
              PROFILER_MAX_VALUE_LENGTH             Same as --limits.max-value-length
              PROFILER_NUMERIC_THRESHOLD            Same as --limits.numeric-threshold
              PROFILER_DEFAULT_TOP_K                Same as --limits.default-top-k
              PROFILER_NULL_RATE_THRESHOLD          Same as --scoring.null-rate-threshold
              PROFILER_TOP1_RATE_THRESHOLD          Same as --scoring.top1-rate-threshold

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file (--config)
              4. Built-in defaults
            """;
    }
}
