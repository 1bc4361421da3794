package org.carball.profiler.profiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.analyzer.SuspiciousColumnScorer;
import org.carball.profiler.config.ProfilerConfig;
import org.carball.profiler.config.ProfilerLimits;
import org.carball.profiler.model.ProfileRequest;
import org.carball.profiler.model.event.ProgressEvent;
import org.carball.profiler.model.profile.ColumnProfile;
import org.carball.profiler.model.profile.Profile;
import org.carball.profiler.model.profile.SuspiciousRankingEntry;
import org.carball.profiler.model.schema.LogicalTypeMap;
import org.carball.profiler.model.value.FieldValue;
import org.carball.profiler.model.value.FieldValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes a {@link Profile} in one synchronous pass over the records. Every call starts
 * from fresh accumulators, so instances can be reused across runs.
 */
@Slf4j
public class ColumnProfiler {

    private final ProfilerLimits limits;
    private final LogicalTypeResolver logicalTypeResolver;
    private final ValueNormalizer normalizer;
    private final ProfileSynthesizer synthesizer;
    private final SuspiciousColumnScorer scorer;

    public ColumnProfiler() {
        this(ProfilerConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException when the configured limits cannot be profiled with
     */
    public ColumnProfiler(ProfilerConfig config) {
        config.validate();
        this.limits = config.getLimits();
        this.logicalTypeResolver = new LogicalTypeResolver();
        this.normalizer = new ValueNormalizer(limits.getMaxValueLength());
        this.synthesizer = new ProfileSynthesizer(limits);
        this.scorer = new SuspiciousColumnScorer(config.getScoring());

        log.debug("Initialized ColumnProfiler with {}", config.getConfigurationSummary());
    }

    public Profile profile(ProfileRequest request) {
        return profile(request, ProgressListener.NONE);
    }

    public Profile profile(ProfileRequest request, ProgressListener progressListener) {
        List<? extends Map<String, ?>> records = request.records();
        int topK = request.resolveTopK(limits.getDefaultTopK());
        long totalRecords = records.size();

        log.info("Profiling {} records (topK={})", totalRecords, topK);

        // Step 1: Resolve logical types
        LogicalTypeMap logicalTypes = logicalTypeResolver.resolve(request.schema());

        // Step 2: Discover columns
        List<String> columns = discoverColumns(records);
        log.debug("Discovered {} columns: {}", columns.size(), columns);

        // Step 3: Single pass over all records
        Map<String, ColumnAccumulator> accumulators = new LinkedHashMap<>();
        for (String column : columns) {
            accumulators.put(column, new ColumnAccumulator(column,
                    logicalTypes.get(column).orElse(null), limits.getMaxDistinctValues()));
        }

        int index = 0;
        for (Map<String, ?> record : records) {
            for (ColumnAccumulator accumulator : accumulators.values()) {
                Object raw = record != null ? record.get(accumulator.getColumn()) : null;
                FieldValue value = FieldValues.of(raw);
                accumulator.accept(value, normalizer.toKey(value));
            }

            if (index % limits.getProgressInterval() == 0) {
                progressListener.onProgress(new ProgressEvent(index + 1L, totalRecords));
            }
            index++;
        }

        // Step 4: Synthesize profiles
        Map<String, ColumnProfile> profiles = new LinkedHashMap<>();
        for (ColumnAccumulator accumulator : accumulators.values()) {
            profiles.put(accumulator.getColumn(), synthesizer.synthesize(accumulator, totalRecords, topK));
        }

        // Step 5: Rank suspicious columns
        List<SuspiciousRankingEntry> ranking = scorer.rank(profiles);

        log.info("Profile complete: {} columns, {} flagged", profiles.size(),
                ranking.stream().filter(entry -> entry.score() > 0).count());

        return new Profile(totalRecords, Collections.unmodifiableMap(profiles), List.copyOf(ranking));
    }

    /**
     * Union of all record keys in first-seen order.
     */
    List<String> discoverColumns(List<? extends Map<String, ?>> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            if (record == null) {
                continue;
            }
            for (String key : record.keySet()) {
                if (key != null) {
                    columns.add(key);
                }
            }
        }
        return new ArrayList<>(columns);
    }
}
