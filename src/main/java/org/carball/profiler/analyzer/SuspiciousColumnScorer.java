package org.carball.profiler.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.config.ScoringConfig;
import org.carball.profiler.model.profile.ColumnProfile;
import org.carball.profiler.model.profile.ReasonCode;
import org.carball.profiler.model.profile.SuspiciousRankingEntry;
import org.carball.profiler.model.profile.SuspiciousReason;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class SuspiciousColumnScorer {

    private static final int MAX_SCORE = 100;
    private static final int MAX_REASONS = 3;

    private final ScoringConfig config;

    public SuspiciousColumnScorer() {
        this(ScoringConfig.defaults());
    }

    public SuspiciousColumnScorer(ScoringConfig config) {
        this.config = config;
    }

    /**
     * Scores every column and orders them by descending score. Equal scores keep the
     * iteration order of {@code columns}.
     */
    public List<SuspiciousRankingEntry> rank(Map<String, ColumnProfile> columns) {
        List<SuspiciousRankingEntry> ranking = new ArrayList<>(columns.size());
        for (Map.Entry<String, ColumnProfile> column : columns.entrySet()) {
            ranking.add(scoreColumn(column.getKey(), column.getValue()));
        }

        ranking.sort(Comparator.comparingInt(SuspiciousRankingEntry::score).reversed());

        if (!ranking.isEmpty()) {
            log.debug("Most suspicious column: {} (score {})", ranking.get(0).column(), ranking.get(0).score());
        }
        return ranking;
    }

    public SuspiciousRankingEntry scoreColumn(String column, ColumnProfile profile) {
        int score = 0;
        List<WeightedReason> reasons = new ArrayList<>();

        // Rule 1: High null rate
        if (profile.getNullRate() >= config.getNullRateThreshold()) {
            int add = scaledWeight(profile.getNullRate(), config.getNullRateThreshold(), config.getNullRateMax());
            score += add;
            reasons.add(new WeightedReason(ReasonCode.HIGH_NULL_RATE, add,
                    String.format(Locale.ROOT, "Null rate is high at %.1f%%", profile.getNullRate() * 100)));
        }

        // Rule 2: One value dominates
        if (profile.getTop1Rate() >= config.getTop1RateThreshold()) {
            int add = scaledWeight(profile.getTop1Rate(), config.getTop1RateThreshold(), config.getTop1RateMax());
            score += add;
            reasons.add(new WeightedReason(ReasonCode.TOP1_DOMINANT, add,
                    String.format(Locale.ROOT, "Top value accounts for %.1f%% of values", profile.getTop1Rate() * 100)));
        }

        // Rule 3: Constant range
        if (profile.isMinMaxFlat()) {
            score += config.getFlatValueScore();
            reasons.add(new WeightedReason(ReasonCode.MIN_EQ_MAX, config.getFlatValueScore(),
                    "Min and max are identical (constant value)"));
        }

        // Rule 4: Frequency table saturated
        if (profile.isTopKLimited()) {
            score += config.getFreqOverflowScore();
            reasons.add(new WeightedReason(ReasonCode.TOPK_LIMITED, config.getFreqOverflowScore(),
                    "Too many distinct values, top-K accuracy is reduced"));
        }

        reasons.sort(Comparator.comparingInt(WeightedReason::weight).reversed());

        List<SuspiciousReason> shown = reasons.stream()
                .limit(MAX_REASONS)
                .map(reason -> new SuspiciousReason(reason.code(), reason.message()))
                .collect(Collectors.toList());

        return new SuspiciousRankingEntry(column, Math.max(0, Math.min(MAX_SCORE, score)), shown);
    }

    /**
     * Linear from 0 at the threshold to {@code max} at a rate of 1, rounded half up.
     */
    static int scaledWeight(double rate, double threshold, int max) {
        double ratio = (rate - threshold) / (1 - threshold);
        return (int) Math.round(Math.min(max, max * ratio));
    }

    private record WeightedReason(ReasonCode code, int weight, String message) {
    }
}
