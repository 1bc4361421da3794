package org.carball.profiler.model.profile;

import java.util.List;

/**
 * @param score   0 to 100
 * @param reasons at most three, strongest first
 */
public record SuspiciousRankingEntry(String column, int score, List<SuspiciousReason> reasons) {

    public SuspiciousRankingEntry {
        reasons = List.copyOf(reasons);
    }
}
