package org.carball.profiler.model.profile;

import java.util.List;
import java.util.Map;

/**
 * Result of one profiling run. {@code columns} iterates in column discovery order.
 */
public record Profile(
    long totalRecords,
    Map<String, ColumnProfile> columns,
    List<SuspiciousRankingEntry> suspiciousRanking
) {}
