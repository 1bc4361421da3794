package org.carball.profiler.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.model.profile.ColumnProfile;
import org.carball.profiler.model.profile.Profile;
import org.carball.profiler.model.profile.SuspiciousRankingEntry;
import org.carball.profiler.model.profile.SuspiciousReason;
import org.carball.profiler.model.profile.TopKEntry;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ProfileReport {

    static final String VERSION = "1.0.0";

    private final Profile profile;
    private final String source;
    private final Instant timestamp;
    private final ObjectMapper objectMapper;

    public ProfileReport(Profile profile, String source) {
        this(profile, source, Instant.now());
    }

    ProfileReport(Profile profile, String source, Instant timestamp) {
        this.profile = profile;
        this.source = source;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(new Metadata(source, timestamp, VERSION), profile));
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Column Profile Report\n\n");
        if (source != null) {
            md.append("**Source:** `").append(source).append("`  \n");
        }
        md.append("**Generated:** ")
                .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp.atZone(ZoneOffset.UTC)))
                .append("Z  \n");
        md.append("**Profiler Version:** ").append(VERSION).append("  \n\n");

        // Overview
        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Records | ").append(profile.totalRecords()).append(" |\n");
        md.append("| Columns | ").append(profile.columns().size()).append(" |\n");
        md.append("| Suspicious Columns | ").append(countSuspicious()).append(" |\n\n");

        // Ranking
        md.append("## Suspicious Columns\n\n");
        if (countSuspicious() == 0) {
            md.append("**No column triggered a data-quality rule.**\n\n");
        } else {
            md.append("| Column | Score | Reasons |\n");
            md.append("|--------|-------|---------|\n");
            for (SuspiciousRankingEntry entry : profile.suspiciousRanking()) {
                if (entry.score() == 0 && entry.reasons().isEmpty()) {
                    continue;
                }
                md.append("| ").append(escape(entry.column()))
                        .append(" | ").append(entry.score())
                        .append(" | ").append(entry.reasons().stream()
                                .map(SuspiciousReason::message)
                                .map(ProfileReport::escape)
                                .collect(Collectors.joining("; ")))
                        .append(" |\n");
            }
            md.append("\n");
        }

        // Column details
        md.append("## Columns\n\n");
        for (Map.Entry<String, ColumnProfile> column : profile.columns().entrySet()) {
            appendColumn(md, column.getKey(), column.getValue());
        }

        md.append("---\n\n");
        md.append("*Generated by Column Profiler*\n");

        return md.toString();
    }

    private void appendColumn(StringBuilder md, String name, ColumnProfile column) {
        md.append("### ").append(name).append("\n\n");
        md.append("- **Type:** ").append(column.getTypeHint());
        if (column.getLogicalType() != null) {
            md.append(" (").append(column.getLogicalType()).append(")");
        }
        md.append("\n");
        md.append("- **Nulls:** ").append(column.getNullCount())
                .append(" (").append(percent(column.getNullRate())).append(")\n");
        md.append("- **Non-null:** ").append(column.getNonNullCount()).append("\n");
        md.append("- **Numeric ratio:** ").append(percent(column.getNumericRatio())).append("\n");

        if (column.hasMinMax()) {
            md.append("- **Min:** ").append(column.getMinDisplay() != null ? column.getMinDisplay() : number(column.getMin()))
                    .append("\n");
            md.append("- **Max:** ").append(column.getMaxDisplay() != null ? column.getMaxDisplay() : number(column.getMax()))
                    .append("\n");
        } else if (column.getMinMaxReason() != null) {
            md.append("- **Min/Max:** ").append(column.getMinMaxReason()).append("\n");
        }

        if (column.isTopKLimited()) {
            md.append("- **Note:** too many distinct values, frequencies are partial\n");
        }
        md.append("\n");

        if (!column.getTopK().isEmpty()) {
            md.append("| Value | Count | Rate |\n");
            md.append("|-------|-------|------|\n");
            for (TopKEntry entry : column.getTopK()) {
                md.append("| ").append(escape(entry.value()))
                        .append(" | ").append(entry.count())
                        .append(" | ").append(percent(entry.rate()))
                        .append(" |\n");
            }
            md.append("\n");
        }
    }

    private long countSuspicious() {
        return profile.suspiciousRanking().stream()
                .filter(entry -> entry.score() > 0 || !entry.reasons().isEmpty())
                .count();
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }

    private static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String escape(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    static class ReportData {
        private Metadata metadata;
        private Profile profile;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    static class Metadata {
        private String source;
        private Instant generatedAt;
        private String profilerVersion;
    }
}
