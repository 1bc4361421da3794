package org.carball.profiler.profiler;

import org.carball.profiler.config.ProfilerLimits;
import org.carball.profiler.model.profile.ColumnProfile;
import org.carball.profiler.model.profile.TopKEntry;
import org.carball.profiler.model.profile.TypeHint;
import org.carball.profiler.model.schema.LogicalType;
import org.carball.profiler.model.value.FieldValue;
import org.carball.profiler.model.value.FieldValues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ProfileSynthesizerTest {

    private final ValueNormalizer normalizer = new ValueNormalizer(200);
    private ProfileSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new ProfileSynthesizer(ProfilerLimits.defaults());
    }

    private ColumnAccumulator accumulate(LogicalType logicalType, Object... values) {
        ColumnAccumulator accumulator = new ColumnAccumulator("col", logicalType, 50_000);
        for (Object raw : values) {
            FieldValue value = FieldValues.of(raw);
            accumulator.accept(value, normalizer.toKey(value));
        }
        return accumulator;
    }

    @Test
    void shouldReportUnknownTypeAndZeroRatesForEmptyColumn() {
        // Given
        ColumnAccumulator stats = accumulate(null);

        // When
        ColumnProfile profile = synthesizer.synthesize(stats, 0, 10);

        // Then
        assertThat(profile.getTypeHint()).isEqualTo(TypeHint.UNKNOWN);
        assertThat(profile.getNullRate()).isZero();
        assertThat(profile.getNumericRatio()).isZero();
        assertThat(profile.getTopK()).isEmpty();
        assertThat(profile.getMinMaxReason()).isNull();
        assertThat(profile.hasMinMax()).isFalse();
    }

    @Test
    void shouldUseDominantCategoryAsTypeHint() {
        ColumnProfile profile = synthesizer.synthesize(accumulate(null, "a", "b", "c", "d", 1), 5, 10);

        assertThat(profile.getTypeHint()).isEqualTo(TypeHint.STRING);
    }

    @Test
    void shouldReportMixedBelowDominantShare() {
        // Given - 3 strings and 2 numbers, top share 0.6
        ColumnAccumulator stats = accumulate(null, "a", "b", "c", 1, 2);

        // When
        ColumnProfile profile = synthesizer.synthesize(stats, 5, 10);

        // Then
        assertThat(profile.getTypeHint()).isEqualTo(TypeHint.MIXED);
        assertThat(profile.getNumericRatio()).isCloseTo(0.4, within(1e-9));
        assertThat(profile.getMinMaxReason()).isEqualTo(ProfileSynthesizer.MIXED_REASON);
        assertThat(profile.getMin()).isNull();
    }

    @Test
    void shouldExplainMissingMinMaxForNonNumericColumn() {
        ColumnProfile profile = synthesizer.synthesize(accumulate(null, true, false), 2, 10);

        assertThat(profile.getTypeHint()).isEqualTo(TypeHint.BOOLEAN);
        assertThat(profile.getMinMaxReason()).isEqualTo(ProfileSynthesizer.NOT_NUMERIC_REASON);
    }

    @Test
    void shouldComputeMinMaxAtNumericThreshold() {
        // Given - 4 of 5 values numeric
        ColumnAccumulator stats = accumulate(null, 3, 9, -1, 4, "n/a");

        // When
        ColumnProfile profile = synthesizer.synthesize(stats, 5, 10);

        // Then
        assertThat(profile.getNumericRatio()).isEqualTo(0.8);
        assertThat(profile.getMin()).isEqualTo(-1.0);
        assertThat(profile.getMax()).isEqualTo(9.0);
        assertThat(profile.getMinDisplay()).isNull();
        assertThat(profile.isMinMaxFlat()).isFalse();
        assertThat(profile.getMinMaxReason()).isNull();
    }

    @Test
    void shouldFlagConstantNumericColumn() {
        ColumnProfile profile = synthesizer.synthesize(accumulate(null, 5, 5, 5.0), 3, 10);

        assertThat(profile.getMin()).isEqualTo(5.0);
        assertThat(profile.getMax()).isEqualTo(5.0);
        assertThat(profile.isMinMaxFlat()).isTrue();
    }

    @Test
    void shouldReportDatetimeWithFormattedExtrema() {
        // Given
        ColumnAccumulator stats = accumulate(LogicalType.TIMESTAMP_MILLIS, 1_700_000_000_000L, 1_600_000_000_123L);

        // When
        ColumnProfile profile = synthesizer.synthesize(stats, 2, 10);

        // Then
        assertThat(profile.getTypeHint()).isEqualTo(TypeHint.DATETIME);
        assertThat(profile.getLogicalType()).isEqualTo(LogicalType.TIMESTAMP_MILLIS);
        assertThat(profile.getMin()).isEqualTo(1_600_000_000_123.0);
        assertThat(profile.getMinDisplay()).isEqualTo("2020-09-13T12:26:40.123Z");
        assertThat(profile.getMaxDisplay()).isEqualTo("2023-11-14T22:13:20.000Z");
    }

    @Test
    void shouldExplainMissingExtremaForNonNumericTimestampColumn() {
        ColumnProfile profile = synthesizer.synthesize(accumulate(LogicalType.TIMESTAMP_MILLIS, "yesterday"), 1, 10);

        assertThat(profile.getTypeHint()).isEqualTo(TypeHint.DATETIME);
        assertThat(profile.hasMinMax()).isFalse();
        assertThat(profile.getMinMaxReason()).isEqualTo(ProfileSynthesizer.NOT_NUMERIC_REASON);
    }

    @Test
    void shouldTruncateSubMillisecondPartWhenFormatting() {
        assertThat(ProfileSynthesizer.formatTimestamp(1000.9)).isEqualTo("1970-01-01T00:00:01.000Z");
    }

    @Test
    void shouldLimitTopKAndComputeRatesOverNonNullValues() {
        // Given
        ColumnAccumulator stats = accumulate(null, "b", "a", "b", "a", "c", null);

        // When
        ColumnProfile profile = synthesizer.synthesize(stats, 6, 2);

        // Then
        assertThat(profile.getTopK()).extracting(TopKEntry::value).containsExactly("b", "a");
        assertThat(profile.getTopK()).extracting(TopKEntry::rate).containsExactly(0.4, 0.4);
        assertThat(profile.getTop1Rate()).isEqualTo(0.4);
        assertThat(profile.getNullRate()).isCloseTo(1.0 / 6, within(1e-9));
    }

    @Test
    void shouldMirrorOverflowAsTopKLimited() {
        ColumnAccumulator stats = new ColumnAccumulator("col", null, 1);
        stats.accept(FieldValues.of("a"), "a");
        stats.accept(FieldValues.of("b"), "b");

        assertThat(synthesizer.synthesize(stats, 2, 10).isTopKLimited()).isTrue();
    }
}
