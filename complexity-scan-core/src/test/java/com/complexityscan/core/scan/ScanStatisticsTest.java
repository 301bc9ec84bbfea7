package com.complexityscan.core.scan;

import com.complexityscan.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanStatistics}.
 */
class ScanStatisticsTest {

    @Test
    void builder_countsAttemptsFromParsedAndFailed() {
        // When
        ScanStatistics stats = new ScanStatistics.Builder()
            .incrementFilesDiscovered()
            .incrementFilesDiscovered()
            .incrementFilesDiscovered()
            .incrementFilesParsed()
            .incrementFilesParsed()
            .incrementFilesFailed()
            .addError(ErrorKind.PARSE_FAILURE, "a.py: syntax errors")
            .filesSkippedBinary(4)
            .build();

        // Then
        assertThat(stats.filesAttempted()).isEqualTo(3);
        assertThat(stats.getSuccessRate()).isCloseTo(66.67, org.assertj.core.data.Offset.offset(0.01));
        assertThat(stats.hasFailures()).isTrue();
        assertThat(stats.errorCounts()).containsEntry(ErrorKind.PARSE_FAILURE, 1);
        assertThat(stats.getSummary())
            .contains("Parsed: 2/3")
            .contains("Failed: 1")
            .contains("4 binary");
    }

    @Test
    void addError_keepsOnlyFirstTenMessages() {
        ScanStatistics.Builder builder = new ScanStatistics.Builder();
        for (int i = 0; i < 15; i++) {
            builder.addError(ErrorKind.PARSE_FAILURE, "file" + i);
        }

        ScanStatistics stats = builder.build();

        assertThat(stats.topErrors()).hasSize(10).startsWith("file0");
        assertThat(stats.errorCounts()).containsEntry(ErrorKind.PARSE_FAILURE, 15);
    }

    @Test
    void merge_sumsCountsAndErrorKinds() {
        ScanStatistics left = new ScanStatistics.Builder()
            .incrementFilesParsed()
            .addError(ErrorKind.PERMISSION_DENIED, "x")
            .build();
        ScanStatistics right = new ScanStatistics.Builder()
            .incrementFilesFailed()
            .addError(ErrorKind.PERMISSION_DENIED, "y")
            .addError(ErrorKind.PARSE_FAILURE, "z")
            .build();

        ScanStatistics merged = left.merge(right);

        assertThat(merged.filesAttempted()).isEqualTo(2);
        assertThat(merged.filesParsed()).isEqualTo(1);
        assertThat(merged.errorCounts())
            .containsEntry(ErrorKind.PERMISSION_DENIED, 2)
            .containsEntry(ErrorKind.PARSE_FAILURE, 1);
        assertThat(merged.topErrors()).containsExactly("x", "y", "z");
    }

    @Test
    void empty_hasZeroSuccessRate() {
        assertThat(ScanStatistics.empty().getSuccessRate()).isZero();
        assertThat(ScanStatistics.empty().hasFailures()).isFalse();
    }
}
