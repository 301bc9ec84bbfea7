package com.complexityscan.core.aggregate;

import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.model.FunctionRecord;
import com.complexityscan.core.model.ParseStatus;
import com.complexityscan.core.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComplexityAccumulator}.
 */
class ComplexityAccumulatorTest {

    private static final BucketThresholds THRESHOLDS = BucketThresholds.defaults();

    private static FunctionRecord function(String file, String name, int line, int cc) {
        return new FunctionRecord(file, name, line, line + 4, 1, cc, cc - 1, 0, 5);
    }

    private static FileMetrics parsed(String path, String language, int... complexities) {
        List<FunctionRecord> functions = new ArrayList<>();
        for (int i = 0; i < complexities.length; i++) {
            functions.add(function(path, "f" + i, 1 + i * 10, complexities[i]));
        }
        SourceFile source = new SourceFile(path, language, 100, "hash", ParseStatus.success());
        return new FileMetrics(source, 10 * complexities.length + 1, 0, functions);
    }

    private static FileMetrics failed(String path, String language) {
        return FileMetrics.failed(new SourceFile(path, language, 100, "hash", ParseStatus.failure("syntax errors")));
    }

    private static List<FileMetrics> sampleFiles() {
        return List.of(
            parsed("a.py", "python", 1, 3, 7),
            parsed("b.go", "go", 16, 2),
            failed("c.js", "javascript"),
            parsed("d.rs", "rust"),
            parsed("e.java", "java", 20, 20, 5)
        );
    }

    @Test
    void toSummary_reducesTotalsAndDistribution() {
        // Given
        ComplexityAccumulator accumulator = ComplexityAccumulator.empty(3, false);
        sampleFiles().forEach(accumulator::add);

        // When
        RepositorySummary summary = accumulator.toSummary(THRESHOLDS, 42);

        // Then
        assertThat(summary.totalFiles()).isEqualTo(5);
        assertThat(summary.parsedFiles()).isEqualTo(4);
        assertThat(summary.failedFiles()).isEqualTo(1);
        assertThat(summary.totalFunctions()).isEqualTo(8);
        assertThat(summary.totalCyclomaticComplexity()).isEqualTo(74);
        assertThat(summary.avgCyclomaticComplexity()).isEqualTo(9.25);
        assertThat(summary.parseSuccessRate()).isEqualTo(0.8);
        assertThat(summary.distribution()).isEqualTo(new Distribution(4, 1, 3));
        assertThat(summary.languages())
            .containsEntry("python", 1)
            .containsEntry("javascript", 1)
            .hasSize(5);
        assertThat(summary.bucket()).isEqualTo(ComplexityBucket.SIMPLE);
        assertThat(summary.scanTimeMs()).isEqualTo(42);
        assertThat(summary.files()).isEmpty();
    }

    @Test
    void toSummary_topFunctionsBreakTiesByFileThenLine() {
        // Given
        ComplexityAccumulator accumulator = ComplexityAccumulator.empty(3, false);
        sampleFiles().forEach(accumulator::add);

        // When
        List<FunctionRecord> top = accumulator.toSummary(THRESHOLDS, 0).topComplexFunctions();

        // Then
        assertThat(top)
            .extracting(f -> f.file() + ":" + f.startLine() + "=" + f.cyclomaticComplexity())
            .containsExactly("e.java:1=20", "e.java:11=20", "b.go:1=16");
    }

    @Test
    void combine_isIndependentOfFileOrderAndGrouping() {
        // Given
        List<FileMetrics> files = new ArrayList<>(sampleFiles());
        ComplexityAccumulator sequential = ComplexityAccumulator.empty(4, true);
        files.forEach(sequential::add);
        RepositorySummary expected = sequential.toSummary(THRESHOLDS, 0);

        // When
        Collections.shuffle(files, new Random(7));
        ComplexityAccumulator left = ComplexityAccumulator.empty(4, true);
        ComplexityAccumulator right = ComplexityAccumulator.empty(4, true);
        for (int i = 0; i < files.size(); i++) {
            (i % 2 == 0 ? left : right).add(files.get(i));
        }
        RepositorySummary combined = right.combine(left).toSummary(THRESHOLDS, 0);

        // Then
        assertThat(combined).isEqualTo(expected);
        assertThat(combined.files()).extracting(FileMetrics::path)
            .containsExactly("a.py", "b.go", "c.js", "d.rs", "e.java");
    }

    @Test
    void combine_leavesOperandsUnchanged() {
        // Given
        ComplexityAccumulator a = ComplexityAccumulator.of(parsed("a.py", "python", 2), 5, false);
        ComplexityAccumulator b = ComplexityAccumulator.of(parsed("b.py", "python", 3), 5, false);

        // When
        ComplexityAccumulator merged = a.combine(b);

        // Then
        assertThat(merged.totalCyclomaticComplexity()).isEqualTo(5);
        assertThat(a.totalCyclomaticComplexity()).isEqualTo(2);
        assertThat(b.totalCyclomaticComplexity()).isEqualTo(3);
    }

    @Test
    void combine_withEmpty_isIdentity() {
        ComplexityAccumulator file = ComplexityAccumulator.of(parsed("a.py", "python", 2, 9), 5, false);

        RepositorySummary left = ComplexityAccumulator.empty(5, false).combine(file).toSummary(THRESHOLDS, 0);
        RepositorySummary right = file.combine(ComplexityAccumulator.empty(5, false)).toSummary(THRESHOLDS, 0);

        assertThat(left).isEqualTo(right).isEqualTo(file.toSummary(THRESHOLDS, 0));
    }

    @Test
    void toSummary_noFiles_isZeroed() {
        RepositorySummary summary = ComplexityAccumulator.empty(10, false).toSummary(THRESHOLDS, 0);

        assertThat(summary.totalFiles()).isZero();
        assertThat(summary.avgCyclomaticComplexity()).isZero();
        assertThat(summary.parseSuccessRate()).isZero();
        assertThat(summary.bucket()).isEqualTo(ComplexityBucket.SIMPLE);
        assertThat(summary.topComplexFunctions()).isEmpty();
    }

    @Test
    void add_skippedFile_isRejected() {
        SourceFile binary = new SourceFile("blob.py", "python", 10, "", ParseStatus.skippedBinary("binary content"));

        assertThatThrownBy(() -> ComplexityAccumulator.empty(10, false).add(FileMetrics.failed(binary)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void absorb_differentSettings_isRejected() {
        ComplexityAccumulator a = ComplexityAccumulator.empty(10, false);
        ComplexityAccumulator b = ComplexityAccumulator.empty(5, false);

        assertThatThrownBy(() -> a.absorb(b)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> a.absorb(a)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void topN_zero_keepsNoFunctions() {
        ComplexityAccumulator accumulator = ComplexityAccumulator.of(parsed("a.py", "python", 4), 0, false);

        assertThat(accumulator.toSummary(THRESHOLDS, 0).topComplexFunctions()).isEmpty();
    }

    @Test
    void topFunctions_lambdasOnSameLine_areAllKept() {
        // Given
        FunctionRecord outer = new FunctionRecord("A.java", "A.run", 1, 3, 1, 1, 0, 0, 3);
        FunctionRecord first = new FunctionRecord("A.java", "<anonymous>", 2, 2, 1, 1, 0, 0, 1);
        FunctionRecord second = new FunctionRecord("A.java", "<anonymous>", 2, 2, 1, 1, 0, 0, 1);
        SourceFile source = new SourceFile("A.java", "java", 80, "hash", ParseStatus.success());
        FileMetrics file = new FileMetrics(source, 3, 1, List.of(outer, first, second));

        // When
        RepositorySummary summary = ComplexityAccumulator.of(file, 10, false).toSummary(THRESHOLDS, 0);

        // Then
        assertThat(summary.totalFunctions()).isEqualTo(3);
        assertThat(summary.topComplexFunctions()).hasSize(3);
    }

    @Test
    void topFunctions_equalRecordsBeyondLimit_areTrimmedToTopN() {
        // Given
        FunctionRecord lambda = new FunctionRecord("A.java", "<anonymous>", 2, 2, 1, 1, 0, 0, 1);
        SourceFile source = new SourceFile("A.java", "java", 80, "hash", ParseStatus.success());
        FileMetrics file = new FileMetrics(source, 3, 0, List.of(lambda, lambda, lambda, function("A.java", "hot", 5, 9)));

        // When
        RepositorySummary summary = ComplexityAccumulator.of(file, 2, false).toSummary(THRESHOLDS, 0);

        // Then
        assertThat(summary.topComplexFunctions())
            .extracting(FunctionRecord::name)
            .containsExactly("hot", "<anonymous>");
    }
}
