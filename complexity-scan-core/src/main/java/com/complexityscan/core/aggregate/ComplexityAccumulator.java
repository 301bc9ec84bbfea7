package com.complexityscan.core.aggregate;

import com.complexityscan.core.error.ErrorKind;
import com.complexityscan.core.error.ScanException;
import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.model.FunctionRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Mergeable partial summary of a scan.
 *
 * <p>Fragments combine associatively and commutatively: counts are summed, the language
 * histogram is merged, and the top-N list keeps the N best functions under
 * {@link FunctionRecord#BY_COMPLEXITY_DESC}. Functions that compare equal (two lambdas
 * on one line) are both kept; they are indistinguishable in the report, so the final
 * summary is the same whatever the worker count or completion order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComplexityAccumulator total = ComplexityAccumulator.empty(10, false);
 * for (FileMetrics file : results) {
 *     total.absorb(ComplexityAccumulator.of(file, 10, false));
 * }
 * RepositorySummary summary = total.toSummary(BucketThresholds.defaults(), elapsedMs);
 * }</pre>
 *
 * <p>Not thread-safe; each fragment is owned by one thread until it is combined.
 */
public final class ComplexityAccumulator {

    private final int topN;
    private final boolean retainFiles;

    private int attemptedFiles;
    private int parsedFiles;
    private int totalFunctions;
    private long totalCyclomaticComplexity;
    private Distribution distribution = Distribution.empty();
    private final SortedMap<String, Integer> languages = new TreeMap<>();
    private final List<FunctionRecord> topFunctions = new ArrayList<>();
    private final SortedMap<String, FileMetrics> files = new TreeMap<>();

    private ComplexityAccumulator(int topN, boolean retainFiles) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0 but was " + topN);
        }
        this.topN = topN;
        this.retainFiles = retainFiles;
    }

    /**
     * Identity element.
     *
     * @param topN size of the ranked function list
     * @param retainFiles whether per-file metrics are kept for the report
     * @return empty accumulator
     */
    public static ComplexityAccumulator empty(int topN, boolean retainFiles) {
        return new ComplexityAccumulator(topN, retainFiles);
    }

    /**
     * Fragment holding a single file.
     *
     * @param file analyzed file
     * @param topN size of the ranked function list
     * @param retainFiles whether per-file metrics are kept
     * @return one-file accumulator
     */
    public static ComplexityAccumulator of(FileMetrics file, int topN, boolean retainFiles) {
        return new ComplexityAccumulator(topN, retainFiles).add(file);
    }

    /**
     * Folds one file into this accumulator.
     *
     * @param file analyzed file; skipped files are rejected
     * @return this accumulator
     */
    public ComplexityAccumulator add(FileMetrics file) {
        Objects.requireNonNull(file, "file must not be null");
        if (!file.source().status().isAttempted()) {
            throw new IllegalArgumentException("Only attempted files can be aggregated: " + file.path());
        }
        attemptedFiles++;
        if (file.source().language() != null) {
            languages.merge(file.source().language(), 1, Integer::sum);
        }
        if (file.source().status().isSuccess()) {
            parsedFiles++;
            for (FunctionRecord function : file.functions()) {
                totalFunctions++;
                totalCyclomaticComplexity += function.cyclomaticComplexity();
                distribution = distribution.plus(Distribution.of(function.cyclomaticComplexity()));
                offerTop(function);
            }
        }
        if (retainFiles) {
            files.put(file.path(), file);
        }
        return this;
    }

    /**
     * Associative, commutative merge. Neither operand is modified.
     *
     * @param other fragment to merge
     * @return new accumulator holding both fragments
     */
    public ComplexityAccumulator combine(ComplexityAccumulator other) {
        ComplexityAccumulator merged = new ComplexityAccumulator(topN, retainFiles);
        merged.absorb(this);
        merged.absorb(other);
        return merged;
    }

    /**
     * In-place form of {@link #combine}: folds {@code other} into this accumulator.
     *
     * @param other fragment to merge, left unchanged
     * @return this accumulator
     */
    public ComplexityAccumulator absorb(ComplexityAccumulator other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other == this) {
            throw new IllegalArgumentException("An accumulator cannot absorb itself; use combine");
        }
        if (other.topN != topN || other.retainFiles != retainFiles) {
            throw new IllegalArgumentException("Cannot combine accumulators with different settings");
        }
        attemptedFiles += other.attemptedFiles;
        parsedFiles += other.parsedFiles;
        totalFunctions += other.totalFunctions;
        totalCyclomaticComplexity += other.totalCyclomaticComplexity;
        distribution = distribution.plus(other.distribution);
        other.languages.forEach((language, count) -> languages.merge(language, count, Integer::sum));
        other.topFunctions.forEach(this::offerTop);
        files.putAll(other.files);
        return this;
    }

    private void offerTop(FunctionRecord function) {
        if (topN == 0) {
            return;
        }
        if (topFunctions.size() == topN
            && FunctionRecord.BY_COMPLEXITY_DESC.compare(function, topFunctions.get(topN - 1)) >= 0) {
            return;
        }
        int index = Collections.binarySearch(topFunctions, function, FunctionRecord.BY_COMPLEXITY_DESC);
        topFunctions.add(index < 0 ? -index - 1 : index, function);
        if (topFunctions.size() > topN) {
            topFunctions.remove(topFunctions.size() - 1);
        }
    }

    public int attemptedFiles() {
        return attemptedFiles;
    }

    public int parsedFiles() {
        return parsedFiles;
    }

    public int totalFunctions() {
        return totalFunctions;
    }

    public long totalCyclomaticComplexity() {
        return totalCyclomaticComplexity;
    }

    /**
     * Finalizes the reduction after checking the aggregate invariants.
     *
     * @param thresholds bucket breakpoints
     * @param scanTimeMs scan duration to record
     * @return repository summary
     * @throws ScanException with {@link ErrorKind#INTERNAL_INVARIANT_VIOLATION} if the
     *         totals are inconsistent
     */
    public RepositorySummary toSummary(BucketThresholds thresholds, long scanTimeMs) {
        verifyInvariants();
        double average = totalFunctions == 0 ? 0.0 : round((double) totalCyclomaticComplexity / totalFunctions, 2);
        double successRate = attemptedFiles == 0 ? 0.0 : round((double) parsedFiles / attemptedFiles, 4);
        return new RepositorySummary(
            attemptedFiles,
            parsedFiles,
            totalFunctions,
            languages,
            totalCyclomaticComplexity,
            average,
            ComplexityBucket.of(totalCyclomaticComplexity, thresholds),
            successRate,
            distribution,
            new ArrayList<>(topFunctions),
            new ArrayList<>(files.values()),
            scanTimeMs
        );
    }

    private void verifyInvariants() {
        if (distribution.total() != totalFunctions) {
            throw violation("distribution " + distribution + " does not add up to " + totalFunctions + " functions");
        }
        if (totalCyclomaticComplexity < totalFunctions) {
            throw violation("total cyclomatic complexity " + totalCyclomaticComplexity
                + " is below the function count " + totalFunctions);
        }
        if (parsedFiles > attemptedFiles) {
            throw violation(parsedFiles + " parsed files exceed " + attemptedFiles + " attempted");
        }
        int languageTotal = languages.values().stream().mapToInt(Integer::intValue).sum();
        if (languageTotal > attemptedFiles) {
            throw violation("language histogram counts " + languageTotal + " files, only " + attemptedFiles + " attempted");
        }
        if (retainFiles) {
            long fileTotal = 0;
            int fileFunctions = 0;
            for (FileMetrics file : files.values()) {
                fileTotal += file.totalCyclomaticComplexity();
                fileFunctions += file.functionCount();
            }
            if (fileTotal != totalCyclomaticComplexity || fileFunctions != totalFunctions) {
                throw violation("per-file totals (" + fileFunctions + " functions, cc " + fileTotal
                    + ") disagree with repository totals (" + totalFunctions + ", " + totalCyclomaticComplexity + ")");
            }
        }
    }

    private static ScanException violation(String message) {
        return new ScanException(ErrorKind.INTERNAL_INVARIANT_VIOLATION, "Aggregate invariant violated: " + message);
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
