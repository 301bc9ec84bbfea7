package com.complexityscan.core.aggregate;

import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.model.FunctionRecord;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Repository-level reduction of all file metrics.
 *
 * @param totalFiles files handed to a parser, parsed or not
 * @param parsedFiles files parsed successfully
 * @param totalFunctions functions across all parsed files
 * @param languages language id to attempted-file count
 * @param totalCyclomaticComplexity sum over all functions
 * @param avgCyclomaticComplexity average per function, two decimals, 0 without functions
 * @param bucket bucket of the total
 * @param parseSuccessRate parsed / attempted in [0, 1], four decimals
 * @param distribution per-function complexity histogram
 * @param topComplexFunctions most complex functions, best first
 * @param files per-file metrics sorted by path, empty unless requested
 * @param scanTimeMs wall-clock duration of the scan
 */
public record RepositorySummary(
    int totalFiles,
    int parsedFiles,
    int totalFunctions,
    SortedMap<String, Integer> languages,
    long totalCyclomaticComplexity,
    double avgCyclomaticComplexity,
    ComplexityBucket bucket,
    double parseSuccessRate,
    Distribution distribution,
    List<FunctionRecord> topComplexFunctions,
    List<FileMetrics> files,
    long scanTimeMs
) {
    public RepositorySummary {
        Objects.requireNonNull(bucket, "bucket must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
        languages = languages == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(languages));
        topComplexFunctions = topComplexFunctions == null ? List.of() : List.copyOf(topComplexFunctions);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public int failedFiles() {
        return totalFiles - parsedFiles;
    }
}
