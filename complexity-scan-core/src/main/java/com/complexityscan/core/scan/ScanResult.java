package com.complexityscan.core.scan;

import com.complexityscan.core.aggregate.RepositorySummary;
import com.complexityscan.core.discovery.SkippedPaths;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything a completed scan produced.
 *
 * @param repository scanned root as given to the scanner
 * @param summary repository summary
 * @param skipped what discovery left out
 * @param grammars language id to grammar version for the languages this scan analyzed
 * @param statistics scan statistics
 */
public record ScanResult(
    String repository,
    RepositorySummary summary,
    SkippedPaths skipped,
    SortedMap<String, String> grammars,
    ScanStatistics statistics
) {
    public ScanResult {
        Objects.requireNonNull(repository, "repository must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(skipped, "skipped must not be null");
        grammars = grammars == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(grammars));
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }
}
