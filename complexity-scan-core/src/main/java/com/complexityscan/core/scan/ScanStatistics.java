package com.complexityscan.core.scan;

import com.complexityscan.core.error.ErrorKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during a scan.
 *
 * <p>Gives transparency into what was analyzed and what was left out, and why. Logged at
 * the end of every scan and printed by the CLI.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics stats = new ScanStatistics.Builder()
 *     .incrementFilesDiscovered()
 *     .incrementFilesParsed()
 *     .build();
 * System.err.println(stats.getSummary());
 * }</pre>
 *
 * @param filesDiscovered files accepted by discovery
 * @param filesAttempted files handed to a parser
 * @param filesParsed files parsed successfully
 * @param filesFailed files that failed to parse
 * @param filesSkippedBinary binary or oversized files
 * @param filesSkippedUnrecognized files with an unrecognized extension
 * @param pathsPermissionDenied unreadable files and directories
 * @param errorCounts occurrences per error kind
 * @param topErrors first error messages (max 10)
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesAttempted,
    int filesParsed,
    int filesFailed,
    int filesSkippedBinary,
    int filesSkippedUnrecognized,
    int pathsPermissionDenied,
    Map<ErrorKind, Integer> errorCounts,
    List<String> topErrors
) {
    static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesAttempted = Math.max(0, filesAttempted);
        filesParsed = Math.max(0, filesParsed);
        filesFailed = Math.max(0, filesFailed);
        filesSkippedBinary = Math.max(0, filesSkippedBinary);
        filesSkippedUnrecognized = Math.max(0, filesSkippedUnrecognized);
        pathsPermissionDenied = Math.max(0, pathsPermissionDenied);
        errorCounts = errorCounts == null || errorCounts.isEmpty() ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the parse success rate.
     *
     * @return success rate as percentage (0.0 to 100.0), or 0 if nothing was attempted
     */
    public double getSuccessRate() {
        if (filesAttempted == 0) {
            return 0.0;
        }
        return (filesParsed * 100.0) / filesAttempted;
    }

    /**
     * Returns true if any attempted file failed to parse.
     *
     * @return true if at least one file failed
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Sums two statistics. Top errors are concatenated and capped.
     *
     * @param other statistics to add
     * @return combined statistics
     */
    public ScanStatistics merge(ScanStatistics other) {
        Map<ErrorKind, Integer> counts = new EnumMap<>(ErrorKind.class);
        counts.putAll(errorCounts);
        other.errorCounts.forEach((kind, count) -> counts.merge(kind, count, Integer::sum));
        List<String> errors = new ArrayList<>(topErrors);
        for (String error : other.topErrors) {
            if (errors.size() >= MAX_TOP_ERRORS) {
                break;
            }
            errors.add(error);
        }
        return new ScanStatistics(
            filesDiscovered + other.filesDiscovered,
            filesAttempted + other.filesAttempted,
            filesParsed + other.filesParsed,
            filesFailed + other.filesFailed,
            filesSkippedBinary + other.filesSkippedBinary,
            filesSkippedUnrecognized + other.filesSkippedUnrecognized,
            pathsPermissionDenied + other.pathsPermissionDenied,
            counts,
            errors
        );
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Parsed: %d/%d (%.1f%%), Failed: %d, Skipped: %d binary, %d unrecognized, %d unreadable",
            filesDiscovered,
            filesParsed,
            filesAttempted,
            getSuccessRate(),
            filesFailed,
            filesSkippedBinary,
            filesSkippedUnrecognized,
            pathsPermissionDenied
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesAttempted = 0;
        private int filesParsed = 0;
        private int filesFailed = 0;
        private int filesSkippedBinary = 0;
        private int filesSkippedUnrecognized = 0;
        private int pathsPermissionDenied = 0;
        private final Map<ErrorKind, Integer> errorCounts = new EnumMap<>(ErrorKind.class);
        private final List<String> topErrors = new ArrayList<>();

        public Builder incrementFilesDiscovered() {
            this.filesDiscovered++;
            return this;
        }

        public Builder incrementFilesParsed() {
            this.filesAttempted++;
            this.filesParsed++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesAttempted++;
            this.filesFailed++;
            return this;
        }

        public Builder filesSkippedBinary(int count) {
            this.filesSkippedBinary = count;
            return this;
        }

        public Builder filesSkippedUnrecognized(int count) {
            this.filesSkippedUnrecognized = count;
            return this;
        }

        public Builder pathsPermissionDenied(int count) {
            this.pathsPermissionDenied = count;
            return this;
        }

        public Builder addError(ErrorKind kind, String errorDetail) {
            errorCounts.merge(kind, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesAttempted,
                filesParsed,
                filesFailed,
                filesSkippedBinary,
                filesSkippedUnrecognized,
                pathsPermissionDenied,
                errorCounts,
                topErrors
            );
        }
    }
}
