package com.complexityscan.core.report;

import com.complexityscan.core.aggregate.ComplexityBucket;
import com.complexityscan.core.aggregate.Distribution;
import com.complexityscan.core.aggregate.RepositorySummary;
import com.complexityscan.core.discovery.SkippedPaths;
import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.scan.ScanResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.SortedMap;

/**
 * The canonical JSON report.
 *
 * <p>{@code repository}, {@code scan_time_ms}, {@code summary}, {@code distribution} and
 * {@code top_complex_functions} form the stable contract read by downstream consumers.
 * The remaining keys are additive; {@code files} is only present when per-file metrics
 * were requested.
 *
 * @param schemaVersion report schema version
 * @param repository scanned root
 * @param scanTimeMs scan duration
 * @param summary repository totals
 * @param distribution per-function complexity histogram
 * @param topComplexFunctions most complex functions, best first
 * @param grammars grammar versions used, by language id
 * @param skipped discovery exclusions
 * @param files per-file metrics, {@code null} when not requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"schema_version", "repository", "scan_time_ms", "summary", "distribution",
    "top_complex_functions", "grammars", "skipped", "files"})
public record ScanReport(
    @JsonProperty("schema_version") String schemaVersion,
    @JsonProperty("repository") String repository,
    @JsonProperty("scan_time_ms") long scanTimeMs,
    @JsonProperty("summary") Summary summary,
    @JsonProperty("distribution") Distribution distribution,
    @JsonProperty("top_complex_functions") List<RankedFunction> topComplexFunctions,
    @JsonProperty("grammars") SortedMap<String, String> grammars,
    @JsonProperty("skipped") Skipped skipped,
    @JsonProperty("files") List<FileMetrics> files
) {
    /**
     * Version of the report layout. Bumped on any incompatible change, and recorded with
     * the grammar versions because different grammars can yield different counts.
     */
    public static final String SCHEMA_VERSION = "1.0";

    /**
     * Builds the report of a completed scan.
     *
     * @param result scan result
     * @param includeFiles whether to emit the per-file list
     * @return report document
     */
    public static ScanReport from(ScanResult result, boolean includeFiles) {
        RepositorySummary summary = result.summary();
        return new ScanReport(
            SCHEMA_VERSION,
            result.repository(),
            summary.scanTimeMs(),
            Summary.from(summary),
            summary.distribution(),
            summary.topComplexFunctions().stream().map(RankedFunction::from).toList(),
            result.grammars(),
            Skipped.from(result.skipped()),
            includeFiles ? summary.files() : null
        );
    }

    /**
     * The {@code summary} object.
     *
     * @param totalFiles attempted files
     * @param totalFunctions functions in parsed files
     * @param languages language id to file count
     * @param totalCyclomaticComplexity sum of all function complexities
     * @param avgCyclomaticComplexity average per function
     * @param complexityBucket bucket of the total
     * @param description bucket description
     * @param parseSuccessRate parsed / attempted
     */
    @JsonPropertyOrder({"total_files", "total_functions", "languages", "total_cyclomatic_complexity",
        "avg_cyclomatic_complexity", "complexity_bucket", "description", "parse_success_rate"})
    public record Summary(
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("total_functions") int totalFunctions,
        @JsonProperty("languages") SortedMap<String, Integer> languages,
        @JsonProperty("total_cyclomatic_complexity") long totalCyclomaticComplexity,
        @JsonProperty("avg_cyclomatic_complexity") double avgCyclomaticComplexity,
        @JsonProperty("complexity_bucket") ComplexityBucket complexityBucket,
        @JsonProperty("description") String description,
        @JsonProperty("parse_success_rate") double parseSuccessRate
    ) {
        static Summary from(RepositorySummary summary) {
            return new Summary(
                summary.totalFiles(),
                summary.totalFunctions(),
                summary.languages(),
                summary.totalCyclomaticComplexity(),
                summary.avgCyclomaticComplexity(),
                summary.bucket(),
                summary.bucket().description(),
                summary.parseSuccessRate()
            );
        }
    }

    /**
     * The {@code skipped} object.
     *
     * @param binary binary or oversized files
     * @param unrecognized files with an unrecognized extension
     * @param permissionDenied unreadable paths
     * @param unrecognizedExtensions extension to count
     */
    @JsonPropertyOrder({"binary", "unrecognized", "permission_denied", "unrecognized_extensions"})
    public record Skipped(
        @JsonProperty("binary") int binary,
        @JsonProperty("unrecognized") int unrecognized,
        @JsonProperty("permission_denied") int permissionDenied,
        @JsonProperty("unrecognized_extensions") SortedMap<String, Integer> unrecognizedExtensions
    ) {
        static Skipped from(SkippedPaths skipped) {
            return new Skipped(skipped.binary(), skipped.unrecognized(), skipped.permissionDenied(),
                skipped.unrecognizedExtensions());
        }
    }
}
