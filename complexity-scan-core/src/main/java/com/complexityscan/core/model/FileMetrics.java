package com.complexityscan.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Objects;

/**
 * Per-file analysis result.
 *
 * <p>Files that failed to parse carry no functions and zero line/class counts, but are
 * still reported so the failure is visible.
 *
 * @param source file identity and status
 * @param lineCount number of lines in the file
 * @param classCount class-like declarations (classes, structs, impl blocks, interfaces)
 * @param functions functions found in the file, in source order
 */
@JsonPropertyOrder({"source", "lines", "classes", "function_count", "total_cyclomatic_complexity",
    "avg_cyclomatic_complexity", "max_cyclomatic_complexity", "functions"})
public record FileMetrics(
    @JsonUnwrapped SourceFile source,
    @JsonProperty("lines") int lineCount,
    @JsonProperty("classes") int classCount,
    @JsonProperty("functions") List<FunctionRecord> functions
) {
    public FileMetrics {
        Objects.requireNonNull(source, "source must not be null");
        functions = functions == null ? List.of() : List.copyOf(functions);
        if (!source.status().isSuccess() && !functions.isEmpty()) {
            throw new IllegalArgumentException("Only successfully parsed files may own functions: " + source.path());
        }
    }

    /**
     * Metrics for a file that was attempted but could not be parsed.
     *
     * @param source file identity; its status must be a failure
     * @return metrics with no functions
     */
    public static FileMetrics failed(SourceFile source) {
        return new FileMetrics(source, 0, 0, List.of());
    }

    public String path() {
        return source.path();
    }

    @JsonProperty("function_count")
    public int functionCount() {
        return functions.size();
    }

    @JsonProperty("total_cyclomatic_complexity")
    public long totalCyclomaticComplexity() {
        long total = 0;
        for (FunctionRecord function : functions) {
            total += function.cyclomaticComplexity();
        }
        return total;
    }

    /**
     * Average cyclomatic complexity rounded to two decimals.
     *
     * @return average, or 0 when the file has no functions
     */
    @JsonProperty("avg_cyclomatic_complexity")
    public double averageCyclomaticComplexity() {
        if (functions.isEmpty()) {
            return 0.0;
        }
        return Math.round((double) totalCyclomaticComplexity() / functions.size() * 100.0) / 100.0;
    }

    @JsonProperty("max_cyclomatic_complexity")
    public int maxCyclomaticComplexity() {
        int max = 0;
        for (FunctionRecord function : functions) {
            max = Math.max(max, function.cyclomaticComplexity());
        }
        return max;
    }
}
