package com.complexityscan.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * Complexity metrics for one function, method or closure.
 *
 * <p>Line numbers are 1-based and inclusive. A record is owned by exactly one
 * {@link FileMetrics}; nested functions get their own record and are never folded
 * into the enclosing one.
 *
 * @param file root-relative path of the owning file
 * @param name best-effort qualified name ({@code Outer.method}, {@code <anonymous>})
 * @param startLine first line of the function
 * @param endLine last line of the function
 * @param parameterCount number of declared formal parameters
 * @param cyclomaticComplexity {@code 1 + decision points}, always at least 1
 * @param cognitiveComplexity nesting-weighted decision count
 * @param maxNestingDepth deepest decision nesting reached
 * @param lineCount {@code endLine - startLine + 1}
 */
@JsonPropertyOrder({"file", "name", "start_line", "end_line", "parameter_count",
    "cyclomatic_complexity", "cognitive_complexity", "max_nesting_depth", "line_count"})
public record FunctionRecord(
    @JsonProperty("file") String file,
    @JsonProperty("name") String name,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    @JsonProperty("parameter_count") int parameterCount,
    @JsonProperty("cyclomatic_complexity") int cyclomaticComplexity,
    @JsonProperty("cognitive_complexity") int cognitiveComplexity,
    @JsonProperty("max_nesting_depth") int maxNestingDepth,
    @JsonProperty("line_count") int lineCount
) {
    /**
     * Ranking order for the top-N list: cyclomatic complexity descending, then file
     * path, start line and name ascending so ties resolve the same way every run. Records
     * equal under this order have identical report output.
     */
    public static final Comparator<FunctionRecord> BY_COMPLEXITY_DESC =
        Comparator.comparingInt(FunctionRecord::cyclomaticComplexity).reversed()
            .thenComparing(FunctionRecord::file)
            .thenComparingInt(FunctionRecord::startLine)
            .thenComparing(FunctionRecord::name)
            .thenComparingInt(FunctionRecord::endLine)
            .thenComparingInt(FunctionRecord::cognitiveComplexity)
            .thenComparingInt(FunctionRecord::parameterCount)
            .thenComparingInt(FunctionRecord::maxNestingDepth);

    public FunctionRecord {
        Objects.requireNonNull(file, "file must not be null");
        if (name == null || name.isBlank()) {
            name = "<anonymous>";
        }
        if (cyclomaticComplexity < 1) {
            throw new IllegalArgumentException(
                "cyclomaticComplexity must be >= 1 for " + file + ":" + startLine + " but was " + cyclomaticComplexity);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " before startLine " + startLine);
        }
    }
}
