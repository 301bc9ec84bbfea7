package com.complexityscan.core.report;

import com.complexityscan.core.model.FunctionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Entry of the {@code top_complex_functions} list.
 *
 * @param file root-relative path
 * @param name qualified function name
 * @param line start line
 * @param cyclomaticComplexity cyclomatic complexity
 * @param cognitiveComplexity cognitive complexity
 */
@JsonPropertyOrder({"file", "name", "line", "cyclomatic_complexity", "cognitive_complexity"})
public record RankedFunction(
    @JsonProperty("file") String file,
    @JsonProperty("name") String name,
    @JsonProperty("line") int line,
    @JsonProperty("cyclomatic_complexity") int cyclomaticComplexity,
    @JsonProperty("cognitive_complexity") int cognitiveComplexity
) {
    public static RankedFunction from(FunctionRecord function) {
        return new RankedFunction(function.file(), function.name(), function.startLine(),
            function.cyclomaticComplexity(), function.cognitiveComplexity());
    }
}
