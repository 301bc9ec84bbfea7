package com.complexityscan.core.metrics;

/**
 * Complexity of a single function body.
 *
 * @param cyclomatic {@code 1 + decision points}
 * @param cognitive nesting-weighted decision count
 * @param maxNestingDepth deepest nesting level opened by a decision construct
 */
public record ComplexityScore(int cyclomatic, int cognitive, int maxNestingDepth) {

    public ComplexityScore {
        if (cyclomatic < 1) {
            throw new IllegalArgumentException("cyclomatic must be >= 1 but was " + cyclomatic);
        }
        if (cognitive < 0 || maxNestingDepth < 0) {
            throw new IllegalArgumentException("cognitive and maxNestingDepth must be >= 0");
        }
    }
}
