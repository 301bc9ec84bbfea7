package com.complexityscan.core.aggregate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Coarse classification of a repository's total cyclomatic complexity.
 *
 * <p>A monotonic step function with no hysteresis: a given total always maps to exactly
 * one bucket.
 */
public enum ComplexityBucket {
    SIMPLE("simple", "Small, focused codebase - minimal documentation needed"),
    MEDIUM("medium", "Medium codebase - moderate documentation effort"),
    LARGE("large", "Large codebase - substantial documentation effort"),
    COMPLEX("complex", "Complex codebase - comprehensive documentation required");

    private final String label;
    private final String description;

    ComplexityBucket(String label, String description) {
        this.label = label;
        this.description = description;
    }

    /**
     * Classifies a total.
     *
     * @param totalCyclomaticComplexity sum over all functions
     * @param thresholds bucket breakpoints
     * @return the bucket containing the total
     */
    public static ComplexityBucket of(long totalCyclomaticComplexity, BucketThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        if (totalCyclomaticComplexity < thresholds.simple()) {
            return SIMPLE;
        }
        if (totalCyclomaticComplexity < thresholds.medium()) {
            return MEDIUM;
        }
        if (totalCyclomaticComplexity < thresholds.large()) {
            return LARGE;
        }
        return COMPLEX;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String description() {
        return description;
    }
}
