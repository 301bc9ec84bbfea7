package com.complexityscan.core.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Histogram of per-function cyclomatic complexity.
 *
 * @param low functions with complexity 1 to 5
 * @param medium functions with complexity 6 to 15
 * @param high functions with complexity above 15
 */
@JsonPropertyOrder({"low", "medium", "high"})
public record Distribution(
    @JsonProperty("low") int low,
    @JsonProperty("medium") int medium,
    @JsonProperty("high") int high
) {
    public static final int LOW_MAX = 5;
    public static final int MEDIUM_MAX = 15;

    private static final Distribution EMPTY = new Distribution(0, 0, 0);

    public Distribution {
        if (low < 0 || medium < 0 || high < 0) {
            throw new IllegalArgumentException("Distribution counts must be >= 0");
        }
    }

    public static Distribution empty() {
        return EMPTY;
    }

    /**
     * Distribution holding a single function.
     *
     * @param cyclomaticComplexity the function's complexity
     * @return one-element histogram
     */
    public static Distribution of(int cyclomaticComplexity) {
        if (cyclomaticComplexity <= LOW_MAX) {
            return new Distribution(1, 0, 0);
        }
        if (cyclomaticComplexity <= MEDIUM_MAX) {
            return new Distribution(0, 1, 0);
        }
        return new Distribution(0, 0, 1);
    }

    public Distribution plus(Distribution other) {
        return new Distribution(low + other.low, medium + other.medium, high + other.high);
    }

    @JsonIgnore
    public int total() {
        return low + medium + high;
    }
}
